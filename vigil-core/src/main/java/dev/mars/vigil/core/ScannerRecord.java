package dev.mars.vigil.core;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


import java.util.Objects;
import java.util.Optional;

/**
 * Stored description of a scanner: where it listens, the TLS material to reach it with,
 * and an optional relay that fronts it.
 *
 * <p>A host starting with {@code /} is the path of a local socket.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ScannerRecord {

    private final String id;
    private final String host;
    private final int port;
    private final String caCertificate;
    private final String clientCertificate;
    private final String clientKey;
    private final String relayHost;
    private final int relayPort;

    public ScannerRecord(String id, String host, int port, String caCertificate,
                         String clientCertificate, String clientKey) {
        this(id, host, port, caCertificate, clientCertificate, clientKey, null, 0);
    }

    public ScannerRecord(String id, String host, int port, String caCertificate,
                         String clientCertificate, String clientKey,
                         String relayHost, int relayPort) {
        this.id = Objects.requireNonNull(id, "id");
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.caCertificate = caCertificate;
        this.clientCertificate = clientCertificate;
        this.clientKey = clientKey;
        this.relayHost = relayHost;
        this.relayPort = relayPort;
    }

    public String getId() {
        return id;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public Optional<String> getCaCertificate() {
        return Optional.ofNullable(caCertificate);
    }

    public Optional<String> getClientCertificate() {
        return Optional.ofNullable(clientCertificate);
    }

    public Optional<String> getClientKey() {
        return Optional.ofNullable(clientKey);
    }

    public String getRelayHost() {
        return relayHost;
    }

    public int getRelayPort() {
        return relayPort;
    }

    public boolean hasRelay() {
        return relayHost != null && !relayHost.isEmpty();
    }

    @Override
    public String toString() {
        return "ScannerRecord{id='" + id + "', host='" + host + "', port=" + port +
                (hasRelay() ? ", relay=" + relayHost + ":" + relayPort : "") + '}';
    }
}
