package dev.mars.vigil.connection;

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

/**
 * Immutable description of how to reach a scanner for one connection attempt.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ConnectionDescriptor {

    private final String host;
    private final int port;
    private final String caCertificate;
    private final String clientCertificate;
    private final String clientKey;
    private final boolean useRelayMapper;

    public ConnectionDescriptor(String host, int port, String caCertificate, String clientCertificate,
                                String clientKey, boolean useRelayMapper) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.caCertificate = caCertificate;
        this.clientCertificate = clientCertificate;
        this.clientKey = clientKey;
        this.useRelayMapper = useRelayMapper;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getCaCertificate() {
        return caCertificate;
    }

    public String getClientCertificate() {
        return clientCertificate;
    }

    public String getClientKey() {
        return clientKey;
    }

    public boolean isUseRelayMapper() {
        return useRelayMapper;
    }

    public boolean isUnixSocket() {
        return host.startsWith("/");
    }

    /**
     * Copy pointing at a relay endpoint. The client certificate and key are kept.
     */
    public ConnectionDescriptor withEndpoint(String newHost, int newPort, String newCaCertificate) {
        return new ConnectionDescriptor(newHost, newPort, newCaCertificate, clientCertificate, clientKey, false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConnectionDescriptor)) {
            return false;
        }
        ConnectionDescriptor that = (ConnectionDescriptor) o;
        return port == that.port && useRelayMapper == that.useRelayMapper && host.equals(that.host)
                && Objects.equals(caCertificate, that.caCertificate)
                && Objects.equals(clientCertificate, that.clientCertificate)
                && Objects.equals(clientKey, that.clientKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, caCertificate, clientCertificate, clientKey, useRelayMapper);
    }

    @Override
    public String toString() {
        return "ConnectionDescriptor{" + host + (isUnixSocket() ? "" : ":" + port) +
                ", tls=" + (caCertificate != null) + ", useRelayMapper=" + useRelayMapper + '}';
    }
}
