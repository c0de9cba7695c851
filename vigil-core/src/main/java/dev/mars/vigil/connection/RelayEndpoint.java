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
 * A relay found by a {@link RelayMapper}: where to connect instead, and the CA
 * certificate to trust there, if any.
 *
 * @since 1.0
 */
public final class RelayEndpoint {

    private final String host;
    private final int port;
    private final String caCertificate;

    public RelayEndpoint(String host, int port, String caCertificate) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.caCertificate = caCertificate;
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

    @Override
    public String toString() {
        return "RelayEndpoint{" + host + ":" + port + '}';
    }
}
