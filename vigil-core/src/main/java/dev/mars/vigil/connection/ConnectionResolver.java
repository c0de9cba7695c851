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


import dev.mars.vigil.core.ScannerRecord;
import dev.mars.vigil.scanner.ScannerClient;
import dev.mars.vigil.scanner.ScannerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a stored scanner record into a live connection, going through a relay when one
 * is declared or when the relay mapper knows one.
 *
 * <p>Descriptors are meant to be resolved again for every connection attempt. Connection
 * failures are logged here and surface as an empty result; nothing is thrown.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ConnectionResolver {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionResolver.class);

    private final ScannerClient scannerClient;
    private final RelayMapper relayMapper;

    public ConnectionResolver(ScannerClient scannerClient) {
        this(scannerClient, null);
    }

    /**
     * @param relayMapper mapper to consult, or {@code null} when relay mapping is not configured
     */
    public ConnectionResolver(ScannerClient scannerClient, RelayMapper relayMapper) {
        this.scannerClient = Objects.requireNonNull(scannerClient, "scannerClient");
        this.relayMapper = relayMapper;
    }

    public ConnectionDescriptor resolve(ScannerRecord scanner) {
        boolean hasRelay = scanner.hasRelay();
        String host = hasRelay ? scanner.getRelayHost() : scanner.getHost();
        int port = hasRelay ? scanner.getRelayPort() : scanner.getPort();

        if (host.startsWith("/")) {
            return new ConnectionDescriptor(host, 0, null, null, null, false);
        }
        return new ConnectionDescriptor(host, port,
                scanner.getCaCertificate().orElse(null),
                scanner.getClientCertificate().orElse(null),
                scanner.getClientKey().orElse(null),
                !hasRelay);
    }

    public Optional<ScannerConnection> connect(ConnectionDescriptor descriptor) {
        ConnectionDescriptor effective = descriptor;

        if (descriptor.isUseRelayMapper() && !descriptor.isUnixSocket() && relayMapper != null) {
            Optional<RelayEndpoint> relay;
            try {
                relay = relayMapper.lookup(descriptor.getHost(), descriptor.getPort(),
                        descriptor.getCaCertificate(), RelayMapper.PROTOCOL_OSP);
            } catch (IOException e) {
                logger.warn("Relay lookup failed for Scanner at {}:{}: {}",
                        descriptor.getHost(), descriptor.getPort(), e.getMessage());
                return Optional.empty();
            }
            if (relay.isEmpty()) {
                logger.warn("No relay found for Scanner at {}:{}", descriptor.getHost(), descriptor.getPort());
                return Optional.empty();
            }
            effective = descriptor.withEndpoint(relay.get().getHost(), relay.get().getPort(),
                    relay.get().getCaCertificate());
        }

        try {
            return Optional.of(scannerClient.connect(effective.getHost(), effective.getPort(),
                    effective.getCaCertificate(), effective.getClientCertificate(), effective.getClientKey()));
        } catch (IOException e) {
            if (effective != descriptor) {
                logger.warn("Could not connect to relay at {}:{} for Scanner at {}:{}: {}",
                        effective.getHost(), effective.getPort(),
                        descriptor.getHost(), descriptor.getPort(), e.getMessage());
            } else {
                logger.warn("Could not connect to Scanner at {}:{}: {}",
                        descriptor.getHost(), descriptor.getPort(), e.getMessage());
            }
            return Optional.empty();
        }
    }

    /**
     * Resolves a fresh descriptor for {@code scanner} and connects with it.
     */
    public Optional<ScannerConnection> connect(ScannerRecord scanner) {
        return connect(resolve(scanner));
    }
}
