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


import dev.mars.vigil.scanner.ScanProgress;
import dev.mars.vigil.scanner.ScanStartRequest;
import dev.mars.vigil.scanner.ScanStatus;
import dev.mars.vigil.scanner.ScanStatusReply;
import dev.mars.vigil.scanner.ScannerClient;
import dev.mars.vigil.scanner.ScannerConnection;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scanner client that only records connection attempts. Hosts listed as unreachable
 * refuse the connection.
 */
class RecordingScannerClient implements ScannerClient {

    static final class ConnectAttempt {
        final String host;
        final int port;
        final String caCertificate;
        final String clientCertificate;
        final String clientKey;

        ConnectAttempt(String host, int port, String caCertificate, String clientCertificate, String clientKey) {
            this.host = host;
            this.port = port;
            this.caCertificate = caCertificate;
            this.clientCertificate = clientCertificate;
            this.clientKey = clientKey;
        }
    }

    final List<ConnectAttempt> attempts = new CopyOnWriteArrayList<>();
    final List<String> unreachableHosts = new CopyOnWriteArrayList<>();

    @Override
    public ScannerConnection connect(String host, int port, String caCertificate,
                                     String clientCertificate, String clientKey) throws IOException {
        attempts.add(new ConnectAttempt(host, port, caCertificate, clientCertificate, clientKey));
        if (unreachableHosts.contains(host)) {
            throw new IOException("Connection refused");
        }
        return new ScannerConnection() {
            @Override
            public String getHost() {
                return host;
            }

            @Override
            public int getPort() {
                return port;
            }

            @Override
            public void close() {
            }
        };
    }

    @Override
    public void startScan(ScannerConnection connection, ScanStartRequest request) {
    }

    @Override
    public void stopScan(ScannerConnection connection, String scanId) {
    }

    @Override
    public void deleteScan(ScannerConnection connection, String scanId) {
    }

    @Override
    public ScanProgress getScan(ScannerConnection connection, String scanId, boolean details, boolean pop) {
        return ScanProgress.of(0, null);
    }

    @Override
    public ScanStatusReply getStatus(ScannerConnection connection, String scanId) {
        return ScanStatusReply.of(ScanStatus.RUNNING);
    }
}
