package dev.mars.vigil.scanner;

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


import java.io.IOException;

/**
 * Client for the scanner's management protocol.
 *
 * <p>Queries ({@link #getScan}, {@link #getStatus}) report failures in their return value.
 * Commands throw {@link ScannerException}. All methods may block; none is called from an
 * event loop.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface ScannerClient {

    /**
     * Opens a connection. A host starting with {@code /} is a local socket path, in which
     * case port and TLS material are ignored.
     *
     * @throws IOException if the scanner cannot be reached
     */
    ScannerConnection connect(String host, int port, String caCertificate,
                              String clientCertificate, String clientKey) throws IOException;

    void startScan(ScannerConnection connection, ScanStartRequest request) throws ScannerException;

    void stopScan(ScannerConnection connection, String scanId) throws ScannerException;

    void deleteScan(ScannerConnection connection, String scanId) throws ScannerException;

    /**
     * Queries a scan.
     *
     * @param details include the report payload
     * @param pop     hand over results only once; later queries return only newer results
     */
    ScanProgress getScan(ScannerConnection connection, String scanId, boolean details, boolean pop);

    ScanStatusReply getStatus(ScannerConnection connection, String scanId);
}
