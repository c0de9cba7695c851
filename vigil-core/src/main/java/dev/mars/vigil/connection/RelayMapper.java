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


import java.io.IOException;
import java.util.Optional;

/**
 * Finds the relay that fronts a scanner.
 *
 * @since 1.0
 */
public interface RelayMapper {

    String PROTOCOL_OSP = "OSP";

    /**
     * @return the relay to use, or empty when none is registered for the scanner
     * @throws IOException if the lookup itself failed
     */
    Optional<RelayEndpoint> lookup(String host, int port, String caCertificate, String protocol)
            throws IOException;
}
