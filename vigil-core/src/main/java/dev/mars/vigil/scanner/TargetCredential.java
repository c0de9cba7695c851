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


import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A credential as handed to the scanner: its wire type ({@code up}, {@code usk},
 * {@code snmp}, {@code krb5}), the service it logs in to, an optional port and the
 * authentication fields.
 *
 * @since 1.0
 */
public final class TargetCredential {

    private final String type;
    private final String service;
    private final String port;
    private final Map<String, String> authData;

    public TargetCredential(String type, String service, String port) {
        this.type = Objects.requireNonNull(type, "type");
        this.service = Objects.requireNonNull(service, "service");
        this.port = port;
        this.authData = new LinkedHashMap<>();
    }

    public TargetCredential withAuthData(String name, String value) {
        authData.put(name, value == null ? "" : value);
        return this;
    }

    public String getType() {
        return type;
    }

    public String getService() {
        return service;
    }

    public String getPort() {
        return port;
    }

    public Map<String, String> getAuthData() {
        return Collections.unmodifiableMap(authData);
    }

    @Override
    public String toString() {
        return "TargetCredential{service='" + service + "', type='" + type + "', fields=" + authData.keySet() + '}';
    }
}
