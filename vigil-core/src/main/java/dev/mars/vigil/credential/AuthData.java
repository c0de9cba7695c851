package dev.mars.vigil.credential;

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
import java.util.Optional;

/**
 * Secret fields of a credential after retrieval.
 *
 * @since 1.0
 */
public final class AuthData {

    public static final String USERNAME = "username";
    public static final String PASSWORD = "password";
    public static final String PRIVATE_KEY = "private_key";
    public static final String COMMUNITY = "community";
    public static final String AUTH_ALGORITHM = "auth_algorithm";
    public static final String PRIVACY_PASSWORD = "privacy_password";
    public static final String PRIVACY_ALGORITHM = "privacy_algorithm";
    public static final String REALM = "realm";
    public static final String KDC = "kdc";

    private final Map<String, String> fields;

    private AuthData(Map<String, String> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public String getOrEmpty(String name) {
        return fields.getOrDefault(name, "");
    }

    public Map<String, String> asMap() {
        return fields;
    }

    public static class Builder {
        private final Map<String, String> fields = new LinkedHashMap<>();

        public Builder field(String name, String value) {
            if (value != null) {
                fields.put(name, value);
            }
            return this;
        }

        public AuthData build() {
            return new AuthData(new LinkedHashMap<>(fields));
        }
    }
}
