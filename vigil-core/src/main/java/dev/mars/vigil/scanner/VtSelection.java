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
 * One vulnerability test to run, with the preference values set for it.
 *
 * @since 1.0
 */
public final class VtSelection {

    private final String oid;
    private final Map<String, String> preferences = new LinkedHashMap<>();

    public VtSelection(String oid) {
        this.oid = Objects.requireNonNull(oid, "oid");
    }

    public String getOid() {
        return oid;
    }

    public void putPreference(String id, String value) {
        preferences.put(id, value);
    }

    public Map<String, String> getPreferences() {
        return Collections.unmodifiableMap(preferences);
    }
}
