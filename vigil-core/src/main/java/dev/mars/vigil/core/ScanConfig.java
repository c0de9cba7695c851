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


import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A scan configuration: the vulnerability tests to run and their preferences.
 *
 * <p>VT preference keys have the form {@code oid:prefId:type:name}; the value is the
 * raw stored value, normalised for the scanner when a scan is launched.</p>
 *
 * @since 1.0
 */
public final class ScanConfig {

    private final String id;
    private final List<String> vtOids;
    private final Map<String, String> serverPreferences;
    private final Map<String, String> vtPreferences;

    public ScanConfig(String id, List<String> vtOids, Map<String, String> serverPreferences,
                      Map<String, String> vtPreferences) {
        this.id = Objects.requireNonNull(id, "id");
        this.vtOids = List.copyOf(vtOids);
        this.serverPreferences = Collections.unmodifiableMap(new LinkedHashMap<>(serverPreferences));
        this.vtPreferences = Collections.unmodifiableMap(new LinkedHashMap<>(vtPreferences));
    }

    public String getId() {
        return id;
    }

    public List<String> getVtOids() {
        return vtOids;
    }

    public Map<String, String> getServerPreferences() {
        return serverPreferences;
    }

    public Map<String, String> getVtPreferences() {
        return vtPreferences;
    }
}
