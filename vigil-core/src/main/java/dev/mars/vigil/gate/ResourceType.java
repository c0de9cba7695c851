package dev.mars.vigil.gate;

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


/**
 * The named counters guarded by a {@link ResourceGate}.
 *
 * @since 1.0
 */
public enum ResourceType {

    /** Concurrent scan-status updates, one per poll cycle or post-processing pass. */
    SCAN_UPDATE("scan-update"),

    /** Concurrent database connections held by scan handlers. */
    DB_CONNECTIONS("db-connections"),

    /** Concurrent report ingestion and asset import. */
    REPORT_PROCESSING("report-processing");

    private final String key;

    ResourceType(String key) {
        this.key = key;
    }

    /**
     * Name used in configuration keys and on disk.
     */
    public String getKey() {
        return key;
    }
}
