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


import dev.mars.vigil.config.VigilConfiguration;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Capacity of every {@link ResourceType}. Immutable; resources not mentioned have
 * capacity 0.
 *
 * @since 1.0
 */
public final class GateCapacities {

    private final Map<ResourceType, Integer> capacities;

    private GateCapacities(Map<ResourceType, Integer> capacities) {
        this.capacities = Collections.unmodifiableMap(capacities);
    }

    public static GateCapacities fromConfiguration(VigilConfiguration configuration) {
        return builder()
                .capacity(ResourceType.SCAN_UPDATE, configuration.getScanUpdateCapacity())
                .capacity(ResourceType.DB_CONNECTIONS, configuration.getDbConnectionsCapacity())
                .capacity(ResourceType.REPORT_PROCESSING, configuration.getReportProcessingCapacity())
                .build();
    }

    public static GateCapacities of(ResourceType resource, int capacity) {
        return builder().capacity(resource, capacity).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int get(ResourceType resource) {
        return capacities.getOrDefault(resource, 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GateCapacities)) {
            return false;
        }
        GateCapacities other = (GateCapacities) o;
        for (ResourceType type : ResourceType.values()) {
            if (get(type) != other.get(type)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (ResourceType type : ResourceType.values()) {
            hash = 31 * hash + get(type);
        }
        return hash;
    }

    @Override
    public String toString() {
        return "GateCapacities" + capacities;
    }

    public static class Builder {
        private final Map<ResourceType, Integer> capacities = new EnumMap<>(ResourceType.class);

        public Builder capacity(ResourceType resource, int capacity) {
            Objects.requireNonNull(resource, "resource");
            if (capacity < 0) {
                throw new IllegalArgumentException("Capacity of " + resource + " must not be negative: " + capacity);
            }
            capacities.put(resource, capacity);
            return this;
        }

        public GateCapacities build() {
            return new GateCapacities(new EnumMap<>(capacities));
        }
    }
}
