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


import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Long-lived scan task. Points at the scanner, target and scan configuration used by
 * every run, and carries the run status of its current report.
 *
 * <p>The descriptive part is fixed at construction. Run status, start/end times and the
 * current report id are mutable and updated only through the scan store.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ScanTask {

    public static final String PREF_MAX_CHECKS = "max_checks";
    public static final String PREF_MAX_HOSTS = "max_hosts";
    public static final String PREF_IN_ASSETS = "in_assets";

    private final String id;
    private final String name;
    private final String ownerId;
    private final String scannerId;
    private final String targetId;
    private final String configId;
    private final String hostsOrdering;
    private final Map<String, String> preferences;

    private volatile RunStatus runStatus;
    private volatile Instant startTime;
    private volatile Instant endTime;
    private volatile String currentReportId;

    private ScanTask(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.name = builder.name == null ? builder.id : builder.name;
        this.ownerId = builder.ownerId;
        this.scannerId = Objects.requireNonNull(builder.scannerId, "scannerId");
        this.targetId = Objects.requireNonNull(builder.targetId, "targetId");
        this.configId = Objects.requireNonNull(builder.configId, "configId");
        this.hostsOrdering = builder.hostsOrdering;
        this.preferences = Collections.unmodifiableMap(new HashMap<>(builder.preferences));
        this.runStatus = builder.runStatus;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getScannerId() {
        return scannerId;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getConfigId() {
        return configId;
    }

    public Optional<String> getHostsOrdering() {
        return Optional.ofNullable(hostsOrdering).filter(s -> !s.isEmpty());
    }

    public Map<String, String> getPreferences() {
        return preferences;
    }

    public Optional<String> getPreference(String name) {
        return Optional.ofNullable(preferences.get(name));
    }

    /**
     * Reports of this task feed the asset database unless the task turns it off.
     */
    public boolean isInAssets() {
        return !"no".equalsIgnoreCase(preferences.getOrDefault(PREF_IN_ASSETS, "yes"));
    }

    public RunStatus getRunStatus() {
        return runStatus;
    }

    public void setRunStatus(RunStatus runStatus) {
        this.runStatus = Objects.requireNonNull(runStatus, "runStatus");
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    public String getCurrentReportId() {
        return currentReportId;
    }

    public void setCurrentReportId(String currentReportId) {
        this.currentReportId = currentReportId;
    }

    @Override
    public String toString() {
        return "ScanTask{id='" + id + "', name='" + name + "', runStatus=" + runStatus + '}';
    }

    public static class Builder {
        private String id;
        private String name;
        private String ownerId;
        private String scannerId;
        private String targetId;
        private String configId;
        private String hostsOrdering;
        private final Map<String, String> preferences = new HashMap<>();
        private RunStatus runStatus = RunStatus.DONE;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder scannerId(String scannerId) {
            this.scannerId = scannerId;
            return this;
        }

        public Builder targetId(String targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder configId(String configId) {
            this.configId = configId;
            return this;
        }

        public Builder hostsOrdering(String hostsOrdering) {
            this.hostsOrdering = hostsOrdering;
            return this;
        }

        public Builder preference(String name, String value) {
            this.preferences.put(name, value);
            return this;
        }

        public Builder runStatus(RunStatus runStatus) {
            this.runStatus = runStatus;
            return this;
        }

        public ScanTask build() {
            return new ScanTask(this);
        }
    }
}
