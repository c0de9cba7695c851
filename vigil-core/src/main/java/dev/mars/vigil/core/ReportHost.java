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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-host data collected in a report: timing, host details reported by the scanner,
 * and the values computed during post-processing.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ReportHost {

    public static final double NO_SEVERITY = -99.0;

    private final String host;
    private final Map<String, String> details = new LinkedHashMap<>();
    private final Map<String, String> identifiers = new LinkedHashMap<>();
    private volatile Instant startTime;
    private volatile Instant endTime;
    private volatile double maxSeverity = NO_SEVERITY;
    private volatile boolean detailsEnriched;

    public ReportHost(String host) {
        this.host = host;
    }

    public String getHost() {
        return host;
    }

    public synchronized Map<String, String> getDetails() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public synchronized void putDetail(String name, String value) {
        details.put(name, value);
    }

    public synchronized Map<String, String> getIdentifiers() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(identifiers));
    }

    public synchronized void putIdentifier(String name, String value) {
        identifiers.put(name, value);
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

    public double getMaxSeverity() {
        return maxSeverity;
    }

    public void setMaxSeverity(double maxSeverity) {
        this.maxSeverity = maxSeverity;
    }

    public boolean isDetailsEnriched() {
        return detailsEnriched;
    }

    public void setDetailsEnriched(boolean detailsEnriched) {
        this.detailsEnriched = detailsEnriched;
    }
}
