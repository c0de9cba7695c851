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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The report of one scan run. Its id doubles as the scan id handed to the scanner.
 *
 * <p>A report is created when a run is requested, filled while the scan is polled and
 * is never recreated during the job. A resumed run reuses the report it continues.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ScanReport {

    private final String id;
    private final String taskId;
    private final List<ScanResult> results = new ArrayList<>();
    private final Map<String, ReportHost> hosts = new LinkedHashMap<>();
    private final Set<String> finishedHosts = new LinkedHashSet<>();

    private volatile RunStatus runStatus;
    private volatile Instant scanStart;
    private volatile Instant scanEnd;
    private volatile int progress;
    private volatile boolean processingRequired;
    private volatile boolean inAssets;

    public ScanReport(String id, String taskId, RunStatus runStatus) {
        this.id = Objects.requireNonNull(id, "id");
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.runStatus = Objects.requireNonNull(runStatus, "runStatus");
    }

    public String getId() {
        return id;
    }

    public String getTaskId() {
        return taskId;
    }

    public RunStatus getRunStatus() {
        return runStatus;
    }

    public void setRunStatus(RunStatus runStatus) {
        this.runStatus = Objects.requireNonNull(runStatus, "runStatus");
    }

    public Instant getScanStart() {
        return scanStart;
    }

    public void setScanStart(Instant scanStart) {
        this.scanStart = scanStart;
    }

    public Instant getScanEnd() {
        return scanEnd;
    }

    public void setScanEnd(Instant scanEnd) {
        this.scanEnd = scanEnd;
    }

    public int getProgress() {
        return progress;
    }

    public void setProgress(int progress) {
        this.progress = progress;
    }

    public boolean isProcessingRequired() {
        return processingRequired;
    }

    public boolean isInAssets() {
        return inAssets;
    }

    public void setProcessingRequired(boolean processingRequired, boolean inAssets) {
        this.processingRequired = processingRequired;
        this.inAssets = inAssets;
    }

    public synchronized List<ScanResult> getResults() {
        return Collections.unmodifiableList(new ArrayList<>(results));
    }

    public synchronized void addResult(ScanResult result) {
        results.add(Objects.requireNonNull(result, "result"));
    }

    public synchronized ReportHost host(String host) {
        return hosts.computeIfAbsent(host, ReportHost::new);
    }

    public synchronized Map<String, ReportHost> getHosts() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(hosts));
    }

    public synchronized Set<String> getFinishedHosts() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(finishedHosts));
    }

    public synchronized void addFinishedHost(String host) {
        finishedHosts.add(host);
        host(host).setEndTime(Instant.now());
    }

    /**
     * Drops everything collected for hosts that had not finished, so a resumed scan
     * can rescan them without duplicating their results.
     */
    public synchronized void trimUnfinishedHosts() {
        results.removeIf(r -> !r.getHost().isEmpty() && !finishedHosts.contains(r.getHost()));
        hosts.keySet().removeIf(h -> !finishedHosts.contains(h));
        progress = 0;
    }

    @Override
    public String toString() {
        return "ScanReport{id='" + id + "', taskId='" + taskId + "', runStatus=" + runStatus +
                ", progress=" + progress + '}';
    }
}
