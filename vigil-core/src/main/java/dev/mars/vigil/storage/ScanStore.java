package dev.mars.vigil.storage;

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


import dev.mars.vigil.core.RunStatus;
import dev.mars.vigil.core.ScanConfig;
import dev.mars.vigil.core.ScanReport;
import dev.mars.vigil.core.ScanResult;
import dev.mars.vigil.core.ScanTarget;
import dev.mars.vigil.core.ScanTask;
import dev.mars.vigil.core.ScannerRecord;
import dev.mars.vigil.core.UserHostAccess;
import dev.mars.vigil.credential.ScanCredential;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence used by the scan manager.
 *
 * <p>Updates to unknown tasks or reports throw {@link IllegalArgumentException}.
 * Implementations must be safe for use from several scan handlers at once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface ScanStore {

    // Lookups

    Optional<ScanTask> findTask(String taskId);

    Optional<ScanTarget> findTarget(String targetId);

    Optional<ScannerRecord> findScanner(String scannerId);

    Optional<ScanConfig> findConfig(String configId);

    Optional<ScanCredential> findCredential(String credentialId);

    Optional<ScanReport> findReport(String reportId);

    Optional<UserHostAccess> findUserHostAccess(String ownerId);

    // Run status and times

    RunStatus getTaskRunStatus(String taskId);

    /**
     * Sets task and report to {@code status} in one step.
     */
    void setRunStatus(String taskId, String reportId, RunStatus status);

    void setTaskRunStatus(String taskId, RunStatus status);

    void setTaskStartTime(String taskId, Instant time);

    /**
     * @param time end time, or {@code null} to clear it
     */
    void setTaskEndTime(String taskId, Instant time);

    void setReportScanStart(String reportId, Instant time);

    /**
     * @param time end time, or {@code null} to clear it
     */
    void setReportScanEnd(String reportId, Instant time);

    // Reports

    /**
     * The most recent report of the task that was stopped or interrupted.
     */
    Optional<ScanReport> findLastResumableReport(String taskId);

    /**
     * Creates a report with a fresh id and makes it the task's current report.
     */
    ScanReport createReport(String taskId, RunStatus status);

    void setCurrentReport(String taskId, String reportId);

    void setReportProgress(String reportId, int progress);

    void addResult(String reportId, ScanResult result);

    void addHostDetail(String reportId, String host, String name, String value);

    void setHostStart(String reportId, String host, Instant time);

    void addFinishedHosts(String reportId, Collection<String> hosts);

    Set<String> getFinishedHosts(String reportId);

    /**
     * Removes results and host entries of hosts that had not finished.
     */
    void trimPartialReport(String reportId);

    // Host post-processing

    void identifyHosts(String reportId);

    void aggregateHostSeverity(String reportId);

    void enrichHostDetails(String reportId);

    void setReportProcessingRequired(String reportId, boolean required, boolean inAssets);

    /**
     * Reports marked for asset processing, oldest first.
     */
    List<String> findReportsRequiringProcessing();

    /**
     * Imports the hosts of a report into the asset database and clears its
     * processing-required mark.
     */
    void importReportAssets(String reportId);

    // Scan queue

    void enqueueScan(QueuedScan entry);

    List<QueuedScan> listQueuedScans();

    void updateQueuedScan(QueuedScan entry);

    /**
     * Moves the entry to the end of the queue and marks it idle.
     */
    void requeueScan(String reportId);

    void removeQueuedScan(String reportId);
}
