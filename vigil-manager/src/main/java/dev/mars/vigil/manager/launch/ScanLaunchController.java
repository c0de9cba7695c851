package dev.mars.vigil.manager.launch;

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


import dev.mars.vigil.connection.ConnectionResolver;
import dev.mars.vigil.core.ResumeMode;
import dev.mars.vigil.core.RunStatus;
import dev.mars.vigil.core.ScanReport;
import dev.mars.vigil.core.ScanResult;
import dev.mars.vigil.core.ScanTarget;
import dev.mars.vigil.core.ScanTask;
import dev.mars.vigil.core.exceptions.ScanException;
import dev.mars.vigil.manager.ScanJobContext;
import dev.mars.vigil.manager.observability.ScanTelemetryMetrics;
import dev.mars.vigil.scanner.ScanStartRequest;
import dev.mars.vigil.scanner.ScanStatusReply;
import dev.mars.vigil.scanner.ScannerClient;
import dev.mars.vigil.scanner.ScannerConnection;
import dev.mars.vigil.scanner.ScannerException;
import dev.mars.vigil.storage.ScanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;

/**
 * Prepares the report of a scan job and submits the scan to its scanner.
 *
 * <p>A resumed report is first reconciled with whatever the scanner still holds for it:
 * a scan still queued or running is stopped and deleted, a finished one is deleted, and
 * results of hosts the scan did not finish are trimmed from the report.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ScanLaunchController {

    private static final Logger logger = LoggerFactory.getLogger(ScanLaunchController.class);

    public static final String CONNECT_FAILED = "Could not connect to Scanner";
    public static final String DELETE_OLD_FAILED = "Failed to delete old report";
    public static final String NOTHING_TO_RESUME = "No stopped or interrupted report to resume";

    private final ScanStore store;
    private final ConnectionResolver resolver;
    private final ScannerClient client;
    private final ScanRequestAssembler assembler;
    private final ScanTelemetryMetrics metrics;

    public ScanLaunchController(ScanStore store, ConnectionResolver resolver, ScannerClient client,
                                ScanRequestAssembler assembler) {
        this.store = store;
        this.resolver = resolver;
        this.client = client;
        this.assembler = assembler;
        this.metrics = ScanTelemetryMetrics.getInstance();
    }

    /**
     * Picks the report the job writes into and moves the task to REQUESTED.
     *
     * @throws ScanException if the mode requires a resumable report and there is none
     */
    public PreparedReport prepareReport(ScanTask task, ResumeMode mode) throws ScanException {
        if (mode.allowsResume()) {
            Optional<ScanReport> last = store.findLastResumableReport(task.getId());
            if (last.isPresent()) {
                ScanReport report = last.get();
                store.setCurrentReport(task.getId(), report.getId());
                store.setRunStatus(task.getId(), report.getId(), RunStatus.REQUESTED);
                store.setTaskStartTime(task.getId(),
                        report.getScanStart() != null ? report.getScanStart() : Instant.now());
                store.setTaskEndTime(task.getId(), null);
                store.setReportScanEnd(report.getId(), null);
                logger.info("Resuming report {} of task {}", report.getId(), task.getId());
                return new PreparedReport(report.getId(), true);
            }
            if (mode == ResumeMode.RESUME_ONLY) {
                throw new ScanException(task.getId(), NOTHING_TO_RESUME);
            }
        }

        ScanReport report = store.createReport(task.getId(), RunStatus.REQUESTED);
        Instant now = Instant.now();
        store.setTaskRunStatus(task.getId(), RunStatus.REQUESTED);
        store.setTaskStartTime(task.getId(), now);
        store.setTaskEndTime(task.getId(), null);
        store.setReportScanStart(report.getId(), now);
        logger.info("Created report {} for task {}", report.getId(), task.getId());
        return new PreparedReport(report.getId(), false);
    }

    /**
     * Launches the scan, recording any failure on the report.
     *
     * <p>On failure the report gets one error result with the reason, the task ends in
     * DONE with its end times stamped, and the exception is rethrown.</p>
     */
    public void start(ScanJobContext context, boolean resumed) throws ScanException {
        try {
            launch(context, resumed);
            metrics.recordScanLaunched(resumed);
        } catch (ScanException e) {
            logger.error("Failed to launch scan {} of task {}: {}", context.getScanId(), context.getTaskId(), e.getReason());
            store.addResult(context.getReportId(), ScanResult.syntheticError(e.getReason()));
            store.setRunStatus(context.getTaskId(), context.getReportId(), RunStatus.DONE);
            Instant now = Instant.now();
            store.setTaskEndTime(context.getTaskId(), now);
            store.setReportScanEnd(context.getReportId(), now);
            context.clearActive();
            throw e;
        }
    }

    /**
     * Submits the scan. A resumed report is reconciled first and its finished hosts are
     * excluded from the new run.
     */
    public void launch(ScanJobContext context, boolean resumed) throws ScanException {
        String scanId = context.getScanId();
        ScanTask task = store.findTask(context.getTaskId())
                .orElseThrow(() -> new ScanException(scanId, "Task " + context.getTaskId() + " not found"));
        ScanTarget target = store.findTarget(task.getTargetId())
                .orElseThrow(() -> new ScanException(scanId, "Target " + task.getTargetId() + " not found"));

        Set<String> finishedHosts = Collections.emptySet();
        if (resumed && reconcileForResume(context)) {
            finishedHosts = store.getFinishedHosts(context.getReportId());
        }

        ScanStartRequest request = assembler.assemble(task, target, scanId, finishedHosts);

        Optional<ScannerConnection> connection = resolver.connect(context.getScanner());
        if (connection.isEmpty()) {
            throw new ScanException(scanId, CONNECT_FAILED);
        }
        try (ScannerConnection conn = connection.get()) {
            client.startScan(conn, request);
        } catch (ScannerException e) {
            throw new ScanException(scanId, "Scanner refused to start the scan: " + e.getMessage(), e);
        }
        logger.info("Scan {} of task {} submitted to scanner {} ({} hosts finished earlier)",
                scanId, task.getId(), context.getScanner().getId(), finishedHosts.size());
    }

    /**
     * Brings the scanner's copy of a resumed scan in line with the report.
     *
     * @return true when the scan must be started again, which is always the case unless
     *         an exception is thrown
     * @throws ScanException if the scanner cannot be reached, reports an unexpected
     *                       status, or refuses to drop the old scan
     */
    public boolean reconcileForResume(ScanJobContext context) throws ScanException {
        String scanId = context.getScanId();
        Optional<ScannerConnection> connection = resolver.connect(context.getScanner());
        if (connection.isEmpty()) {
            throw new ScanException(scanId, CONNECT_FAILED);
        }

        try (ScannerConnection conn = connection.get()) {
            ScanStatusReply reply = client.getStatus(conn, scanId);
            switch (reply.getStatus()) {
                case QUEUED:
                case RUNNING:
                    logger.info("Scan {} still {} on the scanner, stopping it before resuming",
                            scanId, reply.getStatus());
                    client.stopScan(conn, scanId);
                    client.deleteScan(conn, scanId);
                    break;
                case FINISHED:
                case STOPPED:
                case INTERRUPTED:
                    client.deleteScan(conn, scanId);
                    break;
                case ERROR:
                    if (!reply.isScanNotFound()) {
                        throw new ScanException(scanId, "Could not get status of old scan: " + reply.getError());
                    }
                    logger.debug("Scan {} is unknown to the scanner", scanId);
                    break;
                default:
                    throw new ScanException(scanId, "Old scan is in unexpected status " + reply.getStatus());
            }
        } catch (ScannerException e) {
            throw new ScanException(scanId, DELETE_OLD_FAILED, e);
        }

        store.trimPartialReport(context.getReportId());
        return true;
    }
}
