package dev.mars.vigil.manager;

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
import dev.mars.vigil.connection.ConnectionResolver;
import dev.mars.vigil.core.ResumeMode;
import dev.mars.vigil.core.RunStatus;
import dev.mars.vigil.core.ScanOutcome;
import dev.mars.vigil.core.ScanResult;
import dev.mars.vigil.core.ScanTask;
import dev.mars.vigil.core.ScannerRecord;
import dev.mars.vigil.core.exceptions.InvalidTransitionException;
import dev.mars.vigil.core.exceptions.ScanException;
import dev.mars.vigil.credential.CredentialSourceRegistry;
import dev.mars.vigil.gate.ResourceGate;
import dev.mars.vigil.manager.finalize.ScanFinalizer;
import dev.mars.vigil.manager.launch.PreparedReport;
import dev.mars.vigil.manager.launch.ScanLaunchController;
import dev.mars.vigil.manager.launch.ScanRequestAssembler;
import dev.mars.vigil.manager.launch.TargetCredentialAssembler;
import dev.mars.vigil.manager.poll.RetryPolicy;
import dev.mars.vigil.manager.poll.ScanReportParser;
import dev.mars.vigil.manager.poll.ScanUpdateLoop;
import dev.mars.vigil.scanner.ScannerClient;
import dev.mars.vigil.scanner.ScannerConnection;
import dev.mars.vigil.scanner.ScannerException;
import dev.mars.vigil.storage.QueuedScan;
import dev.mars.vigil.storage.ScanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Entry point for running, queueing and stopping scan jobs.
 *
 * <p>A job moves its task through REQUESTED, optionally QUEUED, RUNNING and PROCESSING
 * to DONE, or ends in STOPPED or INTERRUPTED. The methods here are blocking and are
 * meant to run on a scan handler thread, never on an event loop.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ScanJobManager {

    private static final Logger logger = LoggerFactory.getLogger(ScanJobManager.class);

    private final ScanStore store;
    private final ScannerClient client;
    private final ConnectionResolver resolver;
    private final VigilConfiguration config;
    private final ScanLaunchController launchController;
    private final ScanUpdateLoop updateLoop;
    private final ScanFinalizer finalizer;

    public ScanJobManager(ScanStore store, ScannerClient client, ConnectionResolver resolver,
                          ResourceGate gate, CredentialSourceRegistry credentials, VigilConfiguration config) {
        this.store = store;
        this.client = client;
        this.resolver = resolver;
        this.config = config;

        ScanRequestAssembler assembler = new ScanRequestAssembler(store,
                new TargetCredentialAssembler(store, credentials), config);
        this.launchController = new ScanLaunchController(store, resolver, client, assembler);
        this.updateLoop = new ScanUpdateLoop(store, resolver, client, gate, new ScanReportParser(store), config,
                () -> store.listQueuedScans().size());
        this.finalizer = new ScanFinalizer(store, gate);
    }

    /**
     * Prepares the report, launches the scan and waits until the scanner has queued or
     * started it. A job that ends before that is finalized here.
     *
     * @return the job context, active while the scan runs on the scanner
     * @throws ScanException if the job cannot be prepared or launched; a launch failure
     *                       has already been recorded on the report
     */
    public ScanJobContext runJob(String taskId, ResumeMode mode) throws ScanException {
        ScanJobContext context = launch(taskId, mode);
        ScanOutcome outcome = updateLoop.startAndWaitUntilActive(context);
        if (outcome.isTerminal()) {
            finalizer.finalizeScan(context, outcome);
        }
        return context;
    }

    /**
     * Runs a job from launch to its final status on the calling thread.
     *
     * @return the terminal outcome, or {@link ScanOutcome#STILL_ACTIVE} if the thread was
     *         interrupted while the scan was still running
     */
    public ScanOutcome runToCompletion(String taskId, ResumeMode mode) throws ScanException {
        ScanJobContext context = launch(taskId, mode);
        ScanOutcome outcome = updateLoop.startAndWaitUntilActive(context);
        while (outcome == ScanOutcome.STILL_ACTIVE) {
            if (Thread.currentThread().isInterrupted()) {
                logger.warn("Handler for scan {} interrupted, leaving it active", context.getScanId());
                return ScanOutcome.STILL_ACTIVE;
            }
            outcome = updateLoop.pollUntilTerminalOrYield(context, null);
        }
        finalizer.finalizeScan(context, outcome);
        return outcome;
    }

    private ScanJobContext launch(String taskId, ResumeMode mode) throws ScanException {
        ScanTask task = findTask(taskId);
        ensureIdle(task);

        PreparedReport prepared = launchController.prepareReport(task, mode);
        ScanJobContext context = openContext(taskId, prepared.getReportId());
        launchController.start(context, prepared.isResumed());
        return context;
    }

    /**
     * Prepares the report of a job and places it on the scan queue.
     *
     * @return the id of the report the job will write into
     */
    public String queueJob(String taskId, ResumeMode mode) throws ScanException {
        ScanTask task = findTask(taskId);
        ensureIdle(task);

        PreparedReport prepared = launchController.prepareReport(task, mode);
        ResumeMode startMode = prepared.isResumed() ? ResumeMode.RESUME_ONLY : ResumeMode.FROM_START;
        store.enqueueScan(new QueuedScan(prepared.getReportId(), taskId, startMode, Instant.now(), false));
        logger.info("Queued scan {} of task {}", prepared.getReportId(), taskId);
        return prepared.getReportId();
    }

    /**
     * Gives a queued job one turn: launches it if it has not been launched yet, then
     * polls it until it ends or should yield. Terminal outcomes are finalized.
     *
     * <p>A job whose context cannot be built, for example because its scanner record is
     * gone, or whose handler fails unexpectedly, is settled as
     * {@link RunStatus#INTERRUPTED} with both end times stamped.</p>
     *
     * @return the outcome of this turn; {@link ScanOutcome#STILL_ACTIVE} means the job
     *         goes back to the end of the queue
     */
    public ScanOutcome handleQueuedJob(QueuedScan entry, Instant yieldDeadline) throws ScanException {
        ScanJobContext context;
        try {
            context = openContext(entry.getTaskId(), entry.getReportId());
        } catch (ScanException e) {
            logger.error("Cannot handle queued scan {}: {}", entry.getReportId(), e.getMessage());
            interruptQueuedJob(entry, e.getMessage());
            return ScanOutcome.INTERRUPTED;
        }

        try {
            return runQueuedTurn(context, entry, yieldDeadline);
        } catch (RuntimeException e) {
            logger.error("Handler for queued scan {} failed", entry.getReportId(), e);
            interruptQueuedJob(entry, e.getMessage());
            return ScanOutcome.INTERRUPTED;
        }
    }

    private ScanOutcome runQueuedTurn(ScanJobContext context, QueuedScan entry, Instant yieldDeadline) {
        RunStatus status = store.getTaskRunStatus(entry.getTaskId());

        ScanOutcome outcome;
        if (status == RunStatus.REQUESTED) {
            try {
                launchController.start(context, entry.getResumeMode() == ResumeMode.RESUME_ONLY);
            } catch (ScanException e) {
                // already settled as DONE with the failure on the report
                return ScanOutcome.FATAL;
            }
            outcome = updateLoop.startAndWaitUntilActive(context);
            if (outcome == ScanOutcome.STILL_ACTIVE) {
                outcome = updateLoop.pollUntilTerminalOrYield(context, yieldDeadline);
            }
        } else {
            outcome = updateLoop.pollUntilTerminalOrYield(context, yieldDeadline);
        }

        if (outcome.isTerminal()) {
            finalizer.finalizeScan(context, outcome);
        }
        return outcome;
    }

    /**
     * Settles a queued job that cannot be handled. A pending stop ends as STOPPED, any
     * other active status as INTERRUPTED so the report can be resumed later.
     */
    private void interruptQueuedJob(QueuedScan entry, String reason) {
        String taskId = entry.getTaskId();
        String reportId = entry.getReportId();
        if (store.findTask(taskId).isEmpty() || store.findReport(reportId).isEmpty()) {
            logger.warn("Queued scan {} of task {} no longer exists, nothing to settle", reportId, taskId);
            return;
        }

        RunStatus current = store.getTaskRunStatus(taskId);
        if (current == RunStatus.STOP_REQUESTED) {
            store.setRunStatus(taskId, reportId, RunStatus.STOPPED);
        } else if (current.canTransitionTo(RunStatus.INTERRUPTED)) {
            store.addResult(reportId, ScanResult.syntheticError(
                    reason != null ? reason : ScanUpdateLoop.TASK_INTERRUPTED));
            store.setRunStatus(taskId, reportId, RunStatus.INTERRUPTED);
        }
        Instant now = Instant.now();
        store.setTaskEndTime(taskId, now);
        store.setReportScanEnd(reportId, now);
        logger.warn("Queued scan {} of task {} settled as {}", reportId, taskId, store.getTaskRunStatus(taskId));
    }

    /**
     * Builds the context for an existing report of a task, picking up the task's
     * current status.
     */
    public ScanJobContext openContext(String taskId, String reportId) throws ScanException {
        ScanTask task = findTask(taskId);
        ScannerRecord scanner = store.findScanner(task.getScannerId())
                .orElseThrow(() -> new ScanException(reportId, "Scanner " + task.getScannerId() + " not found"));
        return ScanJobContext.resume(taskId, reportId, scanner,
                new RetryPolicy(config.getConnectionRetry()), store.getTaskRunStatus(taskId));
    }

    public ScanOutcome pollUntilTerminalOrYield(ScanJobContext context, Instant yieldDeadline) {
        return updateLoop.pollUntilTerminalOrYield(context, yieldDeadline);
    }

    public RunStatus finalizeJob(ScanJobContext context, ScanOutcome outcome) {
        return finalizer.finalizeScan(context, outcome);
    }

    /**
     * Stops the active job of a task. The scanner is asked to stop and drop the scan;
     * the task ends in STOPPED even if the scanner cannot be reached.
     *
     * @throws InvalidTransitionException if the task has no job that can be stopped
     */
    public void stopJob(String taskId) throws ScanException, InvalidTransitionException {
        ScanTask task = findTask(taskId);
        RunStatus current = store.getTaskRunStatus(taskId);
        if (!current.canTransitionTo(RunStatus.STOP_REQUESTED)) {
            throw new InvalidTransitionException(taskId, current, RunStatus.STOP_REQUESTED,
                    current.getValidTransitions().toArray(new RunStatus[0]));
        }

        String reportId = task.getCurrentReportId();
        if (reportId == null) {
            throw new ScanException(taskId, "Task has no current report");
        }
        store.setRunStatus(taskId, reportId, RunStatus.STOP_REQUESTED);
        logger.info("Stop requested for scan {} of task {}", reportId, taskId);

        ScannerRecord scanner = store.findScanner(task.getScannerId())
                .orElseThrow(() -> new ScanException(reportId, "Scanner " + task.getScannerId() + " not found"));
        Optional<ScannerConnection> connection = resolver.connect(scanner);
        if (connection.isPresent()) {
            try (ScannerConnection conn = connection.get()) {
                stopRemote(conn, reportId);
            }
        } else {
            logger.warn("Could not connect to Scanner to stop scan {}", reportId);
        }

        store.removeQueuedScan(reportId);
        store.setRunStatus(taskId, reportId, RunStatus.STOPPED);
        Instant now = Instant.now();
        store.setTaskEndTime(taskId, now);
        store.setReportScanEnd(reportId, now);
        logger.info("Scan {} of task {} stopped", reportId, taskId);
    }

    private void stopRemote(ScannerConnection connection, String scanId) {
        try {
            client.stopScan(connection, scanId);
        } catch (ScannerException e) {
            logger.warn("Scanner failed to stop scan {}: {}", scanId, e.getMessage());
        }
        try {
            client.deleteScan(connection, scanId);
        } catch (ScannerException e) {
            logger.warn("Scanner failed to delete scan {}: {}", scanId, e.getMessage());
        }
    }

    private ScanTask findTask(String taskId) throws ScanException {
        return store.findTask(taskId)
                .orElseThrow(() -> new ScanException(taskId, "Task " + taskId + " not found"));
    }

    private void ensureIdle(ScanTask task) throws ScanException {
        RunStatus status = store.getTaskRunStatus(task.getId());
        if (status.isActive() || status == RunStatus.STOP_REQUESTED) {
            throw new ScanException(task.getId(), "Task already has an active scan in status " + status);
        }
    }
}
