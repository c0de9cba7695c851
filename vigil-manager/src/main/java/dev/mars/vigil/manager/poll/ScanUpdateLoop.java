package dev.mars.vigil.manager.poll;

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
import dev.mars.vigil.core.RunStatus;
import dev.mars.vigil.core.ScanOutcome;
import dev.mars.vigil.core.ScanResult;
import dev.mars.vigil.core.exceptions.ResourceGateException;
import dev.mars.vigil.gate.AcquireStatus;
import dev.mars.vigil.gate.ResourceGate;
import dev.mars.vigil.gate.ResourceType;
import dev.mars.vigil.manager.ScanJobContext;
import dev.mars.vigil.manager.observability.ScanTelemetryMetrics;
import dev.mars.vigil.scanner.ScanProgress;
import dev.mars.vigil.scanner.ScanStatus;
import dev.mars.vigil.scanner.ScanStatusReply;
import dev.mars.vigil.scanner.ScannerClient;
import dev.mars.vigil.scanner.ScannerConnection;
import dev.mars.vigil.scanner.ScannerException;
import dev.mars.vigil.storage.ScanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.function.IntSupplier;

/**
 * Polls a launched scan and folds its progress, results and status into the report.
 *
 * <p>Each cycle runs under one slot of the {@link ResourceType#SCAN_UPDATE} gate and
 * releases it exactly once. Every scanner call opens a fresh connection, so a
 * connection dropped between cycles is simply retried on the next one.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ScanUpdateLoop {

    private static final Logger logger = LoggerFactory.getLogger(ScanUpdateLoop.class);

    public static final String ERRONEOUS_PROGRESS = "Erroneous scan progress value";
    public static final String TASK_INTERRUPTED = "Task interrupted unexpectedly";
    public static final String STOPPED_BY_SERVER = "Scan stopped unexpectedly by the server";
    public static final String GATE_WAIT_FAILED = "Error waiting for scan update semaphore";
    public static final String GATE_SIGNAL_FAILED = "Error signaling scan update semaphore";
    public static final String CONNECT_FAILED = "Could not connect to Scanner";

    private final ScanStore store;
    private final ConnectionResolver resolver;
    private final ScannerClient client;
    private final ResourceGate gate;
    private final ScanReportParser parser;
    private final IntSupplier queueLength;
    private final long gateTimeoutSeconds;
    private final long pollIntervalMs;
    private final long retryDelayMs;
    private final int maxActiveHandlers;
    private final ScanTelemetryMetrics metrics;

    public ScanUpdateLoop(ScanStore store, ConnectionResolver resolver, ScannerClient client,
                          ResourceGate gate, ScanReportParser parser, VigilConfiguration config,
                          IntSupplier queueLength) {
        this.store = store;
        this.resolver = resolver;
        this.client = client;
        this.gate = gate;
        this.parser = parser;
        this.queueLength = queueLength;
        this.gateTimeoutSeconds = config.getGateAcquireTimeoutSeconds();
        this.pollIntervalMs = config.getPollIntervalMs();
        this.retryDelayMs = config.getRetryDelayMs();
        this.maxActiveHandlers = config.getMaxActiveHandlers();
        this.metrics = ScanTelemetryMetrics.getInstance();
    }

    /**
     * Cycles until the scan is queued or running on the scanner, or ends.
     *
     * @return {@link ScanOutcome#STILL_ACTIVE} once the scan is queued or running,
     *         otherwise the terminal outcome
     */
    public ScanOutcome startAndWaitUntilActive(ScanJobContext context) {
        context.getRetryPolicy().reset();
        try {
            while (true) {
                CycleResult result = runCycle(context);
                switch (result) {
                    case GATE_BUSY:
                    case RETRY:
                        continue;
                    case QUEUED:
                    case STARTED:
                    case ACTIVE:
                        context.getRetryPolicy().reset();
                        return ScanOutcome.STILL_ACTIVE;
                    default:
                        return result.toOutcome();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Handler for scan {} interrupted while waiting for the scan to start", context.getScanId());
            return ScanOutcome.STILL_ACTIVE;
        }
    }

    /**
     * Cycles until the scan reaches a terminal outcome, or the handler should yield its
     * slot to queued work.
     *
     * <p>The handler yields when the scan has just been queued by the scanner, or when
     * {@code yieldDeadline} has passed and more jobs are queued than handlers may run.
     * A {@code null} deadline never yields on time.</p>
     */
    public ScanOutcome pollUntilTerminalOrYield(ScanJobContext context, Instant yieldDeadline) {
        context.getRetryPolicy().reset();
        try {
            while (true) {
                CycleResult result = runCycle(context);
                switch (result) {
                    case GATE_BUSY:
                    case RETRY:
                        continue;
                    case QUEUED:
                        return ScanOutcome.STILL_ACTIVE;
                    case STARTED:
                    case ACTIVE:
                        context.getRetryPolicy().reset();
                        if (shouldYield(yieldDeadline)) {
                            logger.debug("Handler for scan {} yields to queued scans", context.getScanId());
                            return ScanOutcome.STILL_ACTIVE;
                        }
                        Thread.sleep(pollIntervalMs);
                        continue;
                    default:
                        return result.toOutcome();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Handler for scan {} interrupted while polling", context.getScanId());
            return ScanOutcome.STILL_ACTIVE;
        }
    }

    private boolean shouldYield(Instant yieldDeadline) {
        return yieldDeadline != null
                && !Instant.now().isBefore(yieldDeadline)
                && queueLength.getAsInt() > maxActiveHandlers;
    }

    /**
     * Runs one update cycle under the scan update gate.
     */
    CycleResult runCycle(ScanJobContext context) throws InterruptedException {
        RunStatus current = store.getTaskRunStatus(context.getTaskId());
        if (current == RunStatus.STOPPED || current == RunStatus.STOP_REQUESTED) {
            return CycleResult.ALREADY_STOPPED;
        }

        AcquireStatus acquired;
        try {
            acquired = gate.acquire(ResourceType.SCAN_UPDATE, gateTimeoutSeconds);
        } catch (ResourceGateException e) {
            logger.error("Failed to wait for scan update gate for scan {}: {}", context.getScanId(), e.getMessage());
            recordError(context, GATE_WAIT_FAILED);
            deleteRemoteScan(context);
            return CycleResult.INTERRUPTED;
        }
        if (acquired == AcquireStatus.TIMED_OUT) {
            metrics.recordGateTimeout(ResourceType.SCAN_UPDATE);
            return CycleResult.GATE_BUSY;
        }

        CycleResult result;
        try {
            result = updateScan(context);
        } finally {
            try {
                gate.release(ResourceType.SCAN_UPDATE);
            } catch (ResourceGateException e) {
                logger.error("Failed to release scan update gate for scan {}: {}", context.getScanId(), e.getMessage());
                recordError(context, GATE_SIGNAL_FAILED);
                deleteRemoteScan(context);
                result = CycleResult.INTERRUPTED;
            }
        }

        if (result == CycleResult.RETRY) {
            metrics.recordRetry();
            Thread.sleep(retryDelayMs);
        }
        return result;
    }

    private CycleResult updateScan(ScanJobContext context) {
        ScanProgress progress = queryScan(context, false, false);
        if (!progress.isValid()) {
            return handleInvalidProgress(context, progress);
        }

        ScanProgress report = queryScan(context, true, true);
        if (!report.isValid()) {
            return handleInvalidProgress(context, report);
        }

        store.setReportProgress(context.getReportId(), report.getProgress());
        metrics.recordResultsIngested(parser.ingest(context.getReportId(), report.getPayload()));

        ScanStatus status = queryStatus(context);
        int value = report.getProgress();

        if (status == ScanStatus.QUEUED) {
            if (!context.isQueuedStatusUpdated()) {
                store.setRunStatus(context.getTaskId(), context.getReportId(), RunStatus.QUEUED);
                context.markQueuedStatusUpdated();
                return CycleResult.QUEUED;
            }
            return CycleResult.ACTIVE;
        }

        if (status == ScanStatus.INTERRUPTED) {
            logger.warn("Scan {} was interrupted on the scanner", context.getScanId());
            recordError(context, TASK_INTERRUPTED);
            deleteRemoteScan(context);
            return CycleResult.INTERRUPTED;
        }

        if (value < 100 && status == ScanStatus.STOPPED) {
            if (context.getRetryPolicy().classifyUnexpectedStop() == RetryPolicy.Decision.RETRY) {
                logger.warn("Scan {} stopped by the scanner at {}%, retrying ({} retries left)",
                        context.getScanId(), value, context.getRetryPolicy().getRemaining());
                return CycleResult.RETRY;
            }
            recordError(context, STOPPED_BY_SERVER);
            deleteRemoteScan(context);
            return CycleResult.FATAL;
        }

        if (value == 100 && status == ScanStatus.FINISHED) {
            deleteRemoteScan(context);
            if (!context.isStarted()) {
                store.setRunStatus(context.getTaskId(), context.getReportId(), RunStatus.RUNNING);
                context.markStarted();
            }
            logger.info("Scan {} finished", context.getScanId());
            return CycleResult.FINISHED;
        }

        if (status == ScanStatus.RUNNING && !context.isStarted()) {
            store.setRunStatus(context.getTaskId(), context.getReportId(), RunStatus.RUNNING);
            context.markStarted();
            logger.info("Scan {} is running", context.getScanId());
            return CycleResult.STARTED;
        }

        return CycleResult.ACTIVE;
    }

    private CycleResult handleInvalidProgress(ScanJobContext context, ScanProgress progress) {
        RetryPolicy.Decision decision = context.getRetryPolicy().classifyProgressFailure(progress);
        switch (decision) {
            case RETRY:
                logger.warn("Connection problem while polling scan {} ({}), retrying ({} retries left)",
                        context.getScanId(), describe(progress), context.getRetryPolicy().getRemaining());
                return CycleResult.RETRY;
            case STOPPED_EXTERNALLY:
                logger.warn("Scan {} is no longer known to the scanner", context.getScanId());
                return CycleResult.STOPPED_EXTERNALLY;
            default:
                logger.error("Giving up on scan {}: {}", context.getScanId(), describe(progress));
                recordError(context, ERRONEOUS_PROGRESS);
                deleteRemoteScan(context);
                return CycleResult.FATAL;
        }
    }

    private ScanProgress queryScan(ScanJobContext context, boolean details, boolean pop) {
        Optional<ScannerConnection> connection = resolver.connect(context.getScanner());
        if (connection.isEmpty()) {
            return ScanProgress.failure(CONNECT_FAILED);
        }
        try (ScannerConnection conn = connection.get()) {
            return client.getScan(conn, context.getScanId(), details, pop);
        }
    }

    private ScanStatus queryStatus(ScanJobContext context) {
        Optional<ScannerConnection> connection = resolver.connect(context.getScanner());
        if (connection.isEmpty()) {
            return ScanStatus.ERROR;
        }
        try (ScannerConnection conn = connection.get()) {
            ScanStatusReply reply = client.getStatus(conn, context.getScanId());
            return reply.getStatus();
        }
    }

    /**
     * Removes the scan from the scanner. Failures are logged; the scanner drops stale
     * scans on its own.
     */
    void deleteRemoteScan(ScanJobContext context) {
        Optional<ScannerConnection> connection = resolver.connect(context.getScanner());
        if (connection.isEmpty()) {
            logger.warn("Could not connect to Scanner to delete scan {}", context.getScanId());
            return;
        }
        try (ScannerConnection conn = connection.get()) {
            client.deleteScan(conn, context.getScanId());
        } catch (ScannerException e) {
            logger.warn("Failed to delete scan {} on the scanner: {}", context.getScanId(), e.getMessage());
        }
    }

    private void recordError(ScanJobContext context, String message) {
        store.addResult(context.getReportId(), ScanResult.syntheticError(message));
    }

    private static String describe(ScanProgress progress) {
        return progress.getError() != null ? progress.getError() : "progress " + progress.getProgress();
    }
}
