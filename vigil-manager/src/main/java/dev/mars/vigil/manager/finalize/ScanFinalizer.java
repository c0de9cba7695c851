package dev.mars.vigil.manager.finalize;

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
import dev.mars.vigil.core.ScanOutcome;
import dev.mars.vigil.core.exceptions.ResourceGateException;
import dev.mars.vigil.gate.ResourceGate;
import dev.mars.vigil.gate.ResourceType;
import dev.mars.vigil.manager.ScanJobContext;
import dev.mars.vigil.manager.observability.ScanTelemetryMetrics;
import dev.mars.vigil.storage.ScanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Settles a scan job once its outcome is terminal.
 *
 * <p>A successful scan goes through PROCESSING while the report is post-processed
 * (host identification, severity aggregation, host detail enrichment) and ends in
 * DONE. Failed and interrupted scans are marked STOPPED or INTERRUPTED. End times are
 * always stamped and the job is cleared as active, whatever happens in between.
 * Finalizing the same job twice leaves the status unchanged.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ScanFinalizer {

    private static final Logger logger = LoggerFactory.getLogger(ScanFinalizer.class);

    private final ScanStore store;
    private final ResourceGate gate;
    private final ScanTelemetryMetrics metrics;

    public ScanFinalizer(ScanStore store, ResourceGate gate) {
        this.store = store;
        this.gate = gate;
        this.metrics = ScanTelemetryMetrics.getInstance();
    }

    /**
     * Applies a terminal outcome to the task and its report.
     *
     * @return the run status the task ends in
     * @throws IllegalArgumentException if the outcome is not terminal
     */
    public RunStatus finalizeScan(ScanJobContext context, ScanOutcome outcome) {
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("Cannot finalize scan " + context.getScanId() +
                    " with non-terminal outcome " + outcome);
        }

        try {
            switch (outcome) {
                case SUCCESS:
                    completeSuccessfulScan(context);
                    break;
                case FATAL:
                case STOPPED_EXTERNALLY:
                    settle(context, RunStatus.STOPPED);
                    break;
                case INTERRUPTED:
                    settle(context, RunStatus.INTERRUPTED);
                    break;
                case ALREADY_STOPPED:
                    if (store.getTaskRunStatus(context.getTaskId()) == RunStatus.STOP_REQUESTED) {
                        settle(context, RunStatus.STOPPED);
                    }
                    break;
                default:
                    break;
            }
        } finally {
            Instant now = Instant.now();
            store.setTaskEndTime(context.getTaskId(), now);
            store.setReportScanEnd(context.getReportId(), now);
            if (context.isActive()) {
                metrics.recordScanFinalized(outcome);
            }
            context.clearActive();
        }

        RunStatus finalStatus = store.getTaskRunStatus(context.getTaskId());
        logger.info("Scan {} of task {} finalized with outcome {} in status {}",
                context.getScanId(), context.getTaskId(), outcome, finalStatus);
        return finalStatus;
    }

    private void completeSuccessfulScan(ScanJobContext context) {
        if (store.getTaskRunStatus(context.getTaskId()) == RunStatus.DONE) {
            logger.debug("Scan {} already completed", context.getScanId());
            return;
        }

        store.setRunStatus(context.getTaskId(), context.getReportId(), RunStatus.PROCESSING);
        String reportId = context.getReportId();
        runGated(context, "host identification", () -> store.identifyHosts(reportId));
        runGated(context, "severity aggregation", () -> store.aggregateHostSeverity(reportId));
        runGated(context, "host detail enrichment", () -> store.enrichHostDetails(reportId));
        store.setRunStatus(context.getTaskId(), reportId, RunStatus.DONE);
    }

    private void settle(ScanJobContext context, RunStatus status) {
        if (store.getTaskRunStatus(context.getTaskId()) != status) {
            store.setRunStatus(context.getTaskId(), context.getReportId(), status);
        }
    }

    /**
     * Runs a post-processing pass under the scan update gate. A gate failure is logged
     * and the pass runs anyway.
     */
    private void runGated(ScanJobContext context, String pass, Runnable work) {
        boolean held = false;
        try {
            gate.acquire(ResourceType.SCAN_UPDATE, 0);
            held = true;
        } catch (ResourceGateException e) {
            logger.warn("Scan update gate unavailable for {} of scan {}: {}", pass, context.getScanId(), e.getMessage());
        }
        try {
            work.run();
        } finally {
            if (held) {
                try {
                    gate.release(ResourceType.SCAN_UPDATE);
                } catch (ResourceGateException e) {
                    logger.warn("Failed to release scan update gate after {} of scan {}: {}",
                            pass, context.getScanId(), e.getMessage());
                }
            }
        }
    }
}
