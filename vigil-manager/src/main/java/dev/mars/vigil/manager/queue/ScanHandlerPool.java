package dev.mars.vigil.manager.queue;

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
import dev.mars.vigil.core.ResumeMode;
import dev.mars.vigil.core.ScanOutcome;
import dev.mars.vigil.gate.AcquireStatus;
import dev.mars.vigil.gate.ResourceGate;
import dev.mars.vigil.gate.ResourceType;
import dev.mars.vigil.manager.ScanJobManager;
import dev.mars.vigil.manager.finalize.ReportProcessingService;
import dev.mars.vigil.manager.observability.ScanTelemetryMetrics;
import dev.mars.vigil.storage.QueuedScan;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Runs scan handlers on a shared Vert.x worker pool.
 *
 * <p>Every handler holds one slot of the {@link ResourceType#DB_CONNECTIONS} gate while
 * it runs. A queued handler that cannot get a slot in time gives its turn back as
 * {@link ScanOutcome#STILL_ACTIVE}, so the job is requeued.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ScanHandlerPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScanHandlerPool.class);

    static final String EXECUTOR_NAME = "vigil-scan-handler";

    private final ScanJobManager manager;
    private final ResourceGate gate;
    private final ReportProcessingService reportProcessing;
    private final long gateTimeoutSeconds;
    private final WorkerExecutor executor;
    private final ScanTelemetryMetrics metrics;

    public ScanHandlerPool(Vertx vertx, ScanJobManager manager, ResourceGate gate,
                           ReportProcessingService reportProcessing, VigilConfiguration config) {
        this.manager = manager;
        this.gate = gate;
        this.reportProcessing = reportProcessing;
        this.gateTimeoutSeconds = config.getGateAcquireTimeoutSeconds();
        // scans run for hours, so the blocked-thread checker must not flag handlers
        this.executor = vertx.createSharedWorkerExecutor(EXECUTOR_NAME, config.getHandlerPoolSize(),
                7, TimeUnit.DAYS);
        this.metrics = ScanTelemetryMetrics.getInstance();
        logger.debug("ScanHandlerPool initialized (poolSize={})", config.getHandlerPoolSize());
    }

    /**
     * Runs a job from launch to completion. Waits for a database slot as long as needed.
     */
    public Future<ScanOutcome> submit(String taskId, ResumeMode mode) {
        return executor.executeBlocking(
                () -> withDatabaseSlot(0, () -> manager.runToCompletion(taskId, mode)), false);
    }

    /**
     * Gives a queued job one turn.
     */
    public Future<ScanOutcome> submit(QueuedScan entry, Instant yieldDeadline) {
        return executor.executeBlocking(
                () -> withDatabaseSlot(gateTimeoutSeconds, () -> manager.handleQueuedJob(entry, yieldDeadline)), false);
    }

    /**
     * Imports assets of completed reports that still require processing.
     */
    public Future<Integer> processReports() {
        return executor.executeBlocking(reportProcessing::processPending, false);
    }

    private ScanOutcome withDatabaseSlot(long timeoutSeconds, Callable<ScanOutcome> handler) throws Exception {
        if (gate.acquire(ResourceType.DB_CONNECTIONS, timeoutSeconds) == AcquireStatus.TIMED_OUT) {
            metrics.recordGateTimeout(ResourceType.DB_CONNECTIONS);
            logger.debug("No database slot free, handing the turn back");
            return ScanOutcome.STILL_ACTIVE;
        }
        metrics.recordHandlerStarted();
        try {
            return handler.call();
        } finally {
            metrics.recordHandlerFinished();
            gate.release(ResourceType.DB_CONNECTIONS);
        }
    }

    @Override
    public void close() {
        executor.close();
    }
}
