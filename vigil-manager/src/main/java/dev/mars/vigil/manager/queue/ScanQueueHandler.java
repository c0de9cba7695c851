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
import dev.mars.vigil.core.ScanOutcome;
import dev.mars.vigil.core.ScanTask;
import dev.mars.vigil.storage.QueuedScan;
import dev.mars.vigil.storage.ScanStore;
import io.vertx.core.AsyncResult;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Schedules queued scan jobs onto the handler pool.
 *
 * <p>Each pass starts handlers for queued jobs in queue order until the configured
 * number of handlers is active. A handler that yields sends its job to the end of the
 * queue; a job that ends leaves the queue, and a successful one flags its report for
 * asset processing. Passes run on a Vert.x timer.</p>
 *
 * <p>Handlers live only as long as this process, so entries still marked active when
 * the handler starts belong to handlers that are gone. They are moved to the end of
 * the queue and picked up again.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ScanQueueHandler {

    private static final Logger logger = LoggerFactory.getLogger(ScanQueueHandler.class);

    private final ScanStore store;
    private final ScanHandlerPool pool;
    private final VigilConfiguration config;

    private volatile boolean processingReports;
    private long timerId = -1;

    public ScanQueueHandler(ScanStore store, ScanHandlerPool pool, VigilConfiguration config) {
        this.store = store;
        this.pool = pool;
        this.config = config;
    }

    public synchronized void start(Vertx vertx) {
        if (timerId >= 0) {
            return;
        }
        recoverStaleEntries();
        timerId = vertx.setPeriodic(config.getQueuePollIntervalMs(), id -> handleQueue());
        logger.info("Scan queue handler started (maxActiveHandlers={}, handlerActiveTime={}s)",
                config.getMaxActiveHandlers(), config.getHandlerActiveTimeSeconds());
    }

    public synchronized void stop(Vertx vertx) {
        if (timerId >= 0) {
            vertx.cancelTimer(timerId);
            timerId = -1;
            logger.info("Scan queue handler stopped");
        }
    }

    /**
     * Releases queue entries claimed by handlers that no longer run.
     *
     * @return the number of entries moved to the end of the queue
     */
    public int recoverStaleEntries() {
        int recovered = 0;
        for (QueuedScan entry : store.listQueuedScans()) {
            if (entry.isHandlerActive()) {
                store.requeueScan(entry.getReportId());
                recovered++;
                logger.warn("Queued scan {} had no live handler, moved to the end of the queue", entry.getReportId());
            }
        }
        return recovered;
    }

    /**
     * Runs one scheduling pass.
     *
     * @return the number of handlers started
     */
    public int handleQueue() {
        List<QueuedScan> entries = store.listQueuedScans();
        int active = (int) entries.stream().filter(QueuedScan::isHandlerActive).count();
        int started = 0;

        for (QueuedScan entry : entries) {
            if (active >= config.getMaxActiveHandlers()) {
                break;
            }
            if (entry.isHandlerActive()) {
                continue;
            }
            QueuedScan claimed = entry.withHandlerActive(true);
            store.updateQueuedScan(claimed);
            active++;
            started++;

            Instant yieldDeadline = Instant.now().plusSeconds(config.getHandlerActiveTimeSeconds());
            logger.debug("Starting handler for queued scan {}", entry.getReportId());
            pool.submit(claimed, yieldDeadline).onComplete(result -> completeTurn(claimed, result));
        }

        startReportProcessing();
        return started;
    }

    public int getQueueLength() {
        return store.listQueuedScans().size();
    }

    private void completeTurn(QueuedScan entry, AsyncResult<ScanOutcome> result) {
        if (result.failed()) {
            logger.error("Handler for queued scan {} failed, requeueing: {}",
                    entry.getReportId(), result.cause().getMessage());
            store.requeueScan(entry.getReportId());
            return;
        }

        ScanOutcome outcome = result.result();
        if (outcome == ScanOutcome.STILL_ACTIVE) {
            store.requeueScan(entry.getReportId());
            return;
        }

        store.removeQueuedScan(entry.getReportId());
        if (outcome == ScanOutcome.SUCCESS) {
            Optional<ScanTask> task = store.findTask(entry.getTaskId());
            boolean inAssets = task.map(ScanTask::isInAssets).orElse(true);
            store.setReportProcessingRequired(entry.getReportId(), true, inAssets);
        }
        logger.info("Queued scan {} left the queue with outcome {}", entry.getReportId(), outcome);
    }

    private void startReportProcessing() {
        if (processingReports || store.findReportsRequiringProcessing().isEmpty()) {
            return;
        }
        processingReports = true;
        pool.processReports().onComplete(result -> {
            processingReports = false;
            if (result.failed()) {
                logger.warn("Report processing failed: {}", result.cause().getMessage());
            }
        });
    }
}
