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


import dev.mars.vigil.core.RunStatus;
import dev.mars.vigil.core.ScannerRecord;
import dev.mars.vigil.manager.poll.RetryPolicy;

import java.time.Instant;
import java.util.Objects;

/**
 * State of one scan job while a handler drives it: which task and report it belongs
 * to, the scanner it runs on, whether the start and queued transitions were already
 * recorded, and the retry budget.
 *
 * <p>A context belongs to exactly one handler at a time. It is marked inactive when the
 * job is finalized.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ScanJobContext {

    private final String taskId;
    private final String reportId;
    private final ScannerRecord scanner;
    private final RetryPolicy retryPolicy;
    private final Instant createdAt;

    private volatile boolean started;
    private volatile boolean queuedStatusUpdated;
    private volatile boolean active = true;

    public ScanJobContext(String taskId, String reportId, ScannerRecord scanner, RetryPolicy retryPolicy) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.reportId = Objects.requireNonNull(reportId, "reportId");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.createdAt = Instant.now();
    }

    /**
     * Context for a job picked up again in {@code current} status. A job already running
     * has recorded both transitions; a queued one has recorded the queued transition.
     */
    public static ScanJobContext resume(String taskId, String reportId, ScannerRecord scanner,
                                        RetryPolicy retryPolicy, RunStatus current) {
        ScanJobContext context = new ScanJobContext(taskId, reportId, scanner, retryPolicy);
        context.started = current == RunStatus.RUNNING;
        context.queuedStatusUpdated = context.started || current == RunStatus.QUEUED;
        return context;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getReportId() {
        return reportId;
    }

    /**
     * The scan id known to the scanner, which is the report id.
     */
    public String getScanId() {
        return reportId;
    }

    public ScannerRecord getScanner() {
        return scanner;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isStarted() {
        return started;
    }

    public void markStarted() {
        this.started = true;
        this.queuedStatusUpdated = true;
    }

    public boolean isQueuedStatusUpdated() {
        return queuedStatusUpdated;
    }

    public void markQueuedStatusUpdated() {
        this.queuedStatusUpdated = true;
    }

    public boolean isActive() {
        return active;
    }

    public void clearActive() {
        this.active = false;
    }

    @Override
    public String toString() {
        return "ScanJobContext{task=" + taskId + ", scan=" + reportId + ", started=" + started +
                ", active=" + active + '}';
    }
}
