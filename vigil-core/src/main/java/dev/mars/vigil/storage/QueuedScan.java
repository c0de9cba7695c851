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


import dev.mars.vigil.core.ResumeMode;

import java.time.Instant;
import java.util.Objects;

/**
 * Persistent entry of the scan queue: a report waiting for, or being served by, a scan
 * handler.
 *
 * @since 1.0
 */
public final class QueuedScan {

    private final String reportId;
    private final String taskId;
    private final ResumeMode resumeMode;
    private final Instant queuedAt;
    private final boolean handlerActive;

    public QueuedScan(String reportId, String taskId, ResumeMode resumeMode, Instant queuedAt,
                      boolean handlerActive) {
        this.reportId = Objects.requireNonNull(reportId, "reportId");
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.resumeMode = Objects.requireNonNull(resumeMode, "resumeMode");
        this.queuedAt = Objects.requireNonNull(queuedAt, "queuedAt");
        this.handlerActive = handlerActive;
    }

    public String getReportId() {
        return reportId;
    }

    public String getTaskId() {
        return taskId;
    }

    public ResumeMode getResumeMode() {
        return resumeMode;
    }

    public Instant getQueuedAt() {
        return queuedAt;
    }

    public boolean isHandlerActive() {
        return handlerActive;
    }

    public QueuedScan withHandlerActive(boolean active) {
        return new QueuedScan(reportId, taskId, resumeMode, queuedAt, active);
    }

    public QueuedScan requeued(Instant at) {
        return new QueuedScan(reportId, taskId, resumeMode, at, false);
    }

    @Override
    public String toString() {
        return "QueuedScan{report=" + reportId + ", task=" + taskId + ", active=" + handlerActive + '}';
    }
}
