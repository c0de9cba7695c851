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


import java.util.EnumSet;
import java.util.Set;

/**
 * Run status shared by a scan task and its current report.
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * REQUESTED → QUEUED → RUNNING → PROCESSING → DONE
 *     │          │        │           │
 *     └──────────┴────────┴───────────┴──→ STOP_REQUESTED → STOPPED
 *                                      └──→ INTERRUPTED
 * </pre>
 *
 * <p>{@code STOPPED} and {@code INTERRUPTED} reports can be resumed, which moves the task
 * back to {@code REQUESTED}. {@code DONE} is final. Task and report always carry the same
 * value; storage updates them as a pair.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum RunStatus {

    /** A report exists and the scan is about to be submitted. */
    REQUESTED("Requested"),

    /** The scanner accepted the scan but has not started it yet. */
    QUEUED("Queued"),

    /** The scanner reported the scan as running. */
    RUNNING("Running"),

    /** Scanning finished; host post-processing is underway. */
    PROCESSING("Processing"),

    /** Scan and post-processing are complete. */
    DONE("Done"),

    /** A user asked for the scan to stop; the remote scan is being torn down. */
    STOP_REQUESTED("Stop Requested"),

    /** The scan ended early, by request or because of an error. */
    STOPPED("Stopped"),

    /** The scan was cut off unexpectedly and can be resumed. */
    INTERRUPTED("Interrupted");

    private final String description;

    RunStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == DONE || this == STOPPED || this == INTERRUPTED;
    }

    public boolean isActive() {
        return this == REQUESTED || this == QUEUED || this == RUNNING || this == PROCESSING;
    }

    /**
     * Whether a report left in this status can be picked up again by a resume.
     */
    public boolean isResumable() {
        return this == STOPPED || this == INTERRUPTED;
    }

    public boolean canTransitionTo(RunStatus target) {
        return getValidTransitions().contains(target);
    }

    public Set<RunStatus> getValidTransitions() {
        switch (this) {
            case REQUESTED:
                return EnumSet.of(QUEUED, RUNNING, DONE, STOP_REQUESTED, STOPPED, INTERRUPTED);
            case QUEUED:
                return EnumSet.of(RUNNING, STOP_REQUESTED, STOPPED, INTERRUPTED);
            case RUNNING:
                return EnumSet.of(PROCESSING, STOP_REQUESTED, STOPPED, INTERRUPTED);
            case PROCESSING:
                return EnumSet.of(DONE, STOP_REQUESTED, INTERRUPTED);
            case STOP_REQUESTED:
                return EnumSet.of(STOPPED);
            case STOPPED:
            case INTERRUPTED:
                return EnumSet.of(REQUESTED);
            default:
                return EnumSet.noneOf(RunStatus.class);
        }
    }
}
