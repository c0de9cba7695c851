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


/**
 * Result of driving a scan job through one or more poll cycles.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum ScanOutcome {

    /** The scanner finished the scan and all results were collected. */
    SUCCESS(true),

    /** The scan is queued or running; the caller should come back later. */
    STILL_ACTIVE(false),

    /** An error the job cannot recover from. A synthetic error result was recorded. */
    FATAL(true),

    /** The scanner no longer knows the scan. */
    STOPPED_EXTERNALLY(true),

    /** The scan was cut off and may be resumed. */
    INTERRUPTED(true),

    /** The job was already stopped locally before this cycle began. */
    ALREADY_STOPPED(true);

    private final boolean terminal;

    ScanOutcome(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
