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


import dev.mars.vigil.core.ScanOutcome;

/**
 * Result of a single update cycle.
 */
enum CycleResult {
    FINISHED(ScanOutcome.SUCCESS),
    RETRY(ScanOutcome.STILL_ACTIVE),
    GATE_BUSY(ScanOutcome.STILL_ACTIVE),
    QUEUED(ScanOutcome.STILL_ACTIVE),
    STARTED(ScanOutcome.STILL_ACTIVE),
    ACTIVE(ScanOutcome.STILL_ACTIVE),
    FATAL(ScanOutcome.FATAL),
    STOPPED_EXTERNALLY(ScanOutcome.STOPPED_EXTERNALLY),
    INTERRUPTED(ScanOutcome.INTERRUPTED),
    ALREADY_STOPPED(ScanOutcome.ALREADY_STOPPED);

    private final ScanOutcome outcome;

    CycleResult(ScanOutcome outcome) {
        this.outcome = outcome;
    }

    ScanOutcome toOutcome() {
        return outcome;
    }

    boolean isTerminal() {
        return outcome.isTerminal();
    }
}
