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


import dev.mars.vigil.scanner.ScanProgress;

/**
 * Retry budget of one scan job and the rules for spending it.
 *
 * <p>Connection problems and a scan the scanner stopped on its own are retried while the
 * budget lasts. A scan the scanner no longer knows is never retried, and neither is a
 * well-formed answer with a progress value out of range. The budget is
 * refilled by {@link #reset()} after every cycle that completed without a connection
 * problem.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class RetryPolicy {

    public enum Decision {
        RETRY,
        FATAL,
        STOPPED_EXTERNALLY
    }

    private final int maxRetries;
    private int remaining;

    public RetryPolicy(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.remaining = maxRetries;
    }

    /**
     * Classifies a failed or malformed scan query, spending one retry if it is retried.
     */
    public synchronized Decision classifyProgressFailure(ScanProgress progress) {
        if (progress.isScanNotFound()) {
            return Decision.STOPPED_EXTERNALLY;
        }
        if (progress.getError() == null) {
            return Decision.FATAL;
        }
        return consume() ? Decision.RETRY : Decision.FATAL;
    }

    /**
     * Classifies a scan the scanner reports as stopped before it finished.
     */
    public synchronized Decision classifyUnexpectedStop() {
        return consume() ? Decision.RETRY : Decision.FATAL;
    }

    public synchronized void reset() {
        remaining = maxRetries;
    }

    public synchronized int getRemaining() {
        return remaining;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private boolean consume() {
        if (remaining > 0) {
            remaining--;
            return true;
        }
        return false;
    }
}
