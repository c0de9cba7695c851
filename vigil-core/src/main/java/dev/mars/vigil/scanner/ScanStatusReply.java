package dev.mars.vigil.scanner;

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


import java.util.Objects;

/**
 * Answer to a status query. When the query failed the status is {@link ScanStatus#ERROR}
 * and {@link #getError()} holds the reason.
 *
 * @since 1.0
 */
public final class ScanStatusReply {

    private final ScanStatus status;
    private final String error;

    private ScanStatusReply(ScanStatus status, String error) {
        this.status = Objects.requireNonNull(status, "status");
        this.error = error;
    }

    public static ScanStatusReply of(ScanStatus status) {
        return new ScanStatusReply(status, null);
    }

    public static ScanStatusReply failure(String error) {
        return new ScanStatusReply(ScanStatus.ERROR, error);
    }

    public ScanStatus getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public boolean isScanNotFound() {
        return error != null && error.contains(ScanProgress.SCAN_NOT_FOUND_MARKER);
    }

    @Override
    public String toString() {
        return error == null ? status.name() : status + " (" + error + ")";
    }
}
