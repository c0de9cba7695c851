package dev.mars.vigil.core.exceptions;

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
 * Job-scoped failure: a launch precondition that does not hold, a scanner that refused
 * the submission, or a resume reconciliation that could not be completed.
 *
 * <p>{@link #getReason()} returns the bare reason text, which is what ends up in the
 * synthetic error result of the report. {@link #getMessage()} prefixes the scan id.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ScanException extends VigilException {

    private final String scanId;

    public ScanException(String scanId, String message) {
        super(message);
        this.scanId = scanId;
    }

    public ScanException(String scanId, String message, Throwable cause) {
        super(message, cause);
        this.scanId = scanId;
    }

    public String getScanId() {
        return scanId;
    }

    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return String.format("Scan %s failed: %s", scanId, super.getMessage());
    }
}
