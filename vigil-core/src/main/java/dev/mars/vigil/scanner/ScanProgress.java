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


/**
 * Answer to a scan query: the progress percentage and, for detailed queries, the report
 * payload delivered since the last pop.
 *
 * <p>A failed query has progress {@code -1} and an error text. The scanner signals an
 * unknown scan id with an error containing {@value #SCAN_NOT_FOUND_MARKER}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ScanProgress {

    public static final String SCAN_NOT_FOUND_MARKER = "Failed to find scan";

    private final int progress;
    private final String payload;
    private final String error;

    private ScanProgress(int progress, String payload, String error) {
        this.progress = progress;
        this.payload = payload;
        this.error = error;
    }

    public static ScanProgress of(int progress, String payload) {
        return new ScanProgress(progress, payload, null);
    }

    public static ScanProgress failure(String error) {
        return new ScanProgress(-1, null, error == null ? "" : error);
    }

    public int getProgress() {
        return progress;
    }

    /**
     * Report payload, or {@code null} when the query asked for no details.
     */
    public String getPayload() {
        return payload;
    }

    public String getError() {
        return error;
    }

    public boolean isValid() {
        return error == null && progress >= 0 && progress <= 100;
    }

    public boolean isScanNotFound() {
        return error != null && error.contains(SCAN_NOT_FOUND_MARKER);
    }

    @Override
    public String toString() {
        return isValid() ? "ScanProgress{" + progress + "%}" : "ScanProgress{error='" + error + "'}";
    }
}
