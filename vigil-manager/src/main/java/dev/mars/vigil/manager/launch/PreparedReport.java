package dev.mars.vigil.manager.launch;

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
 * Report a scan job writes into, and whether it continues a stopped or interrupted one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class PreparedReport {

    private final String reportId;
    private final boolean resumed;

    public PreparedReport(String reportId, boolean resumed) {
        this.reportId = reportId;
        this.resumed = resumed;
    }

    public String getReportId() {
        return reportId;
    }

    public boolean isResumed() {
        return resumed;
    }

    @Override
    public String toString() {
        return "PreparedReport{reportId='" + reportId + "', resumed=" + resumed + '}';
    }
}
