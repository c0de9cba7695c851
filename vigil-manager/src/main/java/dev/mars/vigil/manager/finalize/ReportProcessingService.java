package dev.mars.vigil.manager.finalize;

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


import dev.mars.vigil.core.exceptions.ResourceGateException;
import dev.mars.vigil.gate.AcquireStatus;
import dev.mars.vigil.gate.ResourceGate;
import dev.mars.vigil.gate.ResourceType;
import dev.mars.vigil.manager.observability.ScanTelemetryMetrics;
import dev.mars.vigil.storage.ScanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Imports host assets of completed reports flagged as requiring processing.
 * Each report is imported under one slot of the {@link ResourceType#REPORT_PROCESSING}
 * gate.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ReportProcessingService {

    private static final Logger logger = LoggerFactory.getLogger(ReportProcessingService.class);

    private final ScanStore store;
    private final ResourceGate gate;
    private final long gateTimeoutSeconds;

    public ReportProcessingService(ScanStore store, ResourceGate gate, long gateTimeoutSeconds) {
        this.store = store;
        this.gate = gate;
        this.gateTimeoutSeconds = gateTimeoutSeconds;
    }

    /**
     * Processes pending reports until none are left or the gate stays busy.
     *
     * @return the number of reports processed
     */
    public int processPending() throws ResourceGateException {
        List<String> pending = store.findReportsRequiringProcessing();
        int processed = 0;
        for (String reportId : pending) {
            if (gate.acquire(ResourceType.REPORT_PROCESSING, gateTimeoutSeconds) == AcquireStatus.TIMED_OUT) {
                ScanTelemetryMetrics.getInstance().recordGateTimeout(ResourceType.REPORT_PROCESSING);
                logger.debug("Report processing gate busy, {} reports left", pending.size() - processed);
                break;
            }
            try {
                store.importReportAssets(reportId);
                processed++;
                logger.debug("Imported assets of report {}", reportId);
            } finally {
                gate.release(ResourceType.REPORT_PROCESSING);
            }
        }
        if (processed > 0) {
            logger.info("Processed {} reports", processed);
        }
        return processed;
    }
}
