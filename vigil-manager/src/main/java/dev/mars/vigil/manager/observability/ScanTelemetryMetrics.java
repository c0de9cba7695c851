package dev.mars.vigil.manager.observability;

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
import dev.mars.vigil.gate.ResourceType;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for scan orchestration:
 * - vigil.scan.launched (counter) - Scans submitted to a scanner
 * - vigil.scan.finalized (counter) - Scans settled, by outcome
 * - vigil.scan.retries (counter) - Poll cycles retried after a connection problem
 * - vigil.scan.results (counter) - Result rows ingested
 * - vigil.gate.timeouts (counter) - Bounded gate waits that timed out, by resource
 * - vigil.scan.handlers.active (gauge) - Scan handlers currently running
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ScanTelemetryMetrics {

    private static final Logger logger = LoggerFactory.getLogger(ScanTelemetryMetrics.class);
    private static final String METER_NAME = "vigil-manager";

    private static ScanTelemetryMetrics instance;

    private final LongCounter scansLaunched;
    private final LongCounter scansFinalized;
    private final LongCounter pollRetries;
    private final LongCounter resultsIngested;
    private final LongCounter gateTimeouts;

    private final AtomicLong activeHandlers = new AtomicLong(0);

    private static final AttributeKey<Boolean> RESUMED_KEY = AttributeKey.booleanKey("resumed");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");
    private static final AttributeKey<String> RESOURCE_KEY = AttributeKey.stringKey("resource");

    private ScanTelemetryMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        scansLaunched = meter.counterBuilder("vigil.scan.launched")
                .setDescription("Number of scans submitted to a scanner")
                .setUnit("1")
                .build();

        scansFinalized = meter.counterBuilder("vigil.scan.finalized")
                .setDescription("Number of scans settled, by outcome")
                .setUnit("1")
                .build();

        pollRetries = meter.counterBuilder("vigil.scan.retries")
                .setDescription("Number of poll cycles retried after a connection problem")
                .setUnit("1")
                .build();

        resultsIngested = meter.counterBuilder("vigil.scan.results")
                .setDescription("Number of result rows ingested from scanners")
                .setUnit("1")
                .build();

        gateTimeouts = meter.counterBuilder("vigil.gate.timeouts")
                .setDescription("Number of resource gate waits that timed out")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("vigil.scan.handlers.active")
                .setDescription("Number of scan handlers currently running")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeHandlers.get()));

        logger.info("ScanTelemetryMetrics initialized");
    }

    public static synchronized ScanTelemetryMetrics getInstance() {
        if (instance == null) {
            instance = new ScanTelemetryMetrics();
        }
        return instance;
    }

    public void recordScanLaunched(boolean resumed) {
        scansLaunched.add(1, Attributes.of(RESUMED_KEY, resumed));
    }

    public void recordScanFinalized(ScanOutcome outcome) {
        scansFinalized.add(1, Attributes.of(OUTCOME_KEY, outcome.name()));
    }

    public void recordRetry() {
        pollRetries.add(1);
    }

    public void recordResultsIngested(int count) {
        if (count > 0) {
            resultsIngested.add(count);
        }
    }

    public void recordGateTimeout(ResourceType resource) {
        gateTimeouts.add(1, Attributes.of(RESOURCE_KEY, resource.getKey()));
    }

    public void recordHandlerStarted() {
        activeHandlers.incrementAndGet();
    }

    public void recordHandlerFinished() {
        activeHandlers.decrementAndGet();
    }

    public long getActiveHandlers() {
        return activeHandlers.get();
    }
}
