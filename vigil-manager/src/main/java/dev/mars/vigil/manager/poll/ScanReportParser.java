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


import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.vigil.core.ResultType;
import dev.mars.vigil.core.ScanResult;
import dev.mars.vigil.storage.ScanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a scanner report payload into stored results, host details, host start times
 * and finished hosts.
 *
 * <p>Row types: {@code Alarm}, {@code Log Message} and {@code Error Message} become
 * results; {@code Host Detail} rows are stored as details of their host;
 * {@code Host Start} and {@code Host End} carry an epoch second timestamp in
 * {@code value} and record the host start time and completion. Unknown types are
 * skipped. A payload that cannot be parsed leaves one error result on the report, since
 * the scanner does not send popped results again.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ScanReportParser {

    private static final Logger logger = LoggerFactory.getLogger(ScanReportParser.class);

    static final String TYPE_ALARM = "Alarm";
    static final String TYPE_LOG = "Log Message";
    static final String TYPE_ERROR = "Error Message";
    static final String TYPE_HOST_DETAIL = "Host Detail";
    static final String TYPE_HOST_START = "Host Start";
    static final String TYPE_HOST_END = "Host End";

    public static final String MALFORMED_PAYLOAD = "Malformed scan results received from the scanner";

    private final ScanStore store;
    private final ObjectMapper objectMapper;

    public ScanReportParser(ScanStore store) {
        this(store, new ObjectMapper());
    }

    public ScanReportParser(ScanStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    /**
     * Ingests one payload into the report.
     *
     * @return the number of result rows stored
     */
    public int ingest(String reportId, String payload) {
        if (payload == null || payload.isBlank()) {
            return 0;
        }

        ScanReportPayload report;
        try {
            report = objectMapper.readValue(payload, ScanReportPayload.class);
        } catch (JsonProcessingException e) {
            logger.warn("Malformed report payload for scan {}: {}", reportId, e.getOriginalMessage());
            store.addResult(reportId, ScanResult.syntheticError(MALFORMED_PAYLOAD));
            return 0;
        }

        int stored = 0;
        List<String> finishedHosts = new ArrayList<>();
        for (ScanReportPayload.Entry entry : report.getResults()) {
            String type = entry.getType() != null ? entry.getType() : "";
            switch (type) {
                case TYPE_ALARM:
                    store.addResult(reportId, toResult(entry, ResultType.ALARM));
                    stored++;
                    break;
                case TYPE_LOG:
                    store.addResult(reportId, toResult(entry, ResultType.LOG));
                    stored++;
                    break;
                case TYPE_ERROR:
                    store.addResult(reportId, toResult(entry, ResultType.ERROR));
                    stored++;
                    break;
                case TYPE_HOST_DETAIL:
                    if (entry.getHost() != null && entry.getName() != null) {
                        store.addHostDetail(reportId, entry.getHost(), entry.getName(),
                                entry.getValue() != null ? entry.getValue() : "");
                    }
                    break;
                case TYPE_HOST_START:
                    if (entry.getHost() != null) {
                        store.setHostStart(reportId, entry.getHost(), parseTime(entry.getValue()));
                    }
                    break;
                case TYPE_HOST_END:
                    if (entry.getHost() != null) {
                        finishedHosts.add(entry.getHost());
                    }
                    break;
                default:
                    logger.debug("Skipping result of unknown type '{}' for scan {}", type, reportId);
            }
        }

        if (!finishedHosts.isEmpty()) {
            store.addFinishedHosts(reportId, finishedHosts);
        }
        return stored;
    }

    private ScanResult toResult(ScanReportPayload.Entry entry, ResultType type) {
        return ScanResult.builder()
                .type(type)
                .host(entry.getHost())
                .hostname(entry.getHostname())
                .port(entry.getPort())
                .nvtOid(entry.getTestId())
                .severity(parseSeverity(entry.getSeverity()))
                .qod(parseQod(entry.getQod()))
                .description(entry.getValue())
                .build();
    }

    static double parseSeverity(String value) {
        if (value == null || value.isBlank()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    static int parseQod(String value) {
        if (value == null || value.isBlank()) {
            return ScanResult.DEFAULT_QOD;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return ScanResult.DEFAULT_QOD;
        }
    }

    private static Instant parseTime(String value) {
        if (value != null) {
            try {
                return Instant.ofEpochSecond(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                // not an epoch value
            }
        }
        return Instant.now();
    }
}
