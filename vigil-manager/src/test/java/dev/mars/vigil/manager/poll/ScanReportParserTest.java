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


import dev.mars.vigil.core.ReportHost;
import dev.mars.vigil.core.ResultType;
import dev.mars.vigil.core.RunStatus;
import dev.mars.vigil.core.ScanReport;
import dev.mars.vigil.core.ScanResult;
import dev.mars.vigil.manager.ScanTestFixtures;
import dev.mars.vigil.storage.InMemoryScanStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ScanReportParser.
 *
 * @since 1.0
 */
class ScanReportParserTest {

    private InMemoryScanStore store;
    private ScanReportParser parser;
    private String reportId;

    @BeforeEach
    void setUp() {
        store = ScanTestFixtures.populatedStore();
        parser = new ScanReportParser(store);
        reportId = store.createReport(ScanTestFixtures.TASK_ID, RunStatus.RUNNING).getId();
    }

    @Test
    @DisplayName("Result rows should be mapped by type")
    void testResultTypes() {
        String payload = "{\"results\":["
                + "{\"type\":\"Alarm\",\"host\":\"10.0.0.1\",\"hostname\":\"web01\",\"port\":\"443/tcp\","
                + "\"test_id\":\"1.2.3\",\"severity\":\"7.5\",\"qod\":\"97\",\"value\":\"Outdated TLS\"},"
                + "{\"type\":\"Log Message\",\"host\":\"10.0.0.1\",\"port\":\"general/tcp\",\"test_id\":\"1.2.4\","
                + "\"value\":\"Service detected\"},"
                + "{\"type\":\"Error Message\",\"host\":\"10.0.0.2\",\"test_id\":\"1.2.5\",\"value\":\"Plugin timed out\"}"
                + "]}";

        assertEquals(3, parser.ingest(reportId, payload));

        List<ScanResult> results = store.findReport(reportId).orElseThrow().getResults();
        assertEquals(ResultType.ALARM, results.get(0).getType());
        assertEquals("web01", results.get(0).getHostname());
        assertEquals(7.5, results.get(0).getSeverity(), 0.001);
        assertEquals(97, results.get(0).getQod());
        assertEquals(ResultType.LOG, results.get(1).getType());
        assertEquals(ScanResult.DEFAULT_QOD, results.get(1).getQod(), "Missing QoD falls back to default");
        assertEquals(ResultType.ERROR, results.get(2).getType());
        assertEquals("Plugin timed out", results.get(2).getDescription());
    }

    @Test
    @DisplayName("Host rows should update hosts instead of adding results")
    void testHostRows() {
        String payload = "{\"results\":["
                + "{\"type\":\"Host Start\",\"host\":\"10.0.0.1\",\"value\":\"1700000000\"},"
                + "{\"type\":\"Host Detail\",\"host\":\"10.0.0.1\",\"name\":\"hostname\",\"value\":\"web01\"},"
                + "{\"type\":\"Host End\",\"host\":\"10.0.0.1\",\"value\":\"1700000600\"}"
                + "]}";

        assertEquals(0, parser.ingest(reportId, payload));

        ScanReport report = store.findReport(reportId).orElseThrow();
        ReportHost host = report.getHosts().get("10.0.0.1");
        assertNotNull(host);
        assertEquals(Instant.ofEpochSecond(1700000000L), host.getStartTime());
        assertEquals("web01", host.getDetails().get("hostname"));
        assertTrue(report.getFinishedHosts().contains("10.0.0.1"));
        assertTrue(report.getResults().isEmpty());
    }

    @Test
    @DisplayName("Numbers sent as JSON numbers should be accepted")
    void testNumericFields() {
        String payload = "{\"results\":[{\"type\":\"Alarm\",\"host\":\"10.0.0.1\",\"severity\":9.8,\"qod\":75,"
                + "\"value\":\"RCE\",\"extra\":\"ignored\"}],\"scan_info\":{}}";

        assertEquals(1, parser.ingest(reportId, payload));
        ScanResult result = store.findReport(reportId).orElseThrow().getResults().get(0);
        assertEquals(9.8, result.getSeverity(), 0.001);
        assertEquals(75, result.getQod());
    }

    @Test
    @DisplayName("Empty payloads should be ignored")
    void testEmptyPayload() {
        assertEquals(0, parser.ingest(reportId, ""));
        assertEquals(0, parser.ingest(reportId, null));
        assertTrue(store.findReport(reportId).orElseThrow().getResults().isEmpty());
    }

    @Test
    @DisplayName("Malformed payload should leave one error result on the report")
    void testMalformedPayload() {
        assertEquals(0, parser.ingest(reportId, "{\"results\":[{\"type\":"));

        List<ScanResult> results = store.findReport(reportId).orElseThrow().getResults();
        assertEquals(1, results.size(), "Lost results should be visible on the report");
        assertEquals(ResultType.ERROR, results.get(0).getType());
        assertEquals(ScanReportParser.MALFORMED_PAYLOAD, results.get(0).getDescription());
    }

    @Test
    @DisplayName("Unparseable severity and QoD should fall back to defaults")
    void testFallbacks() {
        assertEquals(0.0, ScanReportParser.parseSeverity("n/a"), 0.001);
        assertEquals(0.0, ScanReportParser.parseSeverity(null), 0.001);
        assertEquals(ScanResult.DEFAULT_QOD, ScanReportParser.parseQod("high"));
        assertEquals(30, ScanReportParser.parseQod(" 30 "));
    }
}
