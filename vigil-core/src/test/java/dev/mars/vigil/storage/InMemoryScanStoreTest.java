package dev.mars.vigil.storage;

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
import dev.mars.vigil.core.ResumeMode;
import dev.mars.vigil.core.RunStatus;
import dev.mars.vigil.core.ScanReport;
import dev.mars.vigil.core.ScanResult;
import dev.mars.vigil.core.ScanTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryScanStore.
 *
 * @since 1.0
 */
class InMemoryScanStoreTest {

    private InMemoryScanStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryScanStore();
        store.saveTask(ScanTask.builder().id("t1").scannerId("s1").targetId("tg1").configId("c1").build());
    }

    private static ScanResult alarm(String host, double severity) {
        return ScanResult.builder().type(ResultType.ALARM).host(host).nvtOid("1.3.6.1.4.1.25623.1.0.1")
                .severity(severity).description("finding").build();
    }

    @Test
    @DisplayName("Run status should be written to task and report together")
    void testPairedRunStatus() {
        ScanReport report = store.createReport("t1", RunStatus.REQUESTED);

        store.setRunStatus("t1", report.getId(), RunStatus.RUNNING);

        assertEquals(RunStatus.RUNNING, store.getTaskRunStatus("t1"));
        assertEquals(RunStatus.RUNNING, store.findReport(report.getId()).orElseThrow().getRunStatus());
        assertEquals(report.getId(), store.findTask("t1").orElseThrow().getCurrentReportId());
    }

    @Test
    @DisplayName("Unknown task should be rejected")
    void testUnknownTask() {
        assertThrows(IllegalArgumentException.class, () -> store.createReport("nope", RunStatus.REQUESTED));
        assertThrows(IllegalArgumentException.class, () -> store.getTaskRunStatus("nope"));
    }

    @Test
    @DisplayName("Last resumable report should be the newest stopped or interrupted one")
    void testFindLastResumableReport() {
        ScanReport first = store.createReport("t1", RunStatus.INTERRUPTED);
        store.createReport("t1", RunStatus.DONE);
        assertEquals(first.getId(), store.findLastResumableReport("t1").orElseThrow().getId());

        ScanReport third = store.createReport("t1", RunStatus.STOPPED);
        assertEquals(third.getId(), store.findLastResumableReport("t1").orElseThrow().getId());
        assertTrue(store.findLastResumableReport("other").isEmpty());
    }

    @Test
    @DisplayName("Trimming should keep only finished hosts and synthetic errors")
    void testTrimPartialReport() {
        ScanReport report = store.createReport("t1", RunStatus.INTERRUPTED);
        store.addResult(report.getId(), alarm("10.0.0.1", 5.0));
        store.addResult(report.getId(), alarm("10.0.0.2", 7.5));
        store.addResult(report.getId(), ScanResult.syntheticError("Task interrupted unexpectedly"));
        store.addFinishedHosts(report.getId(), List.of("10.0.0.1"));

        store.trimPartialReport(report.getId());

        ScanReport trimmed = store.findReport(report.getId()).orElseThrow();
        assertEquals(2, trimmed.getResults().size());
        assertTrue(trimmed.getHosts().containsKey("10.0.0.1"));
        assertFalse(trimmed.getHosts().containsKey("10.0.0.2"));
    }

    @Test
    @DisplayName("Post-processing should identify hosts, aggregate severity and enrich details")
    void testPostProcessing() {
        ScanReport report = store.createReport("t1", RunStatus.RUNNING);
        store.addResult(report.getId(), alarm("10.0.0.1", 5.0));
        store.addResult(report.getId(), alarm("10.0.0.1", 9.8));
        store.addHostDetail(report.getId(), "10.0.0.1", "OS", "cpe:/o:debian:debian_linux:12");
        store.addHostDetail(report.getId(), "10.0.0.1", "hostname", "web-01");

        store.identifyHosts(report.getId());
        store.aggregateHostSeverity(report.getId());
        store.enrichHostDetails(report.getId());

        ReportHost host = store.findReport(report.getId()).orElseThrow().getHosts().get("10.0.0.1");
        assertEquals("web-01", host.getIdentifiers().get("hostname"));
        assertEquals("10.0.0.1", host.getIdentifiers().get("ip"));
        assertEquals(9.8, host.getMaxSeverity());
        assertEquals("cpe:/o:debian:debian_linux:12", host.getDetails().get("best_os_cpe"));
        assertTrue(host.isDetailsEnriched());
    }

    @Test
    @DisplayName("Asset import should honour the in-assets flag and clear the processing mark")
    void testImportReportAssets() {
        ScanReport report = store.createReport("t1", RunStatus.DONE);
        store.addResult(report.getId(), alarm("10.0.0.9", 4.0));
        store.setReportProcessingRequired(report.getId(), true, true);

        assertEquals(List.of(report.getId()), store.findReportsRequiringProcessing());
        store.importReportAssets(report.getId());

        assertTrue(store.getAssetHosts().containsKey("10.0.0.9"));
        assertTrue(store.findReportsRequiringProcessing().isEmpty());
    }

    @Test
    @DisplayName("Requeue should move the entry to the end and mark it idle")
    void testQueueOrdering() {
        Instant now = Instant.now();
        store.enqueueScan(new QueuedScan("r1", "t1", ResumeMode.FROM_START, now, false));
        store.enqueueScan(new QueuedScan("r2", "t1", ResumeMode.FROM_START, now, false));
        store.updateQueuedScan(store.listQueuedScans().get(0).withHandlerActive(true));

        store.requeueScan("r1");

        List<QueuedScan> entries = store.listQueuedScans();
        assertEquals("r2", entries.get(0).getReportId());
        assertEquals("r1", entries.get(1).getReportId());
        assertFalse(entries.get(1).isHandlerActive());

        store.removeQueuedScan("r2");
        assertEquals(1, store.listQueuedScans().size());
    }
}
