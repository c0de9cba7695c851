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


import dev.mars.vigil.config.VigilConfiguration;
import dev.mars.vigil.connection.ConnectionResolver;
import dev.mars.vigil.core.RunStatus;
import dev.mars.vigil.core.ScanOutcome;
import dev.mars.vigil.core.ScanReport;
import dev.mars.vigil.core.ScanResult;
import dev.mars.vigil.gate.GateCapacities;
import dev.mars.vigil.gate.LocalResourceGate;
import dev.mars.vigil.gate.ResourceType;
import dev.mars.vigil.manager.CountingResourceGate;
import dev.mars.vigil.manager.ScanJobContext;
import dev.mars.vigil.manager.ScanTestFixtures;
import dev.mars.vigil.scanner.ScanStatus;
import dev.mars.vigil.simulator.InMemoryScannerClientSimulator;
import dev.mars.vigil.simulator.InMemoryScannerClientSimulator.ScannerFailureMode;
import dev.mars.vigil.simulator.InMemoryScannerClientSimulator.Step;
import dev.mars.vigil.storage.InMemoryScanStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static dev.mars.vigil.manager.ScanTestFixtures.TASK_ID;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ScanUpdateLoop against the in-memory scanner.
 *
 * @since 1.0
 */
class ScanUpdateLoopTest {

    private InMemoryScanStore store;
    private InMemoryScannerClientSimulator scanner;
    private CountingResourceGate gate;
    private ScanUpdateLoop loop;
    private ScanJobContext context;
    private String reportId;
    private final AtomicInteger queueLength = new AtomicInteger(0);

    @BeforeEach
    void setUp() {
        VigilConfiguration config = ScanTestFixtures.fastConfiguration();
        store = ScanTestFixtures.populatedStore();
        scanner = new InMemoryScannerClientSimulator();
        gate = new CountingResourceGate(new LocalResourceGate(GateCapacities.fromConfiguration(config)));
        loop = new ScanUpdateLoop(store, new ConnectionResolver(scanner), scanner, gate,
                new ScanReportParser(store), config, queueLength::get);

        ScanReport report = store.createReport(TASK_ID, RunStatus.REQUESTED);
        store.setTaskRunStatus(TASK_ID, RunStatus.REQUESTED);
        reportId = report.getId();
        context = new ScanJobContext(TASK_ID, reportId, ScanTestFixtures.scanner(), new RetryPolicy(3));
    }

    private List<ScanResult> errors() {
        return ScanTestFixtures.errorResults(store, reportId);
    }

    @Test
    @DisplayName("Connection errors should be retried exactly three times before giving up")
    void testRetryBudgetExhausted() {
        scanner.existingScan(reportId, Step.of(10, ScanStatus.RUNNING));
        scanner.setFailureMode(ScannerFailureMode.CONNECTION_ERROR);

        ScanOutcome outcome = loop.pollUntilTerminalOrYield(context, null);

        assertEquals(ScanOutcome.FATAL, outcome, "Exhausted budget should be fatal");
        assertEquals(4, scanner.getProgressQueryCount(), "Three retries plus the final attempt");
        assertEquals(1, errors().size(), "Exactly one synthetic error result");
        assertEquals(ScanUpdateLoop.ERRONEOUS_PROGRESS, errors().get(0).getDescription());
        assertEquals(1, scanner.getDeleteCount(), "Remote scan should be deleted");
        assertEquals(4, gate.acquired(ResourceType.SCAN_UPDATE));
        assertEquals(4, gate.released(ResourceType.SCAN_UPDATE));
    }

    @Test
    @DisplayName("Out of range progress should be fatal on the first cycle")
    void testOutOfRangeProgress() {
        scanner.existingScan(reportId, Step.of(150, ScanStatus.RUNNING));

        ScanOutcome outcome = loop.pollUntilTerminalOrYield(context, null);

        assertEquals(ScanOutcome.FATAL, outcome);
        assertEquals(1, scanner.getProgressQueryCount(), "Malformed progress should not be retried");
        assertEquals(3, context.getRetryPolicy().getRemaining(), "Budget should be untouched");
        assertEquals(1, errors().size());
        assertEquals(ScanUpdateLoop.ERRONEOUS_PROGRESS, errors().get(0).getDescription());
        assertEquals(1, scanner.getDeleteCount());
        assertEquals(1, gate.released(ResourceType.SCAN_UPDATE));
    }

    @Test
    @DisplayName("First running observation should mark the task running and release the gate once")
    void testFirstRunningObservation() throws InterruptedException {
        scanner.existingScan(reportId, Step.of(45, ScanStatus.RUNNING));

        CycleResult result = loop.runCycle(context);

        assertEquals(CycleResult.STARTED, result);
        assertEquals(ScanOutcome.STILL_ACTIVE, result.toOutcome(), "Caller should continue polling");
        assertEquals(RunStatus.RUNNING, store.getTaskRunStatus(TASK_ID));
        assertEquals(RunStatus.RUNNING, store.findReport(reportId).orElseThrow().getRunStatus());
        assertEquals(45, store.findReport(reportId).orElseThrow().getProgress());
        assertTrue(context.isStarted());
        assertTrue(errors().isEmpty(), "No error results expected");
        assertEquals(1, gate.acquired(ResourceType.SCAN_UPDATE));
        assertEquals(1, gate.released(ResourceType.SCAN_UPDATE), "Gate released exactly once");
    }

    @Test
    @DisplayName("Later running observations should not repeat the transition")
    void testRepeatedRunningObservation() throws InterruptedException {
        scanner.existingScan(reportId, Step.of(45, ScanStatus.RUNNING), Step.of(60, ScanStatus.RUNNING));

        assertEquals(CycleResult.STARTED, loop.runCycle(context));
        assertEquals(CycleResult.ACTIVE, loop.runCycle(context));
        assertEquals(60, store.findReport(reportId).orElseThrow().getProgress());
    }

    @Test
    @DisplayName("Finished scan should be deleted once and pass through running")
    void testFinishedScan() {
        scanner.existingScan(reportId, Step.of(100, ScanStatus.FINISHED));

        ScanOutcome outcome = loop.pollUntilTerminalOrYield(context, null);

        assertEquals(ScanOutcome.SUCCESS, outcome);
        assertEquals(1, scanner.getDeleteCount(), "Remote scan deleted exactly once");
        assertEquals(RunStatus.RUNNING, store.getTaskRunStatus(TASK_ID));
        assertTrue(context.isStarted());
        assertTrue(errors().isEmpty());
    }

    @Test
    @DisplayName("Interrupted scan should produce one error result and be deleted")
    void testInterruptedScan() {
        scanner.existingScan(reportId, Step.of(30, ScanStatus.INTERRUPTED));

        ScanOutcome outcome = loop.pollUntilTerminalOrYield(context, null);

        assertEquals(ScanOutcome.INTERRUPTED, outcome);
        assertEquals(1, errors().size());
        assertEquals(ScanUpdateLoop.TASK_INTERRUPTED, errors().get(0).getDescription());
        assertEquals(1, scanner.getDeleteCount());
    }

    @Test
    @DisplayName("Scan unknown to the scanner should end as stopped externally without error result")
    void testScanNotFound() {
        ScanOutcome outcome = loop.pollUntilTerminalOrYield(context, null);

        assertEquals(ScanOutcome.STOPPED_EXTERNALLY, outcome);
        assertTrue(errors().isEmpty(), "External termination is not our failure");
        assertEquals(0, scanner.getDeleteCount());
        assertEquals(1, gate.released(ResourceType.SCAN_UPDATE));
    }

    @Test
    @DisplayName("Scan stopped by the scanner should be retried then fail")
    void testUnexpectedStop() {
        scanner.existingScan(reportId, Step.of(60, ScanStatus.STOPPED));

        ScanOutcome outcome = loop.pollUntilTerminalOrYield(context, null);

        assertEquals(ScanOutcome.FATAL, outcome);
        assertEquals(4, scanner.getStatusQueryCount(), "Three retries plus the final attempt");
        assertEquals(1, errors().size());
        assertEquals(ScanUpdateLoop.STOPPED_BY_SERVER, errors().get(0).getDescription());
        assertEquals(1, scanner.getDeleteCount());
    }

    @Test
    @DisplayName("Transient connection errors should be absorbed by the retry budget")
    void testTransientErrorsRecovered() {
        scanner.existingScan(reportId, Step.of(100, ScanStatus.FINISHED));
        scanner.failNextQueries(2);

        ScanOutcome outcome = loop.pollUntilTerminalOrYield(context, null);

        assertEquals(ScanOutcome.SUCCESS, outcome);
        assertTrue(errors().isEmpty());
        assertEquals(1, context.getRetryPolicy().getRemaining(), "Two retries spent");
    }

    @Test
    @DisplayName("Stop request should win over polling without touching the gate")
    void testStopRequestWins() throws InterruptedException {
        scanner.existingScan(reportId, Step.of(45, ScanStatus.RUNNING));
        store.setRunStatus(TASK_ID, reportId, RunStatus.STOP_REQUESTED);

        assertEquals(CycleResult.ALREADY_STOPPED, loop.runCycle(context));
        assertEquals(0, gate.acquired(ResourceType.SCAN_UPDATE));
        assertEquals(0, scanner.getProgressQueryCount());
    }

    @Test
    @DisplayName("Queued status should be recorded on first observation only")
    void testQueuedScan() throws InterruptedException {
        scanner.existingScan(reportId, Step.of(0, ScanStatus.QUEUED));

        assertEquals(CycleResult.QUEUED, loop.runCycle(context));
        assertEquals(RunStatus.QUEUED, store.getTaskRunStatus(TASK_ID));
        assertTrue(context.isQueuedStatusUpdated());

        assertEquals(CycleResult.ACTIVE, loop.runCycle(context), "Later observations are absorbed");
        assertEquals(RunStatus.QUEUED, store.getTaskRunStatus(TASK_ID));
    }

    @Test
    @DisplayName("Waiting for a launched scan should return once it is queued")
    void testWaitUntilActive() {
        scanner.existingScan(reportId, Step.of(0, ScanStatus.QUEUED));

        assertEquals(ScanOutcome.STILL_ACTIVE, loop.startAndWaitUntilActive(context));
        assertEquals(RunStatus.QUEUED, store.getTaskRunStatus(TASK_ID));
    }

    @Test
    @DisplayName("Busy gate should time out without spending the retry budget")
    void testGateBusy() throws Exception {
        scanner.existingScan(reportId, Step.of(45, ScanStatus.RUNNING));
        gate.acquire(ResourceType.SCAN_UPDATE, 0);
        try {
            assertEquals(CycleResult.GATE_BUSY, loop.runCycle(context));
            assertEquals(3, context.getRetryPolicy().getRemaining());
            assertEquals(0, scanner.getProgressQueryCount());
        } finally {
            gate.release(ResourceType.SCAN_UPDATE);
        }
    }

    @Test
    @DisplayName("Gate failure on acquire should interrupt the scan")
    void testGateAcquireFailure() throws InterruptedException {
        scanner.existingScan(reportId, Step.of(45, ScanStatus.RUNNING));
        gate.setFailAcquire(true);

        assertEquals(CycleResult.INTERRUPTED, loop.runCycle(context));
        assertEquals(1, errors().size());
        assertEquals(ScanUpdateLoop.GATE_WAIT_FAILED, errors().get(0).getDescription());
        assertEquals(1, scanner.getDeleteCount());
        assertEquals(0, scanner.getProgressQueryCount());
    }

    @Test
    @DisplayName("Gate failure on release should interrupt the scan after one release attempt")
    void testGateReleaseFailure() throws InterruptedException {
        scanner.existingScan(reportId, Step.of(45, ScanStatus.RUNNING));
        gate.setFailRelease(true);

        assertEquals(CycleResult.INTERRUPTED, loop.runCycle(context));
        assertEquals(1, gate.released(ResourceType.SCAN_UPDATE));
        assertEquals(1, errors().size());
        assertEquals(ScanUpdateLoop.GATE_SIGNAL_FAILED, errors().get(0).getDescription());
        assertEquals(1, scanner.getDeleteCount());
    }

    @Test
    @DisplayName("Report payload should be ingested once")
    void testPayloadIngested() {
        String payload = "{\"results\":["
                + "{\"type\":\"Alarm\",\"host\":\"10.0.0.1\",\"port\":\"22/tcp\",\"test_id\":\"" + ScanTestFixtures.VT_SSH
                + "\",\"severity\":\"5.0\",\"qod\":\"80\",\"value\":\"Weak cipher\"},"
                + "{\"type\":\"Host Detail\",\"host\":\"10.0.0.1\",\"name\":\"OS\",\"value\":\"cpe:/o:linux:kernel\"},"
                + "{\"type\":\"Host End\",\"host\":\"10.0.0.1\",\"value\":\"1700000000\"}]}";
        scanner.existingScan(reportId, Step.of(100, ScanStatus.FINISHED, payload));

        assertEquals(ScanOutcome.SUCCESS, loop.pollUntilTerminalOrYield(context, null));

        ScanReport report = store.findReport(reportId).orElseThrow();
        assertEquals(1, report.getResults().size());
        assertEquals(5.0, report.getResults().get(0).getSeverity(), 0.001);
        assertEquals(80, report.getResults().get(0).getQod());
        assertEquals("cpe:/o:linux:kernel", report.getHosts().get("10.0.0.1").getDetails().get("OS"));
        assertTrue(report.getFinishedHosts().contains("10.0.0.1"));
    }

    @Test
    @DisplayName("Handler should yield once the deadline passed and the queue is over capacity")
    void testYieldToQueuedScans() {
        scanner.existingScan(reportId, Step.of(45, ScanStatus.RUNNING));
        queueLength.set(5);

        ScanOutcome outcome = loop.pollUntilTerminalOrYield(context, Instant.now().minusSeconds(1));

        assertEquals(ScanOutcome.STILL_ACTIVE, outcome);
        assertEquals(2, scanner.getProgressQueryCount(), "One cycle before yielding");
        assertEquals(RunStatus.RUNNING, store.getTaskRunStatus(TASK_ID));
    }
}
