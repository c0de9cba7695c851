package dev.mars.vigil.manager;

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
import dev.mars.vigil.core.ResumeMode;
import dev.mars.vigil.core.RunStatus;
import dev.mars.vigil.core.ScanOutcome;
import dev.mars.vigil.core.exceptions.InvalidTransitionException;
import dev.mars.vigil.core.exceptions.ScanException;
import dev.mars.vigil.scanner.ScanStatus;
import dev.mars.vigil.simulator.InMemoryScannerClientSimulator;
import dev.mars.vigil.simulator.InMemoryScannerClientSimulator.Step;
import dev.mars.vigil.storage.InMemoryScanStore;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.Properties;

import static dev.mars.vigil.manager.ScanTestFixtures.TASK_ID;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Wiring tests for VigilManager with a local gate and the in-memory scanner.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@ExtendWith(VertxExtension.class)
@DisplayName("VigilManager Tests")
class VigilManagerTest {

    private static final String HOST_PAYLOAD = "{\"results\":["
            + "{\"type\":\"Alarm\",\"host\":\"10.0.0.1\",\"severity\":\"5.0\",\"value\":\"Finding\"},"
            + "{\"type\":\"Host End\",\"host\":\"10.0.0.1\",\"value\":\"1700000600\"}"
            + "]}";

    private InMemoryScanStore store;
    private InMemoryScannerClientSimulator scanner;
    private VigilManager manager;

    @BeforeEach
    void setUp() {
        store = ScanTestFixtures.populatedStore();
        scanner = new InMemoryScannerClientSimulator();
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.close();
        }
    }

    private VigilManager create(Vertx vertx, Properties properties) throws Exception {
        manager = new VigilManager(vertx, new VigilConfiguration(properties), store, scanner);
        return manager;
    }

    @Test
    @DisplayName("Without the queue a scan should run straight to its final outcome")
    void testDirectScan(Vertx vertx, VertxTestContext ctx) throws Exception {
        create(vertx, ScanTestFixtures.fastProperties()).start();

        manager.startScan(TASK_ID, ResumeMode.FROM_START)
                .onComplete(ctx.succeeding(outcome -> ctx.verify(() -> {
                    assertEquals(ScanOutcome.SUCCESS, outcome);
                    assertEquals(RunStatus.DONE, store.getTaskRunStatus(TASK_ID));
                    ctx.completeNow();
                })));
    }

    @Test
    @DisplayName("With the queue a scan should be queued, run by a handler and fed to assets")
    void testQueuedScan(Vertx vertx) throws Exception {
        Properties properties = ScanTestFixtures.fastProperties();
        properties.setProperty(VigilConfiguration.QUEUE_ENABLED, "true");
        create(vertx, properties).start();
        scanner.script(Step.of(50, ScanStatus.RUNNING), Step.of(100, ScanStatus.FINISHED, HOST_PAYLOAD));

        ScanOutcome outcome = manager.startScan(TASK_ID, ResumeMode.FROM_START)
                .toCompletionStage().toCompletableFuture().get();

        assertEquals(ScanOutcome.STILL_ACTIVE, outcome, "Queued scans are reported as active");
        await().atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(50))
                .until(() -> store.getAssetHosts().containsKey("10.0.0.1"));
        assertEquals(RunStatus.DONE, store.getTaskRunStatus(TASK_ID));
        assertEquals("5.0", store.getAssetHosts().get("10.0.0.1").get("max_severity"));
    }

    @Test
    @DisplayName("Queueing a busy task should fail the returned future")
    void testQueueBusyTask(Vertx vertx) throws Exception {
        Properties properties = ScanTestFixtures.fastProperties();
        properties.setProperty(VigilConfiguration.QUEUE_ENABLED, "true");
        create(vertx, properties);
        store.setTaskRunStatus(TASK_ID, RunStatus.RUNNING);

        assertTrue(manager.startScan(TASK_ID, ResumeMode.FROM_START).failed());
        assertTrue(manager.startScan(TASK_ID, ResumeMode.FROM_START).cause() instanceof ScanException);
    }

    @Test
    @DisplayName("Stopping an idle task should be rejected")
    void testStopIdleTask(Vertx vertx) throws Exception {
        create(vertx, ScanTestFixtures.fastProperties());

        assertThrows(InvalidTransitionException.class, () -> manager.stopScan(TASK_ID));
    }

    @Test
    @DisplayName("Invalid configuration should be rejected at construction")
    void testInvalidConfiguration(Vertx vertx) {
        Properties properties = ScanTestFixtures.fastProperties();
        properties.setProperty(VigilConfiguration.GATE_MODE, "clustered");

        assertThrows(IllegalStateException.class, () -> create(vertx, properties));
    }

    @Test
    @DisplayName("Closed manager should not start again")
    void testClose(Vertx vertx) throws Exception {
        create(vertx, ScanTestFixtures.fastProperties());

        manager.close();
        manager.close();

        assertThrows(IllegalStateException.class, () -> manager.start());
    }
}
