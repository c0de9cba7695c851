package dev.mars.vigil.gate;

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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SharedFileResourceGate using a real state directory.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class SharedFileResourceGateTest {

    @TempDir
    Path stateDir;

    private static GateCapacities capacities(int scanUpdate) {
        return GateCapacities.builder()
                .capacity(ResourceType.SCAN_UPDATE, scanUpdate)
                .capacity(ResourceType.DB_CONNECTIONS, 0)
                .capacity(ResourceType.REPORT_PROCESSING, 1)
                .build();
    }

    @Test
    @DisplayName("Create should write the manifest and one slot file per unit of capacity")
    void testCreateBuildsLayout() throws Exception {
        try (SharedFileResourceGate gate = SharedFileResourceGate.create(stateDir, capacities(3))) {
            assertTrue(Files.exists(stateDir.resolve(SharedFileResourceGate.MANIFEST_FILE)));
            for (int i = 0; i < 3; i++) {
                assertTrue(Files.exists(stateDir.resolve("scan-update").resolve("slot-" + i + ".lock")));
            }
            assertTrue(Files.exists(stateDir.resolve("db-connections").resolve("slot-0.lock")),
                    "Disabled resources keep a single slot");
            assertEquals(3, gate.getCapacity(ResourceType.SCAN_UPDATE));
        }
    }

    @Test
    @DisplayName("Attach should fail when no gate was created")
    void testAttachWithoutCreate() {
        assertThrows(ResourceGateException.class,
                () -> SharedFileResourceGate.attach(stateDir, capacities(2)));
    }

    @Test
    @DisplayName("Attach should fail when the gate was built for other capacities")
    void testAttachShapeMismatch() throws Exception {
        SharedFileResourceGate.create(stateDir, capacities(2)).close();

        assertThrows(ResourceGateException.class,
                () -> SharedFileResourceGate.attach(stateDir, capacities(5)));
    }

    @Test
    @DisplayName("Create should rebuild slots when capacities change")
    void testRecreateRebuilds() throws Exception {
        SharedFileResourceGate.create(stateDir, capacities(4)).close();
        SharedFileResourceGate.create(stateDir, capacities(2)).close();

        assertTrue(Files.exists(stateDir.resolve("scan-update").resolve("slot-1.lock")));
        assertFalse(Files.exists(stateDir.resolve("scan-update").resolve("slot-2.lock")),
                "Slots beyond the new capacity should be removed");
        SharedFileResourceGate.attach(stateDir, capacities(2)).close();
    }

    @Test
    @DisplayName("Two gate instances on one directory should share the capacity")
    void testInstancesShareCapacity() throws Exception {
        try (SharedFileResourceGate manager = SharedFileResourceGate.create(stateDir, capacities(1));
             SharedFileResourceGate worker = SharedFileResourceGate.attach(stateDir, capacities(1))) {

            assertEquals(AcquireStatus.ACQUIRED, manager.acquire(ResourceType.SCAN_UPDATE, 1));
            assertEquals(AcquireStatus.TIMED_OUT, worker.acquire(ResourceType.SCAN_UPDATE, 1),
                    "The only slot is held by the other instance");

            manager.release(ResourceType.SCAN_UPDATE);
            assertEquals(AcquireStatus.ACQUIRED, worker.acquire(ResourceType.SCAN_UPDATE, 1));
            worker.release(ResourceType.SCAN_UPDATE);
        }
    }

    @Test
    @DisplayName("Should never admit more holders than the capacity across threads")
    void testCapacityIsNeverExceeded() throws Exception {
        int capacity = 2;
        int callers = 8;
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);

        try (SharedFileResourceGate gate = SharedFileResourceGate.create(stateDir, capacities(capacity))) {
            ExecutorService executor = Executors.newFixedThreadPool(callers);
            try {
                List<Future<AcquireStatus>> futures = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        AcquireStatus status = gate.acquire(ResourceType.SCAN_UPDATE, 20);
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        Thread.sleep(30);
                        inside.decrementAndGet();
                        gate.release(ResourceType.SCAN_UPDATE);
                        return status;
                    }));
                }
                start.countDown();
                for (Future<AcquireStatus> future : futures) {
                    assertEquals(AcquireStatus.ACQUIRED, future.get(60, TimeUnit.SECONDS));
                }
            } finally {
                executor.shutdownNow();
            }
            assertEquals(0, gate.heldSlots(ResourceType.SCAN_UPDATE), "Every slot should be released");
        }
        assertTrue(maxInside.get() <= capacity, "At most " + capacity + " holders at once, saw " + maxInside.get());
    }

    @Test
    @DisplayName("Capacity 0 should make acquire and release no-ops")
    void testDisabledResource() throws Exception {
        try (SharedFileResourceGate gate = SharedFileResourceGate.create(stateDir, capacities(0))) {
            assertEquals(AcquireStatus.ACQUIRED, gate.acquire(ResourceType.SCAN_UPDATE, 1));
            assertEquals(AcquireStatus.ACQUIRED, gate.acquire(ResourceType.SCAN_UPDATE, 1));
            gate.release(ResourceType.SCAN_UPDATE);
            assertEquals(AcquireStatus.ACQUIRED, gate.acquire(ResourceType.DB_CONNECTIONS, 0));
        }
    }

    @Test
    @DisplayName("Removing the state directory should make the gate fail")
    void testDestroyedStateFails() throws Exception {
        try (SharedFileResourceGate gate = SharedFileResourceGate.create(stateDir, capacities(1))) {
            assertEquals(AcquireStatus.ACQUIRED, gate.acquire(ResourceType.REPORT_PROCESSING, 1));
            gate.release(ResourceType.REPORT_PROCESSING);

            deleteRecursively(stateDir.resolve("report-processing"));

            assertThrows(ResourceGateException.class, () -> gate.acquire(ResourceType.REPORT_PROCESSING, 1));
            assertThrows(ResourceGateException.class, () -> gate.release(ResourceType.REPORT_PROCESSING));
        }
    }

    private static void deleteRecursively(Path path) throws Exception {
        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }
}
