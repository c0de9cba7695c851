package dev.mars.vigil.simulator;

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


import dev.mars.vigil.scanner.ScanProgress;
import dev.mars.vigil.scanner.ScanStartRequest;
import dev.mars.vigil.scanner.ScanStatus;
import dev.mars.vigil.scanner.ScanStatusReply;
import dev.mars.vigil.scanner.ScannerClient;
import dev.mars.vigil.scanner.ScannerConnection;
import dev.mars.vigil.scanner.ScannerException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory scanner for testing scan orchestration without a scanner process.
 *
 * <p>Every started scan follows a script of {@link Step}s. A progress-only query moves
 * the scan to its next step; the last step repeats. The detailed query and the status
 * query answer from the current step, and a step's payload is handed over once when
 * queried with pop.</p>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * InMemoryScannerClientSimulator scanner = new InMemoryScannerClientSimulator();
 * scanner.script(Step.of(45, ScanStatus.RUNNING), Step.of(100, ScanStatus.FINISHED));
 * scanner.setFailureMode(ScannerFailureMode.CONNECTION_ERROR);
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InMemoryScannerClientSimulator implements ScannerClient {

    public static final String NOT_FOUND_ERROR = "Failed to find scan";
    public static final String CONNECTION_ERROR = "Connection reset by peer";

    /**
     * Failure modes for chaos testing.
     */
    public enum ScannerFailureMode {
        /** Normal operation */
        NONE,
        /** Connections are refused */
        CONNECTION_REFUSED,
        /** Scan queries fail with a transport error */
        CONNECTION_ERROR,
        /** The scanner forgot every scan */
        SCAN_NOT_FOUND,
        /** Start requests are rejected */
        START_REJECTED,
        /** Stop requests are rejected */
        STOP_REJECTED,
        /** Delete requests are rejected */
        DELETE_REJECTED
    }

    /**
     * One scripted scanner state.
     */
    public static final class Step {
        final int progress;
        final ScanStatus status;
        final String payload;

        private Step(int progress, ScanStatus status, String payload) {
            this.progress = progress;
            this.status = status;
            this.payload = payload;
        }

        public static Step of(int progress, ScanStatus status) {
            return new Step(progress, status, null);
        }

        public static Step of(int progress, ScanStatus status, String payload) {
            return new Step(progress, status, payload);
        }
    }

    private static final class SimulatedScan {
        final List<Step> steps;
        int position = -1;
        boolean payloadDelivered;

        SimulatedScan(List<Step> steps) {
            this.steps = steps;
        }

        synchronized Step advance() {
            if (position < steps.size() - 1) {
                position++;
                payloadDelivered = false;
            }
            return steps.get(position);
        }

        synchronized Step current() {
            return steps.get(Math.max(position, 0));
        }
    }

    private final Map<String, SimulatedScan> scans = new ConcurrentHashMap<>();
    private volatile List<Step> defaultScript = List.of(Step.of(100, ScanStatus.FINISHED));
    private volatile ScannerFailureMode failureMode = ScannerFailureMode.NONE;
    private final AtomicInteger transientFailures = new AtomicInteger(0);

    // Statistics
    private final AtomicInteger connectCount = new AtomicInteger(0);
    private final AtomicInteger startCount = new AtomicInteger(0);
    private final AtomicInteger stopCount = new AtomicInteger(0);
    private final AtomicInteger deleteCount = new AtomicInteger(0);
    private final AtomicInteger progressQueryCount = new AtomicInteger(0);
    private final AtomicInteger statusQueryCount = new AtomicInteger(0);
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final List<ScanStartRequest> startRequests = new CopyOnWriteArrayList<>();

    // ==================== Scripting ====================

    /**
     * Sets the script followed by scans started from now on.
     */
    public InMemoryScannerClientSimulator script(Step... steps) {
        if (steps.length == 0) {
            throw new IllegalArgumentException("A script needs at least one step");
        }
        this.defaultScript = List.of(steps);
        return this;
    }

    /**
     * Places a scan on the scanner as if an earlier run had left it there.
     */
    public InMemoryScannerClientSimulator existingScan(String scanId, Step... steps) {
        scans.put(scanId, new SimulatedScan(List.of(steps)));
        return this;
    }

    public InMemoryScannerClientSimulator setFailureMode(ScannerFailureMode mode) {
        this.failureMode = mode;
        return this;
    }

    /**
     * Makes the next {@code count} scan queries fail with a transport error.
     */
    public InMemoryScannerClientSimulator failNextQueries(int count) {
        transientFailures.set(count);
        return this;
    }

    public void reset() {
        scans.clear();
        failureMode = ScannerFailureMode.NONE;
        transientFailures.set(0);
        connectCount.set(0);
        startCount.set(0);
        stopCount.set(0);
        deleteCount.set(0);
        progressQueryCount.set(0);
        statusQueryCount.set(0);
        calls.clear();
        startRequests.clear();
    }

    // ==================== ScannerClient ====================

    @Override
    public ScannerConnection connect(String host, int port, String caCertificate,
                                     String clientCertificate, String clientKey) throws IOException {
        connectCount.incrementAndGet();
        if (failureMode == ScannerFailureMode.CONNECTION_REFUSED) {
            throw new IOException("Connection refused: " + host + ":" + port);
        }
        return new SimulatedConnection(host, port);
    }

    @Override
    public void startScan(ScannerConnection connection, ScanStartRequest request) throws ScannerException {
        startCount.incrementAndGet();
        calls.add("start:" + request.getScanId());
        if (failureMode == ScannerFailureMode.START_REJECTED) {
            throw new ScannerException("Scanner rejected scan " + request.getScanId());
        }
        startRequests.add(request);
        scans.put(request.getScanId(), new SimulatedScan(new ArrayList<>(defaultScript)));
    }

    @Override
    public void stopScan(ScannerConnection connection, String scanId) throws ScannerException {
        stopCount.incrementAndGet();
        calls.add("stop:" + scanId);
        if (failureMode == ScannerFailureMode.STOP_REJECTED) {
            throw new ScannerException("Scanner refused to stop scan " + scanId);
        }
        SimulatedScan scan = scans.get(scanId);
        if (scan != null) {
            Step current = scan.current();
            scans.put(scanId, new SimulatedScan(List.of(Step.of(current.progress, ScanStatus.STOPPED))));
        }
    }

    @Override
    public void deleteScan(ScannerConnection connection, String scanId) throws ScannerException {
        deleteCount.incrementAndGet();
        calls.add("delete:" + scanId);
        if (failureMode == ScannerFailureMode.DELETE_REJECTED) {
            throw new ScannerException("Scanner refused to delete scan " + scanId);
        }
        scans.remove(scanId);
    }

    @Override
    public ScanProgress getScan(ScannerConnection connection, String scanId, boolean details, boolean pop) {
        progressQueryCount.incrementAndGet();
        if (failureMode == ScannerFailureMode.CONNECTION_ERROR || consumeTransientFailure()) {
            return ScanProgress.failure(CONNECTION_ERROR);
        }
        SimulatedScan scan = scans.get(scanId);
        if (scan == null || failureMode == ScannerFailureMode.SCAN_NOT_FOUND) {
            return ScanProgress.failure(NOT_FOUND_ERROR + " " + scanId);
        }
        if (!details) {
            return ScanProgress.of(scan.advance().progress, null);
        }
        synchronized (scan) {
            Step step = scan.current();
            String payload = null;
            if (!scan.payloadDelivered) {
                payload = step.payload;
                scan.payloadDelivered = pop;
            }
            return ScanProgress.of(step.progress, payload);
        }
    }

    @Override
    public ScanStatusReply getStatus(ScannerConnection connection, String scanId) {
        statusQueryCount.incrementAndGet();
        if (failureMode == ScannerFailureMode.CONNECTION_ERROR) {
            return ScanStatusReply.failure(CONNECTION_ERROR);
        }
        SimulatedScan scan = scans.get(scanId);
        if (scan == null || failureMode == ScannerFailureMode.SCAN_NOT_FOUND) {
            return ScanStatusReply.failure(NOT_FOUND_ERROR + " " + scanId);
        }
        return ScanStatusReply.of(scan.current().status);
    }

    private boolean consumeTransientFailure() {
        while (true) {
            int remaining = transientFailures.get();
            if (remaining <= 0) {
                return false;
            }
            if (transientFailures.compareAndSet(remaining, remaining - 1)) {
                return true;
            }
        }
    }

    // ==================== Statistics ====================

    public boolean isKnown(String scanId) {
        return scans.containsKey(scanId);
    }

    public int getConnectCount() {
        return connectCount.get();
    }

    public int getStartCount() {
        return startCount.get();
    }

    public int getStopCount() {
        return stopCount.get();
    }

    public int getDeleteCount() {
        return deleteCount.get();
    }

    public int getProgressQueryCount() {
        return progressQueryCount.get();
    }

    public int getStatusQueryCount() {
        return statusQueryCount.get();
    }

    /**
     * Start, stop and delete calls in the order they arrived, as {@code "<call>:<scanId>"}.
     */
    public List<String> getCalls() {
        return new ArrayList<>(calls);
    }

    public List<ScanStartRequest> getStartRequests() {
        return new ArrayList<>(startRequests);
    }

    public ScanStartRequest getLastStartRequest() {
        if (startRequests.isEmpty()) {
            throw new IllegalStateException("No scan was started");
        }
        return startRequests.get(startRequests.size() - 1);
    }

    private static final class SimulatedConnection implements ScannerConnection {
        private final String host;
        private final int port;

        SimulatedConnection(String host, int port) {
            this.host = host;
            this.port = port;
        }

        @Override
        public String getHost() {
            return host;
        }

        @Override
        public int getPort() {
            return port;
        }

        @Override
        public void close() {
        }

        @Override
        public String toString() {
            return "SimulatedConnection{" + host + ":" + port + '}';
        }
    }

    @Override
    public String toString() {
        return "InMemoryScannerClientSimulator{scans=" + scans.keySet() + ", mode=" + failureMode +
                ", calls=" + Arrays.toString(calls.toArray()) + '}';
    }
}
