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
import dev.mars.vigil.connection.ConnectionResolver;
import dev.mars.vigil.connection.ProcessRelayMapper;
import dev.mars.vigil.core.ResumeMode;
import dev.mars.vigil.core.ScanOutcome;
import dev.mars.vigil.core.exceptions.InvalidTransitionException;
import dev.mars.vigil.core.exceptions.ResourceGateException;
import dev.mars.vigil.core.exceptions.ScanException;
import dev.mars.vigil.credential.CredentialSourceRegistry;
import dev.mars.vigil.credential.VaultCredentialStore;
import dev.mars.vigil.gate.ResourceGate;
import dev.mars.vigil.gate.ResourceGates;
import dev.mars.vigil.manager.finalize.ReportProcessingService;
import dev.mars.vigil.manager.queue.ScanHandlerPool;
import dev.mars.vigil.manager.queue.ScanQueueHandler;
import dev.mars.vigil.scanner.ScannerClient;
import dev.mars.vigil.storage.ScanStore;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the scan orchestration components from a {@link VigilConfiguration}.
 *
 * <p>Creates the resource gate, the credential sources (the vault backend only when a
 * vault URL is configured), the connection resolver (with the external relay mapper
 * when one is configured), the job manager, the handler pool and, when the scan queue
 * is enabled, the queue handler. Scans are either handed straight to the handler pool
 * or placed on the queue.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class VigilManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(VigilManager.class);

    private final Vertx vertx;
    private final VigilConfiguration config;
    private final ResourceGate gate;
    private final VaultCredentialStore vaultStore;
    private final ScanJobManager jobManager;
    private final ScanHandlerPool handlerPool;
    private final ScanQueueHandler queueHandler;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public VigilManager(Vertx vertx, VigilConfiguration config, ScanStore store, ScannerClient scannerClient)
            throws ResourceGateException {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.config = Objects.requireNonNull(config, "VigilConfiguration cannot be null");
        config.validate();

        this.gate = ResourceGates.forManager(config);

        CredentialSourceRegistry credentials = new CredentialSourceRegistry();
        if (config.isVaultConfigured()) {
            this.vaultStore = new VaultCredentialStore(vertx, config.getVaultBaseUrl(), config.getVaultAppId(),
                    config.getVaultTimeoutMs());
            credentials.register(vaultStore);
        } else {
            this.vaultStore = null;
        }

        ConnectionResolver resolver = config.isRelayMapperConfigured()
                ? new ConnectionResolver(scannerClient,
                        new ProcessRelayMapper(Paths.get(config.getRelayMapperPath()), config.getRelayMapperTimeoutMs()))
                : new ConnectionResolver(scannerClient);

        this.jobManager = new ScanJobManager(store, scannerClient, resolver, gate, credentials, config);
        ReportProcessingService reportProcessing = new ReportProcessingService(store, gate,
                config.getGateAcquireTimeoutSeconds());
        this.handlerPool = new ScanHandlerPool(vertx, jobManager, gate, reportProcessing, config);
        this.queueHandler = config.isQueueEnabled() ? new ScanQueueHandler(store, handlerPool, config) : null;

        logger.info("VigilManager initialized (gate={}, queue={}, vault={}, relayMapper={})",
                config.getGateMode(), config.isQueueEnabled(), config.isVaultConfigured(),
                config.isRelayMapperConfigured());
    }

    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Manager is closed, cannot start");
        }
        config.logConfiguration();
        if (queueHandler != null) {
            queueHandler.start(vertx);
        }
    }

    /**
     * Runs a scan for the task. With the queue enabled the job is queued and the returned
     * future completes with {@link ScanOutcome#STILL_ACTIVE} once it is on the queue;
     * otherwise it completes with the job's final outcome.
     */
    public Future<ScanOutcome> startScan(String taskId, ResumeMode mode) {
        if (queueHandler == null) {
            return handlerPool.submit(taskId, mode);
        }
        try {
            jobManager.queueJob(taskId, mode);
            return Future.succeededFuture(ScanOutcome.STILL_ACTIVE);
        } catch (ScanException e) {
            return Future.failedFuture(e);
        }
    }

    public void stopScan(String taskId) throws ScanException, InvalidTransitionException {
        jobManager.stopJob(taskId);
    }

    public ScanJobManager getJobManager() {
        return jobManager;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (queueHandler != null) {
            queueHandler.stop(vertx);
        }
        handlerPool.close();
        if (vaultStore != null) {
            vaultStore.close();
        }
        gate.close();
        logger.info("VigilManager closed");
    }
}
