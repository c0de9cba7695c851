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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * In-process gate backed by one fair {@link Semaphore} per enabled resource.
 *
 * <p>Only bounds holders inside this JVM. Use {@link SharedFileResourceGate} when scan
 * handlers run in several processes.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class LocalResourceGate implements ResourceGate {
    private static final Logger logger = LoggerFactory.getLogger(LocalResourceGate.class);

    private final GateCapacities capacities;
    private final Map<ResourceType, Semaphore> semaphores = new EnumMap<>(ResourceType.class);
    private volatile boolean closed;

    public LocalResourceGate(GateCapacities capacities) {
        this.capacities = capacities;
        for (ResourceType type : ResourceType.values()) {
            int capacity = capacities.get(type);
            if (capacity > 0) {
                semaphores.put(type, new Semaphore(capacity, true));
            }
        }
        logger.debug("Local resource gate created with {}", capacities);
    }

    @Override
    public AcquireStatus acquire(ResourceType resource, long timeoutSeconds) throws ResourceGateException {
        Semaphore semaphore = semaphores.get(resource);
        if (semaphore == null) {
            return AcquireStatus.ACQUIRED;
        }
        ensureOpen(resource);
        try {
            if (timeoutSeconds <= 0) {
                semaphore.acquire();
                return AcquireStatus.ACQUIRED;
            }
            return semaphore.tryAcquire(timeoutSeconds, TimeUnit.SECONDS)
                    ? AcquireStatus.ACQUIRED : AcquireStatus.TIMED_OUT;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResourceGateException("Interrupted while waiting for " + resource.getKey(), e);
        }
    }

    @Override
    public void release(ResourceType resource) throws ResourceGateException {
        Semaphore semaphore = semaphores.get(resource);
        if (semaphore == null) {
            return;
        }
        ensureOpen(resource);
        semaphore.release();
    }

    @Override
    public int getCapacity(ResourceType resource) {
        return capacities.get(resource);
    }

    /**
     * Slots currently free; exposed for monitoring and tests.
     */
    public int availablePermits(ResourceType resource) {
        Semaphore semaphore = semaphores.get(resource);
        return semaphore == null ? 0 : semaphore.availablePermits();
    }

    @Override
    public void close() {
        closed = true;
    }

    private void ensureOpen(ResourceType resource) throws ResourceGateException {
        if (closed) {
            throw new ResourceGateException("Resource gate for " + resource.getKey() + " has been closed");
        }
    }
}
