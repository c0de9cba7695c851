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

/**
 * Counting gate that bounds how many holders work on a resource at the same time.
 *
 * <p>A resource configured with capacity 0 is disabled: {@link #acquire} returns
 * {@link AcquireStatus#ACQUIRED} at once and {@link #release} does nothing.</p>
 *
 * <p>Every successful acquire must be paired with exactly one release by the same
 * holder. A {@link ResourceGateException} means the gate itself is unusable and must
 * not be retried.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface ResourceGate extends AutoCloseable {

    /**
     * Takes one slot of the resource.
     *
     * @param resource       the resource to take a slot of
     * @param timeoutSeconds how long to wait for a free slot; 0 waits without bound
     * @return {@link AcquireStatus#ACQUIRED}, or {@link AcquireStatus#TIMED_OUT} when no
     *         slot became free in time
     * @throws ResourceGateException if the gate state is missing, destroyed or the wait
     *                               was interrupted
     */
    AcquireStatus acquire(ResourceType resource, long timeoutSeconds) throws ResourceGateException;

    /**
     * Gives back a slot taken by {@link #acquire}.
     *
     * @throws ResourceGateException if the gate state is missing or destroyed
     */
    void release(ResourceType resource) throws ResourceGateException;

    /**
     * Configured capacity of the resource; 0 means the resource is not gated.
     */
    int getCapacity(ResourceType resource);

    default boolean isEnabled(ResourceType resource) {
        return getCapacity(resource) > 0;
    }

    /**
     * Releases whatever this gate instance still holds.
     */
    @Override
    void close();
}
