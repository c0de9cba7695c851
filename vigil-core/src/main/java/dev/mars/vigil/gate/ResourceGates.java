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


import dev.mars.vigil.config.VigilConfiguration;
import dev.mars.vigil.core.exceptions.ResourceGateException;

/**
 * Builds the gate selected by {@code vigil.gate.mode}.
 *
 * @since 1.0
 */
public final class ResourceGates {

    private ResourceGates() {
    }

    /**
     * Gate for the manager process: the shared gate is created or rebuilt.
     */
    public static ResourceGate forManager(VigilConfiguration configuration) throws ResourceGateException {
        GateCapacities capacities = GateCapacities.fromConfiguration(configuration);
        if ("local".equals(configuration.getGateMode())) {
            return new LocalResourceGate(capacities);
        }
        return SharedFileResourceGate.create(configuration.getGateStateDirectory(), capacities);
    }

    /**
     * Gate for a worker process: the shared gate must already exist.
     */
    public static ResourceGate forWorker(VigilConfiguration configuration) throws ResourceGateException {
        GateCapacities capacities = GateCapacities.fromConfiguration(configuration);
        if ("local".equals(configuration.getGateMode())) {
            return new LocalResourceGate(capacities);
        }
        return SharedFileResourceGate.attach(configuration.getGateStateDirectory(), capacities);
    }
}
