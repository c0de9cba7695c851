package dev.mars.vigil.core;

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


import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunStatusTest {

    @Test
    void testTerminalStates() {
        assertTrue(RunStatus.DONE.isTerminal());
        assertTrue(RunStatus.STOPPED.isTerminal());
        assertTrue(RunStatus.INTERRUPTED.isTerminal());
        assertFalse(RunStatus.STOP_REQUESTED.isTerminal());
        assertFalse(RunStatus.RUNNING.isTerminal());
    }

    @Test
    void testTransitions() {
        assertTrue(RunStatus.RUNNING.canTransitionTo(RunStatus.STOP_REQUESTED));
        assertTrue(RunStatus.STOP_REQUESTED.canTransitionTo(RunStatus.STOPPED));
        assertTrue(RunStatus.INTERRUPTED.canTransitionTo(RunStatus.REQUESTED));
        assertFalse(RunStatus.DONE.canTransitionTo(RunStatus.STOP_REQUESTED));
        assertTrue(RunStatus.DONE.getValidTransitions().isEmpty());
    }

    @Test
    void testSyntheticErrorDefaults() {
        ScanResult result = ScanResult.syntheticError("Erroneous scan progress value");

        assertEquals(ResultType.ERROR, result.getType());
        assertEquals("", result.getHost());
        assertEquals("", result.getPort());
        assertEquals("", result.getNvtOid());
        assertEquals(ScanResult.DEFAULT_QOD, result.getQod());
    }
}
