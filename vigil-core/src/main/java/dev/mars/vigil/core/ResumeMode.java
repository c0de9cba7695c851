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


/**
 * How a run request treats a previous, unfinished report of the same task.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum ResumeMode {

    /** Always start over with a new report. */
    FROM_START,

    /** Continue the last stopped or interrupted report; fail if there is none. */
    RESUME_ONLY,

    /** Continue the last stopped or interrupted report, or start over if there is none. */
    RESUME_OR_START;

    public boolean allowsResume() {
        return this != FROM_START;
    }
}
