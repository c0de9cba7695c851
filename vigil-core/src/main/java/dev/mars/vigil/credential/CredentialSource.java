package dev.mars.vigil.credential;

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


import dev.mars.vigil.core.exceptions.CredentialException;

import java.util.Set;

/**
 * Where the secrets of a credential come from.
 *
 * @since 1.0
 */
public interface CredentialSource {

    /**
     * Credential kinds this source can fetch.
     */
    Set<CredentialKind> getSupportedKinds();

    /**
     * Retrieves the secret fields of {@code credential}. May block.
     *
     * @throws CredentialException if the secrets cannot be retrieved
     */
    AuthData fetch(ScanCredential credential) throws CredentialException;
}
