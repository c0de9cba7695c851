package dev.mars.vigil.core.exceptions;

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
 * Thrown when a credential cannot be fetched or is of a type the scanner does not
 * accept for the service it is attached to.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class CredentialException extends VigilException {

    private final String credentialId;

    public CredentialException(String credentialId, String message) {
        super(message);
        this.credentialId = credentialId;
    }

    public CredentialException(String credentialId, String message, Throwable cause) {
        super(message, cause);
        this.credentialId = credentialId;
    }

    public String getCredentialId() {
        return credentialId;
    }

    @Override
    public String getMessage() {
        return String.format("Credential %s: %s", credentialId, super.getMessage());
    }
}
