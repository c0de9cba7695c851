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

import java.util.EnumSet;
import java.util.Set;

/**
 * Credentials whose secrets are kept with the credential record itself.
 *
 * @since 1.0
 */
public class LocalCredentialStore implements CredentialSource {

    @Override
    public Set<CredentialKind> getSupportedKinds() {
        return EnumSet.of(CredentialKind.UP, CredentialKind.USK, CredentialKind.SNMP, CredentialKind.KRB5);
    }

    @Override
    public AuthData fetch(ScanCredential credential) throws CredentialException {
        AuthData.Builder data = AuthData.builder()
                .field(AuthData.USERNAME, credential.getLogin());
        switch (credential.getKind()) {
            case UP:
                data.field(AuthData.PASSWORD, credential.getPassword());
                break;
            case USK:
                if (credential.getPrivateKey() == null) {
                    throw new CredentialException(credential.getId(), "Private key is missing");
                }
                data.field(AuthData.PASSWORD, credential.getPassword())
                        .field(AuthData.PRIVATE_KEY, credential.getPrivateKey());
                break;
            case SNMP:
                data.field(AuthData.PASSWORD, credential.getPassword())
                        .field(AuthData.COMMUNITY, credential.getCommunity())
                        .field(AuthData.AUTH_ALGORITHM, credential.getAuthAlgorithm())
                        .field(AuthData.PRIVACY_PASSWORD, credential.getPrivacyPassword())
                        .field(AuthData.PRIVACY_ALGORITHM, credential.getPrivacyAlgorithm());
                break;
            case KRB5:
                data.field(AuthData.PASSWORD, credential.getPassword())
                        .field(AuthData.REALM, credential.getRealm())
                        .field(AuthData.KDC, credential.getKdc());
                break;
            default:
                throw new CredentialException(credential.getId(),
                        "Credential type " + credential.getKind().getCode() + " is not stored locally");
        }
        return data.build();
    }
}
