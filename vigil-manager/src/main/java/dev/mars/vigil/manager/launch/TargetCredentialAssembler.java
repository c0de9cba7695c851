package dev.mars.vigil.manager.launch;

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


import dev.mars.vigil.core.ScanTarget;
import dev.mars.vigil.core.exceptions.CredentialException;
import dev.mars.vigil.credential.AuthData;
import dev.mars.vigil.credential.CredentialKind;
import dev.mars.vigil.credential.CredentialSourceRegistry;
import dev.mars.vigil.credential.ScanCredential;
import dev.mars.vigil.scanner.TargetCredential;
import dev.mars.vigil.storage.ScanStore;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds the per-service credentials of a scan target in the form the scanner expects.
 *
 * <p>Vault-backed credentials are fetched through the {@link CredentialSourceRegistry}
 * and sent with their base type. An SSH private key is sent base64 encoded.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TargetCredentialAssembler {

    static final String SERVICE_SSH = "ssh";
    static final String SERVICE_SMB = "smb";
    static final String SERVICE_ESXI = "esxi";
    static final String SERVICE_SNMP = "snmp";
    static final String SERVICE_KRB5 = "krb5";

    private final ScanStore store;
    private final CredentialSourceRegistry registry;

    public TargetCredentialAssembler(ScanStore store, CredentialSourceRegistry registry) {
        this.store = store;
        this.registry = registry;
    }

    public List<TargetCredential> forTarget(ScanTarget target) throws CredentialException {
        List<TargetCredential> credentials = new ArrayList<>();

        Optional<String> sshId = target.getSshCredentialId();
        if (sshId.isPresent()) {
            credentials.add(sshCredential(target, sshId.get()));
        }
        Optional<String> smbId = target.getSmbCredentialId();
        if (smbId.isPresent()) {
            credentials.add(passwordCredential(smbId.get(), SERVICE_SMB));
        }
        Optional<String> esxiId = target.getEsxiCredentialId();
        if (esxiId.isPresent()) {
            credentials.add(passwordCredential(esxiId.get(), SERVICE_ESXI));
        }
        Optional<String> snmpId = target.getSnmpCredentialId();
        if (snmpId.isPresent()) {
            credentials.add(snmpCredential(snmpId.get()));
        }
        Optional<String> krb5Id = target.getKrb5CredentialId();
        if (krb5Id.isPresent()) {
            credentials.add(kerberosCredential(krb5Id.get()));
        }
        return credentials;
    }

    private TargetCredential sshCredential(ScanTarget target, String credentialId) throws CredentialException {
        ScanCredential credential = load(credentialId);
        CredentialKind type = credential.getKind().getBaseType();
        if (type != CredentialKind.UP && type != CredentialKind.USK) {
            throw new CredentialException(credentialId, "SSH credential must be of type up or usk, not " + type.getCode());
        }

        AuthData data = registry.fetch(credential);
        TargetCredential result = new TargetCredential(type.getCode(), SERVICE_SSH, String.valueOf(target.getSshPort()))
                .withAuthData("username", data.getOrEmpty(AuthData.USERNAME))
                .withAuthData("password", data.getOrEmpty(AuthData.PASSWORD));
        if (type == CredentialKind.USK) {
            String key = data.get(AuthData.PRIVATE_KEY)
                    .orElseThrow(() -> new CredentialException(credentialId, "SSH key credential has no private key"));
            result.withAuthData("private", Base64.getEncoder().encodeToString(key.getBytes(StandardCharsets.UTF_8)));
        }

        Optional<String> elevateId = target.getSshElevateCredentialId();
        if (elevateId.isPresent()) {
            ScanCredential elevate = load(elevateId.get());
            if (elevate.getKind().getBaseType() != CredentialKind.UP) {
                throw new CredentialException(elevate.getId(), "SSH elevate credential must be of type up");
            }
            AuthData elevateData = registry.fetch(elevate);
            result.withAuthData("priv_username", elevateData.getOrEmpty(AuthData.USERNAME))
                    .withAuthData("priv_password", elevateData.getOrEmpty(AuthData.PASSWORD));
        }
        return result;
    }

    private TargetCredential passwordCredential(String credentialId, String service) throws CredentialException {
        ScanCredential credential = load(credentialId);
        if (credential.getKind().getBaseType() != CredentialKind.UP) {
            throw new CredentialException(credentialId,
                    service.toUpperCase(Locale.ROOT) + " credential must be of type up, not " + credential.getKind().getCode());
        }
        AuthData data = registry.fetch(credential);
        return new TargetCredential(CredentialKind.UP.getCode(), service, "")
                .withAuthData("username", data.getOrEmpty(AuthData.USERNAME))
                .withAuthData("password", data.getOrEmpty(AuthData.PASSWORD));
    }

    private TargetCredential snmpCredential(String credentialId) throws CredentialException {
        ScanCredential credential = load(credentialId);
        if (credential.getKind() != CredentialKind.SNMP) {
            throw new CredentialException(credentialId, "SNMP credential must be of type snmp, not " + credential.getKind().getCode());
        }
        AuthData data = registry.fetch(credential);
        return new TargetCredential(CredentialKind.SNMP.getCode(), SERVICE_SNMP, "")
                .withAuthData("username", data.getOrEmpty(AuthData.USERNAME))
                .withAuthData("password", data.getOrEmpty(AuthData.PASSWORD))
                .withAuthData("community", data.getOrEmpty(AuthData.COMMUNITY))
                .withAuthData("auth_algorithm", data.getOrEmpty(AuthData.AUTH_ALGORITHM))
                .withAuthData("privacy_algorithm", data.getOrEmpty(AuthData.PRIVACY_ALGORITHM))
                .withAuthData("privacy_password", data.getOrEmpty(AuthData.PRIVACY_PASSWORD));
    }

    private TargetCredential kerberosCredential(String credentialId) throws CredentialException {
        ScanCredential credential = load(credentialId);
        if (credential.getKind() != CredentialKind.KRB5) {
            throw new CredentialException(credentialId, "Kerberos credential must be of type krb5, not " + credential.getKind().getCode());
        }
        AuthData data = registry.fetch(credential);
        return new TargetCredential(CredentialKind.KRB5.getCode(), SERVICE_KRB5, "")
                .withAuthData("username", data.getOrEmpty(AuthData.USERNAME))
                .withAuthData("password", data.getOrEmpty(AuthData.PASSWORD))
                .withAuthData("realm", data.getOrEmpty(AuthData.REALM))
                .withAuthData("kdc", data.getOrEmpty(AuthData.KDC));
    }

    private ScanCredential load(String credentialId) throws CredentialException {
        return store.findCredential(credentialId)
                .orElseThrow(() -> new CredentialException(credentialId, "Credential not found"));
    }
}
