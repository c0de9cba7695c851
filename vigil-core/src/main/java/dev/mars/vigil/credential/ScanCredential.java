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


import java.util.Objects;

/**
 * A stored credential. Locally stored kinds carry their secrets here; vault-backed kinds
 * carry only the vault and host identifiers to look them up with.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ScanCredential {

    private final String id;
    private final CredentialKind kind;
    private final String login;
    private final String password;
    private final String privateKey;
    private final String community;
    private final String authAlgorithm;
    private final String privacyPassword;
    private final String privacyAlgorithm;
    private final String realm;
    private final String kdc;
    private final String vaultId;
    private final String hostIdentifier;

    private ScanCredential(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.login = builder.login;
        this.password = builder.password;
        this.privateKey = builder.privateKey;
        this.community = builder.community;
        this.authAlgorithm = builder.authAlgorithm;
        this.privacyPassword = builder.privacyPassword;
        this.privacyAlgorithm = builder.privacyAlgorithm;
        this.realm = builder.realm;
        this.kdc = builder.kdc;
        this.vaultId = builder.vaultId;
        this.hostIdentifier = builder.hostIdentifier;
    }

    public static Builder builder(String id, CredentialKind kind) {
        return new Builder(id, kind);
    }

    public String getId() {
        return id;
    }

    public CredentialKind getKind() {
        return kind;
    }

    public String getLogin() {
        return login;
    }

    public String getPassword() {
        return password;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public String getCommunity() {
        return community;
    }

    public String getAuthAlgorithm() {
        return authAlgorithm;
    }

    public String getPrivacyPassword() {
        return privacyPassword;
    }

    public String getPrivacyAlgorithm() {
        return privacyAlgorithm;
    }

    public String getRealm() {
        return realm;
    }

    public String getKdc() {
        return kdc;
    }

    public String getVaultId() {
        return vaultId;
    }

    public String getHostIdentifier() {
        return hostIdentifier;
    }

    @Override
    public String toString() {
        return "ScanCredential{id='" + id + "', kind=" + kind + '}';
    }

    public static class Builder {
        private final String id;
        private final CredentialKind kind;
        private String login;
        private String password;
        private String privateKey;
        private String community;
        private String authAlgorithm;
        private String privacyPassword;
        private String privacyAlgorithm;
        private String realm;
        private String kdc;
        private String vaultId;
        private String hostIdentifier;

        private Builder(String id, CredentialKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder login(String login) {
            this.login = login;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder privateKey(String privateKey) {
            this.privateKey = privateKey;
            return this;
        }

        public Builder community(String community) {
            this.community = community;
            return this;
        }

        public Builder authAlgorithm(String authAlgorithm) {
            this.authAlgorithm = authAlgorithm;
            return this;
        }

        public Builder privacy(String privacyAlgorithm, String privacyPassword) {
            this.privacyAlgorithm = privacyAlgorithm;
            this.privacyPassword = privacyPassword;
            return this;
        }

        public Builder kerberos(String realm, String kdc) {
            this.realm = realm;
            this.kdc = kdc;
            return this;
        }

        public Builder vault(String vaultId, String hostIdentifier) {
            this.vaultId = vaultId;
            this.hostIdentifier = hostIdentifier;
            return this;
        }

        public ScanCredential build() {
            return new ScanCredential(this);
        }
    }
}
