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


import java.util.Objects;
import java.util.Optional;

/**
 * What to scan: hosts, ports, exclusions, alive-test settings and the credentials to
 * log in with. Credential fields hold credential ids and are all optional.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ScanTarget {

    public static final int DEFAULT_SSH_PORT = 22;

    private final String id;
    private final String hosts;
    private final String excludeHosts;
    private final String portRange;
    private final String aliveTests;
    private final boolean reverseLookupOnly;
    private final boolean reverseLookupUnify;
    private final String sshCredentialId;
    private final String sshElevateCredentialId;
    private final int sshPort;
    private final String smbCredentialId;
    private final String esxiCredentialId;
    private final String snmpCredentialId;
    private final String krb5CredentialId;

    private ScanTarget(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.hosts = Objects.requireNonNull(builder.hosts, "hosts");
        this.excludeHosts = builder.excludeHosts == null ? "" : builder.excludeHosts;
        this.portRange = builder.portRange == null ? "" : builder.portRange;
        this.aliveTests = builder.aliveTests;
        this.reverseLookupOnly = builder.reverseLookupOnly;
        this.reverseLookupUnify = builder.reverseLookupUnify;
        this.sshCredentialId = builder.sshCredentialId;
        this.sshElevateCredentialId = builder.sshElevateCredentialId;
        this.sshPort = builder.sshPort;
        this.smbCredentialId = builder.smbCredentialId;
        this.esxiCredentialId = builder.esxiCredentialId;
        this.snmpCredentialId = builder.snmpCredentialId;
        this.krb5CredentialId = builder.krb5CredentialId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getHosts() {
        return hosts;
    }

    public String getExcludeHosts() {
        return excludeHosts;
    }

    public String getPortRange() {
        return portRange;
    }

    public Optional<String> getAliveTests() {
        return Optional.ofNullable(aliveTests);
    }

    public boolean isReverseLookupOnly() {
        return reverseLookupOnly;
    }

    public boolean isReverseLookupUnify() {
        return reverseLookupUnify;
    }

    public Optional<String> getSshCredentialId() {
        return Optional.ofNullable(sshCredentialId);
    }

    public Optional<String> getSshElevateCredentialId() {
        return Optional.ofNullable(sshElevateCredentialId);
    }

    public int getSshPort() {
        return sshPort;
    }

    public Optional<String> getSmbCredentialId() {
        return Optional.ofNullable(smbCredentialId);
    }

    public Optional<String> getEsxiCredentialId() {
        return Optional.ofNullable(esxiCredentialId);
    }

    public Optional<String> getSnmpCredentialId() {
        return Optional.ofNullable(snmpCredentialId);
    }

    public Optional<String> getKrb5CredentialId() {
        return Optional.ofNullable(krb5CredentialId);
    }

    public static class Builder {
        private String id;
        private String hosts;
        private String excludeHosts;
        private String portRange;
        private String aliveTests;
        private boolean reverseLookupOnly;
        private boolean reverseLookupUnify;
        private String sshCredentialId;
        private String sshElevateCredentialId;
        private int sshPort = DEFAULT_SSH_PORT;
        private String smbCredentialId;
        private String esxiCredentialId;
        private String snmpCredentialId;
        private String krb5CredentialId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder hosts(String hosts) {
            this.hosts = hosts;
            return this;
        }

        public Builder excludeHosts(String excludeHosts) {
            this.excludeHosts = excludeHosts;
            return this;
        }

        public Builder portRange(String portRange) {
            this.portRange = portRange;
            return this;
        }

        public Builder aliveTests(String aliveTests) {
            this.aliveTests = aliveTests;
            return this;
        }

        public Builder reverseLookupOnly(boolean reverseLookupOnly) {
            this.reverseLookupOnly = reverseLookupOnly;
            return this;
        }

        public Builder reverseLookupUnify(boolean reverseLookupUnify) {
            this.reverseLookupUnify = reverseLookupUnify;
            return this;
        }

        public Builder sshCredential(String credentialId, int port) {
            this.sshCredentialId = credentialId;
            this.sshPort = port;
            return this;
        }

        public Builder sshElevateCredential(String credentialId) {
            this.sshElevateCredentialId = credentialId;
            return this;
        }

        public Builder smbCredential(String credentialId) {
            this.smbCredentialId = credentialId;
            return this;
        }

        public Builder esxiCredential(String credentialId) {
            this.esxiCredentialId = credentialId;
            return this;
        }

        public Builder snmpCredential(String credentialId) {
            this.snmpCredentialId = credentialId;
            return this;
        }

        public Builder krb5Credential(String credentialId) {
            this.krb5CredentialId = credentialId;
            return this;
        }

        public ScanTarget build() {
            return new ScanTarget(this);
        }
    }
}
