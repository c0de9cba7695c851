package dev.mars.vigil.scanner;

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


import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the scanner needs to start a scan: the scan id, the target, credentials,
 * the vulnerability tests and the scanner options.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ScanStartRequest {

    private final String scanId;
    private final String hosts;
    private final String ports;
    private final String excludeHosts;
    private final String finishedHosts;
    private final String aliveTests;
    private final boolean reverseLookupOnly;
    private final boolean reverseLookupUnify;
    private final List<TargetCredential> credentials;
    private final List<VtSelection> vts;
    private final Map<String, String> scannerOptions;

    private ScanStartRequest(Builder builder) {
        this.scanId = Objects.requireNonNull(builder.scanId, "scanId");
        this.hosts = Objects.requireNonNull(builder.hosts, "hosts");
        this.ports = builder.ports;
        this.excludeHosts = builder.excludeHosts;
        this.finishedHosts = builder.finishedHosts;
        this.aliveTests = builder.aliveTests;
        this.reverseLookupOnly = builder.reverseLookupOnly;
        this.reverseLookupUnify = builder.reverseLookupUnify;
        this.credentials = Collections.unmodifiableList(new ArrayList<>(builder.credentials));
        this.vts = Collections.unmodifiableList(new ArrayList<>(builder.vts));
        this.scannerOptions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.scannerOptions));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getScanId() {
        return scanId;
    }

    public String getHosts() {
        return hosts;
    }

    public String getPorts() {
        return ports;
    }

    public String getExcludeHosts() {
        return excludeHosts;
    }

    public String getFinishedHosts() {
        return finishedHosts;
    }

    public String getAliveTests() {
        return aliveTests;
    }

    public boolean isReverseLookupOnly() {
        return reverseLookupOnly;
    }

    public boolean isReverseLookupUnify() {
        return reverseLookupUnify;
    }

    public List<TargetCredential> getCredentials() {
        return credentials;
    }

    public List<VtSelection> getVts() {
        return vts;
    }

    public Map<String, String> getScannerOptions() {
        return scannerOptions;
    }

    public static class Builder {
        private String scanId;
        private String hosts;
        private String ports = "";
        private String excludeHosts = "";
        private String finishedHosts = "";
        private String aliveTests;
        private boolean reverseLookupOnly;
        private boolean reverseLookupUnify;
        private final List<TargetCredential> credentials = new ArrayList<>();
        private final List<VtSelection> vts = new ArrayList<>();
        private final Map<String, String> scannerOptions = new LinkedHashMap<>();

        public Builder scanId(String scanId) {
            this.scanId = scanId;
            return this;
        }

        public Builder hosts(String hosts) {
            this.hosts = hosts;
            return this;
        }

        public Builder ports(String ports) {
            this.ports = ports;
            return this;
        }

        public Builder excludeHosts(String excludeHosts) {
            this.excludeHosts = excludeHosts;
            return this;
        }

        public Builder finishedHosts(String finishedHosts) {
            this.finishedHosts = finishedHosts;
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

        public Builder credential(TargetCredential credential) {
            this.credentials.add(credential);
            return this;
        }

        public Builder vt(VtSelection vt) {
            this.vts.add(vt);
            return this;
        }

        public Builder scannerOption(String name, String value) {
            this.scannerOptions.put(name, value);
            return this;
        }

        public ScanStartRequest build() {
            return new ScanStartRequest(this);
        }
    }
}
