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


import java.time.Instant;
import java.util.Objects;

/**
 * One row of report output. Immutable.
 *
 * <p>Synthetic error results, recorded by the manager itself when a job fails, carry an
 * empty host, port and NVT oid and the default quality of detection.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ScanResult {

    public static final int DEFAULT_QOD = 70;

    private final String host;
    private final String hostname;
    private final String port;
    private final String nvtOid;
    private final ResultType type;
    private final double severity;
    private final int qod;
    private final String description;
    private final Instant createdAt;

    private ScanResult(Builder builder) {
        this.host = builder.host;
        this.hostname = builder.hostname;
        this.port = builder.port;
        this.nvtOid = builder.nvtOid;
        this.type = Objects.requireNonNull(builder.type, "type");
        this.severity = builder.severity;
        this.qod = builder.qod;
        this.description = builder.description == null ? "" : builder.description;
        this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
    }

    /**
     * Creates the error row the manager records when it gives up on a scan.
     */
    public static ScanResult syntheticError(String description) {
        return builder()
                .type(ResultType.ERROR)
                .description(description)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getHost() {
        return host;
    }

    public String getHostname() {
        return hostname;
    }

    public String getPort() {
        return port;
    }

    public String getNvtOid() {
        return nvtOid;
    }

    public ResultType getType() {
        return type;
    }

    public double getSeverity() {
        return severity;
    }

    public int getQod() {
        return qod;
    }

    public String getDescription() {
        return description;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "ScanResult{" +
                "type=" + type +
                ", host='" + host + '\'' +
                ", port='" + port + '\'' +
                ", nvtOid='" + nvtOid + '\'' +
                ", severity=" + severity +
                ", description='" + description + '\'' +
                '}';
    }

    public static class Builder {
        private String host = "";
        private String hostname = "";
        private String port = "";
        private String nvtOid = "";
        private ResultType type;
        private double severity;
        private int qod = DEFAULT_QOD;
        private String description;
        private Instant createdAt;

        public Builder host(String host) {
            this.host = host == null ? "" : host;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname == null ? "" : hostname;
            return this;
        }

        public Builder port(String port) {
            this.port = port == null ? "" : port;
            return this;
        }

        public Builder nvtOid(String nvtOid) {
            this.nvtOid = nvtOid == null ? "" : nvtOid;
            return this;
        }

        public Builder type(ResultType type) {
            this.type = type;
            return this;
        }

        public Builder severity(double severity) {
            this.severity = severity;
            return this;
        }

        public Builder qod(int qod) {
            this.qod = qod;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public ScanResult build() {
            return new ScanResult(this);
        }
    }
}
