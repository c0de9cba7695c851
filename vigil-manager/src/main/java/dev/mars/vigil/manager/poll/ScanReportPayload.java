package dev.mars.vigil.manager.poll;

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


import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Report payload returned by a detailed scan query.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanReportPayload {

    @JsonProperty("results")
    private List<Entry> results = new ArrayList<>();

    public List<Entry> getResults() {
        return results;
    }

    public void setResults(List<Entry> results) {
        this.results = results != null ? results : new ArrayList<>();
    }

    /**
     * One result row. Numeric fields arrive as text and are parsed by the consumer.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {

        @JsonProperty("type")
        private String type;

        @JsonProperty("host")
        private String host;

        @JsonProperty("hostname")
        private String hostname;

        @JsonProperty("port")
        private String port;

        @JsonProperty("test_id")
        private String testId;

        @JsonProperty("severity")
        private String severity;

        @JsonProperty("qod")
        private String qod;

        @JsonProperty("name")
        private String name;

        @JsonProperty("value")
        private String value;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public String getHostname() {
            return hostname;
        }

        public void setHostname(String hostname) {
            this.hostname = hostname;
        }

        public String getPort() {
            return port;
        }

        public void setPort(String port) {
            this.port = port;
        }

        public String getTestId() {
            return testId;
        }

        public void setTestId(String testId) {
            this.testId = testId;
        }

        public String getSeverity() {
            return severity;
        }

        public void setSeverity(String severity) {
            this.severity = severity;
        }

        public String getQod() {
            return qod;
        }

        public void setQod(String qod) {
            this.qod = qod;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getValue() {
            return value;
        }

        public void setValue(String value) {
            this.value = value;
        }
    }
}
