package dev.mars.vigil.connection;

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


import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Relay lookup through an external mapper program.
 *
 * <p>The program is run as {@code <mapper> --host <host> --port <port> --protocol <protocol>}
 * and must exit with 0 and print a JSON object with the fields {@code host}, {@code port}
 * and {@code ca_cert}. An empty host or port means no relay is registered; an empty
 * {@code ca_cert} means the relay needs no CA certificate.</p>
 *
 * <pre>
 * {"host": "relay.example.net", "port": 9390, "ca_cert": "-----BEGIN CERTIFICATE-----..."}
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ProcessRelayMapper implements RelayMapper {
    private static final Logger logger = LoggerFactory.getLogger(ProcessRelayMapper.class);

    private final Path mapperPath;
    private final long timeoutMs;
    private final ObjectMapper objectMapper;

    public ProcessRelayMapper(Path mapperPath, long timeoutMs) {
        this(mapperPath, timeoutMs, new ObjectMapper());
    }

    public ProcessRelayMapper(Path mapperPath, long timeoutMs, ObjectMapper objectMapper) {
        this.mapperPath = Objects.requireNonNull(mapperPath, "mapperPath");
        this.timeoutMs = timeoutMs;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public Optional<RelayEndpoint> lookup(String host, int port, String caCertificate, String protocol)
            throws IOException {
        List<String> command = List.of(mapperPath.toString(),
                "--host", host, "--port", String.valueOf(port), "--protocol", protocol);
        logger.debug("Running relay mapper: {}", command);

        Process process = new ProcessBuilder(command).start();
        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        try {
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("Relay mapper did not answer within " + timeoutMs + "ms");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for relay mapper", e);
        }

        String output = collect(stdout);
        if (process.exitValue() != 0) {
            String error = collect(stderr).trim();
            throw new IOException("Relay mapper exited with code " + process.exitValue()
                    + (error.isEmpty() ? "" : ": " + error));
        }
        return parse(output);
    }

    // Both pipes are read while the mapper runs so a large answer cannot fill the pipe buffer.
    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    private String collect(CompletableFuture<String> output) throws IOException {
        try {
            return output.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while reading relay mapper output", e);
        } catch (ExecutionException e) {
            throw new IOException("Failed to read relay mapper output", e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("Relay mapper output was not closed within " + timeoutMs + "ms", e);
        }
    }

    Optional<RelayEndpoint> parse(String output) throws IOException {
        JsonNode root = objectMapper.readTree(output);
        if (root == null || !root.isObject()) {
            throw new IOException("Relay mapper output is not a JSON object");
        }
        String relayHost = requiredText(root, "host");
        String relayPort = requiredText(root, "port");
        String relayCa = requiredText(root, "ca_cert");

        if (relayHost.isEmpty() || relayPort.isEmpty()) {
            return Optional.empty();
        }
        int parsedPort;
        try {
            parsedPort = Integer.parseInt(relayPort);
        } catch (NumberFormatException e) {
            throw new IOException("Relay mapper returned an invalid port: " + relayPort, e);
        }
        return Optional.of(new RelayEndpoint(relayHost, parsedPort, relayCa.isEmpty() ? null : relayCa));
    }

    private static String requiredText(JsonNode root, String field) throws IOException {
        JsonNode node = root.get(field);
        if (node == null) {
            throw new IOException("Relay mapper output is missing '" + field + "'");
        }
        return node.isNull() ? "" : node.asText().trim();
    }
}
