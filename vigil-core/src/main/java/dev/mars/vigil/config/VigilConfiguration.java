package dev.mars.vigil.config;

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


import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration for the Vigil scan manager.
 *
 * <p>Values are resolved in layers, each overriding the previous one:</p>
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code vigil.properties} from the working directory, {@code config/},
 *       {@code ~/.vigil/}, {@code /etc/vigil/} or, failing those, the classpath</li>
 *   <li>system properties starting with {@code vigil.}</li>
 *   <li>environment variables, named after the key in upper case with dots and dashes
 *       replaced by underscores ({@code vigil.scanner.connection.retry} becomes
 *       {@code VIGIL_SCANNER_CONNECTION_RETRY})</li>
 * </ol>
 *
 * <p>A capacity of 0 disables the corresponding resource gate.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class VigilConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(VigilConfiguration.class);

    public static final String GATE_MODE = "vigil.gate.mode";
    public static final String GATE_STATE_DIR = "vigil.gate.state.dir";
    public static final String GATE_SCAN_UPDATE_CAPACITY = "vigil.gate.scan-update.capacity";
    public static final String GATE_DB_CONNECTIONS_CAPACITY = "vigil.gate.db-connections.capacity";
    public static final String GATE_REPORT_PROCESSING_CAPACITY = "vigil.gate.report-processing.capacity";
    public static final String GATE_ACQUIRE_TIMEOUT_SECONDS = "vigil.gate.acquire.timeout.seconds";
    public static final String SCANNER_CONNECTION_RETRY = "vigil.scanner.connection.retry";
    public static final String SCAN_POLL_INTERVAL_MS = "vigil.scan.poll.interval.ms";
    public static final String SCAN_RETRY_DELAY_MS = "vigil.scan.retry.delay.ms";
    public static final String SCAN_MAX_CHECKS = "vigil.scan.max.checks";
    public static final String SCAN_MAX_HOSTS = "vigil.scan.max.hosts";
    public static final String RELAY_MAPPER_PATH = "vigil.relay.mapper.path";
    public static final String RELAY_MAPPER_TIMEOUT_MS = "vigil.relay.mapper.timeout.ms";
    public static final String QUEUE_ENABLED = "vigil.queue.enabled";
    public static final String QUEUE_MAX_ACTIVE_HANDLERS = "vigil.queue.max.active.handlers";
    public static final String QUEUE_HANDLER_ACTIVE_TIME_SECONDS = "vigil.queue.handler.active.time.seconds";
    public static final String QUEUE_POLL_INTERVAL_MS = "vigil.queue.poll.interval.ms";
    public static final String HANDLER_POOL_SIZE = "vigil.handler.pool.size";
    public static final String VAULT_BASE_URL = "vigil.vault.base.url";
    public static final String VAULT_APP_ID = "vigil.vault.app.id";
    public static final String VAULT_TIMEOUT_MS = "vigil.vault.timeout.ms";

    private static final String DEFAULT_GATE_MODE = "shared";
    private static final int DEFAULT_GATE_CAPACITY = 0;
    private static final int DEFAULT_GATE_ACQUIRE_TIMEOUT_SECONDS = 5;
    private static final int DEFAULT_CONNECTION_RETRY = 3;
    private static final long DEFAULT_POLL_INTERVAL_MS = 5000;
    private static final long DEFAULT_RETRY_DELAY_MS = 1000;
    private static final int DEFAULT_MAX_CHECKS = 4;
    private static final int DEFAULT_MAX_HOSTS = 20;
    private static final long DEFAULT_RELAY_MAPPER_TIMEOUT_MS = 30000;
    private static final int DEFAULT_MAX_ACTIVE_HANDLERS = 3;
    private static final int DEFAULT_HANDLER_ACTIVE_TIME_SECONDS = 0;
    private static final long DEFAULT_QUEUE_POLL_INTERVAL_MS = 1000;
    private static final int DEFAULT_HANDLER_POOL_SIZE = 10;
    private static final long DEFAULT_VAULT_TIMEOUT_MS = 10000;

    private final Properties properties;

    public VigilConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
        loadConfigurationFromEnvironment(System.getenv());
    }

    /**
     * Creates a configuration from defaults plus the given properties only. Used by tests
     * and embedders that manage their own configuration sources.
     */
    public VigilConfiguration(Properties overrides) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (overrides != null) {
            this.properties.putAll(overrides);
        }
    }

    // Resource gate
    public String getGateMode() {
        return getStringProperty(GATE_MODE, DEFAULT_GATE_MODE).trim().toLowerCase(Locale.ROOT);
    }

    public Path getGateStateDirectory() {
        return Paths.get(getStringProperty(GATE_STATE_DIR, defaultGateStateDir()));
    }

    public int getScanUpdateCapacity() {
        return getIntProperty(GATE_SCAN_UPDATE_CAPACITY, DEFAULT_GATE_CAPACITY);
    }

    public int getDbConnectionsCapacity() {
        return getIntProperty(GATE_DB_CONNECTIONS_CAPACITY, DEFAULT_GATE_CAPACITY);
    }

    public int getReportProcessingCapacity() {
        return getIntProperty(GATE_REPORT_PROCESSING_CAPACITY, DEFAULT_GATE_CAPACITY);
    }

    public int getGateAcquireTimeoutSeconds() {
        return getIntProperty(GATE_ACQUIRE_TIMEOUT_SECONDS, DEFAULT_GATE_ACQUIRE_TIMEOUT_SECONDS);
    }

    // Scanner polling
    public int getConnectionRetry() {
        return getIntProperty(SCANNER_CONNECTION_RETRY, DEFAULT_CONNECTION_RETRY);
    }

    public long getPollIntervalMs() {
        return getLongProperty(SCAN_POLL_INTERVAL_MS, DEFAULT_POLL_INTERVAL_MS);
    }

    public long getRetryDelayMs() {
        return getLongProperty(SCAN_RETRY_DELAY_MS, DEFAULT_RETRY_DELAY_MS);
    }

    public int getMaxChecks() {
        return getIntProperty(SCAN_MAX_CHECKS, DEFAULT_MAX_CHECKS);
    }

    public int getMaxHosts() {
        return getIntProperty(SCAN_MAX_HOSTS, DEFAULT_MAX_HOSTS);
    }

    // Relays
    public String getRelayMapperPath() {
        return getStringProperty(RELAY_MAPPER_PATH, "").trim();
    }

    public boolean isRelayMapperConfigured() {
        return !getRelayMapperPath().isEmpty();
    }

    public long getRelayMapperTimeoutMs() {
        return getLongProperty(RELAY_MAPPER_TIMEOUT_MS, DEFAULT_RELAY_MAPPER_TIMEOUT_MS);
    }

    // Scan queue and handlers
    public boolean isQueueEnabled() {
        return getBooleanProperty(QUEUE_ENABLED, false);
    }

    public int getMaxActiveHandlers() {
        return getIntProperty(QUEUE_MAX_ACTIVE_HANDLERS, DEFAULT_MAX_ACTIVE_HANDLERS);
    }

    public int getHandlerActiveTimeSeconds() {
        return getIntProperty(QUEUE_HANDLER_ACTIVE_TIME_SECONDS, DEFAULT_HANDLER_ACTIVE_TIME_SECONDS);
    }

    public long getQueuePollIntervalMs() {
        return getLongProperty(QUEUE_POLL_INTERVAL_MS, DEFAULT_QUEUE_POLL_INTERVAL_MS);
    }

    public int getHandlerPoolSize() {
        return getIntProperty(HANDLER_POOL_SIZE, DEFAULT_HANDLER_POOL_SIZE);
    }

    // Credential vault
    public String getVaultBaseUrl() {
        return getStringProperty(VAULT_BASE_URL, "").trim();
    }

    public boolean isVaultConfigured() {
        return !getVaultBaseUrl().isEmpty();
    }

    public String getVaultAppId() {
        return getStringProperty(VAULT_APP_ID, "").trim();
    }

    public long getVaultTimeoutMs() {
        return getLongProperty(VAULT_TIMEOUT_MS, DEFAULT_VAULT_TIMEOUT_MS);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    /**
     * Validates the configuration.
     *
     * @throws IllegalStateException if a value is out of range
     */
    public void validate() {
        String mode = getGateMode();
        if (!"shared".equals(mode) && !"local".equals(mode)) {
            throw new IllegalStateException(
                    "Invalid " + GATE_MODE + ": " + mode + ". Must be 'shared' or 'local'");
        }
        requireAtLeast(GATE_SCAN_UPDATE_CAPACITY, getScanUpdateCapacity(), 0);
        requireAtLeast(GATE_DB_CONNECTIONS_CAPACITY, getDbConnectionsCapacity(), 0);
        requireAtLeast(GATE_REPORT_PROCESSING_CAPACITY, getReportProcessingCapacity(), 0);
        requireAtLeast(GATE_ACQUIRE_TIMEOUT_SECONDS, getGateAcquireTimeoutSeconds(), 0);
        requireAtLeast(SCANNER_CONNECTION_RETRY, getConnectionRetry(), 0);
        requireAtLeast(SCAN_POLL_INTERVAL_MS, getPollIntervalMs(), 1);
        requireAtLeast(SCAN_RETRY_DELAY_MS, getRetryDelayMs(), 0);
        requireAtLeast(QUEUE_MAX_ACTIVE_HANDLERS, getMaxActiveHandlers(), 1);
        requireAtLeast(QUEUE_HANDLER_ACTIVE_TIME_SECONDS, getHandlerActiveTimeSeconds(), 0);
        requireAtLeast(HANDLER_POOL_SIZE, getHandlerPoolSize(), 1);
        logger.debug("Vigil configuration validated successfully");
    }

    public void logConfiguration() {
        logger.info("Vigil configuration:");
        logger.info("  Gate mode: {} (state dir {})", getGateMode(), getGateStateDirectory());
        logger.info("  Gate capacities: scan-update={}, db-connections={}, report-processing={}",
                getScanUpdateCapacity(), getDbConnectionsCapacity(), getReportProcessingCapacity());
        logger.info("  Scanner connection retry: {}", getConnectionRetry());
        logger.info("  Poll interval: {}ms, retry delay: {}ms", getPollIntervalMs(), getRetryDelayMs());
        logger.info("  Scan queue: {} (max active handlers {})",
                isQueueEnabled() ? "enabled" : "disabled", getMaxActiveHandlers());
        logger.info("  Relay mapper: {}", isRelayMapperConfigured() ? getRelayMapperPath() : "none");
        logger.info("  Credential vault: {}", isVaultConfigured() ? getVaultBaseUrl() : "none");
    }

    private static void requireAtLeast(String key, long value, long min) {
        if (value < min) {
            throw new IllegalStateException("Invalid " + key + ": " + value + ". Must be at least " + min);
        }
    }

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private static String defaultGateStateDir() {
        return Paths.get(System.getProperty("java.io.tmpdir"), "vigil-gate").toString();
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(GATE_MODE, DEFAULT_GATE_MODE);
        properties.setProperty(GATE_STATE_DIR, defaultGateStateDir());
        properties.setProperty(GATE_SCAN_UPDATE_CAPACITY, String.valueOf(DEFAULT_GATE_CAPACITY));
        properties.setProperty(GATE_DB_CONNECTIONS_CAPACITY, String.valueOf(DEFAULT_GATE_CAPACITY));
        properties.setProperty(GATE_REPORT_PROCESSING_CAPACITY, String.valueOf(DEFAULT_GATE_CAPACITY));
        properties.setProperty(GATE_ACQUIRE_TIMEOUT_SECONDS, String.valueOf(DEFAULT_GATE_ACQUIRE_TIMEOUT_SECONDS));
        properties.setProperty(SCANNER_CONNECTION_RETRY, String.valueOf(DEFAULT_CONNECTION_RETRY));
        properties.setProperty(SCAN_POLL_INTERVAL_MS, String.valueOf(DEFAULT_POLL_INTERVAL_MS));
        properties.setProperty(SCAN_RETRY_DELAY_MS, String.valueOf(DEFAULT_RETRY_DELAY_MS));
        properties.setProperty(SCAN_MAX_CHECKS, String.valueOf(DEFAULT_MAX_CHECKS));
        properties.setProperty(SCAN_MAX_HOSTS, String.valueOf(DEFAULT_MAX_HOSTS));
        properties.setProperty(RELAY_MAPPER_PATH, "");
        properties.setProperty(RELAY_MAPPER_TIMEOUT_MS, String.valueOf(DEFAULT_RELAY_MAPPER_TIMEOUT_MS));
        properties.setProperty(QUEUE_ENABLED, "false");
        properties.setProperty(QUEUE_MAX_ACTIVE_HANDLERS, String.valueOf(DEFAULT_MAX_ACTIVE_HANDLERS));
        properties.setProperty(QUEUE_HANDLER_ACTIVE_TIME_SECONDS, String.valueOf(DEFAULT_HANDLER_ACTIVE_TIME_SECONDS));
        properties.setProperty(QUEUE_POLL_INTERVAL_MS, String.valueOf(DEFAULT_QUEUE_POLL_INTERVAL_MS));
        properties.setProperty(HANDLER_POOL_SIZE, String.valueOf(DEFAULT_HANDLER_POOL_SIZE));
        properties.setProperty(VAULT_BASE_URL, "");
        properties.setProperty(VAULT_APP_ID, "");
        properties.setProperty(VAULT_TIMEOUT_MS, String.valueOf(DEFAULT_VAULT_TIMEOUT_MS));
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "vigil.properties",
                "config/vigil.properties",
                System.getProperty("user.home") + "/.vigil/vigil.properties",
                "/etc/vigil/vigil.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("vigil.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("vigil."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}", entry.getKey());
                });
    }

    void loadConfigurationFromEnvironment(Map<String, String> environment) {
        for (String key : properties.stringPropertyNames()) {
            String envValue = environment.get(toEnvironmentName(key));
            if (envValue != null && !envValue.isEmpty()) {
                properties.setProperty(key, envValue);
                logger.debug("Override from environment: {}", toEnvironmentName(key));
            }
        }
    }

    static String toEnvironmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    @Override
    public String toString() {
        return "VigilConfiguration{" +
                "gateMode=" + getGateMode() +
                ", scanUpdateCapacity=" + getScanUpdateCapacity() +
                ", dbConnectionsCapacity=" + getDbConnectionsCapacity() +
                ", reportProcessingCapacity=" + getReportProcessingCapacity() +
                ", connectionRetry=" + getConnectionRetry() +
                ", pollIntervalMs=" + getPollIntervalMs() +
                ", queueEnabled=" + isQueueEnabled() +
                '}';
    }
}
