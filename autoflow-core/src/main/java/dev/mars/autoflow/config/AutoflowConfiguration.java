package dev.mars.autoflow.config;

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
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration management for the Autoflow engine.
 *
 * <p>Values are resolved from built-in defaults, then the first readable
 * {@code autoflow.properties} file (working directory, {@code config/},
 * {@code ~/.autoflow/}, classpath), then {@code autoflow.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class AutoflowConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(AutoflowConfiguration.class);

    private static final String PREFIX = "autoflow.";

    public static final String WORKER_THREADS = "autoflow.execution.worker.threads";
    public static final String WAKEUP_THREADS = "autoflow.execution.wakeup.threads";
    public static final String EXECUTION_MAX_RETRIES = "autoflow.execution.max.retries";
    public static final String SHUTDOWN_TIMEOUT_SECONDS = "autoflow.execution.shutdown.timeout.seconds";
    public static final String NODE_TIMEOUT_SECONDS = "autoflow.node.timeout.seconds";
    public static final String NODE_RETRY_BACKOFF_MS = "autoflow.node.retry.backoff.ms";
    public static final String NODE_TIMEOUT_GRACE_MS = "autoflow.node.timeout.grace.ms";
    public static final String LOOP_MAX_CONCURRENCY = "autoflow.loop.max.concurrency";
    public static final String SCHEDULER_TICK_MS = "autoflow.scheduler.tick.interval.ms";
    public static final String ANALYTICS_RANGE_DAYS = "autoflow.analytics.default.range.days";
    public static final String ANALYTICS_TOP_ERRORS = "autoflow.analytics.top.errors";
    public static final String METRICS_ENABLED = "autoflow.monitoring.metrics.enabled";

    private static final int DEFAULT_WORKER_THREADS = 4;
    private static final int DEFAULT_WAKEUP_THREADS = 1;
    private static final int DEFAULT_EXECUTION_MAX_RETRIES = 3;
    private static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 10;
    private static final long DEFAULT_NODE_TIMEOUT_SECONDS = 300; // 5 minutes
    private static final long DEFAULT_NODE_RETRY_BACKOFF_MS = 0;
    private static final long DEFAULT_NODE_TIMEOUT_GRACE_MS = 5000;
    private static final int DEFAULT_LOOP_MAX_CONCURRENCY = 8;
    private static final long DEFAULT_SCHEDULER_TICK_MS = 60000;
    private static final int DEFAULT_ANALYTICS_RANGE_DAYS = 30;
    private static final int DEFAULT_ANALYTICS_TOP_ERRORS = 5;

    private final Properties properties;

    public AutoflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public AutoflowConfiguration(Properties overrides) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (overrides != null) {
            this.properties.putAll(overrides);
        }
    }

    /**
     * Defaults only, ignoring files and system properties.
     */
    public static AutoflowConfiguration defaults() {
        return new AutoflowConfiguration(null);
    }

    // Execution
    public int getWorkerThreads() {
        return Math.max(1, getIntProperty(WORKER_THREADS, DEFAULT_WORKER_THREADS));
    }

    public int getWakeupThreads() {
        return Math.max(1, getIntProperty(WAKEUP_THREADS, DEFAULT_WAKEUP_THREADS));
    }

    public int getExecutionMaxRetries() {
        return Math.max(0, getIntProperty(EXECUTION_MAX_RETRIES, DEFAULT_EXECUTION_MAX_RETRIES));
    }

    public Duration getShutdownTimeout() {
        return Duration.ofSeconds(getLongProperty(SHUTDOWN_TIMEOUT_SECONDS, DEFAULT_SHUTDOWN_TIMEOUT_SECONDS));
    }

    // Nodes
    public Duration getDefaultNodeTimeout() {
        return Duration.ofSeconds(getLongProperty(NODE_TIMEOUT_SECONDS, DEFAULT_NODE_TIMEOUT_SECONDS));
    }

    /**
     * How long a timed-out node attempt may keep running before the next attempt starts.
     */
    public Duration getNodeTimeoutGrace() {
        return Duration.ofMillis(Math.max(0, getLongProperty(NODE_TIMEOUT_GRACE_MS, DEFAULT_NODE_TIMEOUT_GRACE_MS)));
    }

    public Duration getNodeRetryBackoff() {
        return Duration.ofMillis(Math.max(0, getLongProperty(NODE_RETRY_BACKOFF_MS, DEFAULT_NODE_RETRY_BACKOFF_MS)));
    }

    public int getLoopMaxConcurrency() {
        return Math.max(1, getIntProperty(LOOP_MAX_CONCURRENCY, DEFAULT_LOOP_MAX_CONCURRENCY));
    }

    // Scheduling
    public Duration getSchedulerTickInterval() {
        return Duration.ofMillis(Math.max(1, getLongProperty(SCHEDULER_TICK_MS, DEFAULT_SCHEDULER_TICK_MS)));
    }

    // Analytics
    public int getAnalyticsDefaultRangeDays() {
        return Math.max(1, getIntProperty(ANALYTICS_RANGE_DAYS, DEFAULT_ANALYTICS_RANGE_DAYS));
    }

    public int getAnalyticsTopErrors() {
        return Math.max(1, getIntProperty(ANALYTICS_TOP_ERRORS, DEFAULT_ANALYTICS_TOP_ERRORS));
    }

    // Monitoring
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
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
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
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

    private void loadDefaultConfiguration() {
        properties.setProperty(WORKER_THREADS, String.valueOf(DEFAULT_WORKER_THREADS));
        properties.setProperty(WAKEUP_THREADS, String.valueOf(DEFAULT_WAKEUP_THREADS));
        properties.setProperty(EXECUTION_MAX_RETRIES, String.valueOf(DEFAULT_EXECUTION_MAX_RETRIES));
        properties.setProperty(SHUTDOWN_TIMEOUT_SECONDS, String.valueOf(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS));
        properties.setProperty(NODE_TIMEOUT_SECONDS, String.valueOf(DEFAULT_NODE_TIMEOUT_SECONDS));
        properties.setProperty(NODE_RETRY_BACKOFF_MS, String.valueOf(DEFAULT_NODE_RETRY_BACKOFF_MS));
        properties.setProperty(NODE_TIMEOUT_GRACE_MS, String.valueOf(DEFAULT_NODE_TIMEOUT_GRACE_MS));
        properties.setProperty(LOOP_MAX_CONCURRENCY, String.valueOf(DEFAULT_LOOP_MAX_CONCURRENCY));
        properties.setProperty(SCHEDULER_TICK_MS, String.valueOf(DEFAULT_SCHEDULER_TICK_MS));
        properties.setProperty(ANALYTICS_RANGE_DAYS, String.valueOf(DEFAULT_ANALYTICS_RANGE_DAYS));
        properties.setProperty(ANALYTICS_TOP_ERRORS, String.valueOf(DEFAULT_ANALYTICS_TOP_ERRORS));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "autoflow.properties",
                "config/autoflow.properties",
                System.getProperty("user.home") + "/.autoflow/autoflow.properties"
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

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("autoflow.properties")) {
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
                .filter(entry -> entry.getKey().toString().startsWith(PREFIX))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "AutoflowConfiguration{" +
                "workerThreads=" + getWorkerThreads() +
                ", executionMaxRetries=" + getExecutionMaxRetries() +
                ", defaultNodeTimeout=" + getDefaultNodeTimeout() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
