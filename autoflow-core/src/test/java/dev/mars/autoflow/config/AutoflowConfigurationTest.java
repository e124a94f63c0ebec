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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for AutoflowConfiguration.
 * Validates default values, overrides and type conversion fallbacks.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
class AutoflowConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(AutoflowConfiguration.WORKER_THREADS);
    }

    @Test
    void testDefaults() {
        AutoflowConfiguration config = AutoflowConfiguration.defaults();

        assertEquals(4, config.getWorkerThreads());
        assertEquals(3, config.getExecutionMaxRetries());
        assertEquals(Duration.ofMinutes(5), config.getDefaultNodeTimeout());
        assertEquals(Duration.ZERO, config.getNodeRetryBackoff());
        assertEquals(Duration.ofSeconds(5), config.getNodeTimeoutGrace());
        assertEquals(30, config.getAnalyticsDefaultRangeDays());
        assertEquals(5, config.getAnalyticsTopErrors());
        assertTrue(config.isMetricsEnabled());
    }

    @Test
    void testExplicitOverrides() {
        Properties overrides = new Properties();
        overrides.setProperty(AutoflowConfiguration.NODE_TIMEOUT_SECONDS, "2");
        overrides.setProperty(AutoflowConfiguration.METRICS_ENABLED, "false");

        AutoflowConfiguration config = new AutoflowConfiguration(overrides);

        assertEquals(Duration.ofSeconds(2), config.getDefaultNodeTimeout());
        assertFalse(config.isMetricsEnabled());
    }

    @Test
    void testInvalidNumberFallsBackToDefault() {
        Properties overrides = new Properties();
        overrides.setProperty(AutoflowConfiguration.WORKER_THREADS, "many");

        assertEquals(4, new AutoflowConfiguration(overrides).getWorkerThreads());
    }

    @Test
    void testWorkerThreadsNeverBelowOne() {
        Properties overrides = new Properties();
        overrides.setProperty(AutoflowConfiguration.WORKER_THREADS, "0");

        assertEquals(1, new AutoflowConfiguration(overrides).getWorkerThreads());
    }

    @Test
    void testSystemPropertyOverride() {
        System.setProperty(AutoflowConfiguration.WORKER_THREADS, "9");

        assertEquals(9, new AutoflowConfiguration().getWorkerThreads());
    }

    @Test
    void testClasspathFileIsLoaded() {
        AutoflowConfiguration config = new AutoflowConfiguration();

        assertEquals("60000", config.getProperty(AutoflowConfiguration.SCHEDULER_TICK_MS));
    }
}
