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

package dev.mars.ghaverify.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
/**
 * Tests for VerifierConfiguration
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */

class VerifierConfigurationTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(VerifierConfiguration.SOLVER_TIMEOUT_MS);
    }

    @Test
    @DisplayName("Should expose defaults")
    void testDefaults() {
        VerifierConfiguration config = new VerifierConfiguration(new Properties());

        assertEquals("hybrid", config.getMode());
        assertFalse(config.isStrictMode());
        assertEquals("", config.getPermittedFixes());
        assertEquals(5000, config.getSolverTimeoutMs());
        assertEquals(0.6, config.getStructuralWeight(), 1e-9);
        assertEquals(0.4, config.getLogicalWeight(), 1e-9);
        assertEquals(0.1, config.getUnsupportedClausePenalty(), 1e-9);
        assertEquals(1, config.getBatchParallelism());
        assertEquals(0, config.getBatchMaxFiles());
        assertEquals(1, config.getReadRetries());
        assertNull(config.getRewriteTableLocation());
    }

    @Test
    @DisplayName("Should apply supplied properties over defaults")
    void testOverrides() {
        Properties properties = new Properties();
        properties.setProperty(VerifierConfiguration.MODE, "structural");
        properties.setProperty(VerifierConfiguration.STRICT, "true");
        properties.setProperty(VerifierConfiguration.PERMITTED_FIXES, "permissions,timeout");
        properties.setProperty(VerifierConfiguration.BATCH_PARALLELISM, "4");
        properties.setProperty(VerifierConfiguration.REWRITE_TABLE, " /etc/rewrites.yaml ");

        VerifierConfiguration config = new VerifierConfiguration(properties);

        assertEquals("structural", config.getMode());
        assertTrue(config.isStrictMode());
        assertEquals("permissions,timeout", config.getPermittedFixes());
        assertEquals(4, config.getBatchParallelism());
        assertEquals("/etc/rewrites.yaml", config.getRewriteTableLocation());
    }

    @Test
    @DisplayName("Should fall back to defaults for malformed numbers")
    void testMalformedNumbers() {
        Properties properties = new Properties();
        properties.setProperty(VerifierConfiguration.SOLVER_TIMEOUT_MS, "soon");
        properties.setProperty(VerifierConfiguration.STRUCTURAL_WEIGHT, "heavy");

        VerifierConfiguration config = new VerifierConfiguration(properties);

        assertEquals(5000, config.getSolverTimeoutMs());
        assertEquals(0.6, config.getStructuralWeight(), 1e-9);
    }

    @Test
    @DisplayName("System properties should override loaded values")
    void testSystemPropertyOverride() {
        System.setProperty(VerifierConfiguration.SOLVER_TIMEOUT_MS, "1234");

        VerifierConfiguration config = new VerifierConfiguration();

        assertEquals(1234, config.getSolverTimeoutMs());
    }
}
