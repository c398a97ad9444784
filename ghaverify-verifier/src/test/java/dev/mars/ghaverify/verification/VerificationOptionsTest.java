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

package dev.mars.ghaverify.verification;

import dev.mars.ghaverify.config.VerifierConfiguration;
import dev.mars.ghaverify.core.FixTag;
import dev.mars.ghaverify.core.VerificationMode;
import dev.mars.ghaverify.core.exceptions.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class VerificationOptionsTest {

    @Test
    void testDefaults() {
        VerificationOptions options = VerificationOptions.defaults();

        assertEquals(VerificationMode.HYBRID, options.getMode());
        assertFalse(options.isStrictMode());
        assertTrue(options.getPermittedFixes().isEmpty());
        assertEquals(Duration.ofMillis(5000), options.getSolverTimeout());
        assertEquals(0.6, options.getStructuralWeight());
        assertEquals(0.4, options.getLogicalWeight());
    }

    @Test
    void testFromConfiguration() throws ConfigurationException {
        Properties properties = new Properties();
        properties.setProperty(VerifierConfiguration.MODE, "logical");
        properties.setProperty(VerifierConfiguration.PERMITTED_FIXES, "smell_3, timeout");
        properties.setProperty(VerifierConfiguration.SOLVER_TIMEOUT_MS, "250");

        VerificationOptions options = VerificationOptions.fromConfiguration(new VerifierConfiguration(properties));

        assertEquals(VerificationMode.LOGICAL, options.getMode());
        assertEquals(EnumSet.of(FixTag.PERMISSIONS, FixTag.TIMEOUT), options.getPermittedFixes());
        assertEquals(Duration.ofMillis(250), options.getSolverTimeout());
    }

    @Test
    void testInvalidConfiguration() {
        Properties properties = new Properties();
        properties.setProperty(VerifierConfiguration.SOLVER_TIMEOUT_MS, "0");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> VerificationOptions.fromConfiguration(new VerifierConfiguration(properties)));

        assertEquals(VerifierConfiguration.SOLVER_TIMEOUT_MS, e.getPropertyName());
    }

    @Test
    void testWeightsMustNotBothBeZero() {
        VerificationOptions options = VerificationOptions.builder().structuralWeight(0).logicalWeight(0).build();

        assertThrows(ConfigurationException.class, options::validate);
    }

    @Test
    void testStrictModeIgnoresFixes() {
        VerificationOptions options = VerificationOptions.builder()
                .permittedFixes(EnumSet.of(FixTag.PERMISSIONS))
                .strictMode(true)
                .build();

        assertEquals(EnumSet.of(FixTag.PERMISSIONS), options.getPermittedFixes());
        assertTrue(options.getEffectiveFixes().isEmpty());
    }

    @Test
    void testToBuilderCopies() {
        VerificationOptions options = VerificationOptions.builder().mode(VerificationMode.STRUCTURAL).build();

        assertEquals(options, options.toBuilder().build());
        assertNotEquals(options, options.toBuilder().strictMode(true).build());
    }
}
