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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration management for the workflow verifier.
 * Handles loading and providing access to verification parameters.
 *
 * <p>Values are resolved in this order, later sources overriding earlier ones:
 * built-in defaults, the first {@code ghaverify.properties} found on disk or on the
 * classpath, then system properties starting with {@code ghaverify.}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class VerifierConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(VerifierConfiguration.class);

    public static final String MODE = "ghaverify.verification.mode";
    public static final String STRICT = "ghaverify.verification.strict";
    public static final String PERMITTED_FIXES = "ghaverify.verification.permitted-fixes";
    public static final String SOLVER_TIMEOUT_MS = "ghaverify.solver.timeout.ms";
    public static final String STRUCTURAL_WEIGHT = "ghaverify.confidence.structural.weight";
    public static final String LOGICAL_WEIGHT = "ghaverify.confidence.logical.weight";
    public static final String UNSUPPORTED_PENALTY = "ghaverify.confidence.unsupported.penalty";
    public static final String BATCH_PARALLELISM = "ghaverify.batch.parallelism";
    public static final String BATCH_MAX_FILES = "ghaverify.batch.max-files";
    public static final String REWRITE_TABLE = "ghaverify.structural.rewrite-table";
    public static final String READ_RETRIES = "ghaverify.io.read.retries";

    private static final String CONFIG_FILE = "ghaverify.properties";

    // Default configuration values
    private static final String DEFAULT_MODE = "hybrid";
    private static final long DEFAULT_SOLVER_TIMEOUT_MS = 5000;
    private static final double DEFAULT_STRUCTURAL_WEIGHT = 0.6;
    private static final double DEFAULT_LOGICAL_WEIGHT = 0.4;
    private static final double DEFAULT_UNSUPPORTED_PENALTY = 0.1;
    private static final int DEFAULT_BATCH_PARALLELISM = 1;
    private static final int DEFAULT_READ_RETRIES = 1;

    private final Properties properties;

    public VerifierConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public VerifierConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Verification
    public String getMode() {
        return getStringProperty(MODE, DEFAULT_MODE);
    }

    public boolean isStrictMode() {
        return getBooleanProperty(STRICT, false);
    }

    public String getPermittedFixes() {
        return getStringProperty(PERMITTED_FIXES, "");
    }

    // Solver
    public long getSolverTimeoutMs() {
        return getLongProperty(SOLVER_TIMEOUT_MS, DEFAULT_SOLVER_TIMEOUT_MS);
    }

    // Confidence scoring
    public double getStructuralWeight() {
        return getDoubleProperty(STRUCTURAL_WEIGHT, DEFAULT_STRUCTURAL_WEIGHT);
    }

    public double getLogicalWeight() {
        return getDoubleProperty(LOGICAL_WEIGHT, DEFAULT_LOGICAL_WEIGHT);
    }

    public double getUnsupportedClausePenalty() {
        return getDoubleProperty(UNSUPPORTED_PENALTY, DEFAULT_UNSUPPORTED_PENALTY);
    }

    // Batch
    public int getBatchParallelism() {
        return getIntProperty(BATCH_PARALLELISM, DEFAULT_BATCH_PARALLELISM);
    }

    public int getBatchMaxFiles() {
        return getIntProperty(BATCH_MAX_FILES, 0);
    }

    public int getReadRetries() {
        return getIntProperty(READ_RETRIES, DEFAULT_READ_RETRIES);
    }

    /**
     * Location of an external run-command rewrite table, or null for the bundled one.
     */
    public String getRewriteTableLocation() {
        String value = properties.getProperty(REWRITE_TABLE);
        return value == null || value.isBlank() ? null : value.trim();
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

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
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

    private double getDoubleProperty(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid decimal value for property {}: {}. Using default: {}", key, value, defaultValue);
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
        properties.setProperty(MODE, DEFAULT_MODE);
        properties.setProperty(STRICT, "false");
        properties.setProperty(PERMITTED_FIXES, "");
        properties.setProperty(SOLVER_TIMEOUT_MS, String.valueOf(DEFAULT_SOLVER_TIMEOUT_MS));
        properties.setProperty(STRUCTURAL_WEIGHT, String.valueOf(DEFAULT_STRUCTURAL_WEIGHT));
        properties.setProperty(LOGICAL_WEIGHT, String.valueOf(DEFAULT_LOGICAL_WEIGHT));
        properties.setProperty(UNSUPPORTED_PENALTY, String.valueOf(DEFAULT_UNSUPPORTED_PENALTY));
        properties.setProperty(BATCH_PARALLELISM, String.valueOf(DEFAULT_BATCH_PARALLELISM));
        properties.setProperty(BATCH_MAX_FILES, "0");
        properties.setProperty(READ_RETRIES, String.valueOf(DEFAULT_READ_RETRIES));
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                CONFIG_FILE,
                "config/" + CONFIG_FILE,
                System.getProperty("user.home") + "/.ghaverify/" + CONFIG_FILE
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

        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
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
                .filter(entry -> entry.getKey().toString().startsWith("ghaverify."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "VerifierConfiguration{" +
                "mode='" + getMode() + '\'' +
                ", strict=" + isStrictMode() +
                ", permittedFixes='" + getPermittedFixes() + '\'' +
                ", solverTimeoutMs=" + getSolverTimeoutMs() +
                ", parallelism=" + getBatchParallelism() +
                '}';
    }
}
