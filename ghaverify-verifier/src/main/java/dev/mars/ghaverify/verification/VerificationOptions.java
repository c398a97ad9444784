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

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable settings for one verification: which fixes are permitted, the mode, the solver
 * timeout and the confidence weighting.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * VerificationOptions options = VerificationOptions.builder()
 *     .mode(VerificationMode.HYBRID)
 *     .permittedFixes(EnumSet.of(FixTag.PERMISSIONS, FixTag.TIMEOUT))
 *     .solverTimeout(Duration.ofSeconds(5))
 *     .build();
 * options.validate();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class VerificationOptions {

    public static final Duration DEFAULT_SOLVER_TIMEOUT = Duration.ofMillis(5000);
    public static final double DEFAULT_STRUCTURAL_WEIGHT = 0.6;
    public static final double DEFAULT_LOGICAL_WEIGHT = 0.4;
    public static final double DEFAULT_UNSUPPORTED_PENALTY = 0.1;

    private final Set<FixTag> permittedFixes;
    private final boolean strictMode;
    private final VerificationMode mode;
    private final Duration solverTimeout;
    private final double structuralWeight;
    private final double logicalWeight;
    private final double unsupportedClausePenalty;

    private VerificationOptions(Builder builder) {
        this.permittedFixes = builder.permittedFixes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.permittedFixes));
        this.strictMode = builder.strictMode;
        this.mode = Objects.requireNonNull(builder.mode, "Mode cannot be null");
        this.solverTimeout = Objects.requireNonNull(builder.solverTimeout, "Solver timeout cannot be null");
        this.structuralWeight = builder.structuralWeight;
        this.logicalWeight = builder.logicalWeight;
        this.unsupportedClausePenalty = builder.unsupportedClausePenalty;
    }

    public static VerificationOptions defaults() {
        return builder().build();
    }

    /**
     * Reads the options from configuration and validates them.
     */
    public static VerificationOptions fromConfiguration(VerifierConfiguration configuration) throws ConfigurationException {
        VerificationOptions options = builder()
                .mode(VerificationMode.parse(configuration.getMode()))
                .strictMode(configuration.isStrictMode())
                .permittedFixes(FixTag.parseList(configuration.getPermittedFixes()))
                .solverTimeout(Duration.ofMillis(configuration.getSolverTimeoutMs()))
                .structuralWeight(configuration.getStructuralWeight())
                .logicalWeight(configuration.getLogicalWeight())
                .unsupportedClausePenalty(configuration.getUnsupportedClausePenalty())
                .build();
        options.validate();
        return options;
    }

    /**
     * Rejects settings that cannot produce a meaningful verdict.
     *
     * @throws ConfigurationException naming the offending setting
     */
    public void validate() throws ConfigurationException {
        if (solverTimeout.isZero() || solverTimeout.isNegative()) {
            throw new ConfigurationException(VerifierConfiguration.SOLVER_TIMEOUT_MS,
                    "Solver timeout must be positive but was " + solverTimeout.toMillis() + " ms");
        }
        if (structuralWeight < 0) {
            throw new ConfigurationException(VerifierConfiguration.STRUCTURAL_WEIGHT, "Weight cannot be negative");
        }
        if (logicalWeight < 0) {
            throw new ConfigurationException(VerifierConfiguration.LOGICAL_WEIGHT, "Weight cannot be negative");
        }
        if (structuralWeight + logicalWeight <= 0) {
            throw new ConfigurationException(VerifierConfiguration.STRUCTURAL_WEIGHT,
                    "Structural and logical weights must not both be zero");
        }
        if (unsupportedClausePenalty < 0 || unsupportedClausePenalty > 1) {
            throw new ConfigurationException(VerifierConfiguration.UNSUPPORTED_PENALTY,
                    "Penalty must be between 0 and 1 but was " + unsupportedClausePenalty);
        }
    }

    /**
     * Fixes that actually enable deltas. Strict mode ignores all of them.
     */
    public Set<FixTag> getEffectiveFixes() {
        return strictMode ? Collections.emptySet() : permittedFixes;
    }

    public Set<FixTag> getPermittedFixes() { return permittedFixes; }

    public boolean isStrictMode() { return strictMode; }

    public VerificationMode getMode() { return mode; }

    public Duration getSolverTimeout() { return solverTimeout; }

    public double getStructuralWeight() { return structuralWeight; }

    public double getLogicalWeight() { return logicalWeight; }

    public double getUnsupportedClausePenalty() { return unsupportedClausePenalty; }

    public Builder toBuilder() {
        return builder()
                .permittedFixes(permittedFixes)
                .strictMode(strictMode)
                .mode(mode)
                .solverTimeout(solverTimeout)
                .structuralWeight(structuralWeight)
                .logicalWeight(logicalWeight)
                .unsupportedClausePenalty(unsupportedClausePenalty);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Set<FixTag> permittedFixes = Collections.emptySet();
        private boolean strictMode;
        private VerificationMode mode = VerificationMode.HYBRID;
        private Duration solverTimeout = DEFAULT_SOLVER_TIMEOUT;
        private double structuralWeight = DEFAULT_STRUCTURAL_WEIGHT;
        private double logicalWeight = DEFAULT_LOGICAL_WEIGHT;
        private double unsupportedClausePenalty = DEFAULT_UNSUPPORTED_PENALTY;

        public Builder permittedFixes(Set<FixTag> permittedFixes) {
            this.permittedFixes = Objects.requireNonNull(permittedFixes, "Permitted fixes cannot be null");
            return this;
        }

        public Builder strictMode(boolean strictMode) {
            this.strictMode = strictMode;
            return this;
        }

        public Builder mode(VerificationMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder solverTimeout(Duration solverTimeout) {
            this.solverTimeout = solverTimeout;
            return this;
        }

        public Builder structuralWeight(double structuralWeight) {
            this.structuralWeight = structuralWeight;
            return this;
        }

        public Builder logicalWeight(double logicalWeight) {
            this.logicalWeight = logicalWeight;
            return this;
        }

        public Builder unsupportedClausePenalty(double unsupportedClausePenalty) {
            this.unsupportedClausePenalty = unsupportedClausePenalty;
            return this;
        }

        public VerificationOptions build() {
            return new VerificationOptions(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VerificationOptions that = (VerificationOptions) o;
        return strictMode == that.strictMode
                && Double.compare(that.structuralWeight, structuralWeight) == 0
                && Double.compare(that.logicalWeight, logicalWeight) == 0
                && Double.compare(that.unsupportedClausePenalty, unsupportedClausePenalty) == 0
                && permittedFixes.equals(that.permittedFixes)
                && mode == that.mode
                && solverTimeout.equals(that.solverTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(permittedFixes, strictMode, mode, solverTimeout,
                structuralWeight, logicalWeight, unsupportedClausePenalty);
    }

    @Override
    public String toString() {
        return "VerificationOptions{" +
                "mode=" + mode +
                ", strict=" + strictMode +
                ", fixes=" + permittedFixes +
                ", timeout=" + solverTimeout.toMillis() + "ms" +
                ", weights=" + structuralWeight + "/" + logicalWeight +
                '}';
    }
}
