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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.mars.ghaverify.core.VerificationMode;
import dev.mars.ghaverify.logical.LogicalResult;
import dev.mars.ghaverify.structural.StructuralResult;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable verdict for one original/modified file pair.
 *
 * <p>{@code is_safe} holds exactly when the status is {@link VerificationStatus#SAFE}. The
 * structural and logical parts are present only when the mode ran them and parsing succeeded;
 * {@code error} is present only for {@link VerificationStatus#ERROR}.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * VerificationVerdict verdict = VerificationVerdict.builder()
 *     .pairId("ci.yml")
 *     .status(VerificationStatus.SAFE)
 *     .mode(VerificationMode.HYBRID)
 *     .confidence(1.0)
 *     .structural(structuralResult)
 *     .logical(logicalResult)
 *     .elapsed(Duration.ofMillis(42))
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@JsonPropertyOrder({"pair_id", "status", "is_safe", "confidence", "mode", "structural", "logical",
        "failure_reasons", "error", "elapsed_ms"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class VerificationVerdict {

    private final String pairId;
    private final VerificationStatus status;
    private final double confidence;
    private final VerificationMode mode;
    private final StructuralResult structural;
    private final LogicalResult logical;
    private final List<String> failureReasons;
    private final String error;
    private final Duration elapsed;

    private VerificationVerdict(Builder builder) {
        this.pairId = Objects.requireNonNull(builder.pairId, "Pair ID cannot be null");
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        this.mode = Objects.requireNonNull(builder.mode, "Mode cannot be null");
        this.confidence = builder.confidence;
        this.structural = builder.structural;
        this.logical = builder.logical;
        this.failureReasons = List.copyOf(builder.failureReasons);
        this.error = builder.error;
        this.elapsed = builder.elapsed != null ? builder.elapsed : Duration.ZERO;
    }

    @JsonProperty("pair_id")
    public String getPairId() { return pairId; }

    @JsonProperty("status")
    public VerificationStatus getStatus() { return status; }

    @JsonProperty("is_safe")
    public boolean isSafe() {
        return status == VerificationStatus.SAFE;
    }

    @JsonProperty("confidence")
    public double getConfidence() { return confidence; }

    @JsonProperty("mode")
    public VerificationMode getMode() { return mode; }

    @JsonProperty("structural")
    public StructuralResult getStructural() { return structural; }

    @JsonProperty("logical")
    public LogicalResult getLogical() { return logical; }

    @JsonProperty("failure_reasons")
    public List<String> getFailureReasons() { return failureReasons; }

    @JsonProperty("error")
    public String getError() { return error; }

    @JsonIgnore
    public Duration getElapsed() { return elapsed; }

    @JsonProperty("elapsed_ms")
    public long getElapsedMillis() {
        return elapsed.toMillis();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String pairId;
        private VerificationStatus status;
        private double confidence;
        private VerificationMode mode;
        private StructuralResult structural;
        private LogicalResult logical;
        private List<String> failureReasons = List.of();
        private String error;
        private Duration elapsed;

        public Builder pairId(String pairId) {
            this.pairId = pairId;
            return this;
        }

        public Builder status(VerificationStatus status) {
            this.status = status;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder mode(VerificationMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder structural(StructuralResult structural) {
            this.structural = structural;
            return this;
        }

        public Builder logical(LogicalResult logical) {
            this.logical = logical;
            return this;
        }

        public Builder failureReasons(List<String> failureReasons) {
            this.failureReasons = Objects.requireNonNull(failureReasons, "Failure reasons cannot be null");
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder elapsed(Duration elapsed) {
            this.elapsed = elapsed;
            return this;
        }

        public VerificationVerdict build() {
            return new VerificationVerdict(this);
        }
    }

    /**
     * Equality ignores the elapsed time, so repeated runs over the same input compare equal.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VerificationVerdict that = (VerificationVerdict) o;
        return Double.compare(that.confidence, confidence) == 0
                && pairId.equals(that.pairId)
                && status == that.status
                && mode == that.mode
                && Objects.equals(structural, that.structural)
                && Objects.equals(logical, that.logical)
                && failureReasons.equals(that.failureReasons)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pairId, status, confidence, mode, structural, logical, failureReasons, error);
    }

    @Override
    public String toString() {
        return "VerificationVerdict{" +
                "pairId='" + pairId + '\'' +
                ", status=" + status +
                ", confidence=" + confidence +
                ", mode=" + mode +
                (error != null ? ", error='" + error + '\'' : "") +
                ", elapsed=" + elapsed.toMillis() + "ms" +
                '}';
    }
}
