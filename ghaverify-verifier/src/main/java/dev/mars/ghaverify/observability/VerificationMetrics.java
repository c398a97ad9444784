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

package dev.mars.ghaverify.observability;

import dev.mars.ghaverify.structural.StructuralIssue;
import dev.mars.ghaverify.verification.VerificationVerdict;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for workflow verification.
 *
 * Provides:
 * - ghaverify.verification.total (counter) - Verdicts by status and mode
 * - ghaverify.verification.duration.seconds (histogram) - Time per file pair
 * - ghaverify.verification.confidence (histogram) - Confidence distribution
 * - ghaverify.structural.issues (counter) - Critical structural issues by kind
 * - ghaverify.logical.unsupported_clauses (counter) - Clauses abstracted to opaque atoms
 * - ghaverify.verification.active (gauge) - Verifications in progress
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0 (OpenTelemetry)
 */
public class VerificationMetrics {

    private static final Logger logger = LoggerFactory.getLogger(VerificationMetrics.class);
    public static final String METER_NAME = "ghaverify-verifier";

    private final LongCounter verdictsTotal;
    private final LongCounter structuralIssues;
    private final LongCounter unsupportedClauses;

    private final DoubleHistogram verificationDuration;
    private final DoubleHistogram confidence;

    private final AtomicLong activeVerifications = new AtomicLong(0);

    private static final AttributeKey<String> STATUS_KEY = AttributeKey.stringKey("verification.status");
    private static final AttributeKey<String> MODE_KEY = AttributeKey.stringKey("verification.mode");
    private static final AttributeKey<String> ISSUE_KIND_KEY = AttributeKey.stringKey("issue.kind");

    public VerificationMetrics(Meter meter) {
        Objects.requireNonNull(meter, "Meter cannot be null");

        verdictsTotal = meter.counterBuilder("ghaverify.verification.total")
                .setDescription("Number of file pairs verified, by verdict status")
                .setUnit("1")
                .build();

        structuralIssues = meter.counterBuilder("ghaverify.structural.issues")
                .setDescription("Number of critical structural issues found")
                .setUnit("1")
                .build();

        unsupportedClauses = meter.counterBuilder("ghaverify.logical.unsupported_clauses")
                .setDescription("Number of condition clauses treated as unconstrained")
                .setUnit("1")
                .build();

        verificationDuration = meter.histogramBuilder("ghaverify.verification.duration.seconds")
                .setDescription("Verification duration per file pair in seconds")
                .setUnit("s")
                .build();

        confidence = meter.histogramBuilder("ghaverify.verification.confidence")
                .setDescription("Confidence of verification verdicts")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("ghaverify.verification.active")
                .setDescription("Number of verifications in progress")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeVerifications.get()));

        logger.debug("VerificationMetrics initialized");
    }

    /**
     * Metrics reported through the globally registered OpenTelemetry instance.
     */
    public static VerificationMetrics global() {
        return new VerificationMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
    }

    public static VerificationMetrics noop() {
        return new VerificationMetrics(OpenTelemetry.noop().getMeter(METER_NAME));
    }

    public void recordStarted() {
        activeVerifications.incrementAndGet();
    }

    /**
     * Record a finished verification. Pairs with {@link #recordStarted()}.
     */
    public void recordVerdict(VerificationVerdict verdict) {
        activeVerifications.decrementAndGet();

        Attributes attrs = Attributes.builder()
                .put(STATUS_KEY, verdict.getStatus().name())
                .put(MODE_KEY, verdict.getMode().name())
                .build();

        verdictsTotal.add(1, attrs);
        verificationDuration.record(verdict.getElapsed().toNanos() / 1_000_000_000.0, attrs);
        confidence.record(verdict.getConfidence(), attrs);

        if (verdict.getStructural() != null) {
            for (StructuralIssue issue : verdict.getStructural().getCriticalIssues()) {
                structuralIssues.add(1, Attributes.of(ISSUE_KIND_KEY, issue.kind().name()));
            }
        }
        if (verdict.getLogical() != null && !verdict.getLogical().getUnsupportedClauses().isEmpty()) {
            unsupportedClauses.add(verdict.getLogical().getUnsupportedClauses().size());
        }
    }

    public long getActiveVerifications() {
        return activeVerifications.get();
    }
}
