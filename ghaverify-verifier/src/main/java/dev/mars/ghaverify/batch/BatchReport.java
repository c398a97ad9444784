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

package dev.mars.ghaverify.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.mars.ghaverify.logical.DomainOutcome;
import dev.mars.ghaverify.logical.DomainResult;
import dev.mars.ghaverify.logical.LogicalResult;
import dev.mars.ghaverify.logical.LogicalStatus;
import dev.mars.ghaverify.structural.StructuralIssue;
import dev.mars.ghaverify.verification.VerificationStatus;
import dev.mars.ghaverify.verification.VerificationVerdict;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Aggregated outcome of a batch run.
 *
 * <p>Pairs that ended in {@link VerificationStatus#ERROR} are counted apart from unsafe ones and
 * are not part of the verified count; the safety rate is safe over verified. Pairs that never ran
 * because the batch was cancelled are counted as skipped.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@JsonPropertyOrder({"timestamp", "configuration", "statistics", "details", "file_results"})
public final class BatchReport {

    @JsonPropertyOrder({"total_files", "verified_files", "safe_files", "unsafe_files", "inconclusive_files",
            "error_files", "skipped_files", "safety_rate", "average_confidence", "elapsed_seconds", "cancelled"})
    public record Statistics(
            @JsonProperty("total_files") int totalFiles,
            @JsonProperty("verified_files") int verifiedFiles,
            @JsonProperty("safe_files") int safeFiles,
            @JsonProperty("unsafe_files") int unsafeFiles,
            @JsonProperty("inconclusive_files") int inconclusiveFiles,
            @JsonProperty("error_files") int errorFiles,
            @JsonProperty("skipped_files") int skippedFiles,
            @JsonProperty("safety_rate") double safetyRate,
            @JsonProperty("average_confidence") double averageConfidence,
            @JsonProperty("elapsed_seconds") double elapsedSeconds,
            @JsonProperty("cancelled") boolean cancelled) {
    }

    /**
     * Counts per verifier and per logical domain, plus the hybrid agreement breakdown.
     */
    @JsonPropertyOrder({"structural_safe", "structural_unsafe", "logical_safe", "logical_unsafe",
            "logical_inconclusive", "domain_failures", "issue_kinds", "both_safe", "both_unsafe", "mixed_results"})
    public record Details(
            @JsonProperty("structural_safe") int structuralSafe,
            @JsonProperty("structural_unsafe") int structuralUnsafe,
            @JsonProperty("logical_safe") int logicalSafe,
            @JsonProperty("logical_unsafe") int logicalUnsafe,
            @JsonProperty("logical_inconclusive") int logicalInconclusive,
            @JsonProperty("domain_failures") Map<String, Map<String, Integer>> domainFailures,
            @JsonProperty("issue_kinds") Map<String, Integer> issueKinds,
            @JsonProperty("both_safe") int bothSafe,
            @JsonProperty("both_unsafe") int bothUnsafe,
            @JsonProperty("mixed_results") int mixedResults) {
    }

    private final Instant timestamp;
    private final Map<String, Object> configuration;
    private final Statistics statistics;
    private final Details details;
    private final List<VerificationVerdict> fileResults;

    private BatchReport(Instant timestamp, Map<String, Object> configuration, Statistics statistics,
                        Details details, List<VerificationVerdict> fileResults) {
        this.timestamp = timestamp;
        this.configuration = configuration;
        this.statistics = statistics;
        this.details = details;
        this.fileResults = fileResults;
    }

    /**
     * Aggregates the verdicts of a run.
     *
     * @param totalPairs number of pairs the run was started with, including those never verified
     */
    public static BatchReport summarize(Instant timestamp, Map<String, Object> configuration,
                                        List<VerificationVerdict> verdicts, int totalPairs,
                                        Duration elapsed, boolean cancelled) {
        Objects.requireNonNull(verdicts, "Verdicts cannot be null");

        int safe = 0;
        int unsafe = 0;
        int inconclusive = 0;
        int errors = 0;
        double confidenceSum = 0.0;

        int structuralSafe = 0;
        int structuralUnsafe = 0;
        int logicalSafe = 0;
        int logicalUnsafe = 0;
        int logicalInconclusive = 0;
        int bothSafe = 0;
        int bothUnsafe = 0;
        int mixed = 0;

        Map<String, Map<String, Integer>> domainFailures = new LinkedHashMap<>();
        for (String domain : List.of(DomainResult.TRIGGER, DomainResult.IF, DomainResult.CONCURRENCY)) {
            Map<String, Integer> counts = new LinkedHashMap<>();
            counts.put(DomainOutcome.NOT_EQUIVALENT.name().toLowerCase(Locale.ROOT), 0);
            counts.put(DomainOutcome.INCONCLUSIVE.name().toLowerCase(Locale.ROOT), 0);
            domainFailures.put(domain, counts);
        }
        Map<String, Integer> issueKinds = new TreeMap<>();

        for (VerificationVerdict verdict : verdicts) {
            switch (verdict.getStatus()) {
                case SAFE:
                    safe++;
                    break;
                case UNSAFE:
                    unsafe++;
                    break;
                case INCONCLUSIVE:
                    inconclusive++;
                    break;
                default:
                    errors++;
                    continue;
            }
            confidenceSum += verdict.getConfidence();

            Boolean structuralOk = null;
            if (verdict.getStructural() != null) {
                structuralOk = verdict.getStructural().isSafe();
                if (structuralOk) {
                    structuralSafe++;
                } else {
                    structuralUnsafe++;
                }
                for (StructuralIssue issue : verdict.getStructural().getCriticalIssues()) {
                    issueKinds.merge(issue.kind().name(), 1, Integer::sum);
                }
            }

            Boolean logicalOk = null;
            LogicalResult logical = verdict.getLogical();
            if (logical != null) {
                logicalOk = logical.isSafe();
                if (logical.getStatus() == LogicalStatus.SAFE) {
                    logicalSafe++;
                } else if (logical.getStatus() == LogicalStatus.UNSAFE) {
                    logicalUnsafe++;
                } else {
                    logicalInconclusive++;
                }
                for (DomainResult domain : logical.getPerDomain().values()) {
                    DomainOutcome outcome = domain.getOutcome();
                    if (!outcome.isAcceptable()) {
                        domainFailures.get(domain.getDomain()).merge(outcome.name().toLowerCase(Locale.ROOT), 1, Integer::sum);
                    }
                }
            }

            if (structuralOk != null && logicalOk != null) {
                if (structuralOk && logicalOk) {
                    bothSafe++;
                } else if (!structuralOk && !logicalOk) {
                    bothUnsafe++;
                } else {
                    mixed++;
                }
            }
        }

        int verified = safe + unsafe + inconclusive;
        Statistics statistics = new Statistics(
                totalPairs,
                verified,
                safe,
                unsafe,
                inconclusive,
                errors,
                Math.max(0, totalPairs - verdicts.size()),
                verified > 0 ? (double) safe / verified : 0.0,
                verified > 0 ? confidenceSum / verified : 0.0,
                elapsed.toMillis() / 1000.0,
                cancelled);

        Details details = new Details(structuralSafe, structuralUnsafe, logicalSafe, logicalUnsafe,
                logicalInconclusive, domainFailures, issueKinds, bothSafe, bothUnsafe, mixed);

        return new BatchReport(timestamp,
                Collections.unmodifiableMap(new LinkedHashMap<>(configuration)),
                statistics,
                details,
                List.copyOf(verdicts));
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() { return timestamp; }

    @JsonProperty("configuration")
    public Map<String, Object> getConfiguration() { return configuration; }

    @JsonProperty("statistics")
    public Statistics getStatistics() { return statistics; }

    @JsonProperty("details")
    public Details getDetails() { return details; }

    @JsonProperty("file_results")
    public List<VerificationVerdict> getFileResults() { return fileResults; }

    @Override
    public String toString() {
        return "BatchReport{" +
                "total=" + statistics.totalFiles() +
                ", safe=" + statistics.safeFiles() +
                ", unsafe=" + statistics.unsafeFiles() +
                ", inconclusive=" + statistics.inconclusiveFiles() +
                ", errors=" + statistics.errorFiles() +
                ", skipped=" + statistics.skippedFiles() +
                '}';
    }
}
