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
import dev.mars.ghaverify.core.VerificationMode;
import dev.mars.ghaverify.core.exceptions.ConfigurationException;
import dev.mars.ghaverify.logical.ConditionCheck;
import dev.mars.ghaverify.logical.DomainResult;
import dev.mars.ghaverify.logical.LogicalResult;
import dev.mars.ghaverify.logical.LogicalStatus;
import dev.mars.ghaverify.logical.LogicalVerifier;
import dev.mars.ghaverify.observability.VerificationMetrics;
import dev.mars.ghaverify.structural.CommandRewriteTable;
import dev.mars.ghaverify.structural.StructuralIssue;
import dev.mars.ghaverify.structural.StructuralResult;
import dev.mars.ghaverify.structural.StructuralVerifier;
import dev.mars.ghaverify.workflow.ValidationResult;
import dev.mars.ghaverify.workflow.Workflow;
import dev.mars.ghaverify.workflow.WorkflowParseException;
import dev.mars.ghaverify.workflow.WorkflowParser;
import dev.mars.ghaverify.workflow.YamlWorkflowParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the structural and logical verifiers over one file pair and combines their results.
 *
 * <p>Per-pair failures never escape: unreadable files, malformed YAML, invalid options and
 * unexpected runtime failures all become a verdict with status {@link VerificationStatus#ERROR}.
 * In hybrid mode the pair is unsafe if either side is unsafe, inconclusive if the structure is
 * safe but the logical side could not be decided, and safe only when both are safe.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class IntegratedVerifier {

    private final Logger logger;
    private final WorkflowParser parser;
    private final StructuralVerifier structuralVerifier;
    private final LogicalVerifier logicalVerifier;
    private final VerificationMetrics metrics;
    private final int readRetries;

    public IntegratedVerifier() throws ConfigurationException {
        this(new VerifierConfiguration());
    }

    public IntegratedVerifier(VerifierConfiguration configuration) throws ConfigurationException {
        this(LoggerFactory.getLogger(IntegratedVerifier.class),
                new YamlWorkflowParser(),
                new StructuralVerifier(CommandRewriteTable.fromConfiguration(configuration)),
                new LogicalVerifier(),
                VerificationMetrics.noop(),
                configuration.getReadRetries());
    }

    public IntegratedVerifier(Logger logger, WorkflowParser parser, StructuralVerifier structuralVerifier,
                              LogicalVerifier logicalVerifier, VerificationMetrics metrics, int readRetries) {
        this.logger = Objects.requireNonNull(logger, "Logger cannot be null");
        this.parser = Objects.requireNonNull(parser, "Parser cannot be null");
        this.structuralVerifier = Objects.requireNonNull(structuralVerifier, "Structural verifier cannot be null");
        this.logicalVerifier = Objects.requireNonNull(logicalVerifier, "Logical verifier cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        if (readRetries < 0) {
            throw new IllegalArgumentException("Read retries cannot be negative: " + readRetries);
        }
        this.readRetries = readRetries;
    }

    /**
     * Returns a copy of this verifier that reports to the given metrics.
     */
    public IntegratedVerifier withMetrics(VerificationMetrics metrics) {
        return new IntegratedVerifier(logger, parser, structuralVerifier, logicalVerifier, metrics, readRetries);
    }

    public VerificationVerdict verify(String originalYaml, String modifiedYaml, VerificationOptions options) {
        return verify("inline", originalYaml, modifiedYaml, options);
    }

    public VerificationVerdict verify(Path original, Path modified, VerificationOptions options) {
        return verify(String.valueOf(original.getFileName()), original, modified, options);
    }

    public VerificationVerdict verify(String pairId, Path original, Path modified, VerificationOptions options) {
        long start = System.nanoTime();
        metrics.recordStarted();
        String originalYaml;
        String modifiedYaml;
        try {
            originalYaml = read(original);
            modifiedYaml = read(modified);
        } catch (IOException e) {
            logger.error("Cannot read file pair {}: {}", pairId, e.getMessage());
            return finish(error(pairId, options, "Cannot read file: " + e.getMessage(), start));
        }
        return finish(run(pairId, originalYaml, modifiedYaml, options, start));
    }

    public VerificationVerdict verify(String pairId, String originalYaml, String modifiedYaml,
                                      VerificationOptions options) {
        long start = System.nanoTime();
        metrics.recordStarted();
        return finish(run(pairId, originalYaml, modifiedYaml, options, start));
    }

    private VerificationVerdict run(String pairId, String originalYaml, String modifiedYaml,
                                    VerificationOptions options, long start) {
        try {
            options.validate();
            if (options.isStrictMode() && !options.getPermittedFixes().isEmpty()) {
                logger.warn("Strict mode ignores permitted fixes {} for {}", options.getPermittedFixes(), pairId);
            }

            Workflow original = parse(pairId, "original", originalYaml);
            Workflow modified = parse(pairId, "modified", modifiedYaml);
            return combine(pairId, original, modified, options, start);
        } catch (WorkflowParseException | ConfigurationException e) {
            logger.error("Verification of {} failed: {}", pairId, e.getMessage());
            return error(pairId, options, e.getMessage(), start);
        } catch (RuntimeException e) {
            logger.error("Unexpected failure verifying {}", pairId, e);
            return error(pairId, options, e.getClass().getSimpleName() + ": " + e.getMessage(), start);
        }
    }

    private Workflow parse(String pairId, String side, String yaml) throws WorkflowParseException {
        try {
            Workflow workflow = parser.parseFromString(yaml);
            ValidationResult validation = parser.validate(workflow);
            for (ValidationResult.Problem problem : validation.getProblems()) {
                if (problem.isError()) {
                    logger.warn("{} ({}): {}", pairId, side, problem);
                } else {
                    logger.debug("{} ({}): {}", pairId, side, problem);
                }
            }
            return workflow;
        } catch (WorkflowParseException e) {
            throw e.withSource(pairId + " (" + side + ")");
        }
    }

    private VerificationVerdict combine(String pairId, Workflow original, Workflow modified,
                                        VerificationOptions options, long start) {
        VerificationMode mode = options.getMode();
        StructuralResult structural = null;
        LogicalResult logical = null;

        if (mode.includesStructural()) {
            structural = structuralVerifier.verify(original, modified,
                    options.getEffectiveFixes(), options.isStrictMode());
        }
        if (mode.includesLogical()) {
            logical = logicalVerifier.verify(original, modified,
                    options.getEffectiveFixes(), options.isStrictMode(), options.getSolverTimeout());
        }

        VerificationStatus status = status(structural, logical);
        double confidence = confidence(structural, logical, options);
        List<String> reasons = failureReasons(structural, logical);

        logger.info("{}: {} (confidence {})", pairId, status, String.format("%.2f", confidence));
        return VerificationVerdict.builder()
                .pairId(pairId)
                .status(status)
                .mode(mode)
                .confidence(confidence)
                .structural(structural)
                .logical(logical)
                .failureReasons(reasons)
                .elapsed(elapsedSince(start))
                .build();
    }

    static VerificationStatus status(StructuralResult structural, LogicalResult logical) {
        boolean structuralSafe = structural == null || structural.isSafe();
        LogicalStatus logicalStatus = logical == null ? LogicalStatus.SAFE : logical.getStatus();

        if (!structuralSafe || logicalStatus == LogicalStatus.UNSAFE) {
            return VerificationStatus.UNSAFE;
        }
        if (logicalStatus == LogicalStatus.INCONCLUSIVE) {
            return VerificationStatus.INCONCLUSIVE;
        }
        return VerificationStatus.SAFE;
    }

    static double confidence(StructuralResult structural, LogicalResult logical, VerificationOptions options) {
        double structuralScore = structural != null && structural.isSafe() ? 1.0 : 0.0;
        double logicalScore = 0.0;
        if (logical != null && logical.isSafe()) {
            double penalty = options.getUnsupportedClausePenalty() * logical.getUnsupportedClauses().size();
            logicalScore = Math.max(0.5, 1.0 - penalty);
        }

        if (structural == null) {
            return logicalScore;
        }
        if (logical == null) {
            return structuralScore;
        }
        double total = options.getStructuralWeight() + options.getLogicalWeight();
        return (options.getStructuralWeight() * structuralScore + options.getLogicalWeight() * logicalScore) / total;
    }

    private static List<String> failureReasons(StructuralResult structural, LogicalResult logical) {
        List<String> reasons = new ArrayList<>();
        if (structural != null) {
            for (StructuralIssue issue : structural.getCriticalIssues()) {
                reasons.add("structural " + issue.kind() + " at " + issue.path() + ": " + issue.message());
            }
        }
        if (logical != null) {
            for (DomainResult domain : logical.getPerDomain().values()) {
                for (ConditionCheck check : domain.getChecks()) {
                    if (!check.outcome().isAcceptable()) {
                        reasons.add(domain.getDomain() + " " + check.outcome() + " at " + check.location()
                                + (check.detail() != null ? ": " + check.detail() : ""));
                    }
                }
            }
        }
        return reasons;
    }

    private VerificationVerdict error(String pairId, VerificationOptions options, String message, long start) {
        return VerificationVerdict.builder()
                .pairId(pairId)
                .status(VerificationStatus.ERROR)
                .mode(options.getMode())
                .confidence(0.0)
                .error(message)
                .elapsed(elapsedSince(start))
                .build();
    }

    private VerificationVerdict finish(VerificationVerdict verdict) {
        metrics.recordVerdict(verdict);
        return verdict;
    }

    private String read(Path file) throws IOException {
        int attempt = 0;
        while (true) {
            try {
                return readFile(file);
            } catch (IOException e) {
                if (attempt++ >= readRetries) {
                    throw e;
                }
                logger.warn("Retrying read of {} after {}", file, e.toString());
            }
        }
    }

    /**
     * Reads one workflow file. Failures are retried up to the configured number of times.
     */
    protected String readFile(Path file) throws IOException {
        return Files.readString(file);
    }

    private static Duration elapsedSince(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }
}
