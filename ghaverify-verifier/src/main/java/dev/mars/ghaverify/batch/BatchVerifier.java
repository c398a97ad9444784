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

import dev.mars.ghaverify.core.exceptions.BatchVerificationException;
import dev.mars.ghaverify.verification.IntegratedVerifier;
import dev.mars.ghaverify.verification.VerificationOptions;
import dev.mars.ghaverify.verification.VerificationVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Verifies many file pairs on a fixed pool of worker threads.
 *
 * <p>Pairs are independent, so they are verified in parallel. Each verification builds its own
 * symbolic context and solver, so nothing solver-related is shared between workers. A failure in
 * one pair is recorded as that pair's ERROR verdict and never stops the batch. The report lists
 * verdicts in the order the pairs were given, whatever order they finish in.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class BatchVerifier {

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger(0);

    private final Logger logger;
    private final IntegratedVerifier verifier;
    private final int parallelism;

    public BatchVerifier(IntegratedVerifier verifier, int parallelism) {
        this(LoggerFactory.getLogger(BatchVerifier.class), verifier, parallelism);
    }

    public BatchVerifier(Logger logger, IntegratedVerifier verifier, int parallelism) {
        this.logger = Objects.requireNonNull(logger, "Logger cannot be null");
        this.verifier = Objects.requireNonNull(verifier, "Verifier cannot be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1 but was " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /**
     * Starts verifying the pairs in the background.
     *
     * @param configuration settings echoed into the report
     */
    public BatchRun start(List<FilePair> pairs, VerificationOptions options, Map<String, Object> configuration) {
        Objects.requireNonNull(pairs, "Pairs cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");
        Objects.requireNonNull(configuration, "Configuration cannot be null");

        Instant timestamp = Instant.now();
        long start = System.nanoTime();
        BatchRun run = new BatchRun(pairs.size());
        AtomicReferenceArray<VerificationVerdict> verdicts = new AtomicReferenceArray<>(pairs.size());
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, Math.max(1, pairs.size())),
                threadFactory());

        logger.info("Starting batch verification of {} pair(s) with {} worker(s), mode {}",
                pairs.size(), parallelism, options.getMode());

        List<CompletableFuture<Void>> tasks = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            int index = i;
            FilePair pair = pairs.get(i);
            tasks.add(CompletableFuture.runAsync(() -> {
                if (run.isCancelled()) {
                    return;
                }
                VerificationVerdict verdict = verifier.verify(pair.id(), pair.original(), pair.modified(), options);
                verdicts.set(index, verdict);
                run.markCompleted();
                logger.debug("[{}/{}] {}: {}", run.getCompletedCount(), pairs.size(), pair.id(), verdict.getStatus());
            }, executor));
        }

        CompletableFuture<BatchReport> report = CompletableFuture
                .allOf(tasks.toArray(new CompletableFuture[0]))
                .handle((ignored, failure) -> {
                    executor.shutdown();
                    if (failure != null) {
                        logger.error("Batch worker failed unexpectedly", failure);
                    }
                    List<VerificationVerdict> finished = new ArrayList<>();
                    for (int i = 0; i < verdicts.length(); i++) {
                        VerificationVerdict verdict = verdicts.get(i);
                        if (verdict != null) {
                            finished.add(verdict);
                        }
                    }
                    BatchReport summary = BatchReport.summarize(timestamp, configuration, finished, pairs.size(),
                            Duration.ofNanos(System.nanoTime() - start), run.isCancelled());
                    logSummary(summary);
                    return summary;
                });
        run.attach(report);
        return run;
    }

    /**
     * Verifies the pairs and waits for the report.
     *
     * @throws BatchVerificationException if the batch could not be completed
     */
    public BatchReport verifyBatch(List<FilePair> pairs, VerificationOptions options,
                                   Map<String, Object> configuration) throws BatchVerificationException {
        BatchRun run = start(pairs, options, configuration);
        try {
            return run.getReport().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.cancel();
            throw new BatchVerificationException(firstLocation(pairs), "Batch verification interrupted", e);
        } catch (ExecutionException e) {
            throw new BatchVerificationException(firstLocation(pairs), "Batch verification failed", e.getCause());
        }
    }

    public int getParallelism() {
        return parallelism;
    }

    private void logSummary(BatchReport report) {
        BatchReport.Statistics stats = report.getStatistics();
        logger.info("Batch finished{}: {} total, {} safe, {} unsafe, {} inconclusive, {} error(s), {} skipped, "
                        + "safety rate {}",
                stats.cancelled() ? " (cancelled)" : "",
                stats.totalFiles(), stats.safeFiles(), stats.unsafeFiles(), stats.inconclusiveFiles(),
                stats.errorFiles(), stats.skippedFiles(), String.format("%.1f%%", stats.safetyRate() * 100));
    }

    private static Path firstLocation(List<FilePair> pairs) {
        return pairs.isEmpty() ? null : pairs.get(0).original().getParent();
    }

    private static ThreadFactory threadFactory() {
        int pool = POOL_COUNTER.incrementAndGet();
        AtomicInteger thread = new AtomicInteger(0);
        return runnable -> {
            Thread worker = new Thread(runnable, "ghaverify-batch-" + pool + "-" + thread.incrementAndGet());
            worker.setDaemon(true);
            return worker;
        };
    }
}
