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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handle on a running batch.
 *
 * <p>{@link #cancel()} stops pairs that have not started yet; pairs already being verified run
 * to completion and keep their verdicts. The report future completes in both cases.
 */
public final class BatchRun {

    private final int totalPairs;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger completed = new AtomicInteger(0);
    private volatile CompletableFuture<BatchReport> report;

    BatchRun(int totalPairs) {
        this.totalPairs = totalPairs;
    }

    void attach(CompletableFuture<BatchReport> report) {
        this.report = report;
    }

    void markCompleted() {
        completed.incrementAndGet();
    }

    /**
     * Requests cancellation.
     *
     * @return false if the run had already been cancelled
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public CompletableFuture<BatchReport> getReport() {
        return report;
    }

    public int getCompletedCount() {
        return completed.get();
    }

    public int getTotalPairs() {
        return totalPairs;
    }

    public boolean isDone() {
        return report.isDone();
    }
}
