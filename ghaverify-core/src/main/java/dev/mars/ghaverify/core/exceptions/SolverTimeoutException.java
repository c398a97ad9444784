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

package dev.mars.ghaverify.core.exceptions;

import java.time.Duration;

/**
 * Thrown when the SMT solver returns UNKNOWN, either because the configured timeout
 * elapsed or because the solver gave up for another reason. Always mapped to an
 * inconclusive outcome, never to a safe one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class SolverTimeoutException extends VerificationException {

    private final Duration timeout;
    private final String reason;

    public SolverTimeoutException(Duration timeout, String reason) {
        super("Solver returned UNKNOWN");
        this.timeout = timeout;
        this.reason = reason;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public String getReason() {
        return reason;
    }

    public boolean isTimeout() {
        return reason != null && (reason.contains("timeout") || reason.contains("canceled"));
    }

    @Override
    public String getMessage() {
        return String.format("Solver returned UNKNOWN after at most %d ms: %s",
                timeout.toMillis(), reason != null ? reason : "no reason given");
    }
}
