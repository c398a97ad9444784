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

package dev.mars.ghaverify.logical;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import dev.mars.ghaverify.core.exceptions.SolverTimeoutException;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs equivalence queries against Z3 with a bounded timeout.
 *
 * <p>The difference {@code a != b} is split into two directed queries, {@code a && !b} first and
 * then {@code !a && b}, so a counterexample always says which side executes. UNKNOWN is never
 * treated as equivalent.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SolverSession {

    /**
     * Creates the solver session of one verification.
     */
    @FunctionalInterface
    public interface Factory {
        SolverSession create(SymbolicContext symbols, Duration timeout, Logger logger);
    }

    private final SymbolicContext symbols;
    private final Duration timeout;
    private final Logger logger;
    private int queries;

    public SolverSession(SymbolicContext symbols, Duration timeout, Logger logger) {
        this.symbols = Objects.requireNonNull(symbols, "Symbolic context cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "Timeout cannot be null");
        this.logger = Objects.requireNonNull(logger, "Logger cannot be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Solver timeout must be positive: " + timeout);
        }
    }

    /**
     * Searches for a valuation under which exactly one of the two formulas holds.
     *
     * @return empty when the formulas are equivalent
     * @throws SolverTimeoutException when the solver cannot decide within the timeout
     */
    public Optional<Counterexample> findDifference(String location, BoolExpr original, BoolExpr modified)
            throws SolverTimeoutException {
        Context ctx = symbols.getContext();
        logger.debug("Checking {}: original={} modified={}", location, original, modified);

        Optional<Counterexample> onlyOriginal = check(location, Counterexample.ORIGINAL,
                ctx.mkAnd(original, ctx.mkNot(modified)));
        if (onlyOriginal.isPresent()) {
            return onlyOriginal;
        }
        return check(location, Counterexample.MODIFIED, ctx.mkAnd(ctx.mkNot(original), modified));
    }

    public int getQueryCount() {
        return queries;
    }

    private Optional<Counterexample> check(String location, String executes, BoolExpr formula)
            throws SolverTimeoutException {
        Context ctx = symbols.getContext();
        Solver solver = ctx.mkSolver();
        Params params = ctx.mkParams();
        params.add("timeout", (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));
        solver.setParameters(params);
        solver.add(formula);

        queries++;
        Status status = solver.check();
        logger.debug("Solver returned {} for {} ({} executes)", status, location, executes);

        switch (status) {
            case UNSATISFIABLE:
                return Optional.empty();
            case SATISFIABLE:
                return Optional.of(new Counterexample(location, executes, symbols.describe(solver.getModel())));
            default:
                throw new SolverTimeoutException(timeout, solver.getReasonUnknown());
        }
    }
}
