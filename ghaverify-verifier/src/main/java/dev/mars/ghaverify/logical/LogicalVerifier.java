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
import dev.mars.ghaverify.core.FixTag;
import dev.mars.ghaverify.core.exceptions.SolverTimeoutException;
import dev.mars.ghaverify.core.exceptions.UnsupportedExpressionException;
import dev.mars.ghaverify.logical.expression.Expression;
import dev.mars.ghaverify.logical.expression.ExpressionParseException;
import dev.mars.ghaverify.logical.expression.ExpressionParser;
import dev.mars.ghaverify.logical.expression.Literal;
import dev.mars.ghaverify.workflow.Job;
import dev.mars.ghaverify.workflow.Step;
import dev.mars.ghaverify.workflow.Workflow;
import dev.mars.ghaverify.workflow.YamlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Proves that the conditions gating execution are unchanged between two workflows.
 *
 * <p>Three domains are compared: the {@code on} triggers, every job and step {@code if} that
 * exists in both workflows, and the workflow and job {@code concurrency} settings. For each
 * location the comparison short-circuits on identical text, then on a recognised delta from
 * {@link LogicalDeltaRules}, and only then asks the solver. Every call to {@link #verify} works
 * in a fresh {@link SymbolicContext}, so instances can be shared between threads.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class LogicalVerifier {

    private final Logger logger;
    private final ExpressionParser parser;
    private final SolverSession.Factory solverSessions;

    public LogicalVerifier() {
        this(LoggerFactory.getLogger(LogicalVerifier.class));
    }

    public LogicalVerifier(Logger logger) {
        this(logger, SolverSession::new);
    }

    public LogicalVerifier(Logger logger, SolverSession.Factory solverSessions) {
        this.logger = Objects.requireNonNull(logger, "Logger cannot be null");
        this.solverSessions = Objects.requireNonNull(solverSessions, "Solver session factory cannot be null");
        this.parser = new ExpressionParser();
    }

    public LogicalResult verify(Workflow original, Workflow modified, Set<FixTag> permittedFixes,
                                boolean strictMode, Duration solverTimeout) {
        LogicalDeltaRules deltas = new LogicalDeltaRules(permittedFixes, strictMode);

        try (SymbolicContext symbols = new SymbolicContext(logger)) {
            Session session = new Session(symbols, solverSessions.create(symbols, solverTimeout, logger), deltas);
            DomainResult trigger = session.checkTriggers(original, modified);
            DomainResult conditions = session.checkConditions(original, modified);
            DomainResult concurrency = session.checkConcurrency(original, modified);

            LogicalResult result = new LogicalResult(List.of(trigger, conditions, concurrency),
                    session.counterexample, new ArrayList<>(symbols.getUnsupportedClauses()));
            logger.debug("Logical comparison finished: {} ({} solver queries)",
                    result.getStatus(), session.solver.getQueryCount());
            return result;
        }
    }

    /**
     * State of one verification: the symbolic context, its solver and the first counterexample.
     */
    private final class Session {

        private final SymbolicContext symbols;
        private final SolverSession solver;
        private final LogicalDeltaRules deltas;
        private Counterexample counterexample;

        Session(SymbolicContext symbols, SolverSession solver, LogicalDeltaRules deltas) {
            this.symbols = symbols;
            this.solver = solver;
            this.deltas = deltas;
        }

        DomainResult checkTriggers(Workflow original, Workflow modified) {
            DomainResult result = new DomainResult(DomainResult.TRIGGER);
            Map<String, YamlNode> before = original.getTriggers();
            Map<String, YamlNode> after = modified.getTriggers();

            if (original.getTriggerNode().toCanonicalString().equals(modified.getTriggerNode().toCanonicalString())) {
                result.add(ConditionCheck.of("on", DomainOutcome.IDENTICAL));
            } else if (deltas.isPathFilterAddition(before, after)) {
                result.add(new ConditionCheck("on", DomainOutcome.ALLOWED_CHANGE, "path filter added"));
            } else {
                TriggerEncoder encoder = new TriggerEncoder(symbols, logger);
                result.add(prove("on", encoder.encode(before), encoder.encode(after)));
            }
            return result;
        }

        DomainResult checkConditions(Workflow original, Workflow modified) {
            DomainResult result = new DomainResult(DomainResult.IF);
            for (Job job : original.getJobs().values()) {
                Job other = modified.getJob(job.getId());
                if (other == null) {
                    continue;
                }
                String jobPath = "jobs." + job.getId();
                result.add(compareCondition(jobPath + ".if", job.getIfCondition(), other.getIfCondition()));

                List<Step> steps = job.getSteps();
                List<Step> otherSteps = other.getSteps();
                int common = Math.min(steps.size(), otherSteps.size());
                for (int i = 0; i < common; i++) {
                    result.add(compareCondition(jobPath + ".steps[" + i + "].if",
                            steps.get(i).getIfCondition(), otherSteps.get(i).getIfCondition()));
                }
            }
            return result;
        }

        DomainResult checkConcurrency(Workflow original, Workflow modified) {
            DomainResult result = new DomainResult(DomainResult.CONCURRENCY);
            result.add(compareConcurrency("concurrency", original.getConcurrency(), modified.getConcurrency()));
            for (Job job : original.getJobs().values()) {
                Job other = modified.getJob(job.getId());
                if (other != null) {
                    result.add(compareConcurrency("jobs." + job.getId() + ".concurrency",
                            job.getConcurrency(), other.getConcurrency()));
                }
            }
            return result;
        }

        private ConditionCheck compareCondition(String location, String before, String after) {
            String left = normalize(before);
            String right = normalize(after);
            if (left.equals(right)) {
                return ConditionCheck.of(location, DomainOutcome.IDENTICAL);
            }

            Expression originalExpression;
            Expression modifiedExpression;
            try {
                originalExpression = parseCondition(before);
                modifiedExpression = parseCondition(after);
            } catch (ExpressionParseException e) {
                logger.warn("Cannot parse condition at {}: {}", location, e.getMessage());
                symbols.recordUnsupported(location, e.getMessage());
                return new ConditionCheck(location, DomainOutcome.INCONCLUSIVE, e.getMessage());
            }

            if (originalExpression.equals(modifiedExpression)) {
                return ConditionCheck.of(location, DomainOutcome.IDENTICAL);
            }

            ExpressionEncoder encoder = new ExpressionEncoder(symbols);
            BoolExpr originalFormula = encoder.encodeRunCondition(originalExpression);

            Optional<Expression> residue = deltas.stripForkGuards(modifiedExpression);
            if (residue.isPresent()) {
                ConditionCheck check = prove(location, originalFormula, encoder.encodeRunCondition(residue.get()), false);
                if (check.outcome() == DomainOutcome.EQUIVALENT) {
                    return new ConditionCheck(location, DomainOutcome.ALLOWED_CHANGE, "fork guard added");
                }
                logger.debug("Fork guard at {} also changes the remaining condition", location);
            }

            return prove(location, originalFormula, encoder.encodeRunCondition(modifiedExpression));
        }

        private ConditionCheck compareConcurrency(String location, YamlNode before, YamlNode after) {
            if (before == null && after == null) {
                return ConditionCheck.of(location, DomainOutcome.IDENTICAL);
            }
            if (before != null && after != null && before.toCanonicalString().equals(after.toCanonicalString())) {
                return ConditionCheck.of(location, DomainOutcome.IDENTICAL);
            }
            if (deltas.isConcurrencyAddition(before, after)) {
                return new ConditionCheck(location, DomainOutcome.ALLOWED_CHANGE,
                        before == null ? "concurrency added" : "cancel-in-progress added");
            }
            if (before == null || after == null) {
                return new ConditionCheck(location, DomainOutcome.NOT_EQUIVALENT,
                        before == null ? "concurrency added" : "concurrency removed");
            }

            ConcurrencyEncoder encoder = new ConcurrencyEncoder(symbols, parser);
            try {
                ConcurrencyEncoder.Setting originalSetting = ConcurrencyEncoder.Setting.of(before, parser);
                ConcurrencyEncoder.Setting modifiedSetting = ConcurrencyEncoder.Setting.of(after, parser);

                ConditionCheck group = prove(location + ".group",
                        encoder.sameLane(originalSetting), encoder.sameLane(modifiedSetting));
                if (group.outcome() != DomainOutcome.EQUIVALENT) {
                    return group;
                }
                ConditionCheck cancel = prove(location + ".cancel-in-progress",
                        encoder.cancelInProgress(originalSetting), encoder.cancelInProgress(modifiedSetting));
                if (cancel.outcome() != DomainOutcome.EQUIVALENT) {
                    return cancel;
                }
                return ConditionCheck.of(location, DomainOutcome.EQUIVALENT);
            } catch (UnsupportedExpressionException | ExpressionParseException e) {
                logger.warn("Cannot encode concurrency at {}: {}", location, e.getMessage());
                symbols.recordUnsupported(location, e.getMessage());
                return new ConditionCheck(location, DomainOutcome.INCONCLUSIVE, e.getMessage());
            }
        }

        private ConditionCheck prove(String location, BoolExpr before, BoolExpr after) {
            return prove(location, before, after, true);
        }

        private ConditionCheck prove(String location, BoolExpr before, BoolExpr after, boolean keepCounterexample) {
            try {
                Optional<Counterexample> difference = solver.findDifference(location, before, after);
                if (difference.isEmpty()) {
                    return ConditionCheck.of(location, DomainOutcome.EQUIVALENT);
                }
                if (keepCounterexample && counterexample == null) {
                    counterexample = difference.get();
                }
                return new ConditionCheck(location, DomainOutcome.NOT_EQUIVALENT, difference.get().describe());
            } catch (SolverTimeoutException e) {
                logger.warn("Solver could not decide {}: {}", location, e.getMessage());
                return new ConditionCheck(location, DomainOutcome.INCONCLUSIVE, e.getMessage());
            }
        }

        private Expression parseCondition(String condition) throws ExpressionParseException {
            if (condition == null || condition.isBlank()) {
                return Literal.bool(true);
            }
            return parser.parse(condition);
        }
    }

    /**
     * Text used for the syntactic short cut. An absent condition equals {@code success()}.
     */
    private static String normalize(String condition) {
        if (condition == null || condition.isBlank()) {
            return "";
        }
        return ExpressionParser.stripTemplate(condition).replaceAll("\\s+", " ");
    }
}
