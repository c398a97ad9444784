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
import dev.mars.ghaverify.workflow.Workflow;
import dev.mars.ghaverify.workflow.WorkflowParseException;
import dev.mars.ghaverify.workflow.YamlWorkflowParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LogicalVerifier
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class LogicalVerifierTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private YamlWorkflowParser parser;
    private LogicalVerifier verifier;

    @BeforeEach
    void setUp() {
        parser = new YamlWorkflowParser();
        verifier = new LogicalVerifier();
    }

    private LogicalResult verify(String original, String modified, Set<FixTag> fixes, boolean strict)
            throws WorkflowParseException {
        Workflow before = parser.parseFromString(original);
        Workflow after = parser.parseFromString(modified);
        return verifier.verify(before, after, fixes, strict, TIMEOUT);
    }

    private static String withJobCondition(String condition) {
        String guard = condition == null ? "" : "    if: \"" + condition.replace("\"", "\\\"") + "\"\n";
        return """
                on: push
                jobs:
                  build:
                    runs-on: ubuntu-latest
                """ + guard + """
                    steps:
                      - run: make
                """;
    }

    private static String withTriggers(String on) {
        return "on:\n" + on.indent(2) + """
                jobs:
                  build:
                    runs-on: ubuntu-latest
                    steps:
                      - run: make
                """;
    }

    private static String withConcurrency(String concurrency) {
        String block = concurrency == null ? "" : "concurrency:\n" + concurrency.indent(2);
        return "on: push\n" + block + """
                jobs:
                  build:
                    runs-on: ubuntu-latest
                    steps:
                      - run: make
                """;
    }

    @Test
    @DisplayName("A workflow is equivalent to itself")
    void testReflexive() throws WorkflowParseException {
        String yaml = withJobCondition("github.event_name == 'push' && !cancelled()");

        LogicalResult result = verify(yaml, yaml, Set.of(), true);

        assertTrue(result.isSafe());
        assertNull(result.getCounterexample());
        assertEquals(DomainOutcome.IDENTICAL, result.getDomain(DomainResult.IF).getOutcome());
    }

    @Nested
    @DisplayName("If conditions")
    class Conditions {

        @Test
        @DisplayName("Swapping conjuncts is proven equivalent")
        void testCommutedConjunction() throws WorkflowParseException {
            LogicalResult result = verify(
                    withJobCondition("github.event_name == 'push' && github.ref == 'refs/heads/main'"),
                    withJobCondition("github.ref == 'refs/heads/main' && github.event_name == 'push'"),
                    Set.of(), true);

            assertTrue(result.isSafe());
            assertEquals(DomainOutcome.EQUIVALENT, result.getDomain(DomainResult.IF).getOutcome());
        }

        @Test
        @DisplayName("A different branch yields a counterexample")
        void testBranchCounterexample() throws WorkflowParseException {
            LogicalResult result = verify(
                    withJobCondition("github.ref == 'refs/heads/main'"),
                    withJobCondition("github.ref == 'refs/heads/develop'"),
                    Set.of(), false);

            assertFalse(result.isSafe());
            assertEquals(LogicalStatus.UNSAFE, result.getStatus());
            Counterexample counterexample = result.getCounterexample();
            assertNotNull(counterexample);
            assertEquals("jobs.build.if", counterexample.location());
            assertEquals(Counterexample.ORIGINAL, counterexample.executes());
            assertEquals("refs/heads/main", counterexample.valuation().get("github.ref"));
        }

        @Test
        @DisplayName("De Morgan rewrites are equivalent")
        void testDeMorgan() throws WorkflowParseException {
            LogicalResult result = verify(
                    withJobCondition("!(github.event_name == 'push' || github.actor == 'bot')"),
                    withJobCondition("github.event_name != 'push' && github.actor != 'bot'"),
                    Set.of(), true);

            assertTrue(result.isSafe());
        }

        @Test
        @DisplayName("A missing condition equals success()")
        void testImplicitSuccess() throws WorkflowParseException {
            LogicalResult result = verify(withJobCondition(null), withJobCondition("${{ success() }}"), Set.of(), true);

            assertTrue(result.isSafe());
        }

        @Test
        @DisplayName("always() differs from failure()")
        void testStatusFunctions() throws WorkflowParseException {
            LogicalResult result = verify(withJobCondition("always()"), withJobCondition("failure()"), Set.of(), true);

            assertFalse(result.isSafe());
        }

        @Test
        @DisplayName("always() also runs after a failure, unlike a missing condition")
        void testMissingConditionVersusAlways() throws WorkflowParseException {
            LogicalResult result = verify(withJobCondition(null), withJobCondition("always()"), Set.of(), true);

            assertFalse(result.isSafe());
            assertEquals(DomainOutcome.NOT_EQUIVALENT, result.getDomain(DomainResult.IF).getOutcome());
            assertEquals(Counterexample.MODIFIED, result.getCounterexample().executes());
        }

        @Test
        @DisplayName("A query the solver cannot decide is inconclusive")
        void testSolverUnknown() throws WorkflowParseException {
            LogicalVerifier undecided = new LogicalVerifier(LoggerFactory.getLogger(LogicalVerifier.class),
                    (symbols, timeout, logger) -> new SolverSession(symbols, timeout, logger) {
                        @Override
                        public Optional<Counterexample> findDifference(String location, BoolExpr original,
                                                                       BoolExpr modified) throws SolverTimeoutException {
                            throw new SolverTimeoutException(timeout, "timeout");
                        }
                    });

            LogicalResult result = undecided.verify(
                    parser.parseFromString(withJobCondition("github.ref == 'refs/heads/main'")),
                    parser.parseFromString(withJobCondition("github.ref != 'refs/heads/develop'")),
                    Set.of(), true, TIMEOUT);

            assertFalse(result.isSafe());
            assertEquals(LogicalStatus.INCONCLUSIVE, result.getStatus());
            assertEquals(DomainOutcome.INCONCLUSIVE, result.getDomain(DomainResult.IF).getOutcome());
            assertNull(result.getCounterexample());
        }

        @Test
        @DisplayName("success() differs from always()")
        void testSuccessVersusAlways() throws WorkflowParseException {
            LogicalResult result = verify(withJobCondition("success()"), withJobCondition("always()"), Set.of(), true);

            assertFalse(result.isSafe());
        }

        @Test
        @DisplayName("A condition without status function carries an implicit success()")
        void testImplicitStatusCheck() throws WorkflowParseException {
            LogicalResult implicit = verify(
                    withJobCondition("github.event_name == 'push'"),
                    withJobCondition("success() && github.event_name == 'push'"),
                    Set.of(), true);
            LogicalResult widened = verify(
                    withJobCondition("github.event_name == 'push'"),
                    withJobCondition("always() && github.event_name == 'push'"),
                    Set.of(), true);

            assertTrue(implicit.isSafe());
            assertFalse(widened.isSafe());
        }

        @Test
        @DisplayName("Prefix tests agree with the contains rewrite they imply")
        void testStringFunctions() throws WorkflowParseException {
            LogicalResult same = verify(
                    withJobCondition("startsWith(github.ref, 'refs/tags/v')"),
                    withJobCondition("startsWith(github.ref, 'refs/tags/v') && contains(github.ref, 'refs/tags/')"),
                    Set.of(), true);
            LogicalResult different = verify(
                    withJobCondition("startsWith(github.ref, 'refs/tags/')"),
                    withJobCondition("endsWith(github.ref, '-rc')"),
                    Set.of(), true);

            assertTrue(same.isSafe());
            assertFalse(different.isSafe());
        }

        @Test
        @DisplayName("Unparseable conditions are inconclusive")
        void testUnparseable() throws WorkflowParseException {
            LogicalResult result = verify(withJobCondition("github.ref == 'a'"), withJobCondition("github.ref = 'a'"),
                    Set.of(), true);

            assertEquals(LogicalStatus.INCONCLUSIVE, result.getStatus());
            assertEquals(1, result.getUnsupportedClauses().size());
        }

        @Test
        @DisplayName("Unknown context fields are recorded but still compared")
        void testUnknownField() throws WorkflowParseException {
            LogicalResult result = verify(withJobCondition("env.DEPLOY == 'yes'"),
                    withJobCondition("'yes' == env.DEPLOY"), Set.of(), true);

            assertTrue(result.isSafe());
            assertFalse(result.getUnsupportedClauses().isEmpty());
        }

        @Test
        @DisplayName("Step conditions are compared by position")
        void testStepConditions() throws WorkflowParseException {
            String original = """
                    on: push
                    jobs:
                      build:
                        runs-on: ubuntu-latest
                        steps:
                          - run: make
                            if: github.event_name == 'push'
                    """;
            String modified = original.replace("'push'", "'pull_request'");

            LogicalResult result = verify(original, modified, Set.of(), true);

            assertFalse(result.isSafe());
            assertEquals("jobs.build.steps[0].if", result.getCounterexample().location());
        }
    }

    @Nested
    @DisplayName("Fork guards")
    class ForkGuards {

        @Test
        @DisplayName("An owner guard is an allowed change with the fork-prevention tag")
        void testScenarioA() throws WorkflowParseException {
            LogicalResult result = verify(withJobCondition(null),
                    withJobCondition("github.repository_owner == 'owner'"),
                    EnumSet.of(FixTag.FORK_PREVENTION), false);

            assertTrue(result.isSafe());
            assertEquals(DomainOutcome.ALLOWED_CHANGE, result.getDomain(DomainResult.IF).getOutcome());
            assertNull(result.getCounterexample());
        }

        @Test
        @DisplayName("An owner guard is a real change in strict mode")
        void testScenarioAStrict() throws WorkflowParseException {
            LogicalResult result = verify(withJobCondition(null),
                    withJobCondition("github.repository_owner == 'owner'"),
                    EnumSet.of(FixTag.FORK_PREVENTION), true);

            assertFalse(result.isSafe());
            assertEquals(Counterexample.ORIGINAL, result.getCounterexample().executes());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "github.event.pull_request.head.repo.full_name == github.repository",
                "!github.event.pull_request.head.repo.fork",
                "github.event.pull_request.head.repo.fork == false",
                "github.event_name != 'pull_request' || github.event.pull_request.head.repo.full_name == github.repository"
        })
        @DisplayName("Recognised guard shapes keep the original condition")
        void testGuardShapes(String guard) throws WorkflowParseException {
            LogicalResult result = verify(withJobCondition("github.ref == 'refs/heads/main'"),
                    withJobCondition("github.ref == 'refs/heads/main' && " + guardTerm(guard)),
                    EnumSet.of(FixTag.FORK_PREVENTION), false);

            assertEquals(DomainOutcome.ALLOWED_CHANGE, result.getDomain(DomainResult.IF).getOutcome());
        }

        @Test
        @DisplayName("A guard that also changes the rest of the condition is rejected")
        void testGuardWithOtherChange() throws WorkflowParseException {
            LogicalResult result = verify(withJobCondition("github.ref == 'refs/heads/main'"),
                    withJobCondition("github.ref == 'refs/heads/dev' && github.repository_owner == 'owner'"),
                    EnumSet.of(FixTag.FORK_PREVENTION), false);

            assertFalse(result.isSafe());
            assertEquals(DomainOutcome.NOT_EQUIVALENT, result.getDomain(DomainResult.IF).getOutcome());
        }

        private String guardTerm(String guard) {
            return guard.contains("||") ? "(" + guard + ")" : guard;
        }
    }

    @Nested
    @DisplayName("Triggers")
    class Triggers {

        @Test
        @DisplayName("Scalar and list spellings of one event are equivalent")
        void testSpellings() throws WorkflowParseException {
            LogicalResult result = verify(withTriggers("push"), withTriggers("[push]"), Set.of(), true);

            assertTrue(result.isSafe());
        }

        @Test
        @DisplayName("Adding an event is not equivalent")
        void testAddedEvent() throws WorkflowParseException {
            LogicalResult result = verify(withTriggers("push"), withTriggers("[push, pull_request]"), Set.of(), true);

            assertFalse(result.isSafe());
            Counterexample counterexample = result.getCounterexample();
            assertEquals("on", counterexample.location());
            assertEquals(Counterexample.MODIFIED, counterexample.executes());
            assertEquals("pull_request", counterexample.valuation().get("github.event_name"));
        }

        @Test
        @DisplayName("Changing a branch filter is not equivalent")
        void testBranchFilter() throws WorkflowParseException {
            LogicalResult result = verify(withTriggers("push:\n  branches: [main]"),
                    withTriggers("push:\n  branches: [develop]"), Set.of(), true);

            assertFalse(result.isSafe());
            assertEquals("refs/heads/main", result.getCounterexample().valuation().get("github.ref"));
        }

        @Test
        @DisplayName("Duplicate branch entries do not change the filter")
        void testDuplicateBranches() throws WorkflowParseException {
            LogicalResult result = verify(withTriggers("push:\n  branches: [main]"),
                    withTriggers("push:\n  branches: [main, main]"), Set.of(), true);

            assertTrue(result.isSafe());
        }

        @Test
        @DisplayName("A single star does not cross a slash")
        void testGlobs() throws WorkflowParseException {
            LogicalResult narrower = verify(withTriggers("push:\n  branches: ['release/**']"),
                    withTriggers("push:\n  branches: ['release/*']"), Set.of(), true);
            LogicalResult covered = verify(withTriggers("push:\n  branches: ['release/*', 'release/*/*']"),
                    withTriggers("push:\n  branches: ['release/*/*', 'release/*']"), Set.of(), true);

            assertFalse(narrower.isSafe());
            assertTrue(covered.isSafe());
        }

        @Test
        @DisplayName("Pull request branch filters apply to the base branch")
        void testPullRequestBranches() throws WorkflowParseException {
            LogicalResult result = verify(withTriggers("pull_request:\n  branches: [main]"),
                    withTriggers("pull_request:\n  branches: [master]"), Set.of(), true);

            assertFalse(result.isSafe());
            assertEquals("main", result.getCounterexample().valuation().get("github.base_ref"));
        }

        @Test
        @DisplayName("A path filter addition is allowed with the path-filter tag")
        void testPathFilterAddition() throws WorkflowParseException {
            LogicalResult result = verify(withTriggers("push:\n  branches: [main]"),
                    withTriggers("push:\n  branches: [main]\n  paths: ['src/**']"),
                    EnumSet.of(FixTag.PATH_FILTER), false);

            assertEquals(DomainOutcome.ALLOWED_CHANGE, result.getDomain(DomainResult.TRIGGER).getOutcome());
        }

        @Test
        @DisplayName("Negated patterns are modelled as opaque")
        void testUnsupportedPattern() throws WorkflowParseException {
            LogicalResult result = verify(withTriggers("push:\n  branches: ['**', '!wip']"),
                    withTriggers("push:\n  branches: ['!wip', '**']"), Set.of(), true);

            assertTrue(result.isSafe());
            assertTrue(result.getUnsupportedClauses().stream().anyMatch(clause -> clause.contains("!wip")));
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("A concurrency block added with its tag is allowed")
        void testAddition() throws WorkflowParseException {
            String modified = withConcurrency("group: ${{ github.workflow }}-${{ github.ref }}\ncancel-in-progress: true");

            LogicalResult allowed = verify(withConcurrency(null), modified, EnumSet.of(FixTag.CONCURRENCY), false);
            LogicalResult rejected = verify(withConcurrency(null), modified, Set.of(), false);

            assertEquals(DomainOutcome.ALLOWED_CHANGE, allowed.getDomain(DomainResult.CONCURRENCY).getOutcome());
            assertEquals(DomainOutcome.NOT_EQUIVALENT, rejected.getDomain(DomainResult.CONCURRENCY).getOutcome());
        }

        @Test
        @DisplayName("A group with the same partition is equivalent")
        void testSamePartition() throws WorkflowParseException {
            LogicalResult result = verify(withConcurrency("group: ci-${{ github.ref }}"),
                    withConcurrency("group: ci-${{ github.ref }}-build"), Set.of(), true);

            assertTrue(result.isSafe());
            assertEquals(DomainOutcome.EQUIVALENT, result.getDomain(DomainResult.CONCURRENCY).getOutcome());
        }

        @Test
        @DisplayName("A group over a different field changes the partition")
        void testDifferentPartition() throws WorkflowParseException {
            LogicalResult result = verify(withConcurrency("group: ci-${{ github.ref }}"),
                    withConcurrency("group: ci-${{ github.actor }}"), Set.of(), true);

            assertFalse(result.isSafe());
            assertEquals("concurrency.group", result.getCounterexample().location());
        }

        @Test
        @DisplayName("Toggling cancel-in-progress is not equivalent")
        void testCancelInProgress() throws WorkflowParseException {
            LogicalResult result = verify(withConcurrency("group: ci\ncancel-in-progress: true"),
                    withConcurrency("group: ci\ncancel-in-progress: false"), Set.of(), true);

            assertFalse(result.isSafe());
            assertEquals("concurrency.cancel-in-progress", result.getCounterexample().location());
        }

        @Test
        @DisplayName("Removing concurrency is never allowed")
        void testRemoval() throws WorkflowParseException {
            LogicalResult result = verify(withConcurrency("group: ci"), withConcurrency(null),
                    EnumSet.allOf(FixTag.class), false);

            assertEquals(DomainOutcome.NOT_EQUIVALENT, result.getDomain(DomainResult.CONCURRENCY).getOutcome());
        }
    }
}
