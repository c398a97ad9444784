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
import dev.mars.ghaverify.core.exceptions.SolverTimeoutException;
import dev.mars.ghaverify.logical.expression.ExpressionParseException;
import dev.mars.ghaverify.logical.expression.ExpressionParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Encodes conditions directly and checks them with a solver session.
 */
class ExpressionEncoderTest {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionEncoderTest.class);

    private SymbolicContext symbols;
    private SolverSession solver;
    private ExpressionEncoder encoder;
    private final ExpressionParser parser = new ExpressionParser();

    @BeforeEach
    void setUp() {
        symbols = new SymbolicContext(logger);
        solver = new SolverSession(symbols, Duration.ofSeconds(10), logger);
        encoder = new ExpressionEncoder(symbols);
    }

    @AfterEach
    void tearDown() {
        symbols.close();
    }

    private BoolExpr encode(String condition) throws ExpressionParseException {
        return encoder.encodeCondition(parser.parse(condition));
    }

    private boolean equivalent(String a, String b) throws ExpressionParseException, SolverTimeoutException {
        return solver.findDifference("test", encode(a), encode(b)).isEmpty();
    }

    @Test
    void testSameVariableForSamePath() throws ExpressionParseException, SolverTimeoutException {
        assertTrue(equivalent("github.actor == 'a' || github.actor == 'b'", "github.actor == 'b' || github.actor == 'a'"));
        assertEquals(1, symbols.getVariableCount());
    }

    @Test
    void testBooleanField() throws ExpressionParseException, SolverTimeoutException {
        assertTrue(equivalent("github.event.pull_request.draft == false", "!github.event.pull_request.draft"));
        assertTrue(equivalent("github.event.pull_request.draft != true", "!github.event.pull_request.draft"));
    }

    @Test
    void testStringTruthiness() throws ExpressionParseException, SolverTimeoutException {
        assertTrue(equivalent("github.head_ref", "github.head_ref != ''"));
    }

    @Test
    void testRelationalOperatorIsOpaque() throws ExpressionParseException, SolverTimeoutException {
        assertTrue(equivalent("github.run_number > 5", "github.run_number > 5"));
        assertFalse(symbols.getUnsupportedClauses().isEmpty());
    }

    @Test
    void testOpaqueFunctionIsRecorded() throws ExpressionParseException, SolverTimeoutException {
        assertFalse(equivalent("hashFiles('**/go.sum') != ''", "true"));
        assertTrue(symbols.getUnsupportedClauses().stream().anyMatch(clause -> clause.contains("hashfiles")));
    }

    @Test
    void testCounterexampleNamesVariables() throws ExpressionParseException, SolverTimeoutException {
        Optional<Counterexample> difference = solver.findDifference("jobs.a.if",
                encode("github.event_name == 'push'"), encode("github.event_name == 'push' && !failure()"));

        assertTrue(difference.isPresent());
        assertEquals("true", difference.get().valuation().get(SymbolicContext.STATUS_FAILURE));
        assertEquals("push", difference.get().valuation().get("github.event_name"));
        assertTrue(difference.get().describe().startsWith("jobs.a.if: only the original version holds"));
        assertEquals(1, solver.getQueryCount());
    }

    @Test
    void testClosedContextRejectsUse() {
        symbols.close();

        assertThrows(IllegalStateException.class, () -> symbols.stringVariable("github.ref", 0));
    }

    @Test
    void testRejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new SolverSession(symbols, Duration.ZERO, logger));
    }
}
