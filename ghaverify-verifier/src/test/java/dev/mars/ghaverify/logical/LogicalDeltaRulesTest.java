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

import dev.mars.ghaverify.core.FixTag;
import dev.mars.ghaverify.logical.expression.Expression;
import dev.mars.ghaverify.logical.expression.ExpressionParseException;
import dev.mars.ghaverify.logical.expression.ExpressionParser;
import dev.mars.ghaverify.logical.expression.Literal;
import dev.mars.ghaverify.workflow.Workflow;
import dev.mars.ghaverify.workflow.WorkflowParseException;
import dev.mars.ghaverify.workflow.YamlWorkflowParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LogicalDeltaRulesTest {

    private final ExpressionParser parser = new ExpressionParser();
    private final LogicalDeltaRules all = new LogicalDeltaRules(EnumSet.allOf(FixTag.class), false);

    @Nested
    @DisplayName("Fork guards")
    class ForkGuards {

        @Test
        @DisplayName("Should strip a guard and keep the residue")
        void testStrip() throws ExpressionParseException {
            Optional<Expression> residue = all.stripForkGuards(
                    parser.parse("github.repository == 'acme/app' && github.ref == 'refs/heads/main'"));

            assertEquals(Optional.of(parser.parse("github.ref == 'refs/heads/main'")), residue);
        }

        @Test
        @DisplayName("Should leave true behind when the guard is the whole condition")
        void testWholeCondition() throws ExpressionParseException {
            assertEquals(Optional.of(Literal.bool(true)),
                    all.stripForkGuards(parser.parse("'owner' == github.repository_owner")));
        }

        @Test
        @DisplayName("Should find nothing to strip in an ordinary condition")
        void testNoGuard() throws ExpressionParseException {
            assertTrue(all.stripForkGuards(parser.parse("github.actor == 'owner'")).isEmpty());
        }

        @Test
        @DisplayName("Should not look inside disjunctions other than event scoping")
        void testNestedGuard() throws ExpressionParseException {
            assertTrue(all.stripForkGuards(
                    parser.parse("github.actor == 'bot' || github.repository_owner == 'owner'")).isEmpty());
        }

        @Test
        @DisplayName("Should be disabled without the tag or in strict mode")
        void testDisabled() throws ExpressionParseException {
            Expression guard = parser.parse("github.repository_owner == 'owner'");

            assertTrue(new LogicalDeltaRules(Set.of(), false).stripForkGuards(guard).isEmpty());
            assertTrue(new LogicalDeltaRules(EnumSet.allOf(FixTag.class), true).stripForkGuards(guard).isEmpty());
        }
    }

    @Nested
    @DisplayName("Trigger and concurrency deltas")
    class Deltas {

        private final YamlWorkflowParser yaml = new YamlWorkflowParser();

        private Workflow workflow(String on) throws WorkflowParseException {
            return yaml.parseFromString("on:\n" + on.indent(2) + "jobs:\n  a:\n    runs-on: x\n    steps: [{run: make}]\n");
        }

        @Test
        @DisplayName("Should accept newly added path filters only")
        void testPathFilterAddition() throws WorkflowParseException {
            Workflow original = workflow("push:\n  branches: [main]");
            Workflow added = workflow("push:\n  branches: [main]\n  paths-ignore: ['docs/**']");
            Workflow changed = workflow("push:\n  branches: [dev]\n  paths: ['src/**']");

            assertTrue(all.isPathFilterAddition(original.getTriggers(), added.getTriggers()));
            assertFalse(all.isPathFilterAddition(original.getTriggers(), changed.getTriggers()));
            assertFalse(all.isPathFilterAddition(original.getTriggers(), original.getTriggers()));
        }

        @Test
        @DisplayName("Should accept a new block or an added cancel-in-progress")
        void testConcurrencyAddition() throws WorkflowParseException {
            Workflow none = yaml.parseFromString("on: push\njobs: {}\n");
            Workflow plain = yaml.parseFromString("on: push\nconcurrency: ci\njobs: {}\n");
            Workflow cancelling = yaml.parseFromString(
                    "on: push\nconcurrency:\n  group: ci\n  cancel-in-progress: true\njobs: {}\n");

            assertTrue(all.isConcurrencyAddition(none.getConcurrency(), plain.getConcurrency()));
            assertTrue(all.isConcurrencyAddition(plain.getConcurrency(), cancelling.getConcurrency()));
            assertFalse(all.isConcurrencyAddition(cancelling.getConcurrency(), plain.getConcurrency()));
            assertFalse(all.isConcurrencyAddition(plain.getConcurrency(), none.getConcurrency()));
        }
    }
}
