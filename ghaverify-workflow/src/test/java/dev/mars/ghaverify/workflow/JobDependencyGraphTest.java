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

package dev.mars.ghaverify.workflow;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
/**
 * Tests for JobDependencyGraph
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 1.0
 */

class JobDependencyGraphTest {

    private JobDependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new JobDependencyGraph();
    }

    @Test
    void testEmptyGraph() throws WorkflowParseException {
        assertTrue(graph.getJobs().isEmpty());
        assertTrue(graph.topologicalSort().isEmpty());
        assertFalse(graph.hasCycles());
        assertTrue(graph.validate().isValid());
    }

    @Test
    void testLinearDependency() throws WorkflowParseException {
        graph.addJob(createJob("deploy", List.of("test")));
        graph.addJob(createJob("build", List.of()));
        graph.addJob(createJob("test", List.of("build")));

        assertEquals(List.of("build", "test", "deploy"), graph.topologicalSort());
        assertFalse(graph.hasCycles());
    }

    @Test
    void testDiamondKeepsDocumentOrderForTies() throws WorkflowParseException {
        graph.addJob(createJob("build", List.of()));
        graph.addJob(createJob("unit", List.of("build")));
        graph.addJob(createJob("lint", List.of("build")));
        graph.addJob(createJob("release", List.of("unit", "lint")));

        assertEquals(List.of("build", "unit", "lint", "release"), graph.topologicalSort());
    }

    @Test
    void testCircularDependency() {
        graph.addJob(createJob("a", List.of("c")));
        graph.addJob(createJob("b", List.of("a")));
        graph.addJob(createJob("c", List.of("b")));

        assertTrue(graph.hasCycles());
        WorkflowParseException e = assertThrows(WorkflowParseException.class, graph::topologicalSort);
        assertTrue(e.getMessage().contains("Circular dependency"));
    }

    @Test
    void testSelfDependency() {
        graph.addJob(createJob("a", List.of("a")));

        ValidationResult result = graph.validate();

        assertFalse(result.isValid());
        assertTrue(result.getErrors().stream().anyMatch(i -> i.message().contains("itself")));
    }

    @Test
    void testMissingDependency() {
        graph.addJob(createJob("test", List.of("build")));

        ValidationResult result = graph.validate();

        assertFalse(result.isValid());
        assertEquals(1, result.getErrors().size());
        assertEquals("Dependency 'build' not found", result.getErrors().get(0).message());
    }

    @Test
    void testFromWorkflow() throws WorkflowParseException {
        Workflow workflow = new YamlWorkflowParser().parseFromString("""
                on: push
                jobs:
                  test:
                    needs: build
                    steps: [{run: make test}]
                  build:
                    steps: [{run: make}]
                """);

        JobDependencyGraph fromWorkflow = JobDependencyGraph.of(workflow);

        assertEquals(List.of("build", "test"), fromWorkflow.topologicalSort());
        assertEquals(java.util.Set.of("build"), fromWorkflow.getDependencies("test"));
    }

    private Job createJob(String id, List<String> needs) {
        return new Job(id, null, null, null, needs, null, null, null, null, null,
                List.of(), null, YamlNode.emptyMapping());
    }
}
