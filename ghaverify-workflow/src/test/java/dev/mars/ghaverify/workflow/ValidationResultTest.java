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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ValidationResult
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class ValidationResultTest {

    @Test
    void testEmptyResultIsValid() {
        ValidationResult result = new ValidationResult();

        assertTrue(result.isValid());
        assertFalse(result.hasWarnings());
        assertTrue(result.getProblems().isEmpty());
    }

    @Test
    void testWarningsKeepResultValid() {
        ValidationResult result = new ValidationResult();
        result.addWarning("on", "Workflow declares no triggering events");

        assertTrue(result.isValid());
        assertTrue(result.hasWarnings());
        assertEquals(List.of(), result.getErrors());
        assertEquals("WARNING [on]: Workflow declares no triggering events", result.getWarnings().get(0).toString());
    }

    @Test
    void testAddAllKeepsOrderAndSeverity() {
        ValidationResult first = new ValidationResult();
        first.addWarning("jobs.a", "Job has neither steps nor a reusable workflow reference");
        ValidationResult second = new ValidationResult();
        second.addError("jobs.b.needs", "Dependency 'c' not found");

        first.addAll(second);

        assertFalse(first.isValid());
        assertEquals(2, first.getProblems().size());
        assertEquals("jobs.a", first.getProblems().get(0).path());
        ValidationResult.Problem error = first.getErrors().get(0);
        assertEquals(ValidationResult.Severity.ERROR, error.severity());
        assertEquals("jobs.b.needs", error.path());
        assertFalse(second.isValid());
    }

    @Test
    void testProblemRequiresMessage() {
        assertThrows(NullPointerException.class,
                () -> new ValidationResult.Problem(ValidationResult.Severity.ERROR, "jobs", null));
    }
}
