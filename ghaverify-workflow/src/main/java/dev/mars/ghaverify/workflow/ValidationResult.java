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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Consistency problems of a single parsed workflow, such as a {@code needs} entry naming an
 * unknown job. Errors make the workflow invalid; warnings are informational. Problems keep the
 * order in which they were found.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ValidationResult {

    public enum Severity {
        ERROR, WARNING
    }

    /**
     * One problem, located by a dotted path such as {@code jobs.test.needs}.
     */
    public record Problem(Severity severity, String path, String message) {

        public Problem {
            Objects.requireNonNull(severity, "Severity cannot be null");
            Objects.requireNonNull(path, "Path cannot be null");
            Objects.requireNonNull(message, "Message cannot be null");
        }

        public boolean isError() {
            return severity == Severity.ERROR;
        }

        @Override
        public String toString() {
            return severity + " [" + path + "]: " + message;
        }
    }

    private final List<Problem> problems = new ArrayList<>();

    public void addError(String path, String message) {
        problems.add(new Problem(Severity.ERROR, path, message));
    }

    public void addWarning(String path, String message) {
        problems.add(new Problem(Severity.WARNING, path, message));
    }

    public void addAll(ValidationResult other) {
        problems.addAll(other.problems);
    }

    public List<Problem> getProblems() {
        return List.copyOf(problems);
    }

    public List<Problem> getErrors() {
        return problems.stream().filter(Problem::isError).toList();
    }

    public List<Problem> getWarnings() {
        return problems.stream().filter(problem -> !problem.isError()).toList();
    }

    public boolean isValid() {
        return problems.stream().noneMatch(Problem::isError);
    }

    public boolean hasWarnings() {
        return problems.stream().anyMatch(problem -> !problem.isError());
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid() + ", problems=" + problems + '}';
    }
}
