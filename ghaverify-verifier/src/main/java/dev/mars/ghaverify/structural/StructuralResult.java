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

package dev.mars.ghaverify.structural;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a structural comparison. Safe iff no issue is critical.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@JsonPropertyOrder({"is_safe", "issues"})
public final class StructuralResult {

    private final List<StructuralIssue> issues;

    public StructuralResult(List<StructuralIssue> issues) {
        this.issues = List.copyOf(Objects.requireNonNull(issues, "Issues cannot be null"));
    }

    @JsonProperty("is_safe")
    public boolean isSafe() {
        return issues.stream().noneMatch(StructuralIssue::isCritical);
    }

    @JsonProperty("issues")
    public List<StructuralIssue> getIssues() {
        return issues;
    }

    @JsonIgnore
    public List<StructuralIssue> getCriticalIssues() {
        return issues.stream().filter(StructuralIssue::isCritical).toList();
    }

    @JsonIgnore
    public List<StructuralIssue> getWarnings() {
        return issues.stream().filter(issue -> !issue.isCritical()).toList();
    }

    public boolean hasIssue(IssueKind kind) {
        return issues.stream().anyMatch(issue -> issue.kind() == kind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return issues.equals(((StructuralResult) o).issues);
    }

    @Override
    public int hashCode() {
        return issues.hashCode();
    }

    @Override
    public String toString() {
        return "StructuralResult{" +
               "safe=" + isSafe() +
               ", issues=" + issues +
               '}';
    }
}
