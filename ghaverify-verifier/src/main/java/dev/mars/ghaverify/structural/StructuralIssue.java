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

import java.util.Objects;

/**
 * A single structural difference between two workflows. Only {@link Severity#CRITICAL}
 * issues make a pair unsafe.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public record StructuralIssue(Severity severity, IssueKind kind, String path, String message) {

    public enum Severity {
        CRITICAL, WARNING
    }

    public StructuralIssue {
        Objects.requireNonNull(severity, "Severity cannot be null");
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(path, "Path cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
    }

    public static StructuralIssue critical(IssueKind kind, String path, String message) {
        return new StructuralIssue(Severity.CRITICAL, kind, path, message);
    }

    public static StructuralIssue warning(IssueKind kind, String path, String message) {
        return new StructuralIssue(Severity.WARNING, kind, path, message);
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }

    @Override
    public String toString() {
        return severity + " " + kind + " [" + path + "]: " + message;
    }
}
