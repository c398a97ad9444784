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

import dev.mars.ghaverify.core.exceptions.VerificationException;

/**
 * Raised when workflow text cannot be turned into a {@link Workflow}. This is a per-file
 * condition: callers record it against the file pair and carry on.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class WorkflowParseException extends VerificationException {

    private final String source;
    private final int lineNumber;
    private final String fieldPath;

    public WorkflowParseException(String message) {
        this(null, -1, null, message, null);
    }

    public WorkflowParseException(String message, Throwable cause) {
        this(null, -1, null, message, cause);
    }

    public WorkflowParseException(String fieldPath, String message) {
        this(null, -1, fieldPath, message, null);
    }

    public WorkflowParseException(int lineNumber, String fieldPath, String message) {
        this(null, lineNumber, fieldPath, message, null);
    }

    public WorkflowParseException(String source, int lineNumber, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.lineNumber = lineNumber;
        this.fieldPath = fieldPath;
    }

    /**
     * Returns a copy of this exception attributed to the given file or pair identifier.
     */
    public WorkflowParseException withSource(String source) {
        WorkflowParseException copy = new WorkflowParseException(source, lineNumber, fieldPath,
                super.getMessage(), getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public String getSource() {
        return source;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (source != null) {
            sb.append("Workflow '").append(source).append("': ");
        }

        if (lineNumber > 0) {
            sb.append("Line ").append(lineNumber).append(": ");
        }

        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
