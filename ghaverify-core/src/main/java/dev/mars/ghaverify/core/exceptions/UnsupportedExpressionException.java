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

package dev.mars.ghaverify.core.exceptions;

/**
 * Thrown when a condition clause parses but falls outside the subset that can be
 * encoded for the solver (unknown context field, unknown function, mixed operand types).
 * Callers treat the clause as an unconstrained atom instead of failing.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class UnsupportedExpressionException extends VerificationException {

    private final String clause;

    public UnsupportedExpressionException(String clause, String message) {
        super(message);
        this.clause = clause;
    }

    public String getClause() {
        return clause;
    }

    @Override
    public String getMessage() {
        return String.format("Unsupported expression '%s': %s", clause, super.getMessage());
    }
}
