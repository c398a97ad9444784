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

package dev.mars.ghaverify.logical.expression;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Call of a function other than {@code contains}, {@code startsWith} and {@code endsWith},
 * for example the status functions {@code success()} and {@code always()}. Function names are
 * case-insensitive and stored in lower case.
 */
public record FunctionCall(String name, List<Expression> arguments) implements Expression {

    public FunctionCall {
        Objects.requireNonNull(name, "Function name cannot be null");
        name = name.toLowerCase(Locale.ROOT);
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }

    public boolean isStatusFunction() {
        return arguments.isEmpty()
                && ("success".equals(name) || "always".equals(name)
                    || "failure".equals(name) || "cancelled".equals(name));
    }

    @Override
    public String toCanonicalString() {
        return name + arguments.stream()
                .map(Expression::toCanonicalString)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
