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

import java.util.Locale;
import java.util.Objects;

/**
 * Reference to a context property such as {@code github.ref}. Property names are
 * case-insensitive, so the path is stored in lower case.
 */
public record ContextRef(String path) implements Expression {

    public ContextRef {
        Objects.requireNonNull(path, "Path cannot be null");
        path = path.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toCanonicalString() {
        return path;
    }
}
