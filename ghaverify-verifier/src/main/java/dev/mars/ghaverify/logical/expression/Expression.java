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

/**
 * Typed syntax tree of a GitHub Actions expression such as an {@code if} condition.
 *
 * <p>Every node renders to a canonical text form. Two expressions with the same canonical
 * text are syntactically identical after normalization: wrapper, whitespace and context-name
 * case differences are gone.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public sealed interface Expression
        permits Literal, ContextRef, Comparison, Contains, StartsWith, EndsWith, And, Or, Not, FunctionCall {

    String toCanonicalString();
}
