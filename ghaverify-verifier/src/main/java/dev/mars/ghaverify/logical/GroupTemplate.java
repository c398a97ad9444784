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

package dev.mars.ghaverify.logical;

import dev.mars.ghaverify.logical.expression.Expression;
import dev.mars.ghaverify.logical.expression.ExpressionParseException;
import dev.mars.ghaverify.logical.expression.ExpressionParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A string with embedded {@code ${{ }}} expressions, such as a concurrency group name.
 */
public final class GroupTemplate {

    /** Either literal text or an embedded expression; exactly one of the two is set. */
    public record Part(String text, Expression expression) {

        public boolean isLiteral() {
            return expression == null;
        }
    }

    private static final String OPEN = "${{";
    private static final String CLOSE = "}}";

    private final String source;
    private final List<Part> parts;

    private GroupTemplate(String source, List<Part> parts) {
        this.source = source;
        this.parts = List.copyOf(parts);
    }

    public static GroupTemplate parse(String source, ExpressionParser parser) throws ExpressionParseException {
        Objects.requireNonNull(source, "Template cannot be null");
        List<Part> parts = new ArrayList<>();
        int position = 0;
        while (position < source.length()) {
            int open = source.indexOf(OPEN, position);
            if (open < 0) {
                parts.add(new Part(source.substring(position), null));
                break;
            }
            if (open > position) {
                parts.add(new Part(source.substring(position, open), null));
            }
            int close = source.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                throw new ExpressionParseException(source, open, "Unterminated template expression");
            }
            String inner = source.substring(open + OPEN.length(), close);
            parts.add(new Part(null, parser.parse(inner)));
            position = close + CLOSE.length();
        }
        return new GroupTemplate(source, parts);
    }

    public String getSource() {
        return source;
    }

    public List<Part> getParts() {
        return parts;
    }

    @Override
    public String toString() {
        return source;
    }
}
