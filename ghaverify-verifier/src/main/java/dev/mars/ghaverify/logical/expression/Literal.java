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

import java.util.Objects;

/**
 * A string, number, boolean or null literal.
 */
public record Literal(Type type, String value) implements Expression {

    public enum Type {
        STRING, NUMBER, BOOLEAN, NULL
    }

    public Literal {
        Objects.requireNonNull(type, "Literal type cannot be null");
        value = type == Type.NULL ? null : Objects.requireNonNull(value, "Literal value cannot be null");
    }

    public static Literal string(String value) {
        return new Literal(Type.STRING, value);
    }

    public static Literal bool(boolean value) {
        return new Literal(Type.BOOLEAN, Boolean.toString(value));
    }

    public static Literal nullLiteral() {
        return new Literal(Type.NULL, null);
    }

    public boolean isTrue() {
        return type == Type.BOOLEAN && Boolean.parseBoolean(value);
    }

    public boolean isFalse() {
        return type == Type.BOOLEAN && !Boolean.parseBoolean(value);
    }

    @Override
    public String toCanonicalString() {
        switch (type) {
            case STRING:
                return "'" + value.replace("'", "''") + "'";
            case NULL:
                return "null";
            default:
                return value;
        }
    }
}
