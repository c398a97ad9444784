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

import dev.mars.ghaverify.logical.expression.ExpressionLexer.Token;
import dev.mars.ghaverify.logical.expression.ExpressionLexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser for GitHub Actions expressions.
 *
 * <p>Grammar, lowest precedence first:
 * <pre>
 *   or         := and ('||' and)*
 *   and        := equality ('&amp;&amp;' equality)*
 *   equality   := relational (('==' | '!=') relational)*
 *   relational := unary (('&lt;' | '&lt;=' | '&gt;' | '&gt;=') unary)*
 *   unary      := '!' unary | primary
 *   primary    := literal | '(' or ')' | call | reference
 *   reference  := IDENT ('.' IDENT | '.' '*' | '[' or ']')*
 * </pre>
 * A surrounding {@code ${{ }}} wrapper is removed before parsing.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ExpressionParser {

    private static final String OPEN = "${{";
    private static final String CLOSE = "}}";

    public Expression parse(String text) throws ExpressionParseException {
        if (text == null || text.isBlank()) {
            throw new ExpressionParseException(String.valueOf(text), 0, "Expression is empty");
        }
        String source = stripTemplate(text);
        if (source.contains(OPEN)) {
            throw new ExpressionParseException(text, source.indexOf(OPEN), "Embedded template in a condition");
        }
        Cursor cursor = new Cursor(source, ExpressionLexer.tokenize(source));
        Expression expression = parseOr(cursor);
        if (cursor.peek().type() != TokenType.EOF) {
            throw cursor.error("Unexpected token '" + cursor.peek().text() + "'");
        }
        return expression;
    }

    /**
     * Removes a single {@code ${{ ... }}} wrapper spanning the whole text.
     */
    public static String stripTemplate(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith(OPEN) && trimmed.endsWith(CLOSE)
                && trimmed.indexOf(OPEN, OPEN.length()) < 0) {
            return trimmed.substring(OPEN.length(), trimmed.length() - CLOSE.length()).trim();
        }
        return trimmed;
    }

    private Expression parseOr(Cursor cursor) throws ExpressionParseException {
        Expression left = parseAnd(cursor);
        while (cursor.accept(TokenType.OR)) {
            left = new Or(left, parseAnd(cursor));
        }
        return left;
    }

    private Expression parseAnd(Cursor cursor) throws ExpressionParseException {
        Expression left = parseEquality(cursor);
        while (cursor.accept(TokenType.AND)) {
            left = new And(left, parseEquality(cursor));
        }
        return left;
    }

    private Expression parseEquality(Cursor cursor) throws ExpressionParseException {
        Expression left = parseRelational(cursor);
        while (true) {
            if (cursor.accept(TokenType.EQ)) {
                left = new Comparison(Comparison.Operator.EQ, left, parseRelational(cursor));
            } else if (cursor.accept(TokenType.NE)) {
                left = new Comparison(Comparison.Operator.NE, left, parseRelational(cursor));
            } else {
                return left;
            }
        }
    }

    private Expression parseRelational(Cursor cursor) throws ExpressionParseException {
        Expression left = parseUnary(cursor);
        while (true) {
            Comparison.Operator operator;
            if (cursor.accept(TokenType.LT)) {
                operator = Comparison.Operator.LT;
            } else if (cursor.accept(TokenType.LE)) {
                operator = Comparison.Operator.LE;
            } else if (cursor.accept(TokenType.GT)) {
                operator = Comparison.Operator.GT;
            } else if (cursor.accept(TokenType.GE)) {
                operator = Comparison.Operator.GE;
            } else {
                return left;
            }
            left = new Comparison(operator, left, parseUnary(cursor));
        }
    }

    private Expression parseUnary(Cursor cursor) throws ExpressionParseException {
        if (cursor.accept(TokenType.NOT)) {
            return new Not(parseUnary(cursor));
        }
        return parsePrimary(cursor);
    }

    private Expression parsePrimary(Cursor cursor) throws ExpressionParseException {
        Token token = cursor.peek();
        switch (token.type()) {
            case STRING:
                cursor.next();
                return Literal.string(token.text());
            case NUMBER:
                cursor.next();
                return new Literal(Literal.Type.NUMBER, token.text());
            case LPAREN:
                cursor.next();
                Expression inner = parseOr(cursor);
                cursor.expect(TokenType.RPAREN, "')'");
                return inner;
            case IDENTIFIER:
                return parseIdentifier(cursor);
            default:
                throw cursor.error(token.type() == TokenType.EOF
                        ? "Unexpected end of expression"
                        : "Unexpected token '" + token.text() + "'");
        }
    }

    private Expression parseIdentifier(Cursor cursor) throws ExpressionParseException {
        Token name = cursor.next();
        String lower = name.text().toLowerCase(Locale.ROOT);

        if (cursor.peek().type() == TokenType.LPAREN) {
            cursor.next();
            List<Expression> arguments = new ArrayList<>();
            if (!cursor.accept(TokenType.RPAREN)) {
                do {
                    arguments.add(parseOr(cursor));
                } while (cursor.accept(TokenType.COMMA));
                cursor.expect(TokenType.RPAREN, "')'");
            }
            return call(cursor, lower, arguments);
        }

        boolean hasAccessor = cursor.peek().type() == TokenType.DOT || cursor.peek().type() == TokenType.LBRACKET;
        if (!hasAccessor) {
            switch (lower) {
                case "true":
                    return Literal.bool(true);
                case "false":
                    return Literal.bool(false);
                case "null":
                    return Literal.nullLiteral();
                default:
                    break;
            }
        }

        StringBuilder path = new StringBuilder(name.text());
        while (true) {
            if (cursor.accept(TokenType.DOT)) {
                if (cursor.accept(TokenType.STAR)) {
                    path.append(".*");
                } else {
                    Token property = cursor.expect(TokenType.IDENTIFIER, "property name");
                    path.append('.').append(property.text());
                }
            } else if (cursor.accept(TokenType.LBRACKET)) {
                if (cursor.accept(TokenType.STAR)) {
                    cursor.expect(TokenType.RBRACKET, "']'");
                    path.append(".*");
                    continue;
                }
                Expression index = parseOr(cursor);
                cursor.expect(TokenType.RBRACKET, "']'");
                if (index instanceof Literal literal && literal.type() == Literal.Type.STRING) {
                    path.append('.').append(literal.value());
                } else {
                    path.append('[').append(index.toCanonicalString()).append(']');
                }
            } else {
                return new ContextRef(path.toString());
            }
        }
    }

    private Expression call(Cursor cursor, String name, List<Expression> arguments) throws ExpressionParseException {
        switch (name) {
            case "contains":
                requireArity(cursor, name, arguments, 2);
                return new Contains(arguments.get(0), arguments.get(1));
            case "startswith":
                requireArity(cursor, name, arguments, 2);
                return new StartsWith(arguments.get(0), arguments.get(1));
            case "endswith":
                requireArity(cursor, name, arguments, 2);
                return new EndsWith(arguments.get(0), arguments.get(1));
            default:
                return new FunctionCall(name, arguments);
        }
    }

    private void requireArity(Cursor cursor, String name, List<Expression> arguments, int arity)
            throws ExpressionParseException {
        if (arguments.size() != arity) {
            throw cursor.error(name + " expects " + arity + " arguments but got " + arguments.size());
        }
    }

    private static final class Cursor {
        private final String source;
        private final List<Token> tokens;
        private int index;

        Cursor(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            Token token = tokens.get(index);
            if (token.type() != TokenType.EOF) {
                index++;
            }
            return token;
        }

        boolean accept(TokenType type) {
            if (peek().type() == type) {
                next();
                return true;
            }
            return false;
        }

        Token expect(TokenType type, String description) throws ExpressionParseException {
            if (peek().type() != type) {
                throw error("Expected " + description);
            }
            return next();
        }

        ExpressionParseException error(String message) {
            return new ExpressionParseException(source, peek().position(), message);
        }
    }
}
