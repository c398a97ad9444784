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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits expression text into tokens.
 */
public final class ExpressionLexer {

    public enum TokenType {
        STRING, NUMBER, IDENTIFIER,
        DOT, STAR, COMMA, LPAREN, RPAREN, LBRACKET, RBRACKET,
        NOT, AND, OR, EQ, NE, LT, LE, GT, GE,
        EOF
    }

    public record Token(TokenType type, String text, int position) {
    }

    private ExpressionLexer() {
    }

    public static List<Token> tokenize(String text) throws ExpressionParseException {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = text.length();

        while (i < length) {
            char c = text.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            int start = i;
            if (c == '\'') {
                StringBuilder value = new StringBuilder();
                i++;
                boolean closed = false;
                while (i < length) {
                    char ch = text.charAt(i);
                    if (ch == '\'') {
                        if (i + 1 < length && text.charAt(i + 1) == '\'') {
                            value.append('\'');
                            i += 2;
                            continue;
                        }
                        closed = true;
                        i++;
                        break;
                    }
                    value.append(ch);
                    i++;
                }
                if (!closed) {
                    throw new ExpressionParseException(text, start, "Unterminated string literal");
                }
                tokens.add(new Token(TokenType.STRING, value.toString(), start));
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < length && Character.isDigit(text.charAt(i + 1)))) {
                i++;
                while (i < length && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, text.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_') {
                i++;
                while (i < length && isIdentifierPart(text.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(TokenType.IDENTIFIER, text.substring(start, i), start));
            } else {
                TokenType type;
                int width = 1;
                char next = i + 1 < length ? text.charAt(i + 1) : '\0';
                switch (c) {
                    case '.': type = TokenType.DOT; break;
                    case '*': type = TokenType.STAR; break;
                    case ',': type = TokenType.COMMA; break;
                    case '(': type = TokenType.LPAREN; break;
                    case ')': type = TokenType.RPAREN; break;
                    case '[': type = TokenType.LBRACKET; break;
                    case ']': type = TokenType.RBRACKET; break;
                    case '!':
                        if (next == '=') {
                            type = TokenType.NE;
                            width = 2;
                        } else {
                            type = TokenType.NOT;
                        }
                        break;
                    case '=':
                        if (next != '=') {
                            throw new ExpressionParseException(text, i, "Expected '==' but found '='");
                        }
                        type = TokenType.EQ;
                        width = 2;
                        break;
                    case '&':
                        if (next != '&') {
                            throw new ExpressionParseException(text, i, "Expected '&&'");
                        }
                        type = TokenType.AND;
                        width = 2;
                        break;
                    case '|':
                        if (next != '|') {
                            throw new ExpressionParseException(text, i, "Expected '||'");
                        }
                        type = TokenType.OR;
                        width = 2;
                        break;
                    case '<':
                        type = next == '=' ? TokenType.LE : TokenType.LT;
                        width = next == '=' ? 2 : 1;
                        break;
                    case '>':
                        type = next == '=' ? TokenType.GE : TokenType.GT;
                        width = next == '=' ? 2 : 1;
                        break;
                    default:
                        throw new ExpressionParseException(text, i, "Unexpected character '" + c + "'");
                }
                tokens.add(new Token(type, text.substring(i, i + width), start));
                i += width;
            }
        }

        tokens.add(new Token(TokenType.EOF, "", length));
        return tokens;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }
}
