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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionLexerTest {

    private static List<TokenType> types(String text) throws ExpressionParseException {
        return ExpressionLexer.tokenize(text).stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    void testComparison() throws ExpressionParseException {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER, TokenType.EQ,
                TokenType.STRING, TokenType.EOF), types("github.ref == 'refs/heads/main'"));
    }

    @Test
    void testOperators() throws ExpressionParseException {
        assertEquals(List.of(TokenType.NOT, TokenType.LPAREN, TokenType.IDENTIFIER, TokenType.AND,
                TokenType.IDENTIFIER, TokenType.OR, TokenType.IDENTIFIER, TokenType.NE, TokenType.NUMBER,
                TokenType.RPAREN, TokenType.LE, TokenType.NUMBER, TokenType.EOF), types("!(a && b || c != 1) <= -2"));
    }

    @Test
    void testEscapedQuote() throws ExpressionParseException {
        Token token = ExpressionLexer.tokenize("'it''s'").get(0);

        assertEquals(TokenType.STRING, token.type());
        assertEquals("it's", token.text());
    }

    @Test
    void testHyphenatedIdentifier() throws ExpressionParseException {
        Token token = ExpressionLexer.tokenize("needs.build-linux.result").get(2);

        assertEquals("build-linux", token.text());
        assertEquals(6, token.position());
    }

    @Test
    void testErrors() {
        ExpressionParseException single = assertThrows(ExpressionParseException.class,
                () -> ExpressionLexer.tokenize("a = b"));
        assertEquals(2, single.getPosition());

        assertThrows(ExpressionParseException.class, () -> ExpressionLexer.tokenize("a & b"));
        assertThrows(ExpressionParseException.class, () -> ExpressionLexer.tokenize("a | b"));
        assertThrows(ExpressionParseException.class, () -> ExpressionLexer.tokenize("'open"));
        assertThrows(ExpressionParseException.class, () -> ExpressionLexer.tokenize("a # b"));
    }
}
