package org.persoftware.seta.syntax;

import org.junit.jupiter.api.Test;
import org.persoftware.seta.error.SetaError;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    @Test
    void tokenize_symbolDeclaration_producesKeywordAndNames() {
        var tokens = Lexer.tokenize("symbol x, y;").unwrap();

        assertEquals(6, tokens.size());
        assertInstanceOf(Token.SymbolKeyword.class, tokens.get(0));
        assertEquals("x", ((Token.Identifier) tokens.get(1)).name());
        assertInstanceOf(Token.Comma.class, tokens.get(2));
        assertEquals("y", ((Token.Identifier) tokens.get(3)).name());
        assertInstanceOf(Token.Semicolon.class, tokens.get(4));
        assertInstanceOf(Token.Eof.class, tokens.get(5));
    }

    @Test
    void tokenize_operators_recognizesAll() {
        var tokens = Lexer.tokenize("+ - * / ÷ ^ = ( )").unwrap();

        assertInstanceOf(Token.Plus.class, tokens.get(0));
        assertInstanceOf(Token.Minus.class, tokens.get(1));
        assertInstanceOf(Token.Star.class, tokens.get(2));
        assertInstanceOf(Token.Slash.class, tokens.get(3));
        assertInstanceOf(Token.Slash.class, tokens.get(4));
        assertInstanceOf(Token.Caret.class, tokens.get(5));
        assertInstanceOf(Token.Equals.class, tokens.get(6));
        assertInstanceOf(Token.LParen.class, tokens.get(7));
        assertInstanceOf(Token.RParen.class, tokens.get(8));
    }

    @Test
    void tokenize_numbers_keepsLiteralText() {
        var tokens = Lexer.tokenize("12 0.25 .5").unwrap();

        assertEquals("12", ((Token.NumberLiteral) tokens.get(0)).text());
        assertEquals("0.25", ((Token.NumberLiteral) tokens.get(1)).text());
        assertEquals(".5", ((Token.NumberLiteral) tokens.get(2)).text());
    }

    @Test
    void tokenize_keywordPrefix_isIdentifier() {
        var tokens = Lexer.tokenize("symbols").unwrap();

        assertEquals("symbols", ((Token.Identifier) tokens.get(0)).name());
    }

    @Test
    void tokenize_comment_isSkippedAndLinesTracked() {
        var tokens = Lexer.tokenize("# header\n  x").unwrap();

        assertEquals(2, tokens.size());
        var start = tokens.get(0).span().start();
        assertEquals(2, start.line());
        assertEquals(3, start.column());
    }

    @Test
    void tokenize_unexpectedCharacter_failsWithPosition() {
        var result = Lexer.tokenize("x = 2 @ 3;");

        assertTrue(result.isFailure());
        var error = assertInstanceOf(SetaError.LexError.class, result.cause());
        assertEquals('@', error.unexpectedChar());
        assertEquals(1, error.location().line());
        assertEquals(7, error.location().column());
    }

    @Test
    void tokenize_oversizedInput_throws() {
        var input = "x".repeat(1_000_001);

        assertThrows(IllegalArgumentException.class, () -> Lexer.tokenize(input));
    }
}
