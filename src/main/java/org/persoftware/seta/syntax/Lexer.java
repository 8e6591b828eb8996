package org.persoftware.seta.syntax;

import org.persoftware.seta.error.SetaError;
import org.persoftware.seta.lang.Result;
import org.persoftware.seta.tree.SourceLocation;
import org.persoftware.seta.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for Seta scripts.
 */
public final class Lexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 16;
    private static final String SYMBOL_KEYWORD = "symbol";

    private final String input;
    private int pos;
    private int line;
    private int column;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    /**
     * Split script text into tokens, ending with {@link Token.Eof}.
     *
     * @throws IllegalArgumentException if the input exceeds one million characters
     */
    public static Result<List<Token>> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
                "Script input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new Lexer(input).tokenizeAll();
    }

    private Result<List<Token>> tokenizeAll() {
        var tokens = new ArrayList<Token>();
        while (!isAtEnd()) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                break;
            }
            var start = currentLocation();
            var token = nextToken(start);
            if (token == null) {
                return Result.failure(new SetaError.LexError(start, input.charAt(start.offset())));
            }
            tokens.add(token);
        }
        tokens.add(new Token.Eof(currentSpan()));
        return Result.success(tokens);
    }

    /**
     * Next token starting at the current position, or {@code null} if no token starts with the current character.
     */
    private Token nextToken(SourceLocation start) {
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (isDigit(c) || (c == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
            return scanNumber(start);
        }
        return scanOperator(start);
    }

    private Token scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        var name = sb.toString();
        if (name.equals(SYMBOL_KEYWORD)) {
            return new Token.SymbolKeyword(span(start));
        }
        return new Token.Identifier(span(start), name);
    }

    private Token scanNumber(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        // Fraction part only when a digit follows the dot
        if (!isAtEnd() && peek() == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1))) {
            sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
        }
        return new Token.NumberLiteral(span(start), sb.toString());
    }

    private Token scanOperator(SourceLocation start) {
        char c = peek();
        switch (c) {
            case '+':
                advance();
                return new Token.Plus(span(start));
            case '-':
                advance();
                return new Token.Minus(span(start));
            case '*':
                advance();
                return new Token.Star(span(start));
            case '/':
            case '÷':
                advance();
                return new Token.Slash(span(start));
            case '^':
                advance();
                return new Token.Caret(span(start));
            case '=':
                advance();
                return new Token.Equals(span(start));
            case ',':
                advance();
                return new Token.Comma(span(start));
            case ';':
                advance();
                return new Token.Semicolon(span(start));
            case '(':
                advance();
                return new Token.LParen(span(start));
            case ')':
                advance();
                return new Token.RParen(span(start));
            default:
                return null;
        }
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '#') {
                // Line comment
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan currentSpan() {
        return SourceSpan.at(currentLocation());
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
