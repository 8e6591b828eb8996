package org.persoftware.seta.syntax;

import org.persoftware.seta.tree.SourceSpan;

/**
 * Token types of the script lexer.
 */
public sealed interface Token {
    SourceSpan span();

    // Identifiers and literals
    record Identifier(SourceSpan span, String name) implements Token {}

    /**
     * Numeric literal exactly as written, e.g. {@code 2} or {@code 0.25}.
     */
    record NumberLiteral(SourceSpan span, String text) implements Token {}

    // symbol
    record SymbolKeyword(SourceSpan span) implements Token {}

    // Operators
    record Plus(SourceSpan span) implements Token {}

    record Minus(SourceSpan span) implements Token {}

    record Star(SourceSpan span) implements Token {}

    // / or ÷
    record Slash(SourceSpan span) implements Token {}

    record Caret(SourceSpan span) implements Token {}

    record Equals(SourceSpan span) implements Token {}

    // Delimiters
    record Comma(SourceSpan span) implements Token {}

    record Semicolon(SourceSpan span) implements Token {}

    record LParen(SourceSpan span) implements Token {}

    record RParen(SourceSpan span) implements Token {}

    // Special
    record Eof(SourceSpan span) implements Token {}
}
