package org.persoftware.seta.syntax;

import org.persoftware.seta.tree.SourceSpan;

import java.util.List;

/**
 * Expression syntax as written in a script, before lowering to {@link org.persoftware.seta.expr.Expression}.
 */
public sealed interface Syntax {

    /**
     * Source location of this expression in the script.
     */
    SourceSpan span();

    // === Atoms ===

    /**
     * Numeric literal: 2, 0.25
     */
    record NumberLiteral(SourceSpan span, String text) implements Syntax {}

    /**
     * Name reference: x, f
     */
    record Identifier(SourceSpan span, String name) implements Syntax {}

    /**
     * Function application: ln(x), integrate(f, x)
     */
    record Invocation(SourceSpan span, String function, List<Syntax> arguments) implements Syntax {
        public Invocation {
            arguments = List.copyOf(arguments);
        }
    }

    // === Operators ===

    /**
     * Unary minus: -e
     */
    record Negate(SourceSpan span, Syntax operand) implements Syntax {}

    /**
     * Binary operation: a + b, a ^ b
     */
    record Binary(SourceSpan span, Operator operator, Syntax left, Syntax right) implements Syntax {}

    enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        POWER("^");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }
}
