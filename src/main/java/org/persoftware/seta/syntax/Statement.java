package org.persoftware.seta.syntax;

import org.persoftware.seta.tree.SourceSpan;

import java.util.List;

/**
 * Top-level script statements.
 */
public sealed interface Statement {
    SourceSpan span();

    /**
     * symbol a, b;
     */
    record SymbolDeclaration(SourceSpan span, List<Syntax.Identifier> names) implements Statement {
        public SymbolDeclaration {
            names = List.copyOf(names);
        }
    }

    /**
     * name = expr;
     */
    record Assignment(SourceSpan span, Syntax.Identifier target, Syntax value) implements Statement {}

    /**
     * display(f); wrap();
     */
    record CallStatement(SourceSpan span, Syntax.Identifier function, List<Syntax> arguments) implements Statement {
        public CallStatement {
            arguments = List.copyOf(arguments);
        }
    }
}
