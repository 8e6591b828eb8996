package org.persoftware.seta.syntax;

import java.util.List;

/**
 * A parsed script: its statements in source order.
 */
public record Program(List<Statement> statements) {
    public Program {
        statements = List.copyOf(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
