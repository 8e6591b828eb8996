package org.persoftware.seta.error;

import org.persoftware.seta.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Script error report in Rust style.
 *
 * <p>Example output:
 * <pre>
 * error[E004]: Name 'y' is neither a declared symbol nor an assigned value (at 2:9)
 *   --> script.seta:2:9
 *   |
 * 2 | f = x + y;
 *   |         ^ undeclared name
 *   |
 *   = help: declare it first with 'symbol y;'
 * </pre>
 *
 * @param code     Stable error code, one per error kind
 * @param message  Primary error message
 * @param location Script position, absent for errors raised by pure algebra
 * @param label    Text next to the caret
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(String code, String message, Optional<SourceLocation> location, String label,
                         List<String> notes) {

    public Diagnostic {
        notes = List.copyOf(notes);
    }

    /**
     * Diagnostic for an error; an {@link SetaError.EvalError} reports its underlying cause at the best known position.
     */
    public static Diagnostic of(SetaError error) {
        var position = error.position();
        var cause = error instanceof SetaError.EvalError evalError ? innermost(evalError) : error;
        var diagnostic = new Diagnostic(codeOf(cause), cause.message(), position, labelOf(cause), List.of());
        if (cause instanceof SetaError.UndeclaredSymbolError undeclared) {
            return diagnostic.withHelp("declare it first with 'symbol " + undeclared.name() + ";'");
        }
        if (cause instanceof SetaError.IntegrationError) {
            return diagnostic.withNote("integration rules tried: linearity, table, by parts, substitution");
        }
        return diagnostic;
    }

    private static SetaError innermost(SetaError.EvalError error) {
        var cause = error.cause();
        while (cause instanceof SetaError.EvalError nested) {
            cause = nested.cause();
        }
        return cause;
    }

    private static String codeOf(SetaError error) {
        if (error instanceof SetaError.LexError) {
            return "E001";
        }
        if (error instanceof SetaError.ParseError) {
            return "E002";
        }
        if (error instanceof SetaError.RedeclarationError) {
            return "E003";
        }
        if (error instanceof SetaError.UndeclaredSymbolError) {
            return "E004";
        }
        if (error instanceof SetaError.DivisionByZeroError) {
            return "E005";
        }
        if (error instanceof SetaError.ZeroToZeroPowerError) {
            return "E006";
        }
        if (error instanceof SetaError.DifferentiationError) {
            return "E007";
        }
        if (error instanceof SetaError.IntegrationError) {
            return "E008";
        }
        if (error instanceof SetaError.ArgumentError) {
            return "E009";
        }
        if (error instanceof SetaError.UnknownFunctionError) {
            return "E010";
        }
        return "E000";
    }

    private static String labelOf(SetaError error) {
        if (error instanceof SetaError.LexError) {
            return "unexpected character";
        }
        if (error instanceof SetaError.ParseError parseError) {
            return "expected " + parseError.expected();
        }
        if (error instanceof SetaError.RedeclarationError) {
            return "already declared";
        }
        if (error instanceof SetaError.UndeclaredSymbolError) {
            return "undeclared name";
        }
        if (error instanceof SetaError.UnknownFunctionError) {
            return "unknown function";
        }
        return "in this statement";
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(code, message, location, label, newNotes);
    }

    /**
     * Add a help suggestion.
     */
    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format with the offending source line and a caret under the error position.
     *
     * @param source   The script text
     * @param filename Optional filename for display
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        sb.append("error[").append(code).append("]: ").append(message).append("\n");
        if (location.isEmpty()) {
            notes.forEach(note -> sb.append("  = ").append(note).append("\n"));
            return sb.toString();
        }
        var loc = location.get();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        var lines = source.split("\n", -1);
        int gutterWidth = String.valueOf(loc.line()).length();
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        if (loc.line() >= 1 && loc.line() <= lines.length) {
            sb.append(String.format("%" + gutterWidth + "d", loc.line()))
              .append(" | ")
              .append(lines[loc.line() - 1])
              .append("\n");
            sb.append(" ".repeat(gutterWidth))
              .append(" | ")
              .append(" ".repeat(Math.max(0, loc.column() - 1)))
              .append("^ ")
              .append(label)
              .append("\n");
        }
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line form: {@code script:2:9: error[E004]: message}.
     */
    public String formatSimple() {
        var where = location.map(loc -> "script:" + loc.line() + ":" + loc.column()).orElse("script");
        return String.format("%s: error[%s]: %s", where, code, message);
    }
}
