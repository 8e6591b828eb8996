package org.persoftware.seta.error;

import org.persoftware.seta.expr.Expression;
import org.persoftware.seta.expr.Printer;
import org.persoftware.seta.lang.Cause;
import org.persoftware.seta.tree.SourceLocation;

import java.util.Optional;

/**
 * Errors raised while lexing, parsing, simplifying, differentiating, integrating or evaluating a script.
 */
public sealed interface SetaError extends Cause {

    /**
     * Script position the error refers to, if it has one.
     */
    default Optional<SourceLocation> position() {
        return Optional.empty();
    }

    /**
     * Character that starts no token.
     */
    record LexError(SourceLocation location, char unexpectedChar) implements SetaError {
        @Override
        public String message() {
            return "Unexpected character '" + unexpectedChar + "' at " + location;
        }

        @Override
        public Optional<SourceLocation> position() {
            return Optional.of(location);
        }
    }

    /**
     * Token that does not fit the grammar.
     */
    record ParseError(SourceLocation location, String expected, String found) implements SetaError {
        @Override
        public String message() {
            return "Unexpected " + found + " at " + location + ", expected " + expected;
        }

        @Override
        public Optional<SourceLocation> position() {
            return Optional.of(location);
        }
    }

    record RedeclarationError(String name, SourceLocation location) implements SetaError {
        @Override
        public String message() {
            return "Name '" + name + "' is already declared (at " + location + ")";
        }

        @Override
        public Optional<SourceLocation> position() {
            return Optional.of(location);
        }
    }

    record UndeclaredSymbolError(String name, SourceLocation location) implements SetaError {
        @Override
        public String message() {
            return "Name '" + name + "' is neither a declared symbol nor an assigned value (at " + location + ")";
        }

        @Override
        public Optional<SourceLocation> position() {
            return Optional.of(location);
        }
    }

    record DivisionByZeroError(String dividend) implements SetaError {
        @Override
        public String message() {
            return "Division of " + dividend + " by zero";
        }
    }

    record ZeroToZeroPowerError() implements SetaError {
        @Override
        public String message() {
            return "0^0 is undefined";
        }
    }

    enum DifferentiationFailure {
        UNSUPPORTED_FUNCTION
    }

    record DifferentiationError(DifferentiationFailure reason, String function, int arity) implements SetaError {
        @Override
        public String message() {
            return "Cannot differentiate " + function + " with " + arity + " argument(s): no derivative rule";
        }
    }

    enum IntegrationFailure {
        NOT_INTEGRABLE_ELEMENTARILY
    }

    record IntegrationError(IntegrationFailure reason, Expression integrand, String variable) implements SetaError {
        @Override
        public String message() {
            return "No elementary antiderivative found for " + Printer.render(integrand) + " with respect to "
                   + variable;
        }
    }

    record ArgumentError(String function, String reason, SourceLocation location) implements SetaError {
        @Override
        public String message() {
            return "Invalid arguments for " + function + ": " + reason + " (at " + location + ")";
        }

        @Override
        public Optional<SourceLocation> position() {
            return Optional.of(location);
        }
    }

    record UnknownFunctionError(String name, SourceLocation location) implements SetaError {
        @Override
        public String message() {
            return "Unknown statement function '" + name + "' at " + location;
        }

        @Override
        public Optional<SourceLocation> position() {
            return Optional.of(location);
        }
    }

    /**
     * Failure of one statement during evaluation; the remaining statements were not executed.
     */
    record EvalError(SourceLocation location, SetaError cause) implements SetaError {
        @Override
        public String message() {
            return "Statement at " + location + " failed: " + cause.message();
        }

        @Override
        public Optional<SourceLocation> position() {
            return Optional.of(cause.position().orElse(location));
        }
    }
}
