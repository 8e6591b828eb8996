package org.persoftware.seta.error;

/**
 * Unchecked carrier of a {@link SetaError} through code that builds expressions.
 *
 * <p>Raised by the algebra on constant-folding faults and by the evaluator while lowering a statement; the public
 * entry points of the engines and the evaluator turn it into a failed {@link org.persoftware.seta.lang.Result}.
 */
public final class SetaException extends RuntimeException {
    private final SetaError error;

    public SetaException(SetaError error) {
        super(error.message());
        this.error = error;
    }

    public SetaError error() {
        return error;
    }
}
