package org.persoftware.seta.eval;

import java.util.Arrays;
import java.util.Optional;

/**
 * Functions the evaluator executes itself instead of keeping them as {@code Call} nodes.
 */
public enum Builtin {
    DISPLAY("display", 1, 1, false),
    WRAP("wrap", 0, 1, false),
    BREAKPOINT("breakpoint", 0, 0, false),
    INTEGRATE("integrate", 2, 2, true),
    DIFFERENTIATE("differentiate", 2, 3, true),
    SIMPLIFY("simplify", 1, 1, true),
    SUBSTITUTE("substitute", 3, 3, true),
    EXPAND("expand", 1, 1, true);

    private final String functionName;
    private final int minArity;
    private final int maxArity;
    private final boolean computation;

    Builtin(String functionName, int minArity, int maxArity, boolean computation) {
        this.functionName = functionName;
        this.minArity = minArity;
        this.maxArity = maxArity;
        this.computation = computation;
    }

    public static Optional<Builtin> named(String name) {
        return Arrays.stream(values())
                     .filter(builtin -> builtin.functionName.equals(name))
                     .findFirst();
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Computations produce a value and may appear inside expressions; the others only work as statements.
     */
    public boolean isComputation() {
        return computation;
    }

    public boolean accepts(int arity) {
        return arity >= minArity && arity <= maxArity;
    }

    public String arityDescription() {
        if (minArity == maxArity) {
            return minArity + " argument(s)";
        }
        return minArity + " to " + maxArity + " arguments";
    }
}
