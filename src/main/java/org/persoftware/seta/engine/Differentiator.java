package org.persoftware.seta.engine;

import org.persoftware.seta.error.SetaError;
import org.persoftware.seta.error.SetaException;
import org.persoftware.seta.expr.Expression;
import org.persoftware.seta.expr.Expression.Call;
import org.persoftware.seta.expr.Expression.Power;
import org.persoftware.seta.expr.Expression.Product;
import org.persoftware.seta.expr.Expression.Sum;
import org.persoftware.seta.expr.Expression.Symbol;
import org.persoftware.seta.expr.Expressions;
import org.persoftware.seta.expr.Rational;
import org.persoftware.seta.lang.Result;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

import static org.persoftware.seta.expr.Algebra.add;
import static org.persoftware.seta.expr.Algebra.call;
import static org.persoftware.seta.expr.Algebra.divide;
import static org.persoftware.seta.expr.Algebra.multiply;
import static org.persoftware.seta.expr.Algebra.negate;
import static org.persoftware.seta.expr.Algebra.power;
import static org.persoftware.seta.expr.Algebra.product;
import static org.persoftware.seta.expr.Algebra.scale;
import static org.persoftware.seta.expr.Algebra.subtract;
import static org.persoftware.seta.expr.Algebra.sum;
import static org.persoftware.seta.expr.Expression.ONE;
import static org.persoftware.seta.expr.Expression.ZERO;
import static org.persoftware.seta.expr.Expression.number;

/**
 * Symbolic derivative by recursive descent, one call per subexpression.
 */
public final class Differentiator {
    private static final Set<String> SUPPORTED = Set.of("ln", "exp", "sin", "cos", "tan", "sinh", "cosh",
                                                        "asin", "acos", "atan");

    private final Simplifier simplifier;

    public Differentiator(Simplifier simplifier) {
        this.simplifier = simplifier;
    }

    public static boolean supports(String function) {
        return SUPPORTED.contains(function);
    }

    public Result<Expression> differentiate(Expression expression, Symbol variable) {
        return differentiate(expression, variable, 1);
    }

    /**
     * The {@code order}-th derivative.
     */
    public Result<Expression> differentiate(Expression expression, Symbol variable, int order) {
        try {
            var current = simplifier.canonical(expression);
            for (int i = 0; i < order; i++) {
                current = simplifier.canonical(derivative(current, variable));
            }
            return Result.success(current);
        } catch (SetaException e) {
            return Result.failure(e.error());
        }
    }

    /**
     * Derivative of a canonical expression, built from canonical parts. Subexpressions free of the variable
     * differentiate to zero whatever functions they contain.
     *
     * @throws SetaException with a {@link SetaError.DifferentiationError} for functions without a rule
     */
    Expression derivative(Expression expression, Symbol variable) {
        if (!Expressions.dependsOn(expression, variable)) {
            return ZERO;
        }
        if (expression instanceof Symbol) {
            return ONE;
        }
        if (expression instanceof Sum s) {
            var terms = new ArrayList<Expression>();
            for (var term : s.terms()) {
                terms.add(scale(derivative(term.term(), variable), term.coefficient()));
            }
            return sum(terms);
        }
        if (expression instanceof Product p) {
            return scale(productRule(p, variable), p.coefficient());
        }
        if (expression instanceof Power p) {
            return powerRule(p.base(), p.exponent(), variable);
        }
        if (expression instanceof Call c) {
            return chainRule(c, variable);
        }
        throw new IllegalStateException("Unknown expression kind: " + expression.getClass());
    }

    /**
     * Whether every function applied to a subexpression that depends on the variable has a derivative rule.
     */
    static boolean canDifferentiate(Expression expression, Symbol variable) {
        if (!Expressions.dependsOn(expression, variable)) {
            return true;
        }
        if (expression instanceof Sum s) {
            return s.terms().stream().allMatch(t -> canDifferentiate(t.term(), variable));
        }
        if (expression instanceof Product p) {
            return p.factors()
                    .stream()
                    .allMatch(f -> canDifferentiate(f.base(), variable) && canDifferentiate(f.exponent(), variable));
        }
        if (expression instanceof Power p) {
            return canDifferentiate(p.base(), variable) && canDifferentiate(p.exponent(), variable);
        }
        if (expression instanceof Call c) {
            return isSupported(c) && canDifferentiate(c.arguments().get(0), variable);
        }
        return true;
    }

    private Expression productRule(Product product, Symbol variable) {
        var factors = product.factors();
        var terms = new ArrayList<Expression>();
        for (int i = 0; i < factors.size(); i++) {
            var operands = new ArrayList<Expression>();
            for (int j = 0; j < factors.size(); j++) {
                var factor = factors.get(j);
                if (i == j) {
                    operands.add(powerRule(factor.base(), factor.exponent(), variable));
                } else {
                    operands.add(power(factor.base(), factor.exponent()));
                }
            }
            terms.add(product(operands));
        }
        return sum(terms);
    }

    private Expression powerRule(Expression base, Expression exponent, Symbol variable) {
        var baseVaries = Expressions.dependsOn(base, variable);
        var exponentVaries = Expressions.dependsOn(exponent, variable);
        if (!exponentVaries) {
            if (exponent.isOne()) {
                return derivative(base, variable);
            }
            // n * b^(n-1) * b'
            return product(List.of(exponent, power(base, subtract(exponent, ONE)), derivative(base, variable)));
        }
        var self = power(base, exponent);
        if (!baseVaries) {
            // b^e * ln(b) * e'
            return product(List.of(self, call("ln", base), derivative(exponent, variable)));
        }
        // b^e * (e' * ln(b) + e * b' / b)
        var logarithmic = add(multiply(derivative(exponent, variable), call("ln", base)),
                              divide(multiply(exponent, derivative(base, variable)), base));
        return multiply(self, logarithmic);
    }

    private Expression chainRule(Call call, Symbol variable) {
        requireSupported(call);
        var argument = call.arguments().get(0);
        var outer = outerDerivative(call.function()).apply(argument);
        return multiply(outer, derivative(argument, variable));
    }

    private static UnaryOperator<Expression> outerDerivative(String function) {
        switch (function) {
            case "ln":
                return u -> power(u, -1);
            case "exp":
                return u -> call("exp", u);
            case "sin":
                return u -> call("cos", u);
            case "cos":
                return u -> negate(call("sin", u));
            case "tan":
                return u -> power(call("cos", u), -2);
            case "sinh":
                return u -> call("cosh", u);
            case "cosh":
                return u -> call("sinh", u);
            case "asin":
                return u -> power(subtract(ONE, power(u, 2)), number(Rational.of(-1, 2)));
            case "acos":
                return u -> negate(power(subtract(ONE, power(u, 2)), number(Rational.of(-1, 2))));
            case "atan":
                return u -> power(add(ONE, power(u, 2)), -1);
            default:
                throw new IllegalStateException("No derivative rule for " + function);
        }
    }

    private static boolean isSupported(Call call) {
        return SUPPORTED.contains(call.function()) && call.arguments().size() == 1;
    }

    private static void requireSupported(Call call) {
        if (!isSupported(call)) {
            throw new SetaException(new SetaError.DifferentiationError(
                SetaError.DifferentiationFailure.UNSUPPORTED_FUNCTION,
                call.function(),
                call.arguments().size()));
        }
    }
}
