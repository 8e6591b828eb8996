package org.persoftware.seta.engine;

import org.persoftware.seta.error.SetaError;
import org.persoftware.seta.error.SetaException;
import org.persoftware.seta.expr.Algebra;
import org.persoftware.seta.expr.Expression;
import org.persoftware.seta.expr.Expression.Call;
import org.persoftware.seta.expr.Expression.Factor;
import org.persoftware.seta.expr.Expression.Power;
import org.persoftware.seta.expr.Expression.Product;
import org.persoftware.seta.expr.Expression.Sum;
import org.persoftware.seta.expr.Expression.Symbol;
import org.persoftware.seta.expr.Expressions;
import org.persoftware.seta.expr.Rational;
import org.persoftware.seta.lang.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.persoftware.seta.expr.Algebra.add;
import static org.persoftware.seta.expr.Algebra.call;
import static org.persoftware.seta.expr.Algebra.divide;
import static org.persoftware.seta.expr.Algebra.multiply;
import static org.persoftware.seta.expr.Algebra.negate;
import static org.persoftware.seta.expr.Algebra.power;
import static org.persoftware.seta.expr.Algebra.product;
import static org.persoftware.seta.expr.Algebra.scale;
import static org.persoftware.seta.expr.Algebra.subtract;
import static org.persoftware.seta.expr.Expression.ONE;
import static org.persoftware.seta.expr.Expression.number;

/**
 * Best-effort symbolic antiderivative by a bounded, ordered rule search.
 *
 * <p>Rules, first applicable wins:
 * <ol>
 *     <li>linearity - sums split term by term, constant factors move out, polynomial products are expanded;</li>
 *     <li>table lookup of elementary forms in the variable;</li>
 *     <li>integration by parts for two variable-dependent factors, choosing {@code u} by LIATE priority;</li>
 *     <li>substitution of a factor {@code f(g(x))} or {@code g(x)^n} whose cofactor is a constant multiple of
 *     {@code g'(x)}.</li>
 * </ol>
 * A step budget and a depth cap bound the search; running out of either fails the integral.
 */
public final class Integrator {
    private static final Logger log = LoggerFactory.getLogger(Integrator.class);

    // Placeholder variable of table lookups during substitution; the lexer cannot produce this name.
    private static final Symbol PLACEHOLDER = Expression.symbol("u'");
    private static final Expression MINUS_HALF = number(Rational.of(-1, 2));
    private static final Expression HALF = number(Rational.of(1, 2));

    private final EngineConfig config;
    private final Simplifier simplifier;
    private final Differentiator differentiator;

    public Integrator(EngineConfig config, Simplifier simplifier, Differentiator differentiator) {
        this.config = config;
        this.simplifier = simplifier;
        this.differentiator = differentiator;
    }

    /**
     * Antiderivative of the expression, or an {@link SetaError.IntegrationError} when no rule sequence finds one.
     */
    public Result<Expression> integrate(Expression expression, Symbol variable) {
        try {
            var integrand = simplifier.canonical(expression);
            var search = new Search(variable);
            var antiderivative = search.integrate(integrand, 0, 0);
            if (antiderivative.isPresent()) {
                return Result.success(simplifier.canonical(antiderivative.get()));
            }
            log.debug("No antiderivative of {} after {} steps", integrand, search.steps);
            return Result.failure(new SetaError.IntegrationError(
                SetaError.IntegrationFailure.NOT_INTEGRABLE_ELEMENTARILY,
                integrand,
                variable.name()));
        } catch (SetaException e) {
            return Result.failure(e.error());
        }
    }

    /**
     * State of one integral: the variable and the steps spent so far.
     */
    private final class Search {
        private final Symbol x;
        private int steps;
        private boolean exhausted;

        private Search(Symbol x) {
            this.x = x;
        }

        Optional<Expression> integrate(Expression f, int depth, int byPartsDepth) {
            if (exhausted) {
                return Optional.empty();
            }
            if (++steps > config.maxIntegrationSteps() || depth > config.maxIntegrationDepth()) {
                log.debug("Integration budget exhausted at depth {} after {} steps", depth, steps);
                exhausted = true;
                return Optional.empty();
            }
            if (!Expressions.dependsOn(f, x)) {
                return Optional.of(multiply(f, x));
            }
            var linear = linearity(f, depth, byPartsDepth);
            if (linear.isPresent()) {
                return linear.get();
            }
            var tabled = table(f, x);
            if (tabled.isPresent()) {
                log.debug("Table rule for {}", f);
                return tabled;
            }
            var parts = byParts(f, depth, byPartsDepth);
            if (parts.isPresent()) {
                log.debug("Integration by parts for {}", f);
                return parts;
            }
            var substituted = substitution(f);
            substituted.ifPresent(r -> log.debug("Substitution rule for {}", f));
            return substituted;
        }

        // === Rule 1: linearity ===

        /**
         * Outer option present when linearity applies; the inner option is the outcome of the split integrals.
         */
        private Optional<Optional<Expression>> linearity(Expression f, int depth, int byPartsDepth) {
            if (f instanceof Sum sum) {
                var parts = new ArrayList<Expression>();
                for (var term : sum.terms()) {
                    var part = integrate(Algebra.scale(term.term(), term.coefficient()), depth + 1, byPartsDepth);
                    if (part.isEmpty()) {
                        return Optional.of(Optional.empty());
                    }
                    parts.add(part.get());
                }
                return Optional.of(Optional.of(Algebra.sum(parts)));
            }
            if (f instanceof Product p) {
                var constant = new ArrayList<Expression>();
                var varying = new ArrayList<Expression>();
                constant.add(number(p.coefficient()));
                for (var factor : p.factors()) {
                    var operand = power(factor.base(), factor.exponent());
                    if (Expressions.dependsOn(operand, x)) {
                        varying.add(operand);
                    } else {
                        constant.add(operand);
                    }
                }
                if (constant.size() > 1 || !p.coefficient().isOne()) {
                    var scale = product(constant);
                    var rest = product(varying);
                    return Optional.of(integrate(rest, depth + 1, byPartsDepth).map(r -> multiply(scale, r)));
                }
            }
            if (isPolynomial(f) && !(f instanceof Sum)) {
                var expanded = Algebra.expand(f);
                if (expanded instanceof Sum) {
                    return Optional.of(integrate(expanded, depth + 1, byPartsDepth));
                }
            }
            return Optional.empty();
        }

        private boolean isPolynomial(Expression f) {
            if (f instanceof Expression.Number || f.equals(x)) {
                return true;
            }
            if (!Expressions.dependsOn(f, x)) {
                return f instanceof Symbol;
            }
            if (f instanceof Sum sum) {
                return sum.terms().stream().allMatch(t -> isPolynomial(t.term()));
            }
            if (f instanceof Product p) {
                return p.factors().stream().allMatch(this::isPolynomialFactor);
            }
            if (f instanceof Power p) {
                return isPolynomialFactor(new Factor(p.base(), p.exponent()));
            }
            return false;
        }

        private boolean isPolynomialFactor(Factor factor) {
            return factor.exponent() instanceof Expression.Number n
                   && n.value().isInteger()
                   && n.value().signum() > 0
                   && isPolynomial(factor.base());
        }

        // === Rule 3: integration by parts ===

        private Optional<Expression> byParts(Expression f, int depth, int byPartsDepth) {
            if (byPartsDepth >= config.maxByPartsDepth() || !(f instanceof Product p) || p.factors().size() != 2) {
                return Optional.empty();
            }
            var first = asExpression(p.factors().get(0));
            var second = asExpression(p.factors().get(1));
            var firstRank = liate(first);
            var secondRank = liate(second);
            if (firstRank.isEmpty() || secondRank.isEmpty()) {
                return Optional.empty();
            }
            var u = secondRank.get() < firstRank.get() ? second : first;
            var dv = u == first ? second : first;
            if (!Differentiator.canDifferentiate(u, x)) {
                return Optional.empty();
            }
            var v = integrate(dv, depth + 1, byPartsDepth + 1);
            if (v.isEmpty()) {
                return Optional.empty();
            }
            var remaining = multiply(v.get(), differentiator.derivative(u, x));
            if (Expressions.nodeCount(remaining) >= Expressions.nodeCount(f)) {
                log.debug("Integration by parts abandoned for {}: {} is not simpler", f, remaining);
                return Optional.empty();
            }
            return integrate(remaining, depth + 1, byPartsDepth + 1)
                .map(w -> subtract(multiply(u, v.get()), w));
        }

        /**
         * LIATE priority: logarithmic, inverse trigonometric, algebraic, trigonometric, exponential.
         */
        private Optional<Integer> liate(Expression factor) {
            if (factor instanceof Call call && call.arguments().size() == 1) {
                switch (call.function()) {
                    case "ln":
                        return Optional.of(0);
                    case "asin", "acos", "atan":
                        return Optional.of(1);
                    case "sin", "cos", "tan", "sinh", "cosh":
                        return Optional.of(3);
                    case "exp":
                        return Optional.of(4);
                    default:
                        return Optional.empty();
                }
            }
            if (isPolynomial(factor)) {
                return Optional.of(2);
            }
            if (factor instanceof Power p && !Expressions.dependsOn(p.base(), x)) {
                return Optional.of(4);
            }
            return Optional.empty();
        }

        // === Rule 4: substitution ===

        private Optional<Expression> substitution(Expression f) {
            List<Factor> factors;
            if (f instanceof Product p) {
                factors = p.factors();
            } else if (f instanceof Power p) {
                factors = List.of(new Factor(p.base(), p.exponent()));
            } else {
                factors = List.of(new Factor(f, ONE));
            }
            for (var factor : factors) {
                var base = factor.base();
                var exponent = factor.exponent();
                if (Expressions.dependsOn(exponent, x) || base.equals(x)) {
                    continue;
                }
                var cofactor = divide(f, power(base, exponent));
                if (base instanceof Call call && call.arguments().size() == 1 && !call.arguments().get(0).equals(x)) {
                    var inner = call.arguments().get(0);
                    var outer = power(call(call.function(), PLACEHOLDER), exponent);
                    var result = substitute(outer, inner, cofactor);
                    if (result.isPresent()) {
                        return result;
                    }
                }
                var result = substitute(power(PLACEHOLDER, exponent), base, cofactor);
                if (result.isPresent()) {
                    return result;
                }
            }
            return Optional.empty();
        }

        /**
         * {@code ∫ outer(g) * cofactor} when {@code cofactor = k * g'} for a constant {@code k}.
         */
        private Optional<Expression> substitute(Expression outer, Expression inner, Expression cofactor) {
            if (!Differentiator.canDifferentiate(inner, x)) {
                return Optional.empty();
            }
            var innerDerivative = differentiator.derivative(inner, x);
            if (innerDerivative.isZero()) {
                return Optional.empty();
            }
            var ratio = divide(cofactor, innerDerivative);
            if (Expressions.dependsOn(ratio, x)) {
                return Optional.empty();
            }
            return table(outer, PLACEHOLDER)
                .map(antiderivative -> multiply(ratio, Substitution.substitute(antiderivative, PLACEHOLDER, inner)));
        }

        private Expression asExpression(Factor factor) {
            return power(factor.base(), factor.exponent());
        }
    }

    // === Rule 2: table ===

    /**
     * Antiderivative of an elementary form in {@code t}, if the table has one.
     */
    static Optional<Expression> table(Expression f, Symbol t) {
        if (f.equals(t)) {
            return Optional.of(multiply(HALF, power(t, 2)));
        }
        if (f instanceof Power p) {
            return powerTable(p.base(), p.exponent(), t);
        }
        if (f instanceof Call call && call.arguments().size() == 1 && call.arguments().get(0).equals(t)) {
            return functionTable(call.function(), t);
        }
        return Optional.empty();
    }

    private static Optional<Expression> powerTable(Expression base, Expression exponent, Symbol t) {
        if (base.equals(t) && exponent instanceof Expression.Number n) {
            if (n.value().equals(Rational.MINUS_ONE)) {
                return Optional.of(call("ln", t));
            }
            var raised = add(exponent, ONE);
            return Optional.of(divide(power(t, raised), raised));
        }
        if (exponent.equals(t) && !Expressions.dependsOn(base, t) && !base.isOne()) {
            // c^t / ln(c)
            return Optional.of(divide(power(base, t), call("ln", base)));
        }
        if (exponent.equals(Expression.MINUS_ONE) && base.equals(add(power(t, 2), ONE))) {
            return Optional.of(call("atan", t));
        }
        if (exponent.equals(MINUS_HALF) && base.equals(subtract(ONE, power(t, 2)))) {
            return Optional.of(call("asin", t));
        }
        if (exponent.equals(number(-2)) && base.equals(call("cos", t))) {
            return Optional.of(call("tan", t));
        }
        if (exponent.equals(number(-2)) && base.equals(call("sin", t))) {
            return Optional.of(negate(divide(call("cos", t), call("sin", t))));
        }
        return Optional.empty();
    }

    private static Optional<Expression> functionTable(String function, Symbol t) {
        switch (function) {
            case "ln":
                // t*ln(t) - t
                return Optional.of(subtract(multiply(t, call("ln", t)), t));
            case "exp":
                return Optional.of(call("exp", t));
            case "sin":
                return Optional.of(negate(call("cos", t)));
            case "cos":
                return Optional.of(call("sin", t));
            case "tan":
                return Optional.of(negate(call("ln", call("cos", t))));
            case "sinh":
                return Optional.of(call("cosh", t));
            case "cosh":
                return Optional.of(call("sinh", t));
            case "asin":
                // t*asin(t) + (1 - t^2)^(1/2)
                return Optional.of(add(multiply(t, call("asin", t)), power(subtract(ONE, power(t, 2)), HALF)));
            case "acos":
                return Optional.of(subtract(multiply(t, call("acos", t)), power(subtract(ONE, power(t, 2)), HALF)));
            case "atan":
                // t*atan(t) - ln(t^2 + 1)/2
                return Optional.of(subtract(multiply(t, call("atan", t)),
                                            scale(call("ln", add(power(t, 2), ONE)), Rational.of(1, 2))));
            default:
                return Optional.empty();
        }
    }
}
