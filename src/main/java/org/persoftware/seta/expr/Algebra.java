package org.persoftware.seta.expr;

import org.persoftware.seta.error.SetaError;
import org.persoftware.seta.error.SetaException;
import org.persoftware.seta.expr.Expression.Call;
import org.persoftware.seta.expr.Expression.Factor;
import org.persoftware.seta.expr.Expression.Power;
import org.persoftware.seta.expr.Expression.Product;
import org.persoftware.seta.expr.Expression.Sum;
import org.persoftware.seta.expr.Expression.Term;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.persoftware.seta.expr.Expression.MINUS_ONE;
import static org.persoftware.seta.expr.Expression.ONE;
import static org.persoftware.seta.expr.Expression.ZERO;
import static org.persoftware.seta.expr.Expression.number;

/**
 * Smart constructors producing canonical expressions from canonical operands.
 *
 * <p>Every constructor folds constants exactly, drops identities ({@code x+0}, {@code x*1}, {@code x*0},
 * {@code x^1}, {@code x^0}), flattens nested sums and products, merges equal terms and factors, and orders the
 * result with {@link CanonicalOrder}.
 *
 * @throws SetaException from any constructor on division by the constant zero or {@code 0^0}
 */
public final class Algebra {
    private static final Rational HALF = Rational.of(1, 2);
    private static final int MAX_FOLDED_EXPONENT = 1_000;
    private static final int MAX_EXPANDED_POWER = 32;

    private Algebra() {}

    // === Sums ===

    public static Expression add(Expression left, Expression right) {
        return sum(List.of(left, right));
    }

    public static Expression subtract(Expression left, Expression right) {
        return sum(List.of(left, negate(right)));
    }

    public static Expression sum(Iterable<? extends Expression> operands) {
        var terms = new TermCollector();
        for (var operand : operands) {
            terms.absorb(operand, Rational.ONE);
        }
        return terms.build();
    }

    // === Products ===

    public static Expression multiply(Expression left, Expression right) {
        return product(List.of(left, right));
    }

    public static Expression negate(Expression expression) {
        return scale(expression, Rational.MINUS_ONE);
    }

    public static Expression scale(Expression expression, Rational coefficient) {
        return product(List.of(number(coefficient), expression));
    }

    public static Expression divide(Expression dividend, Expression divisor) {
        if (divisor.isZero()) {
            throw new SetaException(new SetaError.DivisionByZeroError(Printer.render(dividend)));
        }
        return multiply(dividend, power(divisor, MINUS_ONE));
    }

    public static Expression product(Iterable<? extends Expression> operands) {
        var factors = new FactorCollector();
        for (var operand : operands) {
            factors.absorb(operand);
        }
        return factors.build();
    }

    // === Powers ===

    public static Expression power(Expression base, Expression exponent) {
        if (exponent instanceof Expression.Number n) {
            return numericExponent(base, n.value());
        }
        if (base.isOne()) {
            return ONE;
        }
        return new Power(base, exponent);
    }

    public static Expression power(Expression base, long exponent) {
        return power(base, number(exponent));
    }

    private static Expression numericExponent(Expression base, Rational exponent) {
        if (exponent.isZero()) {
            if (base.isZero()) {
                throw new SetaException(new SetaError.ZeroToZeroPowerError());
            }
            return ONE;
        }
        if (exponent.isOne()) {
            return base;
        }
        if (base instanceof Expression.Number b) {
            return numericPower(b.value(), exponent);
        }
        if (base instanceof Power p && exponent.isInteger()) {
            return power(p.base(), multiply(p.exponent(), number(exponent)));
        }
        if (base instanceof Product p && exponent.isInteger()) {
            var operands = new ArrayList<Expression>();
            operands.add(numericPower(p.coefficient(), exponent));
            for (var factor : p.factors()) {
                operands.add(power(factor.base(), multiply(factor.exponent(), number(exponent))));
            }
            return product(operands);
        }
        if (base instanceof Sum sum && isFoldable(exponent) && !leadingCoefficient(sum).isOne()) {
            return product(List.of(new Power(base, number(exponent))));
        }
        return new Power(base, number(exponent));
    }

    private static Expression numericPower(Rational base, Rational exponent) {
        if (base.isZero()) {
            if (exponent.signum() < 0) {
                throw new SetaException(new SetaError.DivisionByZeroError("0^" + exponent));
            }
            return ZERO;
        }
        if (base.isOne()) {
            return ONE;
        }
        var whole = exponent.numerator().divide(exponent.denominator());
        if (exponent.isInteger()) {
            if (whole.abs().compareTo(BigInteger.valueOf(MAX_FOLDED_EXPONENT)) > 0) {
                return new Power(number(base), number(exponent));
            }
            return number(base.pow(whole.intValueExact()));
        }
        if (base.signum() < 0) {
            return new Power(number(base), number(exponent));
        }
        var degree = exponent.denominator().bitLength() < 16 ? exponent.denominator().intValueExact() : 0;
        if (degree > 0) {
            var root = base.root(degree);
            if (root.isPresent()) {
                return numericPower(root.get(), Rational.of(exponent.numerator()));
            }
        }
        // b^(w + f) with 0 < f < 1, so that equal powers of one base always share the same fractional exponent
        if (exponent.signum() < 0) {
            whole = whole.subtract(BigInteger.ONE);
        }
        var fraction = exponent.subtract(Rational.of(whole));
        if (whole.signum() == 0) {
            return new Power(number(base), number(fraction));
        }
        return multiply(numericPower(base, Rational.of(whole)), new Power(number(base), number(fraction)));
    }

    // === Expansion ===

    /**
     * Distributes products over sums and multiplies out sums raised to small positive integer powers.
     */
    public static Expression expand(Expression expression) {
        if (expression instanceof Sum sum) {
            var operands = new ArrayList<Expression>();
            for (var term : sum.terms()) {
                operands.add(scale(expand(term.term()), term.coefficient()));
            }
            return sum(operands);
        }
        if (expression instanceof Product p) {
            Expression result = number(p.coefficient());
            for (var factor : p.factors()) {
                result = distribute(result, expand(asPower(factor)));
            }
            return result;
        }
        if (expression instanceof Power p && p.base() instanceof Sum && isExpandableExponent(p.exponent())) {
            var base = expand(p.base());
            int times = ((Expression.Number) p.exponent()).value().numerator().intValueExact();
            Expression result = ONE;
            for (int i = 0; i < times; i++) {
                result = distribute(result, base);
            }
            return result;
        }
        return expression;
    }

    private static boolean isExpandableExponent(Expression exponent) {
        return exponent instanceof Expression.Number n
               && n.value().isInteger()
               && n.value().signum() > 0
               && n.value().compareTo(Rational.of(MAX_EXPANDED_POWER)) <= 0;
    }

    private static Expression distribute(Expression left, Expression right) {
        var operands = new ArrayList<Expression>();
        for (var l : summands(left)) {
            for (var r : summands(right)) {
                operands.add(multiply(l, r));
            }
        }
        return sum(operands);
    }

    private static List<Expression> summands(Expression expression) {
        if (expression instanceof Sum sum) {
            var summands = new ArrayList<Expression>();
            sum.terms().forEach(t -> summands.add(scale(t.term(), t.coefficient())));
            return summands;
        }
        return List.of(expression);
    }

    // === Functions ===

    /**
     * Function application with the identities {@code ln(1)=0}, {@code exp(0)=1}, {@code sin(0)=0},
     * {@code cos(0)=1}, {@code tan(0)=0}, {@code ln(exp(u))=u}, {@code exp(ln(u))=u}; {@code sqrt(u)} becomes
     * {@code u^(1/2)}.
     */
    public static Expression call(String function, List<Expression> arguments) {
        if (arguments.size() != 1) {
            return new Call(function, arguments);
        }
        var argument = arguments.get(0);
        switch (function) {
            case "sqrt":
                return power(argument, number(HALF));
            case "ln":
                if (argument.isOne()) {
                    return ZERO;
                }
                if (argument instanceof Call inner && inner.function().equals("exp") && inner.arguments().size() == 1) {
                    return inner.arguments().get(0);
                }
                break;
            case "exp":
                if (argument.isZero()) {
                    return ONE;
                }
                if (argument instanceof Call inner && inner.function().equals("ln") && inner.arguments().size() == 1) {
                    return inner.arguments().get(0);
                }
                break;
            case "sin", "tan", "asin", "atan", "sinh":
                if (argument.isZero()) {
                    return ZERO;
                }
                break;
            case "cos", "cosh":
                if (argument.isZero()) {
                    return ONE;
                }
                break;
            default:
                break;
        }
        return new Call(function, arguments);
    }

    public static Expression call(String function, Expression argument) {
        return call(function, List.of(argument));
    }

    // === Collectors ===

    /**
     * Accumulates coefficients per monomial.
     */
    private static final class TermCollector {
        private final Map<Expression, Rational> coefficients = new LinkedHashMap<>();

        void absorb(Expression operand, Rational scale) {
            if (operand instanceof Expression.Number n) {
                add(ONE, n.value().multiply(scale));
            } else if (operand instanceof Sum sum) {
                for (var term : sum.terms()) {
                    absorb(term.term(), term.coefficient().multiply(scale));
                }
            } else if (operand instanceof Product p) {
                var factors = new FactorCollector();
                factors.absorb(p);
                var monomial = factors.monomial();
                if (monomial.isPresent()) {
                    add(monomial.get(), factors.coefficient.multiply(scale));
                } else {
                    add(operand, scale);
                }
            } else {
                add(operand, scale);
            }
        }

        private void add(Expression monomial, Rational coefficient) {
            coefficients.merge(monomial, coefficient, Rational::add);
        }

        Expression build() {
            var terms = new ArrayList<Term>();
            coefficients.forEach((monomial, coefficient) -> {
                if (!coefficient.isZero()) {
                    terms.add(new Term(coefficient, monomial));
                }
            });
            if (terms.isEmpty()) {
                return ZERO;
            }
            if (terms.size() == 1) {
                var term = terms.get(0);
                return scaled(term.coefficient(), term.term());
            }
            return new Sum(CanonicalOrder.sortTerms(terms));
        }

        private static Expression scaled(Rational coefficient, Expression monomial) {
            if (monomial.isOne()) {
                return number(coefficient);
            }
            if (coefficient.isOne()) {
                return monomial;
            }
            return product(List.of(number(coefficient), monomial));
        }
    }

    /**
     * Accumulates a numeric coefficient and an exponent per base.
     *
     * <p>A sum raised to an integer power is stored with leading coefficient one, its content moving into the
     * numeric coefficient. On build the coefficient goes back into the first plain sum factor, if there is one, so
     * the result does not depend on how the operands were grouped.
     */
    private static final class FactorCollector {
        private final Map<Expression, Expression> exponents = new LinkedHashMap<>();
        private final Set<Expression> merged = new HashSet<>();
        private Rational coefficient = Rational.ONE;

        void absorb(Expression operand) {
            if (operand instanceof Expression.Number n) {
                coefficient = coefficient.multiply(n.value());
            } else if (operand instanceof Product p) {
                coefficient = coefficient.multiply(p.coefficient());
                p.factors().forEach(f -> add(f.base(), f.exponent()));
            } else if (operand instanceof Power p) {
                add(p.base(), p.exponent());
            } else {
                add(operand, ONE);
            }
        }

        private void add(Expression base, Expression exponent) {
            if (base instanceof Sum sum && exponent instanceof Expression.Number n && isFoldable(n.value())) {
                var leading = leadingCoefficient(sum);
                if (!leading.isOne()) {
                    coefficient = coefficient.multiply(leading.pow(n.value().numerator().intValueExact()));
                    var primitive = new TermCollector();
                    primitive.absorb(sum, Rational.ONE.divide(leading));
                    base = primitive.build();
                }
            }
            var previous = exponents.get(base);
            if (previous == null) {
                exponents.put(base, exponent);
            } else {
                exponents.put(base, Algebra.add(previous, exponent));
                merged.add(base);
            }
        }

        Expression build() {
            var factors = new ArrayList<Factor>();
            var reabsorbed = new ArrayList<Expression>();
            for (var entry : exponents.entrySet()) {
                var base = entry.getKey();
                var exponent = entry.getValue();
                if (!merged.contains(base)) {
                    factors.add(new Factor(base, exponent));
                    continue;
                }
                var folded = power(base, exponent);
                if (folded.isOne()) {
                    continue;
                }
                if (isSingleFactor(folded, base, exponent)) {
                    factors.add(new Factor(base, exponent));
                } else {
                    reabsorbed.add(folded);
                }
            }
            if (coefficient.isZero()) {
                return ZERO;
            }
            if (!reabsorbed.isEmpty()) {
                var operands = new ArrayList<Expression>(reabsorbed);
                operands.add(number(coefficient));
                factors.forEach(f -> operands.add(asPower(f)));
                return product(operands);
            }
            if (factors.isEmpty()) {
                return number(coefficient);
            }
            var sorted = CanonicalOrder.sortFactors(factors);
            if (coefficient.isOne()) {
                return sorted.size() == 1 ? asPower(sorted.get(0)) : new Product(Rational.ONE, sorted);
            }
            for (int i = 0; i < sorted.size(); i++) {
                var factor = sorted.get(i);
                if (factor.base() instanceof Sum sum && factor.exponent().isOne()) {
                    var terms = new TermCollector();
                    terms.absorb(sum, coefficient);
                    if (sorted.size() == 1) {
                        return terms.build();
                    }
                    var scaled = terms.build();
                    if (exponents.containsKey(scaled)) {
                        // a non-integer power of the same sum keeps its own factor
                        break;
                    }
                    var spread = new ArrayList<>(sorted);
                    spread.set(i, new Factor(scaled, ONE));
                    return new Product(Rational.ONE, CanonicalOrder.sortFactors(spread));
                }
            }
            return new Product(coefficient, sorted);
        }

        /**
         * The collected factors without the coefficient; empty when merged factors still need refolding.
         */
        Optional<Expression> monomial() {
            if (!merged.isEmpty() || exponents.isEmpty()) {
                return Optional.empty();
            }
            var factors = new ArrayList<Factor>();
            exponents.forEach((base, exponent) -> factors.add(new Factor(base, exponent)));
            if (factors.size() == 1) {
                return Optional.of(asPower(factors.get(0)));
            }
            return Optional.of(new Product(Rational.ONE, CanonicalOrder.sortFactors(factors)));
        }

        private static boolean isSingleFactor(Expression folded, Expression base, Expression exponent) {
            if (exponent.isOne()) {
                return folded.equals(base) && !(base instanceof Product) && !(base instanceof Expression.Number);
            }
            return folded instanceof Power p && p.base().equals(base) && p.exponent().equals(exponent);
        }
    }

    private static Rational leadingCoefficient(Sum sum) {
        return sum.terms().get(0).coefficient();
    }

    private static boolean isFoldable(Rational exponent) {
        return exponent.isInteger() && exponent.abs().compareTo(Rational.of(MAX_FOLDED_EXPONENT)) <= 0;
    }

    private static Expression asPower(Factor factor) {
        return factor.exponent().isOne() ? factor.base() : new Power(factor.base(), factor.exponent());
    }
}
