package org.persoftware.seta.expr;

import org.persoftware.seta.expr.Expression.Call;
import org.persoftware.seta.expr.Expression.Factor;
import org.persoftware.seta.expr.Expression.Power;
import org.persoftware.seta.expr.Expression.Product;
import org.persoftware.seta.expr.Expression.Sum;
import org.persoftware.seta.expr.Expression.Symbol;
import org.persoftware.seta.expr.Expression.Term;

import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Read-only traversals over expression trees.
 */
public final class Expressions {
    private Expressions() {}

    /**
     * Names of all symbols occurring in the expression, in lexicographic order.
     */
    public static NavigableSet<String> symbolNames(Expression expression) {
        var names = new TreeSet<String>();
        collectSymbols(expression, names);
        return names;
    }

    public static boolean isConstant(Expression expression) {
        return symbolNames(expression).isEmpty();
    }

    /**
     * Whether the symbol occurs anywhere in the expression.
     */
    public static boolean dependsOn(Expression expression, Symbol symbol) {
        if (expression instanceof Symbol s) {
            return s.equals(symbol);
        }
        if (expression instanceof Sum sum) {
            return sum.terms().stream().anyMatch(t -> dependsOn(t.term(), symbol));
        }
        if (expression instanceof Product product) {
            return product.factors()
                          .stream()
                          .anyMatch(f -> dependsOn(f.base(), symbol) || dependsOn(f.exponent(), symbol));
        }
        if (expression instanceof Power power) {
            return dependsOn(power.base(), symbol) || dependsOn(power.exponent(), symbol);
        }
        if (expression instanceof Call call) {
            return call.arguments().stream().anyMatch(a -> dependsOn(a, symbol));
        }
        return false;
    }

    /**
     * Number of tree nodes; a coefficient counts as a node unless it is one.
     */
    public static int nodeCount(Expression expression) {
        if (expression instanceof Sum sum) {
            int count = 1;
            for (Term term : sum.terms()) {
                count += nodeCount(term.term()) + (term.coefficient().isOne() ? 0 : 1);
            }
            return count;
        }
        if (expression instanceof Product product) {
            int count = product.coefficient().isOne() ? 1 : 2;
            for (Factor factor : product.factors()) {
                count += nodeCount(factor.base()) + nodeCount(factor.exponent());
            }
            return count;
        }
        if (expression instanceof Power power) {
            return 1 + nodeCount(power.base()) + nodeCount(power.exponent());
        }
        if (expression instanceof Call call) {
            return 1 + call.arguments().stream().mapToInt(Expressions::nodeCount).sum();
        }
        return 1;
    }

    /**
     * Polynomial-style degree used for ordering: symbols count one, numeric exponents multiply, functions count zero.
     */
    public static Rational degree(Expression expression) {
        if (expression instanceof Symbol) {
            return Rational.ONE;
        }
        if (expression instanceof Power power) {
            return powerDegree(power.base(), power.exponent());
        }
        if (expression instanceof Product product) {
            var degree = Rational.ZERO;
            for (Factor factor : product.factors()) {
                degree = degree.add(powerDegree(factor.base(), factor.exponent()));
            }
            return degree;
        }
        if (expression instanceof Sum sum) {
            var degree = Rational.ZERO;
            for (Term term : sum.terms()) {
                var termDegree = degree(term.term());
                if (termDegree.compareTo(degree) > 0) {
                    degree = termDegree;
                }
            }
            return degree;
        }
        return Rational.ZERO;
    }

    private static Rational powerDegree(Expression base, Expression exponent) {
        if (exponent instanceof Expression.Number n) {
            return degree(base).multiply(n.value());
        }
        return Rational.ZERO;
    }

    private static void collectSymbols(Expression expression, NavigableSet<String> names) {
        if (expression instanceof Symbol symbol) {
            names.add(symbol.name());
        } else if (expression instanceof Sum sum) {
            sum.terms().forEach(t -> collectSymbols(t.term(), names));
        } else if (expression instanceof Product product) {
            product.factors().forEach(f -> {
                collectSymbols(f.base(), names);
                collectSymbols(f.exponent(), names);
            });
        } else if (expression instanceof Power power) {
            collectSymbols(power.base(), names);
            collectSymbols(power.exponent(), names);
        } else if (expression instanceof Call call) {
            call.arguments().forEach(a -> collectSymbols(a, names));
        }
    }
}
