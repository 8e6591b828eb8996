package org.persoftware.seta.expr;

import org.persoftware.seta.expr.Expression.Call;
import org.persoftware.seta.expr.Expression.Factor;
import org.persoftware.seta.expr.Expression.Power;
import org.persoftware.seta.expr.Expression.Product;
import org.persoftware.seta.expr.Expression.Sum;
import org.persoftware.seta.expr.Expression.Symbol;
import org.persoftware.seta.expr.Expression.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders expressions in script notation.
 *
 * <p>Sum terms are joined with {@code " + "} and {@code " - "}, products with {@code *} (numeric coefficient
 * first), and factors with negative numeric exponents move below a {@code /}. Parentheses appear only where the
 * parser would otherwise read a different tree.
 */
public final class Printer {
    private Printer() {}

    public static String render(Expression expression) {
        var sb = new StringBuilder();
        render(expression, sb);
        return sb.toString();
    }

    private static void render(Expression expression, StringBuilder sb) {
        if (expression instanceof Expression.Number n) {
            sb.append(n.value());
        } else if (expression instanceof Symbol symbol) {
            sb.append(symbol.name());
        } else if (expression instanceof Sum sum) {
            renderSum(sum, sb);
        } else if (expression instanceof Product product) {
            renderProduct(product.coefficient(), product.factors(), sb);
        } else if (expression instanceof Power power) {
            renderProduct(Rational.ONE, List.of(new Factor(power.base(), power.exponent())), sb);
        } else if (expression instanceof Call call) {
            sb.append(call.function()).append('(');
            sb.append(call.arguments().stream().map(Printer::render).collect(Collectors.joining(", ")));
            sb.append(')');
        }
    }

    private static void renderSum(Sum sum, StringBuilder sb) {
        boolean first = true;
        for (Term term : sum.terms()) {
            var coefficient = term.coefficient();
            if (first) {
                renderTerm(coefficient, term.term(), sb);
            } else if (coefficient.signum() < 0) {
                sb.append(" - ");
                renderTerm(coefficient.negate(), term.term(), sb);
            } else {
                sb.append(" + ");
                renderTerm(coefficient, term.term(), sb);
            }
            first = false;
        }
    }

    private static void renderTerm(Rational coefficient, Expression monomial, StringBuilder sb) {
        if (monomial.isOne()) {
            sb.append(coefficient);
        } else if (monomial instanceof Product p) {
            renderProduct(coefficient, p.factors(), sb);
        } else if (monomial instanceof Power p) {
            renderProduct(coefficient, List.of(new Factor(p.base(), p.exponent())), sb);
        } else {
            renderProduct(coefficient, List.of(new Factor(monomial, Expression.ONE)), sb);
        }
    }

    private static void renderProduct(Rational coefficient, List<Factor> factors, StringBuilder sb) {
        var numerator = new ArrayList<Factor>();
        var denominator = new ArrayList<Factor>();
        for (var factor : factors) {
            if (factor.exponent() instanceof Expression.Number n && n.value().signum() < 0) {
                denominator.add(new Factor(factor.base(), Expression.number(n.value().negate())));
            } else {
                numerator.add(factor);
            }
        }
        if (coefficient.signum() < 0) {
            sb.append('-');
            coefficient = coefficient.negate();
        }
        var below = new ArrayList<String>();
        if (numerator.isEmpty()) {
            sb.append(coefficient.numerator());
            if (!coefficient.isInteger()) {
                below.add(coefficient.denominator().toString());
            }
        } else {
            if (!coefficient.isOne()) {
                sb.append(coefficient).append('*');
            }
            sb.append(numerator.stream().map(Printer::renderFactor).collect(Collectors.joining("*")));
        }
        denominator.forEach(f -> below.add(renderFactor(f)));
        if (below.isEmpty()) {
            return;
        }
        sb.append('/');
        if (below.size() == 1) {
            sb.append(below.get(0));
        } else {
            sb.append('(').append(String.join("*", below)).append(')');
        }
    }

    private static String renderFactor(Factor factor) {
        var base = factor.base();
        var exponent = factor.exponent();
        if (exponent.isOne()) {
            return needsParenthesesAsFactor(base) ? "(" + render(base) + ")" : render(base);
        }
        var text = needsParenthesesAsBase(base) ? "(" + render(base) + ")" : render(base);
        return text + "^" + renderExponent(exponent);
    }

    private static String renderExponent(Expression exponent) {
        if (exponent instanceof Expression.Number n && n.value().isInteger() && n.value().signum() > 0) {
            return render(exponent);
        }
        if (exponent instanceof Symbol || exponent instanceof Call) {
            return render(exponent);
        }
        return "(" + render(exponent) + ")";
    }

    private static boolean needsParenthesesAsFactor(Expression base) {
        if (base instanceof Expression.Number n) {
            return n.value().signum() < 0 || !n.value().isInteger();
        }
        return base instanceof Sum || base instanceof Product;
    }

    private static boolean needsParenthesesAsBase(Expression base) {
        if (base instanceof Expression.Number n) {
            return n.value().signum() < 0 || !n.value().isInteger();
        }
        return base instanceof Sum || base instanceof Product || base instanceof Power;
    }
}
