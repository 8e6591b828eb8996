package org.persoftware.seta.engine;

import org.persoftware.seta.expr.Algebra;
import org.persoftware.seta.expr.Expression;
import org.persoftware.seta.expr.Expression.Call;
import org.persoftware.seta.expr.Expression.Power;
import org.persoftware.seta.expr.Expression.Product;
import org.persoftware.seta.expr.Expression.Sum;
import org.persoftware.seta.expr.Expression.Symbol;
import org.persoftware.seta.expr.Expressions;

import java.util.ArrayList;

/**
 * Replaces every occurrence of a symbol and rebuilds the tree in canonical form.
 */
public final class Substitution {
    private Substitution() {}

    /**
     * @throws org.persoftware.seta.error.SetaException if the replacement makes a constant fold fail
     */
    public static Expression substitute(Expression expression, Symbol symbol, Expression replacement) {
        if (!Expressions.dependsOn(expression, symbol)) {
            return expression;
        }
        if (expression instanceof Symbol) {
            return replacement;
        }
        if (expression instanceof Sum sum) {
            var operands = new ArrayList<Expression>();
            for (var term : sum.terms()) {
                operands.add(Algebra.scale(substitute(term.term(), symbol, replacement), term.coefficient()));
            }
            return Algebra.sum(operands);
        }
        if (expression instanceof Product product) {
            var operands = new ArrayList<Expression>();
            operands.add(Expression.number(product.coefficient()));
            for (var factor : product.factors()) {
                operands.add(Algebra.power(substitute(factor.base(), symbol, replacement),
                                           substitute(factor.exponent(), symbol, replacement)));
            }
            return Algebra.product(operands);
        }
        if (expression instanceof Power power) {
            return Algebra.power(substitute(power.base(), symbol, replacement),
                                 substitute(power.exponent(), symbol, replacement));
        }
        if (expression instanceof Call call) {
            var arguments = new ArrayList<Expression>();
            call.arguments().forEach(a -> arguments.add(substitute(a, symbol, replacement)));
            return Algebra.call(call.function(), arguments);
        }
        return expression;
    }
}
