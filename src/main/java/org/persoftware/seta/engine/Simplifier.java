package org.persoftware.seta.engine;

import org.persoftware.seta.error.SetaException;
import org.persoftware.seta.expr.Algebra;
import org.persoftware.seta.expr.Expression;
import org.persoftware.seta.expr.Expression.Call;
import org.persoftware.seta.expr.Expression.Power;
import org.persoftware.seta.expr.Expression.Product;
import org.persoftware.seta.expr.Expression.Sum;
import org.persoftware.seta.expr.Expression.Symbol;
import org.persoftware.seta.lang.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Rewrites an arbitrary expression tree into its canonical form.
 *
 * <p>Each pass rebuilds the tree bottom-up through {@link Algebra}, which folds constants, eliminates identities,
 * merges terms and factors and orders them. Passes repeat until the tree stops changing or
 * {@link EngineConfig#maxSimplifyPasses()} is reached.
 */
public final class Simplifier {
    private static final Logger log = LoggerFactory.getLogger(Simplifier.class);

    private final EngineConfig config;

    public Simplifier(EngineConfig config) {
        this.config = config;
    }

    public Result<Expression> simplify(Expression expression) {
        try {
            return Result.success(canonical(expression));
        } catch (SetaException e) {
            return Result.failure(e.error());
        }
    }

    /**
     * Canonical form of the expression.
     *
     * @throws SetaException on division by zero or {@code 0^0}
     */
    Expression canonical(Expression expression) {
        var current = expression;
        for (int pass = 0; pass < config.maxSimplifyPasses(); pass++) {
            var next = rebuild(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        log.warn("Simplification stopped after {} passes without reaching a fixed point", config.maxSimplifyPasses());
        return current;
    }

    private static Expression rebuild(Expression expression) {
        if (expression instanceof Expression.Number n) {
            return Expression.number(n.value());
        }
        if (expression instanceof Symbol symbol) {
            return Expression.symbol(symbol.name());
        }
        if (expression instanceof Sum sum) {
            var operands = new ArrayList<Expression>();
            for (var term : sum.terms()) {
                operands.add(Algebra.scale(rebuild(term.term()), term.coefficient()));
            }
            return Algebra.sum(operands);
        }
        if (expression instanceof Product product) {
            var operands = new ArrayList<Expression>();
            operands.add(Expression.number(product.coefficient()));
            for (var factor : product.factors()) {
                operands.add(Algebra.power(rebuild(factor.base()), rebuild(factor.exponent())));
            }
            return Algebra.product(operands);
        }
        if (expression instanceof Power power) {
            return Algebra.power(rebuild(power.base()), rebuild(power.exponent()));
        }
        if (expression instanceof Call call) {
            var arguments = new ArrayList<Expression>();
            call.arguments().forEach(a -> arguments.add(rebuild(a)));
            return Algebra.call(call.function(), arguments);
        }
        throw new IllegalStateException("Unknown expression kind: " + expression.getClass());
    }
}
