package org.persoftware.seta.expr;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;
import org.persoftware.seta.expr.Expression.Call;
import org.persoftware.seta.expr.Expression.Factor;
import org.persoftware.seta.expr.Expression.Power;
import org.persoftware.seta.expr.Expression.Product;
import org.persoftware.seta.expr.Expression.Sum;
import org.persoftware.seta.expr.Expression.Symbol;
import org.persoftware.seta.expr.Expression.Term;

import java.util.List;

/**
 * Total order of terms in a sum and factor bases in a product.
 *
 * <p>Keys, most significant first: expressions with symbols before constants, higher degree first, smaller leading
 * symbol name first, larger trees first, then a structural comparison. Two expressions compare equal only when
 * they are structurally equal.
 */
public final class CanonicalOrder extends Ordering<Expression> {

    public static final CanonicalOrder INSTANCE = new CanonicalOrder();

    private CanonicalOrder() {}

    @Override
    public int compare(Expression left, Expression right) {
        if (left == right) {
            return 0;
        }
        var leftNames = Expressions.symbolNames(left);
        var rightNames = Expressions.symbolNames(right);
        return ComparisonChain.start()
                              .compareFalseFirst(leftNames.isEmpty(), rightNames.isEmpty())
                              .compare(Expressions.degree(right), Expressions.degree(left))
                              .compare(leftNames.isEmpty() ? "" : leftNames.first(),
                                       rightNames.isEmpty() ? "" : rightNames.first())
                              .compare(Expressions.nodeCount(right), Expressions.nodeCount(left))
                              .compare(rank(right), rank(left))
                              .compare(left, right, CanonicalOrder::structural)
                              .result();
    }

    private static int rank(Expression expression) {
        if (expression instanceof Expression.Number) {
            return 0;
        }
        if (expression instanceof Symbol) {
            return 1;
        }
        if (expression instanceof Call) {
            return 2;
        }
        if (expression instanceof Power) {
            return 3;
        }
        if (expression instanceof Product) {
            return 4;
        }
        return 5;
    }

    private static int structural(Expression left, Expression right) {
        int byRank = Integer.compare(rank(left), rank(right));
        if (byRank != 0) {
            return byRank;
        }
        if (left instanceof Expression.Number l && right instanceof Expression.Number r) {
            return l.value().compareTo(r.value());
        }
        if (left instanceof Symbol l && right instanceof Symbol r) {
            return l.name().compareTo(r.name());
        }
        if (left instanceof Call l && right instanceof Call r) {
            return ComparisonChain.start()
                                  .compare(l.function(), r.function())
                                  .compare(l.arguments(), r.arguments(), lexicographic(INSTANCE))
                                  .result();
        }
        if (left instanceof Power l && right instanceof Power r) {
            return ComparisonChain.start()
                                  .compare(l.base(), r.base(), INSTANCE)
                                  .compare(l.exponent(), r.exponent(), INSTANCE)
                                  .result();
        }
        if (left instanceof Product l && right instanceof Product r) {
            return ComparisonChain.start()
                                  .compare(l.coefficient(), r.coefficient())
                                  .compare(l.factors(), r.factors(), lexicographic(FACTORS))
                                  .result();
        }
        if (left instanceof Sum l && right instanceof Sum r) {
            return lexicographic(TERMS).compare(l.terms(), r.terms());
        }
        throw new IllegalStateException("Unknown expression kind: " + left.getClass());
    }

    private static <T> Ordering<Iterable<T>> lexicographic(Ordering<T> elements) {
        return elements.lexicographical();
    }

    /**
     * Order of product factors: by base, then by exponent.
     */
    public static final Ordering<Factor> FACTORS = new Ordering<>() {
        @Override
        public int compare(Factor left, Factor right) {
            return ComparisonChain.start()
                                  .compare(left.base(), right.base(), INSTANCE)
                                  .compare(left.exponent(), right.exponent(), INSTANCE)
                                  .result();
        }
    };

    /**
     * Order of sum terms: by term, then by coefficient.
     */
    public static final Ordering<Term> TERMS = new Ordering<>() {
        @Override
        public int compare(Term left, Term right) {
            return ComparisonChain.start()
                                  .compare(left.term(), right.term(), INSTANCE)
                                  .compare(left.coefficient(), right.coefficient())
                                  .result();
        }
    };

    public static List<Factor> sortFactors(Iterable<Factor> factors) {
        return FACTORS.sortedCopy(factors);
    }

    public static List<Term> sortTerms(Iterable<Term> terms) {
        return TERMS.sortedCopy(terms);
    }
}
