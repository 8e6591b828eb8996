package org.persoftware.seta.expr;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.persoftware.seta.expr.Algebra.*;
import static org.persoftware.seta.expr.Expression.number;
import static org.persoftware.seta.expr.Expression.symbol;

class CanonicalOrderTest {

    private static final CanonicalOrder ORDER = CanonicalOrder.INSTANCE;
    private static final Expression.Symbol X = symbol("x");
    private static final Expression.Symbol Y = symbol("y");

    @Test
    void constantsComeLast() {
        assertTrue(ORDER.compare(X, number(1)) < 0);
        assertTrue(ORDER.compare(call("ln", number(2)), X) > 0);
    }

    @Test
    void higherDegreeComesFirst() {
        assertTrue(ORDER.compare(power(X, 2), X) < 0);
        assertTrue(ORDER.compare(X, call("ln", X)) < 0);
    }

    @Test
    void leadingSymbolNameBreaksDegreeTies() {
        assertTrue(ORDER.compare(X, Y) < 0);
        assertTrue(ORDER.compare(power(Y, 2), multiply(X, Y)) > 0);
    }

    @Test
    void largerTreeComesFirstAmongEqualKeys() {
        assertTrue(ORDER.compare(multiply(X, call("ln", X)), X) < 0);
    }

    @Test
    void compare_isZeroOnlyForEqualExpressions() {
        var expressions = List.of(X, Y, number(1), number(2), power(X, 2), call("sin", X), call("cos", X),
                                  multiply(X, Y), add(X, Y), power(number(2), X), call("f", List.of(X, Y)));
        for (var left : expressions) {
            for (var right : expressions) {
                assertEquals(left.equals(right), ORDER.compare(left, right) == 0, left + " vs " + right);
                assertEquals(Integer.signum(ORDER.compare(left, right)), -Integer.signum(ORDER.compare(right, left)));
            }
        }
    }

    @Test
    void sortedCopy_isIndependentOfInputOrder() {
        var terms = new ArrayList<Expression>(List.of(number(3), call("ln", X), power(X, 2), Y, X));
        var sorted = ORDER.sortedCopy(terms);
        Collections.reverse(terms);

        assertEquals(sorted, ORDER.sortedCopy(terms));
        assertEquals(List.of(power(X, 2), X, Y, call("ln", X), number(3)), sorted);
    }
}
