package org.persoftware.seta.engine;

import org.junit.jupiter.api.Test;
import org.persoftware.seta.Seta;
import org.persoftware.seta.error.SetaError;
import org.persoftware.seta.expr.Expression;
import org.persoftware.seta.expr.Printer;
import org.persoftware.seta.expr.Rational;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.persoftware.seta.expr.Expression.number;
import static org.persoftware.seta.expr.Expression.symbol;

class SimplifierTest {

    private static final Seta SETA = Seta.create();
    private final Simplifier simplifier = new Simplifier(EngineConfig.DEFAULT);

    @Test
    void simplify_rawTree_isCanonicalized() {
        var x = symbol("x");
        // x*1 + 0 + x, built without the smart constructors
        var raw = new Expression.Sum(List.of(
            new Expression.Term(Rational.ONE, new Expression.Product(Rational.ONE, List.of(
                new Expression.Factor(x, Expression.ONE), new Expression.Factor(number(1), Expression.ONE)))),
            new Expression.Term(Rational.ONE, Expression.ZERO),
            new Expression.Term(Rational.ONE, x)));

        var result = simplifier.simplify(raw);

        assertTrue(result.isSuccess());
        assertEquals("2*x", Printer.render(result.unwrap()));
    }

    @Test
    void simplify_isIdempotent() {
        for (var source : List.of("x + x*y - 3*(x - 2)", "(x^2)^3 / x", "exp(ln(x)) + ln(exp(y))", "sqrt(16*x^2)",
                                  "2^(5/2) * x^(1/2) * x^(1/2)", "1/(1 + x) + 1/(x + 1)")) {
            var once = simplifier.simplify(expr(source)).unwrap();
            var twice = simplifier.simplify(once).unwrap();

            assertEquals(once, twice, source);
        }
    }

    @Test
    void simplify_commutedOperands_areEqual() {
        assertEquals(expr("x + y"), expr("y + x"));
        assertEquals(expr("x*y*2"), expr("2*y*x"));
        assertEquals(expr("(a + b)*(c + d)"), expr("(d + c)*(b + a)"));
    }

    @Test
    void simplify_regroupedProducts_areEqual() {
        assertEquals(expr("(2*(x + 1))*y"), expr("2*((x + 1)*y)"));
        assertEquals(expr("(2*x + 2)*(x + 1)"), expr("2*(x + 1)*(x + 1)"));
        assertEquals(expr("(2*x + 2)^2"), expr("4*(x + 1)^2"));
        assertEquals(expr("3*(x + 1)*y + (x + 1)*y"), expr("4*((x + 1)*y)"));
    }

    @Test
    void simplify_foldsConstantsExactly() {
        assertEquals("7/6", render("1/2 + 2/3"));
        assertEquals("x", render("x^1 + 0"));
        assertEquals("0", render("x - x"));
        assertEquals("x^6", render("(x^2)^3"));
        assertEquals("2", render("sqrt(4)"));
        assertEquals("4*x^2", render("(2*x)^2"));
    }

    @Test
    void simplify_functionIdentities() {
        assertEquals("0", render("ln(1) + sin(0) + tan(0)"));
        assertEquals("2", render("exp(0) + cos(0)"));
        assertEquals("x + y", render("ln(exp(x)) + exp(ln(y))"));
    }

    @Test
    void simplify_divisionByZero_fails() {
        var result = SETA.parseExpression("x / (2 - 2)");

        assertInstanceOf(SetaError.DivisionByZeroError.class, result.cause());
    }

    @Test
    void simplify_zeroToZero_fails() {
        var result = SETA.parseExpression("(x - x)^0");

        assertInstanceOf(SetaError.ZeroToZeroPowerError.class, result.cause());
    }

    @Test
    void simplify_rawDivisionByZero_fails() {
        var raw = new Expression.Power(Expression.ZERO, number(-1));

        assertInstanceOf(SetaError.DivisionByZeroError.class, simplifier.simplify(raw).cause());
    }

    @Test
    void config_rejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(0, 10, 10, 1));
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(1, 10, 10, -1));
    }

    // === Helper Methods ===

    private static Expression expr(String source) {
        return SETA.parseExpression(source).unwrap();
    }

    private static String render(String source) {
        return Printer.render(expr(source));
    }
}
