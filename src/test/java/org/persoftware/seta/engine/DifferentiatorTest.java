package org.persoftware.seta.engine;

import org.junit.jupiter.api.Test;
import org.persoftware.seta.Seta;
import org.persoftware.seta.error.SetaError;
import org.persoftware.seta.expr.Expression;
import org.persoftware.seta.expr.Printer;

import static org.junit.jupiter.api.Assertions.*;

class DifferentiatorTest {

    private static final Seta SETA = Seta.create();
    private static final Expression.Symbol X = Expression.symbol("x");

    private final Differentiator differentiator = new Differentiator(new Simplifier(EngineConfig.DEFAULT));

    // === Basic Rules ===

    @Test
    void differentiate_constantsAndSymbols() {
        assertEquals("0", derivative("42"));
        assertEquals("0", derivative("y"));
        assertEquals("1", derivative("x"));
    }

    @Test
    void differentiate_sum_isLinear() {
        assertEquals("6*x + 3", derivative("3*x^2 + 3*x + 7"));
    }

    @Test
    void differentiate_powerRule() {
        assertEquals("3*x^2", derivative("x^3"));
        assertEquals("-1/x^2", derivative("1/x"));
        assertEquals("1/(2*x^(1/2))", derivative("sqrt(x)"));
    }

    @Test
    void differentiate_productRule() {
        assertEquals("ln(x) + 1", derivative("x*ln(x)"));
    }

    @Test
    void differentiate_exponentialAndLogarithmicRules() {
        assertEquals("ln(2)*2^x", derivative("2^x"));
        assertEquals("1/x", derivative("ln(x)"));
    }

    // === Chain Rule ===

    @Test
    void differentiate_chainRule() {
        assertEquals("2*x*cos(x^2)", derivative("sin(x^2)"));
        assertEquals("-3*sin(3*x)", derivative("cos(3*x)"));
        assertEquals("2*exp(2*x)", derivative("exp(2*x)"));
    }

    @Test
    void differentiate_inverseTrigonometry() {
        assertEquals("1/(x^2 + 1)", derivative("atan(x)"));
    }

    // === Higher Order ===

    @Test
    void differentiate_secondOrder() {
        var result = differentiator.differentiate(expr("x^3"), X, 2);

        assertEquals("6*x", Printer.render(result.unwrap()));
    }

    @Test
    void differentiate_beyondPolynomialDegree_isZero() {
        assertEquals(Expression.ZERO, differentiator.differentiate(expr("x^2 + x"), X, 3).unwrap());
    }

    // === Errors ===

    @Test
    void differentiate_unsupportedFunction_fails() {
        var result = differentiator.differentiate(expr("f(x)"), X);

        var error = assertInstanceOf(SetaError.DifferentiationError.class, result.cause());
        assertEquals(SetaError.DifferentiationFailure.UNSUPPORTED_FUNCTION, error.reason());
        assertEquals("f", error.function());
        assertEquals(1, error.arity());
    }

    @Test
    void differentiate_unsupportedFunctionOfOtherVariable_isZero() {
        assertEquals("0", derivative("f(y)"));
    }

    // === Helper Methods ===

    private static Expression expr(String source) {
        return SETA.parseExpression(source).unwrap();
    }

    private String derivative(String source) {
        return Printer.render(differentiator.differentiate(expr(source), X).unwrap());
    }
}
