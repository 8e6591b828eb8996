package org.persoftware.seta.expr;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.persoftware.seta.Seta;

import static org.assertj.core.api.Assertions.assertThat;
import static org.persoftware.seta.expr.Algebra.*;
import static org.persoftware.seta.expr.Expression.number;
import static org.persoftware.seta.expr.Expression.symbol;

class PrinterTest {

    private static final Expression.Symbol X = symbol("x");
    private static final Expression.Symbol Y = symbol("y");
    private static final Seta SETA = Seta.create();

    // === Rendering Tests ===

    @Test
    void render_atoms() {
        assertThat(Printer.render(X)).isEqualTo("x");
        assertThat(Printer.render(number(-3))).isEqualTo("-3");
        assertThat(Printer.render(number(Rational.of(3, 2)))).isEqualTo("3/2");
    }

    @Test
    void render_coefficientComesFirst() {
        assertThat(Printer.render(multiply(number(Rational.of(3, 2)), power(X, 2)))).isEqualTo("3/2*x^2");
    }

    @Test
    void render_negativeTermsUseMinus() {
        var expression = subtract(multiply(X, call("ln", X)), X);

        assertThat(Printer.render(expression)).isEqualTo("x*ln(x) - x");
    }

    @Test
    void render_negativeExponentsMoveBelow() {
        assertThat(Printer.render(power(X, -1))).isEqualTo("1/x");
        assertThat(Printer.render(divide(X, power(Y, 2)))).isEqualTo("x/y^2");
        assertThat(Printer.render(divide(Expression.ONE, multiply(number(2), X)))).isEqualTo("1/(2*x)");
        assertThat(Printer.render(divide(number(3), multiply(number(2), X)))).isEqualTo("3/(2*x)");
    }

    @Test
    void render_sumBaseIsParenthesized() {
        assertThat(Printer.render(power(add(X, number(1)), -1))).isEqualTo("1/(x + 1)");
        assertThat(Printer.render(power(add(X, number(1)), 3))).isEqualTo("(x + 1)^3");
    }

    @Test
    void render_compoundExponentIsParenthesized() {
        assertThat(Printer.render(power(X, number(Rational.of(1, 2))))).isEqualTo("x^(1/2)");
        assertThat(Printer.render(power(number(2), X))).isEqualTo("2^x");
        assertThat(Printer.render(power(X, add(Y, number(1))))).isEqualTo("x^(y + 1)");
    }

    @Test
    void render_callArguments() {
        assertThat(Printer.render(Expression.call("f", X, Y))).isEqualTo("f(x, y)");
    }

    @Test
    void render_leadingNegativeTerm() {
        var expression = add(negate(multiply(X, call("cos", X))), call("sin", X));

        assertThat(Printer.render(expression)).isEqualTo("-x*cos(x) + sin(x)");
    }

    // === Round-trip Tests ===

    @ParameterizedTest
    @ValueSource(strings = {
        "3*x + ln(x)",
        "3/2*x^2 + x*ln(x) - x",
        "1/(2*x) - y/x^2",
        "(x + 1)^3 * (y - 2)",
        "-x^2 + 2^(3/2)*x",
        "exp(-x) * sin(2*x)",
        "x^(y + 1) - x^(1/2)",
        "(1 - x^2)^(-1/2)",
        "f(x, y + 1) / 7",
        "(-2)^(1/3)",
        "2*((x + 1)*y)",
        "(2*(x + 1))*y",
        "3*(x + 1)*y + z"
    })
    void render_parseOfRender_isStable(String source) {
        var rendered = Printer.render(SETA.parseExpression(source).unwrap());

        assertThat(Printer.render(SETA.parseExpression(rendered).unwrap())).isEqualTo(rendered);
    }
}
