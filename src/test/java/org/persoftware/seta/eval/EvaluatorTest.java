package org.persoftware.seta.eval;

import org.junit.jupiter.api.Test;
import org.persoftware.seta.engine.EngineConfig;
import org.persoftware.seta.error.SetaError;
import org.persoftware.seta.expr.Printer;
import org.persoftware.seta.lang.Result;
import org.persoftware.seta.syntax.Parser;

import static org.junit.jupiter.api.Assertions.*;

class EvaluatorTest {

    private final Evaluator evaluator = new Evaluator(EngineConfig.DEFAULT);

    // === Scenario Tests ===

    @Test
    void evaluate_workedExample_displaysAntiderivative() {
        var environment = run("""
            symbol x;
            f = 3*x+ln(x);
            F = integrate(f, x);
            display(F)
            """).unwrap();

        assertEquals("3/2*x^2 + x*ln(x) - x", environment.output());
        assertEquals("3*x + ln(x)", Printer.render(environment.valueOf("f").orElseThrow()));
    }

    @Test
    void evaluate_undeclaredSymbol_failsWithPosition() {
        var result = run("f = 3*y+1;");

        var error = assertInstanceOf(SetaError.EvalError.class, result.cause());
        var cause = assertInstanceOf(SetaError.UndeclaredSymbolError.class, error.cause());
        assertEquals("y", cause.name());
        assertEquals(1, cause.location().line());
        assertEquals(7, cause.location().column());
        assertEquals(cause.location(), error.position().orElseThrow());
    }

    @Test
    void evaluate_nonElementaryIntegral_failsWithoutCrash() {
        var result = run("symbol x;\nF = integrate(exp(x^2), x);");

        var error = assertInstanceOf(SetaError.EvalError.class, result.cause());
        var cause = assertInstanceOf(SetaError.IntegrationError.class, error.cause());
        assertEquals(SetaError.IntegrationFailure.NOT_INTEGRABLE_ELEMENTARILY, cause.reason());
        assertEquals(2, error.location().line());
    }

    @Test
    void evaluate_redeclaration_fails() {
        var result = run("symbol x; symbol x;");

        var error = assertInstanceOf(SetaError.EvalError.class, result.cause());
        var cause = assertInstanceOf(SetaError.RedeclarationError.class, error.cause());
        assertEquals("x", cause.name());
        assertEquals(18, cause.location().column());
    }

    // === Statement Tests ===

    @Test
    void evaluate_failure_stopsAtFirstError() {
        var output = new StringBuilder();
        var streaming = new Evaluator(EngineConfig.DEFAULT, output::append);

        var result = streaming.evaluate(Parser.parse("symbol x; display(x); g = x/0; display(2*x);").unwrap());

        assertTrue(result.isFailure());
        assertEquals("x", output.toString());
        var error = assertInstanceOf(SetaError.EvalError.class, result.cause());
        assertInstanceOf(SetaError.DivisionByZeroError.class, error.cause());
    }

    @Test
    void evaluate_assignment_rebindsName() {
        var environment = run("symbol x; f = x; f = f + 1; display(f)").unwrap();

        assertEquals("x + 1", environment.output());
    }

    @Test
    void evaluate_symbolOverAssignedName_fails() {
        var error = assertInstanceOf(SetaError.EvalError.class, run("a = 2; symbol a;").cause());

        assertInstanceOf(SetaError.RedeclarationError.class, error.cause());
    }

    @Test
    void evaluate_boundNamesAreSubstituted() {
        var environment = run("symbol x; a = 2; f = a*x^a; display(f)").unwrap();

        assertEquals("2*x^2", environment.output());
    }

    @Test
    void evaluate_unknownFunctionIsKeptAsCall() {
        var environment = run("symbol x; g = f(x, 2) + f(x, 2); display(g)").unwrap();

        assertEquals("2*f(x, 2)", environment.output());
    }

    // === Builtin Tests ===

    @Test
    void wrap_emitsLineBreaks() {
        var environment = run("symbol x; display(x); wrap(); display(2*x); wrap(2)").unwrap();

        assertEquals("x\n2*x\n\n", environment.output());
    }

    @Test
    void breakpoint_listsBindingsInOrder() {
        var environment = run("symbol x; f = x^2; breakpoint();").unwrap();

        assertEquals("x: symbol\nf = x^2\n", environment.output());
    }

    @Test
    void computationStatement_storesLastResult() {
        var environment = run("symbol x; differentiate(x^3, x);").unwrap();

        assertEquals("3*x^2", Printer.render(environment.lastResult().orElseThrow()));
        assertEquals("", environment.output());
    }

    @Test
    void differentiate_withOrder() {
        assertEquals("6*x", run("symbol x; display(differentiate(x^3, x, 2))").unwrap().output());
    }

    @Test
    void substitute_replacesSymbol() {
        assertEquals("y + 9", run("symbol x, y; display(substitute(x^2 + y, x, 3))").unwrap().output());
    }

    @Test
    void expand_multipliesOut() {
        assertEquals("x^2 + 2*x + 1", run("symbol x; display(expand((x + 1)^2))").unwrap().output());
    }

    @Test
    void simplify_inExpression() {
        assertEquals("2*x", run("symbol x; display(simplify(x + x))").unwrap().output());
    }

    // === Builtin Error Tests ===

    @Test
    void unknownStatementFunction_fails() {
        var error = assertInstanceOf(SetaError.EvalError.class, run("symbol x; plot(x);").cause());

        var cause = assertInstanceOf(SetaError.UnknownFunctionError.class, error.cause());
        assertEquals("plot", cause.name());
    }

    @Test
    void displayInsideExpression_fails() {
        var error = assertInstanceOf(SetaError.EvalError.class, run("f = display(1);").cause());

        assertInstanceOf(SetaError.ArgumentError.class, error.cause());
    }

    @Test
    void wrongArity_fails() {
        var error = assertInstanceOf(SetaError.EvalError.class, run("display();").cause());

        var cause = assertInstanceOf(SetaError.ArgumentError.class, error.cause());
        assertEquals("display", cause.function());
    }

    @Test
    void integrationVariableWithValue_fails() {
        var error = assertInstanceOf(SetaError.EvalError.class, run("symbol x; y = 2; F = integrate(x, y);").cause());

        assertInstanceOf(SetaError.ArgumentError.class, error.cause());
    }

    @Test
    void nonIntegerWrapCount_fails() {
        var error = assertInstanceOf(SetaError.EvalError.class, run("wrap(1/2);").cause());

        assertInstanceOf(SetaError.ArgumentError.class, error.cause());
    }

    @Test
    void zeroWrapCount_fails() {
        var error = assertInstanceOf(SetaError.EvalError.class, run("symbol x; display(x); wrap(0);").cause());

        var argument = assertInstanceOf(SetaError.ArgumentError.class, error.cause());
        assertEquals("wrap", argument.function());
        assertEquals(1, argument.location().line());
        assertEquals(28, argument.location().column());
    }

    @Test
    void zeroDerivativeOrder_fails() {
        var error = assertInstanceOf(SetaError.EvalError.class,
                                     run("symbol x; g = differentiate(x^2, x, 0);").cause());

        assertInstanceOf(SetaError.ArgumentError.class, error.cause());
    }

    @Test
    void unsupportedDerivative_fails() {
        var error = assertInstanceOf(SetaError.EvalError.class, run("symbol x; g = differentiate(f(x), x);").cause());

        assertInstanceOf(SetaError.DifferentiationError.class, error.cause());
    }

    // === Helper Methods ===

    private Result<Environment> run(String source) {
        return Parser.parse(source).flatMap(evaluator::evaluate);
    }
}
