package org.persoftware.seta;

import org.junit.jupiter.api.Test;
import org.persoftware.seta.error.SetaError;
import org.persoftware.seta.expr.Expression;

import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SetaTest {

    private static final String WORKED_EXAMPLE = """
        symbol x;
        f = 3*x+ln(x);
        F = integrate(f, x);
        display(F)
        """;

    @Test
    void run_workedExample() {
        var result = Seta.create().run(WORKED_EXAMPLE);

        assertTrue(result.isSuccess());
        assertEquals("3/2*x^2 + x*ln(x) - x", result.unwrap().output());
    }

    @Test
    void builder_outputSinkReceivesDisplay() {
        var chunks = new ArrayList<String>();
        var seta = Seta.builder()
                       .output(chunks::add)
                       .build();

        seta.run("symbol x; display(x); wrap(); display(x^2)").unwrap();

        assertEquals(3, chunks.size());
        assertEquals("x^2", chunks.get(2));
    }

    @Test
    void builder_limitsReachConfig() {
        var seta = Seta.builder()
                       .maxIntegrationSteps(3)
                       .maxByPartsDepth(0)
                       .build();

        assertEquals(3, seta.config().maxIntegrationSteps());
        assertEquals(0, seta.config().maxByPartsDepth());
        var x = Expression.symbol("x");
        assertInstanceOf(SetaError.IntegrationError.class,
                         seta.integrate(seta.parseExpression("x*exp(x)").unwrap(), x).cause());
    }

    @Test
    void builder_invalidLimits_throw() {
        assertThrows(IllegalArgumentException.class, () -> Seta.builder().maxSimplifyPasses(0).build());
    }

    @Test
    void parse_thenEvaluate_matchesRun() {
        var seta = Seta.create();
        var program = Seta.parse(WORKED_EXAMPLE).unwrap();

        assertEquals(seta.run(WORKED_EXAMPLE).unwrap().output(), seta.evaluate(program).unwrap().output());
    }

    @Test
    void engines_workOnParsedExpressions() {
        var seta = Seta.create();
        var x = Expression.symbol("x");
        var f = seta.parseExpression("x^2 * sin(x)").unwrap();

        assertEquals("x^2*sin(x)", Seta.render(f));
        assertEquals("x^2*cos(x) + 2*x*sin(x)", Seta.render(seta.differentiate(f, x).unwrap()));
        assertEquals("2", Seta.render(seta.differentiate(seta.parseExpression("x^2").unwrap(), x, 2).unwrap()));
        assertEquals("x + 1", Seta.render(seta.simplify(seta.parseExpression("1 + x").unwrap()).unwrap()));
    }

    @Test
    void evaluator_sharesFacadeEngines() {
        var seta = Seta.builder().maxIntegrationSteps(5).build();

        assertSame(seta.simplifier(), seta.evaluator().simplifier());
        assertSame(seta.integrator(), seta.evaluator().integrator());
        assertTrue(seta.run("symbol x; F = integrate(x + x^2 + x^3 + x^4 + x^5 + x^6, x);").isFailure());
    }

    @Test
    void describe_rendersDiagnostic() {
        var source = "symbol x;\nf = 3*y+1;\n";
        var failure = Seta.create().run(source);

        var text = Seta.describe(failure.cause(), source, "example.seta");

        assertTrue(text.startsWith("error[E004]"));
        assertTrue(text.contains("example.seta:2:7"));
        assertTrue(text.contains("2 | f = 3*y+1;"));
    }

    @Test
    void describe_lexError() {
        var source = "f = 2 @ 3;";
        var failure = Seta.parse(source);

        assertTrue(Seta.describe(failure.cause(), source, null).startsWith("error[E001]: Unexpected character '@'"));
    }
}
