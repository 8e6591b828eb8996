package org.persoftware.seta;

import org.persoftware.seta.engine.Differentiator;
import org.persoftware.seta.engine.EngineConfig;
import org.persoftware.seta.engine.Integrator;
import org.persoftware.seta.engine.Simplifier;
import org.persoftware.seta.error.Diagnostic;
import org.persoftware.seta.error.SetaError;
import org.persoftware.seta.eval.Environment;
import org.persoftware.seta.eval.Evaluator;
import org.persoftware.seta.expr.Expression;
import org.persoftware.seta.expr.Printer;
import org.persoftware.seta.lang.Cause;
import org.persoftware.seta.lang.Result;
import org.persoftware.seta.syntax.Parser;
import org.persoftware.seta.syntax.Program;

import java.util.function.Consumer;

/**
 * Entry point for running Seta scripts and using the symbolic engines directly.
 *
 * <p>Example usage:
 * <pre>{@code
 * var env = Seta.create().run("""
 *     symbol x;
 *     f = 3*x + ln(x);
 *     F = integrate(f, x);
 *     display(F)
 *     """).unwrap();
 *
 * env.output(); // 3/2*x^2 + x*ln(x) - x
 * }</pre>
 */
public final class Seta {
    private final EngineConfig config;
    private final Simplifier simplifier;
    private final Differentiator differentiator;
    private final Integrator integrator;
    private final Evaluator evaluator;

    private Seta(EngineConfig config, Consumer<String> sink) {
        this.config = config;
        this.simplifier = new Simplifier(config);
        this.differentiator = new Differentiator(simplifier);
        this.integrator = new Integrator(config, simplifier, differentiator);
        this.evaluator = new Evaluator(simplifier, differentiator, integrator, sink);
    }

    /**
     * Instance with the default limits and no output sink.
     */
    public static Seta create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parse script text into a program.
     */
    public static Result<Program> parse(String sourceText) {
        return Parser.parse(sourceText);
    }

    public static String render(Expression expression) {
        return Printer.render(expression);
    }

    /**
     * Rust-style report of a failure, quoting the offending line of the source.
     *
     * @param fileName Optional filename for display
     */
    public static String describe(Cause cause, String source, String fileName) {
        if (cause instanceof SetaError error) {
            return Diagnostic.of(error).format(source, fileName);
        }
        return "error: " + cause.message() + "\n";
    }

    public EngineConfig config() {
        return config;
    }

    Evaluator evaluator() {
        return evaluator;
    }

    Simplifier simplifier() {
        return simplifier;
    }

    Integrator integrator() {
        return integrator;
    }

    /**
     * Run a parsed program on a fresh environment.
     */
    public Result<Environment> evaluate(Program program) {
        return evaluator.evaluate(program);
    }

    /**
     * Parse and run script text.
     */
    public Result<Environment> run(String sourceText) {
        return parse(sourceText).flatMap(this::evaluate);
    }

    /**
     * Parse a single expression; every name in it is a free symbol.
     */
    public Result<Expression> parseExpression(String text) {
        return Parser.parseExpression(text).flatMap(evaluator::evaluateExpression);
    }

    public Result<Expression> simplify(Expression expression) {
        return simplifier.simplify(expression);
    }

    public Result<Expression> differentiate(Expression expression, Expression.Symbol variable) {
        return differentiator.differentiate(expression, variable);
    }

    public Result<Expression> differentiate(Expression expression, Expression.Symbol variable, int order) {
        return differentiator.differentiate(expression, variable, order);
    }

    public Result<Expression> integrate(Expression expression, Expression.Symbol variable) {
        return integrator.integrate(expression, variable);
    }

    public static final class Builder {
        private int maxSimplifyPasses = EngineConfig.DEFAULT.maxSimplifyPasses();
        private int maxIntegrationSteps = EngineConfig.DEFAULT.maxIntegrationSteps();
        private int maxIntegrationDepth = EngineConfig.DEFAULT.maxIntegrationDepth();
        private int maxByPartsDepth = EngineConfig.DEFAULT.maxByPartsDepth();
        private Consumer<String> output = text -> {};

        private Builder() {}

        public Builder maxSimplifyPasses(int passes) {
            this.maxSimplifyPasses = passes;
            return this;
        }

        public Builder maxIntegrationSteps(int steps) {
            this.maxIntegrationSteps = steps;
            return this;
        }

        public Builder maxIntegrationDepth(int depth) {
            this.maxIntegrationDepth = depth;
            return this;
        }

        public Builder maxByPartsDepth(int depth) {
            this.maxByPartsDepth = depth;
            return this;
        }

        /**
         * Receives every piece of script output as it is emitted, in addition to {@link Environment#output()}.
         */
        public Builder output(Consumer<String> sink) {
            this.output = sink;
            return this;
        }

        public Seta build() {
            var config = new EngineConfig(maxSimplifyPasses, maxIntegrationSteps, maxIntegrationDepth,
                                          maxByPartsDepth);
            return new Seta(config, output);
        }
    }
}
