package org.persoftware.seta.eval;

import org.persoftware.seta.engine.Differentiator;
import org.persoftware.seta.engine.EngineConfig;
import org.persoftware.seta.engine.Integrator;
import org.persoftware.seta.engine.Simplifier;
import org.persoftware.seta.engine.Substitution;
import org.persoftware.seta.error.SetaError;
import org.persoftware.seta.error.SetaException;
import org.persoftware.seta.expr.Algebra;
import org.persoftware.seta.expr.Expression;
import org.persoftware.seta.expr.Printer;
import org.persoftware.seta.expr.Rational;
import org.persoftware.seta.lang.Cause;
import org.persoftware.seta.lang.Result;
import org.persoftware.seta.syntax.Program;
import org.persoftware.seta.syntax.Statement;
import org.persoftware.seta.syntax.Syntax;
import org.persoftware.seta.tree.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Executes a program statement by statement against a fresh {@link Environment}.
 *
 * <p>Execution is fail-fast: the first failing statement ends the run with an {@link SetaError.EvalError} and the
 * environment is not returned.
 */
public final class Evaluator {
    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);
    private static final int MAX_COUNT = 1_000;

    private final Simplifier simplifier;
    private final Differentiator differentiator;
    private final Integrator integrator;
    private final Consumer<String> sink;

    public Evaluator(EngineConfig config) {
        this(config, text -> {});
    }

    public Evaluator(EngineConfig config, Consumer<String> sink) {
        this.simplifier = new Simplifier(config);
        this.differentiator = new Differentiator(simplifier);
        this.integrator = new Integrator(config, simplifier, differentiator);
        this.sink = sink;
    }

    /**
     * Evaluator sharing engines already built by its owner.
     */
    public Evaluator(Simplifier simplifier, Differentiator differentiator, Integrator integrator,
                     Consumer<String> sink) {
        this.simplifier = simplifier;
        this.differentiator = differentiator;
        this.integrator = integrator;
        this.sink = sink;
    }

    public Simplifier simplifier() {
        return simplifier;
    }

    public Integrator integrator() {
        return integrator;
    }

    public Result<Environment> evaluate(Program program) {
        var environment = new Environment(sink);
        for (var statement : program.statements()) {
            var location = statement.span().start();
            log.debug("Executing {} at {}", statement.getClass().getSimpleName(), location);
            try {
                execute(statement, environment);
            } catch (SetaException e) {
                log.debug("Statement at {} failed: {}", location, e.getMessage());
                return Result.failure(new SetaError.EvalError(location, e.error()));
            }
        }
        return Result.success(environment);
    }

    /**
     * Value of a standalone expression in which every name is a free symbol.
     */
    public Result<Expression> evaluateExpression(Syntax syntax) {
        var environment = new Environment(sink);
        declareNames(syntax, environment);
        try {
            return Result.success(simplified(lower(syntax, environment)));
        } catch (SetaException e) {
            return Result.failure(e.error());
        }
    }

    private static void declareNames(Syntax syntax, Environment environment) {
        if (syntax instanceof Syntax.Identifier identifier) {
            environment.declare(identifier.name());
        } else if (syntax instanceof Syntax.Negate negate) {
            declareNames(negate.operand(), environment);
        } else if (syntax instanceof Syntax.Binary binary) {
            declareNames(binary.left(), environment);
            declareNames(binary.right(), environment);
        } else if (syntax instanceof Syntax.Invocation invocation) {
            invocation.arguments().forEach(argument -> declareNames(argument, environment));
        }
    }

    // === Statements ===

    private void execute(Statement statement, Environment environment) {
        if (statement instanceof Statement.SymbolDeclaration declaration) {
            for (var name : declaration.names()) {
                if (environment.isDefined(name.name())) {
                    throw new SetaException(new SetaError.RedeclarationError(name.name(), name.span().start()));
                }
                environment.declare(name.name());
            }
        } else if (statement instanceof Statement.Assignment assignment) {
            var value = simplified(lower(assignment.value(), environment));
            log.debug("{} = {}", assignment.target().name(), value);
            environment.bind(assignment.target().name(), value);
        } else if (statement instanceof Statement.CallStatement call) {
            executeCall(call, environment);
        }
    }

    private void executeCall(Statement.CallStatement call, Environment environment) {
        var function = call.function();
        var location = function.span().start();
        var builtin = Builtin.named(function.name())
                             .orElseThrow(() -> new SetaException(
                                 new SetaError.UnknownFunctionError(function.name(), location)));
        var arguments = call.arguments();
        requireArity(builtin, arguments, location);
        switch (builtin) {
            case DISPLAY:
                environment.emit(Printer.render(simplified(lower(arguments.get(0), environment))));
                break;
            case WRAP:
                var lines = arguments.isEmpty() ? 1 : count(arguments.get(0), builtin, environment);
                environment.emit("\n".repeat(lines));
                break;
            case BREAKPOINT:
                environment.emit(environment.describe());
                break;
            default:
                var value = compute(builtin, arguments, environment);
                log.debug("{} -> {}", builtin.functionName(), value);
                environment.remember(value);
                break;
        }
    }

    // === Lowering ===

    /**
     * Expression for the syntax with bound names replaced by their values.
     *
     * @throws SetaException for undeclared names and failed computations
     */
    private Expression lower(Syntax syntax, Environment environment) {
        if (syntax instanceof Syntax.NumberLiteral literal) {
            return Expression.number(Rational.parse(literal.text()));
        }
        if (syntax instanceof Syntax.Identifier identifier) {
            var binding = environment.lookup(identifier.name())
                                     .orElseThrow(() -> undeclared(identifier));
            if (binding instanceof Environment.Binding.Bound bound) {
                return bound.value();
            }
            return ((Environment.Binding.Free) binding).symbol();
        }
        if (syntax instanceof Syntax.Negate negate) {
            return Algebra.negate(lower(negate.operand(), environment));
        }
        if (syntax instanceof Syntax.Binary binary) {
            var left = lower(binary.left(), environment);
            var right = lower(binary.right(), environment);
            switch (binary.operator()) {
                case ADD:
                    return Algebra.add(left, right);
                case SUBTRACT:
                    return Algebra.subtract(left, right);
                case MULTIPLY:
                    return Algebra.multiply(left, right);
                case DIVIDE:
                    return Algebra.divide(left, right);
                case POWER:
                    return Algebra.power(left, right);
                default:
                    throw new IllegalStateException("Unknown operator: " + binary.operator());
            }
        }
        if (syntax instanceof Syntax.Invocation invocation) {
            return lowerInvocation(invocation, environment);
        }
        throw new IllegalStateException("Unknown syntax kind: " + syntax.getClass());
    }

    private Expression lowerInvocation(Syntax.Invocation invocation, Environment environment) {
        var location = invocation.span().start();
        var builtin = Builtin.named(invocation.function());
        if (builtin.isPresent()) {
            if (!builtin.get().isComputation()) {
                throw new SetaException(new SetaError.ArgumentError(
                    invocation.function(), "has no value and cannot be used inside an expression", location));
            }
            requireArity(builtin.get(), invocation.arguments(), location);
            return compute(builtin.get(), invocation.arguments(), environment);
        }
        var arguments = new ArrayList<Expression>();
        invocation.arguments().forEach(argument -> arguments.add(lower(argument, environment)));
        return Algebra.call(invocation.function(), arguments);
    }

    // === Computations ===

    private Expression compute(Builtin builtin, List<Syntax> arguments, Environment environment) {
        switch (builtin) {
            case INTEGRATE: {
                var integrand = lower(arguments.get(0), environment);
                var variable = variable(arguments.get(1), builtin, environment);
                return orThrow(integrator.integrate(integrand, variable));
            }
            case DIFFERENTIATE: {
                var function = lower(arguments.get(0), environment);
                var variable = variable(arguments.get(1), builtin, environment);
                var order = arguments.size() > 2 ? count(arguments.get(2), builtin, environment) : 1;
                return orThrow(differentiator.differentiate(function, variable, order));
            }
            case SIMPLIFY:
                return simplified(lower(arguments.get(0), environment));
            case SUBSTITUTE: {
                var target = lower(arguments.get(0), environment);
                var variable = variable(arguments.get(1), builtin, environment);
                var replacement = lower(arguments.get(2), environment);
                return simplified(Substitution.substitute(target, variable, replacement));
            }
            case EXPAND:
                return simplified(Algebra.expand(lower(arguments.get(0), environment)));
            default:
                throw new IllegalStateException(builtin.functionName() + " is not a computation");
        }
    }

    /**
     * Free symbol named by the argument.
     */
    private static Expression.Symbol variable(Syntax argument, Builtin builtin, Environment environment) {
        var location = argument.span().start();
        if (!(argument instanceof Syntax.Identifier identifier)) {
            throw new SetaException(new SetaError.ArgumentError(
                builtin.functionName(), "variable must be a declared symbol name", location));
        }
        var binding = environment.lookup(identifier.name())
                                 .orElseThrow(() -> undeclared(identifier));
        if (binding instanceof Environment.Binding.Free free) {
            return free.symbol();
        }
        throw new SetaException(new SetaError.ArgumentError(
            builtin.functionName(), "'" + identifier.name() + "' has a value and cannot be used as variable", location));
    }

    /**
     * Positive integer given by the argument, at most {@value #MAX_COUNT}.
     */
    private int count(Syntax argument, Builtin builtin, Environment environment) {
        var value = simplified(lower(argument, environment));
        if (value instanceof Expression.Number number) {
            var count = number.value().intValue();
            if (count.isPresent() && count.get() >= 1 && count.get() <= MAX_COUNT) {
                return count.get();
            }
        }
        throw new SetaException(new SetaError.ArgumentError(
            builtin.functionName(), "expected a positive integer, got " + Printer.render(value),
            argument.span().start()));
    }

    private static void requireArity(Builtin builtin, List<Syntax> arguments, SourceLocation location) {
        if (!builtin.accepts(arguments.size())) {
            throw new SetaException(new SetaError.ArgumentError(
                builtin.functionName(),
                "expected " + builtin.arityDescription() + ", got " + arguments.size(),
                location));
        }
    }

    private Expression simplified(Expression expression) {
        return orThrow(simplifier.simplify(expression));
    }

    private static Expression orThrow(Result<Expression> result) {
        return result.fold(Evaluator::raise, value -> value);
    }

    private static Expression raise(Cause cause) {
        if (cause instanceof SetaError error) {
            throw new SetaException(error);
        }
        throw new IllegalStateException("Unexpected failure: " + cause.message());
    }

    private static SetaException undeclared(Syntax.Identifier identifier) {
        return new SetaException(new SetaError.UndeclaredSymbolError(identifier.name(), identifier.span().start()));
    }
}
