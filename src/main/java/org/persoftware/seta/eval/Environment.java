package org.persoftware.seta.eval;

import org.persoftware.seta.expr.Expression;
import org.persoftware.seta.expr.Printer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Names and output of one script run.
 *
 * <p>A fresh environment is created for every run; bindings keep their declaration order.
 */
public final class Environment {

    /**
     * What a name stands for.
     */
    public sealed interface Binding {
        /**
         * Declared with {@code symbol}; stands for itself.
         */
        record Free(Expression.Symbol symbol) implements Binding {}

        /**
         * Assigned a value.
         */
        record Bound(Expression value) implements Binding {}
    }

    private final Map<String, Binding> bindings = new LinkedHashMap<>();
    private final StringBuilder output = new StringBuilder();
    private final Consumer<String> sink;
    private Expression lastResult;

    public Environment() {
        this(text -> {});
    }

    /**
     * @param sink receives every piece of output as soon as it is emitted
     */
    public Environment(Consumer<String> sink) {
        this.sink = sink;
    }

    public Optional<Binding> lookup(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    public boolean isDefined(String name) {
        return bindings.containsKey(name);
    }

    void declare(String name) {
        bindings.put(name, new Binding.Free(Expression.symbol(name)));
    }

    void bind(String name, Expression value) {
        bindings.put(name, new Binding.Bound(value));
    }

    /**
     * Value assigned to the name, if it has one.
     */
    public Optional<Expression> valueOf(String name) {
        return lookup(name).flatMap(binding -> binding instanceof Binding.Bound bound
                                               ? Optional.of(bound.value())
                                               : Optional.empty());
    }

    public Map<String, Binding> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    void emit(String text) {
        output.append(text);
        sink.accept(text);
    }

    /**
     * Everything the script displayed, in order.
     */
    public String output() {
        return output.toString();
    }

    void remember(Expression value) {
        lastResult = value;
    }

    /**
     * Value of the most recent computation statement such as {@code integrate(f, x);}.
     */
    public Optional<Expression> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    /**
     * One line per binding: {@code x: symbol} or {@code f = 3*x + 1}.
     */
    public String describe() {
        var sb = new StringBuilder();
        bindings.forEach((name, binding) -> {
            if (binding instanceof Binding.Bound bound) {
                sb.append(name).append(" = ").append(Printer.render(bound.value())).append("\n");
            } else {
                sb.append(name).append(": symbol\n");
            }
        });
        return sb.toString();
    }
}
