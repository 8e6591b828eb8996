package org.persoftware.seta.expr;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Immutable mathematical expression tree.
 *
 * <p>The records accept any shape, so non-canonical trees can be built directly; {@link Algebra} builds canonical
 * ones. Children are shared freely between trees and never point back to their parents.
 */
public sealed interface Expression {

    Number ZERO = number(Rational.ZERO);
    Number ONE = number(Rational.ONE);
    Number MINUS_ONE = number(Rational.MINUS_ONE);

    // === Atoms ===

    /**
     * Exact rational constant.
     */
    record Number(Rational value) implements Expression {
        @Override
        public String toString() {
            return value.toString();
        }
    }

    /**
     * Free symbol such as {@code x}.
     */
    record Symbol(String name) implements Expression {
        @Override
        public String toString() {
            return name;
        }
    }

    // === Composites ===

    /**
     * Sum of scaled terms: {@code c1*t1 + c2*t2 + ...}. The constant part is the term {@link #ONE}.
     */
    record Sum(List<Term> terms) implements Expression {
        public Sum {
            terms = ImmutableList.copyOf(terms);
        }

        @Override
        public String toString() {
            return Printer.render(this);
        }
    }

    record Term(Rational coefficient, Expression term) {}

    /**
     * Product of powers scaled by a numeric coefficient: {@code c * b1^e1 * b2^e2 * ...}.
     */
    record Product(Rational coefficient, List<Factor> factors) implements Expression {
        public Product {
            factors = ImmutableList.copyOf(factors);
        }

        @Override
        public String toString() {
            return Printer.render(this);
        }
    }

    record Factor(Expression base, Expression exponent) {}

    /**
     * Single power {@code base^exponent}.
     */
    record Power(Expression base, Expression exponent) implements Expression {
        @Override
        public String toString() {
            return Printer.render(this);
        }
    }

    /**
     * Named function application such as {@code ln(x)}.
     */
    record Call(String function, List<Expression> arguments) implements Expression {
        public Call {
            arguments = ImmutableList.copyOf(arguments);
        }

        @Override
        public String toString() {
            return Printer.render(this);
        }
    }

    // === Interned construction ===

    /**
     * Symbol for the name, shared with every other symbol of the same name.
     */
    static Symbol symbol(String name) {
        return AtomTable.SYMBOLS.intern(new Symbol(name));
    }

    static Number number(long value) {
        return number(Rational.of(value));
    }

    /**
     * Number for the value; small integers are shared instances.
     */
    static Number number(Rational value) {
        var number = new Number(value);
        if (AtomTable.isSmallInteger(value)) {
            return AtomTable.NUMBERS.intern(number);
        }
        return number;
    }

    static Call call(String function, Expression... arguments) {
        return new Call(function, List.of(arguments));
    }

    default boolean isNumber() {
        return this instanceof Number;
    }

    default boolean isZero() {
        return this instanceof Number number && number.value().isZero();
    }

    default boolean isOne() {
        return this instanceof Number number && number.value().isOne();
    }
}
