package org.persoftware.seta.expr;

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;

/**
 * Shared instances of symbols and small integer constants.
 */
final class AtomTable {
    static final Interner<Expression.Symbol> SYMBOLS = Interners.newWeakInterner();
    static final Interner<Expression.Number> NUMBERS = Interners.newStrongInterner();

    private static final long SMALL_MIN = -128;
    private static final long SMALL_MAX = 1024;

    private AtomTable() {}

    static boolean isSmallInteger(Rational value) {
        return value.isInteger()
               && value.numerator().bitLength() < 32
               && value.numerator().longValue() >= SMALL_MIN
               && value.numerator().longValue() <= SMALL_MAX;
    }
}
