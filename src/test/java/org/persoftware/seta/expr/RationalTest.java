package org.persoftware.seta.expr;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class RationalTest {

    @Test
    void of_reducesAndNormalizesSign() {
        var value = Rational.of(6, -8);

        assertEquals(BigInteger.valueOf(-3), value.numerator());
        assertEquals(BigInteger.valueOf(4), value.denominator());
        assertEquals("-3/4", value.toString());
    }

    @Test
    void of_zeroDenominator_throws() {
        assertThrows(ArithmeticException.class, () -> Rational.of(1, 0));
    }

    @Test
    void parse_decimalIsExact() {
        assertEquals(Rational.of(1, 4), Rational.parse("0.25"));
        assertEquals(Rational.of(5, 2), Rational.parse("2.50"));
        assertEquals(Rational.of(12), Rational.parse("12"));
    }

    @Test
    void arithmetic_staysExact() {
        var third = Rational.of(1, 3);
        var sixth = Rational.of(1, 6);

        assertEquals(Rational.of(1, 2), third.add(sixth));
        assertEquals(Rational.of(1, 6), third.subtract(sixth));
        assertEquals(Rational.of(1, 18), third.multiply(sixth));
        assertEquals(Rational.of(2), third.divide(sixth));
    }

    @Test
    void divide_byZero_throws() {
        assertThrows(ArithmeticException.class, () -> Rational.ONE.divide(Rational.ZERO));
    }

    @Test
    void pow_negativeExponent_inverts() {
        assertEquals(Rational.of(8, 27), Rational.of(2, 3).pow(3));
        assertEquals(Rational.of(9, 4), Rational.of(2, 3).pow(-2));
    }

    @Test
    void root_isPresentOnlyWhenExact() {
        assertEquals(Rational.of(3, 2), Rational.of(9, 4).root(2).orElseThrow());
        assertEquals(Rational.of(2), Rational.of(8).root(3).orElseThrow());
        assertTrue(Rational.of(2).root(2).isEmpty());
        assertTrue(Rational.of(-4).root(2).isEmpty());
    }

    @Test
    void intValue_onlyForIntegers() {
        assertEquals(7, Rational.of(7).intValue().orElseThrow());
        assertTrue(Rational.of(7, 2).intValue().isEmpty());
    }

    @Test
    void compareTo_ordersByValue() {
        assertTrue(Rational.of(1, 3).compareTo(Rational.of(1, 2)) < 0);
        assertTrue(Rational.of(-1, 2).compareTo(Rational.of(-1, 3)) < 0);
        assertEquals(0, Rational.of(2, 4).compareTo(Rational.of(1, 2)));
    }
}
