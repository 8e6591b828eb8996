package org.persoftware.seta.expr;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Exact rational number with a reduced fraction and a positive denominator.
 */
public record Rational(BigInteger numerator, BigInteger denominator) implements Comparable<Rational> {

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);
    public static final Rational MINUS_ONE = new Rational(BigInteger.ONE.negate(), BigInteger.ONE);

    private static final int MAX_EXPONENT = 10_000;

    public Rational {
        if (denominator.signum() == 0) {
            throw new ArithmeticException("Zero denominator");
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        var gcd = numerator.gcd(denominator);
        if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
    }

    public static Rational of(long value) {
        return new Rational(BigInteger.valueOf(value), BigInteger.ONE);
    }

    public static Rational of(long numerator, long denominator) {
        return new Rational(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational of(BigInteger value) {
        return new Rational(value, BigInteger.ONE);
    }

    /**
     * Parse a decimal literal such as {@code 12} or {@code 0.25} into its exact value.
     */
    public static Rational parse(String literal) {
        var decimal = new BigDecimal(literal);
        if (decimal.scale() <= 0) {
            return of(decimal.toBigIntegerExact());
        }
        return new Rational(decimal.unscaledValue(), BigInteger.TEN.pow(decimal.scale()));
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isOne() {
        return equals(ONE);
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    public int signum() {
        return numerator.signum();
    }

    public Rational add(Rational other) {
        return new Rational(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                            denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return add(other.negate());
    }

    public Rational multiply(Rational other) {
        return new Rational(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    /**
     * @throws ArithmeticException if {@code other} is zero
     */
    public Rational divide(Rational other) {
        if (other.isZero()) {
            throw new ArithmeticException("Division by zero");
        }
        return new Rational(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    public Rational negate() {
        return new Rational(numerator.negate(), denominator);
    }

    public Rational abs() {
        return signum() < 0 ? negate() : this;
    }

    /**
     * @throws ArithmeticException for a negative power of zero or an exponent too large to compute
     */
    public Rational pow(int exponent) {
        if (Math.abs(exponent) > MAX_EXPONENT) {
            throw new ArithmeticException("Exponent too large: " + exponent);
        }
        if (exponent < 0) {
            return ONE.divide(pow(-exponent));
        }
        return new Rational(numerator.pow(exponent), denominator.pow(exponent));
    }

    /**
     * Exact n-th root, present only when both numerator and denominator are perfect n-th powers.
     */
    public Optional<Rational> root(int degree) {
        if (signum() < 0) {
            return Optional.empty();
        }
        var num = integerRoot(numerator, degree);
        var den = integerRoot(denominator, degree);
        if (num.isPresent() && den.isPresent()) {
            return Optional.of(new Rational(num.get(), den.get()));
        }
        return Optional.empty();
    }

    /**
     * Exponent as an {@code int} when this is an integer of moderate size.
     */
    public Optional<Integer> intValue() {
        if (!isInteger() || numerator.bitLength() > 31) {
            return Optional.empty();
        }
        return Optional.of(numerator.intValueExact());
    }

    @Override
    public int compareTo(Rational other) {
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public String toString() {
        return isInteger() ? numerator.toString() : numerator + "/" + denominator;
    }

    private static Optional<BigInteger> integerRoot(BigInteger value, int degree) {
        if (value.signum() == 0 || value.equals(BigInteger.ONE)) {
            return Optional.of(value);
        }
        var low = BigInteger.ONE;
        var high = BigInteger.ONE.shiftLeft(value.bitLength() / degree + 1);
        while (low.compareTo(high) <= 0) {
            var mid = low.add(high).shiftRight(1);
            var cmp = mid.pow(degree).compareTo(value);
            if (cmp == 0) {
                return Optional.of(mid);
            }
            if (cmp < 0) {
                low = mid.add(BigInteger.ONE);
            } else {
                high = mid.subtract(BigInteger.ONE);
            }
        }
        return Optional.empty();
    }
}
