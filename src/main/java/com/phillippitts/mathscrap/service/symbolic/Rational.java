package com.phillippitts.mathscrap.service.symbolic;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Objects;
import java.util.Optional;

/**
 * Exact rational number in lowest terms with a positive denominator.
 */
public record Rational(BigInteger numerator, BigInteger denominator) implements Comparable<Rational> {

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);
    public static final Rational MINUS_ONE = new Rational(BigInteger.ONE.negate(), BigInteger.ONE);
    public static final Rational HALF = new Rational(BigInteger.ONE, BigInteger.TWO);

    public Rational {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        if (denominator.signum() == 0) {
            throw new ArithmeticException("Division by zero");
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
        if (numerator.signum() == 0) {
            denominator = BigInteger.ONE;
        }
    }

    public static Rational of(long value) {
        return new Rational(BigInteger.valueOf(value), BigInteger.ONE);
    }

    public static Rational of(long numerator, long denominator) {
        return new Rational(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    /**
     * Parses a decimal literal such as {@code 12}, {@code 0.25} or {@code 3.} exactly.
     */
    public static Rational parseDecimal(String literal) {
        BigDecimal decimal = new BigDecimal(literal);
        if (decimal.scale() <= 0) {
            return new Rational(decimal.toBigIntegerExact(), BigInteger.ONE);
        }
        return new Rational(decimal.unscaledValue(), BigInteger.TEN.pow(decimal.scale()));
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

    public Rational divide(Rational other) {
        return new Rational(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    public Rational negate() {
        return new Rational(numerator.negate(), denominator);
    }

    /** Integer power; negative exponents invert. */
    public Rational pow(int exponent) {
        if (exponent >= 0) {
            return new Rational(numerator.pow(exponent), denominator.pow(exponent));
        }
        return new Rational(denominator.pow(-exponent), numerator.pow(-exponent));
    }

    /**
     * Exact k-th root when both numerator and denominator are perfect k-th powers.
     */
    public Optional<Rational> root(int k) {
        if (k <= 0 || (signum() < 0 && k % 2 == 0)) {
            return Optional.empty();
        }
        Optional<BigInteger> num = exactRoot(numerator.abs(), k);
        Optional<BigInteger> den = exactRoot(denominator, k);
        if (num.isEmpty() || den.isEmpty()) {
            return Optional.empty();
        }
        BigInteger n = signum() < 0 ? num.get().negate() : num.get();
        return Optional.of(new Rational(n, den.get()));
    }

    private static Optional<BigInteger> exactRoot(BigInteger value, int k) {
        if (k == 2) {
            BigInteger r = value.sqrt();
            return r.multiply(r).equals(value) ? Optional.of(r) : Optional.empty();
        }
        if (k >= value.bitLength()) {
            // 2^k already exceeds value
            return value.compareTo(BigInteger.ONE) <= 0 ? Optional.of(value) : Optional.empty();
        }
        BigInteger r = BigInteger.valueOf(Math.round(Math.pow(value.doubleValue(), 1.0 / k)));
        for (BigInteger candidate : new BigInteger[] {r.subtract(BigInteger.ONE), r, r.add(BigInteger.ONE)}) {
            if (candidate.signum() >= 0 && candidate.pow(k).equals(value)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public int signum() {
        return numerator.signum();
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

    /** True when this is an integer that fits in an {@code int}. */
    public boolean isSmallInteger() {
        return isInteger() && numerator.bitLength() < 31;
    }

    public int intValueExact() {
        return numerator.intValueExact();
    }

    public double doubleValue() {
        return new BigDecimal(numerator).divide(new BigDecimal(denominator), MathContext.DECIMAL64).doubleValue();
    }

    @Override
    public int compareTo(Rational other) {
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public String toString() {
        return isInteger() ? numerator.toString() : numerator + "/" + denominator;
    }
}
