package io.mathxform.core.algebra;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Exact rational number. The compact constructor keeps the fraction reduced with a positive
 * denominator, so equal values are equal records.
 */
public record Num(BigInteger numerator, BigInteger denominator) implements Expr {

    public static final Num ZERO = of(0);
    public static final Num ONE = of(1);
    public static final Num MINUS_ONE = of(-1);
    public static final Num TWO = of(2);

    public Num {
        Objects.requireNonNull(numerator, "numerator must not be null");
        Objects.requireNonNull(denominator, "denominator must not be null");
        if (denominator.signum() == 0) {
            throw new ArithmeticException("denominator must not be zero");
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

    public static Num of(long value) {
        return new Num(BigInteger.valueOf(value), BigInteger.ONE);
    }

    public static Num of(BigInteger value) {
        return new Num(value, BigInteger.ONE);
    }

    public static Num of(long numerator, long denominator) {
        return new Num(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    /**
     * Parses an integer ({@code 12}), fraction ({@code 3/4}) or plain decimal ({@code 1.25}) into an
     * exact value.
     *
     * @throws NumberFormatException if the text is none of those
     */
    public static Num parse(String text) {
        String trimmed = text.trim();
        int slash = trimmed.indexOf('/');
        if (slash >= 0) {
            return new Num(
                    new BigInteger(trimmed.substring(0, slash).trim()),
                    new BigInteger(trimmed.substring(slash + 1).trim()));
        }
        if (trimmed.indexOf('.') >= 0 || trimmed.indexOf('e') >= 0 || trimmed.indexOf('E') >= 0) {
            BigDecimal decimal = new BigDecimal(trimmed);
            if (decimal.scale() <= 0) {
                return of(decimal.toBigIntegerExact());
            }
            return new Num(decimal.unscaledValue(), BigInteger.TEN.pow(decimal.scale()));
        }
        return of(new BigInteger(trimmed));
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isOne() {
        return isInteger() && numerator.equals(BigInteger.ONE);
    }

    public boolean isNegative() {
        return numerator.signum() < 0;
    }

    public int signum() {
        return numerator.signum();
    }

    public Num add(Num other) {
        return new Num(
                numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    public Num multiply(Num other) {
        return new Num(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    public Num negate() {
        return new Num(numerator.negate(), denominator);
    }

    public Num abs() {
        return isNegative() ? negate() : this;
    }

    public Num reciprocal() {
        return new Num(denominator, numerator);
    }

    /** Integer power; negative exponents take the reciprocal first. */
    public Num pow(int exponent) {
        if (exponent < 0) {
            return reciprocal().pow(-exponent);
        }
        return new Num(numerator.pow(exponent), denominator.pow(exponent));
    }

    /** The integer value, when it fits an {@code int}. */
    public int intValueExact() {
        if (!isInteger()) {
            throw new ArithmeticException("not an integer: " + this);
        }
        return numerator.intValueExact();
    }

    public int compareTo(Num other) {
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public List<Expr> args() {
        return List.of();
    }

    @Override
    public Expr withArgs(List<Expr> args) {
        return this;
    }

    @Override
    public String toString() {
        return isInteger() ? numerator.toString() : numerator + "/" + denominator;
    }
}
