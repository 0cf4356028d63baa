package com.abcfmt.music;

import java.math.BigInteger;

/**
 * Exact fraction of a whole note, with one extra infinite value for unmeasured multi-measure
 * rests. Finite values are kept reduced with a positive denominator in {@link BigInteger}s, so
 * sums of unusual note lengths cannot overflow. Comparison uses cross-multiplication; the
 * infinite value is greater than every finite one and equal only to itself.
 */
public final class Rational implements Comparable<Rational> {

    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);
    public static final Rational INFINITE = new Rational(BigInteger.ONE, BigInteger.ZERO);

    private final BigInteger numerator;
    private final BigInteger denominator;

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static Rational of(long numerator, long denominator) {
        return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational of(BigInteger numerator, BigInteger denominator) {
        if (denominator.signum() == 0) {
            throw new IllegalArgumentException("Denominator must not be zero; use INFINITE");
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        return new Rational(numerator.divide(gcd), denominator.divide(gcd));
    }

    public static Rational of(long value) {
        return new Rational(BigInteger.valueOf(value), BigInteger.ONE);
    }

    /** Parses {@code n/d} or a plain integer. Throws {@link IllegalArgumentException} otherwise. */
    public static Rational parse(String text) {
        String trimmed = text.trim();
        int slash = trimmed.indexOf('/');
        try {
            if (slash < 0) {
                return of(Long.parseLong(trimmed));
            }
            return of(
                    Long.parseLong(trimmed.substring(0, slash).trim()),
                    Long.parseLong(trimmed.substring(slash + 1).trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Not a fraction: " + text, ex);
        }
    }

    public BigInteger getNumerator() {
        return numerator;
    }

    public BigInteger getDenominator() {
        return denominator;
    }

    public boolean isInfinite() {
        return denominator.signum() == 0;
    }

    public Rational add(Rational other) {
        if (isInfinite() || other.isInfinite()) {
            return INFINITE;
        }
        if (denominator.equals(other.denominator)) {
            return of(numerator.add(other.numerator), denominator);
        }
        return of(
                numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    public Rational multiply(Rational other) {
        if (isInfinite() || other.isInfinite()) {
            return INFINITE;
        }
        return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    public Rational multiply(long factorNumerator, long factorDenominator) {
        return multiply(of(factorNumerator, factorDenominator));
    }

    public boolean isGreaterThan(Rational other) {
        return compareTo(other) > 0;
    }

    public boolean isEqualTo(Rational other) {
        return compareTo(other) == 0;
    }

    @Override
    public int compareTo(Rational other) {
        if (isInfinite() || other.isInfinite()) {
            return Boolean.compare(isInfinite(), other.isInfinite());
        }
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Rational)) {
            return false;
        }
        Rational other = (Rational) obj;
        return numerator.equals(other.numerator) && denominator.equals(other.denominator);
    }

    @Override
    public int hashCode() {
        return numerator.hashCode() * 31 + denominator.hashCode();
    }

    @Override
    public String toString() {
        if (isInfinite()) {
            return "inf";
        }
        return denominator.equals(BigInteger.ONE) ? numerator.toString() : numerator + "/" + denominator;
    }
}
