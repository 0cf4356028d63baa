package com.abcfmt.music;

import java.util.Objects;

/** Time signature from an {@code M:} field. */
public final class Meter {

    public static final Meter COMMON_TIME = new Meter(4, 4);

    private static final Rational THREE_QUARTERS = Rational.of(3, 4);

    private final int numerator;
    private final int denominator;

    public Meter(int numerator, int denominator) {
        if (numerator <= 0 || denominator <= 0) {
            throw new IllegalArgumentException(
                    "Meter parts must be positive: " + numerator + "/" + denominator);
        }
        this.numerator = numerator;
        this.denominator = denominator;
    }

    /**
     * Parses {@code C}, {@code C|}, {@code n/d} and additive numerators such as {@code 2+3/8}.
     * Returns null for {@code none} (free meter).
     *
     * @throws IllegalArgumentException if the value is not a meter
     */
    public static Meter parse(String value) {
        Objects.requireNonNull(value, "value");
        String text = value.trim();
        if (text.equalsIgnoreCase("none") || text.isEmpty()) {
            return null;
        }
        if (text.equals("C")) {
            return COMMON_TIME;
        }
        if (text.equals("C|")) {
            return new Meter(2, 2);
        }
        int slash = text.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("Not a meter: " + value);
        }
        String top = text.substring(0, slash).replace("(", "").replace(")", "");
        try {
            int sum = 0;
            for (String part : top.split("\\+")) {
                sum += Integer.parseInt(part.trim());
            }
            return new Meter(sum, Integer.parseInt(text.substring(slash + 1).trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Not a meter: " + value, ex);
        }
    }

    public int getNumerator() {
        return numerator;
    }

    public int getDenominator() {
        return denominator;
    }

    public Rational getValue() {
        return Rational.of(numerator, denominator);
    }

    /** 6/8, 9/8, 12/8 and the like: beats divide in three. */
    public boolean isCompound() {
        return numerator > 3 && numerator % 3 == 0;
    }

    /** Unit note length implied when no {@code L:} is given: 1/16 below 3/4, otherwise 1/8. */
    public Rational impliedUnitLength() {
        return THREE_QUARTERS.isGreaterThan(getValue()) ? Rational.of(1, 16) : Rational.of(1, 8);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Meter)) {
            return false;
        }
        Meter other = (Meter) obj;
        return numerator == other.numerator && denominator == other.denominator;
    }

    @Override
    public int hashCode() {
        return Objects.hash(numerator, denominator);
    }

    @Override
    public String toString() {
        return numerator + "/" + denominator;
    }
}
