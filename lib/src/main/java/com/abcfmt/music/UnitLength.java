package com.abcfmt.music;

/** Parsing for {@code L:} values. */
public final class UnitLength {

    public static final Rational DEFAULT = Rational.of(1, 8);

    private UnitLength() {}

    /**
     * Parses {@code 1/8}, {@code 1/16} and so on.
     *
     * @throws IllegalArgumentException if the value is not a positive fraction
     */
    public static Rational parse(String value) {
        String text = value.trim();
        int comment = text.indexOf('%');
        if (comment >= 0) {
            text = text.substring(0, comment).trim();
        }
        Rational length = Rational.parse(text);
        if (!length.isGreaterThan(Rational.ZERO)) {
            throw new IllegalArgumentException("Unit length must be positive: " + value);
        }
        return length;
    }
}
