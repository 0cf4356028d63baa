package com.abcfmt.loader.ast;

import java.util.Objects;

/**
 * Length modifier written after a note, rest or chord: optional numerator, slashes, optional
 * denominator and an optional broken-rhythm marker. All parts are kept as written so the source can
 * be reproduced exactly; numeric accessors interpret them.
 */
public final class Rhythm {

    public static final Rhythm NONE = new Rhythm(null, "", null, null);

    private final String numerator;
    private final String slashes;
    private final String denominator;
    private final String broken;

    public Rhythm(String numerator, String slashes, String denominator, String broken) {
        this.numerator = numerator;
        this.slashes = slashes == null ? "" : slashes;
        this.denominator = denominator;
        this.broken = broken;
    }

    public String getNumerator() {
        return numerator;
    }

    public String getSlashes() {
        return slashes;
    }

    public String getDenominator() {
        return denominator;
    }

    public String getBroken() {
        return broken;
    }

    public boolean isEmpty() {
        return numerator == null && slashes.isEmpty() && denominator == null && broken == null;
    }

    /** True when the numerator is literally zero, the zero-length shortcut. */
    public boolean isZeroLength() {
        return numerator != null && numerator.chars().allMatch(c -> c == '0');
    }

    /** Numerator as a number, 1 when absent. Throws {@link NumberFormatException} on overflow. */
    public long getNumeratorValue() {
        return numerator == null ? 1L : Long.parseLong(numerator);
    }

    /**
     * Denominator as a number: the explicit one when written, otherwise 2 per slash, 1 when there is
     * no slash. Throws {@link NumberFormatException} on overflow.
     */
    public long getDenominatorValue() {
        if (denominator != null) {
            return Long.parseLong(denominator);
        }
        if (slashes.isEmpty()) {
            return 1L;
        }
        if (slashes.length() > 62) {
            throw new NumberFormatException("Too many slashes: " + slashes.length());
        }
        return 1L << slashes.length();
    }

    /** Positive for {@code >} markers, negative for {@code <}, the magnitude being the marker count. */
    public int getBrokenLevel() {
        if (broken == null) {
            return 0;
        }
        return broken.charAt(0) == '>' ? broken.length() : -broken.length();
    }

    public String toAbc() {
        StringBuilder builder = new StringBuilder();
        if (numerator != null) {
            builder.append(numerator);
        }
        builder.append(slashes);
        if (denominator != null) {
            builder.append(denominator);
        }
        if (broken != null) {
            builder.append(broken);
        }
        return builder.toString();
    }

    /** Shortest equivalent spelling: {@code /2} becomes {@code /}, a bare {@code //} becomes {@code /4}. */
    public String toNormalizedAbc() {
        String separator = slashes;
        String denom = denominator;
        if (slashes.equals("/") && "2".equals(denominator)) {
            denom = null;
        } else if (slashes.equals("//") && denominator == null) {
            separator = "/";
            denom = "4";
        }
        StringBuilder builder = new StringBuilder();
        if (numerator != null) {
            builder.append(numerator);
        }
        builder.append(separator);
        if (denom != null) {
            builder.append(denom);
        }
        if (broken != null) {
            builder.append(broken);
        }
        return builder.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Rhythm)) {
            return false;
        }
        Rhythm other = (Rhythm) obj;
        return Objects.equals(numerator, other.numerator)
                && slashes.equals(other.slashes)
                && Objects.equals(denominator, other.denominator)
                && Objects.equals(broken, other.broken);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numerator, slashes, denominator, broken);
    }

    @Override
    public String toString() {
        return toAbc();
    }
}
