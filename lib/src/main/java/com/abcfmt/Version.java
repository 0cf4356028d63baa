package com.abcfmt;

/** Release identifiers printed by {@code abcfmt --version}. */
public final class Version {
    public static final String NAME = "abcfmt";
    public static final String RELEASE = "0.1.0-alpha";

    /** Runtime of the generated parser; keep in step with {@code antlr.version} in the pom. */
    public static final String PARSER_RUNTIME = "ANTLR 4.13.1";

    private Version() {}

    /** One-line banner, for example {@code abcfmt 0.1.0-alpha (ANTLR 4.13.1, Java 17.0.9)}. */
    public static String banner() {
        return NAME
                + " "
                + RELEASE
                + " ("
                + PARSER_RUNTIME
                + ", Java "
                + System.getProperty("java.version", "unknown")
                + ")";
    }
}
