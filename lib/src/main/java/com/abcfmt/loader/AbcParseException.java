package com.abcfmt.loader;

/** Syntax error in ABC source; the message carries {@code line L:C} of the offending token. */
public final class AbcParseException extends Exception {
    public AbcParseException(String message) {
        super(message);
    }

    public AbcParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
