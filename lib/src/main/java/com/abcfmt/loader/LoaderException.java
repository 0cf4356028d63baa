package com.abcfmt.loader;

/**
 * An ABC file that could not be read or parsed at all. Problems the loader can work around are
 * reported as {@link LoaderMessage}s instead.
 */
public final class LoaderException extends Exception {

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
