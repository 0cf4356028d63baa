package com.abcfmt.loader;

import java.util.Locale;
import java.util.Objects;

/**
 * A recoverable diagnostic produced while loading or analysing an ABC file. Line 0 means the
 * message is not tied to a line.
 */
public final class LoaderMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String text;
    private final String sourceName;
    private final int line;

    public LoaderMessage(Level level, String text, String sourceName, int line) {
        this.level = Objects.requireNonNull(level, "level");
        this.text = Objects.requireNonNull(text, "text");
        this.sourceName = sourceName;
        this.line = line;
    }

    public static LoaderMessage info(String text, String sourceName) {
        return new LoaderMessage(Level.INFO, text, sourceName, 0);
    }

    public static LoaderMessage warning(String text, String sourceName, int line) {
        return new LoaderMessage(Level.WARNING, text, sourceName, line);
    }

    public Level getLevel() {
        return level;
    }

    public String getText() {
        return text;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    /** Whether the message deserves the user's attention, i.e. is worse than INFO. */
    public boolean isReportable() {
        return level != Level.INFO;
    }

    /** {@code name:line: LEVEL: text}, the line omitted when it is 0. */
    @Override
    public String toString() {
        if (line <= 0) {
            return String.format(Locale.ROOT, "%s: %s: %s", sourceName, level, text);
        }
        return String.format(Locale.ROOT, "%s:%d: %s: %s", sourceName, line, level, text);
    }
}
