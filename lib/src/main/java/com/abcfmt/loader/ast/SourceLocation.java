package com.abcfmt.loader.ast;

import java.util.Objects;
import org.antlr.v4.runtime.Token;

/**
 * Where a node starts in its source text. Lines and columns are 1-based; nodes the formatter
 * creates itself share {@link #SYNTHETIC}, which has neither.
 */
public final class SourceLocation implements Comparable<SourceLocation> {

    public static final SourceLocation SYNTHETIC = new SourceLocation("<synthetic>", 0, 0);

    private final String sourceName;
    private final int line;
    private final int column;

    public SourceLocation(String sourceName, int line, int column) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.line = line;
        this.column = column;
    }

    /** Location of the first character of {@code token}. */
    public static SourceLocation of(String sourceName, Token token) {
        return new SourceLocation(sourceName, token.getLine(), token.getCharPositionInLine() + 1);
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public int compareTo(SourceLocation other) {
        int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof SourceLocation)) {
            return false;
        }
        SourceLocation that = (SourceLocation) obj;
        return sourceName.equals(that.sourceName) && line == that.line && column == that.column;
    }

    @Override
    public int hashCode() {
        return (sourceName.hashCode() * 31 + line) * 31 + column;
    }

    @Override
    public String toString() {
        return this == SYNTHETIC ? sourceName : sourceName + ":" + line + ":" + column;
    }
}
