package com.abcfmt.loader.ast;

/** One token of a lyric or symbol line: a syllable or symbol, a {@code *} skip, or a bar. */
public final class SymbolTokenNode extends ElementNode {

    public enum Kind {
        TEXT,
        SKIP,
        BAR
    }

    private final Kind kind;
    private final String text;

    public SymbolTokenNode(int id, SourceLocation location, Kind kind, String text) {
        super(id, location);
        this.kind = kind;
        this.text = text;
    }

    public Kind getKind() {
        return kind;
    }

    /** A syllable ending in a hyphen continues into the next one. */
    public boolean isHyphenated() {
        return kind == Kind.TEXT && text.length() > 1 && text.endsWith("-");
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public boolean isBarLine() {
        return kind == Kind.BAR;
    }
}
