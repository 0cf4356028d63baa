package com.abcfmt.loader.ast;

/** The {@code w:} or {@code s:} that opens a lyric or symbol line. */
public final class SymbolHeaderNode extends ElementNode {

    private final String text;

    public SymbolHeaderNode(int id, SourceLocation location, String text) {
        super(id, location);
        this.text = text;
    }

    public boolean isLyrics() {
        return text.startsWith("w");
    }

    @Override
    public String getText() {
        return text;
    }
}
