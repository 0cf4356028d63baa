package com.abcfmt.loader.ast;

public final class BarLineNode extends ElementNode {

    private final String text;

    public BarLineNode(int id, SourceLocation location, String text) {
        super(id, location);
        this.text = text;
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public boolean isBarLine() {
        return true;
    }
}
