package com.abcfmt.loader.ast;

public final class DecorationNode extends ElementNode {

    private final String text;

    public DecorationNode(int id, SourceLocation location, String text) {
        super(id, location);
        this.text = text;
    }

    @Override
    public String getText() {
        return text;
    }
}
