package com.abcfmt.loader.ast;

/** Trailing {@code %} comment at the end of a music or symbol line. */
public final class CommentNode extends ElementNode {

    private final String text;

    public CommentNode(int id, SourceLocation location, String text) {
        super(id, location);
        this.text = text;
    }

    @Override
    public String getText() {
        return text;
    }
}
