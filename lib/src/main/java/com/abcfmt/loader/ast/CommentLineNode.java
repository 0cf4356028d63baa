package com.abcfmt.loader.ast;

public final class CommentLineNode extends LineNode {

    private final String text;

    public CommentLineNode(SourceLocation location, String text) {
        super(location);
        this.text = text;
    }

    @Override
    public String getText() {
        return text;
    }
}
