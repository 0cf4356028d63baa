package com.abcfmt.loader.ast;

public final class DirectiveLineNode extends LineNode {

    private final String text;

    public DirectiveLineNode(SourceLocation location, String text) {
        super(location);
        this.text = text;
    }

    @Override
    public String getText() {
        return text;
    }
}
