package com.abcfmt.loader.ast;

public final class AnnotationNode extends ElementNode {

    private final String text;

    public AnnotationNode(int id, SourceLocation location, String text) {
        super(id, location);
        this.text = text;
    }

    @Override
    public String getText() {
        return text;
    }
}
