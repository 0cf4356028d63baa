package com.abcfmt.loader.ast;

/** An empty or whitespace-only line; ends the current tune. */
public final class BlankLineNode extends LineNode {

    public BlankLineNode(SourceLocation location) {
        super(location);
    }

    @Override
    public String getText() {
        return "";
    }
}
