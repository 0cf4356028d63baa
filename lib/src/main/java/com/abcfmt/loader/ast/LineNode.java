package com.abcfmt.loader.ast;

import java.util.Objects;

/** One physical line of an ABC file. */
public sealed abstract class LineNode
        permits InfoLineNode,
                DirectiveLineNode,
                CommentLineNode,
                BlankLineNode,
                MusicLineNode,
                SymbolLineNode {

    private final SourceLocation location;

    protected LineNode(SourceLocation location) {
        this.location = Objects.requireNonNull(location, "location");
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** Line text without its line terminator. */
    public abstract String getText();
}
