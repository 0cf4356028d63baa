package com.abcfmt.loader.ast;

import java.util.List;

/** A {@code w:} lyric line or {@code s:} symbol line; the first element is its header. */
public final class SymbolLineNode extends LineNode {

    private final List<ElementNode> elements;

    public SymbolLineNode(SourceLocation location, List<ElementNode> elements) {
        super(location);
        if (elements.isEmpty() || !(elements.get(0) instanceof SymbolHeaderNode)) {
            throw new IllegalArgumentException("Symbol line must start with its header");
        }
        this.elements = List.copyOf(elements);
    }

    public List<ElementNode> getElements() {
        return elements;
    }

    public SymbolHeaderNode getHeader() {
        return (SymbolHeaderNode) elements.get(0);
    }

    @Override
    public String getText() {
        StringBuilder builder = new StringBuilder();
        for (ElementNode element : elements) {
            builder.append(element.getText());
        }
        return builder.toString();
    }
}
