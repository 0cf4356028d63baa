package com.abcfmt.loader.ast;

public final class WhitespaceNode extends ElementNode {

    private final String text;

    public WhitespaceNode(int id, SourceLocation location, String text) {
        super(id, location);
        if (text.isEmpty() || !text.chars().allMatch(c -> c == ' ' || c == '\t')) {
            throw new IllegalArgumentException("Whitespace node must hold spaces or tabs");
        }
        this.text = text;
    }

    /** Synthetic run of {@code width} spaces. */
    public static WhitespaceNode spaces(NodeIds ids, int width) {
        return new WhitespaceNode(ids.next(), SourceLocation.SYNTHETIC, " ".repeat(width));
    }

    public int getWidth() {
        return text.length();
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public boolean isWhitespace() {
        return true;
    }
}
