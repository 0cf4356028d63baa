package com.abcfmt.loader.ast;

/** Bracketed field inside a music line, e.g. {@code [V:1]} or {@code [L:1/16]}. */
public final class InlineFieldNode extends ElementNode {

    private final String text;

    public InlineFieldNode(int id, SourceLocation location, String text) {
        super(id, location);
        if (text.length() < 4 || text.charAt(0) != '[' || text.charAt(2) != ':') {
            throw new IllegalArgumentException("Malformed inline field: " + text);
        }
        this.text = text;
    }

    public char getFieldKey() {
        return text.charAt(1);
    }

    /** Field value between the colon and the closing bracket, trimmed. */
    public String getValue() {
        return text.substring(3, text.length() - 1).trim();
    }

    @Override
    public String getText() {
        return text;
    }
}
