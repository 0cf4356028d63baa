package com.abcfmt.loader.ast;

import java.util.Locale;

/** Header-style field line such as {@code K:G} or {@code V:1 clef=bass}. */
public final class InfoLineNode extends LineNode {

    private final String text;

    public InfoLineNode(SourceLocation location, String text) {
        super(location);
        if (text.length() < 2 || text.charAt(1) != ':') {
            throw new IllegalArgumentException("Malformed info field: " + text);
        }
        this.text = text;
    }

    public char getKey() {
        return text.charAt(0);
    }

    /** Field value with any trailing {@code %} comment removed and surrounding blanks trimmed. */
    public String getValue() {
        String value = text.substring(2);
        int comment = value.indexOf('%');
        if (comment >= 0) {
            value = value.substring(0, comment);
        }
        return value.trim();
    }

    /** First word of the value, which for {@code V:} lines is the voice id. */
    public String getFirstWord() {
        String value = getValue();
        int end = 0;
        while (end < value.length() && !Character.isWhitespace(value.charAt(end))) {
            end++;
        }
        return value.substring(0, end);
    }

    public boolean isKey(char key) {
        return getKey() == key;
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "InfoLine[%s]", text);
    }
}
