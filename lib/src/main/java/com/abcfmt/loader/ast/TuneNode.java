package com.abcfmt.loader.ast;

import java.util.List;
import java.util.Objects;

/**
 * One tune: header lines from {@code X:} through the first {@code K:}, the body up to the next
 * blank line, and any blank or free-text lines that follow before the next tune.
 */
public final class TuneNode {

    private final SourceLocation location;
    private final List<LineNode> header;
    private final List<LineNode> body;
    private final List<LineNode> trailing;

    public TuneNode(
            SourceLocation location,
            List<LineNode> header,
            List<LineNode> body,
            List<LineNode> trailing) {
        this.location = Objects.requireNonNull(location, "location");
        this.header = List.copyOf(header);
        this.body = List.copyOf(body);
        this.trailing = List.copyOf(trailing);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<LineNode> getHeader() {
        return header;
    }

    public List<LineNode> getBody() {
        return body;
    }

    public List<LineNode> getTrailing() {
        return trailing;
    }

    /** Value of the first header field with this key, or null. */
    public String getHeaderValue(char key) {
        for (LineNode line : header) {
            if (line instanceof InfoLineNode info && info.isKey(key)) {
                return info.getValue();
            }
        }
        return null;
    }
}
