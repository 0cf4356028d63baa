package com.abcfmt.loader.ast;

/** Single-character structural markers that carry no data beyond their kind. */
public final class MarkerNode extends ElementNode {

    public enum Kind {
        SLUR_OPEN("("),
        SLUR_CLOSE(")"),
        SPACER("y"),
        OVERLAY("&"),
        CONTINUATION("\\");

        private final String text;

        Kind(String text) {
            this.text = text;
        }

        public String getText() {
            return text;
        }
    }

    private final Kind kind;

    public MarkerNode(int id, SourceLocation location, Kind kind) {
        super(id, location);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String getText() {
        return kind.getText();
    }
}
