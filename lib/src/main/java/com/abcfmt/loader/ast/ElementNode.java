package com.abcfmt.loader.ast;

import java.util.Objects;

/**
 * One item of a music or symbol line. The set of variants is closed; the classification
 * predicates below are what the aligner dispatches on.
 */
public sealed abstract class ElementNode
        permits NoteNode,
                RestNode,
                MultiMeasureRestNode,
                ChordNode,
                BeamNode,
                GraceGroupNode,
                TupletNode,
                BarLineNode,
                DecorationNode,
                AnnotationNode,
                InlineFieldNode,
                MarkerNode,
                WhitespaceNode,
                CommentNode,
                SymbolHeaderNode,
                SymbolTokenNode {

    private final int id;
    private final SourceLocation location;

    protected ElementNode(int id, SourceLocation location) {
        this.id = id;
        this.location = Objects.requireNonNull(location, "location");
    }

    public int getId() {
        return id;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** Source text of this node exactly as written. */
    public abstract String getText();

    /** Notes, chords, rests, multi-measure rests and beams occupy musical time. */
    public boolean isTimeBearing() {
        return false;
    }

    public boolean isBarLine() {
        return false;
    }

    public boolean isBeam() {
        return false;
    }

    public boolean isWhitespace() {
        return false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "#" + id + "[" + getText() + "]";
    }
}
