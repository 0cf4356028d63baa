package com.abcfmt.loader.ast;

import java.util.List;

public final class ChordNode extends ElementNode {

    private final List<NoteNode> notes;
    private final Rhythm rhythm;
    private final boolean tied;

    public ChordNode(
            int id, SourceLocation location, List<NoteNode> notes, Rhythm rhythm, boolean tied) {
        super(id, location);
        this.notes = List.copyOf(notes);
        this.rhythm = rhythm == null ? Rhythm.NONE : rhythm;
        this.tied = tied;
    }

    public List<NoteNode> getNotes() {
        return notes;
    }

    public Rhythm getRhythm() {
        return rhythm;
    }

    public boolean isTied() {
        return tied;
    }

    @Override
    public String getText() {
        StringBuilder builder = new StringBuilder("[");
        for (NoteNode note : notes) {
            builder.append(note.getText());
        }
        return builder.append(']').append(rhythm.toAbc()).append(tied ? "-" : "").toString();
    }

    @Override
    public boolean isTimeBearing() {
        return true;
    }
}
