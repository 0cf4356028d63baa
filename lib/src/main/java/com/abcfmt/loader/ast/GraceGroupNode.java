package com.abcfmt.loader.ast;

import java.util.List;

public final class GraceGroupNode extends ElementNode {

    private final boolean acciaccatura;
    private final List<NoteNode> notes;

    public GraceGroupNode(
            int id, SourceLocation location, boolean acciaccatura, List<NoteNode> notes) {
        super(id, location);
        this.acciaccatura = acciaccatura;
        this.notes = List.copyOf(notes);
    }

    public boolean isAcciaccatura() {
        return acciaccatura;
    }

    public List<NoteNode> getNotes() {
        return notes;
    }

    @Override
    public String getText() {
        StringBuilder builder = new StringBuilder(acciaccatura ? "{/" : "{");
        for (NoteNode note : notes) {
            builder.append(note.getText());
        }
        return builder.append('}').toString();
    }
}
