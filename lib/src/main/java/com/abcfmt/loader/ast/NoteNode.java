package com.abcfmt.loader.ast;

import java.util.Objects;

public final class NoteNode extends ElementNode {

    private final Pitch pitch;
    private final Rhythm rhythm;
    private final boolean tied;

    public NoteNode(int id, SourceLocation location, Pitch pitch, Rhythm rhythm, boolean tied) {
        super(id, location);
        this.pitch = Objects.requireNonNull(pitch, "pitch");
        this.rhythm = rhythm == null ? Rhythm.NONE : rhythm;
        this.tied = tied;
    }

    public Pitch getPitch() {
        return pitch;
    }

    public Rhythm getRhythm() {
        return rhythm;
    }

    public boolean isTied() {
        return tied;
    }

    @Override
    public String getText() {
        return pitch.toAbc() + rhythm.toAbc() + (tied ? "-" : "");
    }

    @Override
    public boolean isTimeBearing() {
        return true;
    }
}
