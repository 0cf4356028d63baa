package com.abcfmt.format.align;

import com.abcfmt.music.Rational;
import java.util.Objects;

/**
 * Mutable per-voice state threaded through one scan: the current default note length, the active
 * tuplet and a pending broken-rhythm factor for the next event. Created fresh for every voice.
 */
public final class DurationContext {

    private Rational defaultLength;
    private boolean compoundMeter;
    private int tupletNotesInGroup;
    private int tupletNotesRemaining;
    private Rational tupletRatio;
    private Rational pendingBrokenFactor;

    public DurationContext(Rational defaultLength, boolean compoundMeter) {
        this.defaultLength = Objects.requireNonNull(defaultLength, "defaultLength");
        this.compoundMeter = compoundMeter;
    }

    public Rational getDefaultLength() {
        return defaultLength;
    }

    public void setDefaultLength(Rational defaultLength) {
        this.defaultLength = Objects.requireNonNull(defaultLength, "defaultLength");
    }

    public boolean isCompoundMeter() {
        return compoundMeter;
    }

    public void setCompoundMeter(boolean compoundMeter) {
        this.compoundMeter = compoundMeter;
    }

    void startTuplet(int notesInGroup, int notesRemaining, Rational ratio) {
        this.tupletNotesInGroup = notesInGroup;
        this.tupletNotesRemaining = notesRemaining;
        this.tupletRatio = ratio;
    }

    public boolean hasActiveTuplet() {
        return tupletRatio != null;
    }

    public int getTupletNotesInGroup() {
        return tupletNotesInGroup;
    }

    public int getTupletNotesRemaining() {
        return tupletNotesRemaining;
    }

    /** Scales a duration by the active tuplet ratio and counts the event against the tuplet. */
    Rational applyTuplet(Rational duration) {
        if (tupletRatio == null) {
            return duration;
        }
        Rational scaled = duration.multiply(tupletRatio);
        tupletNotesRemaining--;
        if (tupletNotesRemaining <= 0) {
            clearTuplet();
        }
        return scaled;
    }

    void clearTuplet() {
        tupletNotesInGroup = 0;
        tupletNotesRemaining = 0;
        tupletRatio = null;
    }

    Rational takePendingBrokenFactor() {
        Rational factor = pendingBrokenFactor;
        pendingBrokenFactor = null;
        return factor;
    }

    void setPendingBrokenFactor(Rational factor) {
        this.pendingBrokenFactor = factor;
    }

    public boolean hasPendingBrokenRhythm() {
        return pendingBrokenFactor != null;
    }

    /** Bar lines end any tuplet and discard a dangling broken rhythm. */
    public void resetAtBarLine() {
        clearTuplet();
        pendingBrokenFactor = null;
    }
}
