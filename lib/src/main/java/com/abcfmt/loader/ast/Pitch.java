package com.abcfmt.loader.ast;

import java.util.Objects;

/** Accidental, letter and octave marks of a note, kept as written. */
public final class Pitch {

    private static final String LETTERS = "CDEFGAB";
    private static final int[] SEMITONES = {0, 2, 4, 5, 7, 9, 11};

    private final String accidental;
    private final char letter;
    private final String octave;

    public Pitch(String accidental, char letter, String octave) {
        this.accidental = accidental == null ? "" : accidental;
        this.letter = letter;
        this.octave = octave == null ? "" : octave;
        if (LETTERS.indexOf(Character.toUpperCase(letter)) < 0) {
            throw new IllegalArgumentException("Not a note letter: " + letter);
        }
    }

    public String getAccidental() {
        return accidental;
    }

    public char getLetter() {
        return letter;
    }

    public String getOctave() {
        return octave;
    }

    /**
     * MIDI-style pitch number ignoring the key signature, used to order chord notes. Middle C
     * ({@code C}) is 60 and {@code c} is 72.
     */
    public int getMidiPitch() {
        int index = LETTERS.indexOf(Character.toUpperCase(letter));
        int value = 60 + SEMITONES[index];
        if (Character.isLowerCase(letter)) {
            value += 12;
        }
        for (char mark : octave.toCharArray()) {
            value += mark == '\'' ? 12 : -12;
        }
        switch (accidental) {
            case "^^":
                return value + 2;
            case "^":
                return value + 1;
            case "__":
                return value - 2;
            case "_":
                return value - 1;
            default:
                return value;
        }
    }

    public String toAbc() {
        return accidental + letter + octave;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Pitch)) {
            return false;
        }
        Pitch other = (Pitch) obj;
        return letter == other.letter
                && accidental.equals(other.accidental)
                && octave.equals(other.octave);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accidental, letter, octave);
    }

    @Override
    public String toString() {
        return toAbc();
    }
}
