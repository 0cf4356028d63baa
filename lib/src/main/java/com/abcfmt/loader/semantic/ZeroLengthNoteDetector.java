package com.abcfmt.loader.semantic;

import com.abcfmt.loader.ast.BeamNode;
import com.abcfmt.loader.ast.ChordNode;
import com.abcfmt.loader.ast.ElementNode;
import com.abcfmt.loader.ast.LineNode;
import com.abcfmt.loader.ast.MusicLineNode;
import com.abcfmt.loader.ast.NoteNode;
import com.abcfmt.loader.ast.RestNode;
import com.abcfmt.loader.ast.TuneNode;
import java.util.List;

/** Finds notes, chords or rests written with a zero numerator, such as {@code C0}. */
public final class ZeroLengthNoteDetector {

    public boolean containsZeroLengthNotes(TuneNode tune) {
        for (LineNode line : tune.getBody()) {
            if (line instanceof MusicLineNode music && containsZeroLength(music.getElements())) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsZeroLength(List<ElementNode> elements) {
        for (ElementNode element : elements) {
            if (element instanceof BeamNode beam) {
                if (containsZeroLength(beam.getContents())) {
                    return true;
                }
            } else if (element instanceof NoteNode note && note.getRhythm().isZeroLength()) {
                return true;
            } else if (element instanceof RestNode rest && rest.getRhythm().isZeroLength()) {
                return true;
            } else if (element instanceof ChordNode chord && chord.getRhythm().isZeroLength()) {
                return true;
            }
        }
        return false;
    }
}
