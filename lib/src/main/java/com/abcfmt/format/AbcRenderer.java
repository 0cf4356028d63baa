package com.abcfmt.format;

import com.abcfmt.format.align.ElementRenderer;
import com.abcfmt.loader.ast.BeamNode;
import com.abcfmt.loader.ast.ChordNode;
import com.abcfmt.loader.ast.ElementNode;
import com.abcfmt.loader.ast.GraceGroupNode;
import com.abcfmt.loader.ast.NoteNode;
import com.abcfmt.loader.ast.RestNode;
import com.abcfmt.loader.ast.Rhythm;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Prints elements back to ABC. With both options off the output is the source text; otherwise
 * rhythms get their shortest spelling and chord notes are ordered from low to high.
 */
public final class AbcRenderer implements ElementRenderer {

    public static final AbcRenderer VERBATIM = new AbcRenderer(false, false);

    private final boolean normalizeRhythms;
    private final boolean sortChordNotes;

    public AbcRenderer(boolean normalizeRhythms, boolean sortChordNotes) {
        this.normalizeRhythms = normalizeRhythms;
        this.sortChordNotes = sortChordNotes;
    }

    public static AbcRenderer forOptions(FormatterOptions options) {
        return new AbcRenderer(options.isNormalizeRhythms(), options.isSortChordNotes());
    }

    @Override
    public String render(ElementNode node) {
        if (node instanceof NoteNode note) {
            return renderNote(note);
        }
        if (node instanceof RestNode rest) {
            return rest.getSymbol() + rhythm(rest.getRhythm());
        }
        if (node instanceof ChordNode chord) {
            return renderChord(chord);
        }
        if (node instanceof GraceGroupNode grace) {
            StringBuilder builder = new StringBuilder(grace.isAcciaccatura() ? "{/" : "{");
            for (NoteNode note : grace.getNotes()) {
                builder.append(renderNote(note));
            }
            return builder.append('}').toString();
        }
        if (node instanceof BeamNode beam) {
            StringBuilder builder = new StringBuilder();
            for (ElementNode member : beam.getContents()) {
                builder.append(render(member));
            }
            return builder.toString();
        }
        return node.getText();
    }

    private String renderNote(NoteNode note) {
        return note.getPitch().toAbc() + rhythm(note.getRhythm()) + (note.isTied() ? "-" : "");
    }

    private String renderChord(ChordNode chord) {
        List<NoteNode> notes = chord.getNotes();
        if (sortChordNotes && sameRhythm(notes)) {
            notes = new ArrayList<>(notes);
            notes.sort(Comparator.comparingInt(note -> note.getPitch().getMidiPitch()));
        }
        StringBuilder builder = new StringBuilder("[");
        for (NoteNode note : notes) {
            builder.append(renderNote(note));
        }
        return builder.append(']')
                .append(rhythm(chord.getRhythm()))
                .append(chord.isTied() ? "-" : "")
                .toString();
    }

    // A chord's length depends on its first note, so reordering is only safe when all agree.
    private static boolean sameRhythm(List<NoteNode> notes) {
        for (NoteNode note : notes) {
            if (!note.getRhythm().equals(notes.get(0).getRhythm())) {
                return false;
            }
        }
        return true;
    }

    private String rhythm(Rhythm rhythm) {
        return normalizeRhythms ? rhythm.toNormalizedAbc() : rhythm.toAbc();
    }
}
