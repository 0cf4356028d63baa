package com.abcfmt.loader.semantic;

import com.abcfmt.format.align.DurationCalculator;
import com.abcfmt.format.align.DurationSnapshot;
import com.abcfmt.loader.ast.BeamNode;
import com.abcfmt.loader.ast.ChordNode;
import com.abcfmt.loader.ast.ElementNode;
import com.abcfmt.loader.ast.InfoLineNode;
import com.abcfmt.loader.ast.LineNode;
import com.abcfmt.loader.ast.MusicLineNode;
import com.abcfmt.loader.ast.NoteNode;
import com.abcfmt.loader.ast.RestNode;
import com.abcfmt.loader.ast.Rhythm;
import com.abcfmt.loader.ast.TuneNode;
import com.abcfmt.music.Rational;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays a tune body voice by voice and records, for every zero-length element, the multiplier
 * it stands for: that of the previous element with a real length in the same voice, or 1 when
 * the voice has none yet.
 */
public final class DurationSnapshotInterpreter {

    public DurationSnapshot interpret(TuneNode tune, String initialVoice) {
        DurationSnapshot.Builder snapshot = DurationSnapshot.builder();
        Map<String, Rational> lastMultiplier = new HashMap<>();
        String voice = initialVoice;
        for (LineNode line : tune.getBody()) {
            if (line instanceof InfoLineNode info && info.isKey('V')) {
                voice = info.getFirstWord();
            } else if (line instanceof MusicLineNode music) {
                String inline = music.getInlineVoiceId();
                if (inline != null) {
                    voice = inline;
                }
                walk(music.getElements(), voice, lastMultiplier, snapshot);
            }
        }
        return snapshot.build();
    }

    private static void walk(
            List<ElementNode> elements,
            String voice,
            Map<String, Rational> lastMultiplier,
            DurationSnapshot.Builder snapshot) {
        for (ElementNode element : elements) {
            if (element instanceof BeamNode beam) {
                walk(beam.getContents(), voice, lastMultiplier, snapshot);
                continue;
            }
            Rhythm rhythm = rhythmOf(element);
            if (rhythm == null) {
                continue;
            }
            if (rhythm.isZeroLength()) {
                snapshot.put(element.getId(), lastMultiplier.getOrDefault(voice, Rational.ONE));
            } else {
                lastMultiplier.put(voice, DurationCalculator.multiplier(rhythm));
            }
        }
    }

    private static Rhythm rhythmOf(ElementNode element) {
        if (element instanceof NoteNode note) {
            return note.getRhythm();
        }
        if (element instanceof RestNode rest) {
            return rest.getRhythm();
        }
        if (element instanceof ChordNode chord) {
            return chord.getRhythm();
        }
        return null;
    }
}
