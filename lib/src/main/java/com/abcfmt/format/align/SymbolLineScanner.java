package com.abcfmt.format.align;

import com.abcfmt.loader.ast.BeamNode;
import com.abcfmt.loader.ast.ChordNode;
import com.abcfmt.loader.ast.ElementNode;
import com.abcfmt.loader.ast.NoteNode;
import com.abcfmt.loader.ast.SymbolTokenNode;
import java.util.List;

/**
 * Anchors the tokens of a lyric ({@code w:}) or symbol ({@code s:}) line to the time points of
 * its parent voice. Each syllable or {@code *} takes the parent's next unclaimed point in the
 * current bar. A beam is a single parent point, so one token covers the whole beamed group and
 * the following token lands after it. Lyrics only attach to notes, chords and beams holding
 * either; symbol lines attach to every time-bearing element.
 */
public final class SymbolLineScanner {

    public void scan(
            VoiceLine symbolLine,
            int symbolIndex,
            VoiceLine parent,
            int parentIndex,
            boolean lyrics,
            AlignmentIndex index) {
        int bar = 0;
        List<AlignmentPoint> targets = targets(index, parent, parentIndex, bar, lyrics);
        int cursor = 0;
        for (ElementNode node : symbolLine.getElements()) {
            if (!(node instanceof SymbolTokenNode token)) {
                continue;
            }
            NodeLocation location = new NodeLocation(symbolIndex, token.getId());
            if (token.isBarLine()) {
                bar++;
                index.pushBarStart(bar, location);
                targets = targets(index, parent, parentIndex, bar, lyrics);
                cursor = 0;
                continue;
            }
            if (token.getText().equals("-")) {
                continue;
            }
            if (cursor >= targets.size()) {
                continue;
            }
            index.pushTime(bar, targets.get(cursor++).getTime(), location);
        }
    }

    private static List<AlignmentPoint> targets(
            AlignmentIndex index, VoiceLine parent, int parentIndex, int bar, boolean lyrics) {
        List<AlignmentPoint> points = index.pointsForVoice(bar, parentIndex);
        if (lyrics) {
            points.removeIf(point -> !isLyricAnchor(parentNode(point, parent, parentIndex)));
        }
        return points;
    }

    private static ElementNode parentNode(AlignmentPoint point, VoiceLine parent, int parentIndex) {
        for (NodeLocation location : point.getLocations()) {
            if (location.voiceIndex() == parentIndex) {
                int position = parent.indexOf(location.nodeId());
                if (position < 0) {
                    throw new AlignmentException("Parent voice lost node " + location);
                }
                return parent.get(position);
            }
        }
        throw new AlignmentException("Point " + point + " has no location in voice " + parentIndex);
    }

    private static boolean isLyricAnchor(ElementNode node) {
        if (node instanceof BeamNode beam) {
            return beam.getContents().stream().anyMatch(SymbolLineScanner::isLyricAnchor);
        }
        return node instanceof NoteNode || node instanceof ChordNode;
    }
}
