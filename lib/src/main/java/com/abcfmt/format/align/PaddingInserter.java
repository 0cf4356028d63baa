package com.abcfmt.format.align;

import com.abcfmt.loader.ast.NodeIds;
import com.abcfmt.loader.ast.WhitespaceNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Splices whitespace into voice lines so that aligned elements start in the same column. Columns
 * are measured on the rendered text from the start of the line; since bar lines are aligned too,
 * equal columns also mean equal offsets from the start of each bar.
 */
public final class PaddingInserter {
    private static final Logger LOGGER = Logger.getLogger(PaddingInserter.class.getName());

    private final ElementRenderer renderer;
    private final NodeIds ids;

    public PaddingInserter(ElementRenderer renderer, NodeIds ids) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    /**
     * Walks the points in index order and pads every location that starts left of the point's
     * rightmost location. Only the first location of each voice in a point takes part.
     *
     * @return number of padding nodes inserted
     * @throws AlignmentException if a recorded location no longer resolves
     */
    public int alignPoints(List<VoiceLine> voices, AlignmentIndex index) {
        int inserted = 0;
        for (AlignmentPoint point : index.getPoints()) {
            List<NodeLocation> locations = firstPerVoice(point.getLocations());
            if (locations.size() < 2) {
                continue;
            }
            List<Integer> nodeIds = new ArrayList<>();
            List<VoiceLine> lines = new ArrayList<>();
            for (NodeLocation location : locations) {
                lines.add(voice(voices, location.voiceIndex()));
                nodeIds.add(location.nodeId());
            }
            int padded = equalize(lines, nodeIds);
            if (padded > 0) {
                LOGGER.finer(() -> "Padded " + padded + " voice(s) at " + point);
            }
            inserted += padded;
        }
        return inserted;
    }

    /**
     * Pads before bar lines so that the k-th bar line of every formatted voice and symbol line
     * starts in the same column, bar by bar from left to right.
     *
     * @return number of padding nodes inserted
     */
    public int equalizeBars(List<VoiceLine> voices) {
        List<Integer> participants = new ArrayList<>();
        List<List<Integer>> barLines = new ArrayList<>();
        int maxBars = 0;
        for (int v = 0; v < voices.size(); v++) {
            if (voices.get(v).getKind() == VoiceLine.Kind.PASSTHROUGH) {
                continue;
            }
            List<Integer> ids = voices.get(v).barLineIds();
            participants.add(v);
            barLines.add(ids);
            maxBars = Math.max(maxBars, ids.size());
        }
        int inserted = 0;
        for (int bar = 0; bar < maxBars; bar++) {
            List<VoiceLine> lines = new ArrayList<>();
            List<Integer> nodeIds = new ArrayList<>();
            for (int p = 0; p < participants.size(); p++) {
                if (barLines.get(p).size() > bar) {
                    lines.add(voices.get(participants.get(p)));
                    nodeIds.add(barLines.get(p).get(bar));
                }
            }
            if (lines.size() >= 2) {
                inserted += equalize(lines, nodeIds);
            }
        }
        return inserted;
    }

    private int equalize(List<VoiceLine> lines, List<Integer> nodeIds) {
        int[] positions = new int[lines.size()];
        int[] columns = new int[lines.size()];
        int max = 0;
        for (int i = 0; i < lines.size(); i++) {
            positions[i] = resolve(lines.get(i), nodeIds.get(i));
            columns[i] = lines.get(i).columnOf(positions[i], renderer);
            max = Math.max(max, columns[i]);
        }
        int inserted = 0;
        for (int i = 0; i < lines.size(); i++) {
            if (columns[i] < max) {
                lines.get(i).insert(positions[i], WhitespaceNode.spaces(ids, max - columns[i]));
                inserted++;
            }
        }
        return inserted;
    }

    private static List<NodeLocation> firstPerVoice(List<NodeLocation> locations) {
        Set<Integer> seen = new HashSet<>();
        List<NodeLocation> result = new ArrayList<>();
        for (NodeLocation location : locations) {
            if (seen.add(location.voiceIndex())) {
                result.add(location);
            }
        }
        return result;
    }

    private static VoiceLine voice(List<VoiceLine> voices, int voiceIndex) {
        if (voiceIndex < 0 || voiceIndex >= voices.size()) {
            throw new AlignmentException("No voice " + voiceIndex + " in system");
        }
        return voices.get(voiceIndex);
    }

    private static int resolve(VoiceLine line, int nodeId) {
        int position = line.indexOf(nodeId);
        if (position < 0) {
            throw new AlignmentException("Node #" + nodeId + " not found in " + line);
        }
        return position;
    }
}
