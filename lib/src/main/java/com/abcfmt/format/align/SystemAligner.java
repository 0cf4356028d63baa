package com.abcfmt.format.align;

import com.abcfmt.loader.ast.NodeIds;
import com.abcfmt.loader.ast.SymbolHeaderNode;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Aligns the lines of one multi-voice system in place. Formatted voices are scanned first,
 * symbol lines are then anchored to the nearest formatted voice above them, and finally padding
 * is inserted according to the configured strategy.
 */
public final class SystemAligner {
    private static final Logger LOGGER = Logger.getLogger(SystemAligner.class.getName());

    private final ElementRenderer renderer;
    private final NodeIds ids;
    private final AlignmentStrategy strategy;

    public SystemAligner(ElementRenderer renderer, NodeIds ids, AlignmentStrategy strategy) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    /**
     * Inserts whitespace into {@code voices} so that simultaneous elements and bar lines line up.
     *
     * @throws AlignmentException on inconsistent index bookkeeping
     */
    public void align(List<VoiceLine> voices, TuneTiming timing) {
        PaddingInserter padding = new PaddingInserter(renderer, ids);
        int inserted = 0;
        if (strategy == AlignmentStrategy.POINTS) {
            AlignmentIndex index = buildIndex(voices, timing);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Alignment index:\n" + index.describe());
            }
            inserted += padding.alignPoints(voices, index);
        }
        inserted += padding.equalizeBars(voices);
        int total = inserted;
        LOGGER.fine(() -> "Inserted " + total + " padding node(s) into " + voices.size() + " lines");
    }

    /** Scans all formatted voices, then all symbol lines, into a fresh index. */
    public AlignmentIndex buildIndex(List<VoiceLine> voices, TuneTiming timing) {
        AlignmentIndex index = new AlignmentIndex();
        DurationCalculator calculator =
                new DurationCalculator(timing.getSnapshot(), timing.hasZeroLengthShortcuts());
        VoiceScanner scanner = new VoiceScanner(calculator);
        for (int i = 0; i < voices.size(); i++) {
            VoiceLine voice = voices.get(i);
            if (voice.getKind() == VoiceLine.Kind.FORMATTED) {
                DurationContext context =
                        new DurationContext(timing.getDefaultLength(), timing.isCompoundMeter());
                scanner.scan(voice, i, context, index);
            }
        }
        SymbolLineScanner symbolScanner = new SymbolLineScanner();
        for (int i = 0; i < voices.size(); i++) {
            VoiceLine line = voices.get(i);
            if (line.getKind() != VoiceLine.Kind.SYMBOL) {
                continue;
            }
            int parent = parentOf(voices, i);
            if (parent < 0) {
                LOGGER.fine(() -> "Symbol line without a voice above it: " + line);
                continue;
            }
            symbolScanner.scan(line, i, voices.get(parent), parent, isLyrics(line), index);
        }
        index.validate();
        return index;
    }

    private static int parentOf(List<VoiceLine> voices, int symbolIndex) {
        for (int j = symbolIndex - 1; j >= 0; j--) {
            if (voices.get(j).getKind() == VoiceLine.Kind.FORMATTED) {
                return j;
            }
        }
        return -1;
    }

    private static boolean isLyrics(VoiceLine line) {
        return line.size() > 0 && line.get(0) instanceof SymbolHeaderNode header && header.isLyrics();
    }
}
