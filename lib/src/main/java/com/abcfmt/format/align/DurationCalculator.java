package com.abcfmt.format.align;

import com.abcfmt.loader.ast.BeamNode;
import com.abcfmt.loader.ast.ChordNode;
import com.abcfmt.loader.ast.ElementNode;
import com.abcfmt.loader.ast.MultiMeasureRestNode;
import com.abcfmt.loader.ast.NoteNode;
import com.abcfmt.loader.ast.RestNode;
import com.abcfmt.loader.ast.Rhythm;
import com.abcfmt.loader.ast.TupletNode;
import com.abcfmt.music.Rational;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Turns one time-bearing element into a length in whole notes, updating the voice's {@link
 * DurationContext} for tuplets and broken rhythms as it goes.
 */
public final class DurationCalculator {
    private static final Logger LOGGER = Logger.getLogger(DurationCalculator.class.getName());

    private final DurationSnapshot snapshot;
    private final boolean zeroLengthShortcuts;

    public DurationCalculator() {
        this(DurationSnapshot.EMPTY, false);
    }

    /**
     * @param snapshot multipliers for zero-length shortcuts, keyed by element id
     * @param zeroLengthShortcuts whether the tune uses zero-length shortcuts at all; the snapshot
     *     is only consulted when it does
     */
    public DurationCalculator(DurationSnapshot snapshot, boolean zeroLengthShortcuts) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
        this.zeroLengthShortcuts = zeroLengthShortcuts;
    }

    /**
     * Length of {@code node}. Multi-measure rests are {@link Rational#INFINITE}; a beam is the sum
     * of its members, each of which counts against an active tuplet on its own.
     *
     * @throws IllegalArgumentException if the node does not bear time
     */
    public Rational duration(ElementNode node, DurationContext context) {
        if (node instanceof MultiMeasureRestNode) {
            return Rational.INFINITE;
        }
        if (node instanceof BeamNode beam) {
            Rational total = Rational.ZERO;
            for (ElementNode member : beam.getContents()) {
                if (member instanceof TupletNode tuplet) {
                    beginTuplet(tuplet, context);
                } else if (member.isTimeBearing()) {
                    total = total.add(duration(member, context));
                }
            }
            return total;
        }
        if (node instanceof NoteNode note) {
            return event(note.getId(), note.getRhythm(), Rational.ONE, context);
        }
        if (node instanceof RestNode rest) {
            return event(rest.getId(), rest.getRhythm(), Rational.ONE, context);
        }
        if (node instanceof ChordNode chord) {
            Rational inner =
                    chord.getNotes().isEmpty()
                            ? Rational.ONE
                            : multiplier(chord.getNotes().get(0).getRhythm());
            return event(chord.getId(), chord.getRhythm(), inner, context);
        }
        throw new IllegalArgumentException("Element does not bear time: " + node);
    }

    /**
     * Activates the tuplet described by {@code (p:q:r}. When q is omitted it follows p: 2, 4 and
     * 8 take 3; 3 and 6 take 2; 5, 7 and 9 take 3 in compound meters and 2 otherwise. r defaults
     * to p.
     */
    public void beginTuplet(TupletNode tuplet, DurationContext context) {
        int p = tuplet.getP();
        if (p <= 0) {
            LOGGER.fine(() -> "Ignoring tuplet with non-positive size: " + tuplet.getText());
            return;
        }
        int q = tuplet.getQ() != null && tuplet.getQ() > 0 ? tuplet.getQ() : defaultQ(p, context);
        int r = tuplet.getR() != null && tuplet.getR() > 0 ? tuplet.getR() : p;
        context.startTuplet(p, r, Rational.of(q, p));
    }

    static int defaultQ(int p, DurationContext context) {
        switch (p) {
            case 2:
            case 4:
            case 8:
                return 3;
            case 3:
            case 6:
                return 2;
            case 5:
            case 7:
            case 9:
                return context.isCompoundMeter() ? 3 : 2;
            default:
                return 2;
        }
    }

    private Rational event(int nodeId, Rhythm rhythm, Rational inner, DurationContext context) {
        Rational multiplier;
        if (rhythm.isZeroLength()) {
            multiplier = zeroLengthMultiplier(nodeId);
        } else {
            multiplier = multiplier(rhythm).multiply(inner);
        }
        Rational length = context.getDefaultLength().multiply(multiplier);
        length = context.applyTuplet(length);
        Rational pending = context.takePendingBrokenFactor();
        if (pending != null) {
            length = length.multiply(pending);
        }
        int level = rhythm.getBrokenLevel();
        if (level != 0) {
            long scale = 1L << Math.min(Math.abs(level), 30);
            Rational longer = Rational.of(2 * scale - 1, scale);
            Rational shorter = Rational.of(1, scale);
            length = length.multiply(level > 0 ? longer : shorter);
            context.setPendingBrokenFactor(level > 0 ? shorter : longer);
        }
        return length;
    }

    private Rational zeroLengthMultiplier(int nodeId) {
        if (zeroLengthShortcuts) {
            Rational recorded = snapshot.get(nodeId);
            if (recorded != null) {
                return recorded;
            }
        }
        return Rational.ONE;
    }

    /** Literal multiplier of a rhythm; unusable shapes fall back to the numerator alone, then 1. */
    public static Rational multiplier(Rhythm rhythm) {
        long numerator;
        try {
            numerator = rhythm.getNumeratorValue();
        } catch (NumberFormatException ex) {
            return Rational.ONE;
        }
        if (numerator <= 0) {
            return Rational.ONE;
        }
        try {
            long denominator = rhythm.getDenominatorValue();
            if (denominator <= 0) {
                return Rational.of(numerator);
            }
            return Rational.of(numerator, denominator);
        } catch (NumberFormatException ex) {
            return Rational.of(numerator);
        }
    }
}
