package com.abcfmt.format.align;

import com.abcfmt.loader.ast.ElementNode;
import com.abcfmt.loader.ast.InlineFieldNode;
import com.abcfmt.loader.ast.TupletNode;
import com.abcfmt.music.Meter;
import com.abcfmt.music.Rational;
import com.abcfmt.music.UnitLength;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Single pass over one formatted voice that records where each bar starts and at which offset
 * inside its bar every time-bearing element begins.
 */
public final class VoiceScanner {
    private static final Logger LOGGER = Logger.getLogger(VoiceScanner.class.getName());

    private final DurationCalculator calculator;

    public VoiceScanner(DurationCalculator calculator) {
        this.calculator = Objects.requireNonNull(calculator, "calculator");
    }

    /**
     * Pushes the voice's bar lines and time-bearing elements into {@code index}. Bars are counted
     * from 0; every bar line opens the next bar, resets the offset and ends any tuplet or pending
     * broken rhythm. A multi-measure rest is recorded but does not advance the offset.
     *
     * @return the number of the last bar reached
     */
    public int scan(
            VoiceLine voice, int voiceIndex, DurationContext context, AlignmentIndex index) {
        int bar = 0;
        Rational time = Rational.ZERO;
        for (ElementNode node : voice.getElements()) {
            NodeLocation location = new NodeLocation(voiceIndex, node.getId());
            if (node.isBarLine()) {
                bar++;
                index.pushBarStart(bar, location);
                time = Rational.ZERO;
                context.resetAtBarLine();
            } else if (node instanceof TupletNode tuplet) {
                calculator.beginTuplet(tuplet, context);
            } else if (node instanceof InlineFieldNode field) {
                applyInlineField(field, context);
            } else if (node.isTimeBearing()) {
                index.pushTime(bar, time, location);
                Rational duration = calculator.duration(node, context);
                if (!duration.isInfinite()) {
                    time = time.add(duration);
                }
            }
        }
        return bar;
    }

    private static void applyInlineField(InlineFieldNode field, DurationContext context) {
        try {
            if (field.getFieldKey() == 'L') {
                context.setDefaultLength(UnitLength.parse(field.getValue()));
            } else if (field.getFieldKey() == 'M') {
                Meter meter = Meter.parse(field.getValue());
                context.setCompoundMeter(meter != null && meter.isCompound());
            }
        } catch (IllegalArgumentException ex) {
            LOGGER.fine(() -> "Ignoring unusable inline field " + field.getText());
        }
    }
}
