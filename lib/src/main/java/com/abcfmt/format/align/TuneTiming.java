package com.abcfmt.format.align;

import com.abcfmt.music.Rational;
import java.util.Objects;

/** Tune-level inputs to duration computation. */
public final class TuneTiming {

    private final Rational defaultLength;
    private final boolean compoundMeter;
    private final DurationSnapshot snapshot;
    private final boolean zeroLengthShortcuts;

    public TuneTiming(
            Rational defaultLength,
            boolean compoundMeter,
            DurationSnapshot snapshot,
            boolean zeroLengthShortcuts) {
        this.defaultLength = Objects.requireNonNull(defaultLength, "defaultLength");
        this.compoundMeter = compoundMeter;
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
        this.zeroLengthShortcuts = zeroLengthShortcuts;
    }

    public static TuneTiming of(Rational defaultLength) {
        return new TuneTiming(defaultLength, false, DurationSnapshot.EMPTY, false);
    }

    public Rational getDefaultLength() {
        return defaultLength;
    }

    public boolean isCompoundMeter() {
        return compoundMeter;
    }

    public DurationSnapshot getSnapshot() {
        return snapshot;
    }

    public boolean hasZeroLengthShortcuts() {
        return zeroLengthShortcuts;
    }
}
