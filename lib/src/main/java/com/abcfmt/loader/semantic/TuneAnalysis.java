package com.abcfmt.loader.semantic;

import com.abcfmt.format.align.DurationSnapshot;
import com.abcfmt.format.align.TuneTiming;
import com.abcfmt.loader.ast.TuneNode;
import com.abcfmt.music.Meter;
import com.abcfmt.music.Rational;
import java.util.List;
import java.util.Objects;

/** What the formatter needs to know about one tune beyond its syntax. */
public final class TuneAnalysis {

    private final TuneNode tune;
    private final Meter meter;
    private final Rational defaultLength;
    private final List<String> voiceIds;
    private final boolean zeroLengthNotes;
    private final DurationSnapshot snapshot;

    public TuneAnalysis(
            TuneNode tune,
            Meter meter,
            Rational defaultLength,
            List<String> voiceIds,
            boolean zeroLengthNotes,
            DurationSnapshot snapshot) {
        this.tune = Objects.requireNonNull(tune, "tune");
        this.meter = meter;
        this.defaultLength = Objects.requireNonNull(defaultLength, "defaultLength");
        this.voiceIds = List.copyOf(voiceIds);
        this.zeroLengthNotes = zeroLengthNotes;
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
    }

    public TuneNode getTune() {
        return tune;
    }

    /** Meter of the tune header, or null for free meter. */
    public Meter getMeter() {
        return meter;
    }

    public Rational getDefaultLength() {
        return defaultLength;
    }

    /** Voice ids in order of first declaration or use. Empty when the tune never names a voice. */
    public List<String> getVoiceIds() {
        return voiceIds;
    }

    public boolean isMultiVoice() {
        return voiceIds.size() > 1;
    }

    /** Voice of body lines that precede any voice switch. */
    public String getInitialVoiceId() {
        return voiceIds.isEmpty() ? "" : voiceIds.get(0);
    }

    public boolean hasZeroLengthNotes() {
        return zeroLengthNotes;
    }

    public DurationSnapshot getSnapshot() {
        return snapshot;
    }

    public TuneTiming getTiming() {
        return new TuneTiming(
                defaultLength, meter != null && meter.isCompound(), snapshot, zeroLengthNotes);
    }
}
