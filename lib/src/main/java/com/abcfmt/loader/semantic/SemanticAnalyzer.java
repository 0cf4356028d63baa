package com.abcfmt.loader.semantic;

import com.abcfmt.format.align.DurationSnapshot;
import com.abcfmt.loader.LoaderMessage;
import com.abcfmt.loader.ast.AbcFileNode;
import com.abcfmt.loader.ast.InfoLineNode;
import com.abcfmt.loader.ast.LineNode;
import com.abcfmt.loader.ast.MusicLineNode;
import com.abcfmt.loader.ast.TuneNode;
import com.abcfmt.music.Meter;
import com.abcfmt.music.Rational;
import com.abcfmt.music.UnitLength;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Interprets tune headers and voice structure. Unusable {@code M:} or {@code L:} values produce
 * warnings and fall back to the defaults rather than failing the load.
 */
public final class SemanticAnalyzer {

    private final ZeroLengthNoteDetector zeroLengthDetector = new ZeroLengthNoteDetector();
    private final DurationSnapshotInterpreter snapshotInterpreter = new DurationSnapshotInterpreter();

    public SemanticAnalysis analyze(AbcFileNode file) {
        Objects.requireNonNull(file, "file");
        List<LoaderMessage> messages = new ArrayList<>();
        List<TuneAnalysis> tunes = new ArrayList<>();
        for (TuneNode tune : file.getTunes()) {
            tunes.add(analyzeTune(file.getSourceName(), tune, messages));
        }
        return new SemanticAnalysis(tunes, messages);
    }

    private TuneAnalysis analyzeTune(String sourceName, TuneNode tune, List<LoaderMessage> messages) {
        Meter meter = Meter.COMMON_TIME;
        Rational unitLength = null;
        for (LineNode line : tune.getHeader()) {
            if (!(line instanceof InfoLineNode info)) {
                continue;
            }
            if (info.isKey('M')) {
                try {
                    meter = Meter.parse(info.getValue());
                } catch (IllegalArgumentException ex) {
                    messages.add(warning(ex.getMessage() + "; using 4/4", sourceName, line));
                }
            } else if (info.isKey('L')) {
                try {
                    unitLength = UnitLength.parse(info.getValue());
                } catch (IllegalArgumentException ex) {
                    messages.add(warning(ex.getMessage() + "; deriving from meter", sourceName, line));
                }
            }
        }
        if (unitLength == null) {
            unitLength = meter == null ? UnitLength.DEFAULT : meter.impliedUnitLength();
        }
        List<String> voiceIds = discoverVoices(tune);
        boolean zeroLength = zeroLengthDetector.containsZeroLengthNotes(tune);
        String initialVoice = voiceIds.isEmpty() ? "" : voiceIds.get(0);
        DurationSnapshot snapshot =
                zeroLength
                        ? snapshotInterpreter.interpret(tune, initialVoice)
                        : DurationSnapshot.EMPTY;
        return new TuneAnalysis(tune, meter, unitLength, voiceIds, zeroLength, snapshot);
    }

    /** Header {@code V:} declarations first, then body voice switches, without duplicates. */
    static List<String> discoverVoices(TuneNode tune) {
        Set<String> ids = new LinkedHashSet<>();
        for (LineNode line : tune.getHeader()) {
            if (line instanceof InfoLineNode info && info.isKey('V') && !info.getFirstWord().isEmpty()) {
                ids.add(info.getFirstWord());
            }
        }
        for (LineNode line : tune.getBody()) {
            if (line instanceof InfoLineNode info && info.isKey('V') && !info.getFirstWord().isEmpty()) {
                ids.add(info.getFirstWord());
            } else if (line instanceof MusicLineNode music && music.getInlineVoiceId() != null) {
                ids.add(music.getInlineVoiceId());
            }
        }
        return new ArrayList<>(ids);
    }

    private static LoaderMessage warning(String message, String sourceName, LineNode line) {
        return LoaderMessage.warning(message, sourceName, line.getLocation().getLine());
    }
}
