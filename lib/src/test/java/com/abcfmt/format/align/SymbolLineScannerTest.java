package com.abcfmt.format.align;

import static com.abcfmt.format.align.AlignFixtures.system;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.abcfmt.music.Rational;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SymbolLineScannerTest {

    private static final Rational EIGHTH = Rational.of(1, 8);

    @Test
    void lyricsSkipRests() throws Exception {
        AlignmentIndex index = scan("C D z E |", "w: la la la |");

        assertEquals(List.of(Rational.ZERO, EIGHTH, Rational.of(3, 8)), times(index, 0));
    }

    @Test
    void symbolLinesAnchorToEveryTimeBearingElement() throws Exception {
        AlignmentIndex index = scan("C D z E |", "s: * * !p! |");

        assertEquals(List.of(Rational.ZERO, EIGHTH, Rational.of(1, 4)), times(index, 0));
    }

    @Test
    void oneTokenCoversAWholeBeam() throws Exception {
        AlignmentIndex index = scan("CD EF |", "w: la di |");

        assertEquals(List.of(Rational.ZERO, Rational.of(1, 4)), times(index, 0));
    }

    @Test
    void tokenAfterABeamTakesTheNextNote() throws Exception {
        AlignmentIndex index = scan("CDE F G |", "w: a b c |");

        assertEquals(List.of(Rational.ZERO, Rational.of(3, 8), Rational.of(1, 2)), times(index, 0));
    }

    @Test
    void hyphenTokensDoNotTakeANote() throws Exception {
        AlignmentIndex index = scan("C D |", "w: a - b |");

        assertEquals(List.of(Rational.ZERO, EIGHTH), times(index, 0));
    }

    @Test
    void barLinesRestartAnchoringInTheNextBar() throws Exception {
        AlignmentIndex index = scan("C D | E F |", "w: a | b c |");

        assertEquals(List.of(Rational.ZERO), times(index, 0));
        assertEquals(List.of(Rational.ZERO, EIGHTH), times(index, 1));
        assertEquals(2, index.pointsInBar(1).get(0).getLocations().size());
    }

    @Test
    void surplusTokensAreLeftUnanchored() throws Exception {
        AlignmentIndex index = scan("C |", "w: a b c |");

        assertEquals(List.of(Rational.ZERO), times(index, 0));
        index.validate();
    }

    private static AlignmentIndex scan(String music, String symbols) throws Exception {
        List<VoiceLine> voices = system(music, symbols).voices();
        AlignmentIndex index = new AlignmentIndex();
        new VoiceScanner(new DurationCalculator())
                .scan(voices.get(0), 0, new DurationContext(EIGHTH, false), index);
        boolean lyrics = symbols.startsWith("w:");
        new SymbolLineScanner().scan(voices.get(1), 1, voices.get(0), 0, lyrics, index);
        return index;
    }

    /** Times at which the symbol line has a token in {@code bar}. */
    private static List<Rational> times(AlignmentIndex index, int bar) {
        List<Rational> times = new ArrayList<>();
        for (AlignmentPoint point : index.pointsForVoice(bar, 1)) {
            times.add(point.getTime());
        }
        return times;
    }
}
