package com.abcfmt.format.align;

import static com.abcfmt.format.align.AlignFixtures.system;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.abcfmt.loader.ast.ElementNode;
import com.abcfmt.music.Rational;
import org.junit.jupiter.api.Test;

class PaddingInserterTest {

    private static final TuneTiming TIMING = TuneTiming.of(Rational.of(1, 8));

    @Test
    void padsTheEarlierVoiceUpToTheLaterColumn() throws Exception {
        AlignFixtures.Fixture fixture = system("C2 E |", "C/D/E/F/ E |");
        PaddingInserter padding = new PaddingInserter(ElementNode::getText, fixture.ids());

        int inserted = padding.alignPoints(fixture.voices(), index(fixture));

        assertEquals(1, inserted);
        assertEquals("C2       E |\nC/D/E/F/ E |", fixture.render());
    }

    @Test
    void secondPassInsertsNothing() throws Exception {
        AlignFixtures.Fixture fixture = system("C2 E G |", "C/D/E/F/ E G2 |", "z4 |");
        PaddingInserter padding = new PaddingInserter(ElementNode::getText, fixture.ids());
        padding.alignPoints(fixture.voices(), index(fixture));
        padding.equalizeBars(fixture.voices());
        String once = fixture.render();

        int inserted = padding.alignPoints(fixture.voices(), index(fixture));
        inserted += padding.equalizeBars(fixture.voices());

        assertEquals(0, inserted);
        assertEquals(once, fixture.render());
    }

    @Test
    void barLinesLineUpBarByBar() throws Exception {
        AlignFixtures.Fixture fixture = system("C | D |", "CDEF | G |");
        PaddingInserter padding = new PaddingInserter(ElementNode::getText, fixture.ids());

        assertEquals(1, padding.equalizeBars(fixture.voices()));
        assertEquals("C    | D |\nCDEF | G |", fixture.render());
    }

    @Test
    void unmatchedBarsAndPassThroughLinesAreLeftAlone() throws Exception {
        AlignFixtures.Fixture fixture = system("C | D2 |", "% between", "CDEF |");
        PaddingInserter padding = new PaddingInserter(ElementNode::getText, fixture.ids());

        padding.equalizeBars(fixture.voices());

        assertEquals("C    | D2 |\n% between\nCDEF |", fixture.render());
    }

    @Test
    void missingNodeIsReported() throws Exception {
        AlignFixtures.Fixture fixture = system("C |", "D |");
        AlignmentIndex index = new AlignmentIndex();
        index.pushTime(0, Rational.ZERO, new NodeLocation(0, -1));
        index.pushTime(0, Rational.ZERO, new NodeLocation(1, -2));
        PaddingInserter padding = new PaddingInserter(ElementNode::getText, fixture.ids());

        assertThrows(AlignmentException.class, () -> padding.alignPoints(fixture.voices(), index));
    }

    private static AlignmentIndex index(AlignFixtures.Fixture fixture) {
        return new SystemAligner(ElementNode::getText, fixture.ids(), AlignmentStrategy.POINTS)
                .buildIndex(fixture.voices(), TIMING);
    }
}
