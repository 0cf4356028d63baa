package com.abcfmt.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.abcfmt.loader.AbcParseException;
import org.junit.jupiter.api.Test;

class AbcFormatterTest {

    private static final String DUET = "X:1\nV:1\nV:2\n";

    private final AbcFormatter formatter = new AbcFormatter();

    @Test
    void collapsesWhitespaceAndSpacesBarLines() throws Exception {
        assertEquals(
                DUET + "V:1\nCDEF GABC |\nV:2\nEFGA BCDE |\n",
                format(DUET + "V:1\nCDEF  GABC|\nV:2\nEFGA BCDE|"));
    }

    @Test
    void alignsDifferentRhythms() throws Exception {
        assertEquals(
                DUET + "V:1\nC2  D/E/ F |\nV:2\nC D E/F/   |\n",
                format(DUET + "V:1\nC2 D/2E/2 F|\nV:2\nC D E/2F/2|"));
    }

    @Test
    void alignsSourceRhythmsWhenNotNormalizing() throws Exception {
        AbcFormatter verbatim =
                new AbcFormatter(FormatterOptions.builder().normalizeRhythms(false).build());

        assertEquals(
                DUET + "V:1\nC2  D/2E/2 F |\nV:2\nC D E/2F/2   |\n",
                verbatim.format("test.abc", DUET + "V:1\nC2 D/2E/2 F|\nV:2\nC D E/2F/2|"));
    }

    @Test
    void alignsGraceNotesChordsAndDecorations() throws Exception {
        assertEquals(
                DUET + "V:1\n{ag}F2   |\nV:2\n    C2 F |\n",
                format(DUET + "V:1\n{ag}F2|\nV:2\nC2 F|"));
        assertEquals(
                DUET + "V:1\n[CEG]F |\nV:2\nC2 E   |\n",
                format(DUET + "V:1\n[CEG]F|\nV:2\nC2 E|"));
        assertEquals(
                DUET + "V:1\n!p! C \"swing\" D |\nV:2\n    C         D |\n",
                format(DUET + "V:1\n!p!C \"swing\"D|\nV:2\nC D|"));
    }

    @Test
    void alignsTheNoteAfterATriplet() throws Exception {
        assertEquals(
                DUET + "V:1\n(3CDE F |\nV:2\n  C2  F |\n",
                format(DUET + "V:1\n(3CDE F|\nV:2\nC2 F|"));
    }

    @Test
    void alignsBarsStartingWithAnnotations() throws Exception {
        assertEquals(
                DUET
                        + "V:1\n\"hello\" CDEF |         GABC | \"again\" DE\n"
                        + "V:2\n        CDEF | \"world\" GABC |         DE\n",
                format(
                        DUET
                                + "V:1\n\"hello\"CDEF|GABC|\"again\" DE\n"
                                + "V:2\nCDEF|\"world\"GABC|DE"));
    }

    @Test
    void expandsMultiMeasureRestsInMultiVoiceTunes() throws Exception {
        assertEquals(
                DUET + "V:1\nZ    | Z    | Z    | Z    |\nV:2\nCDEF | GABC | CDEF | GABC |\n",
                format(DUET + "V:1\nZ4|\nV:2\nCDEF|GABC|CDEF|GABC|"));
    }

    @Test
    void expandsInvisibleMultiMeasureRests() throws Exception {
        assertEquals(
                DUET + "V:1\nX    | X    | X    | X    |\nV:2\nCDEF | GABC | CDEF | GABC |\n",
                format(DUET + "V:1\nX4|\nV:2\nCDEF|GABC|CDEF|GABC|"));
    }

    @Test
    void survivesNoteLengthsWithHugeCoprimeDenominators() throws Exception {
        assertEquals(
                DUET + "V:1\nC/999983 C/999979 C D |\nV:2\nC/999961 C/999959 C D |\n",
                format(DUET + "V:1\nC/999983 C/999979 C D|\nV:2\nC/999961 C/999959 C D|"));
    }

    @Test
    void widensEmptyBars() throws Exception {
        assertEquals(
                DUET + "V:1\nCDEF | GABC | CDE\nV:2\nCDEF |      | GABC |\n",
                format(DUET + "V:1\nCDEF| GABC| CDE\nV:2\nCDEF| |GABC|"));
    }

    @Test
    void keepsCommentsBetweenVoices() throws Exception {
        assertEquals(
                DUET + "V:1\nCDEF |\n% A comment\nV:2\nCDEF |\n",
                format(DUET + "V:1\nCDEF|\n% A comment\nV:2\nCDEF|"));
    }

    @Test
    void alignsLyricsWithTheirVoice() throws Exception {
        assertEquals(
                DUET
                        + "V:1\n   C2  DE F     |\nw: la  di da do |\n"
                        + "V:2\n   C D E F2     |\n",
                format(DUET + "V:1\nC2 DE F|\nw:la di da do|\nV:2\nC D E F2|"));
    }

    @Test
    void formattingIsIdempotent() throws Exception {
        String once =
                format(
                        DUET
                                + "V:1\n\"hello\"CDEF|GABC|\"again\" DE\nw: a b c d|e|f\n"
                                + "V:2\n(3CDE F2 z|Z2|\nV:1\n{ag}F2|\nV:2\nC2 F|");

        assertEquals(once, format(once));
    }

    @Test
    void singleVoiceTunesAreOnlyRespaced() throws Exception {
        assertEquals(
                "X:1\nK:C\nCDEF GABC | Z4 |\nC2 D |\n",
                format("X:1\nK:C\nCDEF  GABC|Z4|\nC2  D|\n"));
    }

    @Test
    void alignmentCanBeSwitchedOff() throws Exception {
        AbcFormatter unaligned = new AbcFormatter(FormatterOptions.builder().align(false).build());

        assertEquals(
                DUET + "V:1\nC2 D/E/ F |\nV:2\nC D E/F/ |\n",
                unaligned.format("test.abc", DUET + "V:1\nC2 D/2E/2 F|\nV:2\nC D E/2F/2|"));
    }

    @Test
    void separatesSystemsWithCommentsWhenAsked() throws Exception {
        String input = "X:1\nV:1\nV:2\nK:C\nV:1\nCD|\nV:2\nEF|\nV:1\nGA|\nV:2\nBc|\n";
        String expected =
                "X:1\nV:1\nV:2\nK:C\nV:1\nCD |\nV:2\nEF |\n%\nV:1\nGA |\nV:2\nBc |\n";
        AbcFormatter commenting =
                new AbcFormatter(FormatterOptions.builder().systemComments(true).build());

        assertEquals(expected, commenting.format("test.abc", input));
        assertEquals(expected, commenting.format("test.abc", expected));
        assertEquals(input.replace("|", " |"), format(input));
    }

    @Test
    void systemCommentsDirectiveInTheHeader() throws Exception {
        String input =
                "X:1\n%%abcfmt system-comments\nV:1\nV:2\nK:C\n"
                        + "V:1\nCD|\nV:2\nEF|\nV:1\nGA|\nV:2\nBc|\n";

        assertEquals(
                "X:1\n%%abcfmt system-comments\nV:1\nV:2\nK:C\n"
                        + "V:1\nCD |\nV:2\nEF |\n%\nV:1\nGA |\nV:2\nBc |\n",
                format(input));
    }

    @Test
    void copiesFileHeaderAndSeparatesTunes() throws Exception {
        assertEquals(
                "%abc-2.1\n\nX:1\nT:Title\nK:C\nCDEF GABC |\n\nX:2\nK:G\nG A |\n",
                format("%abc-2.1\n\nX:1\nT:Title   \nK:C\nCDEF  GABC|\n\nX:2\nK:G\nG  A|\n"));
    }

    @Test
    void formatsFragmentsWithoutTuneHeader() throws Exception {
        assertEquals("CDEF GABC |\n", format("CDEF  GABC|"));
    }

    @Test
    void syntaxErrorsAreReported() {
        assertThrows(AbcParseException.class, () -> format("X:1\nK:C\nC ]|\n"));
    }

    private String format(String input) throws AbcParseException {
        return formatter.format("test.abc", input);
    }
}
