package com.abcfmt.format;

import static com.abcfmt.format.FormatFixtures.musicLine;
import static com.abcfmt.format.FormatFixtures.symbolLine;
import static com.abcfmt.format.FormatFixtures.text;
import static com.abcfmt.format.FormatFixtures.tune;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.abcfmt.loader.ast.AbcFileNode;
import org.junit.jupiter.api.Test;

class SpacingRulesTest {

    @Test
    void collapsesRunsOfWhitespaceAndSeparatesBarLines() throws Exception {
        assertEquals("CDEF GABC |", spaceMusic("CDEF    GABC|"));
    }

    @Test
    void decorationsAndAnnotationsAreFollowedByASpace() throws Exception {
        assertEquals("!p! C \"hello\" DEF [K:G] G |", spaceMusic("!p!C  \"hello\"DEF[K:G]G|"));
    }

    @Test
    void tupletsAndGraceGroupsStayAttached() throws Exception {
        assertEquals("(3abc {ag}F2 |", spaceMusic("(3abc   {ag}F2|"));
    }

    @Test
    void slursAndSpacersHugTheirNotes() throws Exception {
        assertEquals("(C D) (AB)y C |", spaceMusic("( C D ) (AB) y C|"));
    }

    @Test
    void trailingCommentGetsASpace() throws Exception {
        assertEquals("C D | % end", spaceMusic("C D |% end"));
    }

    @Test
    void symbolLinesUseSingleSpacesAndJoinHyphenatedSyllables() throws Exception {
        AbcFileNode file = tune("w:syl-  la-ble   *  |next\n");

        assertEquals(
                "w: syl-la-ble * | next",
                text(new SpacingRules(file.getIds()).spaceSymbols(symbolLine(file))));
    }

    private static String spaceMusic(String music) throws Exception {
        AbcFileNode file = tune(music + "\n");
        return text(new SpacingRules(file.getIds()).spaceMusic(musicLine(file)));
    }
}
