package com.abcfmt.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.abcfmt.loader.ast.AbcFileNode;
import com.abcfmt.loader.ast.BarLineNode;
import com.abcfmt.loader.ast.BeamNode;
import com.abcfmt.loader.ast.BlankLineNode;
import com.abcfmt.loader.ast.ChordNode;
import com.abcfmt.loader.ast.CommentLineNode;
import com.abcfmt.loader.ast.CommentNode;
import com.abcfmt.loader.ast.ElementNode;
import com.abcfmt.loader.ast.GraceGroupNode;
import com.abcfmt.loader.ast.InfoLineNode;
import com.abcfmt.loader.ast.MultiMeasureRestNode;
import com.abcfmt.loader.ast.MusicLineNode;
import com.abcfmt.loader.ast.NoteNode;
import com.abcfmt.loader.ast.RestNode;
import com.abcfmt.loader.ast.Rhythm;
import com.abcfmt.loader.ast.SymbolHeaderNode;
import com.abcfmt.loader.ast.SymbolLineNode;
import com.abcfmt.loader.ast.SymbolTokenNode;
import com.abcfmt.loader.ast.TuneNode;
import com.abcfmt.loader.ast.TupletNode;
import com.abcfmt.loader.ast.WhitespaceNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class AbcAstBuilderTest {

    @Test
    void splitsFileHeaderTunesAndTrailingLines() throws Exception {
        AbcFileNode file =
                parse("%abc-2.1\n\nX:1\nT:First\nM:4/4\nK:C\nCDEF|\n\nX:2\nK:G\nGABc|\n");

        assertEquals(2, file.getFileHeader().size());
        assertInstanceOf(CommentLineNode.class, file.getFileHeader().get(0));
        assertInstanceOf(BlankLineNode.class, file.getFileHeader().get(1));
        assertEquals(2, file.getTunes().size());

        TuneNode first = file.getTunes().get(0);
        assertEquals(4, first.getHeader().size());
        assertEquals("First", first.getHeaderValue('T'));
        assertEquals(1, first.getBody().size());
        assertInstanceOf(MusicLineNode.class, first.getBody().get(0));
        assertEquals(1, first.getTrailing().size());

        TuneNode second = file.getTunes().get(1);
        assertEquals(9, second.getLocation().getLine());
        assertEquals(2, second.getHeader().size());
        assertEquals("GABc|", second.getBody().get(0).getText());
        assertTrue(second.getTrailing().isEmpty());
    }

    @Test
    void headerWithoutKeyEndsAtRepeatedVoice() throws Exception {
        TuneNode tune = parse("X:1\nV:1\nV:2\nV:1\nCDEF|\nV:2\nCDEF|").getTunes().get(0);

        assertEquals(3, tune.getHeader().size());
        assertEquals(4, tune.getBody().size());
        assertEquals("V:1", tune.getBody().get(0).getText());
    }

    @Test
    void headerWithoutKeyEndsAtFirstMusicLine() throws Exception {
        TuneNode tune = parse("X:1\nT:Fragment\n% comment\nCDEF|\n").getTunes().get(0);

        assertEquals(3, tune.getHeader().size());
        assertEquals(1, tune.getBody().size());
    }

    @Test
    void inputWithoutTuneStartIsOneFragment() throws Exception {
        AbcFileNode file = parse("CDEF|GABc|\n[V:2] C4|\n");

        assertTrue(file.getFileHeader().isEmpty());
        assertEquals(1, file.getTunes().size());
        TuneNode tune = file.getTunes().get(0);
        assertTrue(tune.getHeader().isEmpty());
        assertEquals(2, tune.getBody().size());
        assertEquals("2", ((MusicLineNode) tune.getBody().get(1)).getInlineVoiceId());
    }

    @Test
    void adjacentNotesBecomeBeams() throws Exception {
        List<ElementNode> elements = musicLine("CDEF G2 A|");

        assertEquals(6, elements.size());
        BeamNode beam = assertInstanceOf(BeamNode.class, elements.get(0));
        assertEquals(4, beam.getTimeEventCount());
        assertEquals("CDEF", beam.getText());
        assertInstanceOf(WhitespaceNode.class, elements.get(1));
        assertInstanceOf(NoteNode.class, elements.get(2));
        assertInstanceOf(NoteNode.class, elements.get(4));
        assertInstanceOf(BarLineNode.class, elements.get(5));
    }

    @Test
    void leadingMarkersStayOutsideTheBeam() throws Exception {
        List<ElementNode> elements = musicLine("(3CDE \"hello\"FG {ag}A|");

        TupletNode tuplet = assertInstanceOf(TupletNode.class, elements.get(0));
        assertEquals(3, tuplet.getP());
        assertNull(tuplet.getQ());
        assertEquals(3, assertInstanceOf(BeamNode.class, elements.get(1)).getTimeEventCount());
        assertEquals("\"hello\"", elements.get(3).getText());
        assertInstanceOf(BeamNode.class, elements.get(4));
        assertInstanceOf(GraceGroupNode.class, elements.get(6));
        assertInstanceOf(NoteNode.class, elements.get(7));
    }

    @Test
    void readsRhythmsAsWritten() throws Exception {
        List<ElementNode> elements = musicLine("C3/2 D// E>F z4|");

        Rhythm c = ((NoteNode) elements.get(0)).getRhythm();
        assertEquals("3", c.getNumerator());
        assertEquals("/", c.getSlashes());
        assertEquals("2", c.getDenominator());
        Rhythm d = ((NoteNode) elements.get(2)).getRhythm();
        assertEquals(4, d.getDenominatorValue());
        BeamNode broken = assertInstanceOf(BeamNode.class, elements.get(4));
        assertEquals(1, ((NoteNode) broken.getContents().get(0)).getRhythm().getBrokenLevel());
        RestNode rest = assertInstanceOf(RestNode.class, elements.get(6));
        assertEquals(4, rest.getRhythm().getNumeratorValue());
    }

    @Test
    void parsesChordsTupletsAndMultiMeasureRests() throws Exception {
        List<ElementNode> elements = musicLine("[CEG]2- (3:2:4 Z4|");

        ChordNode chord = assertInstanceOf(ChordNode.class, elements.get(0));
        assertEquals(3, chord.getNotes().size());
        assertEquals("2", chord.getRhythm().getNumerator());
        assertTrue(chord.isTied());
        TupletNode tuplet = assertInstanceOf(TupletNode.class, elements.get(2));
        assertEquals(Integer.valueOf(2), tuplet.getQ());
        assertEquals(Integer.valueOf(4), tuplet.getR());
        MultiMeasureRestNode rest = assertInstanceOf(MultiMeasureRestNode.class, elements.get(4));
        assertEquals(4, rest.getBarCount());
    }

    @Test
    void keepsSourceTextAndOneBasedColumns() throws Exception {
        MusicLineNode line =
                (MusicLineNode) parse("X:1\nK:C\n!p!C  D | [K:G] E % end\n").getTunes().get(0)
                        .getBody()
                        .get(0);

        assertEquals("!p!C  D | [K:G] E % end", line.getText());
        ElementNode d = line.getElements().get(3);
        assertEquals("D", d.getText());
        assertEquals(3, d.getLocation().getLine());
        assertEquals(7, d.getLocation().getColumn());
        assertInstanceOf(
                CommentNode.class, line.getElements().get(line.getElements().size() - 1));
    }

    @Test
    void buildsLyricLines() throws Exception {
        SymbolLineNode line =
                (SymbolLineNode) parse("X:1\nK:C\nCDE|\nw: syl-la-ble * |\n").getTunes().get(0)
                        .getBody()
                        .get(1);

        SymbolHeaderNode header = line.getHeader();
        assertTrue(header.isLyrics());
        List<ElementNode> elements = line.getElements();
        SymbolTokenNode first = assertInstanceOf(SymbolTokenNode.class, elements.get(2));
        assertEquals("syl-", first.getText());
        assertTrue(first.isHyphenated());
        SymbolTokenNode last = assertInstanceOf(SymbolTokenNode.class, elements.get(4));
        assertFalse(last.isHyphenated());
        SymbolTokenNode bar =
                assertInstanceOf(SymbolTokenNode.class, elements.get(elements.size() - 1));
        assertTrue(bar.isBarLine());
    }

    @Test
    void whitespaceOnlyLineClosesTheTune() throws Exception {
        AbcFileNode file = parse("X:1\nK:C\nCDEF|\n   \nGABc|\n");

        TuneNode tune = file.getTunes().get(0);
        assertEquals(1, tune.getBody().size());
        assertEquals(2, tune.getTrailing().size());
        assertInstanceOf(BlankLineNode.class, tune.getTrailing().get(0));
    }

    @Test
    void infoLineValueDropsComment() throws Exception {
        InfoLineNode key =
                (InfoLineNode) parse("X:1\nV:T1 clef=bass % tenor\nK:C\n").getTunes().get(0)
                        .getHeader()
                        .get(1);

        assertEquals("T1 clef=bass", key.getValue());
        assertEquals("T1", key.getFirstWord());
    }

    @Test
    void syntaxErrorsCarryTheirPosition() {
        AbcParseException error =
                assertThrows(AbcParseException.class, () -> parse("X:1\nK:C\nCDh|\n"));
        assertTrue(error.getMessage().startsWith("line 3:3"), error.getMessage());
    }

    private static AbcFileNode parse(String input) throws AbcParseException {
        return new AbcAstBuilder().parse("test.abc", input);
    }

    private static List<ElementNode> musicLine(String music) throws AbcParseException {
        TuneNode tune = parse("X:1\nK:C\n" + music + "\n").getTunes().get(0);
        return ((MusicLineNode) tune.getBody().get(0)).getElements();
    }
}
