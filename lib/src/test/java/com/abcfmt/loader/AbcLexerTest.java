package com.abcfmt.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.abcfmt.loader.grammar.AbcLexer;
import com.abcfmt.loader.grammar.AbcParser;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.junit.jupiter.api.Test;

class AbcLexerTest {

    @Test
    void fieldDirectiveAndCommentLinesAreRecognisedAtLineStart() {
        assertEquals(
                List.of("INFO_FIELD", "NEWLINE", "DIRECTIVE", "NEWLINE", "COMMENT", "NEWLINE", "EOF"),
                symbolicNames("T:Title\n%%score 1 2\n% note\n"));
    }

    @Test
    void musicLineTokens() {
        assertEquals(
                List.of(
                        "BARLINE",
                        "NOTE_LETTER",
                        "NOTE_LETTER",
                        "NUMBER",
                        "WS",
                        "REST",
                        "SLASH",
                        "BARLINE",
                        "NEWLINE",
                        "EOF"),
                symbolicNames("|:CD2 z/|\n"));
    }

    @Test
    void tupletMarkerIsOneToken() {
        assertEquals(
                List.of("TUPLET", "NOTE_LETTER", "NOTE_LETTER", "NOTE_LETTER", "NEWLINE", "EOF"),
                symbolicNames("(3:2:3CDE\n"));
    }

    @Test
    void inlineFieldWinsOverChord() {
        assertEquals(
                List.of("INLINE_FIELD", "WS", "CHORD_OPEN", "NOTE_LETTER", "NOTE_LETTER", "CHORD_CLOSE",
                        "NEWLINE", "EOF"),
                symbolicNames("[V:1] [CE]\n"));
    }

    @Test
    void lyricLineSwitchesToSymbolMode() {
        assertEquals(
                List.of(
                        "LYRIC_HEADER",
                        "SYMBOL_WS",
                        "SYMBOL_TEXT",
                        "SYMBOL_TEXT",
                        "SYMBOL_TEXT",
                        "SYMBOL_WS",
                        "SYMBOL_SKIP",
                        "SYMBOL_WS",
                        "SYMBOL_BAR",
                        "SYMBOL_NEWLINE",
                        "NOTE_LETTER",
                        "NEWLINE",
                        "EOF"),
                symbolicNames("w: syl-la-ble * |\nC\n"));
    }

    @Test
    void parserSharesTheLexerVocabulary() {
        for (int type = 1; type <= AbcLexer.VOCABULARY.getMaxTokenType(); type++) {
            assertEquals(
                    AbcLexer.VOCABULARY.getSymbolicName(type),
                    AbcParser.VOCABULARY.getSymbolicName(type));
        }
        assertEquals(AbcLexer.SYMBOL_BAR, AbcParser.SYMBOL_BAR);
    }

    private static List<String> symbolicNames(String input) {
        AbcLexer lexer = new AbcLexer(CharStreams.fromString(input, "test"));
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();

        List<String> symbolic = new ArrayList<>();
        for (Token token : tokens.getTokens()) {
            if (token.getType() == Token.EOF) {
                symbolic.add("EOF");
            } else {
                symbolic.add(lexer.getVocabulary().getSymbolicName(token.getType()));
            }
        }
        return symbolic;
    }
}
