package com.abcfmt.format.align;

import com.abcfmt.loader.AbcAstBuilder;
import com.abcfmt.loader.AbcParseException;
import com.abcfmt.loader.ast.AbcFileNode;
import com.abcfmt.loader.ast.ElementNode;
import com.abcfmt.loader.ast.LineNode;
import com.abcfmt.loader.ast.MusicLineNode;
import com.abcfmt.loader.ast.NodeIds;
import com.abcfmt.loader.ast.SymbolLineNode;
import java.util.ArrayList;
import java.util.List;

/** Builds voice lines from ABC text; each given line becomes one voice, lyric or pass-through line. */
final class AlignFixtures {

    record Fixture(List<VoiceLine> voices, NodeIds ids) {
        String render() {
            StringBuilder builder = new StringBuilder();
            for (VoiceLine voice : voices) {
                if (builder.length() > 0) {
                    builder.append('\n');
                }
                if (voice.getKind() == VoiceLine.Kind.PASSTHROUGH) {
                    builder.append(voice.getSource().getText());
                } else {
                    builder.append(voice.render(ElementNode::getText));
                }
            }
            return builder.toString();
        }
    }

    private AlignFixtures() {}

    static Fixture system(String... lines) throws AbcParseException {
        AbcFileNode file = new AbcAstBuilder().parse("fixture.abc", "X:1\nK:C\n" + String.join("\n", lines));
        List<VoiceLine> voices = new ArrayList<>();
        int voice = 0;
        for (LineNode line : file.getTunes().get(0).getBody()) {
            if (line instanceof MusicLineNode music) {
                voices.add(
                        new VoiceLine(
                                VoiceLine.Kind.FORMATTED,
                                String.valueOf(++voice),
                                music,
                                music.getElements()));
            } else if (line instanceof SymbolLineNode symbols) {
                voices.add(
                        new VoiceLine(
                                VoiceLine.Kind.SYMBOL,
                                String.valueOf(voice),
                                symbols,
                                symbols.getElements()));
            } else {
                voices.add(VoiceLine.passthrough(line));
            }
        }
        return new Fixture(voices, file.getIds());
    }

    /** Non-whitespace elements of a single music line. */
    static List<ElementNode> elements(String music) throws AbcParseException {
        List<ElementNode> result = new ArrayList<>();
        for (ElementNode node : system(music).voices().get(0).getElements()) {
            if (!node.isWhitespace()) {
                result.add(node);
            }
        }
        return result;
    }
}
