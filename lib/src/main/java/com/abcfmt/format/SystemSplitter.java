package com.abcfmt.format;

import com.abcfmt.format.align.VoiceLine;
import com.abcfmt.loader.ast.InfoLineNode;
import com.abcfmt.loader.ast.LineNode;
import com.abcfmt.loader.ast.MusicLineNode;
import com.abcfmt.loader.ast.SymbolLineNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Cuts a tune body into systems. A system holds at most one music line per voice, together with
 * the lyric and symbol lines that follow each music line and the field and comment lines around
 * them. Lines that precede the music line opening the next system move with it.
 */
public final class SystemSplitter {

    public List<List<VoiceLine>> split(List<LineNode> body, String initialVoiceId) {
        List<List<VoiceLine>> systems = new ArrayList<>();
        List<VoiceLine> current = new ArrayList<>();
        List<VoiceLine> pending = new ArrayList<>();
        Set<String> voicesInSystem = new HashSet<>();
        String voice = initialVoiceId;
        for (LineNode line : body) {
            if (line instanceof MusicLineNode music) {
                String inline = music.getInlineVoiceId();
                if (inline != null) {
                    voice = inline;
                }
                if (!voicesInSystem.add(voice)) {
                    systems.add(current);
                    current = new ArrayList<>();
                    voicesInSystem.clear();
                    voicesInSystem.add(voice);
                }
                current.addAll(pending);
                pending.clear();
                current.add(
                        new VoiceLine(
                                VoiceLine.Kind.FORMATTED, voice, music, music.getElements()));
            } else if (line instanceof SymbolLineNode symbols) {
                current.addAll(pending);
                pending.clear();
                current.add(
                        new VoiceLine(
                                VoiceLine.Kind.SYMBOL, voice, symbols, symbols.getElements()));
            } else {
                if (line instanceof InfoLineNode info && info.isKey('V')) {
                    voice = info.getFirstWord();
                }
                pending.add(VoiceLine.passthrough(line));
            }
        }
        current.addAll(pending);
        if (!current.isEmpty()) {
            systems.add(current);
        }
        return systems;
    }
}
