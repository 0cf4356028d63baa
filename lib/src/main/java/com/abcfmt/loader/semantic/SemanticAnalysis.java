package com.abcfmt.loader.semantic;

import com.abcfmt.loader.LoaderMessage;
import com.abcfmt.loader.ast.TuneNode;
import java.util.List;

public final class SemanticAnalysis {
    private final List<TuneAnalysis> tunes;
    private final List<LoaderMessage> messages;

    public SemanticAnalysis(List<TuneAnalysis> tunes, List<LoaderMessage> messages) {
        this.tunes = List.copyOf(tunes);
        this.messages = List.copyOf(messages);
    }

    public List<TuneAnalysis> getTunes() {
        return tunes;
    }

    /** Analysis of the given tune, matched by identity. */
    public TuneAnalysis getTune(TuneNode tune) {
        for (TuneAnalysis analysis : tunes) {
            if (analysis.getTune() == tune) {
                return analysis;
            }
        }
        throw new IllegalArgumentException("Tune was not part of this analysis: " + tune.getLocation());
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }
}
