package com.abcfmt.loader;

import com.abcfmt.loader.ast.AbcFileNode;
import com.abcfmt.loader.semantic.SemanticAnalysis;
import java.util.List;

/** Syntax tree, semantic analysis and diagnostics of one loaded ABC file. */
public final class LoaderResult {
    private final AbcFileNode file;
    private final SemanticAnalysis analysis;
    private final List<LoaderMessage> messages;

    public LoaderResult(AbcFileNode file, SemanticAnalysis analysis, List<LoaderMessage> messages) {
        this.file = file;
        this.analysis = analysis;
        this.messages = List.copyOf(messages);
    }

    public AbcFileNode getFile() {
        return file;
    }

    public SemanticAnalysis getAnalysis() {
        return analysis;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }
}
