package com.abcfmt.loader;

import com.abcfmt.loader.ast.AbcFileNode;
import com.abcfmt.loader.semantic.SemanticAnalysis;
import com.abcfmt.loader.semantic.SemanticAnalyzer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Entry point for loading ABC files through the ANTLR-backed parse and analysis pipeline. */
public final class AbcLoader {

    public LoaderResult load(Path path) throws LoaderException {
        Objects.requireNonNull(path, "path");
        String input;
        try {
            input = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new LoaderException("Unable to read ABC file " + path, ex);
        }
        return load(path.toString(), input);
    }

    public LoaderResult load(String sourceName, String input) throws LoaderException {
        AbcFileNode file;
        try {
            file = new AbcAstBuilder().parse(sourceName, input);
        } catch (AbcParseException ex) {
            throw new LoaderException("Failed to parse " + sourceName + ": " + ex.getMessage(), ex);
        }
        SemanticAnalysis analysis = new SemanticAnalyzer().analyze(file);
        List<LoaderMessage> messages = new ArrayList<>(analysis.getMessages());
        for (String token : DebugFlags.drainCapturedTokens()) {
            messages.add(LoaderMessage.info("[tokens] " + token, sourceName));
        }
        for (String diagnostic : DebugFlags.drainCapturedDiagnostics()) {
            messages.add(LoaderMessage.info("[diagnostic] " + diagnostic, sourceName));
        }
        return new LoaderResult(file, analysis, messages);
    }
}
