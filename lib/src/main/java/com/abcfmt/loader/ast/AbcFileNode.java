package com.abcfmt.loader.ast;

import java.util.List;
import java.util.Objects;

/** Root of a parsed file: free header lines before the first tune, then the tunes in order. */
public final class AbcFileNode {

    private final String sourceName;
    private final List<LineNode> fileHeader;
    private final List<TuneNode> tunes;
    private final NodeIds ids;

    public AbcFileNode(
            String sourceName, List<LineNode> fileHeader, List<TuneNode> tunes, NodeIds ids) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.fileHeader = List.copyOf(fileHeader);
        this.tunes = List.copyOf(tunes);
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<LineNode> getFileHeader() {
        return fileHeader;
    }

    public List<TuneNode> getTunes() {
        return tunes;
    }

    /** Id generator that produced this tree's element ids. */
    public NodeIds getIds() {
        return ids;
    }
}
