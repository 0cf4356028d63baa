package com.abcfmt.format.align;

import com.abcfmt.loader.ast.ElementNode;
import com.abcfmt.loader.ast.LineNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One printed line of a system, owned by the aligner while it runs. Formatted voices and symbol
 * lines carry a mutable element list that padding is spliced into; pass-through lines (comments,
 * field lines) only keep their position in the system.
 */
public final class VoiceLine {

    public enum Kind {
        FORMATTED,
        SYMBOL,
        PASSTHROUGH
    }

    private final Kind kind;
    private final String voiceId;
    private final LineNode source;
    private final List<ElementNode> elements;

    public VoiceLine(Kind kind, String voiceId, LineNode source, List<ElementNode> elements) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.voiceId = voiceId;
        this.source = source;
        this.elements = new ArrayList<>(elements);
    }

    public static VoiceLine passthrough(LineNode source) {
        return new VoiceLine(Kind.PASSTHROUGH, null, source, List.of());
    }

    public Kind getKind() {
        return kind;
    }

    public String getVoiceId() {
        return voiceId;
    }

    /** The parsed line this voice line came from, or null for lines built in code. */
    public LineNode getSource() {
        return source;
    }

    public List<ElementNode> getElements() {
        return Collections.unmodifiableList(elements);
    }

    public int size() {
        return elements.size();
    }

    public ElementNode get(int position) {
        return elements.get(position);
    }

    /** Position of the element with this id, or -1. */
    public int indexOf(int nodeId) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i).getId() == nodeId) {
                return i;
            }
        }
        return -1;
    }

    public void insert(int position, ElementNode node) {
        elements.add(position, node);
    }

    public void replaceAll(List<ElementNode> replacement) {
        elements.clear();
        elements.addAll(replacement);
    }

    /** Width of everything before {@code position}. */
    public int columnOf(int position, ElementRenderer renderer) {
        int column = 0;
        for (int i = 0; i < position; i++) {
            column += renderer.render(elements.get(i)).length();
        }
        return column;
    }

    /** Ids of the bar lines in order; the k-th one closes bar k. */
    public List<Integer> barLineIds() {
        List<Integer> ids = new ArrayList<>();
        for (ElementNode element : elements) {
            if (element.isBarLine()) {
                ids.add(element.getId());
            }
        }
        return ids;
    }

    public String render(ElementRenderer renderer) {
        StringBuilder builder = new StringBuilder();
        for (ElementNode element : elements) {
            builder.append(renderer.render(element));
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return kind + (voiceId == null ? "" : "(" + voiceId + ")") + elements;
    }
}
