package com.abcfmt.format;

import com.abcfmt.loader.ast.CommentNode;
import com.abcfmt.loader.ast.ElementNode;
import com.abcfmt.loader.ast.GraceGroupNode;
import com.abcfmt.loader.ast.MarkerNode;
import com.abcfmt.loader.ast.NodeIds;
import com.abcfmt.loader.ast.SymbolTokenNode;
import com.abcfmt.loader.ast.TupletNode;
import com.abcfmt.loader.ast.WhitespaceNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Replaces the whitespace of a music or symbol line with single spaces between elements.
 * Grace groups, tuplet markers and opening slurs stay attached to what follows them, closing slurs
 * and {@code y} spacers to what precedes them.
 */
public final class SpacingRules {

    private final NodeIds ids;

    public SpacingRules(NodeIds ids) {
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    public List<ElementNode> spaceMusic(List<ElementNode> elements) {
        List<ElementNode> result = new ArrayList<>();
        ElementNode previous = null;
        for (ElementNode element : elements) {
            if (element.isWhitespace()) {
                continue;
            }
            if (previous != null && separates(previous, element)) {
                result.add(WhitespaceNode.spaces(ids, 1));
            }
            result.add(element);
            previous = element;
        }
        return result;
    }

    /** Header, then tokens one space apart; a hyphenated syllable is joined to the next one. */
    public List<ElementNode> spaceSymbols(List<ElementNode> elements) {
        List<ElementNode> result = new ArrayList<>();
        ElementNode previous = null;
        for (ElementNode element : elements) {
            if (element.isWhitespace()) {
                continue;
            }
            boolean joined =
                    previous instanceof SymbolTokenNode token
                            && token.isHyphenated()
                            && element instanceof SymbolTokenNode;
            if (previous != null && !joined) {
                result.add(WhitespaceNode.spaces(ids, 1));
            }
            result.add(element);
            previous = element;
        }
        return result;
    }

    private static boolean separates(ElementNode previous, ElementNode next) {
        if (next instanceof CommentNode) {
            return true;
        }
        if (previous instanceof TupletNode || previous instanceof GraceGroupNode) {
            return false;
        }
        if (previous instanceof MarkerNode marker && marker.getKind() == MarkerNode.Kind.SLUR_OPEN) {
            return false;
        }
        if (next instanceof MarkerNode marker) {
            return marker.getKind() != MarkerNode.Kind.SLUR_CLOSE
                    && marker.getKind() != MarkerNode.Kind.SPACER;
        }
        return true;
    }
}
