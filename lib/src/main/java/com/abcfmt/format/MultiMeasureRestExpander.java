package com.abcfmt.format;

import com.abcfmt.loader.ast.BarLineNode;
import com.abcfmt.loader.ast.ElementNode;
import com.abcfmt.loader.ast.MultiMeasureRestNode;
import com.abcfmt.loader.ast.NodeIds;
import com.abcfmt.loader.ast.SourceLocation;
import com.abcfmt.loader.ast.WhitespaceNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rewrites {@code Zn} and {@code Xn} as n single-bar rests of the same kind separated by bar lines,
 * so that every bar of the rest can line up with the bars of the other voices.
 */
public final class MultiMeasureRestExpander {

    private final NodeIds ids;

    public MultiMeasureRestExpander(NodeIds ids) {
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    public List<ElementNode> expand(List<ElementNode> elements) {
        List<ElementNode> result = new ArrayList<>();
        for (ElementNode element : elements) {
            if (element instanceof MultiMeasureRestNode rest && rest.getBarCount() > 1) {
                for (int bar = 0; bar < rest.getBarCount(); bar++) {
                    if (bar > 0) {
                        result.add(WhitespaceNode.spaces(ids, 1));
                        result.add(new BarLineNode(ids.next(), SourceLocation.SYNTHETIC, "|"));
                        result.add(WhitespaceNode.spaces(ids, 1));
                    }
                    result.add(
                            new MultiMeasureRestNode(
                                    ids.next(), rest.getLocation(), rest.getSymbol(), null));
                }
            } else {
                result.add(element);
            }
        }
        return result;
    }
}
