package com.abcfmt.loader.ast;

import java.util.List;

/**
 * Run of two or more time-bearing elements written without separating whitespace. Grace groups,
 * decorations, slurs and tuplet markers between the members stay inside the run. The aligner treats
 * the whole run as one event whose length is the sum of its members.
 */
public final class BeamNode extends ElementNode {

    private final List<ElementNode> contents;

    public BeamNode(int id, SourceLocation location, List<ElementNode> contents) {
        super(id, location);
        this.contents = List.copyOf(contents);
    }

    public List<ElementNode> getContents() {
        return contents;
    }

    public int getTimeEventCount() {
        int count = 0;
        for (ElementNode node : contents) {
            if (node.isTimeBearing()) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String getText() {
        StringBuilder builder = new StringBuilder();
        for (ElementNode node : contents) {
            builder.append(node.getText());
        }
        return builder.toString();
    }

    @Override
    public boolean isTimeBearing() {
        return true;
    }

    @Override
    public boolean isBeam() {
        return true;
    }
}
