package com.abcfmt.loader.ast;

import java.util.List;

public final class MusicLineNode extends LineNode {

    private final List<ElementNode> elements;

    public MusicLineNode(SourceLocation location, List<ElementNode> elements) {
        super(location);
        this.elements = List.copyOf(elements);
    }

    public List<ElementNode> getElements() {
        return elements;
    }

    /** The voice id of a leading {@code [V:...]} field, or null. */
    public String getInlineVoiceId() {
        for (ElementNode element : elements) {
            if (element.isWhitespace()) {
                continue;
            }
            if (element instanceof InlineFieldNode field && field.getFieldKey() == 'V') {
                String value = field.getValue();
                int space = value.indexOf(' ');
                return space < 0 ? value : value.substring(0, space);
            }
            return null;
        }
        return null;
    }

    @Override
    public String getText() {
        StringBuilder builder = new StringBuilder();
        for (ElementNode element : elements) {
            builder.append(element.getText());
        }
        return builder.toString();
    }
}
