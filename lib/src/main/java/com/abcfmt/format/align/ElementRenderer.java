package com.abcfmt.format.align;

import com.abcfmt.loader.ast.ElementNode;

/** Text of an element as it will be printed; the aligner uses it only to measure widths. */
@FunctionalInterface
public interface ElementRenderer {
    String render(ElementNode node);
}
