package com.abcfmt.loader.ast;

/**
 * Hands out element ids for one parsed file. Ids are the stable identity the aligner uses to find
 * a node again after padding has shifted list positions, so nodes created after parsing must draw
 * from the same generator as the parsed ones.
 */
public final class NodeIds {

    private int next;

    public int next() {
        return next++;
    }

    public int peek() {
        return next;
    }
}
