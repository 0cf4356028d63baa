package com.abcfmt.format.align;

/** An element of one voice, identified by id so it survives padding insertions. */
public record NodeLocation(int voiceIndex, int nodeId) {

    @Override
    public String toString() {
        return "v" + voiceIndex + "#" + nodeId;
    }
}
