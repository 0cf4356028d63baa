package com.abcfmt.loader.ast;

/**
 * Tuplet marker {@code (p:q:r}: put p notes into the time of q for the next r notes. Missing q and
 * r are null and resolved by the duration calculator, which knows the meter.
 */
public final class TupletNode extends ElementNode {

    private final String text;
    private final int p;
    private final Integer q;
    private final Integer r;

    public TupletNode(int id, SourceLocation location, String text, int p, Integer q, Integer r) {
        super(id, location);
        this.text = text;
        this.p = p;
        this.q = q;
        this.r = r;
    }

    public int getP() {
        return p;
    }

    public Integer getQ() {
        return q;
    }

    public Integer getR() {
        return r;
    }

    @Override
    public String getText() {
        return text;
    }
}
