package com.abcfmt.loader.ast;

/** A rest; {@code x} is the invisible variant of {@code z}. */
public final class RestNode extends ElementNode {

    private final char symbol;
    private final Rhythm rhythm;

    public RestNode(int id, SourceLocation location, char symbol, Rhythm rhythm) {
        super(id, location);
        this.symbol = symbol;
        this.rhythm = rhythm == null ? Rhythm.NONE : rhythm;
    }

    public char getSymbol() {
        return symbol;
    }

    public Rhythm getRhythm() {
        return rhythm;
    }

    public boolean isInvisible() {
        return symbol == 'x';
    }

    @Override
    public String getText() {
        return symbol + rhythm.toAbc();
    }

    @Override
    public boolean isTimeBearing() {
        return true;
    }
}
