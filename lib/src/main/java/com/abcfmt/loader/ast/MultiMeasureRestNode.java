package com.abcfmt.loader.ast;

/** {@code Z} or {@code X} rest covering one or more whole bars. */
public final class MultiMeasureRestNode extends ElementNode {

    private final char symbol;
    private final String count;

    public MultiMeasureRestNode(int id, SourceLocation location, char symbol, String count) {
        super(id, location);
        this.symbol = symbol;
        this.count = count;
    }

    public char getSymbol() {
        return symbol;
    }

    /** Number of bars as written, or null when omitted. */
    public String getCount() {
        return count;
    }

    public int getBarCount() {
        if (count == null) {
            return 1;
        }
        try {
            return Math.max(1, Integer.parseInt(count));
        } catch (NumberFormatException ex) {
            return 1;
        }
    }

    public boolean isInvisible() {
        return symbol == 'X';
    }

    @Override
    public String getText() {
        return count == null ? String.valueOf(symbol) : symbol + count;
    }

    @Override
    public boolean isTimeBearing() {
        return true;
    }
}
