package com.abcfmt.format.align;

/** Which padding passes {@link SystemAligner} runs. */
public enum AlignmentStrategy {
    /** Align every shared time point, then equalize bar lines. */
    POINTS,
    /** Only equalize bar lines. */
    BARS
}
