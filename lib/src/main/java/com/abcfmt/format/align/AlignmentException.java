package com.abcfmt.format.align;

/**
 * Internal inconsistency in alignment bookkeeping, such as a location that no longer resolves
 * or a time pushed into a bar the index does not have. Indicates a defect, never bad input.
 */
public final class AlignmentException extends IllegalStateException {
    public AlignmentException(String message) {
        super(message);
    }
}
