package com.abcfmt.format.align;

import com.abcfmt.music.Rational;
import java.util.HashMap;
import java.util.Map;

/**
 * Rhythm multipliers to use in place of zero-length shortcuts, keyed by element id. Filled by the
 * semantic pass for tunes that contain such shortcuts.
 */
public final class DurationSnapshot {

    public static final DurationSnapshot EMPTY = new DurationSnapshot(Map.of());

    private final Map<Integer, Rational> multipliers;

    public DurationSnapshot(Map<Integer, Rational> multipliers) {
        this.multipliers = Map.copyOf(multipliers);
    }

    /** Multiplier recorded for the element, or null. */
    public Rational get(int nodeId) {
        return multipliers.get(nodeId);
    }

    public boolean isEmpty() {
        return multipliers.isEmpty();
    }

    public int size() {
        return multipliers.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Integer, Rational> multipliers = new HashMap<>();

        public Builder put(int nodeId, Rational multiplier) {
            multipliers.put(nodeId, multiplier);
            return this;
        }

        public DurationSnapshot build() {
            return new DurationSnapshot(multipliers);
        }
    }
}
