package com.abcfmt.format.align;

import com.abcfmt.music.Rational;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Elements of different voices that start at the same instant: either the start of a bar or a
 * time offset inside a bar. Locations keep insertion order.
 */
public final class AlignmentPoint {

    private final int bar;
    private final Rational time;
    private final List<NodeLocation> locations = new ArrayList<>();

    private AlignmentPoint(int bar, Rational time) {
        this.bar = bar;
        this.time = time;
    }

    static AlignmentPoint barStart(int bar) {
        return new AlignmentPoint(bar, null);
    }

    static AlignmentPoint at(int bar, Rational time) {
        return new AlignmentPoint(bar, time);
    }

    public int getBar() {
        return bar;
    }

    /** Offset from the start of the bar, or null for a bar-start point. */
    public Rational getTime() {
        return time;
    }

    public boolean isBarStart() {
        return time == null;
    }

    public List<NodeLocation> getLocations() {
        return Collections.unmodifiableList(locations);
    }

    void add(NodeLocation location) {
        locations.add(location);
    }

    @Override
    public String toString() {
        return "(" + bar + ", " + (time == null ? "bar" : time) + ") " + locations;
    }
}
