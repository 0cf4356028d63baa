package com.abcfmt.format.align;

import com.abcfmt.music.Rational;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered alignment points for one system, partitioned by bar. {@code barIndexes.get(b)} is the
 * position of bar b's bar-start point; the time points of bar b follow it in strictly increasing
 * time order up to the next bar-start point. Bar 0 exists from the start so voices can push time
 * points before their first bar line.
 */
public final class AlignmentIndex {

    private final List<AlignmentPoint> points = new ArrayList<>();
    private final List<Integer> barIndexes = new ArrayList<>();

    public AlignmentIndex() {
        points.add(AlignmentPoint.barStart(0));
        barIndexes.add(0);
    }

    /**
     * Records a bar line opening {@code bar}. Bars are opened in order; a bar that already exists
     * gets the location appended to its bar-start point.
     *
     * @throws AlignmentException if {@code bar} would leave a gap in the bar numbering
     */
    public void pushBarStart(int bar, NodeLocation location) {
        if (bar < barIndexes.size()) {
            points.get(barIndexes.get(bar)).add(location);
            return;
        }
        if (bar != barIndexes.size()) {
            throw new AlignmentException(
                    "Bar " + bar + " pushed but the index only has " + barIndexes.size() + " bars");
        }
        AlignmentPoint point = AlignmentPoint.barStart(bar);
        point.add(location);
        points.add(point);
        barIndexes.add(points.size() - 1);
    }

    /**
     * Records an element starting at {@code time} within {@code bar}. Equal times merge into one
     * point; a new time is spliced in before the first later time of the bar, or at the end of
     * the bar.
     *
     * @throws AlignmentException if the bar has not been opened
     */
    public void pushTime(int bar, Rational time, NodeLocation location) {
        if (bar < 0 || bar >= barIndexes.size()) {
            throw new AlignmentException(
                    "Time " + time + " pushed into unknown bar " + bar + " for " + location);
        }
        int start = barIndexes.get(bar);
        int end = barEnd(bar);
        for (int i = start + 1; i < end; i++) {
            AlignmentPoint existing = points.get(i);
            int order = existing.getTime().compareTo(time);
            if (order == 0) {
                existing.add(location);
                return;
            }
            if (order > 0) {
                insert(i, bar, time, location);
                return;
            }
        }
        insert(end, bar, time, location);
    }

    private void insert(int position, int bar, Rational time, NodeLocation location) {
        AlignmentPoint point = AlignmentPoint.at(bar, time);
        point.add(location);
        points.add(position, point);
        for (int b = 0; b < barIndexes.size(); b++) {
            if (barIndexes.get(b) >= position) {
                barIndexes.set(b, barIndexes.get(b) + 1);
            }
        }
    }

    private int barEnd(int bar) {
        return bar + 1 < barIndexes.size() ? barIndexes.get(bar + 1) : points.size();
    }

    /** All points, bar ascending and time ascending within each bar. */
    public List<AlignmentPoint> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public int getBarCount() {
        return barIndexes.size();
    }

    /** Bar-start point of {@code bar} followed by its time points. */
    public List<AlignmentPoint> pointsInBar(int bar) {
        if (bar < 0 || bar >= barIndexes.size()) {
            throw new AlignmentException("Unknown bar " + bar);
        }
        return Collections.unmodifiableList(points.subList(barIndexes.get(bar), barEnd(bar)));
    }

    /** Time points of {@code bar} that contain a location of the given voice. */
    public List<AlignmentPoint> pointsForVoice(int bar, int voiceIndex) {
        List<AlignmentPoint> result = new ArrayList<>();
        if (bar >= barIndexes.size()) {
            return result;
        }
        for (AlignmentPoint point : pointsInBar(bar)) {
            if (point.isBarStart()) {
                continue;
            }
            for (NodeLocation location : point.getLocations()) {
                if (location.voiceIndex() == voiceIndex) {
                    result.add(point);
                    break;
                }
            }
        }
        return result;
    }

    /**
     * Checks the partition and ordering invariants.
     *
     * @throws AlignmentException describing the first violation
     */
    public void validate() {
        for (int b = 0; b < barIndexes.size(); b++) {
            int start = barIndexes.get(b);
            AlignmentPoint first = points.get(start);
            if (!first.isBarStart() || first.getBar() != b) {
                throw new AlignmentException("Bar " + b + " does not start at index " + start);
            }
            Rational previous = null;
            for (int i = start + 1; i < barEnd(b); i++) {
                AlignmentPoint point = points.get(i);
                if (point.isBarStart() || point.getBar() != b) {
                    throw new AlignmentException("Point " + point + " misplaced in bar " + b);
                }
                if (previous != null && !point.getTime().isGreaterThan(previous)) {
                    throw new AlignmentException("Times not increasing in bar " + b + ": " + point);
                }
                previous = point.getTime();
            }
        }
    }

    /** One line per point, for FINE logging and test failure messages. */
    public String describe() {
        StringBuilder builder = new StringBuilder();
        for (AlignmentPoint point : points) {
            builder.append(point).append('\n');
        }
        return builder.toString();
    }
}
