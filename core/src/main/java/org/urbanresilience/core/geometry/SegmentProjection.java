package org.urbanresilience.core.geometry;

import org.locationtech.jts.geom.Coordinate;

/**
 * Result of projecting a point onto a segment.
 */
public final class SegmentProjection {

    private final Coordinate point;
    private final double ratio;
    private final double distance;

    public SegmentProjection(Coordinate point, double ratio, double distance) {
        this.point = point;
        this.ratio = ratio;
        this.distance = distance;
    }

    /** Projected coordinate, always on the segment. */
    public Coordinate getPoint() {
        return new Coordinate(point);
    }

    /** Offset along the segment in [0, 1]. */
    public double getRatio() {
        return ratio;
    }

    /** Distance between the query point and the projected point. */
    public double getDistance() {
        return distance;
    }

    public boolean isAtStart(double tolerance, double segmentLength) {
        return ratio * segmentLength <= tolerance;
    }

    public boolean isAtEnd(double tolerance, double segmentLength) {
        return (1.0 - ratio) * segmentLength <= tolerance;
    }

    @Override
    public String toString() {
        return "SegmentProjection{" +
                "point=" + point +
                ", ratio=" + ratio +
                ", distance=" + distance +
                '}';
    }
}
