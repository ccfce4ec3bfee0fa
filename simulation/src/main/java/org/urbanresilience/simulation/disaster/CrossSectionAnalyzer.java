package org.urbanresilience.simulation.disaster;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.urbanresilience.core.geometry.GeometryUtils;
import org.urbanresilience.core.model.LaneDirection;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Measures how much road width a fallen tree leaves open.
 * <p>
 * The obstruction is sampled with cross-sections perpendicular to the road axis over its
 * along-road extent. The narrowest sample is the width a vehicle actually has to squeeze through.
 */
public final class CrossSectionAnalyzer {

    private final int samples;
    private final double directionalThreshold;

    public CrossSectionAnalyzer(int samples, double directionalThreshold) {
        if (samples < 2) {
            throw new IllegalArgumentException("samples must be at least 2");
        }
        this.samples = samples;
        this.directionalThreshold = directionalThreshold;
    }

    /**
     * Width profile of {@code road} under {@code tree}, or empty when they do not overlap with positive area.
     *
     * @throws IllegalArgumentException if the footprint has no endpoint geometry
     */
    public Optional<WidthProfile> analyze(RoadFootprint road, Polygon tree) {
        if (!road.hasGeometry()) {
            throw new IllegalArgumentException("road " + road.getEdgeId() + " has no geometry");
        }
        Coordinate a = road.getFrom().get();
        Coordinate b = road.getTo().get();
        if (GeometryUtils.isDegenerate(a, b)) {
            return Optional.empty();
        }
        double width = road.getWidth();
        Polygon footprint = GeometryUtils.roadFootprint(a, b, width);
        if (!footprint.getEnvelopeInternal().intersects(tree.getEnvelopeInternal())) {
            return Optional.empty();
        }
        Geometry obstruction = GeometryUtils.intersection(tree, footprint);
        if (GeometryUtils.area(obstruction) <= GeometryUtils.EPSILON) {
            return Optional.empty();
        }

        double length = a.distance(b);
        double ux = (b.x - a.x) / length;
        double uy = (b.y - a.y) / length;
        // left-hand normal; forward traffic keeps to the right of from->to
        double nx = -uy;
        double ny = ux;

        double tMin = Double.POSITIVE_INFINITY;
        double tMax = Double.NEGATIVE_INFINITY;
        for (Coordinate c : obstruction.getCoordinates()) {
            double t = GeometryUtils.clamp((c.x - a.x) * ux + (c.y - a.y) * uy, 0.0, length);
            tMin = Math.min(tMin, t);
            tMax = Math.max(tMax, t);
        }

        boolean directional = road.isBidirectional();
        double half = width / 2.0;
        double divider = -half + road.forwardShare() * width;

        double minRemaining = Double.POSITIVE_INFINITY;
        double minForward = Double.POSITIVE_INFINITY;
        double minBackward = Double.POSITIVE_INFINITY;
        for (int i = 0; i < samples; i++) {
            double t = tMin + (tMax - tMin) * i / (samples - 1);
            double cx = a.x + ux * t;
            double cy = a.y + uy * t;
            Coordinate right = new Coordinate(cx - nx * half, cy - ny * half);
            Coordinate left = new Coordinate(cx + nx * half, cy + ny * half);

            double roadWidthAtSample = GeometryUtils.clippedLength(right, left, footprint);
            if (roadWidthAtSample < width / 2.0) {
                // cross-section on the footprint's end cap; rounding can push the line off the boundary
                roadWidthAtSample = width;
            }
            double blocked = GeometryUtils.clippedLength(right, left, obstruction);
            minRemaining = Math.min(minRemaining, Math.max(0.0, roadWidthAtSample - blocked));

            if (directional) {
                Coordinate split = new Coordinate(cx + nx * divider, cy + ny * divider);
                double forwardWidth = divider + half;
                double backwardWidth = half - divider;
                minForward = Math.min(minForward,
                        Math.max(0.0, forwardWidth - GeometryUtils.clippedLength(right, split, obstruction)));
                minBackward = Math.min(minBackward,
                        Math.max(0.0, backwardWidth - GeometryUtils.clippedLength(split, left, obstruction)));
            }
        }

        Set<LaneDirection> affected = EnumSet.noneOf(LaneDirection.class);
        if (directional) {
            if (minForward < directionalThreshold) {
                affected.add(LaneDirection.FORWARD);
            }
            if (minBackward < directionalThreshold) {
                affected.add(LaneDirection.BACKWARD);
            }
            return Optional.of(new WidthProfile(obstruction, Math.min(minForward, minBackward), tMax - tMin,
                    minForward, minBackward, affected));
        }
        if (minRemaining < directionalThreshold) {
            affected.add(LaneDirection.FORWARD);
        }
        return Optional.of(new WidthProfile(obstruction, minRemaining, tMax - tMin, null, null, affected));
    }
}
