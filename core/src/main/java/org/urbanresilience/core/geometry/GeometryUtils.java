package org.urbanresilience.core.geometry;

import org.locationtech.jts.algorithm.ConvexHull;
import org.locationtech.jts.algorithm.LineIntersector;
import org.locationtech.jts.algorithm.RobustLineIntersector;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineSegment;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.TopologyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Planar geometry helpers shared by the synthesizer, the disaster engine and the analyzer.
 *
 * All coordinates are plane meters. Degenerate inputs produce empty geometries rather than NaN.
 */
public final class GeometryUtils {

    private static final Logger LOG = LoggerFactory.getLogger(GeometryUtils.class);

    public static final double EPSILON = 1e-9;

    private static final GeometryFactory FACTORY = new GeometryFactory();

    private GeometryUtils() {
    }

    public static GeometryFactory factory() {
        return FACTORY;
    }

    public static double distance(Coordinate a, Coordinate b) {
        return a.distance(b);
    }

    public static boolean isDegenerate(Coordinate a, Coordinate b) {
        return a.distance(b) < EPSILON;
    }

    /**
     * Projects {@code p} onto segment a-b, clamping to the endpoints.
     */
    public static SegmentProjection project(Coordinate p, Coordinate a, Coordinate b) {
        if (isDegenerate(a, b)) {
            return new SegmentProjection(new Coordinate(a), 0.0, p.distance(a));
        }
        LineSegment segment = new LineSegment(a, b);
        double ratio = clamp(segment.projectionFactor(p), 0.0, 1.0);
        Coordinate point = segment.pointAlong(ratio);
        return new SegmentProjection(point, ratio, p.distance(point));
    }

    /**
     * Intersection point of two segments. Collinear overlaps and disjoint segments yield empty.
     */
    public static Optional<Coordinate> intersection(Coordinate a1, Coordinate a2, Coordinate b1, Coordinate b2) {
        if (isDegenerate(a1, a2) || isDegenerate(b1, b2)) {
            return Optional.empty();
        }
        LineIntersector intersector = new RobustLineIntersector();
        intersector.computeIntersection(a1, a2, b1, b2);
        if (intersector.getIntersectionNum() != LineIntersector.POINT_INTERSECTION) {
            return Optional.empty();
        }
        return Optional.of(new Coordinate(intersector.getIntersection(0)));
    }

    /**
     * Builds a polygon from an open or closed ring. Fewer than three distinct points give an empty polygon.
     */
    public static Polygon polygon(List<Coordinate> ring) {
        Set<Coordinate> distinct = new LinkedHashSet<>(ring);
        if (distinct.size() < 3) {
            return FACTORY.createPolygon();
        }
        List<Coordinate> closed = new ArrayList<>(ring.size() + 1);
        for (Coordinate c : ring) {
            closed.add(new Coordinate(c));
        }
        if (!closed.get(0).equals2D(closed.get(closed.size() - 1))) {
            closed.add(new Coordinate(closed.get(0)));
        }
        return FACTORY.createPolygon(closed.toArray(new Coordinate[0]));
    }

    /**
     * Rectangle of the given width centered on segment a-b.
     */
    public static Polygon roadFootprint(Coordinate a, Coordinate b, double width) {
        if (isDegenerate(a, b) || width <= 0.0) {
            return FACTORY.createPolygon();
        }
        double length = a.distance(b);
        double nx = -(b.y - a.y) / length * width / 2.0;
        double ny = (b.x - a.x) / length * width / 2.0;
        List<Coordinate> ring = new ArrayList<>(4);
        ring.add(new Coordinate(a.x + nx, a.y + ny));
        ring.add(new Coordinate(b.x + nx, b.y + ny));
        ring.add(new Coordinate(b.x - nx, b.y - ny));
        ring.add(new Coordinate(a.x - nx, a.y - ny));
        return polygon(ring);
    }

    /**
     * Overlay intersection. Retries once on cleaned inputs when the overlay hits a robustness failure.
     */
    public static Geometry intersection(Geometry a, Geometry b) {
        if (a.isEmpty() || b.isEmpty()) {
            return FACTORY.createPolygon();
        }
        try {
            return a.intersection(b);
        } catch (TopologyException e) {
            LOG.debug("Overlay failed ({}), retrying on buffered inputs", e.getMessage());
            return a.buffer(0).intersection(b.buffer(0));
        }
    }

    public static double area(Geometry geometry) {
        return geometry == null || geometry.isEmpty() ? 0.0 : geometry.getArea();
    }

    public static LineString line(Coordinate a, Coordinate b) {
        return FACTORY.createLineString(new Coordinate[] {new Coordinate(a), new Coordinate(b)});
    }

    /**
     * Length of segment a-b lying inside {@code area}.
     */
    public static double clippedLength(Coordinate a, Coordinate b, Geometry area) {
        if (area == null || area.isEmpty() || isDegenerate(a, b)) {
            return 0.0;
        }
        return intersection(line(a, b), area).getLength();
    }

    /**
     * Clips segment a-b to the envelope. Empty when the segment lies outside.
     */
    public static Optional<Coordinate[]> clip(Coordinate a, Coordinate b, Envelope envelope) {
        Geometry clipped = intersection(line(a, b), FACTORY.toGeometry(envelope));
        if (clipped.isEmpty() || !(clipped instanceof LineString)) {
            return Optional.empty();
        }
        Coordinate[] coords = clipped.getCoordinates();
        Coordinate first = coords[0];
        Coordinate last = coords[coords.length - 1];
        // overlay output may be reversed
        if (first.distance(a) > last.distance(a)) {
            Coordinate swap = first;
            first = last;
            last = swap;
        }
        return Optional.of(new Coordinate[] {new Coordinate(first), new Coordinate(last)});
    }

    /**
     * Convex hull of the points: a polygon, or a line/point when the input is degenerate.
     */
    public static Geometry convexHull(Collection<Coordinate> points) {
        if (points.isEmpty()) {
            return FACTORY.createPolygon();
        }
        return new ConvexHull(points.toArray(new Coordinate[0]), FACTORY).getConvexHull();
    }

    public static List<Coordinate> coordinates(Geometry geometry) {
        List<Coordinate> result = new ArrayList<>();
        for (Coordinate c : geometry.getCoordinates()) {
            result.add(new Coordinate(c));
        }
        return result;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
