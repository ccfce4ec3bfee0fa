package org.urbanresilience.synthesizer.generator;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanresilience.core.geometry.GeometryUtils;
import org.urbanresilience.core.model.MapBoundary;
import org.urbanresilience.core.model.NodeKind;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;
import org.urbanresilience.core.model.RoadNode;
import org.urbanresilience.synthesizer.config.SynthesizerConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Places the arterial grid: evenly spaced vertical and horizontal main roads, then diagonal ones.
 */
public final class MainRoadLayout {

    private static final Logger LOG = LoggerFactory.getLogger(MainRoadLayout.class);

    private static final double[] DIAGONAL_BASE_ANGLES = {30.0, 150.0, 210.0, 330.0};
    private static final double DIAGONAL_ANGLE_JITTER = 10.0;
    private static final double DIAGONAL_OVERSHOOT = 1.2;

    private final SynthesizerConfig config;
    private final MapBoundary boundary;

    public MainRoadLayout(SynthesizerConfig config, MapBoundary boundary) {
        this.config = config;
        this.boundary = boundary;
    }

    /** x positions of the vertical main roads, ascending. */
    public List<Double> verticalPositions() {
        return evenlySpaced(boundary.getMinX(), boundary.width(), config.getMainRoadCount() / 2);
    }

    /** y positions of the horizontal main roads, ascending. */
    public List<Double> horizontalPositions() {
        return evenlySpaced(boundary.getMinY(), boundary.height(), config.getMainRoadCount() / 2);
    }

    private static List<Double> evenlySpaced(double origin, double extent, int count) {
        List<Double> positions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            positions.add(origin + (i + 1) * extent / (count + 1));
        }
        return positions;
    }

    /**
     * Adds the straight arteries, each spanning the map inside the edge margin.
     */
    public List<RoadEdge> layStraightRoads(RoadGraph graph) {
        double margin = config.getEdgeMargin();
        List<RoadEdge> roads = new ArrayList<>();
        for (double x : verticalPositions()) {
            roads.add(addRoad(graph,
                    new Coordinate(x, boundary.getMinY() + margin),
                    new Coordinate(x, boundary.getMaxY() - margin)));
        }
        for (double y : horizontalPositions()) {
            roads.add(addRoad(graph,
                    new Coordinate(boundary.getMinX() + margin, y),
                    new Coordinate(boundary.getMaxX() - margin, y)));
        }
        LOG.debug("[Synthesizer] Laid {} straight main roads", roads.size());
        return roads;
    }

    /**
     * Adds diagonal arteries entering from the left or right map edge, clipped to the boundary.
     */
    public List<RoadEdge> layDiagonalRoads(RoadGraph graph, Random random) {
        int min = config.getMinDiagonalRoads();
        int count = min + random.nextInt(config.getMaxDiagonalRoads() - min + 1);
        List<RoadEdge> roads = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double angle = DIAGONAL_BASE_ANGLES[random.nextInt(DIAGONAL_BASE_ANGLES.length)]
                    + uniform(random, -DIAGONAL_ANGLE_JITTER, DIAGONAL_ANGLE_JITTER);
            double radians = Math.toRadians(angle);
            double dx = Math.cos(radians);
            double dy = Math.sin(radians);

            boolean headingRight = dx > 0;
            double startX = headingRight ? boundary.getMinX() : boundary.getMaxX();
            double startY = boundary.getMinY() + uniform(random, 0.3, 0.7) * boundary.height();
            double length = Math.abs(dx) > Math.abs(dy)
                    ? boundary.width() / Math.abs(dx)
                    : boundary.height() / Math.abs(dy);
            length *= DIAGONAL_OVERSHOOT;

            Coordinate start = new Coordinate(startX, startY);
            Coordinate end = new Coordinate(startX + dx * length, startY + dy * length);
            Optional<Coordinate[]> clipped = GeometryUtils.clip(start, end, boundary.toEnvelope());
            if (!clipped.isPresent()) {
                LOG.debug("[Synthesizer] Diagonal road at {} degrees fell outside the map", angle);
                continue;
            }
            Coordinate[] ends = {clamp(clipped.get()[0]), clamp(clipped.get()[1])};
            if (ends[0].distance(ends[1]) < config.getMinRoadLength()) {
                continue;
            }
            roads.add(addRoad(graph, ends[0], ends[1]));
        }
        LOG.debug("[Synthesizer] Laid {} diagonal main roads", roads.size());
        return roads;
    }

    private Coordinate clamp(Coordinate c) {
        return new Coordinate(
                GeometryUtils.clamp(c.x, boundary.getMinX(), boundary.getMaxX()),
                GeometryUtils.clamp(c.y, boundary.getMinY(), boundary.getMaxY()));
    }

    private RoadEdge addRoad(RoadGraph graph, Coordinate from, Coordinate to) {
        RoadNode a = graph.addNode(from, NodeKind.INTERSECTION);
        RoadNode b = graph.addNode(to, NodeKind.INTERSECTION);
        return graph.addEdge(config.getMainRoad().edge(a.getId(), b.getId(), true));
    }

    static double uniform(Random random, double min, double max) {
        return min + random.nextDouble() * (max - min);
    }
}
