package org.urbanresilience.simulation.network;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanresilience.core.geometry.GeometryUtils;
import org.urbanresilience.core.geometry.SegmentProjection;
import org.urbanresilience.core.model.NodeKind;
import org.urbanresilience.core.model.RoadClass;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;
import org.urbanresilience.core.model.RoadNode;
import org.urbanresilience.simulation.config.AnalyzerConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Joins arbitrary coordinates to the road network for the duration of an edit scope.
 * Every point gets attached: near a road by snapping or splitting, otherwise by a direct
 * access link to the nearest intersection.
 */
final class PointAttacher {

    private static final Logger log = LoggerFactory.getLogger(PointAttacher.class);

    private final AnalyzerConfig config;

    PointAttacher(AnalyzerConfig config) {
        this.config = config;
    }

    AttachedPoint attach(GraphEditScope scope, Coordinate point) {
        RoadGraph graph = scope.graph();
        RoadEdge nearest = null;
        SegmentProjection best = null;
        // snapshot: the scope mutates the edge map while we split
        List<RoadEdge> candidates = new ArrayList<>(graph.edges());
        for (RoadEdge edge : candidates) {
            if (edge.getRoadClass() == RoadClass.ACCESS) {
                continue;
            }
            SegmentProjection projection = GeometryUtils.project(point,
                    graph.coordinate(edge.getFromNode()), graph.coordinate(edge.getToNode()));
            if (best == null || projection.getDistance() < best.getDistance()) {
                best = projection;
                nearest = edge;
            }
        }

        if (nearest == null || best.getDistance() > config.getSearchRadius()) {
            return forceConnect(scope, point);
        }

        double length = nearest.getLength();
        double fromOffset = best.getRatio() * length;
        double toOffset = (1.0 - best.getRatio()) * length;
        int roadNode;
        AttachedPoint.Mode mode;
        if (Math.min(fromOffset, toOffset) <= Math.max(config.getSnapTolerance(), GeometryUtils.EPSILON)) {
            roadNode = fromOffset <= toOffset ? nearest.getFromNode() : nearest.getToNode();
            mode = AttachedPoint.Mode.SNAPPED;
        } else {
            roadNode = split(scope, nearest, best.getPoint());
            mode = AttachedPoint.Mode.SPLIT;
        }

        RoadNode road = graph.node(roadNode);
        double offRoad = road.distanceTo(point);
        if (offRoad <= config.getAccessTolerance()) {
            log.debug("Attached {} to node {} ({})", point, roadNode, mode);
            return new AttachedPoint(roadNode, roadNode, mode, offRoad);
        }
        int access = link(scope, point, roadNode);
        log.debug("Attached {} to node {} ({}) via access node {}", point, roadNode, mode, access);
        return new AttachedPoint(access, roadNode, mode, offRoad);
    }

    private int split(GraphEditScope scope, RoadEdge edge, Coordinate at) {
        RoadNode virtual = scope.addNode(at, NodeKind.VIRTUAL);
        scope.removeEdge(edge.getId());
        scope.addEdge(edge.derive(edge.getFromNode(), virtual.getId()));
        scope.addEdge(edge.derive(virtual.getId(), edge.getToNode()));
        return virtual.getId();
    }

    private AttachedPoint forceConnect(GraphEditScope scope, Coordinate point) {
        RoadGraph graph = scope.graph();
        RoadNode nearest = null;
        for (RoadNode node : graph.nodes()) {
            if (node.getKind() != NodeKind.INTERSECTION) {
                continue;
            }
            if (nearest == null || node.distanceTo(point) < nearest.distanceTo(point)) {
                nearest = node;
            }
        }
        if (nearest == null) {
            throw new IllegalStateException("Road graph has no intersection to connect " + point + " to");
        }
        log.debug("No road within {} m of {}, forcing link to node {}", config.getSearchRadius(), point,
                nearest.getId());
        double distance = nearest.distanceTo(point);
        if (distance <= config.getAccessTolerance()) {
            return new AttachedPoint(nearest.getId(), nearest.getId(), AttachedPoint.Mode.FORCED, distance);
        }
        int access = link(scope, point, nearest.getId());
        return new AttachedPoint(access, nearest.getId(), AttachedPoint.Mode.FORCED, distance);
    }

    private int link(GraphEditScope scope, Coordinate point, int roadNode) {
        RoadNode access = scope.addNode(point, NodeKind.ACCESS);
        scope.addEdge(new RoadEdge.Builder()
                .between(access.getId(), roadNode)
                .width(config.getAccessWidth())
                .lanes(1)
                .bidirectional(true)
                .roadClass(RoadClass.ACCESS)
                .speedLimitKmh(config.getAccessSpeedKmh()));
        return access.getId();
    }
}
