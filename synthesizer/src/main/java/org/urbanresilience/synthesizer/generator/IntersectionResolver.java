package org.urbanresilience.synthesizer.generator;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanresilience.core.geometry.GeometryUtils;
import org.urbanresilience.core.model.NodeKind;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;
import org.urbanresilience.core.model.RoadNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns independently placed road segments into a planar graph.
 *
 * Every point where two edges cross becomes a shared node, and each crossed edge is replaced by
 * consecutive sub-edges that keep all of its attributes. A crossing within the tolerance of an
 * existing node reuses that node, so a road ending on another road joins it at its own endpoint.
 * Stubs shorter than the tolerance are dropped, and nodes left without edges are pruned.
 */
public final class IntersectionResolver {

    private static final Logger LOG = LoggerFactory.getLogger(IntersectionResolver.class);

    private final double tolerance;

    public IntersectionResolver(double tolerance) {
        if (tolerance <= 0) {
            throw new IllegalArgumentException("tolerance must be positive");
        }
        this.tolerance = tolerance;
    }

    /**
     * Resolves all crossings in place.
     *
     * @return number of distinct crossing nodes used for splitting
     */
    public int resolve(RoadGraph graph) {
        List<RoadEdge> edges = new ArrayList<>(graph.edges());
        Set<Integer> crossingNodes = new LinkedHashSet<>();
        Map<Integer, List<Crossing>> crossingsByEdge = new LinkedHashMap<>();

        for (int i = 0; i < edges.size(); i++) {
            RoadEdge first = edges.get(i);
            Coordinate a1 = graph.coordinate(first.getFromNode());
            Coordinate a2 = graph.coordinate(first.getToNode());
            for (int j = i + 1; j < edges.size(); j++) {
                RoadEdge second = edges.get(j);
                if (sharesEndpoint(first, second)) {
                    continue;
                }
                Coordinate b1 = graph.coordinate(second.getFromNode());
                Coordinate b2 = graph.coordinate(second.getToNode());
                Optional<Coordinate> point = GeometryUtils.intersection(a1, a2, b1, b2);
                if (!point.isPresent()) {
                    continue;
                }
                RoadNode node = crossingNode(graph, round(point.get()));
                crossingNodes.add(node.getId());
                addCrossing(crossingsByEdge, first.getId(), node, a1, a2);
                addCrossing(crossingsByEdge, second.getId(), node, b1, b2);
            }
        }

        int split = 0;
        for (Map.Entry<Integer, List<Crossing>> entry : crossingsByEdge.entrySet()) {
            splitEdge(graph, graph.edge(entry.getKey()), entry.getValue());
            split++;
        }
        int pruned = graph.pruneIsolatedNodes();
        LOG.info("[Synthesizer] Resolved {} crossings on {} edges, pruned {} dangling nodes",
                crossingNodes.size(), split, pruned);
        return crossingNodes.size();
    }

    private static boolean sharesEndpoint(RoadEdge a, RoadEdge b) {
        return a.touches(b.getFromNode()) || a.touches(b.getToNode());
    }

    private RoadNode crossingNode(RoadGraph graph, Coordinate point) {
        RoadNode nearest = null;
        double best = tolerance;
        for (RoadNode node : graph.nodes()) {
            double distance = node.distanceTo(point);
            if (distance < best) {
                best = distance;
                nearest = node;
            }
        }
        return nearest != null ? nearest : graph.addNode(point, NodeKind.INTERSECTION);
    }

    private static void addCrossing(Map<Integer, List<Crossing>> crossings, int edgeId, RoadNode node,
                                    Coordinate from, Coordinate to) {
        List<Crossing> list = crossings.computeIfAbsent(edgeId, id -> new ArrayList<>());
        for (Crossing crossing : list) {
            if (crossing.nodeId == node.getId()) {
                return;
            }
        }
        double ratio = GeometryUtils.project(node.getCoordinate(), from, to).getRatio();
        list.add(new Crossing(node.getId(), ratio));
    }

    private void splitEdge(RoadGraph graph, RoadEdge edge, List<Crossing> crossings) {
        crossings.sort(Comparator.comparingDouble((Crossing c) -> c.ratio).thenComparingInt(c -> c.nodeId));

        List<Integer> chain = new ArrayList<>(crossings.size() + 2);
        chain.add(edge.getFromNode());
        for (Crossing crossing : crossings) {
            chain.add(crossing.nodeId);
        }
        chain.add(edge.getToNode());

        graph.removeEdge(edge.getId());
        int current = chain.get(0);
        for (int k = 1; k < chain.size(); k++) {
            int next = chain.get(k);
            if (next == current) {
                continue;
            }
            double length = graph.node(current).distanceTo(graph.coordinate(next));
            if (length < tolerance) {
                // stub at a road end: continue from the crossing node, the old endpoint is pruned later
                if (k == chain.size() - 1) {
                    continue;
                }
                current = next;
                continue;
            }
            graph.addEdge(edge.derive(current, next).originEdgeId(RoadEdge.SELF_ORIGIN));
            current = next;
        }
    }

    private static Coordinate round(Coordinate point) {
        return new Coordinate(Math.round(point.x * 100.0) / 100.0, Math.round(point.y * 100.0) / 100.0);
    }

    private static final class Crossing {
        final int nodeId;
        final double ratio;

        Crossing(int nodeId, double ratio) {
            this.nodeId = nodeId;
            this.ratio = ratio;
        }
    }
}
