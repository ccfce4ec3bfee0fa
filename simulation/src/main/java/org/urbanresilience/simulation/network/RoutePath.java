package org.urbanresilience.simulation.network;

import org.urbanresilience.core.model.RoadEdge;

import java.util.Collections;
import java.util.List;

/**
 * Node and edge sequence found by a search, with its accumulated cost.
 */
final class RoutePath {

    private final List<Integer> nodes;
    private final List<RoadEdge> edges;
    private final double cost;

    RoutePath(List<Integer> nodes, List<RoadEdge> edges, double cost) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.edges = Collections.unmodifiableList(edges);
        this.cost = cost;
    }

    List<Integer> getNodes() {
        return nodes;
    }

    List<RoadEdge> getEdges() {
        return edges;
    }

    double getCost() {
        return cost;
    }

    int lastNode() {
        return nodes.get(nodes.size() - 1);
    }
}
