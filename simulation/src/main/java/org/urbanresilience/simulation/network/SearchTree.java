package org.urbanresilience.simulation.network;

import org.urbanresilience.core.model.RoadEdge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Labels left behind by a best-first search: settled nodes in settle order and the edge that
 * reached each of them.
 */
final class SearchTree {

    private final int source;
    private final Map<Integer, Double> settled = new LinkedHashMap<>();
    private final Map<Integer, RoadEdge> parentEdge = new HashMap<>();
    private final Map<Integer, Integer> parentNode = new HashMap<>();
    private boolean pruned;
    private boolean limitReached;

    SearchTree(int source) {
        this.source = source;
    }

    int getSource() {
        return source;
    }

    void settle(int node, double cost) {
        settled.put(node, cost);
    }

    void label(int node, int parent, RoadEdge via) {
        parentNode.put(node, parent);
        parentEdge.put(node, via);
    }

    void markPruned() {
        pruned = true;
    }

    void markLimitReached() {
        limitReached = true;
    }

    boolean isSettled(int node) {
        return settled.containsKey(node);
    }

    /** Settled nodes with their cost, in the order they were settled. */
    Map<Integer, Double> getSettled() {
        return Collections.unmodifiableMap(settled);
    }

    /** True when labels above a cost ceiling were dropped. */
    boolean isPruned() {
        return pruned;
    }

    boolean isLimitReached() {
        return limitReached;
    }

    RoutePath pathTo(int target) {
        Double cost = settled.get(target);
        if (cost == null) {
            throw new IllegalStateException("Node " + target + " was not settled");
        }
        List<Integer> nodes = new ArrayList<>();
        List<RoadEdge> edges = new ArrayList<>();
        int current = target;
        nodes.add(current);
        while (current != source) {
            RoadEdge edge = parentEdge.get(current);
            Integer parent = parentNode.get(current);
            if (edge == null || parent == null) {
                throw new IllegalStateException("Broken parent chain at node " + current);
            }
            edges.add(edge);
            current = parent;
            nodes.add(current);
        }
        Collections.reverse(nodes);
        Collections.reverse(edges);
        return new RoutePath(nodes, edges, cost);
    }
}
