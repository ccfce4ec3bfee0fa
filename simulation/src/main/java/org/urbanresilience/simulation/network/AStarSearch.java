package org.urbanresilience.simulation.network;

import org.locationtech.jts.geom.Coordinate;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;

import java.util.HashMap;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Point-to-point travel-time search.
 * <p>
 * The heuristic is straight-line distance over the fastest speed the vehicle reaches anywhere
 * in the graph, which never overestimates and keeps results identical to Dijkstra.
 */
final class AStarSearch {

    private final RoadGraph graph;
    private final EdgeCostModel costModel;
    private final VehicleProfile vehicle;
    private final int maxExpansions;
    private final double maxSpeed;

    AStarSearch(RoadGraph graph, EdgeCostModel costModel, VehicleProfile vehicle, int maxExpansions) {
        this.graph = graph;
        this.costModel = costModel;
        this.vehicle = vehicle;
        this.maxExpansions = maxExpansions;
        this.maxSpeed = fastestSpeed();
    }

    /**
     * @param ceiling labels costing more than this are dropped; use infinity for none
     * @return the search tree; the goal is settled iff a complete path was found
     */
    SearchTree search(int start, int goal, double ceiling) {
        SearchTree tree = new SearchTree(start);
        Coordinate target = graph.coordinate(goal);
        Map<Integer, Double> best = new HashMap<>();
        PriorityQueue<QueueEntry> open = new PriorityQueue<>(QueueEntry.ORDER);
        long sequence = 0;
        int expansions = 0;

        best.put(start, 0.0);
        open.add(new QueueEntry(start, 0.0, heuristic(start, target), sequence++));

        while (!open.isEmpty()) {
            QueueEntry entry = open.poll();
            if (tree.isSettled(entry.node) || entry.cost > best.get(entry.node)) {
                continue;
            }
            tree.settle(entry.node, entry.cost);
            if (entry.node == goal) {
                return tree;
            }
            if (++expansions >= maxExpansions) {
                tree.markLimitReached();
                return tree;
            }

            for (RoadEdge edge : graph.edgesAt(entry.node)) {
                int neighbor = edge.opposite(entry.node);
                if (tree.isSettled(neighbor)) {
                    continue;
                }
                double step = costModel.cost(edge, vehicle);
                if (!Double.isFinite(step)) {
                    continue;
                }
                double next = entry.cost + step;
                if (next > ceiling) {
                    tree.markPruned();
                    continue;
                }
                Double known = best.get(neighbor);
                if (known == null || next < known) {
                    best.put(neighbor, next);
                    tree.label(neighbor, entry.node, edge);
                    open.add(new QueueEntry(neighbor, next, next + heuristic(neighbor, target), sequence++));
                }
            }
        }
        return tree;
    }

    private double heuristic(int node, Coordinate target) {
        if (maxSpeed <= 0) {
            return 0.0;
        }
        return graph.coordinate(node).distance(target) / maxSpeed;
    }

    private double fastestSpeed() {
        double fastest = 0.0;
        for (RoadEdge edge : graph.edges()) {
            fastest = Math.max(fastest, costModel.effectiveSpeed(edge, vehicle));
        }
        return fastest;
    }
}
