package org.urbanresilience.simulation.network;

import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;

import java.util.HashMap;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * One-to-all travel times from a source, bounded by a time budget and a settle count.
 */
final class DijkstraSearch {

    private final RoadGraph graph;
    private final EdgeCostModel costModel;
    private final VehicleProfile vehicle;

    DijkstraSearch(RoadGraph graph, EdgeCostModel costModel, VehicleProfile vehicle) {
        this.graph = graph;
        this.costModel = costModel;
        this.vehicle = vehicle;
    }

    /**
     * @param budget     labels costing more than this are dropped; use infinity for none
     * @param settleLimit maximum number of nodes to settle
     */
    SearchTree run(int source, double budget, int settleLimit) {
        SearchTree tree = new SearchTree(source);
        Map<Integer, Double> best = new HashMap<>();
        PriorityQueue<QueueEntry> queue = new PriorityQueue<>(QueueEntry.ORDER);
        long sequence = 0;

        best.put(source, 0.0);
        queue.add(new QueueEntry(source, 0.0, 0.0, sequence++));

        while (!queue.isEmpty()) {
            QueueEntry entry = queue.poll();
            if (tree.isSettled(entry.node) || entry.cost > best.get(entry.node)) {
                continue;
            }
            if (tree.getSettled().size() >= settleLimit) {
                tree.markLimitReached();
                break;
            }
            tree.settle(entry.node, entry.cost);

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
                if (next > budget) {
                    tree.markPruned();
                    continue;
                }
                Double known = best.get(neighbor);
                if (known == null || next < known) {
                    best.put(neighbor, next);
                    tree.label(neighbor, entry.node, edge);
                    queue.add(new QueueEntry(neighbor, next, next, sequence++));
                }
            }
        }
        return tree;
    }
}
