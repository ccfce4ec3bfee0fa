package org.urbanresilience.core.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Connected components of a road graph restricted to the edges accepted by a filter.
 */
public final class GraphComponents {

    private final List<List<Integer>> components;

    private GraphComponents(List<List<Integer>> components) {
        this.components = components;
    }

    /**
     * Breadth-first component search over every node. Nodes whose edges are all filtered out form
     * singleton components. Components are ordered largest first, ties by smallest node id.
     */
    public static GraphComponents of(RoadGraph graph, Predicate<RoadEdge> traversable) {
        Set<Integer> visited = new HashSet<>();
        List<List<Integer>> result = new ArrayList<>();
        for (RoadNode start : graph.nodes()) {
            if (!visited.add(start.getId())) {
                continue;
            }
            List<Integer> component = new ArrayList<>();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start.getId());
            while (!queue.isEmpty()) {
                int current = queue.poll();
                component.add(current);
                for (RoadEdge edge : graph.edgesAt(current)) {
                    if (!traversable.test(edge)) {
                        continue;
                    }
                    int neighbor = edge.opposite(current);
                    if (visited.add(neighbor)) {
                        queue.add(neighbor);
                    }
                }
            }
            Collections.sort(component);
            result.add(Collections.unmodifiableList(component));
        }
        result.sort((a, b) -> a.size() != b.size()
                ? Integer.compare(b.size(), a.size())
                : Integer.compare(a.get(0), b.get(0)));
        return new GraphComponents(Collections.unmodifiableList(result));
    }

    public static GraphComponents of(RoadGraph graph) {
        return of(graph, edge -> true);
    }

    public List<List<Integer>> getComponents() {
        return components;
    }

    public int count() {
        return components.size();
    }

    public int largestSize() {
        return components.isEmpty() ? 0 : components.get(0).size();
    }

    public boolean isConnected() {
        return components.size() <= 1;
    }
}
