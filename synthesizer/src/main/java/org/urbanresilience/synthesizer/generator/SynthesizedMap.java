package org.urbanresilience.synthesizer.generator;

import org.urbanresilience.core.model.MapBoundary;
import org.urbanresilience.core.model.RoadClass;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A synthesized world: its extent and road graph.
 */
public final class SynthesizedMap {

    private final MapBoundary boundary;
    private final RoadGraph graph;

    public SynthesizedMap(MapBoundary boundary, RoadGraph graph) {
        this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
    }

    public MapBoundary getBoundary() {
        return boundary;
    }

    public RoadGraph getGraph() {
        return graph;
    }

    public int getNodeCount() {
        return graph.nodeCount();
    }

    public int getEdgeCount() {
        return graph.edgeCount();
    }

    public Map<RoadClass, Integer> getEdgeCountsByClass() {
        Map<RoadClass, Integer> counts = new EnumMap<>(RoadClass.class);
        for (RoadEdge edge : graph.edges()) {
            counts.merge(edge.getRoadClass(), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    public double getTotalRoadLength() {
        double total = 0.0;
        for (RoadEdge edge : graph.edges()) {
            total += edge.getLength();
        }
        return total;
    }

    @Override
    public String toString() {
        return "SynthesizedMap{" +
                "boundary=" + boundary +
                ", nodes=" + graph.nodeCount() +
                ", edges=" + graph.edgeCount() +
                ", byClass=" + getEdgeCountsByClass() +
                '}';
    }
}
