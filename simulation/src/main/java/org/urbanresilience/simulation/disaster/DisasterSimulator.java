package org.urbanresilience.simulation.disaster;

import org.urbanresilience.core.model.RoadGraph;

import java.util.Collection;

/**
 * Turns a tree inventory and a road layout into collapse events and road obstructions.
 */
public interface DisasterSimulator {

    DisasterSimulationResult simulate(Collection<TreeRecord> trees, Collection<RoadFootprint> roads);

    /**
     * Simulates against every edge of {@code graph}.
     */
    default DisasterSimulationResult simulate(Collection<TreeRecord> trees, RoadGraph graph) {
        return simulate(trees, RoadFootprint.fromGraph(graph));
    }
}
