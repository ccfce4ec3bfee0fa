package org.urbanresilience.simulation.disaster;

import org.urbanresilience.simulation.config.DisasterConfig;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one disaster run produced.
 */
public final class DisasterSimulationResult {

    private final String simulationId;
    private final Instant timestamp;
    private final DisasterConfig config;
    private final List<TreeCollapseEvent> events;
    private final List<RoadObstruction> obstructions;
    private final SimulationStatistics statistics;

    public DisasterSimulationResult(String simulationId, Instant timestamp, DisasterConfig config,
                                    List<TreeCollapseEvent> events, List<RoadObstruction> obstructions,
                                    SimulationStatistics statistics) {
        this.simulationId = simulationId;
        this.timestamp = timestamp;
        this.config = config;
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
        this.obstructions = Collections.unmodifiableList(new ArrayList<>(obstructions));
        this.statistics = statistics;
    }

    public String getSimulationId() {
        return simulationId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public DisasterConfig getConfig() {
        return config;
    }

    public List<TreeCollapseEvent> getEvents() {
        return events;
    }

    public List<RoadObstruction> getObstructions() {
        return obstructions;
    }

    public SimulationStatistics getStatistics() {
        return statistics;
    }
}
