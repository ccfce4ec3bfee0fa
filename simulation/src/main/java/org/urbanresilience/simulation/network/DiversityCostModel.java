package org.urbanresilience.simulation.network;

import org.urbanresilience.core.model.RoadEdge;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Makes roads already used by earlier routes more expensive, pushing the search onto other streets.
 */
final class DiversityCostModel implements EdgeCostModel {

    private final EdgeCostModel base;
    private final Set<Integer> usedOrigins;
    private final double factor;

    DiversityCostModel(EdgeCostModel base, Set<Integer> usedOrigins, double factor) {
        this.base = base;
        this.usedOrigins = Collections.unmodifiableSet(new HashSet<>(usedOrigins));
        this.factor = factor;
    }

    @Override
    public double cost(RoadEdge edge, VehicleProfile vehicle) {
        double cost = base.cost(edge, vehicle);
        return usedOrigins.contains(edge.getOriginEdgeId()) ? cost * factor : cost;
    }

    @Override
    public boolean isPassable(RoadEdge edge, VehicleProfile vehicle) {
        return base.isPassable(edge, vehicle);
    }
}
