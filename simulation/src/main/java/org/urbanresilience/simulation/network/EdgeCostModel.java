package org.urbanresilience.simulation.network;

import org.urbanresilience.core.model.RoadEdge;

/**
 * Traversal cost of an edge in seconds.
 */
public interface EdgeCostModel {

    /**
     * @return seconds to traverse, or {@link Double#POSITIVE_INFINITY} when the vehicle cannot pass
     */
    double cost(RoadEdge edge, VehicleProfile vehicle);

    default boolean isPassable(RoadEdge edge, VehicleProfile vehicle) {
        return edge.getCurrentWidth() >= vehicle.getMinimumRoadWidth();
    }

    /**
     * Fastest speed in m/s the vehicle can reach on {@code edge}, ignoring penalties.
     */
    default double effectiveSpeed(RoadEdge edge, VehicleProfile vehicle) {
        return Math.min(edge.getSpeedLimitKmh(), vehicle.getMaxSpeedKmh()) / 3.6;
    }
}
