package org.urbanresilience.simulation.network;

import org.urbanresilience.core.model.RoadEdge;

/**
 * Free-flow travel time, slowed down on narrowed roads.
 */
public final class TravelTimeCostModel implements EdgeCostModel {

    static final double TIGHT_FIT_FACTOR = 1.2;

    @Override
    public double cost(RoadEdge edge, VehicleProfile vehicle) {
        if (!isPassable(edge, vehicle)) {
            return Double.POSITIVE_INFINITY;
        }
        double seconds = edge.getLength() / effectiveSpeed(edge, vehicle);
        if (vehicle.isSidewalkAllowed()) {
            return seconds;
        }
        return seconds * widthPenalty(edge.widthRatio(), edge.getCurrentWidth(), vehicle.getMinimumRoadWidth());
    }

    /**
     * Multiplier for a road narrowed to {@code ratio} of its original width.
     */
    static double widthPenalty(double ratio, double currentWidth, double minimumRoadWidth) {
        if (ratio >= 0.9) {
            return currentWidth < TIGHT_FIT_FACTOR * minimumRoadWidth ? 1.3 : 1.0;
        }
        if (ratio >= 0.7) {
            return 1.5;
        }
        if (ratio >= 0.5) {
            return 2.0;
        }
        return 3.0;
    }
}
