package org.urbanresilience.simulation.network;

import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a routing query. Unreachable destinations come back as partial results, never as errors.
 */
public final class PathResult {

    private final boolean success;
    private final boolean partial;
    private final PartialReason partialReason;
    private final List<Coordinate> coordinates;
    private final List<Integer> nodeIds;
    private final List<Integer> edgeIds;
    private final double totalDistance;
    private final double travelTime;
    private final VehicleType vehicleType;
    private final List<Integer> obstructedRoads;

    private PathResult(Builder builder) {
        this.success = builder.success;
        this.partial = builder.partialReason != null;
        this.partialReason = builder.partialReason;
        this.coordinates = Collections.unmodifiableList(new ArrayList<>(builder.coordinates));
        this.nodeIds = Collections.unmodifiableList(new ArrayList<>(builder.nodeIds));
        this.edgeIds = Collections.unmodifiableList(new ArrayList<>(builder.edgeIds));
        this.totalDistance = builder.totalDistance;
        this.travelTime = builder.travelTime;
        this.vehicleType = builder.vehicleType;
        this.obstructedRoads = Collections.unmodifiableList(new ArrayList<>(builder.obstructedRoads));
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isPartial() {
        return partial;
    }

    public Optional<PartialReason> getPartialReason() {
        return Optional.ofNullable(partialReason);
    }

    /** Path geometry, including the query points when they lie off the road. */
    public List<Coordinate> getCoordinates() {
        return coordinates;
    }

    /** Persistent road nodes along the path. */
    public List<Integer> getNodeIds() {
        return nodeIds;
    }

    /** Persistent road edges along the path, in travel order without repeats. */
    public List<Integer> getEdgeIds() {
        return edgeIds;
    }

    public double getTotalDistance() {
        return totalDistance;
    }

    /** Estimated travel time in seconds. */
    public double getTravelTime() {
        return travelTime;
    }

    public VehicleType getVehicleType() {
        return vehicleType;
    }

    /** Obstructed roads the path drives through. */
    public List<Integer> getObstructedRoads() {
        return obstructedRoads;
    }

    @Override
    public String toString() {
        return "PathResult{" +
                (success ? "success" : "partial(" + partialReason + ")") +
                ", edges=" + edgeIds.size() +
                ", distance=" + String.format("%.1f", totalDistance) +
                ", time=" + String.format("%.1f", travelTime) +
                '}';
    }

    static final class Builder {
        private boolean success;
        private PartialReason partialReason;
        private List<Coordinate> coordinates = Collections.emptyList();
        private List<Integer> nodeIds = Collections.emptyList();
        private List<Integer> edgeIds = Collections.emptyList();
        private double totalDistance;
        private double travelTime;
        private VehicleType vehicleType;
        private List<Integer> obstructedRoads = Collections.emptyList();

        Builder success() {
            this.success = true;
            this.partialReason = null;
            return this;
        }

        Builder partial(PartialReason reason) {
            this.success = false;
            this.partialReason = reason;
            return this;
        }

        Builder coordinates(List<Coordinate> coordinates) {
            this.coordinates = coordinates;
            return this;
        }

        Builder nodeIds(List<Integer> nodeIds) {
            this.nodeIds = nodeIds;
            return this;
        }

        Builder edgeIds(List<Integer> edgeIds) {
            this.edgeIds = edgeIds;
            return this;
        }

        Builder totalDistance(double totalDistance) {
            this.totalDistance = totalDistance;
            return this;
        }

        Builder travelTime(double travelTime) {
            this.travelTime = travelTime;
            return this;
        }

        Builder vehicleType(VehicleType vehicleType) {
            this.vehicleType = vehicleType;
            return this;
        }

        Builder obstructedRoads(List<Integer> obstructedRoads) {
            this.obstructedRoads = obstructedRoads;
            return this;
        }

        PathResult build() {
            return new PathResult(this);
        }
    }
}
