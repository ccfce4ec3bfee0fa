package org.urbanresilience.simulation.network;

import org.locationtech.jts.geom.Coordinate;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A routing query between two plane coordinates.
 */
public final class PathRequest {

    private final Coordinate start;
    private final Coordinate end;
    private final VehicleProfile vehicle;
    private final Double maxTravelTime;

    private PathRequest(Coordinate start, Coordinate end, VehicleProfile vehicle, Double maxTravelTime) {
        this.start = new Coordinate(Objects.requireNonNull(start, "start must not be null"));
        this.end = new Coordinate(Objects.requireNonNull(end, "end must not be null"));
        this.vehicle = Objects.requireNonNull(vehicle, "vehicle must not be null");
        if (maxTravelTime != null && !(maxTravelTime > 0)) {
            throw new IllegalArgumentException("maxTravelTime must be positive");
        }
        this.maxTravelTime = maxTravelTime;
    }

    public static PathRequest of(Coordinate start, Coordinate end, VehicleProfile vehicle) {
        return new PathRequest(start, end, vehicle, null);
    }

    public static PathRequest of(Coordinate start, Coordinate end, VehicleType type) {
        return of(start, end, type.defaultProfile());
    }

    public PathRequest withMaxTravelTime(double seconds) {
        return new PathRequest(start, end, vehicle, seconds);
    }

    public Coordinate getStart() {
        return new Coordinate(start);
    }

    public Coordinate getEnd() {
        return new Coordinate(end);
    }

    public VehicleProfile getVehicle() {
        return vehicle;
    }

    public OptionalDouble getMaxTravelTime() {
        return maxTravelTime == null ? OptionalDouble.empty() : OptionalDouble.of(maxTravelTime);
    }

    double ceiling() {
        return maxTravelTime == null ? Double.POSITIVE_INFINITY : maxTravelTime;
    }

    @Override
    public String toString() {
        return "PathRequest{" + start + " -> " + end + ", vehicle=" + vehicle.getType()
                + (maxTravelTime != null ? ", maxTravelTime=" + maxTravelTime : "") + '}';
    }
}
