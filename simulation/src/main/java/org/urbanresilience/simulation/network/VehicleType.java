package org.urbanresilience.simulation.network;

/**
 * Vehicle classes with their default dimensions.
 */
public enum VehicleType {
    PEDESTRIAN(0.6, 0.6, 5.0, 0.8, true),
    MOTORCYCLE(0.8, 2.0, 60.0, 1.2, false),
    CAR(1.8, 4.5, 50.0, 2.2, false),
    AMBULANCE(2.5, 7.0, 80.0, 3.0, false),
    FIRE_TRUCK(3.0, 12.0, 60.0, 3.5, false);

    private final double width;
    private final double length;
    private final double maxSpeedKmh;
    private final double minimumRoadWidth;
    private final boolean sidewalkAllowed;

    VehicleType(double width, double length, double maxSpeedKmh, double minimumRoadWidth, boolean sidewalkAllowed) {
        this.width = width;
        this.length = length;
        this.maxSpeedKmh = maxSpeedKmh;
        this.minimumRoadWidth = minimumRoadWidth;
        this.sidewalkAllowed = sidewalkAllowed;
    }

    public VehicleProfile defaultProfile() {
        return VehicleProfile.builder(this).build();
    }

    double width() {
        return width;
    }

    double length() {
        return length;
    }

    double maxSpeedKmh() {
        return maxSpeedKmh;
    }

    double minimumRoadWidth() {
        return minimumRoadWidth;
    }

    boolean sidewalkAllowed() {
        return sidewalkAllowed;
    }
}
