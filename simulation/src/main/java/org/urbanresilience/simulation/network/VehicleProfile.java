package org.urbanresilience.simulation.network;

import java.util.Objects;

/**
 * Physical constraints of a vehicle moving through the network.
 */
public final class VehicleProfile {

    private final VehicleType type;
    private final double width;
    private final double length;
    private final double maxSpeedKmh;
    private final double minimumRoadWidth;
    private final boolean sidewalkAllowed;

    private VehicleProfile(Builder builder) {
        this.type = builder.type;
        this.width = builder.width;
        this.length = builder.length;
        this.maxSpeedKmh = builder.maxSpeedKmh;
        this.minimumRoadWidth = builder.minimumRoadWidth;
        this.sidewalkAllowed = builder.sidewalkAllowed;
    }

    /**
     * Builder pre-filled with the defaults of {@code type}.
     */
    public static Builder builder(VehicleType type) {
        return new Builder(type);
    }

    public VehicleType getType() {
        return type;
    }

    public double getWidth() {
        return width;
    }

    public double getLength() {
        return length;
    }

    public double getMaxSpeedKmh() {
        return maxSpeedKmh;
    }

    public double getMinimumRoadWidth() {
        return minimumRoadWidth;
    }

    public boolean isSidewalkAllowed() {
        return sidewalkAllowed;
    }

    @Override
    public String toString() {
        return "VehicleProfile{" +
                "type=" + type +
                ", width=" + width +
                ", maxSpeed=" + maxSpeedKmh +
                ", minRoadWidth=" + minimumRoadWidth +
                '}';
    }

    /**
     * Builder for VehicleProfile.
     */
    public static final class Builder {
        private final VehicleType type;
        private double width;
        private double length;
        private double maxSpeedKmh;
        private double minimumRoadWidth;
        private boolean sidewalkAllowed;

        private Builder(VehicleType type) {
            this.type = Objects.requireNonNull(type, "type must not be null");
            this.width = type.width();
            this.length = type.length();
            this.maxSpeedKmh = type.maxSpeedKmh();
            this.minimumRoadWidth = type.minimumRoadWidth();
            this.sidewalkAllowed = type.sidewalkAllowed();
        }

        public Builder width(double width) {
            this.width = positive("width", width);
            return this;
        }

        public Builder length(double length) {
            this.length = positive("length", length);
            return this;
        }

        public Builder maxSpeedKmh(double maxSpeedKmh) {
            this.maxSpeedKmh = positive("maxSpeedKmh", maxSpeedKmh);
            return this;
        }

        public Builder minimumRoadWidth(double minimumRoadWidth) {
            this.minimumRoadWidth = positive("minimumRoadWidth", minimumRoadWidth);
            return this;
        }

        public Builder sidewalkAllowed(boolean sidewalkAllowed) {
            this.sidewalkAllowed = sidewalkAllowed;
            return this;
        }

        public VehicleProfile build() {
            if (minimumRoadWidth < width) {
                throw new IllegalArgumentException("minimumRoadWidth must not be smaller than the vehicle width");
            }
            return new VehicleProfile(this);
        }

        private static double positive(String name, double value) {
            if (!(value > 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
