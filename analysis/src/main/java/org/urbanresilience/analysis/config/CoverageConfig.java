package org.urbanresilience.analysis.config;

import org.urbanresilience.core.config.EnvironmentReader;
import org.urbanresilience.simulation.network.VehicleType;

import java.util.Objects;

/**
 * Immutable configuration for emergency service coverage analysis.
 */
public final class CoverageConfig {

    public static final double DEFAULT_GRID_SIZE = 100.0;
    public static final double DEFAULT_MAX_RESPONSE_TIME = 900.0;
    public static final VehicleType DEFAULT_VEHICLE = VehicleType.AMBULANCE;

    private final double gridSizeMeters;
    private final double maxResponseTimeSeconds;
    private final VehicleType vehicleType;

    private CoverageConfig(Builder builder) {
        this.gridSizeMeters = builder.gridSizeMeters;
        this.maxResponseTimeSeconds = builder.maxResponseTimeSeconds;
        this.vehicleType = builder.vehicleType;
    }

    public static CoverageConfig defaults() {
        return new Builder().build();
    }

    /**
     * Creates configuration from environment variables.
     */
    public static CoverageConfig fromEnvironment() {
        return fromEnvironment(EnvironmentReader.system());
    }

    public static CoverageConfig fromEnvironment(EnvironmentReader env) {
        return new Builder()
                .gridSizeMeters(env.getDouble("COVERAGE_GRID_SIZE", DEFAULT_GRID_SIZE))
                .maxResponseTimeSeconds(env.getDouble("COVERAGE_MAX_RESPONSE_TIME", DEFAULT_MAX_RESPONSE_TIME))
                .vehicleType(VehicleType.valueOf(env.get("COVERAGE_VEHICLE", DEFAULT_VEHICLE.name()).trim().toUpperCase()))
                .build();
    }

    public double getGridSizeMeters() {
        return gridSizeMeters;
    }

    public double getMaxResponseTimeSeconds() {
        return maxResponseTimeSeconds;
    }

    public VehicleType getVehicleType() {
        return vehicleType;
    }

    @Override
    public String toString() {
        return "CoverageConfig{" +
                "gridSizeMeters=" + gridSizeMeters +
                ", maxResponseTimeSeconds=" + maxResponseTimeSeconds +
                ", vehicleType=" + vehicleType +
                '}';
    }

    /**
     * Builder for CoverageConfig.
     */
    public static final class Builder {
        private double gridSizeMeters = DEFAULT_GRID_SIZE;
        private double maxResponseTimeSeconds = DEFAULT_MAX_RESPONSE_TIME;
        private VehicleType vehicleType = DEFAULT_VEHICLE;

        public Builder gridSizeMeters(double gridSizeMeters) {
            if (!(gridSizeMeters > 0) || Double.isInfinite(gridSizeMeters)) {
                throw new IllegalArgumentException("gridSizeMeters must be positive");
            }
            this.gridSizeMeters = gridSizeMeters;
            return this;
        }

        public Builder maxResponseTimeSeconds(double maxResponseTimeSeconds) {
            if (!(maxResponseTimeSeconds > 0) || Double.isInfinite(maxResponseTimeSeconds)) {
                throw new IllegalArgumentException("maxResponseTimeSeconds must be positive");
            }
            this.maxResponseTimeSeconds = maxResponseTimeSeconds;
            return this;
        }

        public Builder vehicleType(VehicleType vehicleType) {
            this.vehicleType = Objects.requireNonNull(vehicleType, "vehicleType must not be null");
            return this;
        }

        public CoverageConfig build() {
            return new CoverageConfig(this);
        }
    }
}
