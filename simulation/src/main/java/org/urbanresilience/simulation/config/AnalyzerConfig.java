package org.urbanresilience.simulation.config;

import org.urbanresilience.core.config.EnvironmentReader;

/**
 * Tuning for point attachment and search limits of the network analyzer.
 */
public final class AnalyzerConfig {

    public static final double DEFAULT_SEARCH_RADIUS = 200.0;
    public static final double DEFAULT_SNAP_TOLERANCE = 12.0;
    public static final double DEFAULT_ACCESS_TOLERANCE = 1.0;
    public static final double DEFAULT_ACCESS_SPEED_KMH = 5.0;
    public static final double DEFAULT_ACCESS_WIDTH = 10.0;
    public static final int DEFAULT_MAX_EXPANSIONS = 1000;
    public static final int DEFAULT_PARTIAL_SEARCH_LIMIT = 5000;

    private final double searchRadius;
    private final double snapTolerance;
    private final double accessTolerance;
    private final double accessSpeedKmh;
    private final double accessWidth;
    private final int maxExpansions;
    private final int partialSearchLimit;

    private AnalyzerConfig(Builder builder) {
        this.searchRadius = builder.searchRadius;
        this.snapTolerance = builder.snapTolerance;
        this.accessTolerance = builder.accessTolerance;
        this.accessSpeedKmh = builder.accessSpeedKmh;
        this.accessWidth = builder.accessWidth;
        this.maxExpansions = builder.maxExpansions;
        this.partialSearchLimit = builder.partialSearchLimit;
    }

    public static AnalyzerConfig defaults() {
        return new Builder().build();
    }

    /**
     * Creates configuration from environment variables.
     */
    public static AnalyzerConfig fromEnvironment() {
        return fromEnvironment(EnvironmentReader.system());
    }

    public static AnalyzerConfig fromEnvironment(EnvironmentReader env) {
        return new Builder()
                .searchRadius(env.getDouble("ANALYZER_SEARCH_RADIUS", DEFAULT_SEARCH_RADIUS))
                .snapTolerance(env.getDouble("ANALYZER_SNAP_TOLERANCE", DEFAULT_SNAP_TOLERANCE))
                .maxExpansions(env.getInt("ANALYZER_MAX_EXPANSIONS", DEFAULT_MAX_EXPANSIONS))
                .partialSearchLimit(env.getInt("ANALYZER_PARTIAL_SEARCH_LIMIT", DEFAULT_PARTIAL_SEARCH_LIMIT))
                .build();
    }

    public double getSearchRadius() {
        return searchRadius;
    }

    public double getSnapTolerance() {
        return snapTolerance;
    }

    public double getAccessTolerance() {
        return accessTolerance;
    }

    public double getAccessSpeedKmh() {
        return accessSpeedKmh;
    }

    public double getAccessWidth() {
        return accessWidth;
    }

    public int getMaxExpansions() {
        return maxExpansions;
    }

    public int getPartialSearchLimit() {
        return partialSearchLimit;
    }

    @Override
    public String toString() {
        return "AnalyzerConfig{" +
                "searchRadius=" + searchRadius +
                ", snapTolerance=" + snapTolerance +
                ", accessTolerance=" + accessTolerance +
                ", maxExpansions=" + maxExpansions +
                ", partialSearchLimit=" + partialSearchLimit +
                '}';
    }

    /**
     * Builder for AnalyzerConfig.
     */
    public static final class Builder {
        private double searchRadius = DEFAULT_SEARCH_RADIUS;
        private double snapTolerance = DEFAULT_SNAP_TOLERANCE;
        private double accessTolerance = DEFAULT_ACCESS_TOLERANCE;
        private double accessSpeedKmh = DEFAULT_ACCESS_SPEED_KMH;
        private double accessWidth = DEFAULT_ACCESS_WIDTH;
        private int maxExpansions = DEFAULT_MAX_EXPANSIONS;
        private int partialSearchLimit = DEFAULT_PARTIAL_SEARCH_LIMIT;

        public Builder searchRadius(double searchRadius) {
            this.searchRadius = positive("searchRadius", searchRadius);
            return this;
        }

        public Builder snapTolerance(double snapTolerance) {
            if (snapTolerance < 0) {
                throw new IllegalArgumentException("snapTolerance must not be negative");
            }
            this.snapTolerance = snapTolerance;
            return this;
        }

        public Builder accessTolerance(double accessTolerance) {
            this.accessTolerance = positive("accessTolerance", accessTolerance);
            return this;
        }

        public Builder accessSpeedKmh(double accessSpeedKmh) {
            this.accessSpeedKmh = positive("accessSpeedKmh", accessSpeedKmh);
            return this;
        }

        public Builder accessWidth(double accessWidth) {
            this.accessWidth = positive("accessWidth", accessWidth);
            return this;
        }

        public Builder maxExpansions(int maxExpansions) {
            if (maxExpansions <= 0) {
                throw new IllegalArgumentException("maxExpansions must be positive");
            }
            this.maxExpansions = maxExpansions;
            return this;
        }

        public Builder partialSearchLimit(int partialSearchLimit) {
            if (partialSearchLimit <= 0) {
                throw new IllegalArgumentException("partialSearchLimit must be positive");
            }
            this.partialSearchLimit = partialSearchLimit;
            return this;
        }

        public AnalyzerConfig build() {
            if (snapTolerance > searchRadius) {
                throw new IllegalArgumentException("snapTolerance must not exceed searchRadius");
            }
            return new AnalyzerConfig(this);
        }

        private static double positive(String name, double value) {
            if (!(value > 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
