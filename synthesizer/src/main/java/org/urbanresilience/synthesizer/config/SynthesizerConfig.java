package org.urbanresilience.synthesizer.config;

import org.urbanresilience.core.config.EnvironmentReader;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.Random;

/**
 * Immutable configuration for the map synthesizer.
 * Map size, main road count and seed can come from the environment; the rest is builder-only.
 */
public final class SynthesizerConfig {

    public static final double DEFAULT_MAP_SIZE = 2000.0;
    public static final int DEFAULT_MAIN_ROAD_COUNT = 4;

    private final double mapWidth;
    private final double mapHeight;
    private final int mainRoadCount;
    private final RoadSpec mainRoad;
    private final RoadSpec secondaryRoad;
    private final double edgeMargin;

    // Diagonal arteries
    private final int minDiagonalRoads;
    private final int maxDiagonalRoads;

    // Alleys
    private final int minAlleysPerBlock;
    private final int maxAlleysPerBlock;
    private final double fullLengthProbability;
    private final double horizontalProbability;
    private final double bidirectionalProbability;
    private final double tiltProbability;
    private final double maxTiltDegrees;
    private final double minRoadLength;

    private final double intersectionTolerance;
    private final Long randomSeed;

    private SynthesizerConfig(Builder builder) {
        this.mapWidth = builder.mapWidth;
        this.mapHeight = builder.mapHeight;
        this.mainRoadCount = builder.mainRoadCount;
        this.mainRoad = builder.mainRoad;
        this.secondaryRoad = builder.secondaryRoad;
        this.edgeMargin = builder.edgeMargin;
        this.minDiagonalRoads = builder.minDiagonalRoads;
        this.maxDiagonalRoads = builder.maxDiagonalRoads;
        this.minAlleysPerBlock = builder.minAlleysPerBlock;
        this.maxAlleysPerBlock = builder.maxAlleysPerBlock;
        this.fullLengthProbability = builder.fullLengthProbability;
        this.horizontalProbability = builder.horizontalProbability;
        this.bidirectionalProbability = builder.bidirectionalProbability;
        this.tiltProbability = builder.tiltProbability;
        this.maxTiltDegrees = builder.maxTiltDegrees;
        this.minRoadLength = builder.minRoadLength;
        this.intersectionTolerance = builder.intersectionTolerance;
        this.randomSeed = builder.randomSeed;
    }

    public static SynthesizerConfig defaults() {
        return new Builder().build();
    }

    /**
     * Creates configuration from environment variables.
     */
    public static SynthesizerConfig fromEnvironment() {
        return fromEnvironment(EnvironmentReader.system());
    }

    public static SynthesizerConfig fromEnvironment(EnvironmentReader env) {
        Builder builder = new Builder()
                .mapSize(env.getDouble("MAP_WIDTH", DEFAULT_MAP_SIZE), env.getDouble("MAP_HEIGHT", DEFAULT_MAP_SIZE))
                .mainRoadCount(env.getInt("MAIN_ROAD_COUNT", DEFAULT_MAIN_ROAD_COUNT));
        OptionalLong seed = env.getLong("RANDOM_SEED");
        if (seed.isPresent()) {
            builder.randomSeed(seed.getAsLong());
        }
        return builder.build();
    }

    /**
     * Seeded generator when a seed is configured, otherwise a fresh one.
     */
    public Random newRandom() {
        return randomSeed != null ? new Random(randomSeed) : new Random();
    }

    public double getMapWidth() {
        return mapWidth;
    }

    public double getMapHeight() {
        return mapHeight;
    }

    public int getMainRoadCount() {
        return mainRoadCount;
    }

    public RoadSpec getMainRoad() {
        return mainRoad;
    }

    public RoadSpec getSecondaryRoad() {
        return secondaryRoad;
    }

    public double getEdgeMargin() {
        return edgeMargin;
    }

    public int getMinDiagonalRoads() {
        return minDiagonalRoads;
    }

    public int getMaxDiagonalRoads() {
        return maxDiagonalRoads;
    }

    public int getMinAlleysPerBlock() {
        return minAlleysPerBlock;
    }

    public int getMaxAlleysPerBlock() {
        return maxAlleysPerBlock;
    }

    public double getFullLengthProbability() {
        return fullLengthProbability;
    }

    public double getHorizontalProbability() {
        return horizontalProbability;
    }

    public double getBidirectionalProbability() {
        return bidirectionalProbability;
    }

    public double getTiltProbability() {
        return tiltProbability;
    }

    public double getMaxTiltDegrees() {
        return maxTiltDegrees;
    }

    public double getMinRoadLength() {
        return minRoadLength;
    }

    public double getIntersectionTolerance() {
        return intersectionTolerance;
    }

    public Long getRandomSeed() {
        return randomSeed;
    }

    @Override
    public String toString() {
        return "SynthesizerConfig{" +
                "mapWidth=" + mapWidth +
                ", mapHeight=" + mapHeight +
                ", mainRoadCount=" + mainRoadCount +
                ", mainRoad=" + mainRoad +
                ", secondaryRoad=" + secondaryRoad +
                ", diagonalRoads=" + minDiagonalRoads + ".." + maxDiagonalRoads +
                ", alleysPerBlock=" + minAlleysPerBlock + ".." + maxAlleysPerBlock +
                ", randomSeed=" + randomSeed +
                '}';
    }

    /**
     * Builder for SynthesizerConfig.
     */
    public static final class Builder {
        private double mapWidth = DEFAULT_MAP_SIZE;
        private double mapHeight = DEFAULT_MAP_SIZE;
        private int mainRoadCount = DEFAULT_MAIN_ROAD_COUNT;
        private RoadSpec mainRoad = RoadSpec.MAIN;
        private RoadSpec secondaryRoad = RoadSpec.SECONDARY;
        private double edgeMargin = 50.0;
        private int minDiagonalRoads = 1;
        private int maxDiagonalRoads = 2;
        private int minAlleysPerBlock = 1;
        private int maxAlleysPerBlock = 4;
        private double fullLengthProbability = 0.5;
        private double horizontalProbability = 0.5;
        private double bidirectionalProbability = 0.7;
        private double tiltProbability = 0.3;
        private double maxTiltDegrees = 20.0;
        private double minRoadLength = 5.0;
        private double intersectionTolerance = 0.5;
        private Long randomSeed;

        public Builder mapSize(double width, double height) {
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("map size must be positive");
            }
            this.mapWidth = width;
            this.mapHeight = height;
            return this;
        }

        public Builder mainRoadCount(int mainRoadCount) {
            if (mainRoadCount < 0) {
                throw new IllegalArgumentException("mainRoadCount must not be negative");
            }
            this.mainRoadCount = mainRoadCount;
            return this;
        }

        public Builder mainRoad(RoadSpec mainRoad) {
            this.mainRoad = Objects.requireNonNull(mainRoad, "mainRoad must not be null");
            return this;
        }

        public Builder secondaryRoad(RoadSpec secondaryRoad) {
            this.secondaryRoad = Objects.requireNonNull(secondaryRoad, "secondaryRoad must not be null");
            return this;
        }

        public Builder edgeMargin(double edgeMargin) {
            if (edgeMargin < 0) {
                throw new IllegalArgumentException("edgeMargin must not be negative");
            }
            this.edgeMargin = edgeMargin;
            return this;
        }

        public Builder diagonalRoads(int min, int max) {
            if (min < 0 || max < min) {
                throw new IllegalArgumentException("diagonal road range must satisfy 0 <= min <= max");
            }
            this.minDiagonalRoads = min;
            this.maxDiagonalRoads = max;
            return this;
        }

        public Builder alleysPerBlock(int min, int max) {
            if (min < 0 || max < min) {
                throw new IllegalArgumentException("alley range must satisfy 0 <= min <= max");
            }
            this.minAlleysPerBlock = min;
            this.maxAlleysPerBlock = max;
            return this;
        }

        public Builder fullLengthProbability(double value) {
            this.fullLengthProbability = probability("fullLengthProbability", value);
            return this;
        }

        public Builder horizontalProbability(double value) {
            this.horizontalProbability = probability("horizontalProbability", value);
            return this;
        }

        public Builder bidirectionalProbability(double value) {
            this.bidirectionalProbability = probability("bidirectionalProbability", value);
            return this;
        }

        public Builder tiltProbability(double value) {
            this.tiltProbability = probability("tiltProbability", value);
            return this;
        }

        public Builder maxTiltDegrees(double maxTiltDegrees) {
            if (maxTiltDegrees < 0 || maxTiltDegrees >= 90) {
                throw new IllegalArgumentException("maxTiltDegrees must be in [0, 90)");
            }
            this.maxTiltDegrees = maxTiltDegrees;
            return this;
        }

        public Builder minRoadLength(double minRoadLength) {
            if (minRoadLength < 0) {
                throw new IllegalArgumentException("minRoadLength must not be negative");
            }
            this.minRoadLength = minRoadLength;
            return this;
        }

        public Builder intersectionTolerance(double intersectionTolerance) {
            if (intersectionTolerance <= 0) {
                throw new IllegalArgumentException("intersectionTolerance must be positive");
            }
            this.intersectionTolerance = intersectionTolerance;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public SynthesizerConfig build() {
            if (2 * edgeMargin >= Math.min(mapWidth, mapHeight)) {
                throw new IllegalArgumentException("edgeMargin leaves no room for roads on a "
                        + mapWidth + "x" + mapHeight + " map");
            }
            return new SynthesizerConfig(this);
        }

        private static double probability(String name, double value) {
            if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
                throw new IllegalArgumentException(name + " must be in [0, 1]");
            }
            return value;
        }
    }
}
