package org.urbanresilience.simulation.config;

import org.urbanresilience.core.config.EnvironmentReader;
import org.urbanresilience.simulation.disaster.VulnerabilityLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Random;

/**
 * Immutable configuration for a disaster simulation run.
 */
public final class DisasterConfig {

    public static final double DEFAULT_INTENSITY = 5.0;
    public static final double MIN_INTENSITY = 1.0;
    public static final double MAX_INTENSITY = 10.0;
    public static final int DEFAULT_CROSS_SECTION_SAMPLES = 10;
    public static final double DEFAULT_DIRECTIONAL_THRESHOLD = 2.0;
    public static final double DEFAULT_FALLBACK_BLOCKAGE = 0.7;

    private final double intensity;
    private final Map<VulnerabilityLevel, Double> collapseRates;
    private final int crossSectionSamples;
    private final double directionalThreshold;
    private final double fallbackBlockageRatio;
    private final Long randomSeed;

    private DisasterConfig(Builder builder) {
        this.intensity = builder.intensity;
        this.collapseRates = Collections.unmodifiableMap(new EnumMap<>(builder.collapseRates));
        this.crossSectionSamples = builder.crossSectionSamples;
        this.directionalThreshold = builder.directionalThreshold;
        this.fallbackBlockageRatio = builder.fallbackBlockageRatio;
        this.randomSeed = builder.randomSeed;
    }

    public static DisasterConfig defaults() {
        return new Builder().build();
    }

    /**
     * Creates configuration from environment variables.
     */
    public static DisasterConfig fromEnvironment() {
        return fromEnvironment(EnvironmentReader.system());
    }

    public static DisasterConfig fromEnvironment(EnvironmentReader env) {
        Builder builder = new Builder()
                .intensity(env.getDouble("DISASTER_INTENSITY", DEFAULT_INTENSITY))
                .crossSectionSamples(env.getInt("CROSS_SECTION_SAMPLES", DEFAULT_CROSS_SECTION_SAMPLES));
        OptionalLong seed = env.getLong("RANDOM_SEED");
        if (seed.isPresent()) {
            builder.randomSeed(seed.getAsLong());
        }
        return builder.build();
    }

    public Random newRandom() {
        return randomSeed != null ? new Random(randomSeed) : new Random();
    }

    public double getIntensity() {
        return intensity;
    }

    public Map<VulnerabilityLevel, Double> getCollapseRates() {
        return collapseRates;
    }

    public double getCollapseRate(VulnerabilityLevel level) {
        return collapseRates.get(level);
    }

    public int getCrossSectionSamples() {
        return crossSectionSamples;
    }

    public double getDirectionalThreshold() {
        return directionalThreshold;
    }

    public double getFallbackBlockageRatio() {
        return fallbackBlockageRatio;
    }

    public Long getRandomSeed() {
        return randomSeed;
    }

    @Override
    public String toString() {
        return "DisasterConfig{" +
                "intensity=" + intensity +
                ", collapseRates=" + collapseRates +
                ", crossSectionSamples=" + crossSectionSamples +
                ", directionalThreshold=" + directionalThreshold +
                ", randomSeed=" + randomSeed +
                '}';
    }

    /**
     * Builder for DisasterConfig.
     */
    public static final class Builder {
        private double intensity = DEFAULT_INTENSITY;
        private final Map<VulnerabilityLevel, Double> collapseRates = new EnumMap<>(VulnerabilityLevel.class);
        private int crossSectionSamples = DEFAULT_CROSS_SECTION_SAMPLES;
        private double directionalThreshold = DEFAULT_DIRECTIONAL_THRESHOLD;
        private double fallbackBlockageRatio = DEFAULT_FALLBACK_BLOCKAGE;
        private Long randomSeed;

        public Builder() {
            for (VulnerabilityLevel level : VulnerabilityLevel.values()) {
                collapseRates.put(level, level.getDefaultCollapseRate());
            }
        }

        public Builder intensity(double intensity) {
            if (Double.isNaN(intensity) || intensity < MIN_INTENSITY || intensity > MAX_INTENSITY) {
                throw new IllegalArgumentException("intensity must be between 1 and 10");
            }
            this.intensity = intensity;
            return this;
        }

        public Builder collapseRate(VulnerabilityLevel level, double rate) {
            Objects.requireNonNull(level, "level must not be null");
            if (Double.isNaN(rate) || rate < 0.0 || rate > 1.0) {
                throw new IllegalArgumentException("collapse rate for level " + level.getCode() + " must be in [0, 1]");
            }
            collapseRates.put(level, rate);
            return this;
        }

        public Builder crossSectionSamples(int crossSectionSamples) {
            if (crossSectionSamples < 2) {
                throw new IllegalArgumentException("crossSectionSamples must be at least 2");
            }
            this.crossSectionSamples = crossSectionSamples;
            return this;
        }

        public Builder directionalThreshold(double directionalThreshold) {
            if (directionalThreshold < 0) {
                throw new IllegalArgumentException("directionalThreshold must not be negative");
            }
            this.directionalThreshold = directionalThreshold;
            return this;
        }

        public Builder fallbackBlockageRatio(double fallbackBlockageRatio) {
            if (fallbackBlockageRatio < 0.0 || fallbackBlockageRatio > 1.0) {
                throw new IllegalArgumentException("fallbackBlockageRatio must be in [0, 1]");
            }
            this.fallbackBlockageRatio = fallbackBlockageRatio;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public DisasterConfig build() {
            return new DisasterConfig(this);
        }
    }
}
