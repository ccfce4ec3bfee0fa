package org.urbanresilience.analysis.domain.model;

/**
 * Response-time band of a coverage cell.
 */
public enum ServiceLevel {
    EXCELLENT(300.0),
    GOOD(600.0),
    FAIR(900.0),
    POOR(Double.POSITIVE_INFINITY),
    UNREACHABLE(Double.NaN);

    private final double upperBoundSeconds;

    ServiceLevel(double upperBoundSeconds) {
        this.upperBoundSeconds = upperBoundSeconds;
    }

    public double getUpperBoundSeconds() {
        return upperBoundSeconds;
    }

    /**
     * Level for a response time; {@code null} means no route.
     */
    public static ServiceLevel of(Double responseTimeSeconds) {
        if (responseTimeSeconds == null || responseTimeSeconds.isNaN()) {
            return UNREACHABLE;
        }
        for (ServiceLevel level : values()) {
            if (level != UNREACHABLE && responseTimeSeconds <= level.upperBoundSeconds) {
                return level;
            }
        }
        return UNREACHABLE;
    }
}
