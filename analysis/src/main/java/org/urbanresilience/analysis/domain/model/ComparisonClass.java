package org.urbanresilience.analysis.domain.model;

/**
 * How a cell's response time changed between the pre- and post-disaster runs.
 */
public enum ComparisonClass {
    NEWLY_UNREACHABLE,
    NEWLY_REACHABLE,
    SEVERELY_DEGRADED,
    MODERATELY_DEGRADED,
    LIGHTLY_DEGRADED,
    IMPROVED_OR_SAME,
    UNREACHABLE;

    static final double SEVERE_INCREASE = 0.5;
    static final double MODERATE_INCREASE = 0.2;

    /**
     * @param before response time before, {@code null} if unreachable
     * @param after  response time after, {@code null} if unreachable
     */
    public static ComparisonClass of(Double before, Double after) {
        if (before == null && after == null) {
            return UNREACHABLE;
        }
        if (after == null) {
            return NEWLY_UNREACHABLE;
        }
        if (before == null) {
            return NEWLY_REACHABLE;
        }
        double increase = after - before;
        if (increase <= 0) {
            return IMPROVED_OR_SAME;
        }
        double relative = before > 0 ? increase / before : Double.POSITIVE_INFINITY;
        if (relative > SEVERE_INCREASE) {
            return SEVERELY_DEGRADED;
        }
        if (relative > MODERATE_INCREASE) {
            return MODERATELY_DEGRADED;
        }
        return LIGHTLY_DEGRADED;
    }

    public boolean isDegraded() {
        return this == SEVERELY_DEGRADED || this == MODERATELY_DEGRADED || this == LIGHTLY_DEGRADED;
    }
}
