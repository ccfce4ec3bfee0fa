package org.urbanresilience.analysis.domain.model;

/**
 * Pre- and post-disaster response times of one grid cell.
 */
public final class CellComparison {

    private final CoverageCell before;
    private final CoverageCell after;
    private final ComparisonClass comparisonClass;

    public CellComparison(CoverageCell before, CoverageCell after) {
        if (before.getRow() != after.getRow() || before.getColumn() != after.getColumn()) {
            throw new IllegalArgumentException("Cannot compare " + before.getId() + " with " + after.getId());
        }
        this.before = before;
        this.after = after;
        this.comparisonClass = ComparisonClass.of(before.getResponseTime(), after.getResponseTime());
    }

    public CoverageCell getBefore() {
        return before;
    }

    public CoverageCell getAfter() {
        return after;
    }

    public ComparisonClass getComparisonClass() {
        return comparisonClass;
    }

    /** Seconds added by the disaster; only defined when both runs reach the cell. */
    public Double getTimeIncrease() {
        if (!before.isReachable() || !after.isReachable()) {
            return null;
        }
        return after.getResponseTime() - before.getResponseTime();
    }
}
