package org.urbanresilience.analysis.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * How much a disaster changed coverage.
 */
public final class ComparisonMetrics {

    private final double coverageChange;
    private final int newlyUnreachable;
    private final int newlyReachable;
    private final double averageTimeIncrease;
    private final double medianTimeIncrease;
    private final int degradedCells;
    private final int improvedOrSameCells;
    private final Map<ComparisonClass, Integer> cellsByClass;

    private ComparisonMetrics(double coverageChange, double averageTimeIncrease, double medianTimeIncrease,
                              Map<ComparisonClass, Integer> cellsByClass) {
        this.coverageChange = coverageChange;
        this.averageTimeIncrease = averageTimeIncrease;
        this.medianTimeIncrease = medianTimeIncrease;
        this.cellsByClass = Collections.unmodifiableMap(cellsByClass);
        this.newlyUnreachable = count(ComparisonClass.NEWLY_UNREACHABLE);
        this.newlyReachable = count(ComparisonClass.NEWLY_REACHABLE);
        this.degradedCells = count(ComparisonClass.SEVERELY_DEGRADED)
                + count(ComparisonClass.MODERATELY_DEGRADED)
                + count(ComparisonClass.LIGHTLY_DEGRADED);
        this.improvedOrSameCells = count(ComparisonClass.IMPROVED_OR_SAME);
    }

    /**
     * Time increase figures are taken over cells reachable in both runs.
     */
    public static ComparisonMetrics of(CoverageMetrics before, CoverageMetrics after, List<CellComparison> cells) {
        Map<ComparisonClass, Integer> byClass = new EnumMap<>(ComparisonClass.class);
        for (ComparisonClass c : ComparisonClass.values()) {
            byClass.put(c, 0);
        }
        List<Double> increases = new ArrayList<>();
        for (CellComparison cell : cells) {
            byClass.merge(cell.getComparisonClass(), 1, Integer::sum);
            Double increase = cell.getTimeIncrease();
            if (increase != null) {
                increases.add(increase);
            }
        }
        Collections.sort(increases);
        double sum = 0.0;
        for (double increase : increases) {
            sum += increase;
        }
        double average = increases.isEmpty() ? 0.0 : sum / increases.size();
        return new ComparisonMetrics(after.getCoveragePercentage() - before.getCoveragePercentage(),
                average, CoverageMetrics.median(increases), byClass);
    }

    private int count(ComparisonClass c) {
        return cellsByClass.getOrDefault(c, 0);
    }

    /** Post minus pre coverage, in percentage points. */
    public double getCoverageChange() {
        return coverageChange;
    }

    public int getNewlyUnreachable() {
        return newlyUnreachable;
    }

    public int getNewlyReachable() {
        return newlyReachable;
    }

    public double getAverageTimeIncrease() {
        return averageTimeIncrease;
    }

    public double getMedianTimeIncrease() {
        return medianTimeIncrease;
    }

    public int getDegradedCells() {
        return degradedCells;
    }

    public int getImprovedOrSameCells() {
        return improvedOrSameCells;
    }

    public int getSeverelyDegraded() {
        return count(ComparisonClass.SEVERELY_DEGRADED);
    }

    public int getModeratelyDegraded() {
        return count(ComparisonClass.MODERATELY_DEGRADED);
    }

    public int getLightlyDegraded() {
        return count(ComparisonClass.LIGHTLY_DEGRADED);
    }

    public Map<ComparisonClass, Integer> getCellsByClass() {
        return cellsByClass;
    }

    @Override
    public String toString() {
        return String.format("ComparisonMetrics{coverageChange=%.1f, newlyUnreachable=%d, degraded=%d, avgIncrease=%.1fs}",
                coverageChange, newlyUnreachable, degradedCells, averageTimeIncrease);
    }
}
