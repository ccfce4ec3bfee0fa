package org.urbanresilience.analysis.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate figures of one coverage grid.
 */
public final class CoverageMetrics {

    private final int totalCells;
    private final int reachableCells;
    private final int unreachableCells;
    private final double coveragePercentage;
    private final double averageResponseTime;
    private final double medianResponseTime;
    private final double maxResponseTime;
    private final Map<ServiceLevel, Integer> cellsByLevel;
    private final double blindAreaSquareMeters;
    private final double totalAreaSquareMeters;
    private final int stationsAnalyzed;

    private CoverageMetrics(int totalCells, int reachableCells, double averageResponseTime,
                            double medianResponseTime, double maxResponseTime,
                            Map<ServiceLevel, Integer> cellsByLevel, double cellArea, int stationsAnalyzed) {
        this.totalCells = totalCells;
        this.reachableCells = reachableCells;
        this.unreachableCells = totalCells - reachableCells;
        this.coveragePercentage = totalCells == 0 ? 0.0 : 100.0 * reachableCells / totalCells;
        this.averageResponseTime = averageResponseTime;
        this.medianResponseTime = medianResponseTime;
        this.maxResponseTime = maxResponseTime;
        this.cellsByLevel = Collections.unmodifiableMap(cellsByLevel);
        this.blindAreaSquareMeters = unreachableCells * cellArea;
        this.totalAreaSquareMeters = totalCells * cellArea;
        this.stationsAnalyzed = stationsAnalyzed;
    }

    /**
     * Summarizes {@code grid}. Time figures cover reachable cells only and are 0 when none is.
     */
    public static CoverageMetrics of(CoverageGrid grid, int stationsAnalyzed) {
        List<Double> times = new ArrayList<>();
        Map<ServiceLevel, Integer> byLevel = new EnumMap<>(ServiceLevel.class);
        for (ServiceLevel level : ServiceLevel.values()) {
            byLevel.put(level, 0);
        }
        for (CoverageCell cell : grid.getCells()) {
            byLevel.merge(cell.getLevel(), 1, Integer::sum);
            if (cell.isReachable()) {
                times.add(cell.getResponseTime());
            }
        }
        Collections.sort(times);
        double sum = 0.0;
        for (double time : times) {
            sum += time;
        }
        double average = times.isEmpty() ? 0.0 : sum / times.size();
        double max = times.isEmpty() ? 0.0 : times.get(times.size() - 1);
        return new CoverageMetrics(grid.getCells().size(), times.size(), average, median(times), max,
                byLevel, grid.getCellArea(), stationsAnalyzed);
    }

    /** Median of an ascending list, 0 when empty. */
    static double median(List<Double> sorted) {
        int n = sorted.size();
        if (n == 0) {
            return 0.0;
        }
        if (n % 2 == 1) {
            return sorted.get(n / 2);
        }
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }

    public int getTotalCells() {
        return totalCells;
    }

    public int getReachableCells() {
        return reachableCells;
    }

    public int getUnreachableCells() {
        return unreachableCells;
    }

    public double getCoveragePercentage() {
        return coveragePercentage;
    }

    public double getAverageResponseTime() {
        return averageResponseTime;
    }

    public double getMedianResponseTime() {
        return medianResponseTime;
    }

    public double getMaxResponseTime() {
        return maxResponseTime;
    }

    public Map<ServiceLevel, Integer> getCellsByLevel() {
        return cellsByLevel;
    }

    public int getCells(ServiceLevel level) {
        return cellsByLevel.getOrDefault(level, 0);
    }

    public double getBlindAreaSquareMeters() {
        return blindAreaSquareMeters;
    }

    public double getTotalAreaSquareMeters() {
        return totalAreaSquareMeters;
    }

    public int getStationsAnalyzed() {
        return stationsAnalyzed;
    }

    @Override
    public String toString() {
        return String.format("CoverageMetrics{cells=%d, reachable=%d, coverage=%.1f%%, avg=%.1fs, median=%.1fs, max=%.1fs}",
                totalCells, reachableCells, coveragePercentage, averageResponseTime, medianResponseTime,
                maxResponseTime);
    }
}
