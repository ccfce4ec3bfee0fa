package org.urbanresilience.analysis.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a coverage analysis. Pre- and post-disaster runs fill one grid; comparison runs fill both
 * grids together with the per-cell classification.
 */
public final class CoverageResult {

    private final AnalysisMode mode;
    private final CoverageGrid before;
    private final CoverageMetrics beforeMetrics;
    private final CoverageGrid after;
    private final CoverageMetrics afterMetrics;
    private final List<CellComparison> comparisons;
    private final ComparisonMetrics comparisonMetrics;

    private CoverageResult(AnalysisMode mode, CoverageGrid before, CoverageMetrics beforeMetrics,
                           CoverageGrid after, CoverageMetrics afterMetrics,
                           List<CellComparison> comparisons, ComparisonMetrics comparisonMetrics) {
        this.mode = mode;
        this.before = before;
        this.beforeMetrics = beforeMetrics;
        this.after = after;
        this.afterMetrics = afterMetrics;
        this.comparisons = comparisons;
        this.comparisonMetrics = comparisonMetrics;
    }

    public static CoverageResult preDisaster(CoverageGrid grid, CoverageMetrics metrics) {
        return new CoverageResult(AnalysisMode.PRE_DISASTER, Objects.requireNonNull(grid, "grid must not be null"),
                metrics, null, null, Collections.emptyList(), null);
    }

    public static CoverageResult postDisaster(CoverageGrid grid, CoverageMetrics metrics) {
        return new CoverageResult(AnalysisMode.POST_DISASTER, null, null,
                Objects.requireNonNull(grid, "grid must not be null"), metrics, Collections.emptyList(), null);
    }

    public static CoverageResult comparison(CoverageGrid before, CoverageMetrics beforeMetrics,
                                            CoverageGrid after, CoverageMetrics afterMetrics,
                                            List<CellComparison> comparisons) {
        List<CellComparison> cells = Collections.unmodifiableList(comparisons);
        return new CoverageResult(AnalysisMode.COMPARISON, before, beforeMetrics, after, afterMetrics, cells,
                ComparisonMetrics.of(beforeMetrics, afterMetrics, cells));
    }

    public AnalysisMode getMode() {
        return mode;
    }

    public Optional<CoverageGrid> getPreDisasterGrid() {
        return Optional.ofNullable(before);
    }

    public Optional<CoverageMetrics> getPreDisasterMetrics() {
        return Optional.ofNullable(beforeMetrics);
    }

    public Optional<CoverageGrid> getPostDisasterGrid() {
        return Optional.ofNullable(after);
    }

    public Optional<CoverageMetrics> getPostDisasterMetrics() {
        return Optional.ofNullable(afterMetrics);
    }

    public List<CellComparison> getComparisons() {
        return comparisons;
    }

    public Optional<ComparisonMetrics> getComparisonMetrics() {
        return Optional.ofNullable(comparisonMetrics);
    }
}
