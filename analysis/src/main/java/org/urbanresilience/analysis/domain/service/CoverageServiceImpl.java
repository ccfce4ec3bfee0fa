package org.urbanresilience.analysis.domain.service;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanresilience.analysis.config.CoverageConfig;
import org.urbanresilience.analysis.domain.model.AnalysisMode;
import org.urbanresilience.analysis.domain.model.CellComparison;
import org.urbanresilience.analysis.domain.model.CoverageCell;
import org.urbanresilience.analysis.domain.model.CoverageGrid;
import org.urbanresilience.analysis.domain.model.CoverageMetrics;
import org.urbanresilience.analysis.domain.model.CoverageResult;
import org.urbanresilience.core.model.MapBoundary;
import org.urbanresilience.simulation.disaster.RoadObstruction;
import org.urbanresilience.simulation.network.NetworkAnalyzer;
import org.urbanresilience.simulation.network.PathRequest;
import org.urbanresilience.simulation.network.PathResult;
import org.urbanresilience.simulation.network.VehicleProfile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Grid-based coverage: every cell gets the fastest successful route from any station, capped at the
 * configured maximum response time.
 */
public final class CoverageServiceImpl implements CoverageService {

    private static final Logger LOG = LoggerFactory.getLogger(CoverageServiceImpl.class);

    private final CoverageConfig config;
    private final VehicleProfile vehicle;

    public CoverageServiceImpl(CoverageConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.vehicle = config.getVehicleType().defaultProfile();
    }

    @Override
    public CoverageResult analyze(NetworkAnalyzer analyzer, MapBoundary boundary, List<Coordinate> stations,
                                  AnalysisMode mode, Collection<RoadObstruction> obstructions) {
        Objects.requireNonNull(analyzer, "analyzer must not be null");
        Objects.requireNonNull(boundary, "boundary must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (stations == null || stations.isEmpty()) {
            throw new IllegalArgumentException("At least one station is required");
        }
        if (mode != AnalysisMode.PRE_DISASTER && obstructions == null) {
            throw new IllegalArgumentException(mode + " analysis requires an obstruction list");
        }

        LOG.info("[Coverage] {} analysis from {} stations, {}", mode, stations.size(), config);
        switch (mode) {
            case PRE_DISASTER: {
                analyzer.clearObstructions();
                CoverageGrid grid = computeGrid(analyzer, boundary, stations);
                return CoverageResult.preDisaster(grid, metrics(grid, stations));
            }
            case POST_DISASTER: {
                analyzer.applyObstructions(obstructions);
                CoverageGrid grid = computeGrid(analyzer, boundary, stations);
                return CoverageResult.postDisaster(grid, metrics(grid, stations));
            }
            case COMPARISON:
            default: {
                analyzer.clearObstructions();
                CoverageGrid before = computeGrid(analyzer, boundary, stations);
                analyzer.applyObstructions(obstructions);
                CoverageGrid after = computeGrid(analyzer, boundary, stations);
                List<CellComparison> cells = new ArrayList<>(before.getCells().size());
                for (int i = 0; i < before.getCells().size(); i++) {
                    cells.add(new CellComparison(before.getCells().get(i), after.getCells().get(i)));
                }
                CoverageResult result = CoverageResult.comparison(before, metrics(before, stations),
                        after, metrics(after, stations), cells);
                result.getComparisonMetrics().ifPresent(m -> LOG.info("[Coverage] {}", m));
                return result;
            }
        }
    }

    private CoverageMetrics metrics(CoverageGrid grid, List<Coordinate> stations) {
        CoverageMetrics metrics = CoverageMetrics.of(grid, stations.size());
        LOG.info("[Coverage] {}", metrics);
        return metrics;
    }

    private CoverageGrid computeGrid(NetworkAnalyzer analyzer, MapBoundary boundary, List<Coordinate> stations) {
        double size = config.getGridSizeMeters();
        List<Coordinate> centers = CoverageGrid.centers(boundary, size);
        int columns = CoverageGrid.count(boundary.width(), size);
        List<CoverageCell> cells = new ArrayList<>(centers.size());
        for (int i = 0; i < centers.size(); i++) {
            cells.add(evaluateCell(analyzer, i / columns, i % columns, centers.get(i), stations));
        }
        return new CoverageGrid(size, centers.size() / columns, columns, cells);
    }

    private CoverageCell evaluateCell(NetworkAnalyzer analyzer, int row, int column, Coordinate center,
                                      List<Coordinate> stations) {
        Double best = null;
        Integer bestStation = null;
        for (int s = 0; s < stations.size(); s++) {
            PathRequest request = PathRequest.of(stations.get(s), center, vehicle)
                    .withMaxTravelTime(config.getMaxResponseTimeSeconds());
            PathResult result = analyzer.findPath(request);
            if (!result.isSuccess() || result.getTravelTime() > config.getMaxResponseTimeSeconds()) {
                continue;
            }
            if (best == null || result.getTravelTime() < best) {
                best = result.getTravelTime();
                bestStation = s;
            }
        }
        LOG.debug("[Coverage] cell {},{} -> {}", row, column, best);
        return new CoverageCell(row, column, center, best, bestStation);
    }
}
