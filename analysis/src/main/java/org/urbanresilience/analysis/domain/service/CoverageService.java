package org.urbanresilience.analysis.domain.service;

import org.locationtech.jts.geom.Coordinate;
import org.urbanresilience.analysis.domain.model.AnalysisMode;
import org.urbanresilience.analysis.domain.model.CoverageResult;
import org.urbanresilience.core.model.MapBoundary;
import org.urbanresilience.simulation.disaster.RoadObstruction;
import org.urbanresilience.simulation.network.NetworkAnalyzer;

import java.util.Collection;
import java.util.List;

/**
 * Service for measuring how quickly emergency stations reach every part of the map.
 */
public interface CoverageService {

    /**
     * Analyze coverage of {@code boundary} from {@code stations}.
     *
     * @param analyzer     the network to route on; its obstructions are replaced according to the mode
     * @param boundary     area to lay the grid over
     * @param stations     station locations, at least one
     * @param mode         which state of the network to analyze
     * @param obstructions disaster obstructions, required unless the mode is pre-disaster
     * @return grids and metrics for the requested mode
     */
    CoverageResult analyze(NetworkAnalyzer analyzer, MapBoundary boundary, List<Coordinate> stations,
                           AnalysisMode mode, Collection<RoadObstruction> obstructions);
}
