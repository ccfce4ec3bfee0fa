package org.urbanresilience.analysis.domain.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.urbanresilience.analysis.config.CoverageConfig;
import org.urbanresilience.analysis.domain.model.AnalysisMode;
import org.urbanresilience.analysis.domain.model.CellComparison;
import org.urbanresilience.analysis.domain.model.ComparisonClass;
import org.urbanresilience.analysis.domain.model.ComparisonMetrics;
import org.urbanresilience.analysis.domain.model.CoverageGrid;
import org.urbanresilience.analysis.domain.model.CoverageMetrics;
import org.urbanresilience.analysis.domain.model.CoverageResult;
import org.urbanresilience.analysis.domain.model.ServiceLevel;
import org.urbanresilience.core.model.MapBoundary;
import org.urbanresilience.core.model.NodeKind;
import org.urbanresilience.core.model.RoadClass;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;
import org.urbanresilience.simulation.disaster.RoadObstruction;
import org.urbanresilience.simulation.network.NetworkAnalyzer;

final class CoverageServiceImplTest {

  private static final MapBoundary BOUNDARY = new MapBoundary(0, 0, 200, 200);
  private static final List<Coordinate> STATION = Collections.singletonList(new Coordinate(0, 0));

  /** 3 x 3 intersections 100 m apart, 36 km/h streets 6 m wide. */
  private static RoadGraph grid() {
    RoadGraph graph = new RoadGraph();
    int[][] ids = new int[3][3];
    for (int row = 0; row < 3; row++) {
      for (int col = 0; col < 3; col++) {
        ids[row][col] = graph.addNode(col * 100.0, row * 100.0, NodeKind.INTERSECTION).getId();
      }
    }
    for (int row = 0; row < 3; row++) {
      for (int col = 0; col < 3; col++) {
        if (col + 1 < 3) {
          graph.addEdge(street(ids[row][col], ids[row][col + 1]));
        }
        if (row + 1 < 3) {
          graph.addEdge(street(ids[row][col], ids[row + 1][col]));
        }
      }
    }
    return graph;
  }

  private static RoadEdge.Builder street(int from, int to) {
    return new RoadEdge.Builder()
        .between(from, to)
        .width(6.0)
        .lanes(2)
        .bidirectional(true)
        .roadClass(RoadClass.SECONDARY)
        .speedLimitKmh(36.0);
  }

  /** Blocks every street touching the origin. */
  private static List<RoadObstruction> isolateOrigin(RoadGraph graph) {
    List<RoadObstruction> obstructions = new ArrayList<>();
    for (RoadEdge edge : graph.edges()) {
      if (graph.coordinate(edge.getFromNode()).equals2D(new Coordinate(0, 0))
          || graph.coordinate(edge.getToNode()).equals2D(new Coordinate(0, 0))) {
        obstructions.add(new RoadObstruction.Builder().edgeId(edge.getId()).remainingWidth(0.5).build());
      }
    }
    return obstructions;
  }

  private static CoverageServiceImpl service(double maxResponseTime) {
    return new CoverageServiceImpl(new CoverageConfig.Builder()
        .gridSizeMeters(100)
        .maxResponseTimeSeconds(maxResponseTime)
        .build());
  }

  @Test
  void everyCellOfIntactGridIsReachable() {
    NetworkAnalyzer analyzer = new NetworkAnalyzer(grid());

    CoverageResult result = service(900).analyze(analyzer, BOUNDARY, STATION, AnalysisMode.PRE_DISASTER, null);

    assertEquals(AnalysisMode.PRE_DISASTER, result.getMode());
    CoverageGrid grid = result.getPreDisasterGrid().get();
    assertEquals(2, grid.getRows());
    assertEquals(2, grid.getColumns());
    CoverageMetrics metrics = result.getPreDisasterMetrics().get();
    assertEquals(4, metrics.getReachableCells());
    assertEquals(100.0, metrics.getCoveragePercentage(), 1e-9);
    assertEquals(4, metrics.getCells(ServiceLevel.EXCELLENT));
    assertEquals(0, grid.cell(0, 0).getNearestStation().getAsInt());
    assertFalse(result.getPostDisasterGrid().isPresent());
  }

  @Test
  void nearerCellsAnswerFaster() {
    NetworkAnalyzer analyzer = new NetworkAnalyzer(grid());

    CoverageGrid grid = service(900)
        .analyze(analyzer, BOUNDARY, STATION, AnalysisMode.PRE_DISASTER, null)
        .getPreDisasterGrid().get();

    assertTrue(grid.cell(0, 0).getResponseTime() < grid.cell(1, 1).getResponseTime());
  }

  @Test
  void cellsBeyondResponseLimitAreUnreachable() {
    NetworkAnalyzer analyzer = new NetworkAnalyzer(grid());

    CoverageResult result = service(45).analyze(analyzer, BOUNDARY, STATION, AnalysisMode.PRE_DISASTER, null);

    CoverageMetrics metrics = result.getPreDisasterMetrics().get();
    assertEquals(1, metrics.getReachableCells());
    assertEquals(25.0, metrics.getCoveragePercentage(), 1e-9);
    assertEquals(30_000.0, metrics.getBlindAreaSquareMeters(), 1e-9);
    assertTrue(result.getPreDisasterGrid().get().cell(0, 0).isReachable());
  }

  @Test
  void closestStationServesEachCell() {
    NetworkAnalyzer analyzer = new NetworkAnalyzer(grid());
    List<Coordinate> stations = Arrays.asList(new Coordinate(0, 0), new Coordinate(200, 200));

    CoverageGrid grid = service(900)
        .analyze(analyzer, BOUNDARY, stations, AnalysisMode.PRE_DISASTER, null)
        .getPreDisasterGrid().get();

    assertEquals(0, grid.cell(0, 0).getNearestStation().getAsInt());
    assertEquals(1, grid.cell(1, 1).getNearestStation().getAsInt());
  }

  @Test
  void postDisasterRunUsesSuppliedObstructions() {
    RoadGraph graph = grid();
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);

    CoverageResult result = service(900)
        .analyze(analyzer, BOUNDARY, STATION, AnalysisMode.POST_DISASTER, isolateOrigin(graph));

    assertEquals(0, result.getPostDisasterMetrics().get().getReachableCells());
    assertEquals(2, analyzer.getActiveObstructions().size());
    assertFalse(result.getPreDisasterMetrics().isPresent());
  }

  @Test
  void preDisasterRunIgnoresEarlierObstructions() {
    RoadGraph graph = grid();
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);
    analyzer.applyObstructions(isolateOrigin(graph));

    CoverageResult result = service(900).analyze(analyzer, BOUNDARY, STATION, AnalysisMode.PRE_DISASTER, null);

    assertEquals(4, result.getPreDisasterMetrics().get().getReachableCells());
    assertTrue(analyzer.getActiveObstructions().isEmpty());
  }

  @Test
  void comparisonClassifiesLostCells() {
    RoadGraph graph = grid();
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);
    String before = analyzer.fingerprint();

    CoverageResult result = service(900)
        .analyze(analyzer, BOUNDARY, STATION, AnalysisMode.COMPARISON, isolateOrigin(graph));

    assertEquals(AnalysisMode.COMPARISON, result.getMode());
    assertEquals(4, result.getComparisons().size());
    for (CellComparison cell : result.getComparisons()) {
      assertEquals(ComparisonClass.NEWLY_UNREACHABLE, cell.getComparisonClass());
    }
    ComparisonMetrics metrics = result.getComparisonMetrics().get();
    assertEquals(-100.0, metrics.getCoverageChange(), 1e-9);
    assertEquals(4, metrics.getNewlyUnreachable());
    assertEquals(0, metrics.getDegradedCells());
    assertEquals(0.0, metrics.getAverageTimeIncrease());
    assertEquals(2, analyzer.getActiveObstructions().size());
    analyzer.clearObstructions();
    assertEquals(before, analyzer.fingerprint());
  }

  @Test
  void comparisonWithoutObstructionsKeepsTimes() {
    NetworkAnalyzer analyzer = new NetworkAnalyzer(grid());

    CoverageResult result = service(900)
        .analyze(analyzer, BOUNDARY, STATION, AnalysisMode.COMPARISON, Collections.emptyList());

    ComparisonMetrics metrics = result.getComparisonMetrics().get();
    assertEquals(4, metrics.getImprovedOrSameCells());
    assertEquals(0.0, metrics.getCoverageChange(), 1e-9);
  }

  @Test
  void rejectsMissingInputs() {
    NetworkAnalyzer analyzer = new NetworkAnalyzer(grid());
    CoverageServiceImpl service = service(900);

    assertThrows(IllegalArgumentException.class,
        () -> service.analyze(analyzer, BOUNDARY, Collections.emptyList(), AnalysisMode.PRE_DISASTER, null));
    assertThrows(IllegalArgumentException.class,
        () -> service.analyze(analyzer, BOUNDARY, STATION, AnalysisMode.POST_DISASTER, null));
    assertThrows(IllegalArgumentException.class,
        () -> service.analyze(analyzer, BOUNDARY, STATION, AnalysisMode.COMPARISON, null));
  }
}
