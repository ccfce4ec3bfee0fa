package org.urbanresilience.analysis.domain.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.urbanresilience.core.model.MapBoundary;

final class CoverageGridTest {

  @Test
  void centersSitMidCellInRowMajorOrder() {
    List<Coordinate> centers = CoverageGrid.centers(new MapBoundary(0, 0, 200, 100), 100);

    assertEquals(2, centers.size());
    assertEquals(new Coordinate(50, 50), centers.get(0));
    assertEquals(new Coordinate(150, 50), centers.get(1));
  }

  @Test
  void partialLastCellIsClampedInsideBoundary() {
    List<Coordinate> centers = CoverageGrid.centers(new MapBoundary(0, 0, 250, 100), 100);

    assertEquals(3, centers.size());
    assertEquals(200.0, centers.get(2).x, 1e-9);
    assertEquals(50.0, centers.get(2).y, 1e-9);
  }

  @Test
  void cellSmallerThanGridStillGetsOneCell() {
    List<Coordinate> centers = CoverageGrid.centers(new MapBoundary(10, 10, 40, 40), 100);

    assertEquals(1, centers.size());
    assertEquals(60.0, centers.get(0).x, 1e-9);
  }

  @Test
  void metricsSummarizeReachableCells() {
    List<CoverageCell> cells = new ArrayList<>(Arrays.asList(
        new CoverageCell(0, 0, new Coordinate(50, 50), 100.0, 0),
        new CoverageCell(0, 1, new Coordinate(150, 50), 400.0, 1),
        new CoverageCell(1, 0, new Coordinate(50, 150), 700.0, 0),
        new CoverageCell(1, 1, new Coordinate(150, 150), null, null)));
    CoverageGrid grid = new CoverageGrid(100, 2, 2, cells);

    CoverageMetrics metrics = CoverageMetrics.of(grid, 2);

    assertEquals(4, metrics.getTotalCells());
    assertEquals(3, metrics.getReachableCells());
    assertEquals(75.0, metrics.getCoveragePercentage(), 1e-9);
    assertEquals(400.0, metrics.getAverageResponseTime(), 1e-9);
    assertEquals(400.0, metrics.getMedianResponseTime(), 1e-9);
    assertEquals(700.0, metrics.getMaxResponseTime(), 1e-9);
    assertEquals(1, metrics.getCells(ServiceLevel.EXCELLENT));
    assertEquals(1, metrics.getCells(ServiceLevel.GOOD));
    assertEquals(1, metrics.getCells(ServiceLevel.FAIR));
    assertEquals(0, metrics.getCells(ServiceLevel.POOR));
    assertEquals(1, metrics.getCells(ServiceLevel.UNREACHABLE));
    assertEquals(10_000.0, metrics.getBlindAreaSquareMeters(), 1e-9);
    assertEquals(40_000.0, metrics.getTotalAreaSquareMeters(), 1e-9);
    assertEquals(2, metrics.getStationsAnalyzed());
    assertEquals("grid_1_1", grid.cell(1, 1).getId());
  }

  @Test
  void emptyReachableSetReportsZeroTimes() {
    CoverageGrid grid = new CoverageGrid(50, 1, 1,
        Arrays.asList(new CoverageCell(0, 0, new Coordinate(25, 25), null, null)));

    CoverageMetrics metrics = CoverageMetrics.of(grid, 1);

    assertEquals(0.0, metrics.getCoveragePercentage());
    assertEquals(0.0, metrics.getAverageResponseTime());
    assertEquals(0.0, metrics.getMedianResponseTime());
  }

  @Test
  void rejectsMismatchedCellCount() {
    assertThrows(IllegalArgumentException.class, () -> new CoverageGrid(100, 2, 2, new ArrayList<>()));
  }
}
