package org.urbanresilience.simulation.disaster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.urbanresilience.simulation.config.DisasterConfig;

final class CollapseModelTest {

  @Test
  void mostVulnerableTreeAtFullIntensity() {
    CollapseModel model = new CollapseModel(new DisasterConfig.Builder().intensity(10).build());

    assertEquals(0.8, model.collapseProbability(VulnerabilityLevel.I), 1e-12);
    assertEquals(0.5, model.collapseProbability(VulnerabilityLevel.II), 1e-12);
    assertEquals(0.1, model.collapseProbability(VulnerabilityLevel.III), 1e-12);
  }

  @Test
  void lowIntensityHalvesTheRateAtMost() {
    assertEquals(0.055, CollapseModel.collapseProbability(0.1, 1.0), 1e-12);
    assertEquals(0.6, CollapseModel.collapseProbability(0.8, 5.0), 1e-12);
    assertEquals(1.0, CollapseModel.collapseProbability(1.0, 10.0), 1e-12);
  }

  @Test
  void certainAndImpossibleCollapse() {
    DisasterConfig config = new DisasterConfig.Builder()
        .intensity(10)
        .collapseRate(VulnerabilityLevel.I, 1.0)
        .collapseRate(VulnerabilityLevel.III, 0.0)
        .build();
    CollapseModel model = new CollapseModel(config);
    Random random = new Random(3);
    TreeRecord fragile = new TreeRecord("a", 0, 0, VulnerabilityLevel.I, 10, 1);
    TreeRecord sturdy = new TreeRecord("b", 0, 0, VulnerabilityLevel.III, 10, 1);

    for (int i = 0; i < 100; i++) {
      assertTrue(model.collapses(fragile, random));
      assertFalse(model.collapses(sturdy, random));
    }
  }

  @Test
  void fallenTreeCoversTrunkWidthAlongItsHeight() {
    List<Coordinate> corners = CollapseModel.blockagePolygon(0, 0, 10, 2, 0);

    assertEquals(4, corners.size());
    assertCoordinate(0, 1, corners.get(0));
    assertCoordinate(0, -1, corners.get(1));
    assertCoordinate(10, -1, corners.get(2));
    assertCoordinate(10, 1, corners.get(3));
  }

  @Test
  void severityScalesWithSizeAndLevel() {
    assertEquals(0.35, CollapseModel.severity(new TreeRecord("t", 0, 0, VulnerabilityLevel.II, 10, 1)), 1e-12);
    assertEquals(1.0, CollapseModel.severity(new TreeRecord("t", 0, 0, VulnerabilityLevel.I, 30, 1.5)), 1e-12);
    assertEquals(0.4, CollapseModel.severity(new TreeRecord("t", 0, 0, VulnerabilityLevel.III, 30, 1.5)), 1e-12);
  }

  private static void assertCoordinate(double x, double y, Coordinate actual) {
    assertEquals(x, actual.x, 1e-9);
    assertEquals(y, actual.y, 1e-9);
  }
}
