package org.urbanresilience.simulation.disaster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.urbanresilience.core.model.NodeKind;
import org.urbanresilience.core.model.RoadClass;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;
import org.urbanresilience.simulation.config.DisasterConfig;

final class TreeCollapseSimulatorTest {

  private static DisasterConfig everythingFalls() {
    DisasterConfig.Builder builder = new DisasterConfig.Builder().intensity(10);
    for (VulnerabilityLevel level : VulnerabilityLevel.values()) {
      builder.collapseRate(level, 1.0);
    }
    return builder.build();
  }

  private static RoadGraph street() {
    RoadGraph graph = new RoadGraph();
    int a = graph.addNode(0, 0, NodeKind.INTERSECTION).getId();
    int b = graph.addNode(200, 0, NodeKind.INTERSECTION).getId();
    graph.addEdge(new RoadEdge.Builder()
        .between(a, b)
        .width(6)
        .lanes(2)
        .bidirectional(true)
        .roadClass(RoadClass.SECONDARY)
        .speedLimitKmh(30));
    return graph;
  }

  private static List<TreeRecord> avenue(int count) {
    List<TreeRecord> trees = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      VulnerabilityLevel level = VulnerabilityLevel.values()[i % 3];
      trees.add(new TreeRecord("tree-" + i, 10 + i * 15, 0, level, 12, 0.8));
    }
    return trees;
  }

  @Test
  void treeStandingOnTheRoadAlwaysObstructsIt() {
    TreeCollapseSimulator simulator = new TreeCollapseSimulator(everythingFalls(), new Random(11));

    DisasterSimulationResult result = simulator.simulate(avenue(9), street());

    assertEquals(9, result.getEvents().size());
    assertEquals(9, result.getObstructions().size());
    SimulationStatistics stats = result.getStatistics();
    assertEquals(9, stats.getTreesAffected());
    assertEquals(1, stats.getRoadsAffected());
    assertEquals(3, (int) stats.getTreesByLevel().get(VulnerabilityLevel.II));
    assertTrue(stats.getTotalBlockedLength() > 0);
    for (RoadObstruction obstruction : result.getObstructions()) {
      assertTrue(obstruction.getRemainingWidth() >= 0 && obstruction.getRemainingWidth() <= 6.0);
      assertTrue(obstruction.getForwardRemaining().isPresent());
      assertEquals((6.0 - obstruction.getRemainingWidth()) / 6.0 * 100.0, obstruction.getBlockedPercentage(), 1e-9);
      assertFalse(obstruction.getPolygon().isEmpty());
    }
  }

  @Test
  void seededRunsAreReproducible() {
    DisasterConfig config = new DisasterConfig.Builder().intensity(7).randomSeed(99).build();

    DisasterSimulationResult first = new TreeCollapseSimulator(config).simulate(avenue(12), street());
    DisasterSimulationResult second = new TreeCollapseSimulator(config).simulate(avenue(12), street());

    assertEquals(first.getEvents().size(), second.getEvents().size());
    for (int i = 0; i < first.getEvents().size(); i++) {
      assertEquals(first.getEvents().get(i).getTreeId(), second.getEvents().get(i).getTreeId());
      assertEquals(first.getEvents().get(i).getAngleDegrees(), second.getEvents().get(i).getAngleDegrees());
    }
    assertEquals(first.getObstructions().size(), second.getObstructions().size());
  }

  @Test
  void calmWeatherProducesEmptyStatistics() {
    DisasterConfig.Builder builder = new DisasterConfig.Builder();
    for (VulnerabilityLevel level : VulnerabilityLevel.values()) {
      builder.collapseRate(level, 0.0);
    }

    DisasterSimulationResult result = new TreeCollapseSimulator(builder.build(), new Random(1))
        .simulate(avenue(6), street());

    SimulationStatistics stats = result.getStatistics();
    assertTrue(result.getEvents().isEmpty());
    assertEquals(0, stats.getRoadsAffected());
    assertEquals(0.0, stats.getAverageBlockagePercentage());
    assertEquals(3, stats.getTreesByLevel().size());
    assertEquals(6, stats.getTreesEvaluated());
  }

  @Test
  void roadKnownByOneEndpointGetsConservativeBlockage() {
    RoadFootprint anchored = new RoadFootprint(7, new Coordinate(0, 0), null, 6, true, Collections.emptyList());
    RoadFootprint unknown = new RoadFootprint(8, null, null, 6, true, Collections.emptyList());
    TreeRecord tree = new TreeRecord("t", 1, 1, VulnerabilityLevel.I, 10, 1);

    DisasterSimulationResult result = new TreeCollapseSimulator(everythingFalls(), new Random(5))
        .simulate(Collections.singletonList(tree), Arrays.asList(anchored, unknown));

    assertEquals(1, result.getObstructions().size());
    RoadObstruction obstruction = result.getObstructions().get(0);
    assertEquals(7, obstruction.getEdgeId());
    assertTrue(obstruction.isApproximated());
    assertEquals(1.8, obstruction.getRemainingWidth(), 1e-9);
    assertEquals(70.0, obstruction.getBlockedPercentage(), 1e-9);
  }
}
