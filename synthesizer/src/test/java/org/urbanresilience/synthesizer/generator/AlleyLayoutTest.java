package org.urbanresilience.synthesizer.generator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.urbanresilience.core.model.LaneDirection;
import org.urbanresilience.core.model.LaneInfo;
import org.urbanresilience.core.model.RoadClass;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;
import org.urbanresilience.core.model.RoadNode;
import org.urbanresilience.synthesizer.config.SynthesizerConfig;

final class AlleyLayoutTest {

  private static final double EPS = 1e-9;

  @Test
  void fullLengthHorizontalAlleySpansTheBlock() {
    SynthesizerConfig config = new SynthesizerConfig.Builder().bidirectionalProbability(1.0).build();
    RoadGraph graph = new RoadGraph();
    AlleyLayout layout = new AlleyLayout(config, new Random(1));

    RoadEdge alley = layout.layAlley(graph, new AlleyLayout.Block(100, 400, 200, 500), true, true);

    assertNotNull(alley);
    RoadNode from = graph.node(alley.getFromNode());
    RoadNode to = graph.node(alley.getToNode());
    assertEquals(100.0, from.getX(), EPS);
    assertEquals(400.0, to.getX(), EPS);
    assertEquals(from.getY(), to.getY(), EPS);
    assertTrue(from.getY() >= 260.0 && from.getY() <= 440.0);
    assertEquals(RoadClass.SECONDARY, alley.getRoadClass());
    assertEquals(6.0, alley.getOriginalWidth(), EPS);
    assertEquals(30.0, alley.getSpeedLimitKmh(), EPS);
    assertTrue(alley.isBidirectional());
    assertEquals(3.0, LaneInfo.totalWidth(alley.getLaneInfo(), LaneDirection.BACKWARD), EPS);
  }

  @Test
  void partialAlleyStartsOnABlockSideAndStaysInside() {
    SynthesizerConfig config =
        new SynthesizerConfig.Builder().tiltProbability(1.0).bidirectionalProbability(0.0).build();
    AlleyLayout.Block block = new AlleyLayout.Block(0, 300, 0, 300);

    for (long seed = 0; seed < 50; seed++) {
      RoadGraph graph = new RoadGraph();
      RoadEdge alley = new AlleyLayout(config, new Random(seed)).layAlley(graph, block, false, false);
      assertNotNull(alley);
      assertFalse(alley.isBidirectional());
      RoadNode from = graph.node(alley.getFromNode());
      RoadNode to = graph.node(alley.getToNode());
      assertTrue(from.getY() == 0.0 || to.getY() == 300.0, "must touch a block side");
      double length = Math.abs(to.getY() - from.getY());
      assertTrue(length >= 0.3 * 300 - EPS && length <= 0.8 * 300 + EPS);
      for (RoadNode node : List.of(from, to)) {
        assertTrue(node.getX() >= AlleyLayout.TILT_BUFFER - EPS);
        assertTrue(node.getX() <= 300 - AlleyLayout.TILT_BUFFER + EPS);
      }
    }
  }

  @Test
  void tooShortAlleyIsDiscarded() {
    SynthesizerConfig config = new SynthesizerConfig.Builder().minRoadLength(5.0).build();
    RoadGraph graph = new RoadGraph();

    RoadEdge alley =
        new AlleyLayout(config, new Random(1)).layAlley(graph, new AlleyLayout.Block(0, 4, 0, 4), true, true);

    assertNull(alley);
    assertEquals(0, graph.nodeCount());
  }

  @Test
  void everyBlockGetsConfiguredAlleyCount() {
    SynthesizerConfig config = new SynthesizerConfig.Builder().alleysPerBlock(2, 2).build();
    RoadGraph graph = new RoadGraph();

    List<RoadEdge> alleys =
        new AlleyLayout(config, new Random(9))
            .layAlleys(graph, List.of(0.0, 500.0, 1000.0), List.of(0.0, 500.0));

    assertEquals(4, alleys.size());
  }
}
