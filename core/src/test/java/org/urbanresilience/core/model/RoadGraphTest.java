package org.urbanresilience.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

final class RoadGraphTest {

  @Test
  void addEdgeMeasuresLengthAndDirection() {
    RoadGraph graph = new RoadGraph();
    RoadNode a = graph.addNode(0, 0, NodeKind.INTERSECTION);
    RoadNode b = graph.addNode(0, 40, NodeKind.INTERSECTION);

    RoadEdge edge = graph.addEdge(new RoadEdge.Builder().between(a.getId(), b.getId()).width(6));

    assertEquals(40.0, edge.getLength(), 1e-9);
    assertEquals(CompassDirection.NORTH, edge.getPrimaryDirection());
    assertEquals(edge.getId(), edge.getOriginEdgeId());
    assertEquals(2, edge.getLaneInfo().size());
    assertEquals(List.of(edge), graph.edgesAt(a.getId()));
    assertEquals(b.getId(), edge.opposite(a.getId()));
  }

  @Test
  void currentWidthStaysWithinBounds() {
    RoadGraph graph = new RoadGraph();
    RoadEdge edge = line(graph, 12.0);

    edge.setCurrentWidth(-3.0);
    assertEquals(0.0, edge.getCurrentWidth());
    edge.setCurrentWidth(50.0);
    assertEquals(12.0, edge.getCurrentWidth());
    edge.setCurrentWidth(3.0);
    assertEquals(0.25, edge.widthRatio(), 1e-9);

    graph.resetWidths();
    assertEquals(12.0, edge.getCurrentWidth());
  }

  @Test
  void removedEdgeCanBeRestoredWithItsId() {
    RoadGraph graph = new RoadGraph();
    RoadEdge edge = line(graph, 6.0);
    String before = graph.fingerprint();

    graph.removeEdge(edge.getId());
    assertEquals(0, graph.degree(edge.getFromNode()));

    graph.restoreEdge(edge);
    assertEquals(before, graph.fingerprint());
  }

  @Test
  void restoringAnEdgeTwiceFails() {
    RoadGraph graph = new RoadGraph();
    RoadEdge edge = line(graph, 6.0);

    assertThrows(IllegalStateException.class, () -> graph.restoreEdge(edge));
  }

  @Test
  void missingLookupsAreInvariantViolations() {
    RoadGraph graph = new RoadGraph();

    assertThrows(IllegalStateException.class, () -> graph.node(42));
    assertThrows(IllegalStateException.class, () -> graph.edge(42));
    assertTrue(graph.findNode(42).isEmpty());
  }

  @Test
  void nodeWithEdgesCannotBeRemoved() {
    RoadGraph graph = new RoadGraph();
    RoadEdge edge = line(graph, 6.0);

    assertThrows(IllegalStateException.class, () -> graph.removeNode(edge.getFromNode()));
  }

  @Test
  void pruneRemovesOnlyIsolatedNodes() {
    RoadGraph graph = new RoadGraph();
    line(graph, 6.0);
    graph.addNode(500, 500, NodeKind.INTERSECTION);

    assertEquals(1, graph.pruneIsolatedNodes());
    assertEquals(2, graph.nodeCount());
  }

  @Test
  void derivedBuilderKeepsAttributesAndOrigin() {
    RoadGraph graph = new RoadGraph();
    RoadEdge edge = line(graph, 12.0);
    edge.setCurrentWidth(5.0);
    RoadNode mid = graph.addNode(50, 0, NodeKind.VIRTUAL);

    RoadEdge half = graph.addEdge(edge.derive(edge.getFromNode(), mid.getId()));

    assertEquals(50.0, half.getLength(), 1e-9);
    assertEquals(5.0, half.getCurrentWidth());
    assertEquals(12.0, half.getOriginalWidth());
    assertEquals(edge.getId(), half.getOriginEdgeId());
    assertEquals(edge.getLaneInfo(), half.getLaneInfo());
    assertEquals(RoadClass.MAIN, half.getRoadClass());
  }

  private static RoadEdge line(RoadGraph graph, double width) {
    RoadNode a = graph.addNode(0, 0, NodeKind.INTERSECTION);
    RoadNode b = graph.addNode(100, 0, NodeKind.INTERSECTION);
    return graph.addEdge(
        new RoadEdge.Builder()
            .between(a.getId(), b.getId())
            .width(width)
            .lanes(4)
            .roadClass(RoadClass.MAIN)
            .speedLimitKmh(70));
  }
}
