package org.urbanresilience.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

final class GraphComponentsTest {

  @Test
  void findsComponentsLargestFirst() {
    RoadGraph graph = new RoadGraph();
    RoadNode a = graph.addNode(0, 0, NodeKind.INTERSECTION);
    RoadNode b = graph.addNode(10, 0, NodeKind.INTERSECTION);
    RoadNode c = graph.addNode(20, 0, NodeKind.INTERSECTION);
    RoadNode d = graph.addNode(100, 0, NodeKind.INTERSECTION);
    RoadNode e = graph.addNode(110, 0, NodeKind.INTERSECTION);
    graph.addEdge(new RoadEdge.Builder().between(a.getId(), b.getId()));
    graph.addEdge(new RoadEdge.Builder().between(b.getId(), c.getId()));
    graph.addEdge(new RoadEdge.Builder().between(d.getId(), e.getId()));

    GraphComponents components = GraphComponents.of(graph);

    assertEquals(2, components.count());
    assertEquals(List.of(a.getId(), b.getId(), c.getId()), components.getComponents().get(0));
    assertEquals(3, components.largestSize());
    assertFalse(components.isConnected());
  }

  @Test
  void filteredEdgesSplitTheGraph() {
    RoadGraph graph = new RoadGraph();
    RoadNode a = graph.addNode(0, 0, NodeKind.INTERSECTION);
    RoadNode b = graph.addNode(10, 0, NodeKind.INTERSECTION);
    RoadEdge edge = graph.addEdge(new RoadEdge.Builder().between(a.getId(), b.getId()).width(6));

    assertTrue(GraphComponents.of(graph).isConnected());

    edge.setCurrentWidth(1.0);
    assertEquals(2, GraphComponents.of(graph, e -> e.getCurrentWidth() >= 2.0).count());
  }
}
