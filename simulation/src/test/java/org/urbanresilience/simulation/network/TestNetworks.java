package org.urbanresilience.simulation.network;

import org.urbanresilience.core.model.NodeKind;
import org.urbanresilience.core.model.RoadClass;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;
import org.urbanresilience.core.model.RoadNode;

/** Small hand-built networks shared by the routing tests. */
final class TestNetworks {

  /** 36 km/h, so every 100 m block takes 10 s. */
  static final double SPEED_KMH = 36.0;

  private TestNetworks() {}

  /** Square grid of {@code n x n} intersections, {@code spacing} apart, starting at the origin. */
  static RoadGraph grid(int n, double spacing) {
    RoadGraph graph = new RoadGraph();
    int[][] ids = new int[n][n];
    for (int row = 0; row < n; row++) {
      for (int col = 0; col < n; col++) {
        ids[row][col] = graph.addNode(col * spacing, row * spacing, NodeKind.INTERSECTION).getId();
      }
    }
    for (int row = 0; row < n; row++) {
      for (int col = 0; col < n; col++) {
        if (col + 1 < n) {
          graph.addEdge(street(ids[row][col], ids[row][col + 1]));
        }
        if (row + 1 < n) {
          graph.addEdge(street(ids[row][col], ids[row + 1][col]));
        }
      }
    }
    return graph;
  }

  static RoadEdge.Builder street(int from, int to) {
    return new RoadEdge.Builder()
        .between(from, to)
        .width(6.0)
        .lanes(2)
        .bidirectional(true)
        .roadClass(RoadClass.SECONDARY)
        .speedLimitKmh(SPEED_KMH);
  }

  static RoadEdge segment(RoadGraph graph, double x1, double y1, double x2, double y2) {
    RoadNode a = graph.addNode(x1, y1, NodeKind.INTERSECTION);
    RoadNode b = graph.addNode(x2, y2, NodeKind.INTERSECTION);
    return graph.addEdge(street(a.getId(), b.getId()));
  }

  static RoadNode nodeAt(RoadGraph graph, double x, double y) {
    for (RoadNode node : graph.nodes()) {
      if (Math.abs(node.getX() - x) < 1e-6 && Math.abs(node.getY() - y) < 1e-6) {
        return node;
      }
    }
    throw new AssertionError("no node at " + x + "," + y);
  }

  static RoadEdge edgeBetween(RoadGraph graph, double x1, double y1, double x2, double y2) {
    int a = nodeAt(graph, x1, y1).getId();
    int b = nodeAt(graph, x2, y2).getId();
    for (RoadEdge edge : graph.edgesAt(a)) {
      if (edge.opposite(a) == b) {
        return edge;
      }
    }
    throw new AssertionError("no edge between " + a + " and " + b);
  }
}
