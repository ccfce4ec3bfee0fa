package org.urbanresilience.simulation.network;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.SortedMap;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.urbanresilience.core.model.NodeKind;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;
import org.urbanresilience.simulation.config.AnalyzerConfig;
import org.urbanresilience.simulation.disaster.RoadObstruction;

final class NetworkAnalyzerTest {

  private static RoadObstruction obstruction(RoadEdge edge, double remaining) {
    return new RoadObstruction.Builder().edgeId(edge.getId()).remainingWidth(remaining).build();
  }

  @Test
  void rejectsEmptyGraph() {
    assertThrows(IllegalArgumentException.class, () -> new NetworkAnalyzer(new RoadGraph()));
  }

  @Test
  void emptyObstructionSetRestoresEveryWidth() {
    RoadGraph graph = TestNetworks.grid(3, 100);
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);
    for (RoadEdge edge : graph.edges()) {
      analyzer.applyObstructions(Collections.singletonList(obstruction(edge, 1.0)));
    }

    analyzer.clearObstructions();
    analyzer.clearObstructions();

    for (RoadEdge edge : graph.edges()) {
      assertEquals(edge.getOriginalWidth(), edge.getCurrentWidth());
    }
    assertTrue(analyzer.getActiveObstructions().isEmpty());
  }

  @Test
  void narrowestObstructionWinsRegardlessOfOrder() {
    RoadGraph graph = TestNetworks.grid(3, 100);
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);
    RoadEdge edge = TestNetworks.edgeBetween(graph, 0, 0, 100, 0);
    RoadObstruction wide = obstruction(edge, 4.0);
    RoadObstruction narrow = obstruction(edge, 1.5);

    analyzer.applyObstructions(Arrays.asList(wide, narrow));
    assertEquals(1.5, edge.getCurrentWidth());

    analyzer.applyObstructions(Arrays.asList(narrow, wide));
    assertEquals(1.5, edge.getCurrentWidth());
  }

  @Test
  void widthsStayWithinBoundsAndUnknownEdgesAreSkipped() {
    RoadGraph graph = TestNetworks.grid(3, 100);
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);
    RoadEdge first = TestNetworks.edgeBetween(graph, 0, 0, 100, 0);
    RoadEdge second = TestNetworks.edgeBetween(graph, 0, 0, 0, 100);
    RoadObstruction unknown = new RoadObstruction.Builder().edgeId(999).remainingWidth(1.0).build();

    int applied = analyzer.applyObstructions(
        Arrays.asList(obstruction(first, -2.0), obstruction(second, 40.0), unknown));

    assertEquals(2, applied);
    assertEquals(0.0, first.getCurrentWidth());
    assertEquals(6.0, second.getCurrentWidth());
    for (RoadEdge edge : graph.edges()) {
      assertTrue(edge.getCurrentWidth() >= 0.0 && edge.getCurrentWidth() <= edge.getOriginalWidth());
    }
  }

  @Test
  void findPathLeavesGraphUntouched() {
    RoadGraph graph = TestNetworks.grid(4, 100);
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);
    String before = analyzer.fingerprint();

    PathResult result = analyzer.findPath(
        PathRequest.of(new Coordinate(40, -10), new Coordinate(300, 255), VehicleType.AMBULANCE));

    assertTrue(result.isSuccess());
    assertFalse(result.isPartial());
    assertEquals(new Coordinate(40, -10), result.getCoordinates().get(0));
    Coordinate last = result.getCoordinates().get(result.getCoordinates().size() - 1);
    assertEquals(0.0, last.distance(new Coordinate(300, 255)), 1e-9);
    for (int node : result.getNodeIds()) {
      assertEquals(NodeKind.INTERSECTION, graph.node(node).getKind());
    }
    assertEquals(before, analyzer.fingerprint());
  }

  @Test
  void blockedRoadForcesDetour() {
    RoadGraph graph = TestNetworks.grid(4, 100);
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);
    RoadEdge middle = TestNetworks.edgeBetween(graph, 100, 0, 200, 0);
    PathRequest request = PathRequest.of(new Coordinate(0, 0), new Coordinate(300, 0), VehicleType.AMBULANCE);

    assertEquals(30.0, analyzer.findPath(request).getTravelTime(), 1e-9);

    analyzer.applyObstructions(Collections.singletonList(obstruction(middle, 0.0)));
    PathResult detour = analyzer.findPath(request);

    assertTrue(detour.isSuccess());
    assertEquals(50.0, detour.getTravelTime(), 1e-9);
    assertFalse(detour.getEdgeIds().contains(middle.getId()));
  }

  @Test
  void narrowedRoadIsReportedWhenTraversed() {
    RoadGraph graph = TestNetworks.grid(4, 100);
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);
    RoadEdge middle = TestNetworks.edgeBetween(graph, 100, 0, 200, 0);
    analyzer.applyObstructions(Collections.singletonList(obstruction(middle, 4.0)));

    PathResult result = analyzer.findPath(
        PathRequest.of(new Coordinate(0, 0), new Coordinate(300, 0), VehicleType.CAR));

    assertTrue(result.isSuccess());
    assertEquals(40.0, result.getTravelTime(), 1e-9);
    assertEquals(Collections.singletonList(middle.getId()), result.getObstructedRoads());
  }

  @Test
  void disconnectedDestinationYieldsPartialRoute() {
    RoadGraph graph = TestNetworks.grid(4, 100);
    TestNetworks.segment(graph, 1000, 0, 1100, 0);
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);

    PathResult result = analyzer.findPath(
        PathRequest.of(new Coordinate(0, 0), new Coordinate(1100, 0), VehicleType.CAR));

    assertFalse(result.isSuccess());
    assertTrue(result.isPartial());
    assertEquals(PartialReason.NO_ROUTE, result.getPartialReason().get());
    assertEquals(new Coordinate(300, 0), result.getCoordinates().get(result.getCoordinates().size() - 1));
  }

  @Test
  void travelTimeCeilingIsHonored() {
    RoadGraph graph = TestNetworks.grid(4, 100);
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);

    PathResult result = analyzer.findPath(
        PathRequest.of(new Coordinate(0, 0), new Coordinate(300, 300), VehicleType.CAR).withMaxTravelTime(25.0));

    assertEquals(PartialReason.TIME_LIMIT_EXCEEDED, result.getPartialReason().get());
    assertTrue(result.getTravelTime() <= 25.0);
    assertEquals(new Coordinate(100, 100), result.getCoordinates().get(result.getCoordinates().size() - 1));
  }

  @Test
  void expansionGuardStopsLongSearches() {
    RoadGraph graph = TestNetworks.grid(4, 100);
    AnalyzerConfig config = new AnalyzerConfig.Builder().maxExpansions(2).build();
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph, config);

    PathResult result = analyzer.findPath(
        PathRequest.of(new Coordinate(0, 0), new Coordinate(300, 300), VehicleType.CAR));

    assertEquals(PartialReason.SEARCH_LIMIT_REACHED, result.getPartialReason().get());
  }

  @Test
  void randomPointsAlwaysGetAnAnswer() {
    RoadGraph graph = TestNetworks.grid(4, 100);
    TestNetworks.segment(graph, 600, 600, 700, 600);
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);
    String before = analyzer.fingerprint();
    Random random = new Random(42);

    for (int i = 0; i < 50; i++) {
      Coordinate start = new Coordinate(random.nextDouble() * 700, random.nextDouble() * 700);
      Coordinate end = new Coordinate(random.nextDouble() * 700, random.nextDouble() * 700);
      PathResult result = analyzer.findPath(PathRequest.of(start, end, VehicleType.FIRE_TRUCK));
      assertTrue(result.isSuccess() || result.isPartial(), "no answer for " + start + " -> " + end);
      assertTrue(result.getCoordinates().get(0).distance(start) <= AnalyzerConfig.DEFAULT_ACCESS_TOLERANCE);
    }
    assertEquals(before, analyzer.fingerprint());
  }

  @Test
  void farAwayPointsAreForceConnected() {
    RoadGraph graph = TestNetworks.grid(4, 100);
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);
    String before = analyzer.fingerprint();

    PathResult result = analyzer.findPath(
        PathRequest.of(new Coordinate(1000, 1000), new Coordinate(0, 0), VehicleType.AMBULANCE));

    assertTrue(result.isSuccess());
    assertEquals(new Coordinate(1000, 1000), result.getCoordinates().get(0));
    assertEquals(new Coordinate(300, 300), result.getCoordinates().get(1));
    assertEquals(before, analyzer.fingerprint());
  }

  @Test
  void alternativesUseDifferentStreets() {
    RoadGraph graph = new RoadGraph();
    int s = graph.addNode(0, 0, NodeKind.INTERSECTION).getId();
    int up = graph.addNode(100, 50, NodeKind.INTERSECTION).getId();
    int down = graph.addNode(100, -50, NodeKind.INTERSECTION).getId();
    int t = graph.addNode(200, 0, NodeKind.INTERSECTION).getId();
    graph.addEdge(TestNetworks.street(s, up));
    graph.addEdge(TestNetworks.street(up, t));
    graph.addEdge(TestNetworks.street(s, down));
    graph.addEdge(TestNetworks.street(down, t));
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);
    String before = analyzer.fingerprint();

    List<PathResult> routes = analyzer.findAlternativePaths(
        PathRequest.of(new Coordinate(0, 0), new Coordinate(200, 0), VehicleType.CAR), 3);

    assertEquals(2, routes.size());
    assertTrue(Collections.disjoint(routes.get(0).getEdgeIds(), routes.get(1).getEdgeIds()));
    assertEquals(routes.get(0).getTravelTime(), routes.get(1).getTravelTime(), 1e-9);
    assertEquals(before, analyzer.fingerprint());
  }

  @Test
  void alternativesRejectBadArguments() {
    NetworkAnalyzer analyzer = new NetworkAnalyzer(TestNetworks.grid(2, 100));
    PathRequest request = PathRequest.of(new Coordinate(0, 0), new Coordinate(100, 100), VehicleType.CAR);

    assertThrows(IllegalArgumentException.class, () -> analyzer.findAlternativePaths(request, 3, 0.5, 0.7));
    assertThrows(IllegalArgumentException.class, () -> analyzer.findAlternativePaths(request, 0));
  }

  @Test
  void isochronesNest() {
    RoadGraph graph = TestNetworks.grid(4, 100);
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);
    String before = analyzer.fingerprint();

    SortedMap<Double, ServiceArea> areas = analyzer.isochrones(
        new Coordinate(0, 0), VehicleType.CAR.defaultProfile(), Arrays.asList(65.0, 15.0, 25.0));

    assertEquals(Arrays.asList(15.0, 25.0, 65.0), Arrays.asList(areas.keySet().toArray(new Double[0])));
    ServiceArea first = areas.get(15.0);
    assertEquals(3, first.getReachableNodeCount());
    assertEquals(5000.0, first.getArea(), 1e-6);

    ServiceArea previous = null;
    for (ServiceArea area : areas.values()) {
      if (previous != null) {
        assertTrue(area.getReachableNodeIds().containsAll(previous.getReachableNodeIds()));
        assertTrue(area.getArea() >= previous.getArea());
      }
      previous = area;
    }
    assertEquals(16, areas.get(65.0).getReachableNodeCount());
    assertEquals(before, analyzer.fingerprint());
  }

  @Test
  void serviceAreaRejectsNonPositiveBudget() {
    NetworkAnalyzer analyzer = new NetworkAnalyzer(TestNetworks.grid(2, 100));

    assertThrows(IllegalArgumentException.class,
        () -> analyzer.serviceArea(new Coordinate(0, 0), VehicleType.CAR.defaultProfile(), 0.0));
    assertThrows(IllegalArgumentException.class,
        () -> analyzer.isochrones(new Coordinate(0, 0), VehicleType.CAR.defaultProfile(), Collections.emptyList()));
  }

  @Test
  void connectivityDetectsFragmentation() {
    RoadGraph graph = TestNetworks.grid(4, 100);
    NetworkAnalyzer analyzer = new NetworkAnalyzer(graph);
    assertFalse(analyzer.analyzeConnectivity(VehicleType.AMBULANCE.defaultProfile()).isFragmented());

    analyzer.applyObstructions(Arrays.asList(
        obstruction(TestNetworks.edgeBetween(graph, 0, 0, 100, 0), 0.0),
        obstruction(TestNetworks.edgeBetween(graph, 0, 100, 100, 100), 0.0),
        obstruction(TestNetworks.edgeBetween(graph, 0, 200, 100, 200), 0.0),
        obstruction(TestNetworks.edgeBetween(graph, 0, 300, 100, 300), 2.0)));

    ConnectivityReport ambulance = analyzer.analyzeConnectivity(VehicleType.AMBULANCE.defaultProfile());
    assertTrue(ambulance.isFragmented());
    assertEquals(2, ambulance.getComponentCount());
    assertEquals(12, ambulance.getLargestComponentSize());
    assertEquals(20, ambulance.getPassableEdges());
    assertEquals(4, ambulance.getBlockedEdges());
    assertEquals(4, ambulance.getSeverelyObstructedEdges());
    assertEquals(20.0 / 24.0, ambulance.getConnectivityRatio(), 1e-9);

    ConnectivityReport pedestrian = analyzer.analyzeConnectivity(VehicleType.PEDESTRIAN.defaultProfile());
    assertEquals(21, pedestrian.getPassableEdges());
  }
}
