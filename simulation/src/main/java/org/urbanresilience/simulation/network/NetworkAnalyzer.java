package org.urbanresilience.simulation.network;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanresilience.core.geometry.GeometryUtils;
import org.urbanresilience.core.model.GraphComponents;
import org.urbanresilience.core.model.NodeKind;
import org.urbanresilience.core.model.RoadClass;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;
import org.urbanresilience.core.model.RoadNode;
import org.urbanresilience.simulation.config.AnalyzerConfig;
import org.urbanresilience.simulation.disaster.RoadObstruction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Routing and reachability over a road network whose widths reflect the current obstructions.
 * <p>
 * The analyzer owns its graph. Queries splice temporary nodes into it and remove them again
 * before returning; one lock serializes all operations on an instance.
 */
public final class NetworkAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(NetworkAnalyzer.class);

    public static final double DEFAULT_DIVERSITY_FACTOR = 1.5;
    public static final double DEFAULT_MINIMUM_DIFFERENCE = 0.7;
    private static final double SEVERE_RATIO = 0.5;

    private final RoadGraph graph;
    private final AnalyzerConfig config;
    private final EdgeCostModel costModel;
    private final PointAttacher attacher;
    private final ReentrantLock lock = new ReentrantLock();
    private final NavigableMap<Integer, Double> activeObstructions = new TreeMap<>();

    public NetworkAnalyzer(RoadGraph graph) {
        this(graph, AnalyzerConfig.defaults());
    }

    public NetworkAnalyzer(RoadGraph graph, AnalyzerConfig config) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        if (graph.isEmpty() || graph.edgeCount() == 0) {
            throw new IllegalArgumentException("road graph must contain at least one edge");
        }
        this.costModel = new TravelTimeCostModel();
        this.attacher = new PointAttacher(config);
        log.info("Network analyzer ready: {} nodes, {} edges", graph.nodeCount(), graph.edgeCount());
    }

    /**
     * Replaces the active obstruction set. Widths are reset first; several obstructions on one
     * edge leave the narrowest remaining width.
     *
     * @return number of edges now obstructed
     */
    public int applyObstructions(Collection<RoadObstruction> obstructions) {
        Objects.requireNonNull(obstructions, "obstructions must not be null");
        lock.lock();
        try {
            graph.resetWidths();
            activeObstructions.clear();

            SortedMap<Integer, Double> narrowest = new TreeMap<>();
            for (RoadObstruction obstruction : obstructions) {
                if (!graph.containsEdge(obstruction.getEdgeId())) {
                    log.warn("Obstruction {} targets unknown edge {}, skipping", obstruction.getId(),
                            obstruction.getEdgeId());
                    continue;
                }
                narrowest.merge(obstruction.getEdgeId(), obstruction.getRemainingWidth(), Math::min);
            }
            for (Map.Entry<Integer, Double> entry : narrowest.entrySet()) {
                RoadEdge edge = graph.edge(entry.getKey());
                edge.setCurrentWidth(entry.getValue());
                activeObstructions.put(edge.getId(), edge.getCurrentWidth());
            }
            log.info("Applied {} obstructions to {} edges", obstructions.size(), activeObstructions.size());
            return activeObstructions.size();
        } finally {
            lock.unlock();
        }
    }

    public void clearObstructions() {
        applyObstructions(Collections.emptyList());
    }

    /** Obstructed edge ids with their current width. */
    public Map<Integer, Double> getActiveObstructions() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new TreeMap<>(activeObstructions));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fastest route between two points. Points off the network are attached first, so a query
     * never fails outright: it either succeeds or returns the best partial route.
     */
    public PathResult findPath(PathRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        lock.lock();
        try (GraphEditScope scope = new GraphEditScope(graph)) {
            AttachedPoint start = attacher.attach(scope, request.getStart());
            AttachedPoint end = attacher.attach(scope, request.getEnd());
            PathResult result = route(request, start, end, costModel);
            log.debug("{} -> {}", request, result);
            return result;
        } finally {
            lock.unlock();
        }
    }

    public List<PathResult> findAlternativePaths(PathRequest request, int maxAlternatives) {
        return findAlternativePaths(request, maxAlternatives, DEFAULT_DIVERSITY_FACTOR, DEFAULT_MINIMUM_DIFFERENCE);
    }

    /**
     * Up to {@code maxAlternatives} complete routes that each differ from the earlier ones by at least
     * {@code minimumDifference} of their roads. Empty when no complete route exists.
     */
    public List<PathResult> findAlternativePaths(PathRequest request, int maxAlternatives, double diversityFactor,
                                                 double minimumDifference) {
        Objects.requireNonNull(request, "request must not be null");
        if (maxAlternatives <= 0) {
            throw new IllegalArgumentException("maxAlternatives must be positive");
        }
        if (diversityFactor < 1.0) {
            throw new IllegalArgumentException("diversityFactor must be at least 1");
        }
        if (minimumDifference < 0.0 || minimumDifference > 1.0) {
            throw new IllegalArgumentException("minimumDifference must be in [0, 1]");
        }
        lock.lock();
        try (GraphEditScope scope = new GraphEditScope(graph)) {
            AttachedPoint start = attacher.attach(scope, request.getStart());
            AttachedPoint end = attacher.attach(scope, request.getEnd());

            List<PathResult> accepted = new ArrayList<>();
            Set<Integer> used = new HashSet<>();
            while (accepted.size() < maxAlternatives) {
                EdgeCostModel model = used.isEmpty() ? costModel : new DiversityCostModel(costModel, used, diversityFactor);
                PathResult candidate = route(request, start, end, model);
                if (!candidate.isSuccess()) {
                    break;
                }
                if (!accepted.isEmpty() && !differsFromAll(candidate, accepted, minimumDifference)) {
                    break;
                }
                accepted.add(candidate);
                used.addAll(candidate.getEdgeIds());
            }
            log.debug("{} alternatives for {}", accepted.size(), request);
            return accepted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Area reachable from {@code center} within {@code maxTravelTime} seconds.
     */
    public ServiceArea serviceArea(Coordinate center, VehicleProfile vehicle, double maxTravelTime) {
        return isochrones(center, vehicle, Collections.singletonList(maxTravelTime)).get(maxTravelTime);
    }

    /**
     * Nested service areas for several budgets, computed with a single search.
     */
    public SortedMap<Double, ServiceArea> isochrones(Coordinate center, VehicleProfile vehicle,
                                                     List<Double> thresholds) {
        Objects.requireNonNull(center, "center must not be null");
        Objects.requireNonNull(vehicle, "vehicle must not be null");
        Objects.requireNonNull(thresholds, "thresholds must not be null");
        if (thresholds.isEmpty()) {
            throw new IllegalArgumentException("at least one threshold is required");
        }
        TreeSet<Double> budgets = new TreeSet<>();
        for (Double threshold : thresholds) {
            if (threshold == null || !(threshold > 0) || threshold.isInfinite()) {
                throw new IllegalArgumentException("thresholds must be positive and finite: " + threshold);
            }
            budgets.add(threshold);
        }

        lock.lock();
        try (GraphEditScope scope = new GraphEditScope(graph)) {
            AttachedPoint origin = attacher.attach(scope, center);
            SearchTree tree = new DijkstraSearch(graph, costModel, vehicle)
                    .run(origin.getNodeId(), budgets.last(), Integer.MAX_VALUE);

            SortedMap<Double, ServiceArea> areas = new TreeMap<>();
            for (double budget : budgets) {
                areas.put(budget, toServiceArea(tree, budget));
            }
            return areas;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Which part of the network {@code vehicle} can still drive on.
     */
    public ConnectivityReport analyzeConnectivity(VehicleProfile vehicle) {
        Objects.requireNonNull(vehicle, "vehicle must not be null");
        lock.lock();
        try {
            int passable = 0;
            int severe = 0;
            double totalLength = 0.0;
            double passableLength = 0.0;
            for (RoadEdge edge : graph.edges()) {
                totalLength += edge.getLength();
                if (costModel.isPassable(edge, vehicle)) {
                    passable++;
                    passableLength += edge.getLength();
                }
                if (edge.widthRatio() < SEVERE_RATIO) {
                    severe++;
                }
            }
            GraphComponents components = GraphComponents.of(graph, edge -> costModel.isPassable(edge, vehicle));
            ConnectivityReport report = new ConnectivityReport(vehicle.getType(), graph.edgeCount(), passable,
                    totalLength, passableLength, severe, components.count(), components.largestSize());
            log.info("Connectivity: {}", report);
            return report;
        } finally {
            lock.unlock();
        }
    }

    /** Structural fingerprint of the owned graph. */
    public String fingerprint() {
        lock.lock();
        try {
            return graph.fingerprint();
        } finally {
            lock.unlock();
        }
    }

    RoadGraph graph() {
        return graph;
    }

    private PathResult route(PathRequest request, AttachedPoint start, AttachedPoint end, EdgeCostModel model) {
        VehicleProfile vehicle = request.getVehicle();
        AStarSearch search = new AStarSearch(graph, model, vehicle, config.getMaxExpansions());
        SearchTree tree = search.search(start.getNodeId(), end.getNodeId(), request.ceiling());
        if (tree.isSettled(end.getNodeId())) {
            return toResult(tree.pathTo(end.getNodeId()), vehicle).success().build();
        }

        PartialReason reason;
        if (tree.isLimitReached()) {
            reason = PartialReason.SEARCH_LIMIT_REACHED;
        } else if (tree.isPruned()) {
            reason = PartialReason.TIME_LIMIT_EXCEEDED;
        } else {
            reason = PartialReason.NO_ROUTE;
        }

        SearchTree reachable = new DijkstraSearch(graph, model, vehicle)
                .run(start.getNodeId(), request.ceiling(), config.getPartialSearchLimit());
        Coordinate goal = graph.coordinate(end.getNodeId());
        int closest = start.getNodeId();
        double closestDistance = Double.POSITIVE_INFINITY;
        for (int node : reachable.getSettled().keySet()) {
            double distance = graph.coordinate(node).distance(goal);
            if (distance < closestDistance) {
                closest = node;
                closestDistance = distance;
            }
        }
        log.debug("No complete route ({}), returning partial route to node {}", reason, closest);
        return toResult(reachable.pathTo(closest), vehicle).partial(reason).build();
    }

    private PathResult.Builder toResult(RoutePath path, VehicleProfile vehicle) {
        List<Coordinate> coordinates = new ArrayList<>(path.getNodes().size());
        List<Integer> persistentNodes = new ArrayList<>();
        for (int nodeId : path.getNodes()) {
            RoadNode node = graph.node(nodeId);
            coordinates.add(node.getCoordinate());
            if (!node.getKind().isTransient()) {
                persistentNodes.add(nodeId);
            }
        }

        Set<Integer> roads = new LinkedHashSet<>();
        double distance = 0.0;
        double time = 0.0;
        for (RoadEdge edge : path.getEdges()) {
            distance += edge.getLength();
            time += costModel.cost(edge, vehicle);
            if (edge.getRoadClass() != RoadClass.ACCESS) {
                roads.add(edge.getOriginEdgeId());
            }
        }
        List<Integer> obstructed = new ArrayList<>();
        for (int road : roads) {
            if (activeObstructions.containsKey(road)) {
                obstructed.add(road);
            }
        }
        return new PathResult.Builder()
                .coordinates(coordinates)
                .nodeIds(persistentNodes)
                .edgeIds(new ArrayList<>(roads))
                .totalDistance(distance)
                .travelTime(time)
                .vehicleType(vehicle.getType())
                .obstructedRoads(obstructed);
    }

    private static boolean differsFromAll(PathResult candidate, List<PathResult> accepted, double minimumDifference) {
        Set<Integer> roads = new HashSet<>(candidate.getEdgeIds());
        if (roads.isEmpty()) {
            return false;
        }
        for (PathResult other : accepted) {
            Set<Integer> shared = new HashSet<>(roads);
            shared.retainAll(other.getEdgeIds());
            double difference = 1.0 - (double) shared.size() / roads.size();
            if (difference < minimumDifference) {
                return false;
            }
        }
        return true;
    }

    private ServiceArea toServiceArea(SearchTree tree, double budget) {
        List<Coordinate> points = new ArrayList<>();
        List<Integer> persistent = new ArrayList<>();
        for (Map.Entry<Integer, Double> entry : tree.getSettled().entrySet()) {
            if (entry.getValue() > budget) {
                continue;
            }
            RoadNode node = graph.node(entry.getKey());
            points.add(node.getCoordinate());
            if (node.getKind() == NodeKind.INTERSECTION) {
                persistent.add(node.getId());
            }
        }
        Collections.sort(persistent);
        Geometry hull = GeometryUtils.convexHull(points);
        return new ServiceArea(budget, GeometryUtils.coordinates(hull), persistent, GeometryUtils.area(hull));
    }
}
