package org.urbanresilience.core.model;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Undirected road graph stored as an arena of nodes and edges keyed by integer id.
 *
 * Ids are allocated monotonically and never reused. Iteration follows id order, so any algorithm
 * that walks the graph is deterministic, and removing then restoring an edge leaves iteration
 * unchanged. The adjacency index is maintained on every mutation. Instances are not thread-safe.
 */
public final class RoadGraph {

    private static final Logger LOG = LoggerFactory.getLogger(RoadGraph.class);

    private final Map<Integer, RoadNode> nodes = new TreeMap<>();
    private final Map<Integer, RoadEdge> edges = new TreeMap<>();
    private final Map<Integer, Set<Integer>> adjacency = new TreeMap<>();

    private int nextNodeId = 1;
    private int nextEdgeId = 1;

    public RoadNode addNode(double x, double y, NodeKind kind) {
        RoadNode node = new RoadNode(nextNodeId++, x, y, kind);
        nodes.put(node.getId(), node);
        adjacency.put(node.getId(), new TreeSet<>());
        return node;
    }

    public RoadNode addNode(Coordinate coordinate, NodeKind kind) {
        return addNode(coordinate.x, coordinate.y, kind);
    }

    /**
     * Removes a node that has no incident edges.
     */
    public RoadNode removeNode(int nodeId) {
        RoadNode node = node(nodeId);
        Set<Integer> incident = adjacency.get(nodeId);
        if (!incident.isEmpty()) {
            throw new IllegalStateException("Node " + nodeId + " still has " + incident.size() + " edges");
        }
        nodes.remove(nodeId);
        adjacency.remove(nodeId);
        return node;
    }

    /**
     * Creates an edge with a fresh id. The length is measured from the endpoint coordinates.
     */
    public RoadEdge addEdge(RoadEdge.Builder builder) {
        RoadNode from = node(builder.getFromNode());
        RoadNode to = node(builder.getToNode());
        double dx = to.getX() - from.getX();
        double dy = to.getY() - from.getY();
        RoadEdge edge = builder.build(nextEdgeId++, Math.hypot(dx, dy), CompassDirection.of(dx, dy));
        link(edge);
        return edge;
    }

    /**
     * Puts a previously removed edge back under its original id.
     */
    public void restoreEdge(RoadEdge edge) {
        if (edges.containsKey(edge.getId())) {
            throw new IllegalStateException("Edge id " + edge.getId() + " is already in use");
        }
        if (edge.getId() >= nextEdgeId) {
            throw new IllegalStateException("Edge id " + edge.getId() + " was never allocated by this graph");
        }
        node(edge.getFromNode());
        node(edge.getToNode());
        link(edge);
    }

    public RoadEdge removeEdge(int edgeId) {
        RoadEdge edge = edges.remove(edgeId);
        if (edge == null) {
            throw new IllegalStateException("Unknown edge " + edgeId);
        }
        adjacency.get(edge.getFromNode()).remove(edgeId);
        adjacency.get(edge.getToNode()).remove(edgeId);
        return edge;
    }

    private void link(RoadEdge edge) {
        edges.put(edge.getId(), edge);
        adjacency.get(edge.getFromNode()).add(edge.getId());
        adjacency.get(edge.getToNode()).add(edge.getId());
    }

    /**
     * Node lookup for ids that must exist.
     *
     * @throws IllegalStateException if the node is missing
     */
    public RoadNode node(int nodeId) {
        RoadNode node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalStateException("Unknown node " + nodeId);
        }
        return node;
    }

    /**
     * Edge lookup for ids that must exist.
     *
     * @throws IllegalStateException if the edge is missing
     */
    public RoadEdge edge(int edgeId) {
        RoadEdge edge = edges.get(edgeId);
        if (edge == null) {
            throw new IllegalStateException("Unknown edge " + edgeId);
        }
        return edge;
    }

    public Optional<RoadNode> findNode(int nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public Optional<RoadEdge> findEdge(int edgeId) {
        return Optional.ofNullable(edges.get(edgeId));
    }

    public boolean containsEdge(int edgeId) {
        return edges.containsKey(edgeId);
    }

    /**
     * Edges incident to the node, in id order.
     */
    public List<RoadEdge> edgesAt(int nodeId) {
        Set<Integer> incident = adjacency.get(nodeId);
        if (incident == null) {
            throw new IllegalStateException("Unknown node " + nodeId);
        }
        List<RoadEdge> result = new ArrayList<>(incident.size());
        for (Integer edgeId : incident) {
            result.add(edges.get(edgeId));
        }
        return result;
    }

    public int degree(int nodeId) {
        Set<Integer> incident = adjacency.get(nodeId);
        return incident == null ? 0 : incident.size();
    }

    public Collection<RoadNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Collection<RoadEdge> edges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Coordinate coordinate(int nodeId) {
        return node(nodeId).getCoordinate();
    }

    public void resetWidths() {
        for (RoadEdge edge : edges.values()) {
            edge.resetWidth();
        }
    }

    /**
     * Removes every node without incident edges.
     *
     * @return number of nodes removed
     */
    public int pruneIsolatedNodes() {
        List<Integer> isolated = new ArrayList<>();
        for (Map.Entry<Integer, Set<Integer>> entry : adjacency.entrySet()) {
            if (entry.getValue().isEmpty()) {
                isolated.add(entry.getKey());
            }
        }
        for (Integer nodeId : isolated) {
            removeNode(nodeId);
        }
        if (!isolated.isEmpty()) {
            LOG.debug("Pruned {} isolated nodes", isolated.size());
        }
        return isolated.size();
    }

    /**
     * Structural snapshot covering ids, geometry, widths and attributes of every node and edge.
     * Two graphs with equal fingerprints are indistinguishable to routing.
     */
    public String fingerprint() {
        StringBuilder sb = new StringBuilder();
        for (RoadNode node : nodes.values()) {
            sb.append("N").append(node.getId())
                    .append('@').append(node.getX()).append(',').append(node.getY())
                    .append(':').append(node.getKind()).append('\n');
        }
        for (RoadEdge edge : edges.values()) {
            sb.append("E").append(edge.getId())
                    .append(' ').append(edge.getFromNode()).append('-').append(edge.getToNode())
                    .append(" len=").append(edge.getLength())
                    .append(" w=").append(edge.getCurrentWidth()).append('/').append(edge.getOriginalWidth())
                    .append(" lanes=").append(edge.getLanes())
                    .append(" bi=").append(edge.isBidirectional())
                    .append(' ').append(edge.getRoadClass())
                    .append(' ').append(edge.getSpeedLimitKmh())
                    .append(" origin=").append(edge.getOriginEdgeId())
                    .append('\n');
        }
        for (Map.Entry<Integer, Set<Integer>> entry : adjacency.entrySet()) {
            sb.append("A").append(entry.getKey()).append(entry.getValue()).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "RoadGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + '}';
    }
}
