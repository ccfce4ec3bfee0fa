package org.urbanresilience.simulation.disaster;

import org.locationtech.jts.geom.Coordinate;
import org.urbanresilience.core.model.LaneDirection;
import org.urbanresilience.core.model.LaneInfo;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Road surface as seen by the disaster engine. Endpoints may be unknown for roads
 * supplied by external callers.
 */
public final class RoadFootprint {

    private final int edgeId;
    private final Coordinate from;
    private final Coordinate to;
    private final double width;
    private final boolean bidirectional;
    private final List<LaneInfo> laneInfo;

    public RoadFootprint(int edgeId, Coordinate from, Coordinate to, double width, boolean bidirectional,
                         List<LaneInfo> laneInfo) {
        if (!(width > 0)) {
            throw new IllegalArgumentException("road " + edgeId + " width must be positive");
        }
        this.edgeId = edgeId;
        this.from = from == null ? null : new Coordinate(from);
        this.to = to == null ? null : new Coordinate(to);
        this.width = width;
        this.bidirectional = bidirectional;
        this.laneInfo = laneInfo == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(laneInfo));
    }

    /**
     * Footprints of every edge, using original widths.
     */
    public static List<RoadFootprint> fromGraph(RoadGraph graph) {
        List<RoadFootprint> footprints = new ArrayList<>(graph.edgeCount());
        for (RoadEdge edge : graph.edges()) {
            footprints.add(new RoadFootprint(edge.getId(),
                    graph.coordinate(edge.getFromNode()),
                    graph.coordinate(edge.getToNode()),
                    edge.getOriginalWidth(),
                    edge.isBidirectional(),
                    edge.getLaneInfo()));
        }
        return footprints;
    }

    public int getEdgeId() {
        return edgeId;
    }

    public Optional<Coordinate> getFrom() {
        return Optional.ofNullable(from);
    }

    public Optional<Coordinate> getTo() {
        return Optional.ofNullable(to);
    }

    public boolean hasGeometry() {
        return from != null && to != null;
    }

    /** The single known endpoint when the other one is missing. */
    public Optional<Coordinate> knownEndpoint() {
        return from != null ? Optional.of(from) : Optional.ofNullable(to);
    }

    public double getWidth() {
        return width;
    }

    public boolean isBidirectional() {
        return bidirectional;
    }

    public List<LaneInfo> getLaneInfo() {
        return laneInfo;
    }

    /**
     * Share of the width taken by forward lanes. Half when lane info is missing.
     */
    public double forwardShare() {
        double forward = LaneInfo.totalWidth(laneInfo, LaneDirection.FORWARD);
        double backward = LaneInfo.totalWidth(laneInfo, LaneDirection.BACKWARD);
        if (forward + backward <= 0) {
            return bidirectional ? 0.5 : 1.0;
        }
        return forward / (forward + backward);
    }

    @Override
    public String toString() {
        return "RoadFootprint{edgeId=" + edgeId + ", width=" + width + ", geometry=" + hasGeometry() + '}';
    }
}
