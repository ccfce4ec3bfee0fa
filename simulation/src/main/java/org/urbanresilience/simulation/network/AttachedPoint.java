package org.urbanresilience.simulation.network;

/**
 * How a query coordinate was joined to the network.
 */
final class AttachedPoint {

    enum Mode {
        /** Reused an existing road node. */
        SNAPPED,
        /** Split a road with a virtual node. */
        SPLIT,
        /** Nothing within the search radius; linked straight to the nearest intersection. */
        FORCED
    }

    private final int nodeId;
    private final int roadNodeId;
    private final Mode mode;
    private final double distanceToRoad;

    AttachedPoint(int nodeId, int roadNodeId, Mode mode, double distanceToRoad) {
        this.nodeId = nodeId;
        this.roadNodeId = roadNodeId;
        this.mode = mode;
        this.distanceToRoad = distanceToRoad;
    }

    /** Node the search starts or ends at; an ACCESS node when the point lies off the road. */
    int getNodeId() {
        return nodeId;
    }

    /** Node on the road network the point hangs off. */
    int getRoadNodeId() {
        return roadNodeId;
    }

    Mode getMode() {
        return mode;
    }

    double getDistanceToRoad() {
        return distanceToRoad;
    }

    @Override
    public String toString() {
        return "AttachedPoint{node=" + nodeId + ", road=" + roadNodeId + ", mode=" + mode
                + ", offset=" + String.format("%.1f", distanceToRoad) + '}';
    }
}
