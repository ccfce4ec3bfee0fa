package org.urbanresilience.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A road segment between two nodes.
 *
 * Everything except {@code currentWidth} is fixed at creation. The current width is the live,
 * obstruction-reduced value and always stays within [0, originalWidth].
 */
public final class RoadEdge {

    /** Marker for "this edge is its own origin". */
    public static final int SELF_ORIGIN = -1;

    private final int id;
    private final int fromNode;
    private final int toNode;
    private final double length;
    private final double originalWidth;
    private final int lanes;
    private final boolean bidirectional;
    private final List<LaneInfo> laneInfo;
    private final RoadClass roadClass;
    private final double speedLimitKmh;
    private final CompassDirection primaryDirection;
    private final boolean centerDivider;
    private final int originEdgeId;

    private double currentWidth;

    private RoadEdge(Builder builder, int id, double length) {
        this.id = id;
        this.fromNode = builder.fromNode;
        this.toNode = builder.toNode;
        this.length = length;
        this.originalWidth = builder.originalWidth;
        this.lanes = builder.lanes;
        this.bidirectional = builder.bidirectional;
        this.laneInfo = builder.laneInfo;
        this.roadClass = builder.roadClass;
        this.speedLimitKmh = builder.speedLimitKmh;
        this.primaryDirection = builder.primaryDirection;
        this.centerDivider = builder.centerDivider;
        this.originEdgeId = builder.originEdgeId == SELF_ORIGIN ? id : builder.originEdgeId;
        this.currentWidth = builder.currentWidth < 0 ? builder.originalWidth : builder.currentWidth;
    }

    public int getId() {
        return id;
    }

    public int getFromNode() {
        return fromNode;
    }

    public int getToNode() {
        return toNode;
    }

    /**
     * Endpoint opposite {@code nodeId}.
     */
    public int opposite(int nodeId) {
        if (nodeId == fromNode) {
            return toNode;
        }
        if (nodeId == toNode) {
            return fromNode;
        }
        throw new IllegalStateException("Node " + nodeId + " is not an endpoint of edge " + id);
    }

    public boolean touches(int nodeId) {
        return fromNode == nodeId || toNode == nodeId;
    }

    public double getLength() {
        return length;
    }

    public double getOriginalWidth() {
        return originalWidth;
    }

    public double getCurrentWidth() {
        return currentWidth;
    }

    /**
     * Sets the live width, clamped to [0, originalWidth].
     */
    public void setCurrentWidth(double width) {
        if (Double.isNaN(width)) {
            throw new IllegalArgumentException("width must not be NaN");
        }
        this.currentWidth = Math.max(0.0, Math.min(originalWidth, width));
    }

    public void resetWidth() {
        this.currentWidth = originalWidth;
    }

    /** Current width as a fraction of the original width. */
    public double widthRatio() {
        return originalWidth <= 0 ? 0.0 : currentWidth / originalWidth;
    }

    public int getLanes() {
        return lanes;
    }

    public boolean isBidirectional() {
        return bidirectional;
    }

    public List<LaneInfo> getLaneInfo() {
        return laneInfo;
    }

    public RoadClass getRoadClass() {
        return roadClass;
    }

    public double getSpeedLimitKmh() {
        return speedLimitKmh;
    }

    public CompassDirection getPrimaryDirection() {
        return primaryDirection;
    }

    public boolean hasCenterDivider() {
        return centerDivider;
    }

    public int getOriginEdgeId() {
        return originEdgeId;
    }

    /**
     * Builder pre-filled with this edge's attributes, for sub-edges after a split.
     * The copy inherits the origin id and the current width.
     */
    public Builder derive(int newFrom, int newTo) {
        return new Builder()
                .between(newFrom, newTo)
                .width(originalWidth)
                .currentWidth(currentWidth)
                .lanes(lanes)
                .bidirectional(bidirectional)
                .laneInfo(laneInfo)
                .roadClass(roadClass)
                .speedLimitKmh(speedLimitKmh)
                .primaryDirection(primaryDirection)
                .centerDivider(centerDivider)
                .originEdgeId(originEdgeId);
    }

    @Override
    public String toString() {
        return "RoadEdge{" +
                "id=" + id +
                ", " + fromNode + "->" + toNode +
                ", length=" + String.format("%.1f", length) +
                ", width=" + currentWidth + "/" + originalWidth +
                ", class=" + roadClass +
                '}';
    }

    /**
     * Builder for RoadEdge. Ids and lengths are assigned by {@link RoadGraph#addEdge(Builder)}.
     */
    public static final class Builder {
        private int fromNode = -1;
        private int toNode = -1;
        private double originalWidth = 6.0;
        private double currentWidth = -1.0;
        private int lanes = 2;
        private boolean bidirectional = true;
        private List<LaneInfo> laneInfo;
        private RoadClass roadClass = RoadClass.SECONDARY;
        private double speedLimitKmh = 30.0;
        private CompassDirection primaryDirection;
        private boolean centerDivider;
        private int originEdgeId = SELF_ORIGIN;

        public Builder between(int fromNode, int toNode) {
            if (fromNode == toNode) {
                throw new IllegalArgumentException("edge endpoints must differ: " + fromNode);
            }
            this.fromNode = fromNode;
            this.toNode = toNode;
            return this;
        }

        public Builder width(double width) {
            if (width <= 0 || !Double.isFinite(width)) {
                throw new IllegalArgumentException("width must be positive");
            }
            this.originalWidth = width;
            return this;
        }

        public Builder currentWidth(double currentWidth) {
            this.currentWidth = currentWidth;
            return this;
        }

        public Builder lanes(int lanes) {
            if (lanes <= 0) {
                throw new IllegalArgumentException("lanes must be positive");
            }
            this.lanes = lanes;
            return this;
        }

        public Builder bidirectional(boolean bidirectional) {
            this.bidirectional = bidirectional;
            return this;
        }

        public Builder laneInfo(List<LaneInfo> laneInfo) {
            this.laneInfo = Collections.unmodifiableList(new ArrayList<>(laneInfo));
            return this;
        }

        public Builder roadClass(RoadClass roadClass) {
            this.roadClass = Objects.requireNonNull(roadClass, "roadClass must not be null");
            return this;
        }

        public Builder speedLimitKmh(double speedLimitKmh) {
            if (speedLimitKmh <= 0) {
                throw new IllegalArgumentException("speedLimitKmh must be positive");
            }
            this.speedLimitKmh = speedLimitKmh;
            return this;
        }

        public Builder primaryDirection(CompassDirection primaryDirection) {
            this.primaryDirection = primaryDirection;
            return this;
        }

        public Builder centerDivider(boolean centerDivider) {
            this.centerDivider = centerDivider;
            return this;
        }

        public Builder originEdgeId(int originEdgeId) {
            this.originEdgeId = originEdgeId;
            return this;
        }

        int getFromNode() {
            return fromNode;
        }

        int getToNode() {
            return toNode;
        }

        RoadEdge build(int id, double length, CompassDirection measuredDirection) {
            if (fromNode < 0 || toNode < 0) {
                throw new IllegalStateException("edge endpoints not set");
            }
            if (laneInfo == null) {
                laneInfo = LaneInfo.standardLayout(lanes, originalWidth, bidirectional);
            }
            if (primaryDirection == null) {
                primaryDirection = measuredDirection;
            }
            return new RoadEdge(this, id, length);
        }
    }
}
