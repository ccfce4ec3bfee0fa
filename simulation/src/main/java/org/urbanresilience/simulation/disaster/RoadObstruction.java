package org.urbanresilience.simulation.disaster;

import org.locationtech.jts.geom.Coordinate;
import org.urbanresilience.core.model.LaneDirection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Width reduction of one road edge caused by one collapse event.
 */
public final class RoadObstruction {

    private final String id;
    private final int edgeId;
    private final List<Coordinate> polygon;
    private final double remainingWidth;
    private final double blockedPercentage;
    private final double blockedLength;
    private final String causedByEvent;
    private final Double forwardRemaining;
    private final Double backwardRemaining;
    private final Set<LaneDirection> affectedDirections;
    private final boolean approximated;

    private RoadObstruction(Builder builder) {
        this.id = builder.id;
        this.edgeId = builder.edgeId;
        this.polygon = Collections.unmodifiableList(new ArrayList<>(builder.polygon));
        this.remainingWidth = builder.remainingWidth;
        this.blockedPercentage = builder.blockedPercentage;
        this.blockedLength = builder.blockedLength;
        this.causedByEvent = builder.causedByEvent;
        this.forwardRemaining = builder.forwardRemaining;
        this.backwardRemaining = builder.backwardRemaining;
        this.affectedDirections = Collections.unmodifiableSet(builder.affectedDirections.isEmpty()
                ? EnumSet.noneOf(LaneDirection.class)
                : EnumSet.copyOf(builder.affectedDirections));
        this.approximated = builder.approximated;
    }

    public String getId() {
        return id;
    }

    public int getEdgeId() {
        return edgeId;
    }

    public List<Coordinate> getPolygon() {
        return polygon;
    }

    public double getRemainingWidth() {
        return remainingWidth;
    }

    public double getBlockedPercentage() {
        return blockedPercentage;
    }

    public double getBlockedLength() {
        return blockedLength;
    }

    public String getCausedByEvent() {
        return causedByEvent;
    }

    public OptionalDouble getForwardRemaining() {
        return forwardRemaining == null ? OptionalDouble.empty() : OptionalDouble.of(forwardRemaining);
    }

    public OptionalDouble getBackwardRemaining() {
        return backwardRemaining == null ? OptionalDouble.empty() : OptionalDouble.of(backwardRemaining);
    }

    public Set<LaneDirection> getAffectedDirections() {
        return affectedDirections;
    }

    /** True when the road could not be located and a conservative blockage was assumed. */
    public boolean isApproximated() {
        return approximated;
    }

    @Override
    public String toString() {
        return "RoadObstruction{" +
                "id='" + id + '\'' +
                ", edgeId=" + edgeId +
                ", remaining=" + String.format("%.2f", remainingWidth) +
                ", blocked=" + String.format("%.1f%%", blockedPercentage) +
                ", event='" + causedByEvent + '\'' +
                '}';
    }

    /**
     * Builder for RoadObstruction.
     */
    public static final class Builder {
        private String id;
        private int edgeId = -1;
        private List<Coordinate> polygon = Collections.emptyList();
        private double remainingWidth;
        private double blockedPercentage;
        private double blockedLength;
        private String causedByEvent;
        private Double forwardRemaining;
        private Double backwardRemaining;
        private Set<LaneDirection> affectedDirections = EnumSet.noneOf(LaneDirection.class);
        private boolean approximated;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder edgeId(int edgeId) {
            this.edgeId = edgeId;
            return this;
        }

        public Builder polygon(List<Coordinate> polygon) {
            this.polygon = Objects.requireNonNull(polygon, "polygon must not be null");
            return this;
        }

        public Builder remainingWidth(double remainingWidth) {
            if (Double.isNaN(remainingWidth)) {
                throw new IllegalArgumentException("remainingWidth must not be NaN");
            }
            this.remainingWidth = remainingWidth;
            return this;
        }

        public Builder blockedPercentage(double blockedPercentage) {
            this.blockedPercentage = Math.max(0.0, Math.min(100.0, blockedPercentage));
            return this;
        }

        public Builder blockedLength(double blockedLength) {
            this.blockedLength = Math.max(0.0, blockedLength);
            return this;
        }

        public Builder causedByEvent(String causedByEvent) {
            this.causedByEvent = causedByEvent;
            return this;
        }

        public Builder directional(double forwardRemaining, double backwardRemaining) {
            this.forwardRemaining = forwardRemaining;
            this.backwardRemaining = backwardRemaining;
            return this;
        }

        public Builder affectedDirections(Set<LaneDirection> affectedDirections) {
            this.affectedDirections = Objects.requireNonNull(affectedDirections, "affectedDirections must not be null");
            return this;
        }

        public Builder approximated(boolean approximated) {
            this.approximated = approximated;
            return this;
        }

        public RoadObstruction build() {
            if (edgeId < 0) {
                throw new IllegalArgumentException("edgeId must be set");
            }
            if (id == null) {
                id = "obstruction-" + edgeId;
            }
            return new RoadObstruction(this);
        }
    }
}
