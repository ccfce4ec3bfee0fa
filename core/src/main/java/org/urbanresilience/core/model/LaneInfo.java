package org.urbanresilience.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One lane of a road edge.
 */
public final class LaneInfo {

    private final int index;
    private final LaneDirection direction;
    private final LaneSide side;
    private final double width;

    public LaneInfo(int index, LaneDirection direction, LaneSide side, double width) {
        if (width <= 0) {
            throw new IllegalArgumentException("lane width must be positive");
        }
        this.index = index;
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.side = Objects.requireNonNull(side, "side must not be null");
        this.width = width;
    }

    /**
     * Standard lane layout for a road.
     *
     * Bidirectional roads put forward lanes on the right and backward lanes on the left; an odd
     * lane goes forward. One-way roads carry only forward lanes.
     */
    public static List<LaneInfo> standardLayout(int lanes, double roadWidth, boolean bidirectional) {
        if (lanes <= 0) {
            throw new IllegalArgumentException("lanes must be positive");
        }
        double laneWidth = roadWidth / lanes;
        List<LaneInfo> result = new ArrayList<>(lanes);
        int forward = bidirectional ? lanes - lanes / 2 : lanes;
        for (int i = 0; i < forward; i++) {
            result.add(new LaneInfo(result.size(), LaneDirection.FORWARD, LaneSide.RIGHT, laneWidth));
        }
        for (int i = forward; i < lanes; i++) {
            result.add(new LaneInfo(result.size(), LaneDirection.BACKWARD, LaneSide.LEFT, laneWidth));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Sum of lane widths travelling in the given direction.
     */
    public static double totalWidth(List<LaneInfo> lanes, LaneDirection direction) {
        double total = 0.0;
        for (LaneInfo lane : lanes) {
            if (lane.direction == direction) {
                total += lane.width;
            }
        }
        return total;
    }

    public int getIndex() {
        return index;
    }

    public LaneDirection getDirection() {
        return direction;
    }

    public LaneSide getSide() {
        return side;
    }

    public double getWidth() {
        return width;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LaneInfo)) {
            return false;
        }
        LaneInfo other = (LaneInfo) o;
        return index == other.index
                && Double.compare(width, other.width) == 0
                && direction == other.direction
                && side == other.side;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, direction, side, width);
    }

    @Override
    public String toString() {
        return "LaneInfo{" + index + ", " + direction + ", " + side + ", " + width + "m}";
    }
}
