package org.urbanresilience.synthesizer.config;

import org.urbanresilience.core.model.LaneInfo;
import org.urbanresilience.core.model.RoadClass;
import org.urbanresilience.core.model.RoadEdge;

import java.util.Objects;

/**
 * Physical template for one class of synthesized road.
 */
public final class RoadSpec {

    public static final RoadSpec MAIN = new RoadSpec(RoadClass.MAIN, 12.0, 4, 70.0);
    public static final RoadSpec SECONDARY = new RoadSpec(RoadClass.SECONDARY, 6.0, 2, 30.0);

    private final RoadClass roadClass;
    private final double width;
    private final int lanes;
    private final double speedLimitKmh;

    public RoadSpec(RoadClass roadClass, double width, int lanes, double speedLimitKmh) {
        if (width <= 0) {
            throw new IllegalArgumentException("road width must be positive");
        }
        if (lanes <= 0) {
            throw new IllegalArgumentException("lanes must be positive");
        }
        if (speedLimitKmh <= 0) {
            throw new IllegalArgumentException("speedLimitKmh must be positive");
        }
        this.roadClass = Objects.requireNonNull(roadClass, "roadClass must not be null");
        this.width = width;
        this.lanes = lanes;
        this.speedLimitKmh = speedLimitKmh;
    }

    /**
     * Edge builder for a road of this class between two nodes. Bidirectional roads get a center divider.
     */
    public RoadEdge.Builder edge(int fromNode, int toNode, boolean bidirectional) {
        return new RoadEdge.Builder()
                .between(fromNode, toNode)
                .width(width)
                .lanes(lanes)
                .bidirectional(bidirectional)
                .laneInfo(LaneInfo.standardLayout(lanes, width, bidirectional))
                .roadClass(roadClass)
                .speedLimitKmh(speedLimitKmh)
                .centerDivider(bidirectional);
    }

    public RoadClass getRoadClass() {
        return roadClass;
    }

    public double getWidth() {
        return width;
    }

    public int getLanes() {
        return lanes;
    }

    public double getSpeedLimitKmh() {
        return speedLimitKmh;
    }

    @Override
    public String toString() {
        return roadClass + "{" + width + "m, " + lanes + " lanes, " + speedLimitKmh + "km/h}";
    }
}
