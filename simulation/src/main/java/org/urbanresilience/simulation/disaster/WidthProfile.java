package org.urbanresilience.simulation.disaster;

import org.locationtech.jts.geom.Geometry;
import org.urbanresilience.core.model.LaneDirection;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Result of sampling cross-sections through an obstructed road.
 */
public final class WidthProfile {

    private final Geometry obstruction;
    private final double remainingWidth;
    private final double blockedLength;
    private final Double forwardRemaining;
    private final Double backwardRemaining;
    private final Set<LaneDirection> affectedDirections;

    WidthProfile(Geometry obstruction, double remainingWidth, double blockedLength,
                 Double forwardRemaining, Double backwardRemaining, Set<LaneDirection> affectedDirections) {
        this.obstruction = obstruction;
        this.remainingWidth = remainingWidth;
        this.blockedLength = blockedLength;
        this.forwardRemaining = forwardRemaining;
        this.backwardRemaining = backwardRemaining;
        this.affectedDirections = affectedDirections.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(LaneDirection.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(affectedDirections));
    }

    public Geometry getObstruction() {
        return obstruction;
    }

    public double getRemainingWidth() {
        return remainingWidth;
    }

    public double getBlockedLength() {
        return blockedLength;
    }

    public boolean isDirectional() {
        return forwardRemaining != null;
    }

    public Double getForwardRemaining() {
        return forwardRemaining;
    }

    public Double getBackwardRemaining() {
        return backwardRemaining;
    }

    public Set<LaneDirection> getAffectedDirections() {
        return affectedDirections;
    }
}
