package org.urbanresilience.simulation.network;

import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Region reachable from a center within a travel-time budget.
 */
public final class ServiceArea {

    private final double maxTravelTime;
    private final List<Coordinate> boundary;
    private final List<Integer> reachableNodeIds;
    private final double area;

    ServiceArea(double maxTravelTime, List<Coordinate> boundary, List<Integer> reachableNodeIds, double area) {
        this.maxTravelTime = maxTravelTime;
        this.boundary = Collections.unmodifiableList(new ArrayList<>(boundary));
        this.reachableNodeIds = Collections.unmodifiableList(new ArrayList<>(reachableNodeIds));
        this.area = area;
    }

    public double getMaxTravelTime() {
        return maxTravelTime;
    }

    /** Convex hull ring of the reachable points. */
    public List<Coordinate> getBoundary() {
        return boundary;
    }

    public List<Integer> getReachableNodeIds() {
        return reachableNodeIds;
    }

    public int getReachableNodeCount() {
        return reachableNodeIds.size();
    }

    /** Hull area in square meters. */
    public double getArea() {
        return area;
    }

    @Override
    public String toString() {
        return "ServiceArea{maxTravelTime=" + maxTravelTime + ", nodes=" + reachableNodeIds.size()
                + ", area=" + String.format("%.0f", area) + '}';
    }
}
