package org.urbanresilience.simulation.disaster;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Polygon;
import org.urbanresilience.core.geometry.GeometryUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One fallen tree.
 */
public final class TreeCollapseEvent {

    private final String eventId;
    private final String treeId;
    private final Coordinate location;
    private final VulnerabilityLevel level;
    private final double angleDegrees;
    private final double height;
    private final double trunkWidth;
    private final double severity;
    private final List<Coordinate> blockagePolygon;

    public TreeCollapseEvent(String eventId, TreeRecord tree, double angleDegrees, double severity,
                             List<Coordinate> blockagePolygon) {
        this.eventId = eventId;
        this.treeId = tree.getId();
        this.location = tree.getLocation();
        this.level = tree.getLevel();
        this.angleDegrees = angleDegrees;
        this.height = tree.getHeight();
        this.trunkWidth = tree.getTrunkWidth();
        this.severity = severity;
        this.blockagePolygon = Collections.unmodifiableList(new ArrayList<>(blockagePolygon));
    }

    public String getEventId() {
        return eventId;
    }

    public String getTreeId() {
        return treeId;
    }

    public Coordinate getLocation() {
        return new Coordinate(location);
    }

    public VulnerabilityLevel getLevel() {
        return level;
    }

    public double getAngleDegrees() {
        return angleDegrees;
    }

    public double getHeight() {
        return height;
    }

    public double getTrunkWidth() {
        return trunkWidth;
    }

    public double getSeverity() {
        return severity;
    }

    public List<Coordinate> getBlockagePolygon() {
        return blockagePolygon;
    }

    public Polygon toPolygon() {
        return GeometryUtils.polygon(blockagePolygon);
    }

    @Override
    public String toString() {
        return "TreeCollapseEvent{" +
                "eventId='" + eventId + '\'' +
                ", treeId='" + treeId + '\'' +
                ", angle=" + String.format("%.1f", angleDegrees) +
                ", severity=" + String.format("%.2f", severity) +
                '}';
    }
}
