package org.urbanresilience.simulation.disaster;

import org.locationtech.jts.geom.Coordinate;

import java.util.Objects;

/**
 * A tree standing in the city, as read from the placement input.
 */
public final class TreeRecord {

    private final String id;
    private final double x;
    private final double y;
    private final VulnerabilityLevel level;
    private final double height;
    private final double trunkWidth;

    public TreeRecord(String id, double x, double y, VulnerabilityLevel level, double height, double trunkWidth) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.level = Objects.requireNonNull(level, "level must not be null");
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("tree " + id + " has a non-finite location");
        }
        if (!(height > 0)) {
            throw new IllegalArgumentException("tree " + id + " height must be positive");
        }
        if (!(trunkWidth > 0)) {
            throw new IllegalArgumentException("tree " + id + " trunk width must be positive");
        }
        this.x = x;
        this.y = y;
        this.height = height;
        this.trunkWidth = trunkWidth;
    }

    public String getId() {
        return id;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public Coordinate getLocation() {
        return new Coordinate(x, y);
    }

    public VulnerabilityLevel getLevel() {
        return level;
    }

    public double getHeight() {
        return height;
    }

    public double getTrunkWidth() {
        return trunkWidth;
    }

    @Override
    public String toString() {
        return "TreeRecord{" +
                "id='" + id + '\'' +
                ", at=(" + x + ", " + y + ")" +
                ", level=" + level +
                ", height=" + height +
                '}';
    }
}
