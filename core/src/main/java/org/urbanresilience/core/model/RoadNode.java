package org.urbanresilience.core.model;

import org.locationtech.jts.geom.Coordinate;

import java.util.Objects;

/**
 * A node of the road graph.
 */
public final class RoadNode {

    private final int id;
    private final double x;
    private final double y;
    private final NodeKind kind;

    public RoadNode(int id, double x, double y, NodeKind kind) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("node coordinates must be finite");
        }
        this.id = id;
        this.x = x;
        this.y = y;
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public int getId() {
        return id;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public NodeKind getKind() {
        return kind;
    }

    public Coordinate getCoordinate() {
        return new Coordinate(x, y);
    }

    public double distanceTo(Coordinate point) {
        return Math.hypot(point.x - x, point.y - y);
    }

    @Override
    public String toString() {
        return "RoadNode{" +
                "id=" + id +
                ", x=" + x +
                ", y=" + y +
                ", kind=" + kind +
                '}';
    }
}
