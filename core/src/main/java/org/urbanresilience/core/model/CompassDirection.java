package org.urbanresilience.core.model;

/**
 * Dominant heading of an edge. The y axis points north.
 */
public enum CompassDirection {
    NORTH,
    SOUTH,
    EAST,
    WEST;

    public static CompassDirection of(double dx, double dy) {
        if (Math.abs(dx) >= Math.abs(dy)) {
            return dx >= 0 ? EAST : WEST;
        }
        return dy >= 0 ? NORTH : SOUTH;
    }
}
