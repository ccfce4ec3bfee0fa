package org.urbanresilience.core.model;

import org.locationtech.jts.geom.Envelope;

/**
 * Axis-aligned extent of a synthesized map, in meters.
 */
public final class MapBoundary {

    private final double minX;
    private final double minY;
    private final double maxX;
    private final double maxY;

    public MapBoundary(double minX, double minY, double maxX, double maxY) {
        if (maxX <= minX || maxY <= minY) {
            throw new IllegalArgumentException("boundary must have a positive extent");
        }
        this.minX = minX;
        this.minY = minY;
        this.maxX = maxX;
        this.maxY = maxY;
    }

    public static MapBoundary of(double width, double height) {
        return new MapBoundary(0.0, 0.0, width, height);
    }

    public double getMinX() {
        return minX;
    }

    public double getMinY() {
        return minY;
    }

    public double getMaxX() {
        return maxX;
    }

    public double getMaxY() {
        return maxY;
    }

    public double width() {
        return maxX - minX;
    }

    public double height() {
        return maxY - minY;
    }

    public double area() {
        return width() * height();
    }

    public boolean contains(double x, double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    public Envelope toEnvelope() {
        return new Envelope(minX, maxX, minY, maxY);
    }

    @Override
    public String toString() {
        return "MapBoundary{" + minX + ", " + minY + " -> " + maxX + ", " + maxY + '}';
    }
}
