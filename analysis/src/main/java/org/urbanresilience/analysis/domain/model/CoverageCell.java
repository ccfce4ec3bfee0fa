package org.urbanresilience.analysis.domain.model;

import org.locationtech.jts.geom.Coordinate;

import java.util.OptionalInt;

/**
 * One square of the coverage grid with its best response time.
 */
public final class CoverageCell {

    private final int row;
    private final int column;
    private final Coordinate center;
    private final Double responseTime;
    private final Integer nearestStation;
    private final ServiceLevel level;

    public CoverageCell(int row, int column, Coordinate center, Double responseTime, Integer nearestStation) {
        this.row = row;
        this.column = column;
        this.center = new Coordinate(center);
        this.responseTime = responseTime;
        this.nearestStation = nearestStation;
        this.level = ServiceLevel.of(responseTime);
    }

    public String getId() {
        return "grid_" + row + "_" + column;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public Coordinate getCenter() {
        return new Coordinate(center);
    }

    /** Seconds from the fastest station, or {@code null} when no station reaches the cell in time. */
    public Double getResponseTime() {
        return responseTime;
    }

    public boolean isReachable() {
        return responseTime != null;
    }

    /** Index of the fastest station in the input list. */
    public OptionalInt getNearestStation() {
        return nearestStation == null ? OptionalInt.empty() : OptionalInt.of(nearestStation);
    }

    public ServiceLevel getLevel() {
        return level;
    }

    @Override
    public String toString() {
        return "CoverageCell{" + getId() + ", time=" + responseTime + ", level=" + level + '}';
    }
}
