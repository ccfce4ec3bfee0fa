package org.urbanresilience.analysis.domain.model;

import org.locationtech.jts.geom.Coordinate;
import org.urbanresilience.core.geometry.GeometryUtils;
import org.urbanresilience.core.model.MapBoundary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Square cells laid over the map boundary, row by row from the minimum corner.
 */
public final class CoverageGrid {

    private final double cellSize;
    private final int rows;
    private final int columns;
    private final List<CoverageCell> cells;

    public CoverageGrid(double cellSize, int rows, int columns, List<CoverageCell> cells) {
        if (cells.size() != rows * columns) {
            throw new IllegalArgumentException("expected " + rows * columns + " cells, got " + cells.size());
        }
        this.cellSize = cellSize;
        this.rows = rows;
        this.columns = columns;
        this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
    }

    /**
     * Cell centers covering {@code boundary}, in row-major order. The last row and column are pulled
     * back so their centers stay half a cell inside the boundary.
     */
    public static List<Coordinate> centers(MapBoundary boundary, double cellSize) {
        int columns = count(boundary.width(), cellSize);
        int rows = count(boundary.height(), cellSize);
        List<Coordinate> centers = new ArrayList<>(rows * columns);
        for (int row = 0; row < rows; row++) {
            double y = center(boundary.getMinY(), boundary.getMaxY(), row, cellSize);
            for (int column = 0; column < columns; column++) {
                double x = center(boundary.getMinX(), boundary.getMaxX(), column, cellSize);
                centers.add(new Coordinate(x, y));
            }
        }
        return centers;
    }

    /** Cells needed to cover {@code extent}. */
    public static int count(double extent, double cellSize) {
        return Math.max(1, (int) Math.ceil(extent / cellSize - GeometryUtils.EPSILON));
    }

    private static double center(double min, double max, int index, double cellSize) {
        double upper = Math.max(min + cellSize / 2.0, max - cellSize / 2.0);
        return Math.min(min + (index + 0.5) * cellSize, upper);
    }

    public double getCellSize() {
        return cellSize;
    }

    public double getCellArea() {
        return cellSize * cellSize;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public List<CoverageCell> getCells() {
        return cells;
    }

    public CoverageCell cell(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException("cell " + row + "," + column + " outside " + rows + "x" + columns);
        }
        return cells.get(row * columns + column);
    }
}
