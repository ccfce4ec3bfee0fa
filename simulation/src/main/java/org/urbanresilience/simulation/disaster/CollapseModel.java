package org.urbanresilience.simulation.disaster;

import org.locationtech.jts.geom.Coordinate;
import org.urbanresilience.simulation.config.DisasterConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Decides which trees fall and what ground a fallen tree covers.
 */
public final class CollapseModel {

    private static final double SEVERITY_SIZE_SCALE = 20.0;

    private final DisasterConfig config;

    public CollapseModel(DisasterConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Collapse probability for a level at the configured intensity.
     */
    public double collapseProbability(VulnerabilityLevel level) {
        return collapseProbability(config.getCollapseRate(level), config.getIntensity());
    }

    /**
     * {@code rate * (0.5 + 0.5 * min(1, intensity / 10))}, capped at 1.
     */
    public static double collapseProbability(double baseRate, double intensity) {
        double factor = 0.5 + 0.5 * Math.min(1.0, intensity / DisasterConfig.MAX_INTENSITY);
        return Math.min(1.0, baseRate * factor);
    }

    public boolean collapses(TreeRecord tree, Random random) {
        return random.nextDouble() < collapseProbability(tree.getLevel());
    }

    /**
     * Fall direction in degrees, uniform in [0, 360).
     */
    public double fallAngle(Random random) {
        return random.nextDouble() * 360.0;
    }

    /**
     * Quadrilateral covered by a tree of the given size falling at {@code angleDegrees}:
     * base+off, base-off, crown-off, crown+off where off is half the trunk width sideways.
     */
    public static List<Coordinate> blockagePolygon(double x, double y, double height, double trunkWidth,
                                                   double angleDegrees) {
        double theta = Math.toRadians(angleDegrees);
        double crownX = x + height * Math.cos(theta);
        double crownY = y + height * Math.sin(theta);
        double offX = trunkWidth / 2.0 * Math.cos(theta + Math.PI / 2.0);
        double offY = trunkWidth / 2.0 * Math.sin(theta + Math.PI / 2.0);

        List<Coordinate> corners = new ArrayList<>(4);
        corners.add(new Coordinate(x + offX, y + offY));
        corners.add(new Coordinate(x - offX, y - offY));
        corners.add(new Coordinate(crownX - offX, crownY - offY));
        corners.add(new Coordinate(crownX + offX, crownY + offY));
        return Collections.unmodifiableList(corners);
    }

    public static double severity(TreeRecord tree) {
        double size = Math.min(1.0, tree.getHeight() * tree.getTrunkWidth() / SEVERITY_SIZE_SCALE);
        return Math.min(1.0, size * tree.getLevel().getSeverityMultiplier());
    }
}
