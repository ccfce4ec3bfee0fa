package org.urbanresilience.simulation.disaster;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanresilience.core.geometry.GeometryUtils;
import org.urbanresilience.core.model.LaneDirection;
import org.urbanresilience.simulation.config.DisasterConfig;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;

/**
 * Storm simulation: trees fall at random angles and each fallen tree narrows the roads it lands on.
 * Trees are evaluated in input order, so a seeded {@link Random} reproduces a run exactly.
 */
public final class TreeCollapseSimulator implements DisasterSimulator {

    private static final Logger log = LoggerFactory.getLogger(TreeCollapseSimulator.class);

    private final DisasterConfig config;
    private final Random random;
    private final CollapseModel collapseModel;
    private final CrossSectionAnalyzer crossSections;

    public TreeCollapseSimulator(DisasterConfig config) {
        this(config, config.newRandom());
    }

    public TreeCollapseSimulator(DisasterConfig config, Random random) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.collapseModel = new CollapseModel(config);
        this.crossSections = new CrossSectionAnalyzer(config.getCrossSectionSamples(), config.getDirectionalThreshold());
    }

    @Override
    public DisasterSimulationResult simulate(Collection<TreeRecord> trees, Collection<RoadFootprint> roads) {
        Objects.requireNonNull(trees, "trees must not be null");
        Objects.requireNonNull(roads, "roads must not be null");
        log.info("[Disaster] Simulating {} trees over {} roads at intensity {}", trees.size(), roads.size(),
                config.getIntensity());

        List<RoadFootprint> locatable = new ArrayList<>();
        List<RoadFootprint> anchored = new ArrayList<>();
        for (RoadFootprint road : roads) {
            if (road.hasGeometry()) {
                locatable.add(road);
            } else if (road.knownEndpoint().isPresent()) {
                anchored.add(road);
            } else {
                log.warn("[Disaster] Road {} has no endpoint coordinates, skipping", road.getEdgeId());
            }
        }

        List<TreeCollapseEvent> events = new ArrayList<>();
        List<RoadObstruction> obstructions = new ArrayList<>();
        for (TreeRecord tree : trees) {
            if (!collapseModel.collapses(tree, random)) {
                continue;
            }
            double angle = collapseModel.fallAngle(random);
            List<Coordinate> polygon = CollapseModel.blockagePolygon(tree.getX(), tree.getY(), tree.getHeight(),
                    tree.getTrunkWidth(), angle);
            TreeCollapseEvent event = new TreeCollapseEvent("event-" + (events.size() + 1), tree, angle,
                    CollapseModel.severity(tree), polygon);
            events.add(event);

            Polygon fallen = event.toPolygon();
            for (RoadFootprint road : locatable) {
                Optional<WidthProfile> profile = crossSections.analyze(road, fallen);
                if (profile.isPresent()) {
                    obstructions.add(toObstruction(obstructions.size() + 1, event, road, profile.get()));
                }
            }
            for (RoadFootprint road : anchored) {
                approximate(obstructions.size() + 1, event, road, fallen).ifPresent(obstructions::add);
            }
        }

        SimulationStatistics statistics = SimulationStatistics.of(trees.size(), events, obstructions);
        log.info("[Disaster] {}", statistics);
        return new DisasterSimulationResult(UUID.randomUUID().toString(), Instant.now(), config, events,
                obstructions, statistics);
    }

    private RoadObstruction toObstruction(int sequence, TreeCollapseEvent event, RoadFootprint road,
                                          WidthProfile profile) {
        double width = road.getWidth();
        RoadObstruction.Builder builder = new RoadObstruction.Builder()
                .id("obstruction-" + sequence)
                .edgeId(road.getEdgeId())
                .polygon(GeometryUtils.coordinates(profile.getObstruction()))
                .remainingWidth(profile.getRemainingWidth())
                .blockedPercentage((width - profile.getRemainingWidth()) / width * 100.0)
                .blockedLength(profile.getBlockedLength())
                .causedByEvent(event.getEventId())
                .affectedDirections(profile.getAffectedDirections());
        if (profile.isDirectional()) {
            builder.directional(profile.getForwardRemaining(), profile.getBackwardRemaining());
        }
        RoadObstruction obstruction = builder.build();
        log.debug("[Disaster] {} blocks road {}: {}", event.getEventId(), road.getEdgeId(), obstruction);
        return obstruction;
    }

    /**
     * Conservative blockage for a road known only by one endpoint: hit when the tree lands within
     * half a road width of that endpoint.
     */
    private Optional<RoadObstruction> approximate(int sequence, TreeCollapseEvent event, RoadFootprint road,
                                                  Polygon fallen) {
        Coordinate anchor = road.knownEndpoint().get();
        double distance = fallen.distance(GeometryUtils.factory().createPoint(anchor));
        if (distance > road.getWidth() / 2.0) {
            return Optional.empty();
        }
        double ratio = config.getFallbackBlockageRatio();
        log.debug("[Disaster] {} near anchored road {}, assuming {}% blockage", event.getEventId(),
                road.getEdgeId(), ratio * 100.0);
        return Optional.of(new RoadObstruction.Builder()
                .id("obstruction-" + sequence)
                .edgeId(road.getEdgeId())
                .polygon(event.getBlockagePolygon())
                .remainingWidth(road.getWidth() * (1.0 - ratio))
                .blockedPercentage(ratio * 100.0)
                .blockedLength(Math.min(event.getHeight(), road.getWidth()))
                .causedByEvent(event.getEventId())
                .affectedDirections(EnumSet.noneOf(LaneDirection.class))
                .approximated(true)
                .build());
    }
}
