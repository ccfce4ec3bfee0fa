package org.urbanresilience.synthesizer.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanresilience.core.model.MapBoundary;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;
import org.urbanresilience.synthesizer.config.SynthesizerConfig;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Procedural road network generator.
 *
 * Generation order:
 * - straight main roads (vertical and horizontal arteries)
 * - alleys in the blocks between straight main roads
 * - diagonal main roads
 * - intersection resolution into a planar graph
 * - stitching of stray components, followed by another resolution pass
 *
 * All randomness comes from the injected generator, so a seeded {@link Random} reproduces the map.
 */
public final class ProceduralMapSynthesizer implements MapSynthesizer {

    private static final Logger LOG = LoggerFactory.getLogger(ProceduralMapSynthesizer.class);

    private final SynthesizerConfig config;
    private final Random random;

    public ProceduralMapSynthesizer(SynthesizerConfig config) {
        this(config, config.newRandom());
    }

    public ProceduralMapSynthesizer(SynthesizerConfig config, Random random) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    @Override
    public SynthesizedMap synthesize() {
        MapBoundary boundary = MapBoundary.of(config.getMapWidth(), config.getMapHeight());
        RoadGraph graph = new RoadGraph();

        MainRoadLayout mainRoads = new MainRoadLayout(config, boundary);
        List<RoadEdge> straight = mainRoads.layStraightRoads(graph);
        List<RoadEdge> alleys = new AlleyLayout(config, random)
                .layAlleys(graph, mainRoads.verticalPositions(), mainRoads.horizontalPositions());
        List<RoadEdge> diagonal = mainRoads.layDiagonalRoads(graph, random);
        LOG.info("[Synthesizer] Placed {} straight, {} diagonal main roads and {} alleys",
                straight.size(), diagonal.size(), alleys.size());

        IntersectionResolver resolver = new IntersectionResolver(config.getIntersectionTolerance());
        resolver.resolve(graph);
        if (new NetworkStitcher(config.getSecondaryRoad()).stitch(graph) > 0) {
            resolver.resolve(graph);
        }

        SynthesizedMap map = new SynthesizedMap(boundary, graph);
        LOG.info("[Synthesizer] Generated map: {}", map);
        return map;
    }
}
