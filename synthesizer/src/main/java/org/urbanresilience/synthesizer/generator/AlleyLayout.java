package org.urbanresilience.synthesizer.generator;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanresilience.core.model.NodeKind;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;
import org.urbanresilience.core.model.RoadNode;
import org.urbanresilience.synthesizer.config.SynthesizerConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Fills the blocks between adjacent straight main roads with secondary alleys.
 *
 * Each alley runs along one axis of its block, either across the full block or partially from
 * one side. Partial alleys may be tilted; the tilted end stays {@value #TILT_BUFFER} m inside the block.
 */
public final class AlleyLayout {

    private static final Logger LOG = LoggerFactory.getLogger(AlleyLayout.class);

    static final double TILT_BUFFER = 10.0;
    private static final double MIN_POSITION = 0.2;
    private static final double MAX_POSITION = 0.8;
    private static final double MIN_EXTENT = 0.3;
    private static final double MAX_EXTENT = 0.8;

    private final SynthesizerConfig config;
    private final Random random;

    public AlleyLayout(SynthesizerConfig config, Random random) {
        this.config = config;
        this.random = random;
    }

    /**
     * Lays alleys in every block formed by the given road positions.
     *
     * @param xPositions ascending x positions of vertical main roads
     * @param yPositions ascending y positions of horizontal main roads
     */
    public List<RoadEdge> layAlleys(RoadGraph graph, List<Double> xPositions, List<Double> yPositions) {
        List<RoadEdge> alleys = new ArrayList<>();
        int blocks = 0;
        for (int i = 0; i + 1 < xPositions.size(); i++) {
            for (int j = 0; j + 1 < yPositions.size(); j++) {
                Block block = new Block(xPositions.get(i), xPositions.get(i + 1),
                        yPositions.get(j), yPositions.get(j + 1));
                blocks++;
                int min = config.getMinAlleysPerBlock();
                int count = min + random.nextInt(config.getMaxAlleysPerBlock() - min + 1);
                for (int k = 0; k < count; k++) {
                    boolean fullLength = random.nextDouble() < config.getFullLengthProbability();
                    boolean horizontal = random.nextDouble() < config.getHorizontalProbability();
                    RoadEdge alley = layAlley(graph, block, horizontal, fullLength);
                    if (alley != null) {
                        alleys.add(alley);
                    }
                }
            }
        }
        LOG.debug("[Synthesizer] Laid {} alleys in {} blocks", alleys.size(), blocks);
        return alleys;
    }

    /**
     * Places one alley. Works in block-local (along, across) coordinates so both orientations share
     * the same logic.
     *
     * @return the new edge, or null when the alley came out shorter than the minimum road length
     */
    RoadEdge layAlley(RoadGraph graph, Block block, boolean horizontal, boolean fullLength) {
        double alongMin = horizontal ? block.left : block.bottom;
        double alongMax = horizontal ? block.right : block.top;
        double acrossMin = horizontal ? block.bottom : block.left;
        double acrossMax = horizontal ? block.top : block.right;
        double alongExtent = alongMax - alongMin;

        double across = acrossMin + MainRoadLayout.uniform(random, MIN_POSITION, MAX_POSITION) * (acrossMax - acrossMin);
        boolean bidirectional = random.nextDouble() < config.getBidirectionalProbability();

        double start;
        double end;
        if (fullLength) {
            start = alongMin;
            end = alongMax;
        } else if (random.nextDouble() < 0.5) {
            start = alongMin;
            end = alongMin + MainRoadLayout.uniform(random, MIN_EXTENT, MAX_EXTENT) * alongExtent;
        } else {
            end = alongMax;
            start = alongMax - MainRoadLayout.uniform(random, MIN_EXTENT, MAX_EXTENT) * alongExtent;
        }

        double endAcross = across;
        if (!fullLength && random.nextDouble() < config.getTiltProbability()) {
            double maxTilt = Math.toRadians(config.getMaxTiltDegrees());
            double tilt = MainRoadLayout.uniform(random, -maxTilt, maxTilt);
            double offset = (end - start) * Math.tan(tilt);
            if (across + offset > acrossMax - TILT_BUFFER) {
                offset = acrossMax - TILT_BUFFER - across;
            } else if (across + offset < acrossMin + TILT_BUFFER) {
                offset = acrossMin + TILT_BUFFER - across;
            }
            endAcross = across + offset;
        }

        Coordinate from = horizontal ? new Coordinate(start, across) : new Coordinate(across, start);
        Coordinate to = horizontal ? new Coordinate(end, endAcross) : new Coordinate(endAcross, end);
        if (from.distance(to) < config.getMinRoadLength()) {
            return null;
        }
        RoadNode a = graph.addNode(from, NodeKind.INTERSECTION);
        RoadNode b = graph.addNode(to, NodeKind.INTERSECTION);
        return graph.addEdge(config.getSecondaryRoad().edge(a.getId(), b.getId(), bidirectional));
    }

    /**
     * Rectangle bounded by two adjacent vertical and two adjacent horizontal main roads.
     */
    static final class Block {
        final double left;
        final double right;
        final double bottom;
        final double top;

        Block(double left, double right, double bottom, double top) {
            this.left = left;
            this.right = right;
            this.bottom = bottom;
            this.top = top;
        }
    }
}
