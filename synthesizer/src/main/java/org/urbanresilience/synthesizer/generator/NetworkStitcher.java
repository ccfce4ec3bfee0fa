package org.urbanresilience.synthesizer.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanresilience.core.model.GraphComponents;
import org.urbanresilience.core.model.RoadGraph;
import org.urbanresilience.core.model.RoadNode;
import org.urbanresilience.synthesizer.config.RoadSpec;

import java.util.List;

/**
 * Joins stray components to the main network.
 *
 * A diagonal artery or alley that misses every other road would otherwise form an island. Each
 * smaller component is linked to the largest one by a connector road between their closest pair
 * of nodes; the caller re-resolves intersections afterwards.
 */
public final class NetworkStitcher {

    private static final Logger LOG = LoggerFactory.getLogger(NetworkStitcher.class);

    private final RoadSpec connectorSpec;

    public NetworkStitcher(RoadSpec connectorSpec) {
        this.connectorSpec = connectorSpec;
    }

    /**
     * @return number of connector roads added
     */
    public int stitch(RoadGraph graph) {
        GraphComponents components = GraphComponents.of(graph);
        if (components.isConnected()) {
            return 0;
        }
        List<List<Integer>> all = components.getComponents();
        List<Integer> main = all.get(0);
        int added = 0;
        for (int i = 1; i < all.size(); i++) {
            RoadNode bestFrom = null;
            RoadNode bestTo = null;
            double best = Double.POSITIVE_INFINITY;
            for (Integer candidateId : all.get(i)) {
                RoadNode candidate = graph.node(candidateId);
                for (Integer targetId : main) {
                    RoadNode target = graph.node(targetId);
                    double distance = candidate.distanceTo(target.getCoordinate());
                    if (distance < best) {
                        best = distance;
                        bestFrom = candidate;
                        bestTo = target;
                    }
                }
            }
            if (bestFrom == null) {
                continue;
            }
            graph.addEdge(connectorSpec.edge(bestFrom.getId(), bestTo.getId(), true));
            added++;
            LOG.info("[Synthesizer] Linked stray component of {} nodes with a {}m connector",
                    all.get(i).size(), String.format("%.1f", best));
        }
        return added;
    }
}
