package org.urbanresilience.simulation.network;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.urbanresilience.core.model.NodeKind;
import org.urbanresilience.core.model.RoadEdge;
import org.urbanresilience.core.model.RoadGraph;
import org.urbanresilience.core.model.RoadNode;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Temporary edits to a road graph that are rolled back on {@link #close()}.
 * <p>
 * Every mutation records its inverse; closing replays the inverses newest first, so split
 * edges come back under their original ids.
 */
final class GraphEditScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GraphEditScope.class);

    private final RoadGraph graph;
    private final Deque<UndoStep> undo = new ArrayDeque<>();
    private boolean closed;

    GraphEditScope(RoadGraph graph) {
        this.graph = graph;
    }

    RoadGraph graph() {
        return graph;
    }

    RoadNode addNode(Coordinate coordinate, NodeKind kind) {
        ensureOpen();
        RoadNode node = graph.addNode(coordinate, kind);
        undo.push(new UndoStep("remove node " + node.getId(), () -> graph.removeNode(node.getId())));
        return node;
    }

    RoadEdge addEdge(RoadEdge.Builder builder) {
        ensureOpen();
        RoadEdge edge = graph.addEdge(builder);
        undo.push(new UndoStep("remove edge " + edge.getId(), () -> graph.removeEdge(edge.getId())));
        return edge;
    }

    RoadEdge removeEdge(int edgeId) {
        ensureOpen();
        RoadEdge edge = graph.removeEdge(edgeId);
        undo.push(new UndoStep("restore edge " + edgeId, () -> graph.restoreEdge(edge)));
        return edge;
    }

    int pendingSteps() {
        return undo.size();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        int failures = 0;
        while (!undo.isEmpty()) {
            UndoStep step = undo.pop();
            try {
                step.action.run();
            } catch (RuntimeException e) {
                failures++;
                log.error("Failed to undo graph edit ({}), graph may have drifted", step.description, e);
            }
        }
        if (failures == 0) {
            log.debug("Graph edit scope closed cleanly");
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Edit scope already closed");
        }
    }

    private static final class UndoStep {
        private final String description;
        private final Runnable action;

        private UndoStep(String description, Runnable action) {
            this.description = description;
            this.action = action;
        }
    }
}
