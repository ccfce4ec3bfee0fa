package org.urbanresilience.core.model;

/**
 * Kinds of road graph nodes. Only INTERSECTION nodes persist between queries.
 */
public enum NodeKind {
    INTERSECTION,
    /** Split point inserted on an edge while a query is attached. */
    VIRTUAL,
    /** Exact query location, joined to the network by an access edge. */
    ACCESS;

    public boolean isTransient() {
        return this != INTERSECTION;
    }
}
