package org.urbanresilience.core.model;

/**
 * Functional class of a road edge.
 */
public enum RoadClass {
    MAIN,
    SECONDARY,
    ACCESS
}
