package org.urbanresilience.core.model;

/**
 * Travel direction of a lane relative to the edge's from-to orientation.
 */
public enum LaneDirection {
    FORWARD,
    BACKWARD
}
