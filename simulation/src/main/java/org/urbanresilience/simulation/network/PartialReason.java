package org.urbanresilience.simulation.network;

/**
 * Why a route stopped short of its destination.
 */
public enum PartialReason {
    /** Destination is not reachable through passable roads. */
    NO_ROUTE,
    /** Every continuation would exceed the travel time ceiling. */
    TIME_LIMIT_EXCEEDED,
    /** The search gave up after its expansion budget. */
    SEARCH_LIMIT_REACHED
}
