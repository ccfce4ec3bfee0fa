package org.urbanresilience.synthesizer.generator;

/**
 * Source of road networks.
 * Implementations can synthesize maps procedurally or adapt them from other sources.
 */
public interface MapSynthesizer {

    /**
     * Produces a new, fully resolved road network.
     *
     * @return the map with its boundary and planar road graph
     */
    SynthesizedMap synthesize();
}
