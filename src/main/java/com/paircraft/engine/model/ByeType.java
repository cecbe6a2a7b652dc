package com.paircraft.engine.model;

/**
 * Kinds of bye a player can receive in a round.
 */
public enum ByeType {
    /** Assigned by the pairing generator because the section had an odd count. */
    PAIRING_ALLOCATED,
    /** Requested in advance, scored as a half point by default. */
    HALF_POINT,
    /** Requested in advance, scored as a full point by default. */
    FULL_POINT,
    /** Player not paired and not scored, e.g. an unannounced absence. */
    ZERO_POINT
}
