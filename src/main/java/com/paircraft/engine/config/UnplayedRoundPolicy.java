package com.paircraft.engine.config;

import com.paircraft.engine.error.InvalidConfigurationException;

/**
 * Value counted in the Buchholz family for a round in which the player had no opponent.
 */
public enum UnplayedRoundPolicy {
    /** The round contributes nothing. */
    ZERO,
    /** The round counts as an opponent with the player's own final score. */
    OWN_SCORE,
    /**
     * The round counts as a virtual opponent: score before the round, plus the points
     * the player did not get in it, plus half a point for every later round.
     */
    VIRTUAL_OPPONENT;

    public static UnplayedRoundPolicy fromKey(String key) {
        for (UnplayedRoundPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(key)) {
                return policy;
            }
        }
        throw new InvalidConfigurationException("Unknown unplayed round policy: " + key);
    }
}
