package com.paircraft.engine.config;

import com.paircraft.engine.error.InvalidConfigurationException;

/**
 * How a team's pairing score is derived from its members' results.
 */
public enum TeamScoring {
    /** 2 for a won match, 1 for a drawn match. */
    MATCH_POINTS,
    /** Sum of the members' board points. */
    GAME_POINTS;

    public static TeamScoring fromKey(String key) {
        for (TeamScoring scoring : values()) {
            if (scoring.name().equalsIgnoreCase(key)) {
                return scoring;
            }
        }
        throw new InvalidConfigurationException("Unknown team scoring: " + key);
    }
}
