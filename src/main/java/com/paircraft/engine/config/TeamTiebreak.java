package com.paircraft.engine.config;

import com.paircraft.engine.error.InvalidConfigurationException;

public enum TeamTiebreak {
    MATCH_POINTS("match_points"),
    GAME_POINTS("game_points"),
    BUCHHOLZ("buchholz"),
    SONNEBORN_BERGER("sonnebornBerger");

    private final String key;

    TeamTiebreak(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static TeamTiebreak fromKey(String key) {
        for (TeamTiebreak tiebreak : values()) {
            if (tiebreak.key.equalsIgnoreCase(key) || tiebreak.name().equalsIgnoreCase(key)) {
                return tiebreak;
            }
        }
        throw new InvalidConfigurationException("Unknown team tiebreak: " + key);
    }
}
