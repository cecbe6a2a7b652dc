package com.paircraft.engine.config;

import com.paircraft.engine.error.InvalidConfigurationException;

public enum TiebreakCriterion {
    BUCHHOLZ("buchholz"),
    MODIFIED_BUCHHOLZ("modifiedBuchholz"),
    MEDIAN_BUCHHOLZ("medianBuchholz"),
    SONNEBORN_BERGER("sonnebornBerger"),
    CUMULATIVE("cumulative"),
    KOYA("koya"),
    DIRECT_ENCOUNTER("directEncounter"),
    AVERAGE_OPPONENT_RATING("avgOpponentRating"),
    PERFORMANCE_RATING("performanceRating");

    private final String key;

    TiebreakCriterion(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static TiebreakCriterion fromKey(String key) {
        for (TiebreakCriterion criterion : values()) {
            if (criterion.key.equalsIgnoreCase(key) || criterion.name().equalsIgnoreCase(key)) {
                return criterion;
            }
        }
        throw new InvalidConfigurationException("Unknown tiebreak criterion: " + key);
    }
}
