package com.paircraft.engine.config;

import com.paircraft.engine.error.InvalidConfigurationException;

/**
 * Acceleration variants.
 * <ul>
 *   <li>{@link #STANDARD}: one virtual point for the top half during the acceleration window</li>
 *   <li>{@link #SIXTHS}: six rating bands with decreasing virtual points</li>
 *   <li>{@link #ADDED_SCORE}: documented added-score values, recorded on the round</li>
 *   <li>{@link #ALL_ROUNDS}: the standard split applied in every round</li>
 * </ul>
 */
public enum AccelerationType {
    STANDARD("standard"),
    SIXTHS("sixths"),
    ADDED_SCORE("added_score"),
    ALL_ROUNDS("all_rounds");

    private final String key;

    AccelerationType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static AccelerationType fromKey(String key) {
        for (AccelerationType type : values()) {
            if (type.key.equalsIgnoreCase(key) || type.name().equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new InvalidConfigurationException("Unknown acceleration type: " + key);
    }
}
