package com.paircraft.engine.config;

import com.paircraft.engine.error.InvalidConfigurationException;

public enum PairingMethod {
    FIDE_DUTCH("fide_dutch"),
    ROUND_ROBIN("round_robin"),
    QUAD("quad"),
    SINGLE_ELIMINATION("single_elimination"),
    TEAM_SWISS("team_swiss");

    private final String key;

    PairingMethod(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isSwiss() {
        return this == FIDE_DUTCH || this == TEAM_SWISS;
    }

    /**
     * Resolves a settings key. "us_chess" is accepted as an alias of the Dutch system.
     */
    public static PairingMethod fromKey(String key) {
        if ("us_chess".equalsIgnoreCase(key)) {
            return FIDE_DUTCH;
        }
        for (PairingMethod method : values()) {
            if (method.key.equalsIgnoreCase(key) || method.name().equalsIgnoreCase(key)) {
                return method;
            }
        }
        throw new InvalidConfigurationException("Unknown pairing method: " + key);
    }
}
