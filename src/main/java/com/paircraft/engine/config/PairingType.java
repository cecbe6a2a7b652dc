package com.paircraft.engine.config;

import com.paircraft.engine.error.InvalidConfigurationException;

public enum PairingType {
    STANDARD,
    ACCELERATED;

    public static PairingType fromKey(String key) {
        for (PairingType type : values()) {
            if (type.name().equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new InvalidConfigurationException("Unknown pairing type: " + key);
    }
}
