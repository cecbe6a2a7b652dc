package com.paircraft.engine.error;

/**
 * Thrown when a configuration is rejected before any computation starts.
 */
public class InvalidConfigurationException extends PairingEngineException {
    public InvalidConfigurationException(String message) {
        super(message);
    }
}
