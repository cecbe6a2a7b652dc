package com.paircraft.engine.error;

/**
 * Thrown when the recorded round history is internally inconsistent. The derived
 * state cannot be trusted, so pairing for the tournament stops until an administrator
 * corrects the history.
 */
public class DataIntegrityException extends PairingEngineException {
    public DataIntegrityException(String message) {
        super(message);
    }
}
