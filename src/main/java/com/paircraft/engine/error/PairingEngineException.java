package com.paircraft.engine.error;

/**
 * Base type for every failure the pairing and tiebreak engine reports to its callers.
 */
public abstract class PairingEngineException extends RuntimeException {

    protected PairingEngineException(String message) {
        super(message);
    }

    protected PairingEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
