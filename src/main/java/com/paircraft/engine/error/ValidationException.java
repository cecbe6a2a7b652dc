package com.paircraft.engine.error;

/**
 * Thrown when a request references state that does not exist or may not be changed,
 * such as an unknown pairing or an already finalized round.
 */
public class ValidationException extends PairingEngineException {
    public ValidationException(String message) {
        super(message);
    }
}
