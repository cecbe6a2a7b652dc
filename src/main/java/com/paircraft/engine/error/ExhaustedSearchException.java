package com.paircraft.engine.error;

import com.paircraft.engine.pairing.PairingOutcome;

/**
 * Thrown only when best-effort fallback is disabled and the pairing search could not
 * satisfy every rule. The best-effort outcome is attached for manual review.
 */
public class ExhaustedSearchException extends PairingEngineException {

    private final transient PairingOutcome bestEffort;

    public ExhaustedSearchException(String message, PairingOutcome bestEffort) {
        super(message);
        this.bestEffort = bestEffort;
    }

    public PairingOutcome bestEffort() {
        return bestEffort;
    }
}
