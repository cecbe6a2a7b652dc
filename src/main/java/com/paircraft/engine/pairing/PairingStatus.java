package com.paircraft.engine.pairing;

public enum PairingStatus {
    /** Every rule was satisfied. */
    COMPLETE,
    /** Pairings were produced but at least one rule deviation is reported. */
    BEST_EFFORT,
    /** Nothing left to pair, e.g. an elimination bracket with a single survivor. */
    FINISHED
}
