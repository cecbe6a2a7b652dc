package com.paircraft.engine.service;

import com.paircraft.engine.pairing.PairingOutcome;

/**
 * Callback for successfully generated rounds, e.g. to notify players.
 */
public interface PairingListener {
    void onPairingsGenerated(String tournamentId, PairingOutcome outcome);
}
