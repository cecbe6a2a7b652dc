package com.paircraft.engine.pairing;

import com.paircraft.engine.config.PairingMethod;

/**
 * Picks the generator for a pairing method.
 */
public final class PairingGenerators {

    private PairingGenerators() {
        // Utility class
    }

    public static PairingGenerator forMethod(PairingMethod method) {
        return switch (method) {
            case FIDE_DUTCH -> new SwissPairingGenerator();
            case ROUND_ROBIN -> new RoundRobinPairingGenerator();
            case QUAD -> new QuadPairingGenerator();
            case SINGLE_ELIMINATION -> new SingleEliminationPairingGenerator();
            case TEAM_SWISS -> new TeamSwissPairingGenerator();
        };
    }
}
