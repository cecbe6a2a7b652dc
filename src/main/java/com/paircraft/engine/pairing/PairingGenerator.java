package com.paircraft.engine.pairing;

/**
 * Produces one section's pairings for one round. Implementations are stateless.
 */
public interface PairingGenerator {

    SectionPairing generate(SectionInput input);
}
