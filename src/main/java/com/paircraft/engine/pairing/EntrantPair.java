package com.paircraft.engine.pairing;

/**
 * Two entrants paired on one board. Before color allocation {@code first} is the higher
 * ranked; after it, {@code first} holds white.
 */
record EntrantPair(Entrant first, Entrant second) {

    EntrantPair swapped() {
        return new EntrantPair(second, first);
    }
}
