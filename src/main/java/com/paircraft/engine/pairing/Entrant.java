package com.paircraft.engine.pairing;

import com.google.common.collect.ImmutableSet;
import com.paircraft.engine.history.ColorProfile;

import java.util.Set;

/**
 * Anything the Dutch engine pairs: a player, or a team in team-swiss.
 *
 * @param scoreHalves        real score
 * @param pairingScoreHalves score used for grouping, including acceleration
 * @param rank               initial rank, 0 is the strongest
 * @param playedOpponents    entrants this one may not meet again
 * @param byeEligible        whether a pairing-allocated bye may go to this entrant
 */
public record Entrant(
    String id,
    int scoreHalves,
    int pairingScoreHalves,
    int rank,
    Set<String> playedOpponents,
    ColorProfile colors,
    boolean byeEligible
) {
    public Entrant {
        playedOpponents = ImmutableSet.copyOf(playedOpponents);
    }

    public boolean hasPlayed(Entrant other) {
        return playedOpponents.contains(other.id);
    }
}
