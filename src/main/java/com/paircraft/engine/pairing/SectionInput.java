package com.paircraft.engine.pairing;

import com.paircraft.engine.config.PairingConfig;
import com.paircraft.engine.history.TournamentHistory;
import com.paircraft.engine.model.Player;
import com.paircraft.engine.model.Team;
import com.paircraft.engine.model.TournamentState;

import java.util.List;

/**
 * Everything a generator needs to pair one section for one round.
 *
 * @param players every registered player of the section in initial rank order, withdrawn included
 * @param teams   the section's teams, used by team-swiss only
 */
public record SectionInput(
    String section,
    int round,
    List<Player> players,
    List<Team> teams,
    TournamentState state,
    TournamentHistory history,
    PairingConfig config,
    SearchBudget budget
) {
    public boolean isFinalRound() {
        return round == config.rounds();
    }
}
