package com.paircraft.engine.pairing;

import com.paircraft.engine.config.PairingConfig;
import com.paircraft.engine.history.HistoryTracker;
import com.paircraft.engine.history.TournamentHistory;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.Player;
import com.paircraft.engine.model.TournamentState;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

final class PairingTestSupport {

    static final String SECTION = Player.DEFAULT_SECTION;

    private PairingTestSupport() {
    }

    static SectionPairing generate(PairingGenerator generator, TournamentState state, int round, PairingConfig config) {
        TournamentHistory history = HistoryTracker.replay(state);
        return generator.generate(new SectionInput(SECTION, round, history.registry().section(SECTION),
            history.registry().teamsInSection(SECTION), state, history, config, new SearchBudget(200_000, 2_000)));
    }

    /**
     * Games as unordered player pairs, byes left out.
     */
    static Set<Set<String>> games(List<Pairing> pairings) {
        return pairings.stream()
            .filter(p -> !p.isBye())
            .map(p -> Set.of(p.whiteId(), p.blackId()))
            .collect(Collectors.toSet());
    }
}
