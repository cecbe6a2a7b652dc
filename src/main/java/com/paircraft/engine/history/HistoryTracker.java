package com.paircraft.engine.history;

import com.paircraft.engine.error.DataIntegrityException;
import com.paircraft.engine.model.Color;
import com.paircraft.engine.model.GameResult;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.Player;
import com.paircraft.engine.model.Round;
import com.paircraft.engine.model.ScoringRules;
import com.paircraft.engine.model.TournamentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives scores, opponents, colors and byes by replaying every round from round 1.
 *
 * <p>There is no incremental state: every call rebuilds the full history, so a corrected
 * result anywhere in the past produces the same history as a fresh run. Pending results
 * contribute nothing until they are entered.
 */
public final class HistoryTracker {

    private static final Logger log = LoggerFactory.getLogger(HistoryTracker.class);

    private HistoryTracker() {
        // Utility class
    }

    public static TournamentHistory replay(TournamentState state) {
        return replay(state, state.rounds().size());
    }

    /**
     * Replays rounds 1..throughRound.
     *
     * @throws DataIntegrityException if any round references unknown players, seats a player
     *                                twice, carries a malformed bye or is out of sequence
     */
    public static TournamentHistory replay(TournamentState state, int throughRound) {
        PlayerRegistry registry = PlayerRegistry.of(state.players(), state.teams());
        ScoringRules scoring = state.scoring();
        Map<String, List<RoundEntry>> entries = new LinkedHashMap<>();
        for (Player player : registry.all()) {
            entries.put(player.id(), new ArrayList<>());
        }

        int limit = Math.min(throughRound, state.rounds().size());
        for (int index = 0; index < limit; index++) {
            Round round = state.rounds().get(index);
            if (round.number() != index + 1) {
                throw new DataIntegrityException("Round at position " + (index + 1)
                    + " is numbered " + round.number());
            }
            replayRound(round, registry, scoring, entries);
        }

        Map<String, PlayerHistory> histories = new LinkedHashMap<>();
        entries.forEach((id, list) -> histories.put(id, new PlayerHistory(id, list)));
        log.debug("Replayed {} rounds for tournament {}", limit, state.id());
        return new TournamentHistory(registry, histories, limit);
    }

    private static void replayRound(Round round, PlayerRegistry registry, ScoringRules scoring,
                                    Map<String, List<RoundEntry>> entries) {
        Set<String> seated = new HashSet<>();
        Set<String> pairingIds = new HashSet<>();
        for (Pairing pairing : round.pairings()) {
            if (pairing.round() != round.number()) {
                throw new DataIntegrityException("Pairing " + pairing.id() + " belongs to round "
                    + pairing.round() + " but is stored in round " + round.number());
            }
            if (!pairingIds.add(pairing.id())) {
                throw new DataIntegrityException("Duplicate pairing id " + pairing.id() + " in round " + round.number());
            }
            if (pairing.whiteId() == null && pairing.blackId() == null) {
                throw new DataIntegrityException("Pairing " + pairing.id() + " has no players");
            }
            for (String playerId : new String[] {pairing.whiteId(), pairing.blackId()}) {
                if (playerId == null) {
                    continue;
                }
                if (!registry.contains(playerId)) {
                    throw new DataIntegrityException("Pairing " + pairing.id() + " references unknown player " + playerId);
                }
                if (!seated.add(playerId)) {
                    throw new DataIntegrityException("Player " + playerId + " appears twice in round " + round.number());
                }
            }

            if (pairing.isBye()) {
                if (pairing.result() != GameResult.BYE || pairing.byeType() == null) {
                    throw new DataIntegrityException("Bye pairing " + pairing.id() + " must carry a bye type and result");
                }
                String playerId = pairing.byePlayerId();
                entries.get(playerId).add(new RoundEntry(round.number(), null, null, RoundEntry.Outcome.BYE,
                    scoring.halvesForBye(pairing.byeType()), pairing.byeType()));
                continue;
            }
            if (pairing.result() == GameResult.BYE || pairing.byeType() != null) {
                throw new DataIntegrityException("Game " + pairing.id() + " is marked as a bye");
            }
            if (pairing.isPending()) {
                continue;
            }
            entries.get(pairing.whiteId()).add(entryFor(round.number(), pairing, Color.WHITE, scoring));
            entries.get(pairing.blackId()).add(entryFor(round.number(), pairing, Color.BLACK, scoring));
        }
    }

    private static RoundEntry entryFor(int round, Pairing pairing, Color side, ScoringRules scoring) {
        boolean white = side == Color.WHITE;
        String opponent = white ? pairing.blackId() : pairing.whiteId();
        RoundEntry.Outcome outcome = switch (pairing.result()) {
            case WHITE_WIN -> white ? RoundEntry.Outcome.WIN : RoundEntry.Outcome.LOSS;
            case BLACK_WIN -> white ? RoundEntry.Outcome.LOSS : RoundEntry.Outcome.WIN;
            case DRAW -> RoundEntry.Outcome.DRAW;
            case WHITE_FORFEIT_WIN -> white ? RoundEntry.Outcome.FORFEIT_WIN : RoundEntry.Outcome.FORFEIT_LOSS;
            case BLACK_FORFEIT_WIN -> white ? RoundEntry.Outcome.FORFEIT_LOSS : RoundEntry.Outcome.FORFEIT_WIN;
            case DOUBLE_FORFEIT -> RoundEntry.Outcome.FORFEIT_LOSS;
            case PENDING, BYE -> throw new IllegalStateException("No entry for result " + pairing.result());
        };
        return new RoundEntry(round, opponent, side, outcome, scoring.halvesFor(pairing.result(), side), null);
    }
}
