package com.paircraft.engine;

import com.paircraft.engine.config.PairingConfig;
import com.paircraft.engine.model.GameResult;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.Player;
import com.paircraft.engine.model.ResultEntry;
import com.paircraft.engine.model.Round;
import com.paircraft.engine.model.TournamentState;
import com.paircraft.engine.pairing.PairingOutcome;
import com.paircraft.engine.service.TournamentEngineService;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared fixtures: players p1..pN with the given ratings, and a driver that plays rounds where
 * the higher-rated player always wins.
 */
public final class TestTournaments {

    private TestTournaments() {
    }

    public static List<Player> players(int... ratings) {
        List<Player> players = new ArrayList<>();
        for (int i = 0; i < ratings.length; i++) {
            players.add(new Player("p" + (i + 1), "Player " + (i + 1), ratings[i]));
        }
        return players;
    }

    public static TournamentState state(int... ratings) {
        return new TournamentState("t1", players(ratings));
    }

    /**
     * Results for every pending game of the round: the higher rating wins, equal ratings draw.
     */
    public static List<ResultEntry> higherRatedWins(TournamentState state, Round round) {
        List<ResultEntry> results = new ArrayList<>();
        for (Pairing pairing : round.pairings()) {
            if (pairing.isBye() || !pairing.isPending()) {
                continue;
            }
            int white = rating(state, pairing.whiteId());
            int black = rating(state, pairing.blackId());
            GameResult result = white > black ? GameResult.WHITE_WIN
                : white < black ? GameResult.BLACK_WIN : GameResult.DRAW;
            results.add(new ResultEntry(pairing.id(), result));
        }
        return results;
    }

    /**
     * Pairs and completes {@code rounds} further rounds.
     */
    public static TournamentState playRounds(TournamentEngineService service, TournamentState state,
                                             PairingConfig config, int rounds) {
        TournamentState current = state;
        for (int i = 0; i < rounds; i++) {
            current = pairNext(service, current, config);
            int number = current.rounds().size();
            current = service.recordResults(current, number,
                higherRatedWins(current, current.round(number).orElseThrow()));
        }
        return current;
    }

    public static TournamentState pairNext(TournamentEngineService service, TournamentState state,
                                           PairingConfig config) {
        PairingOutcome outcome = service.generatePairings(state, state.rounds().size() + 1, config);
        return state.withRound(outcome.toRound());
    }

    private static int rating(TournamentState state, String playerId) {
        return state.players().stream()
            .filter(p -> p.id().equals(playerId))
            .findFirst()
            .orElseThrow()
            .ratingOrZero();
    }
}
