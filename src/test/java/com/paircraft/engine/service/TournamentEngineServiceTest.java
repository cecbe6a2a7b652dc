package com.paircraft.engine.service;

import com.paircraft.engine.config.PairingConfig;
import com.paircraft.engine.config.TiebreakConfig;
import com.paircraft.engine.error.DataIntegrityException;
import com.paircraft.engine.error.ExhaustedSearchException;
import com.paircraft.engine.error.InvalidConfigurationException;
import com.paircraft.engine.error.ValidationException;
import com.paircraft.engine.history.HistoryTracker;
import com.paircraft.engine.history.TournamentHistory;
import com.paircraft.engine.model.ByeType;
import com.paircraft.engine.model.GameResult;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.Player;
import com.paircraft.engine.model.ResultEntry;
import com.paircraft.engine.model.Round;
import com.paircraft.engine.model.ScoringRules;
import com.paircraft.engine.model.TournamentState;
import com.paircraft.engine.pairing.DeviationKind;
import com.paircraft.engine.pairing.PairingOutcome;
import com.paircraft.engine.pairing.PairingStatus;
import com.paircraft.engine.tiebreak.RankedStanding;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.paircraft.engine.TestTournaments.higherRatedWins;
import static com.paircraft.engine.TestTournaments.pairNext;
import static com.paircraft.engine.TestTournaments.playRounds;
import static com.paircraft.engine.TestTournaments.state;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.*;

class TournamentEngineServiceTest {

    private static final String SECTION = "Open";

    private final TournamentEngineService service = new TournamentEngineService(200_000, 2_000, 2);

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void generatePairings_firstRoundOfEightPlayers() {
        TournamentState state = state(2400, 2300, 2200, 2100, 2000, 1900, 1800, 1700);

        PairingOutcome outcome = service.generatePairings(state, 1, PairingConfig.defaults(5));

        assertEquals("t1", outcome.tournamentId());
        assertEquals(PairingStatus.COMPLETE, outcome.status());
        assertEquals(4, outcome.pairings().size());
        Pairing top = outcome.pairings().get(0);
        assertEquals(List.of("p1", "p5"), List.of(top.whiteId(), top.blackId()));
        assertEquals(1, outcome.accelerations().size());
        assertEquals(1, outcome.toRound().number());
    }

    @Test
    void generatePairings_oddFieldOverFiveRounds() {
        TournamentState state = state(2400, 2300, 2200, 2100, 2000, 1900, 1800, 1700, 1600);
        PairingConfig config = PairingConfig.defaults(5);
        Set<String> byePlayers = new HashSet<>();
        Set<Set<String>> met = new HashSet<>();

        for (int round = 1; round <= 5; round++) {
            PairingOutcome outcome = service.generatePairings(state, round, config);
            List<Pairing> byes = outcome.pairings().stream()
                .filter(p -> p.isBye() && p.byeType() == ByeType.PAIRING_ALLOCATED)
                .toList();
            assertEquals(1, byes.size(), "round " + round);
            assertTrue(byePlayers.add(byes.get(0).byePlayerId()), "second bye in round " + round);

            for (Pairing pairing : outcome.pairings()) {
                if (pairing.isBye()) {
                    continue;
                }
                Set<String> pair = Set.of(pairing.whiteId(), pairing.blackId());
                if (!met.add(pair)) {
                    assertTrue(outcome.deviations().stream().anyMatch(d -> d.kind() == DeviationKind.REPEAT_PAIRING
                        && d.playerIds().containsAll(pair)), "undocumented repeat " + pair);
                }
            }
            state = state.withRound(outcome.toRound());
            state = service.recordResults(state, round, higherRatedWins(state, state.round(round).orElseThrow()));
        }
        assertEquals(5, byePlayers.size());
    }

    @Test
    void completedRounds_scoresAddUpAndEveryPlayerHasOneEntryPerRound() {
        PairingConfig config = PairingConfig.defaults(4);
        TournamentState played = playRounds(service, state(2400, 2300, 2200, 2100, 2000, 1900, 1800), config, 4);
        TournamentHistory history = HistoryTracker.replay(played);

        int games = 0;
        int byes = 0;
        for (Round round : played.rounds()) {
            games += (int) round.pairings().stream().filter(p -> !p.isBye()).count();
            byes += (int) round.pairings().stream().filter(Pairing::isBye).count();
        }
        int totalHalves = played.players().stream().mapToInt(p -> history.of(p.id()).scoreHalves()).sum();
        assertEquals(2 * (games + byes), totalHalves);
        for (Player player : played.players()) {
            assertEquals(4, history.of(player.id()).entries().size(), player.id());
        }
    }

    @Test
    void generatePairings_isDeterministic() {
        PairingConfig config = PairingConfig.defaults(4);
        TournamentState first = playRounds(service, state(2400, 2300, 2200, 2100, 2000, 1900, 1800), config, 3);
        TournamentEngineService other = new TournamentEngineService(200_000, 2_000, 1);
        try {
            TournamentState second = playRounds(other, state(2400, 2300, 2200, 2100, 2000, 1900, 1800), config, 3);
            assertEquals(first.rounds(), second.rounds());
        } finally {
            other.shutdown();
        }
    }

    @Test
    void generatePairings_onlyTheNextRound() {
        TournamentState state = state(2000, 1900, 1800, 1700);

        assertThrows(ValidationException.class, () -> service.generatePairings(state, 2, PairingConfig.defaults(3)));
    }

    @Test
    void generatePairings_notBeyondPlannedRounds() {
        PairingConfig config = PairingConfig.defaults(1);
        TournamentState played = playRounds(service, state(2000, 1900, 1800, 1700), config, 1);

        assertThrows(ValidationException.class, () -> service.generatePairings(played, 2, config));
    }

    @Test
    void generatePairings_previousRoundMustBeComplete() {
        PairingConfig config = PairingConfig.defaults(3);
        TournamentState paired = pairNext(service, state(2000, 1900, 1800, 1700), config);

        assertThrows(ValidationException.class, () -> service.generatePairings(paired, 2, config));
    }

    @Test
    void generatePairings_invalidConfigurationIsRejected() {
        TournamentState state = state(2000, 1900);
        PairingConfig base = PairingConfig.defaults(3);
        PairingConfig broken = new PairingConfig(base.method(), base.pairingType(), base.accelerationType(),
            base.accelerationRounds(), null, null, 1.0, 0, 2, 2, false, 4, base.teamScoring(), true,
            base.tiebreaks());

        assertThrows(InvalidConfigurationException.class, () -> service.generatePairings(state, 1, broken));
    }

    @Test
    void generatePairings_pairsSectionsIndependently() {
        TournamentState state = new TournamentState("t1", List.of(
            new Player("a1", "A1", 2200, "Open"), new Player("a2", "A2", 2100, "Open"),
            new Player("b1", "B1", 1500, "Reserve"), new Player("b2", "B2", 1400, "Reserve")));

        PairingOutcome outcome = service.generatePairings(state, 1, PairingConfig.defaults(3));

        assertEquals(List.of("Open-R1-B1", "Reserve-R1-B1"), outcome.pairings().stream().map(Pairing::id).toList());
        assertEquals(2, outcome.accelerations().size());
    }

    @Test
    void generatePairings_disabledFallbackThrowsWithBestEffortOutcome() {
        PairingConfig config = PairingConfig.defaults(2).toBuilder().bestEffortFallback(false).build();
        TournamentState played = playRounds(service, state(2000, 1900), config, 1);

        ExhaustedSearchException e = assertThrows(ExhaustedSearchException.class,
            () -> service.generatePairings(played, 2, config));

        assertEquals(PairingStatus.BEST_EFFORT, e.bestEffort().status());
        assertEquals(DeviationKind.REPEAT_PAIRING, e.bestEffort().deviations().get(0).kind());
    }

    @Test
    void listeners_receiveEveryGeneratedRound() {
        PairingListener listener = mock(PairingListener.class);
        service.registerListener(listener);

        PairingOutcome outcome = service.generatePairings(state(2000, 1900), 1, PairingConfig.defaults(3));

        verify(listener).onPairingsGenerated(eq("t1"), same(outcome));
    }

    @Test
    void listeners_failureDoesNotUndoRound() {
        PairingListener failing = mock(PairingListener.class);
        PairingListener next = mock(PairingListener.class);
        doThrow(new IllegalStateException("boom")).when(failing).onPairingsGenerated(any(), any());
        service.registerListener(failing);
        service.registerListener(next);

        PairingOutcome outcome = service.generatePairings(state(2000, 1900), 1, PairingConfig.defaults(3));

        assertEquals(1, outcome.pairings().size());
        verify(next).onPairingsGenerated("t1", outcome);
    }

    @Test
    void recordResults_appliesEveryEntry() {
        PairingConfig config = PairingConfig.defaults(3);
        TournamentState paired = pairNext(service, state(2000, 1900, 1800, 1700), config);

        TournamentState recorded = service.recordResults(paired, 1, List.of(
            new ResultEntry("Open-R1-B1", GameResult.WHITE_WIN),
            new ResultEntry("Open-R1-B2", GameResult.DRAW)));

        Round round = recorded.round(1).orElseThrow();
        assertTrue(round.isComplete());
        assertEquals(GameResult.DRAW, round.pairing("Open-R1-B2").orElseThrow().result());
        assertFalse(paired.round(1).orElseThrow().isComplete());
    }

    @Test
    void recordResults_rejectsInvalidEntries() {
        PairingConfig config = PairingConfig.defaults(3);
        TournamentState paired = pairNext(service, state(2000, 1900, 1800), config);
        TournamentState partly = service.recordResults(paired, 1,
            List.of(new ResultEntry("Open-R1-B1", GameResult.WHITE_WIN)));

        assertThrows(ValidationException.class, () -> service.recordResults(paired, 2,
            List.of(new ResultEntry("Open-R1-B1", GameResult.DRAW))));
        assertThrows(ValidationException.class, () -> service.recordResults(paired, 1,
            List.of(new ResultEntry("Open-R1-B9", GameResult.DRAW))));
        assertThrows(ValidationException.class, () -> service.recordResults(paired, 1,
            List.of(new ResultEntry("Open-R1-B2", GameResult.DRAW))), "bye");
        assertThrows(ValidationException.class, () -> service.recordResults(paired, 1,
            List.of(new ResultEntry("Open-R1-B1", GameResult.PENDING))));
        assertThrows(ValidationException.class, () -> service.recordResults(paired, 1, List.of(
            new ResultEntry("Open-R1-B1", GameResult.DRAW), new ResultEntry("Open-R1-B1", GameResult.DRAW))));
        assertThrows(ValidationException.class, () -> service.recordResults(partly, 1,
            List.of(new ResultEntry("Open-R1-B1", GameResult.DRAW))), "finalized");
    }

    @Test
    void correctResult_withConfigRegeneratesUnplayedLaterRound() {
        PairingConfig config = PairingConfig.defaults(5);
        TournamentState played = playRounds(service, state(2400, 2300, 2200, 2100, 2000, 1900, 1800, 1700), config, 3);
        TournamentState paired = pairNext(service, played, config);
        Pairing game = paired.round(3).orElseThrow().pairings().get(0);
        GameResult flipped = game.result() == GameResult.WHITE_WIN ? GameResult.BLACK_WIN : GameResult.WHITE_WIN;

        RecomputedState recomputed = service.correctResult(paired, 3, game.id(), flipped, config);

        assertEquals(List.of(3, 4), recomputed.affectedRounds());
        assertEquals(List.of(4), recomputed.regeneratedRounds());
        TournamentState corrected = recomputed.state();
        assertEquals(flipped, corrected.round(3).orElseThrow().pairing(game.id()).orElseThrow().result());
        PairingOutcome fresh = service.generatePairings(corrected.truncatedAfter(3), 4, config);
        assertEquals(fresh.toRound(), corrected.round(4).orElseThrow());
    }

    @Test
    void correctResult_withoutConfigKeepsLaterRounds() {
        PairingConfig config = PairingConfig.defaults(5);
        TournamentState played = playRounds(service, state(2000, 1900, 1800, 1700), config, 2);
        TournamentState paired = pairNext(service, played, config);
        Pairing game = paired.round(1).orElseThrow().pairings().get(0);

        RecomputedState recomputed = service.correctResult(paired, 1, game.id(), GameResult.DRAW);

        assertEquals(List.of(1, 2, 3), recomputed.affectedRounds());
        assertTrue(recomputed.regeneratedRounds().isEmpty());
        assertEquals(paired.round(3), recomputed.state().round(3));
        assertEquals(GameResult.DRAW, recomputed.state().round(1).orElseThrow().pairings().get(0).result());
    }

    @Test
    void correctResult_rejectsByesAndUndecidedResults() {
        PairingConfig config = PairingConfig.defaults(3);
        TournamentState played = playRounds(service, state(2000, 1900, 1800), config, 1);

        assertThrows(ValidationException.class,
            () -> service.correctResult(played, 1, "Open-R1-B2", GameResult.DRAW));
        assertThrows(ValidationException.class,
            () -> service.correctResult(played, 1, "Open-R1-B1", GameResult.PENDING));
        assertThrows(ValidationException.class,
            () -> service.correctResult(played, 2, "Open-R2-B1", GameResult.DRAW));
    }

    @Test
    void corruptedHistory_haltsUntilResolved() {
        TournamentState corrupted = state(2000, 1900)
            .withRound(new Round(1, List.of(
                Pairing.game(1, SECTION, 1, "p1", "ghost").withResult(GameResult.DRAW))));
        PairingConfig config = PairingConfig.defaults(3);

        assertThrows(DataIntegrityException.class, () -> service.generatePairings(corrupted, 2, config));
        assertTrue(service.isHalted("t1"));
        assertThrows(DataIntegrityException.class, () -> service.generatePairings(state(2000, 1900), 1, config));

        service.resolveIntegrity("t1");

        assertFalse(service.isHalted("t1"));
        assertEquals(1, service.generatePairings(state(2000, 1900), 1, config).pairings().size());
    }

    @Test
    void haltedTournament_blocksPairingButStillAnswersStandings() {
        TournamentState corrupted = state(2000, 1900)
            .withRound(new Round(1, List.of(
                Pairing.game(1, SECTION, 1, "p1", "ghost").withResult(GameResult.DRAW))));
        PairingConfig config = PairingConfig.defaults(3);
        TournamentState played = playRounds(new TournamentEngineService(200_000, 2_000, 2), state(2000, 1900), config, 1);

        assertThrows(DataIntegrityException.class,
            () -> service.computeStandings(corrupted, SECTION, TiebreakConfig.defaults()));
        assertTrue(service.isHalted("t1"));

        List<RankedStanding> standings = service.computeStandings(played, SECTION, TiebreakConfig.defaults());

        assertEquals("p1", standings.get(0).playerId());
        assertTrue(service.isHalted("t1"));
        assertThrows(DataIntegrityException.class, () -> service.generatePairings(played, 2, config));
    }

    @Test
    void computeAllStandings_coversEverySection() {
        TournamentState state = new TournamentState("t1", List.of(
            new Player("b1", "B1", 1500, "Reserve"), new Player("b2", "B2", 1400, "Reserve"),
            new Player("a1", "A1", 2200, "Open"), new Player("a2", "A2", 2100, "Open")));
        PairingConfig config = PairingConfig.defaults(3);
        TournamentState played = playRounds(service, state, config, 1);

        Map<String, List<RankedStanding>> standings = service.computeAllStandings(played, TiebreakConfig.defaults());

        assertEquals(List.of("Open", "Reserve"), List.copyOf(standings.keySet()));
        assertEquals("a1", standings.get("Open").get(0).playerId());
        assertEquals(1.0, standings.get("Reserve").get(0).score());
        assertEquals(standings.get("Open"), service.computeStandings(played, "Open", TiebreakConfig.defaults()));
    }

    @Test
    void computeStandings_usesTournamentScoringRules() {
        PairingConfig config = PairingConfig.defaults(3);
        TournamentState state = state(2000, 1900, 1800)
            .withScoring(ScoringRules.defaults().withPairingAllocatedBye(0.5));
        TournamentState played = playRounds(service, state, config, 1);

        List<RankedStanding> standings = service.computeStandings(played, SECTION, TiebreakConfig.defaults());

        RankedStanding byePlayer = standings.stream().filter(s -> s.playerId().equals("p3")).findFirst().orElseThrow();
        assertEquals(0.5, byePlayer.score());
        assertEquals(1, byePlayer.byes());
    }

    @Test
    void computeStandings_unknownSectionIsRejected() {
        assertThrows(ValidationException.class,
            () -> service.computeStandings(state(2000, 1900), "Reserve", TiebreakConfig.defaults()));
    }
}
