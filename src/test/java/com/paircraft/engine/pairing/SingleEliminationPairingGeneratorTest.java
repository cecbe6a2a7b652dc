package com.paircraft.engine.pairing;

import com.paircraft.engine.config.PairingConfig;
import com.paircraft.engine.config.PairingMethod;
import com.paircraft.engine.error.ValidationException;
import com.paircraft.engine.model.ByeType;
import com.paircraft.engine.model.GameResult;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.Round;
import com.paircraft.engine.model.TournamentState;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.paircraft.engine.TestTournaments.state;
import static com.paircraft.engine.pairing.PairingTestSupport.SECTION;
import static com.paircraft.engine.pairing.PairingTestSupport.games;
import static com.paircraft.engine.pairing.PairingTestSupport.generate;
import static org.junit.jupiter.api.Assertions.*;

class SingleEliminationPairingGeneratorTest {

    private final SingleEliminationPairingGenerator generator = new SingleEliminationPairingGenerator();
    private final PairingConfig config =
        PairingConfig.builder().method(PairingMethod.SINGLE_ELIMINATION).rounds(3).build();

    @Test
    void bracketOrder_keepsTopSeedsApart() {
        assertEquals(List.of(1, 2), SingleEliminationPairingGenerator.bracketOrder(2));
        assertEquals(List.of(1, 4, 2, 3), SingleEliminationPairingGenerator.bracketOrder(4));
        assertEquals(List.of(1, 8, 4, 5, 2, 7, 3, 6), SingleEliminationPairingGenerator.bracketOrder(8));
    }

    @Test
    void round1_emptySlotsBecomeByesInPlace() {
        TournamentState state = state(2500, 2400, 2300, 2200, 2100, 2000);

        List<Pairing> pairings = generate(generator, state, 1, config).pairings();

        assertEquals(4, pairings.size());
        assertEquals("p1", pairings.get(0).byePlayerId());
        assertEquals(ByeType.PAIRING_ALLOCATED, pairings.get(0).byeType());
        assertEquals("p4", pairings.get(1).whiteId());
        assertEquals("p5", pairings.get(1).blackId());
        assertEquals("p2", pairings.get(2).byePlayerId());
        assertEquals("p3", pairings.get(3).whiteId());
        assertEquals("p6", pairings.get(3).blackId());
    }

    @Test
    void round2_pairsWinnersOfAdjacentBoards() {
        TournamentState state = state(2500, 2400, 2300, 2200, 2100, 2000)
            .withRound(new Round(1, List.of(
                Pairing.bye(1, SECTION, 1, "p1", ByeType.PAIRING_ALLOCATED),
                Pairing.game(1, SECTION, 2, "p4", "p5").withResult(GameResult.BLACK_WIN),
                Pairing.bye(1, SECTION, 3, "p2", ByeType.PAIRING_ALLOCATED),
                Pairing.game(1, SECTION, 4, "p3", "p6").withResult(GameResult.WHITE_WIN))));

        SectionPairing result = generate(generator, state, 2, config);

        assertEquals(PairingStatus.COMPLETE, result.status());
        assertEquals(2, result.pairings().size());
        assertEquals(List.of("p1", "p5"), List.of(result.pairings().get(0).whiteId(), result.pairings().get(0).blackId()));
        assertEquals(List.of("p2", "p3"), List.of(result.pairings().get(1).whiteId(), result.pairings().get(1).blackId()));
    }

    @Test
    void round2_drawAdvancesHigherSeedWithDeviation() {
        TournamentState state = state(2500, 2400, 2300, 2200)
            .withRound(new Round(1, List.of(
                Pairing.game(1, SECTION, 1, "p1", "p4").withResult(GameResult.WHITE_WIN),
                Pairing.game(1, SECTION, 2, "p2", "p3").withResult(GameResult.DRAW))));

        SectionPairing result = generate(generator, state, 2, config);

        assertEquals(PairingStatus.BEST_EFFORT, result.status());
        assertEquals(DeviationKind.DRAW_ADVANCED_BY_SEED, result.deviations().get(0).kind());
        assertEquals("p1", result.pairings().get(0).whiteId());
        assertEquals("p2", result.pairings().get(0).blackId());
    }

    @Test
    void doubleForfeits_keepLaterRoundsOnTheirBracketPositions() {
        PairingConfig knockout = PairingConfig.builder().method(PairingMethod.SINGLE_ELIMINATION).rounds(4).build();
        TournamentState state = state(2500, 2450, 2400, 2350, 2300, 2250, 2200, 2150,
            2100, 2050, 2000, 1950, 1900, 1850, 1800, 1750)
            .withRound(new Round(1, List.of(
                Pairing.game(1, SECTION, 1, "p1", "p16").withResult(GameResult.DOUBLE_FORFEIT),
                Pairing.game(1, SECTION, 2, "p8", "p9").withResult(GameResult.DOUBLE_FORFEIT),
                Pairing.game(1, SECTION, 3, "p4", "p13").withResult(GameResult.WHITE_WIN),
                Pairing.game(1, SECTION, 4, "p5", "p12").withResult(GameResult.WHITE_WIN),
                Pairing.game(1, SECTION, 5, "p2", "p15").withResult(GameResult.WHITE_WIN),
                Pairing.game(1, SECTION, 6, "p7", "p10").withResult(GameResult.WHITE_WIN),
                Pairing.game(1, SECTION, 7, "p3", "p14").withResult(GameResult.WHITE_WIN),
                Pairing.game(1, SECTION, 8, "p6", "p11").withResult(GameResult.WHITE_WIN))));

        List<Pairing> round2 = generate(generator, state, 2, knockout).pairings();

        assertEquals(Set.of(Set.of("p4", "p5"), Set.of("p2", "p7"), Set.of("p3", "p6")), games(round2));
        TournamentState afterRound2 = state.withRound(new Round(2,
            round2.stream().map(p -> p.withResult(GameResult.WHITE_WIN)).toList()));

        List<Pairing> round3 = generate(generator, afterRound2, 3, knockout).pairings();

        assertEquals(2, round3.size());
        assertEquals("p4", round3.get(0).byePlayerId());
        assertEquals(List.of("p2", "p3"), List.of(round3.get(1).whiteId(), round3.get(1).blackId()));
    }

    @Test
    void final_leavesSectionFinished() {
        TournamentState state = state(2500, 2400)
            .withRound(new Round(1, List.of(
                Pairing.game(1, SECTION, 1, "p1", "p2").withResult(GameResult.BLACK_WIN))));

        SectionPairing result = generate(generator, state, 2, config);

        assertEquals(PairingStatus.FINISHED, result.status());
        assertTrue(result.pairings().isEmpty());
    }

    @Test
    void pendingPreviousRoundIsRejected() {
        TournamentState state = state(2500, 2400, 2300, 2200)
            .withRound(new Round(1, List.of(
                Pairing.game(1, SECTION, 1, "p1", "p4").withResult(GameResult.WHITE_WIN),
                Pairing.game(1, SECTION, 2, "p2", "p3"))));

        assertThrows(ValidationException.class, () -> generate(generator, state, 2, config));
    }
}
