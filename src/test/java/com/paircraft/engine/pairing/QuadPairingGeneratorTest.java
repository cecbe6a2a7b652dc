package com.paircraft.engine.pairing;

import com.paircraft.engine.config.PairingConfig;
import com.paircraft.engine.config.PairingMethod;
import com.paircraft.engine.error.InvalidConfigurationException;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.TournamentState;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.paircraft.engine.TestTournaments.players;
import static com.paircraft.engine.TestTournaments.state;
import static com.paircraft.engine.pairing.PairingTestSupport.generate;
import static org.junit.jupiter.api.Assertions.*;

class QuadPairingGeneratorTest {

    private final QuadPairingGenerator generator = new QuadPairingGenerator();
    private final PairingConfig config = PairingConfig.builder().method(PairingMethod.QUAD).rounds(3).build();

    @Test
    void quads_groupsByRatingOrder() {
        List<List<String>> quads = QuadPairingGenerator.quads(players(2400, 2300, 2200, 2100, 2000, 1900));

        assertEquals(List.of(List.of("p1", "p2", "p3", "p4"), List.of("p5", "p6")), quads);
    }

    @Test
    void generate_eachQuadPlaysItsOwnRoundRobin() {
        TournamentState state = state(2400, 2300, 2200, 2100, 2000, 1900, 1800, 1700);
        Set<Set<String>> met = new HashSet<>();

        for (int round = 1; round <= 3; round++) {
            SectionPairing result = generate(generator, state, round, config);
            assertEquals(PairingStatus.COMPLETE, result.status());
            assertEquals(4, result.pairings().size());
            for (Pairing pairing : result.pairings()) {
                boolean topQuad = pairing.group().equals("Quad 1");
                Set<String> quad = topQuad ? Set.of("p1", "p2", "p3", "p4") : Set.of("p5", "p6", "p7", "p8");
                assertTrue(quad.contains(pairing.whiteId()) && quad.contains(pairing.blackId()), pairing.id());
                assertTrue(met.add(Set.of(pairing.whiteId(), pairing.blackId())));
            }
        }
        assertEquals(12, met.size());
    }

    @Test
    void generate_boardsNumberedAcrossQuads() {
        TournamentState state = state(2400, 2300, 2200, 2100, 2000, 1900, 1800, 1700);

        List<Pairing> pairings = generate(generator, state, 1, config).pairings();

        assertEquals(List.of(1, 2, 3, 4), pairings.stream().map(Pairing::board).toList());
        assertEquals("Quad 1", pairings.get(1).group());
        assertEquals("Quad 2", pairings.get(2).group());
    }

    @Test
    void generate_twoPlayerQuadRepeatsAndIsReported() {
        TournamentState state = state(2400, 2300, 2200, 2100, 2000, 1900);

        SectionPairing round1 = generate(generator, state, 1, config);
        SectionPairing round2 = generate(generator, state, 2, config);

        assertTrue(round1.deviations().stream().anyMatch(d -> d.kind() == DeviationKind.UNDERSIZED_GROUP));
        assertEquals(PairingStatus.BEST_EFFORT, round2.status());
        assertTrue(round2.deviations().stream().anyMatch(d -> d.kind() == DeviationKind.REPEAT_PAIRING
            && d.playerIds().containsAll(List.of("p5", "p6"))));
    }

    @Test
    void generate_threePlayerQuadRotatesBye() {
        TournamentState state = state(2400, 2300, 2200, 2100, 2000, 1900, 1800);
        Set<String> byes = new HashSet<>();

        for (int round = 1; round <= 3; round++) {
            SectionPairing result = generate(generator, state, round, config);
            assertTrue(result.deviations().isEmpty());
            result.pairings().stream().filter(Pairing::isBye).forEach(p -> byes.add(p.byePlayerId()));
        }
        assertEquals(Set.of("p5", "p6", "p7"), byes);
    }

    @Test
    void config_quadWithFourRoundsIsRejected() {
        assertThrows(InvalidConfigurationException.class,
            () -> PairingConfig.builder().method(PairingMethod.QUAD).rounds(4).build());
    }
}
