package com.paircraft.engine.pairing;

import com.paircraft.engine.config.PairingConfig;
import com.paircraft.engine.config.PairingMethod;
import com.paircraft.engine.error.InvalidConfigurationException;
import com.paircraft.engine.model.GameResult;
import com.paircraft.engine.model.Pairing;
import com.paircraft.engine.model.Player;
import com.paircraft.engine.model.PlayerStatus;
import com.paircraft.engine.model.TournamentState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.paircraft.engine.TestTournaments.players;
import static com.paircraft.engine.TestTournaments.state;
import static com.paircraft.engine.pairing.PairingTestSupport.games;
import static com.paircraft.engine.pairing.PairingTestSupport.generate;
import static org.junit.jupiter.api.Assertions.*;

class RoundRobinPairingGeneratorTest {

    private final RoundRobinPairingGenerator generator = new RoundRobinPairingGenerator();
    private final PairingConfig config = PairingConfig.builder().method(PairingMethod.ROUND_ROBIN).rounds(3).build();

    @Test
    void generate_followsScheduleBySeed() {
        TournamentState state = state(2000, 1900, 1800, 1700);

        SectionPairing round1 = generate(generator, state, 1, config);
        SectionPairing round2 = generate(generator, state, 2, config);

        assertEquals(Set.of(Set.of("p1", "p4"), Set.of("p2", "p3")), games(round1.pairings()));
        assertEquals(Set.of(Set.of("p4", "p3"), Set.of("p1", "p2")), games(round2.pairings()));
        assertEquals(PairingStatus.COMPLETE, round1.status());
        assertFalse(round1.acceleration().isApplied());
    }

    @Test
    void generate_roundBeyondScheduleIsRejected() {
        TournamentState state = state(2000, 1900, 1800, 1700);

        assertThrows(InvalidConfigurationException.class, () -> generate(generator, state, 4, config));
    }

    @Test
    void generate_withdrawnPlayerForfeitsScheduledGame() {
        List<Player> players = new ArrayList<>(players(2000, 1900, 1800, 1700));
        players.set(3, players.get(3).withStatus(PlayerStatus.WITHDRAWN));
        TournamentState state = new TournamentState("t1", players);

        List<Pairing> pairings = generate(generator, state, 1, config).pairings();

        Pairing againstWithdrawn = pairings.stream().filter(p -> p.involves("p4")).findFirst().orElseThrow();
        assertEquals("p1", againstWithdrawn.whiteId());
        assertEquals(GameResult.WHITE_FORFEIT_WIN, againstWithdrawn.result());
        Pairing other = pairings.stream().filter(p -> p.involves("p2")).findFirst().orElseThrow();
        assertEquals(GameResult.PENDING, other.result());
    }

    @Test
    void generate_oddFieldPutsByeLast() {
        TournamentState state = state(2000, 1900, 1800);

        List<Pairing> pairings = generate(generator, state, 1, config).pairings();

        assertEquals(2, pairings.size());
        assertFalse(pairings.get(0).isBye());
        assertTrue(pairings.get(1).isBye());
        assertEquals(2, pairings.get(1).board());
    }
}
