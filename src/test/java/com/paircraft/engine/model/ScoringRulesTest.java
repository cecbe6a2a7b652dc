package com.paircraft.engine.model;

import com.paircraft.engine.error.InvalidConfigurationException;
import com.paircraft.engine.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoringRulesTest {

    @Test
    void defaults_awardUsualPoints() {
        ScoringRules rules = ScoringRules.defaults();

        assertEquals(2, rules.halvesFor(GameResult.WHITE_WIN, Color.WHITE));
        assertEquals(0, rules.halvesFor(GameResult.WHITE_WIN, Color.BLACK));
        assertEquals(1, rules.halvesFor(GameResult.DRAW, Color.BLACK));
        assertEquals(2, rules.halvesFor(GameResult.BLACK_FORFEIT_WIN, Color.BLACK));
        assertEquals(0, rules.halvesFor(GameResult.DOUBLE_FORFEIT, Color.WHITE));
        assertEquals(2, rules.halvesForBye(ByeType.PAIRING_ALLOCATED));
        assertEquals(1, rules.halvesForBye(ByeType.HALF_POINT));
        assertEquals(0, rules.halvesForBye(ByeType.ZERO_POINT));
    }

    @Test
    void pairingAllocatedBye_isConfigurable() {
        ScoringRules rules = ScoringRules.defaults().withPairingAllocatedBye(0.5);
        assertEquals(1, rules.halvesForBye(ByeType.PAIRING_ALLOCATED));
    }

    @Test
    void rejectsValuesThatAreNotHalfPoints() {
        assertThrows(InvalidConfigurationException.class,
            () -> new ScoringRules(1.0, 0.4, 0.0, 1.0, 0.0, 1.0, 1.0, 0.5, 0.0));
        assertThrows(InvalidConfigurationException.class,
            () -> new ScoringRules(1.0, 0.5, -1.0, 1.0, 0.0, 1.0, 1.0, 0.5, 0.0));
    }

    @Test
    void pendingResult_hasNoPoints() {
        assertThrows(IllegalArgumentException.class,
            () -> ScoringRules.defaults().halvesFor(GameResult.PENDING, Color.WHITE));
    }

    @Test
    void gameResult_parsesScoresheetNotation() {
        assertEquals(GameResult.WHITE_WIN, GameResult.fromNotation("1-0"));
        assertEquals(GameResult.DRAW, GameResult.fromNotation("1/2-1/2"));
        assertEquals(GameResult.DRAW, GameResult.fromNotation("0.5-0.5"));
        assertEquals(GameResult.BLACK_FORFEIT_WIN, GameResult.fromNotation("0-1F"));
        assertEquals(GameResult.DOUBLE_FORFEIT, GameResult.fromNotation("double_forfeit"));
        assertThrows(ValidationException.class, () -> GameResult.fromNotation("2-0"));
    }

    @Test
    void points_formatHalves() {
        assertEquals("3", Points.format(6));
        assertEquals("2.5", Points.format(5));
        assertEquals(5, Points.toHalves(2.5));
    }
}
