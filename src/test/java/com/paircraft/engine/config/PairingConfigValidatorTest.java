package com.paircraft.engine.config;

import com.paircraft.engine.error.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PairingConfigValidatorTest {

    @Test
    void defaults_areValid() {
        PairingConfig config = PairingConfig.defaults(5);

        assertEquals(PairingMethod.FIDE_DUTCH, config.method());
        assertEquals(2, config.equalizationLimit());
        assertTrue(config.bestEffortFallback());
        assertFalse(config.isAccelerated());
    }

    @Test
    void quad_requiresThreeRounds() {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> PairingConfig.builder().method(PairingMethod.QUAD).rounds(4).build());

        assertTrue(e.getMessage().contains("quad format requires exactly 3 rounds"));
    }

    @Test
    void acceleration_onlyForSwissMethods() {
        assertThrows(InvalidConfigurationException.class, () -> PairingConfig.builder()
            .method(PairingMethod.ROUND_ROBIN)
            .pairingType(PairingType.ACCELERATED)
            .build());
        assertDoesNotThrow(() -> PairingConfig.builder()
            .method(PairingMethod.TEAM_SWISS)
            .pairingType(PairingType.ACCELERATED)
            .build());
    }

    @Test
    void doubleRoundRobin_requiresRoundRobin() {
        assertThrows(InvalidConfigurationException.class,
            () -> PairingConfig.builder().doubleRoundRobin(true).build());
    }

    @Test
    void addedScore_mustBeHalfPointMultiple() {
        assertThrows(InvalidConfigurationException.class, () -> PairingConfig.builder().addedScore(0.3).build());
        assertThrows(InvalidConfigurationException.class, () -> PairingConfig.builder().addedScore(-1).build());
    }

    @Test
    void validate_reportsEveryProblemTogether() {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> PairingConfig.builder().rounds(0).equalizationLimit(0).accelerationThreshold(1).build());

        assertTrue(e.getMessage().contains("rounds must be at least 1"));
        assertTrue(e.getMessage().contains("equalization limit must be at least 1"));
        assertTrue(e.getMessage().contains("acceleration threshold must be at least 2"));
    }

    @Test
    void pairingMethod_acceptsKeysNamesAndAlias() {
        assertEquals(PairingMethod.FIDE_DUTCH, PairingMethod.fromKey("us_chess"));
        assertEquals(PairingMethod.SINGLE_ELIMINATION, PairingMethod.fromKey("single_elimination"));
        assertEquals(PairingMethod.TEAM_SWISS, PairingMethod.fromKey("TEAM_SWISS"));
        assertThrows(InvalidConfigurationException.class, () -> PairingMethod.fromKey("monrad"));
    }
}
