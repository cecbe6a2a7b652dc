package com.paircraft.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paircraft.engine.config.dto.PairingConfigRequest;
import com.paircraft.engine.config.dto.TiebreakConfigRequest;
import com.paircraft.engine.error.InvalidConfigurationException;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigRequestValidatorTest {

    private final ObjectMapper mapper = ObjectMapperFactory.create();
    private ValidatorFactory factory;
    private ConfigRequestValidator validator;

    @BeforeEach
    void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = new ConfigRequestValidator(factory.getValidator());
    }

    @AfterEach
    void tearDown() {
        factory.close();
    }

    @Test
    void toPairingConfig_readsSettingsFile() throws Exception {
        PairingConfigRequest request = mapper.readValue("""
            {
              "pairingMethod": "fide_dutch",
              "pairingType": "accelerated",
              "accelerationType": "sixths",
              "rounds": 7,
              "tiebreaks": {
                "criteria": ["buchholz", "sonnebornBerger"],
                "buchholzCut": 2,
                "unplayedRoundPolicy": "zero"
              }
            }
            """, PairingConfigRequest.class);

        PairingConfig config = validator.toPairingConfig(request);

        assertEquals(7, config.rounds());
        assertTrue(config.isAccelerated());
        assertEquals(AccelerationType.SIXTHS, config.accelerationType());
        assertEquals(List.of(TiebreakCriterion.BUCHHOLZ, TiebreakCriterion.SONNEBORN_BERGER),
            config.tiebreaks().criteria());
        assertEquals(2, config.tiebreaks().buchholzCut());
        assertEquals(UnplayedRoundPolicy.ZERO, config.tiebreaks().unplayedRoundPolicy());
    }

    @Test
    void toPairingConfig_missingRoundsIsRejected() throws Exception {
        PairingConfigRequest request = mapper.readValue("{\"pairingMethod\": \"quad\"}", PairingConfigRequest.class);

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> validator.toPairingConfig(request));

        assertTrue(e.getMessage().contains("rounds"));
    }

    @Test
    void toPairingConfig_constraintViolationsAreReported() throws Exception {
        PairingConfigRequest request = mapper.readValue(
            "{\"rounds\": 5, \"equalizationLimit\": 0, \"tiebreaks\": {\"criteria\": []}}",
            PairingConfigRequest.class);

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> validator.toPairingConfig(request));

        assertTrue(e.getMessage().contains("equalizationLimit"));
        assertTrue(e.getMessage().contains("tiebreaks.criteria"));
    }

    @Test
    void toPairingConfig_unknownMethodIsRejected() throws Exception {
        PairingConfigRequest request = mapper.readValue("{\"rounds\": 5, \"pairingMethod\": \"monrad\"}",
            PairingConfigRequest.class);

        assertThrows(InvalidConfigurationException.class, () -> validator.toPairingConfig(request));
    }

    @Test
    void toTiebreakConfig_convertsTeamTiebreaks() {
        TiebreakConfigRequest request = new TiebreakConfigRequest(List.of("koya"), null, null, true,
            List.of("game_points", "match_points"));

        TiebreakConfig config = validator.toTiebreakConfig(request);

        assertTrue(config.includeAddedScores());
        assertEquals(List.of(TeamTiebreak.GAME_POINTS, TeamTiebreak.MATCH_POINTS), config.teamTiebreaks());
    }

    @Test
    void missingConfigurationIsRejected() {
        assertThrows(InvalidConfigurationException.class, () -> validator.toPairingConfig(null));
    }
}
