package com.paircraft.engine.config;

import com.paircraft.engine.error.InvalidConfigurationException;
import com.paircraft.engine.model.Points;

import java.util.ArrayList;
import java.util.List;

/**
 * Cross-field checks on a {@link PairingConfig}. All problems are collected and reported together.
 */
public final class PairingConfigValidator {

    /** A quad is a four-player round robin and always takes three rounds. */
    public static final int QUAD_ROUNDS = 3;

    private PairingConfigValidator() {
        // Utility class
    }

    /**
     * @throws InvalidConfigurationException listing every violated rule
     */
    public static void validate(PairingConfig config) {
        List<String> problems = new ArrayList<>();
        if (config.method() == null) {
            problems.add("pairing method is required");
        }
        if (config.pairingType() == null) {
            problems.add("pairing type is required");
        }
        if (config.accelerationType() == null) {
            problems.add("acceleration type is required");
        }
        if (config.teamScoring() == null) {
            problems.add("team scoring is required");
        }
        if (config.tiebreaks() == null) {
            problems.add("tiebreak configuration is required");
        }
        if (config.rounds() < 1) {
            problems.add("rounds must be at least 1, got " + config.rounds());
        }
        if (config.accelerationRounds() < 1) {
            problems.add("acceleration rounds must be at least 1, got " + config.accelerationRounds());
        }
        if (config.accelerationThreshold() != null && config.accelerationThreshold() < 2) {
            problems.add("acceleration threshold must be at least 2, got " + config.accelerationThreshold());
        }
        if (config.accelerationBreakPoint() != null && config.accelerationBreakPoint() < 2) {
            problems.add("acceleration break point must be at least 2, got " + config.accelerationBreakPoint());
        }
        if (config.addedScore() < 0) {
            problems.add("added score must not be negative, got " + config.addedScore());
        } else {
            try {
                Points.toHalves(config.addedScore());
            } catch (InvalidConfigurationException e) {
                problems.add("added score: " + e.getMessage());
            }
        }
        if (config.equalizationLimit() < 1) {
            problems.add("equalization limit must be at least 1, got " + config.equalizationLimit());
        }
        if (config.alternationLimit() < 1) {
            problems.add("alternation limit must be at least 1, got " + config.alternationLimit());
        }
        if (config.teamBoardCount() < 1) {
            problems.add("team board count must be at least 1, got " + config.teamBoardCount());
        }
        if (config.method() == PairingMethod.QUAD && config.rounds() != QUAD_ROUNDS) {
            problems.add("quad format requires exactly " + QUAD_ROUNDS + " rounds, got " + config.rounds());
        }
        if (config.method() != null && !config.method().isSwiss() && config.isAccelerated()) {
            problems.add("acceleration only applies to swiss pairing, not " + config.method().key());
        }
        if (config.doubleRoundRobin() && config.method() != PairingMethod.ROUND_ROBIN) {
            problems.add("double round robin requires the round_robin method");
        }
        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException("Invalid pairing configuration: " + String.join("; ", problems));
        }
    }
}
