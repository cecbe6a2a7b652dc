package com.paircraft.engine.acceleration;

import com.paircraft.engine.config.AccelerationType;
import com.paircraft.engine.config.PairingConfig;
import com.paircraft.engine.model.Player;
import com.paircraft.engine.model.Points;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides whether a section is accelerated this round and how many virtual half-points each
 * player carries into score-group sorting.
 *
 * <p>Key rules:
 * <ul>
 *   <li>Only sections strictly larger than 2^(rounds+1) accelerate, unless a threshold is configured.</li>
 *   <li>The top group is half the field rounded up to an even count, unless a break point is configured.</li>
 *   <li>Every decision, including "not applied", is returned so it can be reported.</li>
 * </ul>
 */
public final class AccelerationModule {

    private static final Logger log = LoggerFactory.getLogger(AccelerationModule.class);

    /** Virtual points for one accelerated top group. */
    private static final int STANDARD_VIRTUAL_HALVES = 2;

    private static final int SIXTHS_BANDS = 6;

    private AccelerationModule() {
        // Utility class
    }

    /**
     * @param rankedPlayers the players being paired this round, in initial rank order
     */
    public static AccelerationPlan plan(String section, List<Player> rankedPlayers, int round, PairingConfig config) {
        int size = rankedPlayers.size();
        if (!config.isAccelerated()) {
            return AccelerationPlan.disabled(section, round, size);
        }
        AccelerationType type = config.accelerationType();
        if (type != AccelerationType.ALL_ROUNDS && round > config.accelerationRounds()) {
            log.info("Section {} round {}: past the {}-round acceleration window", section, round,
                config.accelerationRounds());
            return AccelerationPlan.outsideWindow(section, round, type, size);
        }
        int threshold = threshold(config);
        if (size < threshold) {
            log.info("Section {} round {}: {} players is below the acceleration threshold of {}, not accelerated",
                section, round, size, threshold);
            return AccelerationPlan.belowThreshold(section, round, type, size, threshold);
        }

        int breakPoint = breakPoint(size, config);
        Map<String, Integer> virtual = new LinkedHashMap<>();
        Map<String, Integer> added = new LinkedHashMap<>();
        switch (type) {
            case STANDARD, ALL_ROUNDS -> {
                for (int i = 0; i < breakPoint; i++) {
                    virtual.put(rankedPlayers.get(i).id(), STANDARD_VIRTUAL_HALVES);
                }
            }
            case SIXTHS -> {
                int bandSize = (size + SIXTHS_BANDS - 1) / SIXTHS_BANDS;
                for (int i = 0; i < size; i++) {
                    int band = i / bandSize;
                    int halves = SIXTHS_BANDS - 1 - band;
                    if (halves > 0) {
                        virtual.put(rankedPlayers.get(i).id(), halves);
                    }
                }
            }
            case ADDED_SCORE -> {
                int halves = Points.toHalves(config.addedScore());
                for (int i = 0; i < breakPoint; i++) {
                    String id = rankedPlayers.get(i).id();
                    virtual.put(id, halves);
                    added.put(id, halves);
                }
            }
        }
        log.info("Section {} round {}: {} acceleration applied to {} players (break point {}, threshold {})",
            section, round, type.key(), virtual.size(), breakPoint, threshold);
        return AccelerationPlan.applied(section, round, type, size, threshold, breakPoint, virtual, added);
    }

    static int threshold(PairingConfig config) {
        if (config.accelerationThreshold() != null) {
            return config.accelerationThreshold();
        }
        if (config.rounds() >= 29) {
            return Integer.MAX_VALUE;
        }
        return (1 << (config.rounds() + 1)) + 1;
    }

    static int breakPoint(int size, PairingConfig config) {
        int breakPoint;
        if (config.accelerationBreakPoint() != null) {
            breakPoint = config.accelerationBreakPoint();
        } else {
            breakPoint = (size + 1) / 2;
        }
        if (breakPoint % 2 != 0) {
            breakPoint++;
        }
        return Math.min(breakPoint, size);
    }
}
