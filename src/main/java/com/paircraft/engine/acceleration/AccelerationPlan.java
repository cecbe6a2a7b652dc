package com.paircraft.engine.acceleration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import com.paircraft.engine.config.AccelerationType;

import java.util.Map;

/**
 * Provenance of the acceleration step for one section and round. Virtual points only affect
 * score-group sorting; added scores are also recorded on the round.
 */
public record AccelerationPlan(
    @JsonProperty("section") String section,
    @JsonProperty("round") int round,
    @JsonProperty("status") AccelerationStatus status,
    @JsonProperty("type") AccelerationType type,
    @JsonProperty("sectionSize") int sectionSize,
    @JsonProperty("threshold") int threshold,
    @JsonProperty("breakPoint") int breakPoint,
    @JsonProperty("virtualHalves") Map<String, Integer> virtualHalves,
    @JsonProperty("addedScoreHalves") Map<String, Integer> addedScoreHalves
) {

    public AccelerationPlan {
        virtualHalves = virtualHalves == null ? ImmutableMap.of() : ImmutableMap.copyOf(virtualHalves);
        addedScoreHalves = addedScoreHalves == null ? ImmutableMap.of() : ImmutableMap.copyOf(addedScoreHalves);
    }

    /**
     * Creates a plan for a tournament that is not accelerated.
     */
    public static AccelerationPlan disabled(String section, int round, int sectionSize) {
        return new AccelerationPlan(section, round, AccelerationStatus.DISABLED, null, sectionSize, 0, 0, null, null);
    }

    /**
     * Creates a plan for a round after the acceleration window.
     */
    public static AccelerationPlan outsideWindow(String section, int round, AccelerationType type, int sectionSize) {
        return new AccelerationPlan(section, round, AccelerationStatus.OUTSIDE_WINDOW, type, sectionSize, 0, 0, null, null);
    }

    /**
     * Creates a plan for a section that did not reach the size threshold.
     */
    public static AccelerationPlan belowThreshold(String section, int round, AccelerationType type,
                                                  int sectionSize, int threshold) {
        return new AccelerationPlan(section, round, AccelerationStatus.BELOW_THRESHOLD, type, sectionSize,
            threshold, 0, null, null);
    }

    /**
     * Creates a plan that changed pairing scores.
     */
    public static AccelerationPlan applied(String section, int round, AccelerationType type, int sectionSize,
                                           int threshold, int breakPoint, Map<String, Integer> virtualHalves,
                                           Map<String, Integer> addedScoreHalves) {
        return new AccelerationPlan(section, round, AccelerationStatus.APPLIED, type, sectionSize, threshold,
            breakPoint, virtualHalves, addedScoreHalves);
    }

    @JsonIgnore
    public boolean isApplied() {
        return status == AccelerationStatus.APPLIED;
    }

    public int virtualHalvesFor(String playerId) {
        return virtualHalves.getOrDefault(playerId, 0);
    }
}
