package com.paircraft.engine.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.paircraft.engine.model.TournamentState;

import java.util.List;

/**
 * Result of a correction.
 *
 * @param affectedRounds    the corrected round and every later round whose derived scores changed
 * @param regeneratedRounds later rounds that were discarded and paired again
 */
public record RecomputedState(
    @JsonProperty("state") TournamentState state,
    @JsonProperty("affectedRounds") List<Integer> affectedRounds,
    @JsonProperty("regeneratedRounds") List<Integer> regeneratedRounds
) {
    public RecomputedState {
        affectedRounds = ImmutableList.copyOf(affectedRounds);
        regeneratedRounds = ImmutableList.copyOf(regeneratedRounds);
    }
}
