package com.paircraft.engine.pairing;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * An accepted rule deviation in a generated round, for the director to review.
 */
public record Deviation(
    @JsonProperty("kind") DeviationKind kind,
    @JsonProperty("section") String section,
    @JsonProperty("round") int round,
    @JsonProperty("playerIds") List<String> playerIds,
    @JsonProperty("message") String message
) {
    public Deviation {
        playerIds = playerIds == null ? ImmutableList.of() : ImmutableList.copyOf(playerIds);
    }
}
