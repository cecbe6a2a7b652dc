package com.paircraft.engine.team;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A team pairing. {@code teamAId} holds white on board 1; {@code teamBId} is {@code null} for a team bye.
 */
public record TeamMatch(
    @JsonProperty("id") String id,
    @JsonProperty("round") int round,
    @JsonProperty("section") String section,
    @JsonProperty("teamAId") String teamAId,
    @JsonProperty("teamBId") String teamBId,
    @JsonProperty("pairingIds") List<String> pairingIds
) {
    public TeamMatch {
        pairingIds = pairingIds == null ? ImmutableList.of() : ImmutableList.copyOf(pairingIds);
    }

    public static String matchId(String section, int round, int number) {
        return section + "-R" + round + "-M" + number;
    }
}
