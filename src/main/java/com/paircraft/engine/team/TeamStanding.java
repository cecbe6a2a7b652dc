package com.paircraft.engine.team;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

public record TeamStanding(
    @JsonProperty("rank") int rank,
    @JsonProperty("sharedRank") boolean sharedRank,
    @JsonProperty("teamId") String teamId,
    @JsonProperty("name") String name,
    @JsonProperty("section") String section,
    @JsonProperty("matchPoints") int matchPoints,
    @JsonProperty("gamePoints") double gamePoints,
    @JsonProperty("wins") int wins,
    @JsonProperty("draws") int draws,
    @JsonProperty("losses") int losses,
    @JsonProperty("tiebreaks") Map<String, Double> tiebreaks
) {
    public TeamStanding {
        tiebreaks = tiebreaks == null ? ImmutableMap.of() : ImmutableMap.copyOf(tiebreaks);
    }
}
