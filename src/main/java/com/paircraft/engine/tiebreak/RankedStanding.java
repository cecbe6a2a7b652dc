package com.paircraft.engine.tiebreak;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.paircraft.engine.model.PlayerStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One line of a section's standings.
 *
 * @param rank       competition rank; tied players share the rank of the first of them
 * @param sharedRank whether another player holds the same rank
 * @param tiebreaks  value per criterion key in configured order; direct encounter is
 *                   {@code null} when it did not apply to the player's tie
 */
public record RankedStanding(
    @JsonProperty("rank") int rank,
    @JsonProperty("sharedRank") boolean sharedRank,
    @JsonProperty("playerId") String playerId,
    @JsonProperty("name") String name,
    @JsonProperty("rating") Integer rating,
    @JsonProperty("section") String section,
    @JsonProperty("status") PlayerStatus status,
    @JsonProperty("score") double score,
    @JsonProperty("gamesPlayed") int gamesPlayed,
    @JsonProperty("wins") int wins,
    @JsonProperty("draws") int draws,
    @JsonProperty("losses") int losses,
    @JsonProperty("byes") int byes,
    @JsonProperty("tiebreaks") Map<String, Double> tiebreaks
) {
    public RankedStanding {
        tiebreaks = tiebreaks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tiebreaks));
    }

    public Double tiebreak(String key) {
        return tiebreaks.get(key);
    }
}
