package com.paircraft.engine.history;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Replayed histories for every registered player after {@code roundsPlayed} rounds.
 */
public record TournamentHistory(PlayerRegistry registry, Map<String, PlayerHistory> players, int roundsPlayed) {

    public TournamentHistory {
        players = ImmutableMap.copyOf(players);
    }

    public PlayerHistory of(String playerId) {
        PlayerHistory history = players.get(playerId);
        return history != null ? history : PlayerHistory.empty(playerId);
    }
}
