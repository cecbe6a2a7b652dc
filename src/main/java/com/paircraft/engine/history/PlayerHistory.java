package com.paircraft.engine.history;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.paircraft.engine.model.ByeType;
import com.paircraft.engine.model.Color;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Replayed history of a single player. Rounds the player missed have no entry.
 */
public record PlayerHistory(String playerId, List<RoundEntry> entries) {

    public PlayerHistory {
        entries = ImmutableList.copyOf(entries);
    }

    public static PlayerHistory empty(String playerId) {
        return new PlayerHistory(playerId, ImmutableList.of());
    }

    public int scoreHalves() {
        return entries.stream().mapToInt(RoundEntry::pointsHalves).sum();
    }

    public double score() {
        return scoreHalves() / 2.0;
    }

    /**
     * Score after the given round, counting only entries up to and including it.
     */
    public int scoreHalvesAfter(int round) {
        return entries.stream().filter(e -> e.round() <= round).mapToInt(RoundEntry::pointsHalves).sum();
    }

    public Optional<RoundEntry> entry(int round) {
        return entries.stream().filter(e -> e.round() == round).findFirst();
    }

    /**
     * Opponents of games actually played. Forfeited pairings do not count as a meeting.
     */
    public Set<String> playedOpponents() {
        return entries.stream()
            .filter(RoundEntry::isPlayedGame)
            .map(RoundEntry::opponentId)
            .collect(ImmutableSet.toImmutableSet());
    }

    /**
     * Opponent per entry in round order, {@code null} standing in for a bye.
     */
    public List<String> opponentSequence() {
        return entries.stream().map(RoundEntry::opponentId).toList();
    }

    public ColorProfile colorProfile() {
        List<Color> colors = entries.stream()
            .filter(RoundEntry::isPlayedGame)
            .map(RoundEntry::color)
            .toList();
        return new ColorProfile(colors);
    }

    public long byeCount(ByeType byeType) {
        return entries.stream().filter(e -> e.isBye() && e.byeType() == byeType).count();
    }

    public long byeCount() {
        return entries.stream().filter(RoundEntry::isBye).count();
    }

    public long count(RoundEntry.Outcome outcome) {
        return entries.stream().filter(e -> e.outcome() == outcome).count();
    }

    public long gamesPlayed() {
        return entries.stream().filter(RoundEntry::isPlayedGame).count();
    }

    /**
     * True once the player scored a win without playing, which rules out a further
     * pairing-allocated bye.
     */
    public boolean hasUnplayedWin(int winHalves) {
        return entries.stream().anyMatch(e -> e.isUnplayedWin(winHalves));
    }
}
