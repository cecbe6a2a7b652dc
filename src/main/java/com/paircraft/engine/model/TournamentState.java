package com.paircraft.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * Fully materialized snapshot of a tournament: registry, teams and the ordered rounds.
 * Every operation takes a snapshot and returns a new one; nothing is mutated in place.
 */
public record TournamentState(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("players") List<Player> players,
    @JsonProperty("teams") List<Team> teams,
    @JsonProperty("rounds") List<Round> rounds,
    @JsonProperty("scoring") ScoringRules scoring
) {

    public TournamentState {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Tournament id is required");
        }
        name = name == null ? id : name;
        players = players == null ? ImmutableList.of() : ImmutableList.copyOf(players);
        teams = teams == null ? ImmutableList.of() : ImmutableList.copyOf(teams);
        rounds = rounds == null ? ImmutableList.of() : ImmutableList.copyOf(rounds);
        scoring = scoring == null ? ScoringRules.defaults() : scoring;
    }

    public TournamentState(String id, List<Player> players) {
        this(id, id, players, null, null, null);
    }

    public static TournamentState ofTeams(String id, List<Player> players, List<Team> teams) {
        return new TournamentState(id, id, players, teams, null, null);
    }

    public Optional<Round> round(int number) {
        return number >= 1 && number <= rounds.size()
            ? Optional.of(rounds.get(number - 1))
            : Optional.empty();
    }

    public TournamentState withRound(Round round) {
        return new TournamentState(id, name, players,
            teams, ImmutableList.<Round>builder().addAll(rounds).add(round).build(), scoring);
    }

    public TournamentState withRoundReplaced(Round round) {
        ImmutableList.Builder<Round> updated = ImmutableList.builder();
        for (Round existing : rounds) {
            updated.add(existing.number() == round.number() ? round : existing);
        }
        return new TournamentState(id, name, players, teams, updated.build(), scoring);
    }

    /**
     * Keeps rounds 1..lastRound and drops the rest.
     */
    public TournamentState truncatedAfter(int lastRound) {
        return new TournamentState(id, name, players, teams,
            rounds.subList(0, Math.min(lastRound, rounds.size())), scoring);
    }

    public TournamentState withPlayers(List<Player> newPlayers) {
        return new TournamentState(id, name, newPlayers, teams, rounds, scoring);
    }

    public TournamentState withScoring(ScoringRules newScoring) {
        return new TournamentState(id, name, players, teams, rounds, newScoring);
    }
}
