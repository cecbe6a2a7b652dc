package com.paircraft.engine.history;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.paircraft.engine.error.DataIntegrityException;
import com.paircraft.engine.model.Player;
import com.paircraft.engine.model.Team;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Normalized, read-only view of the registered players and teams.
 */
public final class PlayerRegistry {

    /** Initial rank order: rating descending, unrated last, then id. */
    public static final Comparator<Player> RANK_ORDER = Comparator
        .comparingInt(Player::ratingOrZero).reversed()
        .thenComparing(Player::id);

    private final Map<String, Player> players;
    private final Map<String, Team> teams;

    private PlayerRegistry(Map<String, Player> players, Map<String, Team> teams) {
        this.players = players;
        this.teams = teams;
    }

    /**
     * @throws DataIntegrityException for duplicate ids or a team member that is not registered
     */
    public static PlayerRegistry of(List<Player> players, List<Team> teams) {
        Map<String, Player> byId = new LinkedHashMap<>();
        for (Player player : players) {
            if (byId.put(player.id(), player) != null) {
                throw new DataIntegrityException("Duplicate player id " + player.id());
            }
        }
        Map<String, Team> teamsById = new LinkedHashMap<>();
        for (Team team : teams) {
            if (teamsById.put(team.id(), team) != null) {
                throw new DataIntegrityException("Duplicate team id " + team.id());
            }
            for (String memberId : team.memberIds()) {
                if (!byId.containsKey(memberId)) {
                    throw new DataIntegrityException("Team " + team.id() + " lists unknown player " + memberId);
                }
            }
        }
        return new PlayerRegistry(ImmutableMap.copyOf(byId), ImmutableMap.copyOf(teamsById));
    }

    public boolean contains(String playerId) {
        return players.containsKey(playerId);
    }

    /**
     * @throws DataIntegrityException if the player is not registered
     */
    public Player get(String playerId) {
        Player player = players.get(playerId);
        if (player == null) {
            throw new DataIntegrityException("Unknown player " + playerId);
        }
        return player;
    }

    public List<Player> all() {
        return ImmutableList.copyOf(players.values());
    }

    /**
     * Players of a section in initial rank order.
     */
    public List<Player> section(String section) {
        return players.values().stream()
            .filter(p -> p.section().equals(section))
            .sorted(RANK_ORDER)
            .collect(ImmutableList.toImmutableList());
    }

    public List<String> sections() {
        return ImmutableList.copyOf(new TreeSet<>(players.values().stream().map(Player::section).toList()));
    }

    public List<Team> teams() {
        return ImmutableList.copyOf(teams.values());
    }

    public List<Team> teamsInSection(String section) {
        return teams.values().stream()
            .filter(t -> t.section().equals(section))
            .collect(ImmutableList.toImmutableList());
    }

    /**
     * The team a player plays for: its declared team id, or the team listing it as a member.
     */
    public Optional<Team> teamOf(String playerId) {
        Player player = players.get(playerId);
        if (player != null && player.teamId() != null && teams.containsKey(player.teamId())) {
            return Optional.of(teams.get(player.teamId()));
        }
        return teams.values().stream().filter(t -> t.memberIds().contains(playerId)).findFirst();
    }
}
