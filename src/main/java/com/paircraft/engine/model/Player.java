package com.paircraft.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registered player. Running score and color history are derived by replaying rounds,
 * so the registration record only carries what the director enters.
 *
 * @param rating         current rating, {@code null} when unrated
 * @param requestedByes  byes the player asked for ahead of time, keyed by round number
 */
public record Player(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("rating") Integer rating,
    @JsonProperty("provisional") boolean provisional,
    @JsonProperty("section") String section,
    @JsonProperty("teamId") String teamId,
    @JsonProperty("status") PlayerStatus status,
    @JsonProperty("requestedByes") Map<Integer, ByeType> requestedByes
) {

    public static final String DEFAULT_SECTION = "Open";

    public Player {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Player id is required");
        }
        name = name == null ? id : name;
        section = section == null || section.isBlank() ? DEFAULT_SECTION : section;
        status = status == null ? PlayerStatus.ACTIVE : status;
        requestedByes = requestedByes == null ? ImmutableMap.of() : ImmutableMap.copyOf(requestedByes);
    }

    public Player(String id, String name, Integer rating) {
        this(id, name, rating, false, DEFAULT_SECTION, null, PlayerStatus.ACTIVE, null);
    }

    public Player(String id, String name, Integer rating, String section) {
        this(id, name, rating, false, section, null, PlayerStatus.ACTIVE, null);
    }

    /**
     * Rating used for ordering; unrated players sort as zero.
     */
    @JsonIgnore
    public int ratingOrZero() {
        return rating == null ? 0 : rating;
    }

    @JsonIgnore
    public boolean isActive() {
        return status == PlayerStatus.ACTIVE;
    }

    public Optional<ByeType> requestedByeFor(int round) {
        return Optional.ofNullable(requestedByes.get(round));
    }

    public Player withStatus(PlayerStatus newStatus) {
        return new Player(id, name, rating, provisional, section, teamId, newStatus, requestedByes);
    }

    public Player withTeam(String newTeamId) {
        return new Player(id, name, rating, provisional, section, newTeamId, status, requestedByes);
    }

    public Player withRequestedBye(int round, ByeType byeType) {
        if (byeType == ByeType.PAIRING_ALLOCATED) {
            throw new IllegalArgumentException("Pairing-allocated byes cannot be requested");
        }
        Map<Integer, ByeType> byes = new HashMap<>(requestedByes);
        byes.put(round, byeType);
        return new Player(id, name, rating, provisional, section, teamId, status, byes);
    }
}
