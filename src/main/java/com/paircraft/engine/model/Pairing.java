package com.paircraft.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One board of a round. A bye keeps the player in the white slot and leaves black empty.
 *
 * @param group optional label of the quad, bracket or team match the board belongs to
 */
public record Pairing(
    @JsonProperty("id") String id,
    @JsonProperty("round") int round,
    @JsonProperty("section") String section,
    @JsonProperty("board") int board,
    @JsonProperty("whiteId") String whiteId,
    @JsonProperty("blackId") String blackId,
    @JsonProperty("result") GameResult result,
    @JsonProperty("byeType") ByeType byeType,
    @JsonProperty("group") String group
) {

    public Pairing {
        result = result == null ? GameResult.PENDING : result;
    }

    public static String pairingId(String section, int round, int board) {
        return section + "-R" + round + "-B" + board;
    }

    public static Pairing game(int round, String section, int board, String whiteId, String blackId) {
        return game(round, section, board, whiteId, blackId, null);
    }

    public static Pairing game(int round, String section, int board, String whiteId, String blackId, String group) {
        return new Pairing(pairingId(section, round, board), round, section, board,
            whiteId, blackId, GameResult.PENDING, null, group);
    }

    public static Pairing bye(int round, String section, int board, String playerId, ByeType byeType) {
        return bye(round, section, board, playerId, byeType, null);
    }

    public static Pairing bye(int round, String section, int board, String playerId, ByeType byeType, String group) {
        return new Pairing(pairingId(section, round, board), round, section, board,
            playerId, null, GameResult.BYE, byeType, group);
    }

    @JsonIgnore
    public boolean isBye() {
        return (whiteId == null) != (blackId == null);
    }

    @JsonIgnore
    public boolean isPending() {
        return result == GameResult.PENDING;
    }

    /**
     * The player sitting out, for bye pairings.
     */
    public String byePlayerId() {
        return whiteId != null ? whiteId : blackId;
    }

    public boolean involves(String playerId) {
        return playerId.equals(whiteId) || playerId.equals(blackId);
    }

    public Pairing withResult(GameResult newResult) {
        return new Pairing(id, round, section, board, whiteId, blackId, newResult, byeType, group);
    }
}
