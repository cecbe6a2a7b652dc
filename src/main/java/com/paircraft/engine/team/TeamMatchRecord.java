package com.paircraft.engine.team;

import com.paircraft.engine.model.Color;

/**
 * One finished team match from one team's point of view.
 *
 * @param opponentTeamId   {@code null} for a team bye
 * @param boardOneColor    color on board 1, {@code null} for a team bye
 * @param matchPoints      2 for a won match, 1 for a drawn one, 0 for a loss
 */
public record TeamMatchRecord(
    int round,
    String teamId,
    String opponentTeamId,
    Color boardOneColor,
    int gamePointsHalves,
    int opponentGamePointsHalves,
    int matchPoints
) {
    public boolean isBye() {
        return opponentTeamId == null;
    }
}
