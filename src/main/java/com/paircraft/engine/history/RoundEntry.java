package com.paircraft.engine.history;

import com.paircraft.engine.model.ByeType;
import com.paircraft.engine.model.Color;

/**
 * What one round meant for one player.
 *
 * @param opponentId opponent id, {@code null} for a bye
 * @param color      color held, {@code null} for a bye
 * @param byeType    bye kind, {@code null} for a game
 */
public record RoundEntry(
    int round,
    String opponentId,
    Color color,
    Outcome outcome,
    int pointsHalves,
    ByeType byeType
) {

    public enum Outcome {
        WIN,
        DRAW,
        LOSS,
        FORFEIT_WIN,
        FORFEIT_LOSS,
        BYE
    }

    public boolean isBye() {
        return outcome == Outcome.BYE;
    }

    public boolean hasOpponent() {
        return opponentId != null;
    }

    /**
     * True for a game contested over the board. Forfeits and byes are not played games.
     */
    public boolean isPlayedGame() {
        return outcome == Outcome.WIN || outcome == Outcome.DRAW || outcome == Outcome.LOSS;
    }

    /**
     * Full point (or more) collected without playing: a forfeit win or a bye worth a win.
     */
    public boolean isUnplayedWin(int winHalves) {
        return outcome == Outcome.FORFEIT_WIN || (isBye() && pointsHalves >= winHalves);
    }
}
