package com.paircraft.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.paircraft.engine.error.InvalidConfigurationException;

/**
 * Point values awarded per game outcome and bye type. Every value must be a non-negative
 * multiple of 0.5.
 */
public record ScoringRules(
    @JsonProperty("win") double win,
    @JsonProperty("draw") double draw,
    @JsonProperty("loss") double loss,
    @JsonProperty("forfeitWin") double forfeitWin,
    @JsonProperty("forfeitLoss") double forfeitLoss,
    @JsonProperty("pairingAllocatedBye") double pairingAllocatedBye,
    @JsonProperty("fullPointBye") double fullPointBye,
    @JsonProperty("halfPointBye") double halfPointBye,
    @JsonProperty("zeroPointBye") double zeroPointBye
) {

    public ScoringRules {
        for (double value : new double[] {win, draw, loss, forfeitWin, forfeitLoss,
                pairingAllocatedBye, fullPointBye, halfPointBye, zeroPointBye}) {
            if (value < 0) {
                throw new InvalidConfigurationException("Point values must not be negative, got " + value);
            }
            Points.toHalves(value);
        }
    }

    public static ScoringRules defaults() {
        return new ScoringRules(1.0, 0.5, 0.0, 1.0, 0.0, 1.0, 1.0, 0.5, 0.0);
    }

    public ScoringRules withPairingAllocatedBye(double points) {
        return new ScoringRules(win, draw, loss, forfeitWin, forfeitLoss, points, fullPointBye, halfPointBye, zeroPointBye);
    }

    /**
     * Half-points earned by the player who sat on {@code side} of a finished game.
     */
    public int halvesFor(GameResult result, Color side) {
        boolean white = side == Color.WHITE;
        double points = switch (result) {
            case WHITE_WIN -> white ? win : loss;
            case BLACK_WIN -> white ? loss : win;
            case DRAW -> draw;
            case WHITE_FORFEIT_WIN -> white ? forfeitWin : forfeitLoss;
            case BLACK_FORFEIT_WIN -> white ? forfeitLoss : forfeitWin;
            case DOUBLE_FORFEIT -> forfeitLoss;
            case PENDING, BYE -> throw new IllegalArgumentException("No game points for result " + result);
        };
        return Points.toHalves(points);
    }

    public int halvesForBye(ByeType byeType) {
        double points = switch (byeType) {
            case PAIRING_ALLOCATED -> pairingAllocatedBye;
            case FULL_POINT -> fullPointBye;
            case HALF_POINT -> halfPointBye;
            case ZERO_POINT -> zeroPointBye;
        };
        return Points.toHalves(points);
    }

    /**
     * Half-points of a win over the board, the maximum a single round can award.
     */
    public int winHalves() {
        return Points.toHalves(win);
    }
}
