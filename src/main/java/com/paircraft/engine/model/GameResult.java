package com.paircraft.engine.model;

import com.paircraft.engine.error.ValidationException;

/**
 * Result of a pairing, always expressed from white's side of the board.
 */
public enum GameResult {
    PENDING("*"),
    WHITE_WIN("1-0"),
    BLACK_WIN("0-1"),
    DRAW("1/2-1/2"),
    WHITE_FORFEIT_WIN("1-0F"),
    BLACK_FORFEIT_WIN("0-1F"),
    DOUBLE_FORFEIT("0-0F"),
    BYE("bye");

    private final String notation;

    GameResult(String notation) {
        this.notation = notation;
    }

    public String notation() {
        return notation;
    }

    /**
     * Parses the usual scoresheet notation ("1-0", "1/2-1/2", "0-1F", ...) or an enum name.
     *
     * @throws ValidationException if the text is not a known result
     */
    public static GameResult fromNotation(String text) {
        for (GameResult result : values()) {
            if (result.notation.equalsIgnoreCase(text) || result.name().equalsIgnoreCase(text)) {
                return result;
            }
        }
        if ("0.5-0.5".equals(text) || "½-½".equals(text)) {
            return DRAW;
        }
        throw new ValidationException("Unknown game result: " + text);
    }
}
