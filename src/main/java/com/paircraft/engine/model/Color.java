package com.paircraft.engine.model;

/**
 * Piece color a player had in a game.
 */
public enum Color {
    WHITE,
    BLACK;

    public Color opposite() {
        return this == WHITE ? BLACK : WHITE;
    }
}
