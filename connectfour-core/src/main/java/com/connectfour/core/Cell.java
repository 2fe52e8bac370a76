package com.connectfour.core;

/**
 * Content of a single grid cell as seen by rendering code.
 */
public enum Cell {
    EMPTY('.'),
    FIRST(Player.FIRST.symbol()),
    SECOND(Player.SECOND.symbol());

    private final char symbol;

    Cell(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public static Cell of(Player player) {
        return player == Player.FIRST ? FIRST : SECOND;
    }
}
