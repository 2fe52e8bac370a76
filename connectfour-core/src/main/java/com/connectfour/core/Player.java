package com.connectfour.core;

/**
 * The two sides of a Connect Four match. {@link #FIRST} always makes the opening move.
 */
public enum Player {
    FIRST('X'),
    SECOND('O');

    private final char symbol;

    Player(char symbol) {
        this.symbol = symbol;
    }

    public Player opponent() {
        return this == FIRST ? SECOND : FIRST;
    }

    /**
     * Returns the character used by text front-ends to draw this player's discs.
     */
    public char symbol() {
        return symbol;
    }
}
