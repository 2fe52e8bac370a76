package com.connectfour.core;

/**
 * Thrown when a move targets a column outside {@code [0, 6]} or a column that is already full.
 */
public final class InvalidMoveException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int column;

    public InvalidMoveException(int column, String message) {
        super(message);
        this.column = column;
    }

    public int getColumn() {
        return column;
    }
}
