package com.connectfour.core;

/**
 * Observable outcome of a position. Reaching a finished state is not an error.
 */
public enum GameStatus {
    IN_PROGRESS,
    FIRST_WINS,
    SECOND_WINS,
    DRAW;

    public boolean isFinished() {
        return this != IN_PROGRESS;
    }
}
