package com.connectfour.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Static evaluation of Connect Four positions. Builds every four-cell window on the grid once and
 * scores positions by window contents plus a positional bonus for each occupied cell.
 */
public final class Evaluator {

    public static final int WINDOW_LENGTH = 4;
    public static final int TOTAL_WINDOWS = 69;

    public static final int WIN_SCORE = 100_000;
    public static final int THREE_SCORE = 1_000;
    public static final int TWO_SCORE = 100;
    public static final int ONE_SCORE = 10;
    public static final int OPPONENT_THREE_PENALTY = -800;
    public static final int OPPONENT_TWO_PENALTY = -50;
    public static final int DRAW_SCORE = 0;

    /** Centre columns and middle rows participate in the most lines. */
    private static final int[][] CELL_WEIGHTS = {
            {3, 4, 5, 7, 5, 4, 3},
            {4, 6, 8, 10, 8, 6, 4},
            {5, 8, 11, 13, 11, 8, 5},
            {5, 8, 11, 13, 11, 8, 5},
            {4, 6, 8, 10, 8, 6, 4},
            {3, 4, 5, 7, 5, 4, 3}
    };
    private static final int[] COLUMN_WEIGHTS = {40, 70, 120, 200, 120, 70, 40};

    private static final long[] WINDOW_MASKS;
    private static final int[] POSITION_BONUS = new int[Board.COLUMNS * Board.COLUMN_STRIDE];

    static {
        List<Long> windows = new ArrayList<>();
        windows.addAll(generateWindows(1, 0));  // horizontal
        windows.addAll(generateWindows(0, 1));  // vertical
        windows.addAll(generateWindows(1, 1));  // rising diagonal
        windows.addAll(generateWindows(1, -1)); // falling diagonal

        if (windows.size() != TOTAL_WINDOWS) {
            throw new IllegalStateException("Expected " + TOTAL_WINDOWS + " windows but built " + windows.size());
        }
        WINDOW_MASKS = windows.stream().mapToLong(Long::longValue).toArray();

        for (int column = 0; column < Board.COLUMNS; column++) {
            for (int row = 0; row < Board.ROWS; row++) {
                POSITION_BONUS[Board.cellIndex(column, row)] = CELL_WEIGHTS[row][column] + COLUMN_WEIGHTS[column];
            }
        }
    }

    private Evaluator() {
    }

    /**
     * Returns a defensive copy of all window bit masks.
     */
    public static long[] getWindowMasks() {
        return WINDOW_MASKS.clone();
    }

    /**
     * Scores the position for {@code perspective}, handling finished games first. Wins are worth
     * {@link #WIN_SCORE} minus {@code ply} so that quicker wins rank higher.
     *
     * @param ply the distance of this position from the search root
     */
    public static int evaluate(Board board, Player perspective, int ply) {
        if (board.isWin(perspective)) {
            return WIN_SCORE - ply;
        }
        if (board.isWin(perspective.opponent())) {
            return -(WIN_SCORE - ply);
        }
        if (board.isFull()) {
            return DRAW_SCORE;
        }
        return evaluateHeuristic(board, perspective);
    }

    /**
     * Window and positional score of {@code perspective} minus the same score of the opponent.
     * The result is antisymmetric in the two players.
     */
    public static int evaluateHeuristic(Board board, Player perspective) {
        long own = board.bits(perspective);
        long other = board.bits(perspective.opponent());
        return sideScore(own, other) - sideScore(other, own);
    }

    /**
     * Scores one window from the owner's side given the number of own and opposing discs in it.
     */
    public static int scoreWindow(int ownCount, int opponentCount) {
        int empty = WINDOW_LENGTH - ownCount - opponentCount;
        if (ownCount == 4) {
            return WIN_SCORE;
        }
        if (ownCount == 3 && empty == 1) {
            return THREE_SCORE;
        }
        if (ownCount == 2 && empty == 2) {
            return TWO_SCORE;
        }
        if (ownCount == 1 && empty == 3) {
            return ONE_SCORE;
        }
        if (opponentCount == 3 && empty == 1) {
            return OPPONENT_THREE_PENALTY;
        }
        if (opponentCount == 2 && empty == 2) {
            return OPPONENT_TWO_PENALTY;
        }
        return 0;
    }

    private static int sideScore(long own, long other) {
        int score = 0;
        for (long mask : WINDOW_MASKS) {
            score += scoreWindow(Long.bitCount(own & mask), Long.bitCount(other & mask));
        }
        long remaining = own;
        while (remaining != 0L) {
            int bit = Long.numberOfTrailingZeros(remaining);
            remaining &= remaining - 1;
            score += POSITION_BONUS[bit];
        }
        return score;
    }

    private static List<Long> generateWindows(int columnStep, int rowStep) {
        List<Long> windows = new ArrayList<>();
        for (int column = 0; column < Board.COLUMNS; column++) {
            for (int row = 0; row < Board.ROWS; row++) {
                int endColumn = column + (WINDOW_LENGTH - 1) * columnStep;
                int endRow = row + (WINDOW_LENGTH - 1) * rowStep;
                if (endColumn < 0 || endColumn >= Board.COLUMNS || endRow < 0 || endRow >= Board.ROWS) {
                    continue;
                }
                long mask = 0L;
                for (int i = 0; i < WINDOW_LENGTH; i++) {
                    mask |= 1L << Board.cellIndex(column + i * columnStep, row + i * rowStep);
                }
                windows.add(mask);
            }
        }
        return windows;
    }
}
