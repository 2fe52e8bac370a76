package com.connectfour.core.ai;

import com.connectfour.core.Board;

/**
 * Centre-first column ordering. Central columns take part in more four-in-a-row lines, so trying
 * them first produces earlier alpha-beta cutoffs.
 */
public final class MoveOrdering {

    private static final int[] CENTER_FIRST = {3, 2, 4, 1, 5, 0, 6};

    private MoveOrdering() {
    }

    /**
     * Returns a copy of the column search order.
     */
    public static int[] centerFirst() {
        return CENTER_FIRST.clone();
    }

    /**
     * Writes the playable columns of {@code board} into {@code target} starting at {@code offset}
     * in centre-first order.
     *
     * @return the number of columns written
     */
    public static int orderMoves(Board board, int[] target, int offset) {
        int count = 0;
        for (int column : CENTER_FIRST) {
            if (board.canPlay(column)) {
                target[offset + count] = column;
                count++;
            }
        }
        return count;
    }
}
