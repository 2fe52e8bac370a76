package com.connectfour.core.ai.state;

import com.connectfour.core.Board;
import com.connectfour.core.ai.MoveOrdering;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Per-ply move buffers and a triangular principal variation table that let the search run without
 * per-node allocations. Scoped to a single search call.
 */
public final class SearchState {

    private static final int SLICE_LENGTH = Board.COLUMNS;
    private static final int MAX_PLY = Board.CELL_COUNT;

    private final int[] moves = new int[(MAX_PLY + 1) * SLICE_LENGTH];
    private final int[] moveCounts = new int[MAX_PLY + 1];
    private final int[] pvTable = new int[(MAX_PLY + 1) * (MAX_PLY + 1)];
    private final int[] pvLengths = new int[MAX_PLY + 1];

    /**
     * Clears the move buffers and the principal variation.
     */
    public void reset() {
        Arrays.fill(moveCounts, 0);
        Arrays.fill(pvLengths, 0);
    }

    /**
     * Fills the buffer for {@code ply} with the legal columns of {@code board} in search order.
     */
    public int generateMoves(Board board, int ply) {
        int count = MoveOrdering.orderMoves(board, moves, ply * SLICE_LENGTH);
        moveCounts[ply] = count;
        pvLengths[ply] = 0;
        return count;
    }

    public int moveAt(int ply, int index) {
        return moves[ply * SLICE_LENGTH + index];
    }

    public int moveCount(int ply) {
        return moveCounts[ply];
    }

    /**
     * Marks the line at {@code ply} as empty, used for leaves.
     */
    public void clearPv(int ply) {
        pvLengths[ply] = 0;
    }

    /**
     * Records {@code move} followed by the child's line as the best line at {@code ply}.
     */
    public void updatePv(int ply, int move) {
        int base = ply * (MAX_PLY + 1);
        pvTable[base] = move;
        int childLength = ply < MAX_PLY ? pvLengths[ply + 1] : 0;
        if (childLength > 0) {
            System.arraycopy(pvTable, (ply + 1) * (MAX_PLY + 1), pvTable, base + 1, childLength);
        }
        pvLengths[ply] = childLength + 1;
    }

    public List<Integer> principalVariation(int ply) {
        int base = ply * (MAX_PLY + 1);
        List<Integer> line = new ArrayList<>(pvLengths[ply]);
        for (int i = 0; i < pvLengths[ply]; i++) {
            line.add(pvTable[base + i]);
        }
        return line;
    }
}
