package com.connectfour.core.ai;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.connectfour.core.Board;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class MoveOrderingTest {

    @Test
    void ordersFromTheCentreOutwards() {
        assertArrayEquals(new int[] {3, 2, 4, 1, 5, 0, 6}, MoveOrdering.centerFirst());
    }

    @Test
    void skipsFullColumns() {
        Board board = Board.fromMoves("333333222222");
        int[] target = new int[Board.COLUMNS + 2];

        int count = MoveOrdering.orderMoves(board, target, 2);

        assertEquals(5, count);
        assertArrayEquals(new int[] {4, 1, 5, 0, 6}, Arrays.copyOfRange(target, 2, 2 + count));
    }
}
