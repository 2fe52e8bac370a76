package com.connectfour.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.Test;

class BoardTest {

    /** Fills the grid without either side ever connecting four. */
    static final String DRAWN_GAME = "532315310141250566206042303423260411544566";

    @Test
    void emptyBoardOffersEveryColumn() {
        Board board = new Board();
        assertArrayEquals(new int[] {0, 1, 2, 3, 4, 5, 6}, board.legalMoves());
        assertEquals(Player.FIRST, board.sideToMove());
        assertEquals(0, board.moveCount());
        assertEquals(-1, board.lastMove());
        assertEquals(GameStatus.IN_PROGRESS, board.status());
        assertFalse(board.isTerminal());
    }

    @Test
    void discsStackFromTheBottom() {
        Board board = Board.fromMoves("334");
        assertEquals(Cell.FIRST, board.cellAt(3, 0));
        assertEquals(Cell.SECOND, board.cellAt(3, 1));
        assertEquals(Cell.FIRST, board.cellAt(4, 0));
        assertEquals(Cell.EMPTY, board.cellAt(3, 2));
        assertEquals(2, board.height(3));
        assertEquals(Player.SECOND, board.sideToMove());
        assertArrayEquals(new int[] {3, 3, 4}, board.moveHistory());
        assertEquals(0L, board.bits(Player.FIRST) & board.bits(Player.SECOND));
    }

    @Test
    void fullColumnIsRejected() {
        Board board = Board.fromMoves("333333");
        assertFalse(board.canPlay(3));
        assertArrayEquals(new int[] {0, 1, 2, 4, 5, 6}, board.legalMoves());

        InvalidMoveException ex = assertThrows(InvalidMoveException.class, () -> board.applyMove(3));
        assertEquals(3, ex.getColumn());
        assertEquals(6, board.moveCount());
    }

    @Test
    void outOfRangeColumnIsRejected() {
        Board board = new Board();
        assertThrows(InvalidMoveException.class, () -> board.applyMove(-1));
        assertThrows(InvalidMoveException.class, () -> board.applyMove(7));
        assertThrows(InvalidMoveException.class, () -> Board.fromMoves("38"));
        assertEquals(0, board.moveCount());
    }

    @Test
    void undoOnEmptyBoardFails() {
        Board board = new Board();
        assertThrows(EmptyHistoryException.class, board::undo);

        board.applyMove(2);
        assertEquals(2, board.undo());
        assertThrows(EmptyHistoryException.class, board::undo);
    }

    @Test
    void undoRestoresPreviousStateExactly() {
        Random random = new Random(42);
        for (int game = 0; game < 200; game++) {
            Board board = new Board();
            while (!board.isFull()) {
                int[] legal = board.legalMoves();
                int column = legal[random.nextInt(legal.length)];

                long first = board.bits(Player.FIRST);
                long second = board.bits(Player.SECOND);
                int[] heights = heights(board);
                Player toMove = board.sideToMove();
                int moveCount = board.moveCount();

                board.applyMove(column);
                assertEquals(column, board.undo());

                assertEquals(first, board.bits(Player.FIRST));
                assertEquals(second, board.bits(Player.SECOND));
                assertArrayEquals(heights, heights(board));
                assertEquals(toMove, board.sideToMove());
                assertEquals(moveCount, board.moveCount());

                board.applyMove(column);
            }
        }
    }

    @Test
    void detectsFourInEveryDirection() {
        assertTrue(Board.fromMoves("0011223").isWin(Player.FIRST));      // horizontal
        assertTrue(Board.fromMoves("0101010").isWin(Player.FIRST));      // vertical
        assertTrue(Board.fromMoves("23255435544").isWin(Player.FIRST));  // rising diagonal
        assertTrue(Board.fromMoves("6543546321433").isWin(Player.FIRST)); // falling diagonal
        assertFalse(Board.fromMoves("001122").isWin(Player.FIRST));
    }

    @Test
    void doesNotWrapAcrossColumns() {
        // First owns the top three cells of column 0 and the bottom cell of column 1.
        Board board = Board.fromMoves("10606005050");
        assertEquals(Cell.FIRST, board.cellAt(0, 5));
        assertEquals(Cell.FIRST, board.cellAt(1, 0));
        assertFalse(board.isWin(Player.FIRST));
        assertFalse(board.isWin(Player.SECOND));
    }

    @Test
    void bitTrickAgreesWithCellScan() {
        Random random = new Random(7);
        for (int game = 0; game < 500; game++) {
            Board board = new Board();
            while (!board.isFull()) {
                int[] legal = board.legalMoves();
                board.applyMove(legal[random.nextInt(legal.length)]);
                for (Player player : Player.values()) {
                    assertEquals(scanForFour(board, player), board.isWin(player),
                            () -> "Mismatch for " + player + " after " + Arrays.toString(board.moveHistory()));
                }
                if (board.isTerminal()) {
                    break;
                }
            }
        }
    }

    @Test
    void winningCellsCoverTheLine() {
        Board board = Board.fromMoves("0011223");
        long expected = 0L;
        for (int column = 0; column < 4; column++) {
            expected |= 1L << Board.cellIndex(column, 0);
        }
        assertEquals(expected, board.winningCells(Player.FIRST));
        assertEquals(0L, board.winningCells(Player.SECOND));
    }

    @Test
    void filledBoardWithoutLineIsDraw() {
        Board board = Board.fromMoves(DRAWN_GAME);
        assertTrue(board.isFull());
        assertTrue(board.isDraw());
        assertTrue(board.isTerminal());
        assertFalse(board.isWin(Player.FIRST));
        assertFalse(board.isWin(Player.SECOND));
        assertEquals(GameStatus.DRAW, board.status());
        assertEquals(0, board.legalMoves().length);
    }

    @Test
    void copyIsIndependent() {
        Board board = Board.fromMoves("3342");
        Board copy = board.copy();
        copy.applyMove(0);
        assertEquals(4, board.moveCount());
        assertEquals(5, copy.moveCount());

        assertEquals(0, copy.undo());
        assertArrayEquals(board.moveHistory(), copy.moveHistory());
        assertEquals(board.bits(Player.FIRST), copy.bits(Player.FIRST));
        assertEquals(board.bits(Player.SECOND), copy.bits(Player.SECOND));
    }

    @Test
    void rendersGridWithColumnIndices() {
        String rendered = Board.fromMoves("3").toString();
        String[] lines = rendered.split(System.lineSeparator());
        assertEquals(Board.ROWS + 1, lines.length);
        assertEquals(". . . X . . .", lines[Board.ROWS - 1]);
        assertEquals("0 1 2 3 4 5 6", lines[Board.ROWS]);
    }

    private static int[] heights(Board board) {
        int[] heights = new int[Board.COLUMNS];
        for (int column = 0; column < Board.COLUMNS; column++) {
            heights[column] = board.height(column);
        }
        return heights;
    }

    private static boolean scanForFour(Board board, Player player) {
        Cell target = Cell.of(player);
        int[][] directions = {{1, 0}, {0, 1}, {1, 1}, {1, -1}};
        for (int column = 0; column < Board.COLUMNS; column++) {
            for (int row = 0; row < Board.ROWS; row++) {
                for (int[] direction : directions) {
                    int count = 0;
                    for (int step = 0; step < 4; step++) {
                        int c = column + step * direction[0];
                        int r = row + step * direction[1];
                        if (c < 0 || c >= Board.COLUMNS || r < 0 || r >= Board.ROWS || board.cellAt(c, r) != target) {
                            break;
                        }
                        count++;
                    }
                    if (count == 4) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
