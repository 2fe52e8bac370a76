package com.connectfour.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Mutable bitboard representation of the 7x6 Connect Four grid.
 * <p>
 * Each player owns one {@code long}; the cell in {@code column} and {@code row} maps to bit
 * {@code column * 7 + row}, with row 0 at the bottom. The seventh bit of every column is never set,
 * which keeps the shift-based line detection from wrapping into the neighbouring column.
 * Instances are not thread-safe.
 */
public final class Board {

    public static final int COLUMNS = 7;
    public static final int ROWS = 6;
    public static final int CELL_COUNT = COLUMNS * ROWS;
    public static final int COLUMN_STRIDE = ROWS + 1;

    /** Mask of all 42 playable cells. */
    public static final long PLAYABLE_MASK;

    private static final int[] DIRECTIONS = {1, COLUMN_STRIDE, COLUMN_STRIDE + 1, COLUMN_STRIDE - 1};

    static {
        long mask = 0L;
        for (int column = 0; column < COLUMNS; column++) {
            mask |= ((1L << ROWS) - 1) << (column * COLUMN_STRIDE);
        }
        PLAYABLE_MASK = mask;
    }

    private final long[] bits = new long[2];
    private final int[] heights = new int[COLUMNS];
    private final int[] history = new int[CELL_COUNT];
    private int moveCount;

    /**
     * Creates an empty board with {@link Player#FIRST} to move.
     */
    public Board() {
    }

    /**
     * Replays a sequence of column digits, e.g. {@code "3344"}, on an empty board.
     *
     * @throws InvalidMoveException if a character is not a digit in {@code [0, 6]} or targets a full column
     */
    public static Board fromMoves(String moves) {
        Objects.requireNonNull(moves, "moves");
        Board board = new Board();
        for (int i = 0; i < moves.length(); i++) {
            char ch = moves.charAt(i);
            int column = Character.isDigit(ch) ? ch - '0' : -1;
            board.applyMove(column);
        }
        return board;
    }

    /**
     * Returns an independent copy including the move history.
     */
    public Board copy() {
        Board copy = new Board();
        copy.bits[0] = bits[0];
        copy.bits[1] = bits[1];
        System.arraycopy(heights, 0, copy.heights, 0, COLUMNS);
        System.arraycopy(history, 0, copy.history, 0, moveCount);
        copy.moveCount = moveCount;
        return copy;
    }

    /**
     * Returns the bit index of the given cell.
     */
    public static int cellIndex(int column, int row) {
        checkColumn(column);
        if (row < 0 || row >= ROWS) {
            throw new IllegalArgumentException("Row out of range: " + row);
        }
        return column * COLUMN_STRIDE + row;
    }

    /**
     * Returns the legal columns in ascending order. The array is freshly allocated on every call.
     */
    public int[] legalMoves() {
        int[] moves = new int[COLUMNS];
        int count = 0;
        for (int column = 0; column < COLUMNS; column++) {
            if (heights[column] < ROWS) {
                moves[count++] = column;
            }
        }
        return Arrays.copyOf(moves, count);
    }

    /**
     * Returns {@code true} if {@code column} is on the board and not yet full.
     */
    public boolean canPlay(int column) {
        return column >= 0 && column < COLUMNS && heights[column] < ROWS;
    }

    /**
     * Drops a disc of the side to move into {@code column} and passes the turn.
     *
     * @throws InvalidMoveException if the column is out of range or full
     */
    public void applyMove(int column) {
        if (column < 0 || column >= COLUMNS) {
            throw new InvalidMoveException(column, "Column out of range: " + column);
        }
        int height = heights[column];
        if (height >= ROWS) {
            throw new InvalidMoveException(column, "Column " + column + " is full");
        }
        bits[moveCount & 1] |= 1L << (column * COLUMN_STRIDE + height);
        heights[column] = height + 1;
        history[moveCount++] = column;
    }

    /**
     * Takes back the most recent move and returns its column.
     *
     * @throws EmptyHistoryException if no move has been made
     */
    public int undo() {
        if (moveCount == 0) {
            throw new EmptyHistoryException();
        }
        int column = history[--moveCount];
        int height = --heights[column];
        bits[moveCount & 1] &= ~(1L << (column * COLUMN_STRIDE + height));
        return column;
    }

    /**
     * Returns {@code true} if the player owns four aligned discs in any direction.
     */
    public boolean isWin(Player player) {
        return hasFour(bits[player.ordinal()]);
    }

    /**
     * Returns {@code true} if all 42 cells are filled and nobody has connected four.
     */
    public boolean isDraw() {
        return moveCount == CELL_COUNT && !isWin(Player.FIRST) && !isWin(Player.SECOND);
    }

    public boolean isTerminal() {
        return moveCount == CELL_COUNT || isWin(Player.FIRST) || isWin(Player.SECOND);
    }

    public boolean isFull() {
        return moveCount == CELL_COUNT;
    }

    public GameStatus status() {
        if (isWin(Player.FIRST)) {
            return GameStatus.FIRST_WINS;
        }
        if (isWin(Player.SECOND)) {
            return GameStatus.SECOND_WINS;
        }
        return moveCount == CELL_COUNT ? GameStatus.DRAW : GameStatus.IN_PROGRESS;
    }

    /**
     * Returns a mask of every cell that belongs to a four-in-a-row of the given player.
     */
    public long winningCells(Player player) {
        long own = bits[player.ordinal()];
        long cells = 0L;
        for (int direction : DIRECTIONS) {
            long starts = own & (own >>> direction) & (own >>> (2 * direction)) & (own >>> (3 * direction));
            for (int step = 0; step < 4; step++) {
                cells |= starts << (step * direction);
            }
        }
        return cells;
    }

    public Player sideToMove() {
        return (moveCount & 1) == 0 ? Player.FIRST : Player.SECOND;
    }

    public int moveCount() {
        return moveCount;
    }

    /**
     * Returns the number of discs in the column.
     */
    public int height(int column) {
        checkColumn(column);
        return heights[column];
    }

    /**
     * Returns the raw occupancy mask of the player.
     */
    public long bits(Player player) {
        return bits[player.ordinal()];
    }

    public Cell cellAt(int column, int row) {
        long bit = 1L << cellIndex(column, row);
        if ((bits[0] & bit) != 0L) {
            return Cell.FIRST;
        }
        if ((bits[1] & bit) != 0L) {
            return Cell.SECOND;
        }
        return Cell.EMPTY;
    }

    /**
     * Returns the columns played so far, oldest first.
     */
    public int[] moveHistory() {
        return Arrays.copyOf(history, moveCount);
    }

    /**
     * Returns the column of the most recent move, or {@code -1} on an empty board.
     */
    public int lastMove() {
        return moveCount == 0 ? -1 : history[moveCount - 1];
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int row = ROWS - 1; row >= 0; row--) {
            for (int column = 0; column < COLUMNS; column++) {
                if (column > 0) {
                    builder.append(' ');
                }
                builder.append(cellAt(column, row).symbol());
            }
            builder.append(System.lineSeparator());
        }
        for (int column = 0; column < COLUMNS; column++) {
            if (column > 0) {
                builder.append(' ');
            }
            builder.append(column);
        }
        return builder.toString();
    }

    private static boolean hasFour(long own) {
        for (int direction : DIRECTIONS) {
            if ((own & (own >>> direction) & (own >>> (2 * direction)) & (own >>> (3 * direction))) != 0L) {
                return true;
            }
        }
        return false;
    }

    private static void checkColumn(int column) {
        if (column < 0 || column >= COLUMNS) {
            throw new IllegalArgumentException("Column out of range: " + column);
        }
    }
}
