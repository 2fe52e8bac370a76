package com.connectfour.visualizer.model;

import com.connectfour.core.Board;
import com.connectfour.core.GameStatus;
import com.connectfour.core.Player;
import com.connectfour.core.ai.SearchEngine;
import com.connectfour.core.ai.SearchResult;
import com.connectfour.core.ai.SearchTelemetry;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable snapshot of a single position within a match or simulation.
 *
 * @param score        engine score of the last move from its mover's side, {@link SearchEngine#NO_SCORE}
 *                     for human moves
 * @param columnScores engine score of every column in the position before the last move,
 *                     {@link SearchEngine#NO_SCORE} where unavailable
 */
public record GameFrame(
        long firstPlayerBits,
        long secondPlayerBits,
        int lastColumn,
        int ply,
        Player sideToMove,
        GameStatus status,
        long winningCells,
        int score,
        long visitedNodes,
        boolean timedOut,
        SearchTelemetry telemetry,
        int[] columnScores) {

    public GameFrame {
        Objects.requireNonNull(sideToMove, "sideToMove");
        Objects.requireNonNull(status, "status");
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
        columnScores = columnScores == null ? noScores() : columnScores.clone();
    }

    public static GameFrame initial() {
        return capture(new Board(), null, null);
    }

    /**
     * Captures {@code board} after a move, together with the search that produced it if any.
     *
     * @param result       search behind the last move, {@code null} for human moves
     * @param columnScores per-column analysis of the position before the move, may be {@code null}
     */
    public static GameFrame capture(Board board, SearchResult result, int[] columnScores) {
        Objects.requireNonNull(board, "board");
        GameStatus status = board.status();
        long winning = switch (status) {
            case FIRST_WINS -> board.winningCells(Player.FIRST);
            case SECOND_WINS -> board.winningCells(Player.SECOND);
            default -> 0L;
        };
        return new GameFrame(
                board.bits(Player.FIRST),
                board.bits(Player.SECOND),
                board.lastMove(),
                board.moveCount(),
                board.sideToMove(),
                status,
                winning,
                result == null ? SearchEngine.NO_SCORE : result.score(),
                result == null ? 0L : result.visitedNodes(),
                result != null && result.timedOut(),
                result == null ? SearchTelemetry.empty() : result.telemetry(),
                columnScores);
    }

    public boolean hasLastMove() {
        return lastColumn >= 0;
    }

    public boolean hasScore() {
        return score != SearchEngine.NO_SCORE;
    }

    /**
     * Returns the player who made the last move, or {@code null} for the initial position.
     */
    public Player lastMover() {
        return hasLastMove() ? sideToMove.opponent() : null;
    }

    @Override
    public int[] columnScores() {
        return columnScores.clone();
    }

    private static int[] noScores() {
        int[] scores = new int[Board.COLUMNS];
        Arrays.fill(scores, SearchEngine.NO_SCORE);
        return scores;
    }
}
