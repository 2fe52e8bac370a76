package com.connectfour.visualizer.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.connectfour.core.Board;
import com.connectfour.core.GameStatus;
import com.connectfour.core.Player;
import com.connectfour.core.ai.SearchEngine;
import com.connectfour.core.ai.SearchResult;
import org.junit.jupiter.api.Test;

class GameFrameTest {

    @Test
    void initialFrameIsEmpty() {
        GameFrame frame = GameFrame.initial();

        assertEquals(0, frame.ply());
        assertFalse(frame.hasLastMove());
        assertFalse(frame.hasScore());
        assertNull(frame.lastMover());
        assertEquals(Player.FIRST, frame.sideToMove());
        assertEquals(GameStatus.IN_PROGRESS, frame.status());
        assertEquals(0L, frame.firstPlayerBits() | frame.secondPlayerBits());
    }

    @Test
    void capturesEngineMove() {
        Board board = Board.fromMoves("061625");
        SearchEngine engine = new SearchEngine();
        int[] scores = engine.analyse(board, 2);
        SearchResult result = engine.bestMove(board, 2);
        board.applyMove(result.column());

        GameFrame frame = GameFrame.capture(board, result, scores);

        assertEquals(3, frame.lastColumn());
        assertEquals(Player.FIRST, frame.lastMover());
        assertEquals(GameStatus.FIRST_WINS, frame.status());
        assertEquals(board.winningCells(Player.FIRST), frame.winningCells());
        assertEquals(result.score(), frame.score());
        assertTrue(frame.visitedNodes() > 0);
        assertEquals(scores[3], frame.columnScores()[3]);
    }

    @Test
    void isUnaffectedByLaterBoardChanges() {
        Board board = Board.fromMoves("33");
        int[] scores = new int[Board.COLUMNS];
        GameFrame frame = GameFrame.capture(board, null, scores);

        board.applyMove(4);
        scores[0] = 42;
        frame.columnScores()[1] = 7;

        assertEquals(2, frame.ply());
        assertEquals(0, frame.columnScores()[0]);
        assertEquals(0, frame.columnScores()[1]);
    }

    @Test
    void missingAnalysisReportsNoScore() {
        GameFrame frame = GameFrame.capture(Board.fromMoves("3"), null, null);
        for (int score : frame.columnScores()) {
            assertEquals(SearchEngine.NO_SCORE, score);
        }
    }
}
