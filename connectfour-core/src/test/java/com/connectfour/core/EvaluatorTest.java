package com.connectfour.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.Test;

class EvaluatorTest {

    @Test
    void buildsEveryFourCellWindowOnce() {
        long[] masks = Evaluator.getWindowMasks();
        assertEquals(Evaluator.TOTAL_WINDOWS, masks.length);
        assertEquals(masks.length, Arrays.stream(masks).distinct().count());
        for (long mask : masks) {
            assertEquals(4, Long.bitCount(mask));
            assertEquals(0L, mask & ~Board.PLAYABLE_MASK, "Window must not touch sentinel bits");
        }
    }

    @Test
    void windowMasksAreDefensiveCopies() {
        long[] masks = Evaluator.getWindowMasks();
        masks[0] = 0L;
        assertEquals(4, Long.bitCount(Evaluator.getWindowMasks()[0]));
    }

    @Test
    void scoresWindowContents() {
        assertEquals(Evaluator.WIN_SCORE, Evaluator.scoreWindow(4, 0));
        assertEquals(Evaluator.THREE_SCORE, Evaluator.scoreWindow(3, 0));
        assertEquals(Evaluator.TWO_SCORE, Evaluator.scoreWindow(2, 0));
        assertEquals(Evaluator.ONE_SCORE, Evaluator.scoreWindow(1, 0));
        assertEquals(Evaluator.OPPONENT_THREE_PENALTY, Evaluator.scoreWindow(0, 3));
        assertEquals(Evaluator.OPPONENT_TWO_PENALTY, Evaluator.scoreWindow(0, 2));
        assertEquals(0, Evaluator.scoreWindow(0, 0));
        assertEquals(0, Evaluator.scoreWindow(2, 1));
        assertEquals(0, Evaluator.scoreWindow(1, 1));
        assertEquals(0, Evaluator.scoreWindow(3, 1));
    }

    @Test
    void emptyBoardIsBalanced() {
        Board board = new Board();
        assertEquals(0, Evaluator.evaluate(board, Player.FIRST, 0));
        assertEquals(0, Evaluator.evaluate(board, Player.SECOND, 0));
    }

    @Test
    void centreDiscOutweighsEdgeDisc() {
        // Seven windows and a bonus of 207 for the centre, three windows and 43 for the corner.
        assertEquals(277, Evaluator.evaluate(Board.fromMoves("3"), Player.FIRST, 0));
        assertEquals(73, Evaluator.evaluate(Board.fromMoves("0"), Player.FIRST, 0));
        assertEquals(-277, Evaluator.evaluate(Board.fromMoves("3"), Player.SECOND, 0));
    }

    @Test
    void heuristicIsAntisymmetric() {
        Random random = new Random(11);
        for (int game = 0; game < 100; game++) {
            Board board = new Board();
            while (!board.isTerminal()) {
                int first = Evaluator.evaluate(board, Player.FIRST, 0);
                int second = Evaluator.evaluate(board, Player.SECOND, 0);
                assertEquals(-first, second);

                int[] legal = board.legalMoves();
                board.applyMove(legal[random.nextInt(legal.length)]);
            }
        }
    }

    @Test
    void terminalPositionsUsePlyAdjustedScores() {
        Board won = Board.fromMoves("0011223");
        assertEquals(Evaluator.WIN_SCORE - 3, Evaluator.evaluate(won, Player.FIRST, 3));
        assertEquals(-(Evaluator.WIN_SCORE - 3), Evaluator.evaluate(won, Player.SECOND, 3));

        Board drawn = Board.fromMoves(BoardTest.DRAWN_GAME);
        assertEquals(Evaluator.DRAW_SCORE, Evaluator.evaluate(drawn, Player.FIRST, 5));
    }

    @Test
    void quickerWinsScoreHigher() {
        Board won = Board.fromMoves("0101010");
        assertTrue(Evaluator.evaluate(won, Player.FIRST, 1) > Evaluator.evaluate(won, Player.FIRST, 5));
        assertTrue(Evaluator.evaluate(won, Player.SECOND, 1) < Evaluator.evaluate(won, Player.SECOND, 5));
    }
}
