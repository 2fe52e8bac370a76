package com.connectfour.core;

import com.connectfour.core.ai.SearchEngine;
import com.connectfour.core.ai.SearchResult;
import java.util.Scanner;

/**
 * Console front-end for a match against the engine, or between two humans with {@code --pvp}.
 * <p>
 * Options: {@code --difficulty=<easy|medium|hard|expert|insane>}, {@code --ai-first}, {@code --pvp}.
 */
public final class ConnectFourCLI {

    private ConnectFourCLI() {
    }

    public static void main(String[] args) {
        Difficulty difficulty = Difficulty.MEDIUM;
        boolean aiFirst = false;
        boolean humanOnly = false;
        for (String arg : args) {
            if (arg.startsWith("--difficulty=")) {
                try {
                    difficulty = Difficulty.fromLabel(arg.substring("--difficulty=".length()));
                } catch (IllegalArgumentException ex) {
                    System.err.println(ex.getMessage());
                    return;
                }
            } else if ("--ai-first".equals(arg)) {
                aiFirst = true;
            } else if ("--pvp".equals(arg)) {
                humanOnly = true;
            } else {
                System.err.println("Usage: ConnectFourCLI [--difficulty=<label>] [--ai-first] [--pvp]");
                return;
            }
        }

        Player aiPlayer = humanOnly ? null : (aiFirst ? Player.FIRST : Player.SECOND);
        play(new Scanner(System.in), new SearchEngine(), difficulty, aiPlayer);
    }

    private static void play(Scanner scanner, SearchEngine engine, Difficulty difficulty, Player aiPlayer) {
        Board board = new Board();

        System.out.println("Connect Four console edition");
        if (aiPlayer != null) {
            System.out.printf("Engine plays %c at %s%n", aiPlayer.symbol(), difficulty);
        }
        while (!board.isTerminal()) {
            System.out.println(board);
            Player toMove = board.sideToMove();

            if (toMove == aiPlayer) {
                SearchResult result = engine.bestMove(board, difficulty.depth());
                System.out.printf("Engine drops into column %d (score %d, %d nodes)%n", result.column(),
                        result.score(), result.visitedNodes());
                board.applyMove(result.column());
                continue;
            }

            System.out.printf("Player %c, choose a column (0-6), u to undo, q to quit: ", toMove.symbol());
            if (!scanner.hasNextLine()) {
                return;
            }
            String input = scanner.nextLine().trim();
            if ("q".equalsIgnoreCase(input)) {
                return;
            }
            if ("u".equalsIgnoreCase(input)) {
                undoRound(board, aiPlayer);
                continue;
            }

            int column;
            try {
                column = Integer.parseInt(input);
            } catch (NumberFormatException ex) {
                System.out.println("Please enter a valid column number.");
                continue;
            }
            try {
                board.applyMove(column);
            } catch (InvalidMoveException ex) {
                System.out.println(ex.getMessage() + ". Choose another one.");
            }
        }

        System.out.println(board);
        switch (board.status()) {
            case FIRST_WINS -> System.out.printf("Winner: %c%n", Player.FIRST.symbol());
            case SECOND_WINS -> System.out.printf("Winner: %c%n", Player.SECOND.symbol());
            default -> System.out.println("The game is a draw.");
        }
    }

    /**
     * Takes back the human's last move and, against the engine, the engine's reply as well.
     */
    private static void undoRound(Board board, Player aiPlayer) {
        int plies = aiPlayer == null ? 1 : 2;
        if (board.moveCount() < plies) {
            System.out.println("Nothing to undo.");
            return;
        }
        for (int i = 0; i < plies; i++) {
            board.undo();
        }
    }
}
