package com.connectfour.core.ai;

import com.connectfour.core.Board;
import com.connectfour.core.GameStatus;
import com.connectfour.core.Player;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Plays engine-versus-engine series between two search depths. Every opening is played twice with
 * the colours swapped, so neither depth profits from always moving first.
 */
public final class Tournament {

    private static final Logger LOGGER = Logger.getLogger(Tournament.class.getName());

    private final SearchEngine engine;

    public Tournament() {
        this(new SearchEngine());
    }

    public Tournament(SearchEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Returns the seven single-move openings, one per column.
     */
    public static List<String> singleMoveOpenings() {
        List<String> openings = new ArrayList<>();
        for (int column = 0; column < Board.COLUMNS; column++) {
            openings.add(Integer.toString(column));
        }
        return openings;
    }

    /**
     * Plays {@code 2 * openings.size()} games between the two depths.
     *
     * @param openings move strings replayed before the engines take over, e.g. {@code "33"}
     */
    public MatchSummary playSeries(int challengerDepth, int baselineDepth, List<String> openings) {
        if (challengerDepth < 1 || baselineDepth < 1) {
            throw new IllegalArgumentException("Depths must be at least 1");
        }
        Objects.requireNonNull(openings, "openings");
        if (openings.isEmpty()) {
            throw new IllegalArgumentException("At least one opening is required");
        }

        MatchSummary summary = new MatchSummary(challengerDepth, baselineDepth, 0, 0, 0);
        int gameNumber = 0;
        for (String opening : openings) {
            for (Player challengerSide : Player.values()) {
                gameNumber++;
                GameStatus status = playGame(opening, challengerSide, challengerDepth, baselineDepth);
                MatchSummary.GameOutcome outcome = classify(status, challengerSide);
                summary = summary.plus(outcome);

                final int number = gameNumber;
                final MatchSummary running = summary;
                LOGGER.info(() -> String.format(
                        "Completed game %d (opening=%s, challenger=%s, result=%s, score=%d-%d-%d)",
                        number, opening, challengerSide, outcome, running.challengerWins(), running.baselineWins(),
                        running.draws()));
            }
        }
        return summary;
    }

    /**
     * Plays a single game from {@code opening} and returns its final status.
     */
    public GameStatus playGame(String opening, Player challengerSide, int challengerDepth, int baselineDepth) {
        Objects.requireNonNull(challengerSide, "challengerSide");
        Board board = Board.fromMoves(opening);
        while (!board.isTerminal()) {
            int depth = board.sideToMove() == challengerSide ? challengerDepth : baselineDepth;
            SearchResult result = engine.bestMove(board, depth);
            board.applyMove(result.column());
        }
        return board.status();
    }

    private static MatchSummary.GameOutcome classify(GameStatus status, Player challengerSide) {
        return switch (status) {
            case FIRST_WINS -> challengerSide == Player.FIRST
                    ? MatchSummary.GameOutcome.CHALLENGER_WIN
                    : MatchSummary.GameOutcome.BASELINE_WIN;
            case SECOND_WINS -> challengerSide == Player.SECOND
                    ? MatchSummary.GameOutcome.CHALLENGER_WIN
                    : MatchSummary.GameOutcome.BASELINE_WIN;
            case DRAW -> MatchSummary.GameOutcome.DRAW;
            case IN_PROGRESS -> throw new IllegalStateException("Game finished without a result");
        };
    }
}
