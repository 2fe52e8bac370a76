package com.connectfour.core.ai;

import com.connectfour.core.Board;
import com.connectfour.core.Evaluator;
import com.connectfour.core.ai.SearchConstraints.Pruning;
import com.connectfour.core.ai.state.SearchState;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.LockSupport;
import java.util.logging.Logger;

/**
 * Negamax searcher with alpha-beta pruning, centre-first move ordering and optional time and node
 * budgets.
 * <p>
 * Every deepening iteration uses the same move order, so a search that is not interrupted returns
 * exactly what a plain fixed-depth minimax would: the first column in search order that reaches the
 * best score. The engine mutates the caller's board while searching and restores it before
 * returning. Instances keep per-search buffers and must not be shared between threads.
 */
public final class SearchEngine implements Searcher {

    public static final int NO_MOVE = -1;
    public static final int NO_SCORE = Integer.MIN_VALUE;

    private static final Logger LOGGER = Logger.getLogger(SearchEngine.class.getName());
    private static final int INFINITY = Integer.MAX_VALUE / 2;

    private final Duration configuredTimeLimit;
    private final long configuredNodeLimit;
    private final long minThinkTimeNanos;
    private final SearchState searchState = new SearchState();

    private Board board;
    private Pruning pruning;
    private long visitedNodes;
    private long cutoffs;
    private long nodeLimit;
    private long deadline;
    private boolean aborted;

    private long lastVisitedNodes;
    private boolean lastTimedOut;

    /**
     * Creates an engine without time or node budgets.
     */
    public SearchEngine() {
        this(Duration.ZERO, 0L, Duration.ZERO);
    }

    public SearchEngine(Duration timeLimit) {
        this(timeLimit, 0L, Duration.ZERO);
    }

    /**
     * @param timeLimit    wall clock budget per search, {@link Duration#ZERO} for none
     * @param nodeLimit    node budget per search, {@code 0} for none
     * @param minThinkTime minimum duration of a completed search, used to pace interactive games
     */
    public SearchEngine(Duration timeLimit, long nodeLimit, Duration minThinkTime) {
        Objects.requireNonNull(timeLimit, "timeLimit");
        Objects.requireNonNull(minThinkTime, "minThinkTime");
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("Time limit must be non-negative");
        }
        if (nodeLimit < 0L) {
            throw new IllegalArgumentException("Node limit must be non-negative");
        }
        if (minThinkTime.isNegative()) {
            throw new IllegalArgumentException("Minimum think time must be non-negative");
        }
        if (!timeLimit.isZero() && minThinkTime.compareTo(timeLimit) > 0) {
            throw new IllegalArgumentException("Minimum think time cannot exceed the overall time limit");
        }
        this.configuredTimeLimit = timeLimit;
        this.configuredNodeLimit = nodeLimit;
        this.minThinkTimeNanos = minThinkTime.toNanos();
    }

    /**
     * Searches the position to {@code depth} plies with the engine's configured budgets.
     *
     * @throws IllegalArgumentException if {@code depth} is less than one
     */
    public SearchResult bestMove(Board board, int depth) {
        return search(board, new SearchConstraints(depth, configuredTimeLimit, configuredNodeLimit,
                Pruning.ALPHA_BETA));
    }

    public long getLastVisitedNodeCount() {
        return lastVisitedNodes;
    }

    public boolean wasLastSearchTimedOut() {
        return lastTimedOut;
    }

    /**
     * Returns the result of a finished game immediately with {@link #NO_MOVE}; callers are expected
     * to check {@link Board#isTerminal()} first.
     */
    @Override
    public SearchResult search(Board board, SearchConstraints constraints) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(constraints, "constraints");

        if (board.isTerminal()) {
            int score = Evaluator.evaluate(board, board.sideToMove(), 0);
            lastVisitedNodes = 0L;
            lastTimedOut = false;
            return new SearchResult(NO_MOVE, score, 0, 0L, false, SearchTelemetry.empty());
        }

        int remainingMoves = Board.CELL_COUNT - board.moveCount();
        int boundedDepth = Math.min(constraints.depthLimit(), remainingMoves);

        long searchStart = System.nanoTime();
        long timeLimitNanos = toTimeLimitNanos(constraints.timeLimit());
        long deadlineNanos = timeLimitNanos == Long.MAX_VALUE
                ? Long.MAX_VALUE
                : saturatingAdd(searchStart, timeLimitNanos);

        begin(board, constraints.pruning(), deadlineNanos, constraints.nodeLimit());
        SearchResult result;
        try {
            result = iterativeDeepening(boundedDepth);
        } finally {
            this.board = null;
        }

        if (!result.timedOut()) {
            enforceMinimumThinkTime(searchStart);
        }

        lastVisitedNodes = result.visitedNodes();
        lastTimedOut = result.timedOut();
        return result;
    }

    /**
     * Scores every legal root column with a full-window search of {@code depth} plies, ignoring the
     * configured budgets. Illegal columns, and all columns of a finished game, report
     * {@link #NO_SCORE}.
     */
    public int[] analyse(Board board, int depth) {
        Objects.requireNonNull(board, "board");
        if (depth < 1) {
            throw new IllegalArgumentException("Depth must be at least 1");
        }
        int[] scores = new int[Board.COLUMNS];
        Arrays.fill(scores, NO_SCORE);
        if (board.isTerminal()) {
            return scores;
        }

        begin(board, Pruning.ALPHA_BETA, Long.MAX_VALUE, 0L);
        try {
            int moveCount = searchState.generateMoves(board, 0);
            for (int i = 0; i < moveCount; i++) {
                int column = searchState.moveAt(0, i);
                board.applyMove(column);
                try {
                    scores[column] = -negamax(depth - 1, -INFINITY, INFINITY, 1);
                } finally {
                    board.undo();
                }
            }
        } finally {
            this.board = null;
        }
        return scores;
    }

    private void begin(Board board, Pruning pruning, long deadlineNanos, long nodeLimit) {
        this.board = board;
        this.pruning = pruning;
        this.deadline = deadlineNanos;
        this.nodeLimit = nodeLimit;
        this.visitedNodes = 0L;
        this.cutoffs = 0L;
        this.aborted = false;
        searchState.reset();
    }

    private SearchResult iterativeDeepening(int boundedDepthLimit) {
        List<SearchTelemetry.Iteration> iterations = new ArrayList<>();
        RootResult lastComplete = null;
        RootResult lastAttempt = null;

        for (int depth = 1; depth <= boundedDepthLimit; depth++) {
            long iterationStart = System.nanoTime();
            long nodesBefore = visitedNodes;
            long cutoffsBefore = cutoffs;

            RootResult iteration = searchRoot(depth);
            iterations.add(new SearchTelemetry.Iteration(depth, visitedNodes - nodesBefore,
                    cutoffs - cutoffsBefore, System.nanoTime() - iterationStart, iteration.column,
                    iteration.score, !aborted, searchState.principalVariation(0)));

            lastAttempt = iteration;
            if (aborted) {
                break;
            }
            lastComplete = iteration;
        }

        RootResult finalResult = lastComplete;
        if (finalResult == null && lastAttempt != null && lastAttempt.column != NO_MOVE) {
            finalResult = lastAttempt;
        }
        if (finalResult == null) {
            finalResult = fallback();
        }

        long totalVisited = visitedNodes;
        boolean timedOut = aborted;
        RootResult chosen = finalResult;
        LOGGER.fine(() -> String.format("Search explored %d nodes (depth=%d, column=%d, score=%d, timedOut=%s)",
                totalVisited, chosen.depth, chosen.column, chosen.score, timedOut));

        return new SearchResult(chosen.column, chosen.score, chosen.depth, totalVisited, timedOut,
                new SearchTelemetry(iterations));
    }

    private RootResult searchRoot(int depth) {
        visitedNodes++;
        int alpha = -INFINITY;
        int beta = INFINITY;
        int bestColumn = NO_MOVE;
        int bestScore = -INFINITY;

        int moveCount = searchState.generateMoves(board, 0);
        for (int i = 0; i < moveCount; i++) {
            int column = searchState.moveAt(0, i);
            int score;
            board.applyMove(column);
            try {
                score = -negamax(depth - 1, -beta, -alpha, 1);
            } finally {
                board.undo();
            }
            if (aborted) {
                break;
            }

            if (score > bestScore) {
                bestScore = score;
                bestColumn = column;
                searchState.updatePv(0, column);
            }
            if (pruning == Pruning.ALPHA_BETA && score > alpha) {
                alpha = score;
            }
        }
        return new RootResult(bestColumn, bestScore, depth);
    }

    private int negamax(int depth, int alpha, int beta, int ply) {
        if (isBudgetExceeded()) {
            aborted = true;
            return 0;
        }
        visitedNodes++;

        if (depth <= 0 || board.isTerminal()) {
            searchState.clearPv(ply);
            return Evaluator.evaluate(board, board.sideToMove(), ply);
        }

        int moveCount = searchState.generateMoves(board, ply);
        int bestValue = -INFINITY;
        for (int i = 0; i < moveCount; i++) {
            int column = searchState.moveAt(ply, i);
            int score;
            board.applyMove(column);
            try {
                score = -negamax(depth - 1, -beta, -alpha, ply + 1);
            } finally {
                board.undo();
            }
            if (aborted) {
                return bestValue;
            }

            if (score > bestValue) {
                bestValue = score;
                searchState.updatePv(ply, column);
            }
            if (pruning == Pruning.ALPHA_BETA) {
                if (score > alpha) {
                    alpha = score;
                }
                if (alpha >= beta) {
                    cutoffs++;
                    break;
                }
            }
        }
        return bestValue;
    }

    private RootResult fallback() {
        int moveCount = searchState.generateMoves(board, 0);
        if (moveCount == 0) {
            throw new IllegalStateException("No legal moves available");
        }
        int score = Evaluator.evaluate(board, board.sideToMove(), 0);
        return new RootResult(searchState.moveAt(0, 0), score, 0);
    }

    private boolean isBudgetExceeded() {
        if (aborted) {
            return true;
        }
        if (nodeLimit > 0L && visitedNodes >= nodeLimit) {
            return true;
        }
        return deadline != Long.MAX_VALUE && System.nanoTime() >= deadline;
    }

    private long toTimeLimitNanos(Duration timeLimit) {
        long nanos = timeLimit.isZero() ? Long.MAX_VALUE : timeLimit.toNanos();
        return nanos <= 0L ? 1L : nanos;
    }

    private long saturatingAdd(long a, long b) {
        long result = a + b;
        if (((a ^ result) & (b ^ result)) < 0) {
            return Long.MAX_VALUE;
        }
        return result;
    }

    private void enforceMinimumThinkTime(long searchStart) {
        if (minThinkTimeNanos <= 0L) {
            return;
        }
        long remaining = minThinkTimeNanos - (System.nanoTime() - searchStart);
        if (remaining > 0L) {
            LockSupport.parkNanos(remaining);
        }
    }

    private record RootResult(int column, int score, int depth) {
    }
}
