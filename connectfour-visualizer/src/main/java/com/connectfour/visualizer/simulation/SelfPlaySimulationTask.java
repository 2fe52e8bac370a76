package com.connectfour.visualizer.simulation;

import com.connectfour.core.Board;
import com.connectfour.core.ai.SearchConstraints;
import com.connectfour.core.ai.SearchResult;
import com.connectfour.core.ai.Searcher;
import com.connectfour.visualizer.model.GameFrame;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import javafx.application.Platform;
import javafx.concurrent.Task;

/**
 * Background task that plays one engine-versus-engine game with a {@link Searcher}, publishing each
 * position as it is reached.
 */
public final class SelfPlaySimulationTask extends Task<List<GameFrame>> {

    private final Searcher searcher;
    private final int depthLimit;
    private final Duration timeLimit;
    private final Consumer<GameFrame> frameListener;

    public SelfPlaySimulationTask(Searcher searcher, int depthLimit, Duration timeLimit,
            Consumer<GameFrame> frameListener) {
        this.searcher = Objects.requireNonNull(searcher, "searcher");
        if (depthLimit < 1) {
            throw new IllegalArgumentException("Depth limit must be at least 1");
        }
        this.depthLimit = depthLimit;
        this.timeLimit = Objects.requireNonNull(timeLimit, "timeLimit");
        this.frameListener = Objects.requireNonNull(frameListener, "frameListener");
    }

    @Override
    protected List<GameFrame> call() {
        boolean onFxThread;
        try {
            onFxThread = Platform.isFxApplicationThread();
        } catch (IllegalStateException ex) {
            onFxThread = false;
        }
        if (onFxThread) {
            throw new IllegalStateException("Search must not run on the JavaFX application thread");
        }

        updateMessage("Preparing...");
        updateProgress(0, Board.CELL_COUNT);

        List<GameFrame> frames = new ArrayList<>();
        Board board = new Board();
        frames.add(GameFrame.initial());
        SearchConstraints constraints = new SearchConstraints(depthLimit, timeLimit, 0L,
                SearchConstraints.Pruning.ALPHA_BETA);

        while (!board.isTerminal()) {
            if (isCancelled()) {
                updateMessage("Stopped");
                return frames;
            }

            int moveNumber = board.moveCount() + 1;
            updateMessage(String.format("Searching move %d", moveNumber));

            SearchResult result = searcher.search(board, constraints);
            board.applyMove(result.column());

            GameFrame frame = GameFrame.capture(board, result, null);
            frames.add(frame);
            Platform.runLater(() -> frameListener.accept(frame));
            updateProgress(board.moveCount(), Board.CELL_COUNT);
        }

        updateProgress(Board.CELL_COUNT, Board.CELL_COUNT);
        updateMessage("Simulation finished: " + board.status());
        return frames;
    }
}
