package com.connectfour.core.ai;

/**
 * Result payload returned by {@link Searcher} implementations.
 *
 * @param column the chosen column, or {@link SearchEngine#NO_MOVE} for a finished game
 * @param score  evaluation from the perspective of the side that was to move
 */
public record SearchResult(int column, int score, int depthEvaluated, long visitedNodes, boolean timedOut,
        SearchTelemetry telemetry) {

    public SearchResult {
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
    }

    public boolean hasMove() {
        return column != SearchEngine.NO_MOVE;
    }
}
