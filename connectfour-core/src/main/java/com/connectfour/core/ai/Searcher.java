package com.connectfour.core.ai;

import com.connectfour.core.Board;

/**
 * Generic interface for game tree search implementations.
 */
public interface Searcher {

    /**
     * Executes a search for the best column on the provided {@link Board} under the supplied
     * {@link SearchConstraints}. The board may be mutated during the search but is restored before
     * the method returns.
     *
     * @param board the position to analyse, with the side to move taken from the board
     * @param constraints the limits guiding the search execution
     * @return the result of the search
     */
    SearchResult search(Board board, SearchConstraints constraints);
}
