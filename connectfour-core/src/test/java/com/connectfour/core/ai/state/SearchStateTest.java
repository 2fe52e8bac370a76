package com.connectfour.core.ai.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.connectfour.core.Board;
import java.util.List;
import org.junit.jupiter.api.Test;

class SearchStateTest {

    @Test
    void keepsSeparateBuffersPerPly() {
        SearchState state = new SearchState();
        state.generateMoves(new Board(), 0);
        state.generateMoves(Board.fromMoves("333333"), 1);

        assertEquals(7, state.moveCount(0));
        assertEquals(6, state.moveCount(1));
        assertEquals(3, state.moveAt(0, 0));
        assertEquals(2, state.moveAt(1, 0));
    }

    @Test
    void buildsPrincipalVariationFromChildLines() {
        SearchState state = new SearchState();
        state.clearPv(2);
        state.updatePv(1, 4);
        state.updatePv(0, 3);

        assertEquals(List.of(3, 4), state.principalVariation(0));
        assertEquals(List.of(4), state.principalVariation(1));
    }

    @Test
    void resetClearsLines() {
        SearchState state = new SearchState();
        state.updatePv(0, 5);
        state.reset();

        assertTrue(state.principalVariation(0).isEmpty());
    }
}
