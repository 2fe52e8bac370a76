package com.connectfour.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.connectfour.core.GameStatus;
import com.connectfour.core.Player;
import java.util.List;
import org.junit.jupiter.api.Test;

class TournamentTest {

    @Test
    void deeperSearchWinsMoreGames() {
        Tournament tournament = new Tournament();
        List<String> openings = Tournament.singleMoveOpenings();

        MatchSummary summary = tournament.playSeries(4, 2, openings);

        assertEquals(2 * openings.size(), summary.games());
        assertTrue(summary.challengerWins() > summary.baselineWins(),
                () -> "Depth 4 should beat depth 2 but got " + summary);
        assertTrue(summary.challengerScore() > 0.5);
    }

    @Test
    void everyGameReachesAResult() {
        GameStatus status = new Tournament().playGame("33", Player.SECOND, 3, 1);
        assertTrue(status.isFinished());
    }

    @Test
    void providesOneOpeningPerColumn() {
        assertEquals(List.of("0", "1", "2", "3", "4", "5", "6"), Tournament.singleMoveOpenings());
    }

    @Test
    void rejectsInvalidSeries() {
        Tournament tournament = new Tournament();
        assertThrows(IllegalArgumentException.class, () -> tournament.playSeries(0, 2, List.of("3")));
        assertThrows(IllegalArgumentException.class, () -> tournament.playSeries(4, 2, List.of()));
    }

    @Test
    void summaryCountsHalfPointsForDraws() {
        MatchSummary summary = new MatchSummary(4, 2, 3, 1, 2);
        assertEquals(6, summary.games());
        assertEquals(4.0 / 6, summary.challengerScore(), 1e-9);
        assertEquals(0.0, new MatchSummary(4, 2, 0, 0, 0).challengerScore());
    }
}
