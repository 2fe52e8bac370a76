package com.connectfour.core.ai;

/**
 * Outcome counts of a {@link Tournament} series, seen from the challenger's side.
 */
public record MatchSummary(int challengerDepth, int baselineDepth, int challengerWins, int baselineWins,
        int draws) {

    public MatchSummary {
        if (challengerWins < 0 || baselineWins < 0 || draws < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
    }

    public int games() {
        return challengerWins + baselineWins + draws;
    }

    /**
     * Returns the challenger's points per game, counting a draw as half a point.
     */
    public double challengerScore() {
        int games = games();
        return games == 0 ? 0.0 : (challengerWins + draws * 0.5) / games;
    }

    MatchSummary plus(GameOutcome outcome) {
        return switch (outcome) {
            case CHALLENGER_WIN -> new MatchSummary(challengerDepth, baselineDepth, challengerWins + 1, baselineWins,
                    draws);
            case BASELINE_WIN -> new MatchSummary(challengerDepth, baselineDepth, challengerWins, baselineWins + 1,
                    draws);
            case DRAW -> new MatchSummary(challengerDepth, baselineDepth, challengerWins, baselineWins, draws + 1);
        };
    }

    enum GameOutcome {
        CHALLENGER_WIN,
        BASELINE_WIN,
        DRAW
    }
}
