package com.connectfour.core.ai;

import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point for running {@link Tournament} series with configurable parameters.
 */
public final class TournamentRunner {

    private static final Logger LOGGER = Logger.getLogger(TournamentRunner.class.getName());

    private TournamentRunner() {
    }

    public static void main(String[] args) {
        if (args.length < 2 || args.length > 4) {
            printUsage();
            return;
        }
        try {
            int challengerDepth = Integer.parseInt(args[0]);
            int baselineDepth = Integer.parseInt(args[1]);
            long timeLimitMillis = 0L;
            long nodeLimit = 0L;

            for (int index = 2; index < args.length; index++) {
                String option = args[index];
                if (option.startsWith("--timeLimitMillis=")) {
                    timeLimitMillis = Long.parseLong(option.substring("--timeLimitMillis=".length()));
                } else if (option.startsWith("--nodeLimit=")) {
                    nodeLimit = Long.parseLong(option.substring("--nodeLimit=".length()));
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }

            if (timeLimitMillis < 0L) {
                throw new IllegalArgumentException("timeLimitMillis must be non-negative");
            }

            SearchEngine engine = new SearchEngine(Duration.ofMillis(timeLimitMillis), nodeLimit, Duration.ZERO);
            MatchSummary summary = new Tournament(engine).playSeries(challengerDepth, baselineDepth,
                    Tournament.singleMoveOpenings());
            System.out.printf("Depth %d vs depth %d: %d wins, %d losses, %d draws (score %.2f)%n",
                    summary.challengerDepth(), summary.baselineDepth(), summary.challengerWins(),
                    summary.baselineWins(), summary.draws(), summary.challengerScore());
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
        }
    }

    private static void printUsage() {
        System.err.println(
                "Usage: TournamentRunner <challengerDepth> <baselineDepth> [--timeLimitMillis=<value>] "
                        + "[--nodeLimit=<value>]");
    }
}
