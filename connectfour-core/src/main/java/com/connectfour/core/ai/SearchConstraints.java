package com.connectfour.core.ai;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable search configuration passed to {@link Searcher} implementations.
 *
 * @param depthLimit maximum number of plies to look ahead
 * @param timeLimit  wall clock budget, {@link Duration#ZERO} for none
 * @param nodeLimit  maximum number of visited nodes, {@code 0} for none
 * @param pruning    whether alpha-beta cutoffs are applied
 */
public record SearchConstraints(int depthLimit, Duration timeLimit, long nodeLimit, Pruning pruning) {

    public SearchConstraints {
        Objects.requireNonNull(timeLimit, "timeLimit");
        Objects.requireNonNull(pruning, "pruning");
        if (depthLimit < 1) {
            throw new IllegalArgumentException("depthLimit must be at least 1");
        }
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must not be negative");
        }
        if (nodeLimit < 0L) {
            throw new IllegalArgumentException("nodeLimit must not be negative");
        }
    }

    /**
     * Unbounded alpha-beta search to the given depth.
     */
    public static SearchConstraints ofDepth(int depthLimit) {
        return new SearchConstraints(depthLimit, Duration.ZERO, 0L, Pruning.ALPHA_BETA);
    }

    public SearchConstraints withPruning(Pruning pruning) {
        return new SearchConstraints(depthLimit, timeLimit, nodeLimit, pruning);
    }

    /**
     * Tree traversal variant. Both produce identical results; {@link #NONE} visits every node.
     */
    public enum Pruning {
        ALPHA_BETA,
        NONE
    }
}
