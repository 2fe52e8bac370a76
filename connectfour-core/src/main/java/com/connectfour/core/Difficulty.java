package com.connectfour.core;

import java.util.Locale;
import java.util.Objects;

/**
 * Difficulty labels offered by the front-ends and the search depth each one maps to.
 */
public enum Difficulty {
    EASY("Easy", 2),
    MEDIUM("Medium", 4),
    HARD("Hard", 6),
    EXPERT("Expert", 8),
    INSANE("Insane", 10);

    private final String label;
    private final int depth;

    Difficulty(String label, int depth) {
        this.label = label;
        this.depth = depth;
    }

    public String label() {
        return label;
    }

    public int depth() {
        return depth;
    }

    /**
     * Resolves a label case-insensitively, e.g. {@code "hard"} or {@code "HARD"}.
     *
     * @throws IllegalArgumentException if no difficulty carries that label
     */
    public static Difficulty fromLabel(String label) {
        Objects.requireNonNull(label, "label");
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (Difficulty difficulty : values()) {
            if (difficulty.name().equals(normalized)) {
                return difficulty;
            }
        }
        throw new IllegalArgumentException("Unknown difficulty: " + label);
    }

    @Override
    public String toString() {
        return label + " (depth " + depth + ")";
    }
}
