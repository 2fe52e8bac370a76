package com.connectfour.visualizer.ui;

import java.util.Locale;
import java.util.Objects;
import javafx.scene.paint.Color;

/**
 * Colour sets for the board view.
 */
public enum Theme {
    CLASSIC("Classic", "#0074D9", "#FFFFFF", "#FF4136", "#FFDC00", "#111111", "#F0F0F0"),
    DARK("Dark", "#2C3E50", "#34495E", "#E74C3C", "#F39C12", "#ECF0F1", "#1A1A1A"),
    OCEAN("Ocean", "#006994", "#87CEEB", "#FF6B6B", "#4ECDC4", "#003F5C", "#E8F4F8"),
    FOREST("Forest", "#2D5016", "#90EE90", "#8B0000", "#FFD700", "#1B4D0E", "#F0FFF0");

    private final String label;
    private final String frame;
    private final String hole;
    private final String firstDisc;
    private final String secondDisc;
    private final String highlight;
    private final String background;

    Theme(String label, String frame, String hole, String firstDisc, String secondDisc, String highlight,
            String background) {
        this.label = label;
        this.frame = frame;
        this.hole = hole;
        this.firstDisc = firstDisc;
        this.secondDisc = secondDisc;
        this.highlight = highlight;
        this.background = background;
    }

    public String label() {
        return label;
    }

    public Color frameColor() {
        return Color.web(frame);
    }

    public Color holeColor() {
        return Color.web(hole);
    }

    public Color firstDiscColor() {
        return Color.web(firstDisc);
    }

    public Color secondDiscColor() {
        return Color.web(secondDisc);
    }

    /** Stroke for winning discs and the last-move marker. */
    public Color highlightColor() {
        return Color.web(highlight);
    }

    public String backgroundStyle() {
        return "-fx-background-color: " + background + ";";
    }

    public static Theme fromLabel(String label) {
        Objects.requireNonNull(label, "label");
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (Theme theme : values()) {
            if (theme.name().equals(normalized)) {
                return theme;
            }
        }
        throw new IllegalArgumentException("Unknown theme: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
