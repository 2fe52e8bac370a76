package com.connectfour.visualizer.ui;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import javafx.scene.paint.Color;
import org.junit.jupiter.api.Test;

class ThemeTest {

    @Test
    void offersFourColourSets() {
        assertArrayEquals(new Theme[] {Theme.CLASSIC, Theme.DARK, Theme.OCEAN, Theme.FOREST}, Theme.values());
        assertEquals("Forest", Theme.FOREST.label());
        assertEquals("Classic", Theme.CLASSIC.toString());
    }

    @Test
    void resolvesLabelsIgnoringCase() {
        assertSame(Theme.OCEAN, Theme.fromLabel("ocean"));
        assertSame(Theme.DARK, Theme.fromLabel("Dark"));
        assertSame(Theme.FOREST, Theme.fromLabel("forest"));
        assertThrows(IllegalArgumentException.class, () -> Theme.fromLabel("neon"));
    }

    @Test
    void classicUsesTraditionalColours() {
        assertEquals(Color.web("#0074D9"), Theme.CLASSIC.frameColor());
        assertEquals(Color.web("#FF4136"), Theme.CLASSIC.firstDiscColor());
        assertEquals(Color.web("#FFDC00"), Theme.CLASSIC.secondDiscColor());
        assertEquals("-fx-background-color: #F0F0F0;", Theme.CLASSIC.backgroundStyle());
    }

    @Test
    void discsAreDistinguishable() {
        for (Theme theme : Theme.values()) {
            assertNotEquals(theme.firstDiscColor(), theme.secondDiscColor(), theme.label());
            assertNotEquals(theme.holeColor(), theme.firstDiscColor(), theme.label());
            assertNotEquals(theme.holeColor(), theme.secondDiscColor(), theme.label());
        }
    }
}
