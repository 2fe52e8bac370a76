package com.connectfour.visualizer.settings;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.connectfour.core.Difficulty;
import com.connectfour.visualizer.ui.Theme;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VisualizerSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileYieldsDefaults() {
        assertSame(VisualizerSettings.DEFAULTS, VisualizerSettings.load(tempDir.resolve("absent.properties")));
    }

    @Test
    void persistsSettingsToDisk() {
        Path file = tempDir.resolve("nested").resolve("visualizer.properties");
        VisualizerSettings settings = new VisualizerSettings(Difficulty.EXPERT, Theme.OCEAN, 1500, 100);

        assertTrue(settings.save(file));
        assertTrue(Files.exists(file));

        assertEquals(settings, VisualizerSettings.load(file));
    }

    @Test
    void malformedEntriesFallBackIndividually() throws IOException {
        Path file = tempDir.resolve("broken.properties");
        Files.writeString(file, String.join("\n",
                "difficulty=grandmaster",
                "theme=dark",
                "timeLimitMillis=soon",
                "minThinkTimeMillis=-5"), StandardCharsets.ISO_8859_1);

        VisualizerSettings settings = VisualizerSettings.load(file);

        assertEquals(VisualizerSettings.DEFAULTS.difficulty(), settings.difficulty());
        assertEquals(Theme.DARK, settings.theme());
        assertEquals(VisualizerSettings.DEFAULTS.timeLimitMillis(), settings.timeLimitMillis());
        assertEquals(VisualizerSettings.DEFAULTS.minThinkTimeMillis(), settings.minThinkTimeMillis());
    }

    @Test
    void clampsThinkTimeToTimeLimit() throws IOException {
        Path file = tempDir.resolve("timings.properties");
        Files.writeString(file, "timeLimitMillis=100\nminThinkTimeMillis=400\n", StandardCharsets.ISO_8859_1);

        VisualizerSettings settings = VisualizerSettings.load(file);

        assertEquals(100, settings.timeLimitMillis());
        assertEquals(100, settings.minThinkTimeMillis());
    }

    @Test
    void reportsFailedSave() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        assertFalse(VisualizerSettings.DEFAULTS.save(blocker.resolve("visualizer.properties")));
    }

    @Test
    void rejectsNegativeDurations() {
        assertThrows(IllegalArgumentException.class,
                () -> new VisualizerSettings(Difficulty.EASY, Theme.CLASSIC, -1, 0));
    }

    @Test
    void copiesWithSingleFieldChanged() {
        VisualizerSettings settings = VisualizerSettings.DEFAULTS
                .withDifficulty(Difficulty.HARD)
                .withTheme(Theme.DARK)
                .withTimings(0, 50);

        assertEquals(new VisualizerSettings(Difficulty.HARD, Theme.DARK, 0, 50), settings);
    }
}
