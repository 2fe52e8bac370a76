package com.connectfour.visualizer.settings;

import com.connectfour.core.Difficulty;
import com.connectfour.visualizer.ui.Theme;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * User preferences of the visualizer, stored as a properties file between runs.
 *
 * @param timeLimitMillis    engine time budget per move, {@code 0} for none
 * @param minThinkTimeMillis minimum duration of an engine move
 */
public record VisualizerSettings(Difficulty difficulty, Theme theme, int timeLimitMillis, int minThinkTimeMillis) {

    public static final Path DEFAULT_PATH =
            Paths.get(System.getProperty("user.home"), ".connectfour", "visualizer.properties");
    public static final VisualizerSettings DEFAULTS = new VisualizerSettings(Difficulty.MEDIUM, Theme.CLASSIC, 2000, 75);

    static final String DIFFICULTY_KEY = "difficulty";
    static final String THEME_KEY = "theme";
    static final String TIME_LIMIT_KEY = "timeLimitMillis";
    static final String MIN_THINK_TIME_KEY = "minThinkTimeMillis";

    private static final Logger LOGGER = Logger.getLogger(VisualizerSettings.class.getName());

    public VisualizerSettings {
        Objects.requireNonNull(difficulty, "difficulty");
        Objects.requireNonNull(theme, "theme");
        if (timeLimitMillis < 0 || minThinkTimeMillis < 0) {
            throw new IllegalArgumentException("Durations must be non-negative");
        }
    }

    /**
     * Reads settings from {@code path}. A missing file yields {@link #DEFAULTS}; unreadable files and
     * malformed entries are logged and replaced by their defaults.
     */
    public static VisualizerSettings load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            return DEFAULTS;
        }
        Properties properties = new Properties();
        try (InputStream input = Files.newInputStream(path)) {
            properties.load(input);
        } catch (IOException | IllegalArgumentException ex) {
            LOGGER.log(Level.WARNING, "Failed to load visualizer settings from " + path, ex);
            return DEFAULTS;
        }

        Difficulty difficulty = DEFAULTS.difficulty();
        String difficultyValue = properties.getProperty(DIFFICULTY_KEY);
        if (difficultyValue != null) {
            try {
                difficulty = Difficulty.fromLabel(difficultyValue);
            } catch (IllegalArgumentException ex) {
                LOGGER.log(Level.WARNING, "Ignoring unknown difficulty: {0}", difficultyValue);
            }
        }

        Theme theme = DEFAULTS.theme();
        String themeValue = properties.getProperty(THEME_KEY);
        if (themeValue != null) {
            try {
                theme = Theme.fromLabel(themeValue);
            } catch (IllegalArgumentException ex) {
                LOGGER.log(Level.WARNING, "Ignoring unknown theme: {0}", themeValue);
            }
        }

        int timeLimit = readMillis(properties, TIME_LIMIT_KEY, DEFAULTS.timeLimitMillis());
        int minThinkTime = readMillis(properties, MIN_THINK_TIME_KEY, DEFAULTS.minThinkTimeMillis());
        if (timeLimit > 0 && minThinkTime > timeLimit) {
            LOGGER.warning(() -> String.format("Minimum think time %d ms exceeds time limit %d ms, clamping",
                    minThinkTime, timeLimit));
            return new VisualizerSettings(difficulty, theme, timeLimit, timeLimit);
        }
        return new VisualizerSettings(difficulty, theme, timeLimit, minThinkTime);
    }

    /**
     * Writes the settings to {@code path}, creating parent directories as needed.
     *
     * @return {@code false} if the file could not be written; the failure is logged
     */
    public boolean save(Path path) {
        Objects.requireNonNull(path, "path");
        Properties properties = new Properties();
        properties.setProperty(DIFFICULTY_KEY, difficulty.name().toLowerCase(Locale.ROOT));
        properties.setProperty(THEME_KEY, theme.name().toLowerCase(Locale.ROOT));
        properties.setProperty(TIME_LIMIT_KEY, Integer.toString(timeLimitMillis));
        properties.setProperty(MIN_THINK_TIME_KEY, Integer.toString(minThinkTimeMillis));

        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream output = Files.newOutputStream(path)) {
                properties.store(output, "Connect Four visualizer settings");
            }
            LOGGER.fine(() -> "Saved visualizer settings to " + path);
            return true;
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to save visualizer settings to " + path, ex);
            return false;
        }
    }

    public VisualizerSettings withDifficulty(Difficulty difficulty) {
        return new VisualizerSettings(difficulty, theme, timeLimitMillis, minThinkTimeMillis);
    }

    public VisualizerSettings withTheme(Theme theme) {
        return new VisualizerSettings(difficulty, theme, timeLimitMillis, minThinkTimeMillis);
    }

    public VisualizerSettings withTimings(int timeLimitMillis, int minThinkTimeMillis) {
        return new VisualizerSettings(difficulty, theme, timeLimitMillis, minThinkTimeMillis);
    }

    private static int readMillis(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed >= 0) {
                return parsed;
            }
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.FINE, "Malformed value for " + key, ex);
        }
        LOGGER.log(Level.WARNING, "Ignoring invalid {0}: {1}", new Object[] {key, value});
        return fallback;
    }
}
