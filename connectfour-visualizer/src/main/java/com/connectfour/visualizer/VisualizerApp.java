package com.connectfour.visualizer;

import com.connectfour.core.Board;
import com.connectfour.core.Difficulty;
import com.connectfour.core.Player;
import com.connectfour.core.ai.SearchEngine;
import com.connectfour.core.ai.SearchResult;
import com.connectfour.visualizer.model.GameFrame;
import com.connectfour.visualizer.settings.VisualizerSettings;
import com.connectfour.visualizer.simulation.SelfPlaySimulationTask;
import com.connectfour.visualizer.ui.BoardView;
import com.connectfour.visualizer.ui.StatsPane;
import com.connectfour.visualizer.ui.Theme;
import java.time.Duration;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javafx.animation.KeyFrame;
import javafx.animation.Timeline;
import javafx.application.Application;
import javafx.beans.binding.Bindings;
import javafx.beans.property.BooleanProperty;
import javafx.beans.property.IntegerProperty;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.SimpleBooleanProperty;
import javafx.beans.property.SimpleIntegerProperty;
import javafx.beans.property.SimpleObjectProperty;
import javafx.collections.FXCollections;
import javafx.collections.ObservableList;
import javafx.concurrent.Task;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.ComboBox;
import javafx.scene.control.Label;
import javafx.scene.control.ProgressBar;
import javafx.scene.control.Spinner;
import javafx.scene.control.SpinnerValueFactory;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.FlowPane;
import javafx.stage.Stage;

public final class VisualizerApp extends Application {

    private static final int ANALYSIS_DEPTH = 6;
    private static final Duration PLAYBACK_INTERVAL = Duration.ofMillis(400);
    private static final Logger LOGGER = Logger.getLogger(VisualizerApp.class.getName());

    private enum ControllerType {
        HUMAN("Human"),
        AI("AI");

        private final String label;

        ControllerType(String label) {
            this.label = label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    private record EngineMove(SearchResult result, int[] columnScores) {
    }

    private final ObservableList<GameFrame> frames = FXCollections.observableArrayList();
    private final IntegerProperty currentIndex = new SimpleIntegerProperty(0);
    private final ObjectProperty<GameFrame> currentFrame = new SimpleObjectProperty<>();
    private final BooleanProperty playing = new SimpleBooleanProperty(false);
    private final BooleanProperty simulationRunning = new SimpleBooleanProperty(false);
    private final BooleanProperty matchRunning = new SimpleBooleanProperty(false);
    private final BooleanProperty aiTurnInProgress = new SimpleBooleanProperty(false);

    private VisualizerSettings settings = VisualizerSettings.DEFAULTS;
    private Timeline playbackTimeline;
    private BoardView boardView;
    private StatsPane statsPane;
    private ComboBox<Difficulty> difficultyComboBox;
    private ComboBox<Theme> themeComboBox;
    private ComboBox<ControllerType> firstControllerComboBox;
    private ComboBox<ControllerType> secondControllerComboBox;
    private Spinner<Integer> timeLimitSpinner;
    private Spinner<Integer> minThinkTimeSpinner;
    private ProgressBar progressBar;
    private Label statusLabel;
    private Board activeBoard;
    private Task<EngineMove> aiMoveTask;
    private SelfPlaySimulationTask simulationTask;
    private int matchGeneration;

    public static void main(String[] args) {
        launch(args);
    }

    @Override
    public void start(Stage stage) {
        settings = VisualizerSettings.load(VisualizerSettings.DEFAULT_PATH);

        boardView = new BoardView();
        boardView.setInteractive(false);
        boardView.setOnColumnClicked(this::handleHumanMove);
        boardView.applyTheme(settings.theme());
        statsPane = new StatsPane();

        setupIndexListener();
        setupPlaybackTimeline();

        currentFrame.addListener((obs, oldFrame, newFrame) -> {
            boardView.update(newFrame);
            statsPane.update(newFrame);
        });

        GameFrame initialFrame = GameFrame.initial();
        frames.setAll(initialFrame);
        currentFrame.set(initialFrame);
        currentIndex.set(0);

        BorderPane root = new BorderPane();
        root.setPadding(new Insets(16));
        root.setCenter(boardView);
        BorderPane.setAlignment(boardView, Pos.CENTER);
        root.setRight(statsPane);
        BorderPane.setMargin(statsPane, new Insets(0, 0, 0, 16));

        FlowPane controls = buildControls();
        root.setBottom(controls);
        BorderPane.setMargin(controls, new Insets(16, 0, 0, 0));

        Scene scene = new Scene(root, 1100, 760);
        stage.setTitle("Connect Four Visualizer");
        stage.setScene(scene);
        stage.setMinWidth(900);
        stage.setMinHeight(680);
        stage.show();
    }

    @Override
    public void stop() {
        if (aiMoveTask != null) {
            aiMoveTask.cancel(true);
        }
        if (simulationTask != null) {
            simulationTask.cancel(true);
        }
        readSettingsFromControls().save(VisualizerSettings.DEFAULT_PATH);
    }

    private void setupIndexListener() {
        currentIndex.addListener((obs, oldValue, newValue) -> {
            if (frames.isEmpty()) {
                currentFrame.set(null);
                return;
            }
            int requested = newValue.intValue();
            int clamped = Math.max(0, Math.min(requested, frames.size() - 1));
            if (clamped != requested) {
                currentIndex.set(clamped);
                return;
            }
            currentFrame.set(frames.get(clamped));
        });
    }

    private void setupPlaybackTimeline() {
        playbackTimeline = new Timeline(new KeyFrame(
                javafx.util.Duration.millis(PLAYBACK_INTERVAL.toMillis()),
                event -> advanceFrame()));
        playbackTimeline.setCycleCount(Timeline.INDEFINITE);
    }

    private FlowPane buildControls() {
        Button simulateButton = new Button("Run simulation");
        simulateButton.setOnAction(event -> runSimulation());

        Button startGameButton = new Button("Start game");
        startGameButton.setOnAction(event -> startMatch());

        Button stopGameButton = new Button("Stop game");
        stopGameButton.setOnAction(event -> stopMatch("Ready"));

        Button undoButton = new Button("Undo");
        undoButton.setOnAction(event -> undoMove());

        Button resetButton = new Button("|<");
        resetButton.setOnAction(event -> {
            pausePlayback();
            currentIndex.set(0);
        });

        Button previousButton = new Button("<");
        previousButton.setOnAction(event -> {
            pausePlayback();
            currentIndex.set(Math.max(0, currentIndex.get() - 1));
        });

        Button nextButton = new Button(">");
        nextButton.setOnAction(event -> {
            pausePlayback();
            currentIndex.set(Math.min(frames.size() - 1, currentIndex.get() + 1));
        });

        Button playButton = new Button("Play");
        playButton.setOnAction(event -> startPlayback());

        Button pauseButton = new Button("Pause");
        pauseButton.setOnAction(event -> pausePlayback());

        difficultyComboBox = new ComboBox<>();
        difficultyComboBox.getItems().setAll(Difficulty.values());
        difficultyComboBox.setValue(settings.difficulty());

        themeComboBox = new ComboBox<>();
        themeComboBox.getItems().setAll(Theme.values());
        themeComboBox.setValue(settings.theme());
        themeComboBox.valueProperty().addListener((obs, oldValue, newValue) -> {
            if (newValue != null) {
                boardView.applyTheme(newValue);
            }
        });

        timeLimitSpinner = new Spinner<>();
        timeLimitSpinner.setValueFactory(new SpinnerValueFactory.IntegerSpinnerValueFactory(0, 60000,
                settings.timeLimitMillis(), 100));
        timeLimitSpinner.setEditable(true);
        timeLimitSpinner.setPrefWidth(110);

        minThinkTimeSpinner = new Spinner<>();
        minThinkTimeSpinner.setValueFactory(new SpinnerValueFactory.IntegerSpinnerValueFactory(0, 5000,
                settings.minThinkTimeMillis(), 25));
        minThinkTimeSpinner.setEditable(true);
        minThinkTimeSpinner.setPrefWidth(100);

        firstControllerComboBox = new ComboBox<>();
        firstControllerComboBox.getItems().setAll(ControllerType.values());
        firstControllerComboBox.setValue(ControllerType.HUMAN);

        secondControllerComboBox = new ComboBox<>();
        secondControllerComboBox.getItems().setAll(ControllerType.values());
        secondControllerComboBox.setValue(ControllerType.AI);

        progressBar = new ProgressBar(0);
        progressBar.setPrefWidth(160);

        statusLabel = new Label("Ready");
        statusLabel.setMinWidth(180);

        FlowPane controls = new FlowPane(12, 8,
                startGameButton,
                stopGameButton,
                undoButton,
                simulateButton,
                new Label("Difficulty:"),
                difficultyComboBox,
                new Label("First:"),
                firstControllerComboBox,
                new Label("Second:"),
                secondControllerComboBox,
                new Label("Time limit (ms):"),
                timeLimitSpinner,
                new Label("Min. think time (ms):"),
                minThinkTimeSpinner,
                new Label("Theme:"),
                themeComboBox,
                resetButton,
                previousButton,
                nextButton,
                playButton,
                pauseButton,
                progressBar,
                statusLabel);
        controls.setAlignment(Pos.CENTER_LEFT);

        var frameCount = Bindings.size(frames);
        var busy = simulationRunning.or(matchRunning);
        previousButton.disableProperty().bind(Bindings.createBooleanBinding(
                () -> currentIndex.get() <= 0, currentIndex, frameCount).or(busy));
        resetButton.disableProperty().bind(Bindings.createBooleanBinding(
                () -> currentIndex.get() <= 0, currentIndex, frameCount).or(busy));
        nextButton.disableProperty().bind(Bindings.createBooleanBinding(
                () -> currentIndex.get() >= frames.size() - 1, currentIndex, frameCount).or(busy));
        playButton.disableProperty().bind(playing.or(frameCount.lessThanOrEqualTo(1)).or(busy));
        pauseButton.disableProperty().bind(playing.not());
        simulateButton.disableProperty().bind(busy);
        startGameButton.disableProperty().bind(busy);
        stopGameButton.disableProperty().bind(matchRunning.not());
        undoButton.disableProperty().bind(simulationRunning.or(frameCount.lessThanOrEqualTo(1)));
        difficultyComboBox.disableProperty().bind(busy);
        timeLimitSpinner.disableProperty().bind(busy);
        minThinkTimeSpinner.disableProperty().bind(busy);

        return controls;
    }

    private void startPlayback() {
        if (frames.size() <= 1) {
            return;
        }
        if (currentIndex.get() >= frames.size() - 1) {
            currentIndex.set(0);
        }
        playing.set(true);
        playbackTimeline.play();
    }

    private void pausePlayback() {
        playbackTimeline.stop();
        playing.set(false);
    }

    private void advanceFrame() {
        int next = currentIndex.get() + 1;
        if (next >= frames.size()) {
            pausePlayback();
            return;
        }
        currentIndex.set(next);
    }

    private void runSimulation() {
        pausePlayback();
        stopMatch("Ready");
        settings = readSettingsFromControls();

        frames.setAll(GameFrame.initial());
        currentIndex.set(0);
        currentFrame.set(frames.get(0));
        activeBoard = null;

        SearchEngine engine = new SearchEngine(Duration.ofMillis(settings.timeLimitMillis()), 0L,
                Duration.ofMillis(settings.minThinkTimeMillis()));
        SelfPlaySimulationTask task = new SelfPlaySimulationTask(engine, settings.difficulty().depth(),
                Duration.ofMillis(settings.timeLimitMillis()), frame -> {
            if (simulationRunning.get()) {
                frames.add(frame);
                currentIndex.set(frames.size() - 1);
            }
        });
        simulationTask = task;
        simulationRunning.set(true);
        progressBar.progressProperty().bind(task.progressProperty());
        statusLabel.textProperty().bind(task.messageProperty());

        task.setOnSucceeded(event -> {
            cleanupSimulationBindings();
            List<GameFrame> result = task.getValue();
            frames.setAll(result);
            currentIndex.set(frames.size() - 1);
            currentFrame.set(frames.get(frames.size() - 1));
            progressBar.setProgress(1.0);
            statusLabel.setText(describeOutcome(currentFrame.get()));
        });
        task.setOnFailed(event -> {
            cleanupSimulationBindings();
            Throwable error = task.getException();
            LOGGER.log(Level.SEVERE, "Simulation failed", error);
            statusLabel.setText(error == null ? "Error" : "Error: " + error.getMessage());
        });
        task.setOnCancelled(event -> {
            cleanupSimulationBindings();
            statusLabel.setText("Cancelled");
        });

        Thread thread = new Thread(task, "connectfour-visualizer-simulation");
        thread.setDaemon(true);
        thread.start();
    }

    private void cleanupSimulationBindings() {
        simulationRunning.set(false);
        simulationTask = null;
        progressBar.progressProperty().unbind();
        statusLabel.textProperty().unbind();
        progressBar.setProgress(0);
    }

    private void startMatch() {
        pausePlayback();
        stopMatch("Ready");
        settings = readSettingsFromControls();
        settings.save(VisualizerSettings.DEFAULT_PATH);

        activeBoard = new Board();
        frames.setAll(GameFrame.initial());
        currentIndex.set(0);
        currentFrame.set(frames.get(0));

        matchRunning.set(true);
        statusLabel.setText("Game started");
        LOGGER.info(() -> String.format("Starting game: %s, first=%s, second=%s", settings.difficulty(),
                firstControllerComboBox.getValue(), secondControllerComboBox.getValue()));
        proceedWithCurrentTurn();
    }

    private void stopMatch(String message) {
        matchGeneration++;
        matchRunning.set(false);
        cancelAiTurn();
        boardView.setInteractive(false);
        progressBar.progressProperty().unbind();
        statusLabel.textProperty().unbind();
        progressBar.setProgress(0);
        statusLabel.setText(message);
    }

    private void cancelAiTurn() {
        aiTurnInProgress.set(false);
        if (aiMoveTask != null) {
            aiMoveTask.cancel(true);
            aiMoveTask = null;
        }
    }

    private void proceedWithCurrentTurn() {
        if (!matchRunning.get() || activeBoard == null) {
            boardView.setInteractive(false);
            return;
        }
        if (activeBoard.isTerminal()) {
            finishMatch();
            return;
        }
        if (isAiTurn()) {
            runAiTurn();
        } else {
            progressBar.setProgress(0);
            statusLabel.setText(String.format("Your move (%c)", activeBoard.sideToMove().symbol()));
            boardView.setInteractive(true);
        }
    }

    private void finishMatch() {
        String outcome = describeOutcome(currentFrame.get());
        matchRunning.set(false);
        aiTurnInProgress.set(false);
        boardView.setInteractive(false);
        progressBar.setProgress(1.0);
        statusLabel.setText(outcome);
        LOGGER.info(() -> "Game finished: " + outcome);
    }

    private boolean isAiTurn() {
        return controllerFor(activeBoard.sideToMove()) == ControllerType.AI;
    }

    private ControllerType controllerFor(Player player) {
        return player == Player.FIRST ? firstControllerComboBox.getValue() : secondControllerComboBox.getValue();
    }

    private void handleHumanMove(int column) {
        if (!matchRunning.get() || aiTurnInProgress.get() || activeBoard == null || isAiTurn()) {
            return;
        }
        if (!activeBoard.canPlay(column)) {
            statusLabel.setText("Column " + column + " is full");
            return;
        }
        applyMove(column, null, null);
    }

    private void runAiTurn() {
        aiTurnInProgress.set(true);
        boardView.setInteractive(false);

        Board snapshot = activeBoard.copy();
        int depth = settings.difficulty().depth();
        int generation = matchGeneration;
        SearchEngine engine = new SearchEngine(Duration.ofMillis(settings.timeLimitMillis()), 0L,
                Duration.ofMillis(settings.minThinkTimeMillis()));

        Task<EngineMove> task = new Task<>() {
            @Override
            protected EngineMove call() {
                updateMessage(String.format("Engine thinking (%c)...", snapshot.sideToMove().symbol()));
                updateProgress(-1, 1);
                int[] columnScores = engine.analyse(snapshot, Math.min(depth, ANALYSIS_DEPTH));
                SearchResult result = engine.bestMove(snapshot, depth);
                return new EngineMove(result, columnScores);
            }
        };
        aiMoveTask = task;
        progressBar.progressProperty().bind(task.progressProperty());
        statusLabel.textProperty().bind(task.messageProperty());

        task.setOnSucceeded(event -> {
            if (generation != matchGeneration) {
                return;
            }
            cleanupAiTaskBindings();
            EngineMove move = task.getValue();
            applyMove(move.result().column(), move.result(), move.columnScores());
        });
        task.setOnFailed(event -> {
            if (generation != matchGeneration) {
                return;
            }
            cleanupAiTaskBindings();
            LOGGER.log(Level.SEVERE, "Engine move failed", task.getException());
            stopMatch("Engine error");
        });

        Thread thread = new Thread(task, "connectfour-visualizer-ai-turn");
        thread.setDaemon(true);
        thread.start();
    }

    private void cleanupAiTaskBindings() {
        aiTurnInProgress.set(false);
        aiMoveTask = null;
        progressBar.progressProperty().unbind();
        statusLabel.textProperty().unbind();
        progressBar.setProgress(0);
    }

    private void applyMove(int column, SearchResult result, int[] columnScores) {
        activeBoard.applyMove(column);
        GameFrame frame = GameFrame.capture(activeBoard, result, columnScores);
        frames.add(frame);
        currentIndex.set(frames.size() - 1);
        currentFrame.set(frame);
        proceedWithCurrentTurn();
    }

    /**
     * Takes back moves until a human is to move again, or a single move when both sides are engines.
     * A finished game is resumed.
     */
    private void undoMove() {
        if (activeBoard == null || activeBoard.moveCount() == 0) {
            return;
        }
        pausePlayback();
        matchGeneration++;
        cancelAiTurn();
        progressBar.progressProperty().unbind();
        statusLabel.textProperty().unbind();

        boolean engineOnly = controllerFor(Player.FIRST) == ControllerType.AI
                && controllerFor(Player.SECOND) == ControllerType.AI;
        activeBoard.undo();
        while (!engineOnly && activeBoard.moveCount() > 0 && isAiTurn()) {
            activeBoard.undo();
        }

        frames.remove(activeBoard.moveCount() + 1, frames.size());
        currentIndex.set(frames.size() - 1);
        currentFrame.set(frames.get(frames.size() - 1));
        matchRunning.set(true);
        proceedWithCurrentTurn();
    }

    private VisualizerSettings readSettingsFromControls() {
        Difficulty difficulty = difficultyComboBox.getValue() == null
                ? settings.difficulty()
                : difficultyComboBox.getValue();
        Theme theme = themeComboBox.getValue() == null ? settings.theme() : themeComboBox.getValue();
        int timeLimit = normalizeSpinnerValue(timeLimitSpinner);
        int minThinkTime = normalizeSpinnerValue(minThinkTimeSpinner);
        if (timeLimit > 0 && minThinkTime > timeLimit) {
            minThinkTime = timeLimit;
            minThinkTimeSpinner.getValueFactory().setValue(minThinkTime);
        }
        return new VisualizerSettings(difficulty, theme, timeLimit, minThinkTime);
    }

    private int normalizeSpinnerValue(Spinner<Integer> spinner) {
        SpinnerValueFactory<Integer> factory = spinner.getValueFactory();
        try {
            Integer parsed = factory.getConverter().fromString(spinner.getEditor().getText());
            if (parsed != null) {
                factory.setValue(parsed);
            }
        } catch (NumberFormatException ex) {
            spinner.getEditor().setText(String.valueOf(factory.getValue()));
        }
        Integer value = spinner.getValue();
        return value == null ? 0 : Math.max(0, value);
    }

    private static String describeOutcome(GameFrame frame) {
        if (frame == null) {
            return "Ready";
        }
        return switch (frame.status()) {
            case FIRST_WINS -> Player.FIRST.symbol() + " wins";
            case SECOND_WINS -> Player.SECOND.symbol() + " wins";
            case DRAW -> "Draw";
            case IN_PROGRESS -> "Stopped";
        };
    }
}
