package com.connectfour.visualizer.ui;

import com.connectfour.core.Board;
import com.connectfour.core.GameStatus;
import com.connectfour.core.Player;
import com.connectfour.core.ai.SearchEngine;
import com.connectfour.core.ai.SearchTelemetry;
import com.connectfour.visualizer.model.GameFrame;
import java.util.List;
import javafx.geometry.Insets;
import javafx.scene.Node;
import javafx.scene.control.Label;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.VBox;

/**
 * Displays the position and search statistics of the current frame.
 */
public final class StatsPane extends VBox {

    private static final String PLACEHOLDER = "-";

    private final Label plyValue = valueLabel();
    private final Label statusValue = valueLabel();
    private final Label turnValue = valueLabel();
    private final Label lastMoveValue = valueLabel();
    private final Label scoreValue = valueLabel();
    private final Label depthValue = valueLabel();
    private final Label nodesValue = valueLabel();
    private final Label cutoffsValue = valueLabel();
    private final Label searchTimeValue = valueLabel();
    private final Label timeoutValue = valueLabel();
    private final Label pvLineValue = valueLabel();
    private final Label[] columnScoreValues = new Label[Board.COLUMNS];

    public StatsPane() {
        setPadding(new Insets(16));
        setSpacing(12);
        setStyle("-fx-background-color: rgba(255,255,255,0.85); -fx-border-color: #d0d6e6; -fx-border-radius: 6; -fx-background-radius: 6;");
        setPrefWidth(280);
        setMinWidth(280);
        setMaxWidth(280);

        Label title = new Label("Statistics");
        title.setStyle("-fx-font-size: 18px; -fx-font-weight: bold;");

        GridPane grid = new GridPane();
        grid.setHgap(10);
        grid.setVgap(8);

        addRow(grid, 0, "Ply", plyValue);
        addRow(grid, 1, "Status", statusValue);
        addRow(grid, 2, "To move", turnValue);
        addRow(grid, 3, "Last move", lastMoveValue);
        addRow(grid, 4, "Score", scoreValue);
        addRow(grid, 5, "Depth", depthValue);
        addRow(grid, 6, "Visited nodes", nodesValue);
        addRow(grid, 7, "Cutoffs", cutoffsValue);
        addRow(grid, 8, "Search time", searchTimeValue);
        addRow(grid, 9, "Timed out", timeoutValue);
        addRow(grid, 10, "Principal variation", pvLineValue);

        Label analysisTitle = new Label("Column analysis");
        analysisTitle.setStyle("-fx-font-size: 14px; -fx-font-weight: bold;");
        GridPane analysis = new GridPane();
        analysis.setHgap(10);
        analysis.setVgap(4);
        for (int column = 0; column < Board.COLUMNS; column++) {
            columnScoreValues[column] = valueLabel();
            addRow(analysis, column, "Column " + column, columnScoreValues[column]);
        }

        getChildren().addAll(title, grid, analysisTitle, analysis);
    }

    public void update(GameFrame frame) {
        if (frame == null) {
            for (Label label : List.of(plyValue, statusValue, turnValue, lastMoveValue, scoreValue, depthValue,
                    nodesValue, cutoffsValue, searchTimeValue, timeoutValue, pvLineValue)) {
                label.setText(PLACEHOLDER);
            }
            for (Label label : columnScoreValues) {
                label.setText(PLACEHOLDER);
            }
            return;
        }

        plyValue.setText(String.valueOf(frame.ply()));
        statusValue.setText(describe(frame.status()));
        turnValue.setText(frame.status().isFinished() ? PLACEHOLDER : String.valueOf(frame.sideToMove().symbol()));
        if (frame.hasLastMove()) {
            lastMoveValue.setText(String.format("%d (%c)", frame.lastColumn(), frame.lastMover().symbol()));
        } else {
            lastMoveValue.setText(PLACEHOLDER);
        }
        scoreValue.setText(frame.hasScore()
                ? String.format("%d (%c)", frame.score(), frame.lastMover().symbol())
                : PLACEHOLDER);

        SearchTelemetry telemetry = frame.telemetry();
        SearchTelemetry.Iteration latest = telemetry.latest();
        if (latest != null) {
            depthValue.setText(Integer.toString(latest.depth()));
            nodesValue.setText(Long.toString(frame.visitedNodes()));
            cutoffsValue.setText(Long.toString(telemetry.totalCutoffs()));
            searchTimeValue.setText(String.format("%.1f ms", telemetry.totalElapsedNanos() / 1_000_000.0));
            pvLineValue.setText(formatPvLine(latest.principalVariation()));
        } else {
            depthValue.setText(PLACEHOLDER);
            nodesValue.setText(frame.visitedNodes() > 0 ? Long.toString(frame.visitedNodes()) : PLACEHOLDER);
            cutoffsValue.setText(PLACEHOLDER);
            searchTimeValue.setText(PLACEHOLDER);
            pvLineValue.setText(PLACEHOLDER);
        }
        timeoutValue.setText(frame.timedOut() ? "Yes" : "No");

        int[] scores = frame.columnScores();
        for (int column = 0; column < Board.COLUMNS; column++) {
            int score = scores[column];
            columnScoreValues[column].setText(score == SearchEngine.NO_SCORE ? PLACEHOLDER : Integer.toString(score));
        }
    }

    private static String describe(GameStatus status) {
        return switch (status) {
            case IN_PROGRESS -> "In progress";
            case FIRST_WINS -> Player.FIRST.symbol() + " wins";
            case SECOND_WINS -> Player.SECOND.symbol() + " wins";
            case DRAW -> "Draw";
        };
    }

    private static void addRow(GridPane grid, int row, String label, Node value) {
        Label caption = new Label(label + ":");
        caption.setStyle("-fx-text-fill: #4a4f64; -fx-font-weight: 600;");
        grid.addRow(row, caption, value);
    }

    private static String formatPvLine(List<Integer> pv) {
        if (pv == null || pv.isEmpty()) {
            return PLACEHOLDER;
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < pv.size(); i++) {
            if (i > 0) {
                builder.append(" > ");
            }
            builder.append(pv.get(i));
        }
        return builder.toString();
    }

    private static Label valueLabel() {
        Label label = new Label(PLACEHOLDER);
        label.setStyle("-fx-font-size: 14px; -fx-text-fill: #1f2333;");
        return label;
    }
}
