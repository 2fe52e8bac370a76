package com.connectfour.visualizer.ui;

import com.connectfour.core.Board;
import com.connectfour.visualizer.model.GameFrame;
import java.util.Objects;
import java.util.function.IntConsumer;
import javafx.geometry.Insets;
import javafx.scene.Cursor;
import javafx.scene.Group;
import javafx.scene.layout.Pane;
import javafx.scene.paint.Color;
import javafx.scene.shape.Circle;
import javafx.scene.shape.Rectangle;

/**
 * Visual representation of the Connect Four grid. Clicking anywhere in a column reports that column
 * while the view is interactive.
 */
public final class BoardView extends Pane {

    private static final double CELL_SIZE = 72.0;
    private static final double DISC_RADIUS = CELL_SIZE * 0.4;
    private static final double FRAME_PADDING = CELL_SIZE * 0.15;
    private static final double DEFAULT_STROKE_WIDTH = 1.0;
    private static final double WIN_STROKE_WIDTH = 5.0;

    private final Circle[] discs = new Circle[Board.COLUMNS * Board.COLUMN_STRIDE];
    private final Rectangle[] columnHitAreas = new Rectangle[Board.COLUMNS];
    private final Group boardGroup;
    private final Rectangle frame;
    private final Circle lastMoveMarker;
    private final double contentWidth;
    private final double contentHeight;

    private Theme theme = Theme.CLASSIC;
    private GameFrame currentFrame;
    private IntConsumer onColumnClicked = column -> { };
    private boolean interactive;

    public BoardView() {
        setPadding(new Insets(16));
        boardGroup = new Group();
        getChildren().add(boardGroup);

        contentWidth = Board.COLUMNS * CELL_SIZE + 2 * FRAME_PADDING;
        contentHeight = Board.ROWS * CELL_SIZE + 2 * FRAME_PADDING;
        frame = new Rectangle(contentWidth, contentHeight);
        frame.setArcWidth(24);
        frame.setArcHeight(24);
        boardGroup.getChildren().add(frame);

        for (int column = 0; column < Board.COLUMNS; column++) {
            for (int row = 0; row < Board.ROWS; row++) {
                Circle disc = new Circle(centerX(column), centerY(row), DISC_RADIUS);
                disc.setStrokeWidth(DEFAULT_STROKE_WIDTH);
                disc.setMouseTransparent(true);
                discs[Board.cellIndex(column, row)] = disc;
                boardGroup.getChildren().add(disc);
            }
        }

        lastMoveMarker = new Circle(DISC_RADIUS * 0.25);
        lastMoveMarker.setMouseTransparent(true);
        lastMoveMarker.setVisible(false);
        boardGroup.getChildren().add(lastMoveMarker);

        for (int column = 0; column < Board.COLUMNS; column++) {
            int target = column;
            Rectangle hitArea = new Rectangle(FRAME_PADDING + column * CELL_SIZE, 0, CELL_SIZE, contentHeight);
            hitArea.setFill(Color.TRANSPARENT);
            hitArea.setOnMouseClicked(event -> {
                if (interactive) {
                    onColumnClicked.accept(target);
                }
            });
            columnHitAreas[column] = hitArea;
            boardGroup.getChildren().add(hitArea);
        }

        setPrefSize(contentWidth + CELL_SIZE, contentHeight + CELL_SIZE);
        setMinSize(0, 0);
        setMaxSize(Double.MAX_VALUE, Double.MAX_VALUE);
        applyTheme(theme);
    }

    public void setOnColumnClicked(IntConsumer listener) {
        this.onColumnClicked = Objects.requireNonNull(listener, "listener");
    }

    public void setInteractive(boolean interactive) {
        this.interactive = interactive;
        for (Rectangle hitArea : columnHitAreas) {
            hitArea.setCursor(interactive ? Cursor.HAND : Cursor.DEFAULT);
        }
    }

    public void applyTheme(Theme theme) {
        this.theme = Objects.requireNonNull(theme, "theme");
        setStyle(theme.backgroundStyle());
        frame.setFill(theme.frameColor());
        lastMoveMarker.setFill(theme.highlightColor());
        update(currentFrame);
    }

    public void update(GameFrame frame) {
        this.currentFrame = frame;
        long firstBits = frame == null ? 0L : frame.firstPlayerBits();
        long secondBits = frame == null ? 0L : frame.secondPlayerBits();
        long winning = frame == null ? 0L : frame.winningCells();

        for (int index = 0; index < discs.length; index++) {
            Circle disc = discs[index];
            if (disc == null) {
                continue;
            }
            long bit = 1L << index;
            Color fill;
            if ((firstBits & bit) != 0L) {
                fill = theme.firstDiscColor();
            } else if ((secondBits & bit) != 0L) {
                fill = theme.secondDiscColor();
            } else {
                fill = theme.holeColor();
            }
            disc.setFill(fill);
            boolean highlighted = (winning & bit) != 0L;
            disc.setStroke(highlighted ? theme.highlightColor() : theme.frameColor().darker());
            disc.setStrokeWidth(highlighted ? WIN_STROKE_WIDTH : DEFAULT_STROKE_WIDTH);
        }

        updateLastMoveMarker(frame, firstBits | secondBits);
    }

    @Override
    protected void layoutChildren() {
        super.layoutChildren();
        var insets = getInsets();
        double availableWidth = getWidth() - insets.getLeft() - insets.getRight();
        double availableHeight = getHeight() - insets.getTop() - insets.getBottom();
        double offsetX = insets.getLeft() + (availableWidth - contentWidth) / 2.0;
        double offsetY = insets.getTop() + (availableHeight - contentHeight) / 2.0;
        boardGroup.relocate(offsetX, offsetY);
    }

    private void updateLastMoveMarker(GameFrame frame, long occupied) {
        if (frame == null || !frame.hasLastMove()) {
            lastMoveMarker.setVisible(false);
            return;
        }
        int column = frame.lastColumn();
        long columnBits = (occupied >>> (column * Board.COLUMN_STRIDE)) & ((1L << Board.ROWS) - 1);
        if (columnBits == 0L) {
            lastMoveMarker.setVisible(false);
            return;
        }
        int row = 63 - Long.numberOfLeadingZeros(columnBits);
        lastMoveMarker.setCenterX(centerX(column));
        lastMoveMarker.setCenterY(centerY(row));
        lastMoveMarker.setVisible(true);
    }

    private static double centerX(int column) {
        return FRAME_PADDING + column * CELL_SIZE + CELL_SIZE / 2.0;
    }

    /** Row 0 is drawn at the bottom. */
    private static double centerY(int row) {
        return FRAME_PADDING + (Board.ROWS - 1 - row) * CELL_SIZE + CELL_SIZE / 2.0;
    }
}
