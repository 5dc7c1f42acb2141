package com.sgfplayer.viewer.ui;

import com.sgfplayer.core.BoardSnapshot;
import com.sgfplayer.core.Move;
import com.sgfplayer.core.Point;
import com.sgfplayer.core.Stone;
import java.util.Optional;
import javafx.geometry.Insets;
import javafx.scene.Group;
import javafx.scene.layout.Pane;
import javafx.scene.paint.Color;
import javafx.scene.paint.Paint;
import javafx.scene.shape.Circle;
import javafx.scene.shape.Line;
import javafx.scene.shape.Rectangle;

/**
 * Visual representation of a Go board snapshot.
 */
public final class BoardView extends Pane {

    private static final double CELL_SIZE = 28.0;
    private static final double STONE_RADIUS = CELL_SIZE * 0.46;
    private static final double STAR_RADIUS = 3.0;
    private static final Paint BOARD_FILL = Color.web("#DCB35C");
    private static final Paint GRID_STROKE = Color.rgb(60, 45, 20);
    private static final Paint BLACK_FILL = Color.web("#1B1B1B");
    private static final Paint WHITE_FILL = Color.web("#F5F5F0");
    private static final Paint STONE_STROKE = Color.rgb(30, 30, 30);
    private static final Paint LAST_MOVE_ON_BLACK = Color.web("#F5F5F0");
    private static final Paint LAST_MOVE_ON_WHITE = Color.web("#1B1B1B");

    private final Group boardGroup = new Group();
    private final Group gridGroup = new Group();
    private final Group stoneGroup = new Group();
    private final Circle lastMoveMarker;
    private int boardSize;
    private double contentSize;

    public BoardView() {
        setPadding(new Insets(16));
        setStyle("-fx-background-color: linear-gradient(to bottom, #fdfdfd, #e7ebf5);");
        stoneGroup.setMouseTransparent(true);

        lastMoveMarker = new Circle(STONE_RADIUS * 0.4);
        lastMoveMarker.setFill(Color.TRANSPARENT);
        lastMoveMarker.setStrokeWidth(2.0);
        lastMoveMarker.setVisible(false);
        lastMoveMarker.setMouseTransparent(true);

        boardGroup.getChildren().addAll(gridGroup, stoneGroup, lastMoveMarker);
        getChildren().add(boardGroup);

        drawGrid(BoardSnapshot.DEFAULT_SIZE);
        setMinSize(0, 0);
        setMaxSize(Double.MAX_VALUE, Double.MAX_VALUE);
    }

    /**
     * Redraws the stones of {@code board} and marks the point of {@code lastMove}, if any.
     */
    public void update(BoardSnapshot board, Optional<Move> lastMove) {
        if (board == null) {
            stoneGroup.getChildren().clear();
            lastMoveMarker.setVisible(false);
            return;
        }
        if (board.size() != boardSize) {
            drawGrid(board.size());
        }

        stoneGroup.getChildren().clear();
        board.stones().forEach((point, stone) -> {
            Circle circle = new Circle(coordinate(point.x()), coordinate(point.y()), STONE_RADIUS);
            circle.setFill(stone == Stone.BLACK ? BLACK_FILL : WHITE_FILL);
            circle.setStroke(STONE_STROKE);
            stoneGroup.getChildren().add(circle);
        });

        updateLastMoveMarker(board, lastMove.map(Move::point).orElse(null));
    }

    @Override
    protected void layoutChildren() {
        super.layoutChildren();
        var insets = getInsets();
        double availableWidth = getWidth() - insets.getLeft() - insets.getRight();
        double availableHeight = getHeight() - insets.getTop() - insets.getBottom();
        double offsetX = insets.getLeft() + (availableWidth - contentSize) / 2.0;
        double offsetY = insets.getTop() + (availableHeight - contentSize) / 2.0;
        boardGroup.relocate(offsetX, offsetY);
    }

    private void drawGrid(int size) {
        boardSize = size;
        contentSize = size * CELL_SIZE;
        gridGroup.getChildren().clear();

        Rectangle background = new Rectangle(0, 0, contentSize, contentSize);
        background.setFill(BOARD_FILL);
        gridGroup.getChildren().add(background);

        double first = coordinate(0);
        double last = coordinate(size - 1);
        for (int i = 0; i < size; i++) {
            double offset = coordinate(i);
            Line vertical = new Line(offset, first, offset, last);
            vertical.setStroke(GRID_STROKE);
            Line horizontal = new Line(first, offset, last, offset);
            horizontal.setStroke(GRID_STROKE);
            gridGroup.getChildren().addAll(vertical, horizontal);
        }

        for (int x : starLines(size)) {
            for (int y : starLines(size)) {
                Circle star = new Circle(coordinate(x), coordinate(y), STAR_RADIUS);
                star.setFill(GRID_STROKE);
                gridGroup.getChildren().add(star);
            }
        }

        setPrefSize(contentSize + CELL_SIZE * 2, contentSize + CELL_SIZE * 2);
        requestLayout();
    }

    private void updateLastMoveMarker(BoardSnapshot board, Point point) {
        Stone stone = point == null || !board.isOnBoard(point) ? null : board.stoneAt(point);
        if (stone == null) {
            lastMoveMarker.setVisible(false);
            return;
        }
        lastMoveMarker.setStroke(stone == Stone.BLACK ? LAST_MOVE_ON_BLACK : LAST_MOVE_ON_WHITE);
        lastMoveMarker.setCenterX(coordinate(point.x()));
        lastMoveMarker.setCenterY(coordinate(point.y()));
        lastMoveMarker.setVisible(true);
        lastMoveMarker.toFront();
    }

    private static double coordinate(int line) {
        return CELL_SIZE / 2.0 + line * CELL_SIZE;
    }

    private static int[] starLines(int size) {
        if (size < 7) {
            return new int[0];
        }
        int edge = size >= 13 ? 3 : 2;
        if (size % 2 == 0) {
            return new int[] {edge, size - 1 - edge};
        }
        return new int[] {edge, size / 2, size - 1 - edge};
    }
}
