package com.sgfplayer.viewer.ui;

import com.sgfplayer.core.engine.PlaybackEngine;
import com.sgfplayer.core.sgf.GameInfo;
import com.sgfplayer.core.sgf.SgfCoordinates;
import java.util.Locale;
import javafx.geometry.Insets;
import javafx.scene.Node;
import javafx.scene.control.Label;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.VBox;

/**
 * Displays the players of the loaded game and the state of the replay.
 */
public final class InfoPane extends VBox {

    private static final String NONE = "-";

    private final Label titleLabel = new Label("No game loaded");
    private final Label blackValue = valueLabel();
    private final Label whiteValue = valueLabel();
    private final Label komiValue = valueLabel();
    private final Label resultValue = valueLabel();
    private final Label moveValue = valueLabel();
    private final Label lastMoveValue = valueLabel();
    private final Label turnValue = valueLabel();
    private final Label blackCapturesValue = valueLabel();
    private final Label whiteCapturesValue = valueLabel();

    public InfoPane() {
        setPadding(new Insets(16));
        setSpacing(12);
        setStyle("-fx-background-color: rgba(255,255,255,0.85); -fx-border-color: #d0d6e6; -fx-border-radius: 6; -fx-background-radius: 6;");
        setPrefWidth(280);
        setMinWidth(280);
        setMaxWidth(280);

        titleLabel.setStyle("-fx-font-size: 18px; -fx-font-weight: bold;");
        titleLabel.setWrapText(true);

        GridPane grid = new GridPane();
        grid.setHgap(10);
        grid.setVgap(8);

        addRow(grid, 0, "Black", blackValue);
        addRow(grid, 1, "White", whiteValue);
        addRow(grid, 2, "Komi", komiValue);
        addRow(grid, 3, "Result", resultValue);
        addRow(grid, 4, "Move", moveValue);
        addRow(grid, 5, "Last move", lastMoveValue);
        addRow(grid, 6, "To play", turnValue);
        addRow(grid, 7, "Captured by Black", blackCapturesValue);
        addRow(grid, 8, "Captured by White", whiteCapturesValue);

        getChildren().addAll(titleLabel, grid);
    }

    public void showGame(String title, GameInfo info) {
        titleLabel.setText(title);
        blackValue.setText(player(info.playerBlack(), info.blackRank()));
        whiteValue.setText(player(info.playerWhite(), info.whiteRank()));
        komiValue.setText(orNone(info.komi()));
        resultValue.setText(orNone(info.result()));
    }

    public void update(PlaybackEngine engine) {
        moveValue.setText(String.format("%d / %d", engine.getCurrentIndex(), engine.getMaxIndex()));
        lastMoveValue.setText(engine.getLastMove()
                .map(move -> SgfCoordinates.toHumanReadable(move.point(), engine.getBoardSize()))
                .orElse(NONE));
        turnValue.setText(engine.getTurn().name().toLowerCase(Locale.ROOT));
        blackCapturesValue.setText(Integer.toString(engine.getBlackCaptures()));
        whiteCapturesValue.setText(Integer.toString(engine.getWhiteCaptures()));
    }

    private static String player(String name, String rank) {
        if (name == null) {
            return NONE;
        }
        return rank == null ? name : name + " (" + rank + ")";
    }

    private static String orNone(String value) {
        return value == null ? NONE : value;
    }

    private static void addRow(GridPane grid, int row, String label, Node value) {
        Label caption = new Label(label + ":");
        caption.setStyle("-fx-text-fill: #4a4f64; -fx-font-weight: 600;");
        grid.addRow(row, caption, value);
    }

    private static Label valueLabel() {
        Label label = new Label(NONE);
        label.setStyle("-fx-font-size: 14px; -fx-text-fill: #1f2333;");
        return label;
    }
}
