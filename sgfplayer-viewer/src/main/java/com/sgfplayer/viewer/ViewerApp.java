package com.sgfplayer.viewer;

import com.sgfplayer.core.config.PlayerSettings;
import com.sgfplayer.core.config.SettingsStore;
import com.sgfplayer.core.engine.PlaybackEngine;
import com.sgfplayer.core.engine.PlaybackListener;
import com.sgfplayer.core.library.GameEntry;
import com.sgfplayer.core.library.GameLibrary;
import com.sgfplayer.core.sgf.SgfParseException;
import com.sgfplayer.viewer.ui.BoardView;
import com.sgfplayer.viewer.ui.InfoPane;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import javafx.application.Application;
import javafx.application.Platform;
import javafx.beans.property.BooleanProperty;
import javafx.beans.property.IntegerProperty;
import javafx.beans.property.SimpleBooleanProperty;
import javafx.beans.property.SimpleIntegerProperty;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.control.Spinner;
import javafx.scene.control.SpinnerValueFactory;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.Region;
import javafx.stage.FileChooser;
import javafx.stage.Stage;

public final class ViewerApp extends Application {

    private static final Logger LOGGER = Logger.getLogger(ViewerApp.class.getName());
    private static final int MAX_INTERVAL_MILLIS = 10_000;

    private final IntegerProperty currentIndex = new SimpleIntegerProperty(0);
    private final IntegerProperty maxIndex = new SimpleIntegerProperty(0);
    private final BooleanProperty playing = new SimpleBooleanProperty(false);
    private final BooleanProperty loaded = new SimpleBooleanProperty(false);
    private final List<GameEntry> entries = new ArrayList<>();

    private PlayerSettings settings;
    private SettingsStore settingsStore;
    private GameLibrary library;
    private PlaybackEngine engine;
    private BoardView boardView;
    private InfoPane infoPane;
    private Label statusLabel;
    private Stage stage;
    private int entryIndex;

    public static void main(String[] args) {
        launch(args);
    }

    @Override
    public void start(Stage stage) {
        this.stage = stage;
        List<String> args = getParameters().getRaw();
        settingsStore = new SettingsStore();
        settings = loadSettings(args);
        library = new GameLibrary(settings.shuffleGameOrder(), new Random());

        engine = new PlaybackEngine(new FxPlaybackClock());
        engine.setPlayInterval(settings.moveInterval());
        boardView = new BoardView();
        infoPane = new InfoPane();
        engine.addListener(new PlaybackListener() {
            @Override
            public void onPositionChanged(PlaybackEngine source) {
                boardView.update(source.getBoard(), source.getLastMove());
                infoPane.update(source);
                currentIndex.set(source.getCurrentIndex());
                maxIndex.set(source.getMaxIndex());
            }

            @Override
            public void onPlayingChanged(PlaybackEngine source, boolean isPlaying) {
                playing.set(isPlaying);
            }

            @Override
            public void onPlaybackFinished(PlaybackEngine source) {
                statusLabel.setText("End of game");
            }
        });

        BorderPane root = new BorderPane();
        root.setPadding(new Insets(16));
        root.setCenter(boardView);
        BorderPane.setAlignment(boardView, Pos.CENTER);
        root.setRight(infoPane);
        BorderPane.setMargin(infoPane, new Insets(0, 0, 0, 16));

        HBox controls = buildControls();
        root.setBottom(controls);
        BorderPane.setMargin(controls, new Insets(16, 0, 0, 0));

        Scene scene = new Scene(root, 1000, 780);
        stage.setTitle("SGF Player");
        stage.setScene(scene);
        stage.setMinWidth(800);
        stage.setMinHeight(640);
        stage.show();

        boardView.update(engine.getBoard(), engine.getLastMove());
        infoPane.update(engine);
        openInitialGame(args);
    }

    @Override
    public void stop() {
        if (engine != null) {
            engine.pause();
        }
    }

    private PlayerSettings loadSettings(List<String> args) {
        PlayerSettings stored;
        try {
            stored = settingsStore.load();
        } catch (UncheckedIOException ex) {
            stored = PlayerSettings.defaults();
        }
        try {
            return PlayerSettings.fromArgs(args, stored);
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.WARNING, "Ignoring invalid command line options", ex);
            return stored;
        }
    }

    private void openInitialGame(List<String> args) {
        Path file = args.stream()
                .filter(arg -> !arg.startsWith("--"))
                .findFirst()
                .map(Paths::get)
                .orElse(null);
        if (file != null) {
            openFile(file);
        } else if (settings.gameFolder() != null) {
            openFolder(settings.gameFolder());
        }
    }

    private HBox buildControls() {
        Button openButton = new Button("Open…");
        openButton.setOnAction(event -> chooseFile());

        Button nextGameButton = new Button("Next game");
        nextGameButton.setOnAction(event -> showEntry(entryIndex + 1));

        Button resetButton = new Button("⏮⏮");
        resetButton.setOnAction(event -> engine.reset());

        Button previousButton = new Button("⏮");
        previousButton.setOnAction(event -> {
            engine.pause();
            engine.stepBack();
        });

        Button nextButton = new Button("⏭");
        nextButton.setOnAction(event -> {
            engine.pause();
            engine.stepForward();
        });

        Button playButton = new Button("▶");
        playButton.setOnAction(event -> {
            statusLabel.setText("Playing");
            engine.play();
        });

        Button pauseButton = new Button("⏸");
        pauseButton.setOnAction(event -> engine.pause());

        Spinner<Integer> intervalSpinner = new Spinner<>();
        intervalSpinner.setValueFactory(new SpinnerValueFactory.IntegerSpinnerValueFactory(
                (int) PlayerSettings.MIN_MOVE_INTERVAL.toMillis(), MAX_INTERVAL_MILLIS,
                (int) Math.min(MAX_INTERVAL_MILLIS, settings.moveInterval().toMillis()), 50));
        intervalSpinner.setEditable(true);
        intervalSpinner.setPrefWidth(100);
        intervalSpinner.valueProperty().addListener((obs, oldValue, newValue) -> {
            if (newValue != null) {
                changeInterval(Duration.ofMillis(newValue));
            }
        });

        statusLabel = new Label("Ready");
        statusLabel.setMinWidth(160);

        Region spacer = new Region();
        HBox.setHgrow(spacer, Priority.ALWAYS);

        HBox navigation = new HBox(8, resetButton, previousButton, nextButton, playButton, pauseButton);
        navigation.setAlignment(Pos.CENTER_LEFT);

        HBox controls = new HBox(12,
                openButton,
                nextGameButton,
                navigation,
                new Label("Interval (ms):"),
                intervalSpinner,
                spacer,
                statusLabel);
        controls.setAlignment(Pos.CENTER_LEFT);

        previousButton.disableProperty().bind(currentIndex.lessThanOrEqualTo(0));
        nextButton.disableProperty().bind(currentIndex.greaterThanOrEqualTo(maxIndex));
        resetButton.disableProperty().bind(loaded.not().or(currentIndex.isEqualTo(0).and(playing.not())));
        playButton.disableProperty().bind(playing.or(loaded.not()));
        pauseButton.disableProperty().bind(playing.not());
        nextGameButton.disableProperty().bind(loaded.not());

        return controls;
    }

    private void chooseFile() {
        FileChooser chooser = new FileChooser();
        chooser.setTitle("Open SGF file");
        chooser.getExtensionFilters().add(new FileChooser.ExtensionFilter("SGF files", "*.sgf", "*.SGF"));
        File selected = chooser.showOpenDialog(stage);
        if (selected != null) {
            openFile(selected.toPath());
        }
    }

    private void openFile(Path file) {
        try {
            GameEntry entry = library.loadFile(file);
            entries.clear();
            entries.add(entry);
            showEntry(0);
        } catch (IOException | SgfParseException ex) {
            LOGGER.log(Level.WARNING, "Failed to open " + file, ex);
            statusLabel.setText("Could not open " + file.getFileName());
        }
    }

    private void openFolder(Path folder) {
        statusLabel.setText("Loading games…");
        library.loadFolderAsync(folder).whenComplete((loadedEntries, throwable) -> Platform.runLater(() -> {
            if (throwable != null) {
                Throwable cause = throwable.getCause() == null ? throwable : throwable.getCause();
                LOGGER.log(Level.WARNING, "Failed to load games from " + folder, cause);
                statusLabel.setText("Could not read " + folder);
                return;
            }
            entries.clear();
            entries.addAll(loadedEntries);
            if (entries.isEmpty()) {
                statusLabel.setText("No games in " + folder);
                return;
            }
            showEntry(0);
        }));
    }

    private void showEntry(int index) {
        if (entries.isEmpty()) {
            return;
        }
        entryIndex = Math.floorMod(index, entries.size());
        GameEntry entry = entries.get(entryIndex);
        engine.load(entry.record());
        infoPane.showGame(entry.title(), entry.record().getInfo());
        loaded.set(true);
        stage.setTitle("SGF Player - " + entry.title());
        statusLabel.setText(String.format("Game %d of %d", entryIndex + 1, entries.size()));
        if (settings.startGameOnLaunch()) {
            engine.play();
        }
    }

    private void changeInterval(Duration interval) {
        engine.setPlayInterval(interval);
        settings = settings.withMoveInterval(interval);
        try {
            settingsStore.save(settings);
        } catch (UncheckedIOException ex) {
            statusLabel.setText("Could not save settings");
        }
    }
}
