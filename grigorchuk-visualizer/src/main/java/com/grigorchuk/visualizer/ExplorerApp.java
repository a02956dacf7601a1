package com.grigorchuk.visualizer;

import com.grigorchuk.core.GrigorchukOptions;
import com.grigorchuk.core.algebra.CayleyLayers;
import com.grigorchuk.core.algebra.GrigorchukGroup;
import com.grigorchuk.core.map.Direction;
import com.grigorchuk.core.map.GrigorchukMap;
import com.grigorchuk.core.map.Tile;
import com.grigorchuk.core.map.TileAllocator;
import com.grigorchuk.visualizer.model.MapFrame;
import com.grigorchuk.visualizer.model.TileLayout;
import com.grigorchuk.visualizer.task.PrepareGroupTask;
import com.grigorchuk.visualizer.ui.MapView;
import com.grigorchuk.visualizer.ui.StatsPane;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;
import javafx.application.Application;
import javafx.application.Platform;
import javafx.beans.property.BooleanProperty;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.SimpleBooleanProperty;
import javafx.beans.property.SimpleObjectProperty;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.CheckBox;
import javafx.scene.control.Label;
import javafx.scene.control.ProgressBar;
import javafx.scene.control.Spinner;
import javafx.scene.control.SpinnerValueFactory;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.Region;
import javafx.stage.Stage;

/**
 * JavaFX explorer for the Cayley graph of the Grigorchuk group. The group is enumerated on a
 * background thread; once that completes every further call into the group happens on the JavaFX
 * application thread.
 */
public final class ExplorerApp extends Application {

    private static final int DEFAULT_RADIUS = 4;
    private static final int MAX_RADIUS = 8;
    private static final double RING_SPACING = 60.0;
    private static final Logger LOGGER = Logger.getLogger(ExplorerApp.class.getName());

    private final ObjectProperty<MapFrame> currentFrame = new SimpleObjectProperty<>();
    private final BooleanProperty ready = new SimpleBooleanProperty(false);
    private final Deque<Tile> history = new ArrayDeque<>();

    private GrigorchukOptions options = GrigorchukOptions.defaults();
    private GrigorchukGroup group;
    private GrigorchukMap<Tile> map;
    private TileAllocator allocator;
    private Tile focus;
    private MapView mapView;
    private StatsPane statsPane;
    private Spinner<Integer> radiusSpinner;
    private CheckBox linesCheckBox;
    private CheckBox labelsCheckBox;
    private ProgressBar progressBar;
    private Label statusLabel;

    public static void main(String[] args) {
        launch(args);
    }

    @Override
    public void start(Stage stage) {
        try {
            options = GrigorchukOptions.parse(getParameters().getRaw());
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            System.err.println(GrigorchukOptions.usage());
            Platform.exit();
            return;
        }
        if (!options.grigorchukSelected()) {
            LOGGER.info(() -> String.format("%s not given, showing the Grigorchuk map anyway",
                    GrigorchukOptions.SELECT_FLAG));
        }
        group = new GrigorchukGroup(options.limit());

        mapView = new MapView();
        mapView.setOnTileClicked(this::refocus);
        statsPane = new StatsPane();

        currentFrame.addListener((obs, oldFrame, newFrame) -> {
            mapView.update(newFrame);
            statsPane.update(newFrame);
        });

        BorderPane root = new BorderPane();
        root.setPadding(new Insets(16));
        root.setCenter(mapView);
        BorderPane.setAlignment(mapView, Pos.CENTER);
        root.setRight(statsPane);
        BorderPane.setMargin(statsPane, new Insets(0, 0, 0, 16));

        HBox controls = buildControls();
        root.setBottom(controls);
        BorderPane.setMargin(controls, new Insets(16, 0, 0, 0));

        Scene scene = new Scene(root, 1200, 800);
        stage.setTitle("Grigorchuk Explorer");
        stage.setScene(scene);
        stage.setMinWidth(960);
        stage.setMinHeight(720);
        stage.show();

        prepareGroup();
    }

    private HBox buildControls() {
        Button acButton = new Button("ac");
        acButton.setOnAction(event -> move(Direction.AC));
        Button caButton = new Button("ca");
        caButton.setOnAction(event -> move(Direction.CA));
        Button bButton = new Button("b");
        bButton.setOnAction(event -> move(Direction.B));

        Button backButton = new Button("Back");
        backButton.setOnAction(event -> {
            if (!history.isEmpty()) {
                focus = history.pop();
                refresh();
            }
        });

        Button originButton = new Button("Origin");
        originButton.setOnAction(event -> refocus(map.getOriginNode()));

        radiusSpinner = new Spinner<>();
        radiusSpinner.setValueFactory(new SpinnerValueFactory.IntegerSpinnerValueFactory(0, MAX_RADIUS, DEFAULT_RADIUS));
        radiusSpinner.setPrefWidth(80);
        radiusSpinner.valueProperty().addListener((obs, oldValue, newValue) -> refresh());

        linesCheckBox = new CheckBox("Lines");
        linesCheckBox.setSelected(options.showLines());
        linesCheckBox.selectedProperty().addListener((obs, oldValue, newValue) -> {
            options = options.withShowLines(newValue);
            reannotate();
        });

        labelsCheckBox = new CheckBox("Labels");
        labelsCheckBox.setSelected(options.showLabels());
        labelsCheckBox.selectedProperty().addListener((obs, oldValue, newValue) -> {
            options = options.withShowLabels(newValue);
            reannotate();
        });

        progressBar = new ProgressBar(ProgressBar.INDETERMINATE_PROGRESS);
        progressBar.setPrefWidth(180);

        statusLabel = new Label("Preparing");
        statusLabel.setMinWidth(160);

        Region spacer = new Region();
        HBox.setHgrow(spacer, Priority.ALWAYS);

        for (Button button : new Button[] {acButton, caButton, bButton, backButton, originButton}) {
            button.disableProperty().bind(ready.not());
        }
        radiusSpinner.disableProperty().bind(ready.not());

        HBox controls = new HBox(8, acButton, caButton, bButton, backButton, originButton,
                new Label("Radius"), radiusSpinner, linesCheckBox, labelsCheckBox, spacer, progressBar, statusLabel);
        controls.setAlignment(Pos.CENTER_LEFT);
        return controls;
    }

    private void prepareGroup() {
        PrepareGroupTask task = new PrepareGroupTask(group);
        statusLabel.textProperty().bind(task.messageProperty());
        task.setOnSucceeded(event -> {
            cleanupTaskBindings();
            CayleyLayers layers = task.getValue();
            allocator = new TileAllocator();
            map = new GrigorchukMap<>(group, allocator.origin(), allocator);
            focus = map.getOriginNode();
            progressBar.setProgress(1.0);
            statusLabel.setText(String.format("Ready (%d elements)", layers.processed()));
            ready.set(true);
            refresh();
        });
        task.setOnFailed(event -> {
            cleanupTaskBindings();
            Throwable error = task.getException();
            progressBar.setProgress(0);
            statusLabel.setText(error == null ? "Error" : "Error: " + error.getMessage());
            LOGGER.log(Level.WARNING, "Enumeration failed", error);
        });

        Thread thread = new Thread(task, "grigorchuk-explorer-prepare");
        thread.setDaemon(true);
        thread.start();
    }

    private void cleanupTaskBindings() {
        statusLabel.textProperty().unbind();
    }

    private void move(Direction direction) {
        if (!ready.get()) {
            return;
        }
        refocus(map.step(focus, direction));
    }

    private void refocus(Tile tile) {
        if (!ready.get() || tile == null || tile == focus) {
            return;
        }
        history.push(focus);
        focus = tile;
        refresh();
    }

    private void refresh() {
        if (!ready.get()) {
            return;
        }
        TileLayout layout = TileLayout.around(map, focus, radiusSpinner.getValue(), RING_SPACING);
        CayleyLayers layers = group.layers();
        currentFrame.set(new MapFrame(
                layout,
                options.showLines(),
                options.showLabels(),
                allocator.allocated(),
                group.store().size(),
                layers.discovered(),
                layers.completeDepth()));
        LOGGER.fine(() -> String.format("Focused %s with %d tiles in view", focus, layout.placements().size()));
    }

    private void reannotate() {
        MapFrame frame = currentFrame.get();
        if (frame != null) {
            currentFrame.set(frame.withAnnotations(options.showLines(), options.showLabels()));
        }
    }
}
