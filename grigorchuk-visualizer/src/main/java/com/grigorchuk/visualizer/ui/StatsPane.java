package com.grigorchuk.visualizer.ui;

import com.grigorchuk.core.map.TileColors;
import com.grigorchuk.visualizer.model.MapFrame;
import com.grigorchuk.visualizer.model.TileLayout;
import javafx.geometry.Insets;
import javafx.scene.Node;
import javafx.scene.control.Label;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.VBox;

/**
 * Displays information about the focus tile and the explored part of the map.
 */
public final class StatsPane extends VBox {

    private static final String EMPTY = "-";

    private final Label tileValue = valueLabel();
    private final Label wordValue = valueLabel();
    private final Label distanceValue = valueLabel();
    private final Label colorValue = valueLabel();
    private final Label radiusValue = valueLabel();
    private final Label placedValue = valueLabel();
    private final Label materializedValue = valueLabel();
    private final Label internedValue = valueLabel();
    private final Label enumeratedValue = valueLabel();
    private final Label completeDepthValue = valueLabel();

    public StatsPane() {
        setPadding(new Insets(16));
        setSpacing(12);
        setStyle("-fx-background-color: rgba(255,255,255,0.85); -fx-border-color: #d0d6e6; -fx-border-radius: 6; -fx-background-radius: 6;");
        setPrefWidth(308);
        setMinWidth(308);
        setMaxWidth(308);

        Label title = new Label("Statistics");
        title.setStyle("-fx-font-size: 18px; -fx-font-weight: bold;");

        GridPane grid = new GridPane();
        grid.setHgap(10);
        grid.setVgap(8);

        addRow(grid, 0, "Tile", tileValue);
        addRow(grid, 1, "Word", wordValue);
        addRow(grid, 2, "Distance", distanceValue);
        addRow(grid, 3, "Colour", colorValue);
        addRow(grid, 4, "Radius", radiusValue);
        addRow(grid, 5, "Tiles shown", placedValue);
        addRow(grid, 6, "Tiles materialized", materializedValue);
        addRow(grid, 7, "Interned elements", internedValue);
        addRow(grid, 8, "Enumerated elements", enumeratedValue);
        addRow(grid, 9, "Complete to depth", completeDepthValue);

        getChildren().addAll(title, grid);
    }

    public void update(MapFrame frame) {
        if (frame == null) {
            for (Label label : new Label[] {tileValue, wordValue, distanceValue, colorValue, radiusValue,
                    placedValue, materializedValue, internedValue, enumeratedValue, completeDepthValue}) {
                label.setText(EMPTY);
            }
            return;
        }

        TileLayout.Placement focus = frame.focusPlacement();
        tileValue.setText(focus.tile().toString());
        wordValue.setText(focus.label().isEmpty() ? "(identity)" : focus.label());
        if (focus.distance() >= 0) {
            distanceValue.setText(Integer.toString(focus.distance()));
            colorValue.setText(TileColors.toWeb(TileColors.canvasColor(focus.distance())));
        } else {
            distanceValue.setText("beyond limit");
            colorValue.setText(EMPTY);
        }
        radiusValue.setText(Integer.toString(frame.layout().radius()));
        placedValue.setText(Integer.toString(frame.layout().placements().size()));
        materializedValue.setText(Integer.toString(frame.materializedTiles()));
        internedValue.setText(Integer.toString(frame.internedElements()));
        enumeratedValue.setText(Integer.toString(frame.enumeratedElements()));
        completeDepthValue.setText(Integer.toString(frame.completeDepth()));
    }

    private static void addRow(GridPane grid, int row, String title, Node value) {
        Label key = new Label(title);
        key.setStyle("-fx-text-fill: #4b5568;");
        grid.add(key, 0, row);
        grid.add(value, 1, row);
    }

    private static Label valueLabel() {
        Label label = new Label(EMPTY);
        label.setStyle("-fx-font-weight: bold;");
        label.setWrapText(true);
        return label;
    }
}
