package com.grigorchuk.visualizer.ui;

import com.grigorchuk.core.map.Direction;
import com.grigorchuk.core.map.Tile;
import com.grigorchuk.core.map.TileColors;
import com.grigorchuk.visualizer.model.MapFrame;
import com.grigorchuk.visualizer.model.TileLayout;
import java.util.function.Consumer;
import javafx.geometry.Insets;
import javafx.geometry.VPos;
import javafx.scene.Group;
import javafx.scene.layout.Pane;
import javafx.scene.paint.Color;
import javafx.scene.paint.Paint;
import javafx.scene.shape.Circle;
import javafx.scene.shape.Line;
import javafx.scene.shape.StrokeLineCap;
import javafx.scene.text.Font;
import javafx.scene.text.Text;
import javafx.scene.text.TextAlignment;

/**
 * Draws the tiles of a {@link MapFrame} around the focus tile.
 */
public final class MapView extends Pane {

    private static final double TILE_SIZE = 24.0;
    private static final double SHRINK_PER_RING = 0.12;
    private static final Paint EDGE_STROKE = Color.rgb(170, 177, 189);
    private static final Paint TILE_STROKE = Color.rgb(60, 64, 72);
    private static final Paint FOCUS_STROKE = Color.web("#FFB300");
    private static final Paint SPLIT_STROKE = Color.web("#FFFFFF", 0.8);
    private static final Paint LABEL_FILL = Color.web("#1E2430");

    private final Group content = new Group();
    private final Group edgeGroup = new Group();
    private final Group tileGroup = new Group();
    private final Group lineGroup = new Group();
    private final Group labelGroup = new Group();
    private Consumer<Tile> onTileClicked;

    public MapView() {
        setPadding(new Insets(16));
        setStyle("-fx-background-color: linear-gradient(to bottom, #fdfdfd, #e7ebf5);");
        lineGroup.setMouseTransparent(true);
        labelGroup.setMouseTransparent(true);
        edgeGroup.setMouseTransparent(true);
        content.getChildren().addAll(edgeGroup, tileGroup, lineGroup, labelGroup);
        getChildren().add(content);
        setPrefSize(800, 700);
        setMinSize(0, 0);
        setMaxSize(Double.MAX_VALUE, Double.MAX_VALUE);
    }

    public void setOnTileClicked(Consumer<Tile> handler) {
        this.onTileClicked = handler;
    }

    public void update(MapFrame frame) {
        edgeGroup.getChildren().clear();
        tileGroup.getChildren().clear();
        lineGroup.getChildren().clear();
        labelGroup.getChildren().clear();
        if (frame == null) {
            return;
        }
        TileLayout layout = frame.layout();

        for (TileLayout.Edge edge : layout.edges()) {
            TileLayout.Placement from = layout.placement(edge.from());
            TileLayout.Placement to = layout.placement(edge.to());
            Line line = new Line(from.x(), from.y(), to.x(), to.y());
            line.setStroke(EDGE_STROKE);
            line.setStrokeWidth(edge.direction() == Direction.B ? 2.0 : 1.0);
            edgeGroup.getChildren().add(line);
        }

        for (TileLayout.Placement placement : layout.placements()) {
            double size = tileSize(placement.ring());
            Circle circle = new Circle(placement.x(), placement.y(), size);
            circle.setFill(fill(placement.distance()));
            boolean focused = placement.tile() == layout.focus();
            circle.setStroke(focused ? FOCUS_STROKE : TILE_STROKE);
            circle.setStrokeWidth(focused ? 3.0 : 1.0);
            Tile tile = placement.tile();
            circle.setOnMouseClicked(event -> {
                if (onTileClicked != null) {
                    onTileClicked.accept(tile);
                }
            });
            tileGroup.getChildren().add(circle);

            if (frame.showLines()) {
                lineGroup.getChildren().add(splittingLine(layout, placement, size));
            }
            if (frame.showLabels()) {
                labelGroup.getChildren().add(label(placement, size));
            }
        }
        requestLayout();
    }

    @Override
    protected void layoutChildren() {
        super.layoutChildren();
        content.setLayoutX(getWidth() / 2.0);
        content.setLayoutY(getHeight() / 2.0);
    }

    private static double tileSize(int ring) {
        return TILE_SIZE / (1.0 + ring * SHRINK_PER_RING);
    }

    private static Paint fill(int distance) {
        if (distance < 0) {
            return Color.rgb(90, 90, 90);
        }
        return Color.web(TileColors.toWeb(TileColors.canvasColor(distance)));
    }

    /**
     * Segment across the tile pointing at its {@code b} neighbour, or outward when that neighbour
     * lies outside the layout.
     */
    private static Line splittingLine(TileLayout layout, TileLayout.Placement placement, double size) {
        double angle = placement.angle();
        Tile across = placement.tile().neighbour(Direction.B);
        TileLayout.Placement target = across == null ? null : layout.placement(across);
        if (target != null) {
            angle = Math.atan2(target.y() - placement.y(), target.x() - placement.x());
        }
        double dx = Math.cos(angle);
        double dy = Math.sin(angle);
        Line line = new Line(
                placement.x() - dx * size * 0.5, placement.y() - dy * size * 0.5,
                placement.x() + dx * size, placement.y() + dy * size);
        line.setStroke(SPLIT_STROKE);
        line.setStrokeWidth(2.0);
        line.setStrokeLineCap(StrokeLineCap.ROUND);
        return line;
    }

    private static Text label(TileLayout.Placement placement, double size) {
        String word = placement.label().isEmpty() ? "e" : placement.label();
        Text text = new Text(placement.x(), placement.y(), word);
        text.setFont(Font.font(Math.max(7.0, size * 0.45)));
        text.setFill(LABEL_FILL);
        text.setTextAlignment(TextAlignment.CENTER);
        text.setTextOrigin(VPos.CENTER);
        text.setX(placement.x() - text.getLayoutBounds().getWidth() / 2.0);
        return text;
    }
}
