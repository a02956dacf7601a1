package com.grigorchuk.visualizer.model;

import java.util.Objects;

/**
 * Snapshot of the explored map around the focus tile.
 */
public record MapFrame(
        TileLayout layout,
        boolean showLines,
        boolean showLabels,
        int materializedTiles,
        int internedElements,
        int enumeratedElements,
        int completeDepth) {

    public MapFrame {
        Objects.requireNonNull(layout, "layout");
    }

    public TileLayout.Placement focusPlacement() {
        return layout.placement(layout.focus());
    }

    public MapFrame withAnnotations(boolean lines, boolean labels) {
        return new MapFrame(layout, lines, labels, materializedTiles, internedElements, enumeratedElements,
                completeDepth);
    }
}
