package com.grigorchuk.visualizer.model;

import com.grigorchuk.core.map.Direction;
import com.grigorchuk.core.map.GrigorchukMap;
import com.grigorchuk.core.map.Tile;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Radial placement of the tiles within a fixed number of steps of a focus tile. Tiles are placed
 * on concentric rings by their step distance from the focus, and each tile splits its angular
 * sector evenly among the tiles first reached through it. Walking the neighbourhood materializes
 * missing tiles through the map.
 */
public final class TileLayout {

    private final Tile focus;
    private final int radius;
    private final List<Placement> placements;
    private final List<Edge> edges;
    private final Map<Tile, Placement> byTile;

    private TileLayout(Tile focus, int radius, List<Placement> placements, List<Edge> edges) {
        this.focus = focus;
        this.radius = radius;
        this.placements = Collections.unmodifiableList(placements);
        this.edges = Collections.unmodifiableList(edges);
        Map<Tile, Placement> index = new HashMap<>();
        for (Placement placement : placements) {
            index.put(placement.tile(), placement);
        }
        this.byTile = index;
    }

    public static TileLayout around(GrigorchukMap<Tile> map, Tile focus, int radius, double spacing) {
        Objects.requireNonNull(map, "map");
        Objects.requireNonNull(focus, "focus");
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be non-negative: " + radius);
        }
        if (spacing <= 0.0) {
            throw new IllegalArgumentException("Spacing must be positive: " + spacing);
        }

        Map<Tile, Integer> rings = new HashMap<>();
        Map<Tile, double[]> sectors = new HashMap<>();
        List<Tile> order = new ArrayList<>();
        Deque<Tile> queue = new ArrayDeque<>();
        rings.put(focus, 0);
        sectors.put(focus, new double[] {0.0, 2 * Math.PI});
        queue.add(focus);

        while (!queue.isEmpty()) {
            Tile tile = queue.poll();
            order.add(tile);
            int ring = rings.get(tile);
            if (ring == radius) {
                continue;
            }
            List<Tile> children = new ArrayList<>(Direction.COUNT);
            for (Direction direction : Direction.values()) {
                Tile neighbour = map.step(tile, direction);
                if (!rings.containsKey(neighbour)) {
                    rings.put(neighbour, ring + 1);
                    children.add(neighbour);
                    queue.add(neighbour);
                }
            }
            double[] sector = sectors.get(tile);
            double width = (sector[1] - sector[0]) / Math.max(1, children.size());
            for (int i = 0; i < children.size(); i++) {
                double start = sector[0] + i * width;
                sectors.put(children.get(i), new double[] {start, start + width});
            }
        }

        List<Placement> placements = new ArrayList<>(order.size());
        for (Tile tile : order) {
            int ring = rings.get(tile);
            double[] sector = sectors.get(tile);
            double angle = (sector[0] + sector[1]) / 2.0;
            double x = ring == 0 ? 0.0 : ring * spacing * Math.cos(angle);
            double y = ring == 0 ? 0.0 : ring * spacing * Math.sin(angle);
            placements.add(new Placement(tile, x, y, ring, angle, map.distance(tile), map.label(tile)));
        }

        List<Edge> edges = new ArrayList<>();
        for (Tile tile : order) {
            for (Direction direction : Direction.values()) {
                Tile neighbour = tile.neighbour(direction);
                if (neighbour != null && rings.containsKey(neighbour) && tile.id() < neighbour.id()) {
                    edges.add(new Edge(tile, neighbour, direction));
                }
            }
        }
        return new TileLayout(focus, radius, placements, edges);
    }

    public Tile focus() {
        return focus;
    }

    public int radius() {
        return radius;
    }

    /**
     * Returns the placed tiles in breadth-first order from the focus.
     */
    public List<Placement> placements() {
        return placements;
    }

    public List<Edge> edges() {
        return edges;
    }

    /**
     * Returns the placement of {@code tile}, or {@code null} if it lies outside the layout.
     */
    public Placement placement(Tile tile) {
        return byTile.get(tile);
    }

    /**
     * A tile with its position relative to the focus.
     *
     * @param distance breadth-first distance of the tile's element from the identity, or -1
     * @param label    generator word of the tile's element
     */
    public record Placement(Tile tile, double x, double y, int ring, double angle, int distance, String label) {

        public Placement {
            Objects.requireNonNull(tile, "tile");
            Objects.requireNonNull(label, "label");
        }
    }

    /**
     * Adjacency between two placed tiles; {@code direction} leads from {@code from} to {@code to}.
     */
    public record Edge(Tile from, Tile to, Direction direction) {
    }
}
