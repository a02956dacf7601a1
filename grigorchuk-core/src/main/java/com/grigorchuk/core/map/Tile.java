package com.grigorchuk.core.map;

import java.util.Objects;

/**
 * Trivalent map tile with one neighbour slot per {@link Direction}. Equality is identity.
 */
public final class Tile {

    private final int id;
    private final int depth;
    private final Tile[] neighbours = new Tile[Direction.COUNT];

    Tile(int id, int depth) {
        this.id = id;
        this.depth = depth;
    }

    public int id() {
        return id;
    }

    /**
     * Returns the number of steps taken from the origin when this tile was created.
     */
    public int depth() {
        return depth;
    }

    /**
     * Returns the neighbour along {@code direction}, or {@code null} if it is not materialized yet.
     */
    public Tile neighbour(Direction direction) {
        return neighbours[direction.index()];
    }

    void link(Direction direction, Tile neighbour) {
        Objects.requireNonNull(neighbour, "neighbour");
        Tile existing = neighbours[direction.index()];
        if (existing != null && existing != neighbour) {
            throw new IllegalStateException("Tile " + id + " already has neighbour " + existing.id
                    + " along " + direction);
        }
        neighbours[direction.index()] = neighbour;
    }

    @Override
    public String toString() {
        return "Tile#" + id;
    }
}
