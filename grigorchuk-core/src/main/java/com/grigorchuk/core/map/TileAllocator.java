package com.grigorchuk.core.map;

import com.grigorchuk.core.algebra.GrigorchukGroup;
import java.util.Objects;

/**
 * Creates {@link Tile}s with increasing ids, starting from an origin tile with id 0.
 */
public final class TileAllocator implements NodeAllocator<Tile> {

    private final Tile origin = new Tile(0, 0);
    private int nextId = 1;

    public Tile origin() {
        return origin;
    }

    @Override
    public Tile allocate(Tile parent, Direction direction) {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(direction, "direction");
        return new Tile(nextId++, parent.depth() + 1);
    }

    @Override
    public void connect(Tile from, Direction direction, Tile to) {
        from.link(direction, to);
        to.link(direction.reverse(), from);
    }

    /**
     * Returns the number of tiles created so far, including the origin.
     */
    public int allocated() {
        return nextId;
    }

    /**
     * Creates a map over {@code group} whose origin is a fresh tile.
     */
    public static GrigorchukMap<Tile> newMap(GrigorchukGroup group) {
        TileAllocator allocator = new TileAllocator();
        return new GrigorchukMap<>(group, allocator.origin(), allocator);
    }
}
