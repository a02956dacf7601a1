package com.grigorchuk.core.map;

/**
 * Host side of a {@link GrigorchukMap}: creates graph nodes and records adjacency. The map never
 * looks inside the nodes.
 *
 * @param <N> the host's node type
 */
public interface NodeAllocator<N> {

    /**
     * Creates a fresh node reached from {@code parent} along {@code direction}.
     */
    N allocate(N parent, Direction direction);

    /**
     * Records that {@code to} is the neighbour of {@code from} along {@code direction}, and that
     * {@code from} is the neighbour of {@code to} along the reverse direction.
     */
    void connect(N from, Direction direction, N to);
}
