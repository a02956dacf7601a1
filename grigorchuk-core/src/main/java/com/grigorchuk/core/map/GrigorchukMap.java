package com.grigorchuk.core.map;

import com.grigorchuk.core.Generator;
import com.grigorchuk.core.algebra.ElementStore;
import com.grigorchuk.core.algebra.GrigorchukGroup;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Lazily materialized Cayley graph of the subgroup generated by {@code ac}, {@code ca} and
 * {@code b}. Host nodes are bound one-to-one to group elements; a neighbour is created the first
 * time it is requested, and requesting an element that already has a node returns that node, so
 * every relation of the group closes a cycle in the graph.
 *
 * @param <N> the host's node type
 */
public final class GrigorchukMap<N> {

    private static final Logger LOGGER = Logger.getLogger(GrigorchukMap.class.getName());

    private final GrigorchukGroup group;
    private final NodeAllocator<N> allocator;
    private final N origin;
    private final Map<N, Integer> elements = new HashMap<>();
    private final Map<Integer, N> nodes = new HashMap<>();

    public GrigorchukMap(GrigorchukGroup group, N origin, NodeAllocator<N> allocator) {
        this.group = Objects.requireNonNull(group, "group");
        this.origin = Objects.requireNonNull(origin, "origin");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        if (!group.isPrepared()) {
            group.prepare();
        }
        bind(origin, ElementStore.IDENTITY);
    }

    public N getOriginNode() {
        return origin;
    }

    public N step(N from, int direction) {
        return step(from, Direction.fromIndex(direction));
    }

    /**
     * Returns the neighbour of {@code from} along {@code direction}, creating it if needed.
     */
    public N step(N from, Direction direction) {
        Objects.requireNonNull(direction, "direction");
        int element = element(from);
        int neighbourElement = element;
        for (Generator generator : direction.generators()) {
            neighbourElement = group.multiply(neighbourElement, group.generator(generator));
        }

        final int target = neighbourElement;
        N neighbour = nodes.get(target);
        if (neighbour == null) {
            group.lineage().label(target, direction.step());
            neighbour = Objects.requireNonNull(allocator.allocate(from, direction), "allocated node");
            bind(neighbour, target);
            LOGGER.finest(() -> String.format("Materialized node %d for element %d", nodes.size(), target));
        } else {
            LOGGER.finest(() -> String.format("Step %s from element %d reached existing element %d",
                    direction, element, target));
        }
        allocator.connect(from, direction, neighbour);
        return neighbour;
    }

    /**
     * Returns the element bound to {@code node}.
     */
    public int element(N node) {
        Objects.requireNonNull(node, "node");
        Integer element = elements.get(node);
        if (element == null) {
            throw new IllegalArgumentException("Node is not part of this map: " + node);
        }
        return element;
    }

    public Optional<N> node(int element) {
        return Optional.ofNullable(nodes.get(element));
    }

    public boolean contains(N node) {
        return elements.containsKey(node);
    }

    /**
     * Returns the breadth-first distance of the node's element from the identity, or {@code -1}
     * if the enumeration did not reach it.
     */
    public int distance(N node) {
        return group.distance(element(node));
    }

    /**
     * Returns a generator word for the node's element.
     */
    public String label(N node) {
        return group.decode(element(node));
    }

    /**
     * Returns the number of materialized nodes, including the origin.
     */
    public int size() {
        return nodes.size();
    }

    public GrigorchukGroup group() {
        return group;
    }

    private void bind(N node, int element) {
        if (elements.containsKey(node)) {
            throw new IllegalStateException("Node is already bound to element " + elements.get(node));
        }
        elements.put(node, element);
        nodes.put(element, node);
    }
}
