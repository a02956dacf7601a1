package com.grigorchuk.core.algebra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a breadth-first enumeration of the Cayley graph.
 */
public final class CayleyLayers {

    private final int[] discoveryOrder;
    private final int[] distances;
    private final List<Layer> layers;
    private final int processed;
    private final int completeDepth;

    CayleyLayers(int[] discoveryOrder, int[] distances, int processed) {
        Objects.requireNonNull(discoveryOrder, "discoveryOrder");
        Objects.requireNonNull(distances, "distances");
        if (discoveryOrder.length != distances.length) {
            throw new IllegalArgumentException("Every discovered element needs a distance");
        }
        this.discoveryOrder = discoveryOrder.clone();
        this.distances = distances.clone();
        this.processed = processed;

        List<Layer> counted = new ArrayList<>();
        int depth = -1;
        int size = 0;
        for (int distance : distances) {
            if (distance != depth) {
                if (depth >= 0) {
                    counted.add(new Layer(depth, size));
                }
                depth = distance;
                size = 0;
            }
            size++;
        }
        if (depth >= 0) {
            counted.add(new Layer(depth, size));
        }
        this.layers = Collections.unmodifiableList(counted);
        // every element closer than the first unprocessed one has had all its neighbours discovered
        this.completeDepth = processed < distances.length ? distances[processed] : depth;
    }

    public int discovered() {
        return discoveryOrder.length;
    }

    public int element(int index) {
        return discoveryOrder[index];
    }

    public int distance(int index) {
        return distances[index];
    }

    /**
     * Returns the number of elements whose neighbours were explored.
     */
    public int processed() {
        return processed;
    }

    public List<Layer> layers() {
        return layers;
    }

    /**
     * Returns the largest depth whose layer is known to be complete.
     */
    public int completeDepth() {
        return completeDepth;
    }

    /**
     * Number of discovered elements at one breadth-first depth.
     */
    public record Layer(int depth, int size) {
    }
}
