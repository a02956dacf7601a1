package com.grigorchuk.core.algebra;

import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Breadth-first enumeration of the Cayley graph of the subgroup generated by {@code b},
 * {@code ac} and {@code ca}, starting at the identity. The group is infinite, so the enumeration
 * stops after a fixed number of elements has been expanded.
 */
public final class LayerEnumerator {

    public static final int DEFAULT_LIMIT = 10_000;

    private static final Logger LOGGER = Logger.getLogger(LayerEnumerator.class.getName());

    private final Multiplier multiplier;
    private final Lineage lineage;

    public LayerEnumerator(Multiplier multiplier, Lineage lineage) {
        this.multiplier = Objects.requireNonNull(multiplier, "multiplier");
        this.lineage = Objects.requireNonNull(lineage, "lineage");
    }

    /**
     * Expands up to {@code limit} elements, recording the distance and producing step of every
     * element discovered on the way.
     *
     * @param ac    handle of the product {@code ac}
     * @param ca    handle of the product {@code ca}
     * @param limit number of elements to expand
     */
    public CayleyLayers enumerate(int ac, int ca, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Enumeration limit must be at least 1: " + limit);
        }
        if (lineage.isVisited(ElementStore.IDENTITY)) {
            throw new IllegalStateException("Cayley graph has already been enumerated on this lineage");
        }

        int[] order = new int[Math.min(limit, 1 << 16)];
        int[] distances = new int[order.length];
        int discovered = 0;

        lineage.visit(ElementStore.IDENTITY, null, 0);
        order[discovered] = ElementStore.IDENTITY;
        distances[discovered] = 0;
        discovered++;

        int depth = 0;
        int nextLayerStart = discovered;
        int processed = 0;
        while (processed < limit && processed < discovered) {
            if (processed == nextLayerStart) {
                final int reached = depth + 1;
                final int count = discovered;
                final int expanded = processed;
                LOGGER.info(() -> String.format("Reached depth %d after expanding %d elements (%d discovered)",
                        reached, expanded, count));
                nextLayerStart = discovered;
                depth++;
            }
            int element = order[processed];
            int next = lineage.distance(element) + 1;
            int[] neighbours = {
                    multiplier.multiply(element, ElementStore.B),
                    multiplier.multiply(element, ac),
                    multiplier.multiply(element, ca)
            };
            PathStep[] steps = {PathStep.B, PathStep.AC, PathStep.CA};
            for (int i = 0; i < neighbours.length; i++) {
                if (lineage.visit(neighbours[i], steps[i], next)) {
                    if (discovered == order.length) {
                        order = Arrays.copyOf(order, order.length * 2);
                        distances = Arrays.copyOf(distances, distances.length * 2);
                    }
                    order[discovered] = neighbours[i];
                    distances[discovered] = next;
                    discovered++;
                }
            }
            processed++;
        }

        CayleyLayers layers = new CayleyLayers(Arrays.copyOf(order, discovered),
                Arrays.copyOf(distances, discovered), processed);
        LOGGER.info(() -> String.format("Enumerated %d elements in %d layers (complete up to depth %d)",
                layers.discovered(), layers.layers().size(), layers.completeDepth()));
        return layers;
    }
}
