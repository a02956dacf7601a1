package com.grigorchuk.core.algebra;

import com.grigorchuk.core.Generator;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Rebuilds a generator word for an element by following its recorded path steps back to the
 * identity. Only elements labelled by the enumerator or a map can be decoded.
 */
public final class Decoder {

    private final ElementStore store;
    private final Lineage lineage;
    private final Multiplier multiplier;

    public Decoder(ElementStore store, Lineage lineage, Multiplier multiplier) {
        this.store = Objects.requireNonNull(store, "store");
        this.lineage = Objects.requireNonNull(lineage, "lineage");
        this.multiplier = Objects.requireNonNull(multiplier, "multiplier");
    }

    /**
     * Returns a word whose product is {@code element}.
     *
     * @throws IllegalStateException if the path steps of the element are missing or cyclic
     */
    public String decode(int element) {
        if (!store.contains(element)) {
            throw new IllegalArgumentException("Unknown element handle: " + element);
        }
        Deque<PathStep> path = new ArrayDeque<>();
        int current = element;
        while (current != ElementStore.IDENTITY) {
            PathStep step = lineage.step(current);
            if (step == null) {
                throw new IllegalStateException("Element " + current + " on the path of " + element
                        + " has no recorded step");
            }
            // a path longer than the number of elements revisits one of them
            if (path.size() >= store.size()) {
                throw new IllegalStateException("Recorded steps of element " + element + " form a cycle");
            }
            path.push(step);
            current = undo(current, step);
        }
        StringBuilder word = new StringBuilder();
        for (PathStep step : path) {
            word.append(step.word());
        }
        return word.toString();
    }

    private int undo(int element, PathStep step) {
        List<Generator> generators = step.generators();
        int result = element;
        for (int i = generators.size() - 1; i >= 0; i--) {
            result = multiplier.multiply(result, ElementStore.handleOf(generators.get(i)));
        }
        return result;
    }
}
