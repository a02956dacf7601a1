package com.grigorchuk.core.algebra;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Multiplies canonical elements directly on their tree structure. For
 * {@code x = (s, x0, x1)} and {@code y = (t, y0, y1)} the product is
 * {@code (s, x0 y0, x1 y1)} when {@code t} is false and {@code (!s, x1 y0, x0 y1)} otherwise.
 * Products are memoized per operand pair.
 */
public final class Multiplier {

    private final ElementStore store;
    private final Lineage lineage;
    private final Map<Long, Integer> products = new HashMap<>();

    public Multiplier(ElementStore store, Lineage lineage) {
        this.store = Objects.requireNonNull(store, "store");
        this.lineage = Objects.requireNonNull(lineage, "lineage");
    }

    public int multiply(int x, int y) {
        if (!store.contains(x) || !store.contains(y)) {
            throw new IllegalArgumentException("Unknown element handle: " + (store.contains(x) ? y : x));
        }
        if (x == ElementStore.IDENTITY) {
            return y;
        }
        if (y == ElementStore.IDENTITY) {
            return x;
        }
        if (ElementStore.isFixed(x) && ElementStore.isFixed(y)) {
            if (x == y) {
                return ElementStore.IDENTITY;
            }
            if (x != ElementStore.A && y != ElementStore.A) {
                // b + c + d
                return ElementStore.B + ElementStore.C + ElementStore.D - x - y;
            }
        }

        long key = ((long) x << 32) | y;
        Integer cached = products.get(key);
        if (cached != null) {
            return cached;
        }

        boolean swapped;
        int left;
        int right;
        if (store.isSwapped(y)) {
            swapped = !store.isSwapped(x);
            left = multiply(store.right(x), store.left(y));
            right = multiply(store.left(x), store.right(y));
        } else {
            swapped = store.isSwapped(x);
            left = multiply(store.left(x), store.left(y));
            right = multiply(store.right(x), store.right(y));
        }

        int sizeBefore = store.size();
        int product = store.lookup(swapped, left, right);
        if (store.size() > sizeBefore) {
            PathStep step = lineage.step(y);
            if (step != null) {
                lineage.label(product, step);
            }
        }
        products.put(key, product);
        return product;
    }

    /**
     * Returns the number of memoized products.
     */
    public int memoizedProducts() {
        return products.size();
    }
}
