package com.grigorchuk.core.algebra;

import com.grigorchuk.core.Generator;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Algebra engine for the Grigorchuk group. One instance owns an interning context together with
 * the scratch data used for decoding, and prepares the breadth-first layers of the subgroup
 * generated by {@code b}, {@code ac} and {@code ca} on first use.
 *
 * <p>Instances are not thread-safe; confine each one to a single thread.
 */
public final class GrigorchukGroup {

    private static final Logger LOGGER = Logger.getLogger(GrigorchukGroup.class.getName());

    private final ElementStore store = new ElementStore();
    private final Lineage lineage = new Lineage();
    private final Multiplier multiplier = new Multiplier(store, lineage);
    private final Decoder decoder = new Decoder(store, lineage, multiplier);
    private final int limit;

    private int ac = -1;
    private int ca = -1;
    private CayleyLayers layers;

    public GrigorchukGroup() {
        this(LayerEnumerator.DEFAULT_LIMIT);
    }

    public GrigorchukGroup(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Enumeration limit must be at least 1: " + limit);
        }
        this.limit = limit;
    }

    /**
     * Computes {@code ac}, {@code ca} and the breadth-first layers. Later calls do nothing.
     */
    public void prepare() {
        if (layers != null) {
            return;
        }
        ac = multiplier.multiply(ElementStore.A, ElementStore.C);
        ca = multiplier.multiply(ElementStore.C, ElementStore.A);
        layers = new LayerEnumerator(multiplier, lineage).enumerate(ac, ca, limit);
        LOGGER.fine(() -> String.format("Prepared group with %d interned elements", store.size()));
    }

    public boolean isPrepared() {
        return layers != null;
    }

    public int limit() {
        return limit;
    }

    public int identity() {
        return ElementStore.IDENTITY;
    }

    public int generator(Generator generator) {
        return ElementStore.handleOf(Objects.requireNonNull(generator, "generator"));
    }

    public int ac() {
        requirePrepared();
        return ac;
    }

    public int ca() {
        requirePrepared();
        return ca;
    }

    public int multiply(int x, int y) {
        return multiplier.multiply(x, y);
    }

    /**
     * Returns the canonical element of a word.
     */
    public int element(CharSequence word) {
        Objects.requireNonNull(word, "word");
        int result = ElementStore.IDENTITY;
        for (int i = 0; i < word.length(); i++) {
            result = multiplier.multiply(result, ElementStore.handleOf(Generator.fromSymbol(word.charAt(i))));
        }
        return result;
    }

    public boolean isIdentity(int element) {
        if (!store.contains(element)) {
            throw new IllegalArgumentException("Unknown element handle: " + element);
        }
        return element == ElementStore.IDENTITY;
    }

    /**
     * Returns the breadth-first distance of an element from the identity, or {@code -1} if the
     * enumeration did not reach it.
     */
    public int distance(int element) {
        if (!store.contains(element)) {
            throw new IllegalArgumentException("Unknown element handle: " + element);
        }
        return lineage.distance(element);
    }

    public String decode(int element) {
        return decoder.decode(element);
    }

    public CayleyLayers layers() {
        requirePrepared();
        return layers;
    }

    public ElementStore store() {
        return store;
    }

    public Lineage lineage() {
        return lineage;
    }

    private void requirePrepared() {
        if (layers == null) {
            throw new IllegalStateException("Group has not been prepared");
        }
    }
}
