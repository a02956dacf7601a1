package com.grigorchuk.core.algebra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.grigorchuk.core.WordProblem;
import com.grigorchuk.core.Words;
import org.junit.jupiter.api.Test;

class DecoderTest {

    @Test
    void decodesFirstLayers() {
        GrigorchukGroup group = new GrigorchukGroup(100);
        group.prepare();
        CayleyLayers layers = group.layers();

        assertEquals("", group.decode(layers.element(0)));
        assertEquals("b", group.decode(layers.element(1)));
        assertEquals("ac", group.decode(layers.element(2)));
        assertEquals("ca", group.decode(layers.element(3)));
        assertEquals("bac", group.decode(layers.element(4)));
        assertEquals("acac", group.decode(layers.element(7)));
    }

    @Test
    void decodedWordEvaluatesToElement() {
        GrigorchukGroup group = new GrigorchukGroup(500);
        group.prepare();
        CayleyLayers layers = group.layers();
        for (int i = 0; i < layers.discovered(); i++) {
            int element = layers.element(i);
            String word = group.decode(element);
            assertEquals(element, group.element(word), "Word " + word);
            assertTrue(WordProblem.isIdentity(Words.reduce(word + Words.inverse(word))));
        }
    }

    @Test
    void decodedLengthTracksDistance() {
        GrigorchukGroup group = new GrigorchukGroup(300);
        group.prepare();
        CayleyLayers layers = group.layers();
        for (int i = 0; i < layers.discovered(); i++) {
            String word = group.decode(layers.element(i));
            int distance = layers.distance(i);
            assertTrue(word.length() >= distance && word.length() <= 2 * distance, "Word " + word);
        }
    }

    @Test
    void failsForElementsWithoutRecordedSteps() {
        ElementStore store = new ElementStore();
        Lineage lineage = new Lineage();
        Multiplier multiplier = new Multiplier(store, lineage);
        Decoder decoder = new Decoder(store, lineage, multiplier);
        int unlabelled = store.lookup(true, ElementStore.B, ElementStore.B);

        assertThrows(IllegalStateException.class, () -> decoder.decode(unlabelled));
        assertThrows(IllegalArgumentException.class, () -> decoder.decode(store.size()));
    }

    @Test
    void failsForCyclicSteps() {
        ElementStore store = new ElementStore();
        Lineage lineage = new Lineage();
        Multiplier multiplier = new Multiplier(store, lineage);
        Decoder decoder = new Decoder(store, lineage, multiplier);
        int ab = multiplier.multiply(ElementStore.A, ElementStore.B);
        // a step that maps ab back onto itself
        lineage.label(ab, PathStep.AC);
        int abca = multiplier.multiply(multiplier.multiply(ab, ElementStore.C), ElementStore.A);
        lineage.label(abca, PathStep.CA);

        assertThrows(IllegalStateException.class, () -> decoder.decode(ab));
    }

    @Test
    void decodesGeneratorsWithoutEnumeration() {
        GrigorchukGroup group = new GrigorchukGroup(1);
        assertEquals("a", group.decode(ElementStore.A));
        assertEquals("d", group.decode(ElementStore.D));
    }
}
