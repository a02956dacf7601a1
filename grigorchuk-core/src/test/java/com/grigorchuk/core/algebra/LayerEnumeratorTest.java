package com.grigorchuk.core.algebra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class LayerEnumeratorTest {

    private static GrigorchukGroup group;
    private static CayleyLayers layers;

    @BeforeAll
    static void enumerate() {
        group = new GrigorchukGroup(1000);
        group.prepare();
        layers = group.layers();
    }

    @Test
    void startsAtIdentity() {
        assertEquals(ElementStore.IDENTITY, layers.element(0));
        assertEquals(0, layers.distance(0));
        assertEquals(0, group.distance(ElementStore.IDENTITY));
    }

    @Test
    void expandsExactlyTheBudget() {
        assertEquals(1000, layers.processed());
        assertTrue(layers.discovered() > layers.processed());
    }

    @Test
    void layerSizesMatchGrowthOfTheSubgroup() {
        List<CayleyLayers.Layer> expected = List.of(
                new CayleyLayers.Layer(0, 1),
                new CayleyLayers.Layer(1, 3),
                new CayleyLayers.Layer(2, 6),
                new CayleyLayers.Layer(3, 12),
                new CayleyLayers.Layer(4, 21),
                new CayleyLayers.Layer(5, 36),
                new CayleyLayers.Layer(6, 63),
                new CayleyLayers.Layer(7, 108));
        assertEquals(expected, layers.layers().subList(0, expected.size()));
        assertEquals(10, layers.completeDepth());
    }

    @Test
    void distancesAreNonDecreasingInDiscoveryOrder() {
        for (int i = 1; i < layers.discovered(); i++) {
            assertTrue(layers.distance(i - 1) <= layers.distance(i), "Order broken at index " + i);
            assertEquals(layers.distance(i), group.distance(layers.element(i)));
        }
    }

    @Test
    void distanceIsOneMoreThanClosestPredecessor() {
        for (int i = 1; i < layers.discovered(); i++) {
            int distance = layers.distance(i);
            if (distance > layers.completeDepth()) {
                break;
            }
            int element = layers.element(i);
            int closest = Integer.MAX_VALUE;
            for (int predecessor : new int[] {
                    group.multiply(element, ElementStore.B),
                    group.multiply(element, group.ca()),
                    group.multiply(element, group.ac())}) {
                int predecessorDistance = group.distance(predecessor);
                if (predecessorDistance >= 0) {
                    closest = Math.min(closest, predecessorDistance);
                }
            }
            assertEquals(distance - 1, closest, "Element at index " + i);
        }
    }

    @Test
    void labelsEveryDiscoveredElement() {
        Lineage lineage = group.lineage();
        assertEquals(PathStep.B, lineage.step(layers.element(1)));
        assertEquals(PathStep.AC, lineage.step(layers.element(2)));
        assertEquals(PathStep.CA, lineage.step(layers.element(3)));
        for (int i = 1; i < layers.discovered(); i++) {
            assertTrue(lineage.isVisited(layers.element(i)));
        }
    }

    @Test
    void rejectsInvalidLimitAndSecondRun() {
        ElementStore store = new ElementStore();
        Lineage lineage = new Lineage();
        Multiplier multiplier = new Multiplier(store, lineage);
        LayerEnumerator enumerator = new LayerEnumerator(multiplier, lineage);
        int ac = multiplier.multiply(ElementStore.A, ElementStore.C);
        int ca = multiplier.multiply(ElementStore.C, ElementStore.A);

        assertThrows(IllegalArgumentException.class, () -> enumerator.enumerate(ac, ca, 0));
        CayleyLayers small = enumerator.enumerate(ac, ca, 1);
        assertEquals(4, small.discovered());
        assertEquals(1, small.completeDepth());
        assertThrows(IllegalStateException.class, () -> enumerator.enumerate(ac, ca, 1));
    }
}
