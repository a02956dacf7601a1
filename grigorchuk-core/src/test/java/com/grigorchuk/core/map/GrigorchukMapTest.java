package com.grigorchuk.core.map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.grigorchuk.core.WordProblem;
import com.grigorchuk.core.Words;
import com.grigorchuk.core.algebra.GrigorchukGroup;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class GrigorchukMapTest {

    @Test
    void originIsBoundToIdentity() {
        GrigorchukGroup group = new GrigorchukGroup(200);
        GrigorchukMap<Tile> map = TileAllocator.newMap(group);

        Tile origin = map.getOriginNode();
        assertTrue(group.isPrepared(), "Creating a map prepares the group");
        assertEquals(group.identity(), map.element(origin));
        assertEquals(0, map.distance(origin));
        assertEquals("", map.label(origin));
        assertEquals(1, map.size());
    }

    @Test
    void stepsAreIdempotent() {
        GrigorchukMap<Tile> map = TileAllocator.newMap(new GrigorchukGroup(200));
        Tile origin = map.getOriginNode();
        for (Direction direction : Direction.values()) {
            Tile first = map.step(origin, direction);
            Tile second = map.step(origin, direction.index());
            assertSame(first, second);
        }
        assertEquals(4, map.size());
    }

    @Test
    void stepsMultiplyByDirectionGenerators() {
        GrigorchukGroup group = new GrigorchukGroup(200);
        GrigorchukMap<Tile> map = TileAllocator.newMap(group);
        Tile origin = map.getOriginNode();

        Tile viaAc = map.step(origin, Direction.AC);
        Tile viaCa = map.step(origin, Direction.CA);
        Tile viaB = map.step(origin, Direction.B);

        assertEquals(group.ac(), map.element(viaAc));
        assertEquals(group.ca(), map.element(viaCa));
        assertEquals(group.element("b"), map.element(viaB));
        assertEquals("ac", map.label(viaAc));
        assertEquals("ca", map.label(viaCa));
        assertEquals("b", map.label(viaB));
        assertEquals(1, map.distance(viaB));
    }

    @Test
    void reverseStepsReturnToTheSameTile() {
        GrigorchukMap<Tile> map = TileAllocator.newMap(new GrigorchukGroup(200));
        Tile origin = map.getOriginNode();
        for (Direction direction : Direction.values()) {
            Tile neighbour = map.step(origin, direction);
            assertSame(origin, map.step(neighbour, direction.reverse()));
            assertSame(origin, neighbour.neighbour(direction.reverse()));
            assertSame(neighbour, origin.neighbour(direction));
        }
    }

    @Test
    void relationsCloseCycles() {
        GrigorchukMap<Tile> map = TileAllocator.newMap(new GrigorchukGroup(200));
        Tile origin = map.getOriginNode();

        Tile current = origin;
        for (int i = 0; i < 7; i++) {
            current = map.step(current, Direction.AC);
            assertNotSame(origin, current, "(ac)^" + (i + 1) + " is not the identity");
        }
        assertSame(origin, map.step(current, Direction.AC), "(ac)^8 is the identity");
        assertEquals(8, map.size());
    }

    @Test
    void bindingIsBijective() {
        GrigorchukGroup group = new GrigorchukGroup(300);
        GrigorchukMap<Tile> map = TileAllocator.newMap(group);
        List<Tile> tiles = explore(map, 6);

        Set<Integer> elements = new HashSet<>();
        for (Tile tile : tiles) {
            int element = map.element(tile);
            assertTrue(elements.add(element), "Element bound twice: " + element);
            assertSame(tile, map.node(element).orElseThrow());
        }
        assertEquals(tiles.size(), map.size());
    }

    @Test
    void labelsEvaluateToTheirElements() {
        GrigorchukGroup group = new GrigorchukGroup(300);
        GrigorchukMap<Tile> map = TileAllocator.newMap(group);
        for (Tile tile : explore(map, 7)) {
            String word = map.label(tile);
            assertEquals(map.element(tile), group.element(word), "Label " + word);
            assertTrue(WordProblem.isIdentity(Words.reduce(word + Words.inverse(word))));
            assertTrue(map.distance(tile) <= tile.depth(), "BFS distance cannot exceed the walked depth");
        }
    }

    @Test
    void tilesBeyondEnumerationHaveNoDistance() {
        GrigorchukMap<Tile> map = TileAllocator.newMap(new GrigorchukGroup(1));
        Tile current = map.getOriginNode();
        current = map.step(current, Direction.B);
        current = map.step(current, Direction.AC);
        assertEquals(-1, map.distance(current));
        assertEquals("bac", map.label(current));
    }

    @Test
    void rejectsForeignNodesAndDirections() {
        GrigorchukMap<Tile> map = TileAllocator.newMap(new GrigorchukGroup(10));
        Tile stranger = new TileAllocator().origin();
        assertThrows(IllegalArgumentException.class, () -> map.step(stranger, Direction.B));
        assertThrows(IllegalArgumentException.class, () -> map.step(map.getOriginNode(), 3));
        assertTrue(map.node(123_456).isEmpty());
    }

    @Test
    void worksWithAnyHostNodeType() {
        GrigorchukGroup group = new GrigorchukGroup(100);
        List<String> connections = new ArrayList<>();
        NodeAllocator<String> allocator = new NodeAllocator<>() {
            private int next = 1;

            @Override
            public String allocate(String parent, Direction direction) {
                return "n" + next++;
            }

            @Override
            public void connect(String from, Direction direction, String to) {
                connections.add(from + "-" + direction + "->" + to);
            }
        };
        GrigorchukMap<String> map = new GrigorchukMap<>(group, "n0", allocator);

        String b = map.step("n0", 2);
        assertEquals("n1", b);
        assertEquals("n0", map.step(b, 2));
        assertEquals(List.of("n0-B->n1", "n1-B->n0"), connections);
    }

    private static List<Tile> explore(GrigorchukMap<Tile> map, int radius) {
        List<Tile> visited = new ArrayList<>();
        Set<Tile> seen = new HashSet<>();
        Deque<Tile> queue = new ArrayDeque<>();
        Tile origin = map.getOriginNode();
        queue.add(origin);
        seen.add(origin);
        while (!queue.isEmpty()) {
            Tile tile = queue.poll();
            visited.add(tile);
            if (tile.depth() >= radius) {
                continue;
            }
            for (Direction direction : Direction.values()) {
                Tile neighbour = map.step(tile, direction);
                if (seen.add(neighbour)) {
                    queue.add(neighbour);
                }
            }
        }
        return visited;
    }
}
