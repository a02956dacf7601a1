package com.grigorchuk.core;

import com.grigorchuk.core.algebra.CayleyLayers;
import com.grigorchuk.core.algebra.GrigorchukGroup;
import com.grigorchuk.core.map.Direction;
import com.grigorchuk.core.map.GrigorchukMap;
import com.grigorchuk.core.map.Tile;
import com.grigorchuk.core.map.TileAllocator;
import com.grigorchuk.core.map.TileColors;
import java.util.Scanner;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Console front-end for walking the Grigorchuk map one tile at a time.
 */
public final class GrigorchukCLI {

    private static final Logger LOGGER = Logger.getLogger(GrigorchukCLI.class.getName());

    private GrigorchukCLI() {
    }

    public static void main(String[] args) {
        GrigorchukOptions options;
        try {
            options = GrigorchukOptions.parse(args);
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            System.err.println(GrigorchukOptions.usage());
            return;
        }
        if (!options.grigorchukSelected()) {
            System.err.println(GrigorchukOptions.usage());
            return;
        }

        GrigorchukGroup group = new GrigorchukGroup(options.limit());
        group.prepare();
        printLayers(group.layers());

        GrigorchukMap<Tile> map = TileAllocator.newMap(group);
        Tile current = map.getOriginNode();
        Scanner scanner = new Scanner(System.in);

        System.out.println("Grigorchuk map console");
        while (true) {
            printTile(map, current, options);
            System.out.print("Move (0 = ac, 1 = ca, 2 = b), '? <word>' to test a word, 'q' to quit: ");
            if (!scanner.hasNextLine()) {
                break;
            }
            String input = scanner.nextLine().trim();
            if (input.equals("q")) {
                break;
            }
            if (input.startsWith("?")) {
                checkWord(input.substring(1).trim());
                continue;
            }
            int direction;
            try {
                direction = Integer.parseInt(input);
            } catch (NumberFormatException ex) {
                System.out.println("Please enter 0, 1, 2, a word query or q.");
                continue;
            }
            if (direction < 0 || direction >= Direction.COUNT) {
                System.out.println("Direction must be between 0 and 2.");
                continue;
            }
            current = map.step(current, direction);
        }
        System.out.printf("Visited %d tiles, %d elements interned%n", map.size(), group.store().size());
    }

    private static void printLayers(CayleyLayers layers) {
        System.out.printf("Enumerated %d elements, complete up to distance %d%n",
                layers.discovered(), layers.completeDepth());
        for (CayleyLayers.Layer layer : layers.layers()) {
            System.out.printf("  distance %3d: %d%n", layer.depth(), layer.size());
        }
    }

    private static void printTile(GrigorchukMap<Tile> map, Tile tile, GrigorchukOptions options) {
        int distance = map.distance(tile);
        System.out.printf("%s  distance %s  colour %s%n", tile,
                distance < 0 ? "beyond limit" : Integer.toString(distance),
                TileColors.toWeb(TileColors.canvasColor(distance)));
        if (options.showLabels()) {
            String word = map.label(tile);
            System.out.printf("  word: %s%n", word.isEmpty() ? "I" : word);
        }
    }

    private static void checkWord(String word) {
        try {
            boolean identity = WordProblem.isIdentity(word);
            System.out.printf("  %s is %sthe identity, reduced %s, tree %s%n", word.isEmpty() ? "I" : word,
                    identity ? "" : "not ", Words.reduce(word), Splitter.describe(word));
        } catch (IllegalArgumentException ex) {
            System.out.println("  " + ex.getMessage());
        }
    }
}
