package com.grigorchuk.core.map;

/**
 * Distance based tile colouring.
 */
public final class TileColors {

    private static final int DISTANCE_STEP = 0x102008;

    private TileColors() {
    }

    /**
     * Returns an RGB colour that brightens with the distance from the identity. Elements the
     * enumeration never reached ({@code distance == -1}) are black.
     */
    public static int canvasColor(int distance) {
        return (DISTANCE_STEP * (1 + distance)) & 0xFFFFFF;
    }

    public static String toWeb(int rgb) {
        return String.format("#%06X", rgb & 0xFFFFFF);
    }
}
