package com.grigorchuk.core.map;

import com.grigorchuk.core.Generator;
import com.grigorchuk.core.algebra.PathStep;
import java.util.List;

/**
 * The three edges leaving every tile. Stepping along a direction right-multiplies the element of
 * the tile by {@code ac}, {@code ca} or {@code b}.
 */
public enum Direction {
    AC(0, PathStep.AC),
    CA(1, PathStep.CA),
    B(2, PathStep.B);

    public static final int COUNT = 3;

    private final int index;
    private final PathStep step;

    Direction(int index, PathStep step) {
        this.index = index;
        this.step = step;
    }

    public int index() {
        return index;
    }

    public PathStep step() {
        return step;
    }

    public List<Generator> generators() {
        return step.generators();
    }

    /**
     * Returns the direction leading back: {@code ac} and {@code ca} are mutually inverse and
     * {@code b} is an involution.
     */
    public Direction reverse() {
        return switch (this) {
            case AC -> CA;
            case CA -> AC;
            case B -> B;
        };
    }

    public static Direction fromIndex(int index) {
        return switch (index) {
            case 0 -> AC;
            case 1 -> CA;
            case 2 -> B;
            default -> throw new IllegalArgumentException("Direction index out of range: " + index);
        };
    }
}
