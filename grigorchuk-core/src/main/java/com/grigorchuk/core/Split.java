package com.grigorchuk.core;

import java.util.Objects;

/**
 * Result of splitting a word along the first level of the binary tree.
 *
 * @param swapped {@code true} if the word exchanges the two subtrees
 * @param left    reduced word acting on the left subtree
 * @param right   reduced word acting on the right subtree
 */
public record Split(boolean swapped, String left, String right) {

    public Split {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }
}
