package com.grigorchuk.core;

import java.util.Objects;

/**
 * Decomposes words according to the action of the group on the infinite binary tree.
 * {@code a} exchanges the two subtrees, while {@code b}, {@code c} and {@code d} act on each
 * subtree as {@code (c, a)}, {@code (d, a)} and {@code (b, 1)}; after an odd number of
 * {@code a}'s the roles of the subtrees are exchanged.
 */
public final class Splitter {

    private Splitter() {
    }

    public static Split split(CharSequence word) {
        Objects.requireNonNull(word, "word");
        boolean swapped = false;
        StringBuilder left = new StringBuilder();
        StringBuilder right = new StringBuilder();
        for (int i = 0; i < word.length(); i++) {
            switch (Generator.fromSymbol(word.charAt(i))) {
                case A -> swapped = !swapped;
                case B -> {
                    Words.append(left, swapped ? 'a' : 'c');
                    Words.append(right, swapped ? 'c' : 'a');
                }
                case C -> {
                    Words.append(left, swapped ? 'a' : 'd');
                    Words.append(right, swapped ? 'd' : 'a');
                }
                case D -> Words.append(swapped ? right : left, 'b');
            }
        }
        return new Split(swapped, left.toString(), right.toString());
    }

    /**
     * Returns the wreath notation of a word, for example {@code a(I,d)}. Only the empty word and
     * {@code d} are leaves, so a trivial word such as {@code aa} is written {@code (I,I)}.
     */
    public static String describe(CharSequence word) {
        Objects.requireNonNull(word, "word");
        if (word.length() == 0) {
            return "I";
        }
        if ("d".contentEquals(word)) {
            return "d";
        }
        Split split = split(word);
        return (split.swapped() ? "a(" : "(") + describe(split.left()) + "," + describe(split.right()) + ")";
    }
}
