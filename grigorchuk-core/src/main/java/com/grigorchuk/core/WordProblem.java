package com.grigorchuk.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether a word represents the identity of the group.
 */
public final class WordProblem {

    private static final char[] ALPHABET = {'a', 'b', 'c', 'd'};

    private WordProblem() {
    }

    /**
     * Returns {@code true} if {@code word} equals the identity. A word is trivial exactly when it
     * does not exchange the subtrees and both of its halves are trivial.
     */
    public static boolean isIdentity(CharSequence word) {
        Objects.requireNonNull(word, "word");
        if (word.length() == 0) {
            return true;
        }
        // d alternates with b on one side forever, so it needs its own base case
        if ("d".contentEquals(word)) {
            return false;
        }
        Split split = Splitter.split(word);
        if (split.swapped()) {
            return false;
        }
        return isIdentity(split.left()) && isIdentity(split.right());
    }

    /**
     * Returns {@code true} if both words represent the same group element.
     */
    public static boolean equivalent(CharSequence first, CharSequence second) {
        Objects.requireNonNull(first, "first");
        return isIdentity(first + Words.inverse(second));
    }

    /**
     * Lists the reduced words of exactly {@code length} symbols, in lexicographic order, that are
     * pairwise distinct as group elements. A word is dropped when it equals an earlier kept one.
     */
    public static List<String> distinctReducedWords(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("Length must be non-negative: " + length);
        }
        List<String> kept = new ArrayList<>();
        collect(new StringBuilder(), length, kept);
        return List.copyOf(kept);
    }

    private static void collect(StringBuilder prefix, int remaining, List<String> kept) {
        if (remaining == 0) {
            String candidate = prefix.toString();
            for (String existing : kept) {
                if (equivalent(existing, candidate)) {
                    return;
                }
            }
            kept.add(candidate);
            return;
        }
        for (char symbol : ALPHABET) {
            StringBuilder extended = new StringBuilder(prefix);
            Words.append(extended, symbol);
            if (extended.length() != prefix.length() + 1) {
                continue;
            }
            collect(extended, remaining - 1, kept);
        }
    }
}
