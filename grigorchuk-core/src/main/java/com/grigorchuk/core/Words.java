package com.grigorchuk.core;

import java.util.Objects;

/**
 * Free reduction of generator words using the local relations {@code aa = bb = cc = dd = 1} and
 * {@code bc = d}, {@code bd = c}, {@code cd = b}.
 */
public final class Words {

    private Words() {
    }

    /**
     * Appends {@code symbol} to an already reduced word, keeping it reduced.
     */
    public static void append(StringBuilder word, char symbol) {
        Objects.requireNonNull(word, "word");
        Generator.fromSymbol(symbol);
        int length = word.length();
        if (length == 0) {
            word.append(symbol);
            return;
        }
        char last = word.charAt(length - 1);
        if (last == symbol) {
            word.setLength(length - 1);
        } else if (symbol != 'a' && last != 'a') {
            word.setCharAt(length - 1, Generator.kleinProduct(last, symbol));
        } else {
            word.append(symbol);
        }
    }

    public static String reduce(CharSequence word) {
        Objects.requireNonNull(word, "word");
        StringBuilder reduced = new StringBuilder(word.length());
        for (int i = 0; i < word.length(); i++) {
            append(reduced, word.charAt(i));
        }
        return reduced.toString();
    }

    /**
     * Returns a word for the inverse element. All generators are involutions, so this is the
     * reversed word.
     */
    public static String inverse(CharSequence word) {
        Objects.requireNonNull(word, "word");
        for (int i = 0; i < word.length(); i++) {
            Generator.fromSymbol(word.charAt(i));
        }
        return new StringBuilder(word).reverse().toString();
    }

    /**
     * Returns {@code true} if no further local rewriting applies to the word.
     */
    public static boolean isReduced(CharSequence word) {
        return reduce(word).length() == word.length();
    }
}
