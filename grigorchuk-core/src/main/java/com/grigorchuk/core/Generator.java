package com.grigorchuk.core;

/**
 * The four generators of the Grigorchuk group. Every generator is an involution, and
 * {@code b}, {@code c}, {@code d} together with the identity form a Klein four-group.
 */
public enum Generator {
    A('a'),
    B('b'),
    C('c'),
    D('d');

    private final char symbol;

    Generator(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public static Generator fromSymbol(char symbol) {
        return switch (symbol) {
            case 'a' -> A;
            case 'b' -> B;
            case 'c' -> C;
            case 'd' -> D;
            default -> throw new IllegalArgumentException("Not a generator symbol: '" + symbol + "'");
        };
    }

    /**
     * Returns the product of two distinct members of {@code {b, c, d}}, which is the third one.
     */
    public static char kleinProduct(char first, char second) {
        return (char) (first ^ second ^ 'b' ^ 'c' ^ 'd');
    }
}
