package com.grigorchuk.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class WordProblemTest {

    @Test
    void decidesBaseCases() {
        assertTrue(WordProblem.isIdentity(""));
        assertFalse(WordProblem.isIdentity("d"));
        assertTrue(WordProblem.isIdentity("aa"));
        assertFalse(WordProblem.isIdentity("a"));
        assertFalse(WordProblem.isIdentity("b"));
        assertTrue(WordProblem.isIdentity("bcd"));
        assertTrue(WordProblem.isIdentity("dd"));
    }

    @Test
    void recognisesRelatorsAndTheirProperDivisors() {
        assertTrue(WordProblem.isIdentity("ad".repeat(4)));
        assertFalse(WordProblem.isIdentity("ad".repeat(2)));
        assertTrue(WordProblem.isIdentity("ac".repeat(8)));
        assertFalse(WordProblem.isIdentity("ac".repeat(4)));
        assertTrue(WordProblem.isIdentity("ab".repeat(16)));
        assertFalse(WordProblem.isIdentity("ab".repeat(8)));
    }

    @Test
    void wordTimesInverseIsIdentity() {
        String word = "abacabadacab";
        assertTrue(WordProblem.isIdentity(word + Words.inverse(word)));
        assertTrue(WordProblem.equivalent("bc", "d"));
        assertFalse(WordProblem.equivalent("ab", "ba"));
    }

    @Test
    void catalogueKeepsOneWordPerElement() {
        assertEquals(List.of(""), WordProblem.distinctReducedWords(0));
        assertEquals(List.of("a", "b", "c", "d"), WordProblem.distinctReducedWords(1));
        assertEquals(List.of("ab", "ac", "ad", "ba", "ca", "da"), WordProblem.distinctReducedWords(2));
        assertEquals(12, WordProblem.distinctReducedWords(3).size());
        assertEquals(17, WordProblem.distinctReducedWords(4).size());
        assertThrows(IllegalArgumentException.class, () -> WordProblem.distinctReducedWords(-1));
    }
}
