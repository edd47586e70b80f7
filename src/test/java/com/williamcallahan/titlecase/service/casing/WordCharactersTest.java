package com.williamcallahan.titlecase.service.casing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Tests character classes and per-character case mapping.
 */
class WordCharactersTest {

    @Test
    void wordConstituentCoversLatin1LettersDigitsPeriodAndApostrophes() {
        assertTrue(WordCharacters.isWordConstituent('é'));
        assertTrue(WordCharacters.isWordConstituent('Ø'));
        assertTrue(WordCharacters.isWordConstituent('7'));
        assertTrue(WordCharacters.isWordConstituent('.'));
        assertTrue(WordCharacters.isWordConstituent('\''));
        assertTrue(WordCharacters.isWordConstituent('ʼ'));
        assertTrue(WordCharacters.isWordConstituent('’'));
        assertTrue(WordCharacters.isWordConstituent('Ÿ'));
        assertFalse(WordCharacters.isWordConstituent('×'));
        assertFalse(WordCharacters.isWordConstituent('÷'));
        assertFalse(WordCharacters.isWordConstituent('_'));
        assertFalse(WordCharacters.isWordConstituent('‘'));
        assertFalse(WordCharacters.isWordConstituent('-'));
    }

    @Test
    void capitalizeSkipsLeadingPunctuationAndDigitSuffixes() {
        assertEquals("'Tis", WordCharacters.capitalize("'tis"));
        assertEquals("Élan", WordCharacters.capitalize("élan"));
        assertEquals("3d", WordCharacters.capitalize("3d"));
        assertEquals("X2y", WordCharacters.capitalize("x2y"));
        assertEquals("1.A", WordCharacters.capitalize("1.a"));
        assertEquals("", WordCharacters.capitalize(""));
        assertEquals("McCoy", WordCharacters.capitalize("mcCoy"));
    }

    @Test
    void caseMappingPreservesLength() {
        assertEquals("ß.", WordCharacters.toUpperCase("ß."));
        assertEquals("Ÿ", WordCharacters.toUpperCase("ÿ"));
        assertEquals("vis-à-vis", WordCharacters.toLowerCase("VIS-À-VIS"));
    }

    @Test
    void letterCountIgnoresPunctuation() {
        assertEquals(3, WordCharacters.letterCount("o'er"));
        assertEquals(1, WordCharacters.letterCount("c."));
        assertEquals(2, WordCharacters.letterCount("w/o"));
    }
}
