package com.williamcallahan.titlecase.service.casing;

/**
 * Character classes and case mappings shared by the tokenizer, classifier and fixup pass.
 *
 * <p>A word-constituent character is an ASCII letter, a Latin-1 Supplement letter
 * (U+00C0 to U+00FF, minus the multiplication and division signs), U+0178 (the uppercase
 * of {@code ÿ}, which lies outside Latin-1), an ASCII digit,
 * a period, or one of three apostrophe forms. Periods and apostrophes are included so
 * acronyms like {@code M.A.S.H.} and contractions like {@code 'n'} stay whole.</p>
 *
 * <p>Case mapping is strictly per character, so a mapped string always has the same
 * length as its source.</p>
 */
final class WordCharacters {

    static final char APOSTROPHE = '\'';
    static final char MODIFIER_APOSTROPHE = 'ʼ';
    static final char RIGHT_SINGLE_QUOTE = '’';

    private static final char LATIN1_LETTER_FIRST = 'À';
    private static final char LATIN1_LETTER_LAST = 'ÿ';
    private static final char MULTIPLICATION_SIGN = '×';
    private static final char DIVISION_SIGN = '÷';
    private static final char Y_DIAERESIS_UPPER = 'Ÿ';

    /** Regex character-class body for {@link #isLetter(char)}. */
    static final String LETTER_RANGES = "A-Za-z\\u00C0-\\u00D6\\u00D8-\\u00F6\\u00F8-\\u00FF\\u0178";
    static final String APOSTROPHES = "'\\u02BC\\u2019";

    /**
     * Characters that continue a word on either side of a phrase match. The period is left
     * out so a phrase still matches right before sentence punctuation.
     */
    static final String PHRASE_ADJACENT_CLASS = "[" + LETTER_RANGES + "0-9" + APOSTROPHES + "]";

    private WordCharacters() {}

    static boolean isLetter(char candidate) {
        if ((candidate >= 'a' && candidate <= 'z') || (candidate >= 'A' && candidate <= 'Z')) {
            return true;
        }
        if (candidate == Y_DIAERESIS_UPPER) {
            return true;
        }
        return candidate >= LATIN1_LETTER_FIRST
                && candidate <= LATIN1_LETTER_LAST
                && candidate != MULTIPLICATION_SIGN
                && candidate != DIVISION_SIGN;
    }

    static boolean isDigit(char candidate) {
        return candidate >= '0' && candidate <= '9';
    }

    static boolean isApostrophe(char candidate) {
        return candidate == APOSTROPHE || candidate == MODIFIER_APOSTROPHE || candidate == RIGHT_SINGLE_QUOTE;
    }

    static boolean isWordConstituent(char candidate) {
        return isLetter(candidate) || isDigit(candidate) || candidate == '.' || isApostrophe(candidate);
    }

    /**
     * Returns true when every character of the text is word-constituent.
     *
     * @param text text to test
     * @return false for empty text
     */
    static boolean isWordRun(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int index = 0; index < text.length(); index++) {
            if (!isWordConstituent(text.charAt(index))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Counts the letters of a word, ignoring digits, periods, apostrophes and anything else.
     */
    static int letterCount(String text) {
        int letters = 0;
        for (int index = 0; index < text.length(); index++) {
            if (isLetter(text.charAt(index))) {
                letters++;
            }
        }
        return letters;
    }

    static String toUpperCase(String text) {
        StringBuilder mapped = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            mapped.append(Character.toUpperCase(text.charAt(index)));
        }
        return mapped.toString();
    }

    static String toLowerCase(String text) {
        StringBuilder mapped = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            mapped.append(Character.toLowerCase(text.charAt(index)));
        }
        return mapped.toString();
    }

    /**
     * Uppercases the first letter that is not directly preceded by a digit, leaving every
     * other character untouched.
     *
     * <p>Unlike {@link String#toUpperCase()} on the first character, this skips leading
     * punctuation ({@code 'tis} becomes {@code 'Tis}) and never touches a letter that is
     * part of a numeric suffix.</p>
     *
     * @param text word to capitalize
     * @return capitalized word, or the input when it has no eligible letter
     */
    static String capitalize(String text) {
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (!isLetter(current)) {
                continue;
            }
            if (index > 0 && isDigit(text.charAt(index - 1))) {
                continue;
            }
            char upper = Character.toUpperCase(current);
            if (upper == current) {
                return text;
            }
            return text.substring(0, index) + upper + text.substring(index + 1);
        }
        return text;
    }
}
