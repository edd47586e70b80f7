package com.williamcallahan.titlecase.service.casing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable word lists that decide which words stay lowercase inside a title.
 *
 * <p>Single-word function words are matched per token. Entries that can never be a single
 * token, either because they span several words ({@code as well as}) or because they contain
 * a separator character ({@code w/o}), are matched against the reassembled title instead,
 * in the order they were supplied.</p>
 *
 * <p>Instances are safe to share across threads.</p>
 */
public final class Lexicon {

    private static final Logger log = LoggerFactory.getLogger(Lexicon.class);

    /** AP-style cutoff: prepositions and conjunctions of four or more letters are capitalized. */
    public static final int DEFAULT_MAX_FUNCTION_WORD_LETTERS = 3;

    /**
     * Articles, conjunctions and prepositions lowercased mid-title. The {@code 'n'} variants
     * cover all three apostrophe forms so titles like "Toys 'n' Games" come out right.
     */
    public static final List<String> DEFAULT_FUNCTION_WORDS = List.of(
            "a", "an", "the",
            "and", "but", "for", "nor", "or", "so", "yet",
            "as", "at", "by", "cum", "in", "of", "off", "on", "out", "per", "pro", "to", "up", "via",
            "vs.", "v.", "c.", "ca.", "o'er", "w/o", "à",
            "'n", "n'", "'n'",
            "ʼn", "nʼ", "ʼnʼ",
            "’n", "n’", "’n’");

    public static final List<String> DEFAULT_PHRASES = List.of(
            "as for",
            "as per",
            "as well as",
            "away from",
            "but for",
            "due to",
            "far from",
            "in case of",
            "in face of",
            "in view of",
            "near to",
            "off of",
            "out of",
            "vis-à-vis",
            "à la");

    private static final Lexicon DEFAULT = of(DEFAULT_FUNCTION_WORDS, DEFAULT_PHRASES, DEFAULT_MAX_FUNCTION_WORD_LETTERS);

    private final Set<String> functionWords;
    private final List<PhrasalPreposition> phrases;
    private final int maxFunctionWordLetters;

    private Lexicon(Set<String> functionWords, List<PhrasalPreposition> phrases, int maxFunctionWordLetters) {
        this.functionWords = Collections.unmodifiableSet(functionWords);
        this.phrases = List.copyOf(phrases);
        this.maxFunctionWordLetters = maxFunctionWordLetters;
    }

    /**
     * Returns the built-in lexicon.
     *
     * @return shared default lexicon
     */
    public static Lexicon defaults() {
        return DEFAULT;
    }

    /**
     * Builds a lexicon from the built-in lists plus caller-supplied entries.
     *
     * <p>Built-in function words longer than the letter limit are dropped, so lowering the
     * limit narrows the defaults. Supplied words over the limit are rejected.</p>
     *
     * @param additionalFunctionWords extra function words
     * @param additionalPhrases extra phrases, matched after the built-in ones
     * @param maxFunctionWordLetters highest letter count allowed for a function word
     * @return validated lexicon
     * @throws LexiconConfigurationException when a supplied entry is invalid
     */
    public static Lexicon defaultsWith(
            Collection<String> additionalFunctionWords,
            Collection<String> additionalPhrases,
            int maxFunctionWordLetters) {
        List<String> functionWords = new ArrayList<>();
        for (String word : DEFAULT_FUNCTION_WORDS) {
            if (WordCharacters.letterCount(word) <= maxFunctionWordLetters) {
                functionWords.add(word);
            }
        }
        functionWords.addAll(additionalFunctionWords);
        List<String> phrases = new ArrayList<>(DEFAULT_PHRASES);
        phrases.addAll(additionalPhrases);
        return of(functionWords, phrases, maxFunctionWordLetters);
    }

    /**
     * Builds a lexicon, validating every entry.
     *
     * @param functionWords words lowercased when they appear as a whole token
     * @param phrases multi-word entries lowercased after reassembly, in match order
     * @param maxFunctionWordLetters highest letter count allowed for a function word
     * @return validated lexicon
     * @throws LexiconConfigurationException when an entry is blank, too long, or a
     *     single plain word listed as a phrase
     */
    public static Lexicon of(
            Collection<String> functionWords, Collection<String> phrases, int maxFunctionWordLetters) {
        if (maxFunctionWordLetters < 1) {
            throw new LexiconConfigurationException(
                    "Function word letter limit must be at least 1 (got " + maxFunctionWordLetters + ")");
        }
        Set<String> tokenWords = new LinkedHashSet<>();
        List<PhrasalPreposition> compiledPhrases = new ArrayList<>();
        for (String word : functionWords) {
            if (word == null || word.isBlank()) {
                throw new LexiconConfigurationException("Function words must not be blank");
            }
            String normalized = WordCharacters.toLowerCase(word.strip());
            int letters = WordCharacters.letterCount(normalized);
            if (letters > maxFunctionWordLetters) {
                throw new LexiconConfigurationException("Function word '" + normalized + "' has " + letters
                        + " letters; the limit is " + maxFunctionWordLetters);
            }
            if (WordCharacters.isWordRun(normalized)) {
                tokenWords.add(normalized);
            } else {
                // Splits across several tokens, so only the phrase pass can see it.
                compiledPhrases.add(PhrasalPreposition.compile(normalized));
            }
        }
        for (String phrase : phrases) {
            PhrasalPreposition compiled = PhrasalPreposition.compile(phrase);
            if (compiled.wordCount() < 2 && WordCharacters.isWordRun(compiled.canonical())) {
                throw new LexiconConfigurationException(
                        "Phrase '" + compiled.canonical() + "' is a single word; list it as a function word");
            }
            compiledPhrases.add(compiled);
        }
        log.debug("Built lexicon with {} function words and {} phrases (letter limit {})",
                tokenWords.size(), compiledPhrases.size(), maxFunctionWordLetters);
        return new Lexicon(tokenWords, compiledPhrases, maxFunctionWordLetters);
    }

    /**
     * Returns whether a single token is a function word, ignoring case.
     *
     * @param token token text
     * @return true when the lowercased token is listed
     */
    public boolean isFunctionWord(String token) {
        return functionWords.contains(WordCharacters.toLowerCase(token));
    }

    public Set<String> functionWords() {
        return functionWords;
    }

    public List<PhrasalPreposition> phrases() {
        return phrases;
    }

    public int maxFunctionWordLetters() {
        return maxFunctionWordLetters;
    }
}
