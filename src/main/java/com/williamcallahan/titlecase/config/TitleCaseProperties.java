package com.williamcallahan.titlecase.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Title casing settings bound from {@code app.title-case.*}.
 */
@ConfigurationProperties(prefix = "app.title-case")
public class TitleCaseProperties {

    private static final int MAX_LETTERS_DEF = 3;
    private static final String VERSION_DEF = "unknown";
    private static final int MIN_POSITIVE = 1;
    private static final String MAX_LETTERS_KEY = "app.title-case.max-function-word-letters";
    private static final String EXTRA_WORDS_KEY = "app.title-case.additional-function-words";
    private static final String EXTRA_PHRASES_KEY = "app.title-case.additional-phrases";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String BLANK_ENTRY_FMT = "%s must not contain blank entries (index %d).";

    private int maxFunctionWordLetters = MAX_LETTERS_DEF;
    private List<String> additionalFunctionWords = new ArrayList<>();
    private List<String> additionalPhrases = new ArrayList<>();
    private String version = VERSION_DEF;

    /**
     * Creates title casing configuration.
     */
    public TitleCaseProperties() {}

    /**
     * Validates title casing settings.
     */
    public void validateConfiguration() {
        if (maxFunctionWordLetters < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, MAX_LETTERS_KEY));
        }
        requireNoBlankEntries(EXTRA_WORDS_KEY, additionalFunctionWords);
        requireNoBlankEntries(EXTRA_PHRASES_KEY, additionalPhrases);
    }

    private static void requireNoBlankEntries(String key, List<String> entries) {
        for (int index = 0; index < entries.size(); index++) {
            String entry = entries.get(index);
            if (entry == null || entry.isBlank()) {
                throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_ENTRY_FMT, key, index));
            }
        }
    }

    /**
     * Returns the letter limit for single-word function words.
     *
     * @return letter limit for single-word function words
     */
    public int getMaxFunctionWordLetters() {
        return maxFunctionWordLetters;
    }

    /**
     * Sets the letter limit for single-word function words.
     *
     * @param maxFunctionWordLetters letter limit for single-word function words
     */
    public void setMaxFunctionWordLetters(final int maxFunctionWordLetters) {
        this.maxFunctionWordLetters = maxFunctionWordLetters;
    }

    public List<String> getAdditionalFunctionWords() {
        return additionalFunctionWords;
    }

    public void setAdditionalFunctionWords(final List<String> additionalFunctionWords) {
        this.additionalFunctionWords = additionalFunctionWords == null ? new ArrayList<>() : additionalFunctionWords;
    }

    public List<String> getAdditionalPhrases() {
        return additionalPhrases;
    }

    public void setAdditionalPhrases(final List<String> additionalPhrases) {
        this.additionalPhrases = additionalPhrases == null ? new ArrayList<>() : additionalPhrases;
    }

    /**
     * Returns the version reported by {@code --version}.
     *
     * @return application version
     */
    public String getVersion() {
        return version;
    }

    public void setVersion(final String version) {
        this.version = version;
    }
}
