package com.williamcallahan.titlecase.service.casing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A function-word phrase that is lowercased as a unit after token casing, such as
 * {@code as well as} or {@code w/o}.
 *
 * <p>The pattern matches case-insensitively and only on whole words. Whitespace between
 * words matches any whitespace run.</p>
 *
 * @param canonical lowercase form of the phrase
 * @param pattern compiled whole-word matcher
 */
public record PhrasalPreposition(String canonical, Pattern pattern) {

    private static final int PATTERN_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final String WHITESPACE_RUN = "\\s+";
    private static final String LEADING_BOUNDARY = "(?<!" + WordCharacters.PHRASE_ADJACENT_CLASS + ")";
    private static final String TRAILING_BOUNDARY = "(?!" + WordCharacters.PHRASE_ADJACENT_CLASS + ")";

    public PhrasalPreposition {
        Objects.requireNonNull(canonical, "canonical");
        Objects.requireNonNull(pattern, "pattern");
    }

    /**
     * Builds the matcher for a phrase.
     *
     * @param phrase phrase text in any case; surrounding whitespace is ignored
     * @return compiled phrase
     * @throws LexiconConfigurationException when the phrase is blank or cannot be compiled
     */
    public static PhrasalPreposition compile(String phrase) {
        if (phrase == null || phrase.isBlank()) {
            throw new LexiconConfigurationException("Phrase entries must not be blank");
        }
        String canonical = WordCharacters.toLowerCase(phrase.strip());
        List<String> quotedWords = new ArrayList<>();
        for (String word : canonical.split(WHITESPACE_RUN)) {
            quotedWords.add(Pattern.quote(word));
        }
        String regex = LEADING_BOUNDARY + String.join(WHITESPACE_RUN, quotedWords) + TRAILING_BOUNDARY;
        try {
            return new PhrasalPreposition(canonical, Pattern.compile(regex, PATTERN_FLAGS));
        } catch (PatternSyntaxException e) {
            throw new LexiconConfigurationException("Phrase '" + phrase + "' does not compile: " + e.getDescription(), e);
        }
    }

    /**
     * Lowercases every whole-word occurrence of this phrase, keeping the original whitespace.
     *
     * @param title title text
     * @return title with each occurrence lowercased
     */
    public String lowercaseOccurrences(String title) {
        Matcher matcher = pattern.matcher(title);
        if (!matcher.find()) {
            return title;
        }
        StringBuilder rewritten = new StringBuilder(title.length());
        int copiedUpTo = 0;
        do {
            rewritten.append(title, copiedUpTo, matcher.start());
            rewritten.append(WordCharacters.toLowerCase(matcher.group()));
            copiedUpTo = matcher.end();
        } while (matcher.find());
        rewritten.append(title, copiedUpTo, title.length());
        return rewritten.toString();
    }

    int wordCount() {
        return canonical.split(WHITESPACE_RUN).length;
    }
}
