package com.williamcallahan.titlecase.service.casing;

import com.williamcallahan.titlecase.domain.ClassifiedToken;
import com.williamcallahan.titlecase.domain.Token;
import com.williamcallahan.titlecase.domain.TokenCategory;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Decides how a single token is recased, without looking at its neighbours.
 *
 * <p>Rules are tried in list order and the first match wins:</p>
 * <ol>
 *   <li>period-delimited acronym ({@code m.a.s.h.}) is uppercased</li>
 *   <li>ordinal-like token ({@code 22nd}, {@code 2fast}) is left alone</li>
 *   <li>function word from the lexicon is lowercased</li>
 *   <li>a word of letters and apostrophes is capitalized</li>
 * </ol>
 * <p>Anything else passes through unchanged.</p>
 */
final class TokenClassifier {

    private static final String LETTER_CLASS = "[" + WordCharacters.LETTER_RANGES + "]";

    private static final Pattern ACRONYM = Pattern.compile("(?:" + LETTER_CLASS + "\\.){2,}");
    private static final Pattern ORDINAL_LIKE = Pattern.compile(
            "[^" + WordCharacters.LETTER_RANGES + "0-9]*[0-9]+" + LETTER_CLASS + ".*");
    private static final Pattern ORDINARY_WORD = Pattern.compile(
            "[" + WordCharacters.LETTER_RANGES + WordCharacters.APOSTROPHES + "]+");

    static final List<ClassificationRule> RULES = List.of(
            new ClassificationRule(
                    TokenCategory.ACRONYM,
                    (text, lexicon) -> ACRONYM.matcher(text).matches(),
                    WordCharacters::toUpperCase),
            new ClassificationRule(
                    TokenCategory.ORDINAL,
                    (text, lexicon) -> isOrdinalLike(text),
                    UnaryOperator.identity()),
            new ClassificationRule(
                    TokenCategory.FUNCTION_WORD,
                    (text, lexicon) -> lexicon.isFunctionWord(text),
                    WordCharacters::toLowerCase),
            new ClassificationRule(
                    TokenCategory.ORDINARY_WORD,
                    (text, lexicon) -> ORDINARY_WORD.matcher(text).matches(),
                    WordCharacters::capitalize));

    private TokenClassifier() {}

    static ClassifiedToken classify(Token token, Lexicon lexicon) {
        String text = token.text();
        if (token.isWord()) {
            for (ClassificationRule rule : RULES) {
                if (rule.matches(text, lexicon)) {
                    return new ClassifiedToken(token, rule.category(), rule.apply(text));
                }
            }
        }
        return new ClassifiedToken(token, TokenCategory.PASSTHROUGH, text);
    }

    /**
     * Digits directly followed by a letter, optionally after leading punctuation. Such tokens
     * are never recased, which keeps {@code 1st} from turning into {@code 1St}.
     */
    static boolean isOrdinalLike(String text) {
        return ORDINAL_LIKE.matcher(text).matches();
    }
}
