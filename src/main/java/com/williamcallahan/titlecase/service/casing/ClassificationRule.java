package com.williamcallahan.titlecase.service.casing;

import com.williamcallahan.titlecase.domain.TokenCategory;
import java.util.function.BiPredicate;
import java.util.function.UnaryOperator;

/**
 * One entry of the classifier's ordered rule list.
 *
 * @param category category assigned when the rule matches
 * @param matcher test applied to the token text with the active lexicon
 * @param recase transformation applied to a matching token
 */
record ClassificationRule(
        TokenCategory category, BiPredicate<String, Lexicon> matcher, UnaryOperator<String> recase) {

    boolean matches(String tokenText, Lexicon lexicon) {
        return matcher.test(tokenText, lexicon);
    }

    String apply(String tokenText) {
        return recase.apply(tokenText);
    }
}
