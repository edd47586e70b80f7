package com.williamcallahan.titlecase.service.casing;

import com.williamcallahan.titlecase.domain.ClassifiedToken;
import com.williamcallahan.titlecase.domain.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a single line of text to title case.
 *
 * <p>The pipeline tokenizes the line, recases each token on its own, joins the tokens back
 * together and then fixes up multi-word phrases and the first and last words. Only letter
 * case changes; every other character is kept in place.</p>
 *
 * <pre>{@code
 * titleCaser.titleCase("out of the hurly-burly; or, life in an odd corner")
 *     // "Out of the Hurly-Burly; or, Life in an Odd Corner"
 * }</pre>
 *
 * <p>Instances hold no mutable state and can be shared across threads.</p>
 */
public final class TitleCaser {

    private static final Logger log = LoggerFactory.getLogger(TitleCaser.class);

    private final Lexicon lexicon;

    /**
     * Creates a title caser backed by the given lexicon.
     *
     * @param lexicon function words and phrases to keep lowercase
     */
    public TitleCaser(Lexicon lexicon) {
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
    }

    /**
     * Creates a title caser backed by {@link Lexicon#defaults()}.
     *
     * @return title caser with the built-in word lists
     */
    public static TitleCaser withDefaults() {
        return new TitleCaser(Lexicon.defaults());
    }

    /**
     * Title-cases one line of text.
     *
     * @param title line to convert; {@code null} is treated as empty
     * @return the converted line; never {@code null}
     */
    public String titleCase(String title) {
        if (title == null || title.isEmpty()) {
            return "";
        }
        List<ClassifiedToken> classifiedTokens = classify(title);
        String reassembled = TokenReassembler.reassemble(classifiedTokens);
        String result = PhrasalFixup.apply(reassembled, lexicon);
        log.trace("Title cased '{}' -> '{}'", title, result);
        return result;
    }

    /**
     * Tokenizes and classifies a line without applying the phrase and boundary fixups.
     *
     * @param title line to classify
     * @return one classified token per token, in order
     */
    public List<ClassifiedToken> classify(String title) {
        List<Token> tokens = TitleTokenizer.tokenize(title == null ? "" : title);
        List<ClassifiedToken> classifiedTokens = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            ClassifiedToken classifiedToken = TokenClassifier.classify(token, lexicon);
            if (log.isDebugEnabled() && token.isWord()) {
                log.debug("Token '{}' at {} classified as {}", token.text(), token.start(), classifiedToken.category());
            }
            classifiedTokens.add(classifiedToken);
        }
        return classifiedTokens;
    }

    public Lexicon lexicon() {
        return lexicon;
    }
}
