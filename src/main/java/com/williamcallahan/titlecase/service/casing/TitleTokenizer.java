package com.williamcallahan.titlecase.service.casing;

import com.williamcallahan.titlecase.domain.Token;
import com.williamcallahan.titlecase.domain.TokenKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a title into alternating word and separator runs.
 *
 * <p>Boundaries fall exactly where word-constituent membership changes, so joining the
 * token texts in order always rebuilds the input. An empty title yields no tokens.</p>
 */
final class TitleTokenizer {

    private TitleTokenizer() {}

    static List<Token> tokenize(String title) {
        List<Token> tokens = new ArrayList<>();
        if (title.isEmpty()) {
            return tokens;
        }
        int runStart = 0;
        boolean runIsWord = WordCharacters.isWordConstituent(title.charAt(0));
        for (int index = 1; index < title.length(); index++) {
            boolean isWord = WordCharacters.isWordConstituent(title.charAt(index));
            if (isWord != runIsWord) {
                tokens.add(toToken(title, runStart, index, runIsWord));
                runStart = index;
                runIsWord = isWord;
            }
        }
        tokens.add(toToken(title, runStart, title.length(), runIsWord));
        return tokens;
    }

    private static Token toToken(String title, int start, int end, boolean isWord) {
        return new Token(title.substring(start, end), start, end, isWord ? TokenKind.WORD : TokenKind.SEPARATOR);
    }
}
