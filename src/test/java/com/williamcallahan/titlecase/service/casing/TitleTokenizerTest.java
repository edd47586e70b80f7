package com.williamcallahan.titlecase.service.casing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.titlecase.domain.Token;
import com.williamcallahan.titlecase.domain.TokenKind;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Tests splitting titles into word and separator runs.
 */
class TitleTokenizerTest {

    @Test
    void tokenize_splitsAtAlphabetBoundaries() {
        List<Token> tokens = TitleTokenizer.tokenize("hurly-burly; or,");

        assertEquals(List.of("hurly", "-", "burly", "; ", "or", ","), texts(tokens));
        assertEquals(TokenKind.WORD, tokens.get(0).kind());
        assertEquals(TokenKind.SEPARATOR, tokens.get(1).kind());
        assertEquals(TokenKind.SEPARATOR, tokens.get(5).kind());
    }

    @Test
    void tokenize_keepsPeriodsAndApostrophesInsideWords() {
        assertEquals(List.of("...and", " ", "it"), texts(TitleTokenizer.tokenize("...and it")));
        assertEquals(List.of("s.o.s.", " ", "aphrodite", "!"), texts(TitleTokenizer.tokenize("s.o.s. aphrodite!")));
        assertEquals(
                List.of("toys", " ", "’n’", " ", "games"), texts(TitleTokenizer.tokenize("toys ’n’ games")));
        assertEquals(List.of("ʼnʼ"), texts(TitleTokenizer.tokenize("ʼnʼ")));
    }

    @Test
    void tokenize_treatsAccentedLettersAsWordCharacters() {
        assertEquals(List.of("vis", "-", "à", "-", "vis"), texts(TitleTokenizer.tokenize("vis-à-vis")));
        assertEquals(List.of("price", " × ", "2"), texts(TitleTokenizer.tokenize("price × 2")));
    }

    @Test
    void tokenize_emptyTitleYieldsNoTokens() {
        assertTrue(TitleTokenizer.tokenize("").isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "a tramp's wallet",
        "...and it comes out here",
        "\"quoted\" — and (parenthesised)!",
        "   ",
        "x",
        "élan vital à la mode, c. 1850"
    })
    void tokenize_isLosslessWithContiguousOffsets(String title) {
        List<Token> tokens = TitleTokenizer.tokenize(title);

        StringBuilder rebuilt = new StringBuilder();
        int expectedStart = 0;
        for (int index = 0; index < tokens.size(); index++) {
            Token token = tokens.get(index);
            assertEquals(expectedStart, token.start());
            assertEquals(title.substring(token.start(), token.end()), token.text());
            if (index > 0) {
                assertTrue(tokens.get(index - 1).kind() != token.kind());
            }
            rebuilt.append(token.text());
            expectedStart = token.end();
        }
        assertEquals(title, rebuilt.toString());
    }

    private static List<String> texts(List<Token> tokens) {
        return tokens.stream().map(Token::text).toList();
    }
}
