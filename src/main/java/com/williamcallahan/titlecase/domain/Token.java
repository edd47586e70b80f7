package com.williamcallahan.titlecase.domain;

import java.util.Objects;

/**
 * A maximal run of characters from one alphabet within a title.
 *
 * @param text the characters of the run
 * @param start offset of the first character in the source title
 * @param end offset one past the last character in the source title
 * @param kind alphabet the run belongs to
 */
public record Token(String text, int start, int end, TokenKind kind) {

    public Token {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(kind, "kind");
        if (start < 0 || end - start != text.length()) {
            throw new IllegalArgumentException(
                    "Token span [" + start + ", " + end + ") does not match text length " + text.length());
        }
    }

    public boolean isWord() {
        return kind == TokenKind.WORD;
    }
}
