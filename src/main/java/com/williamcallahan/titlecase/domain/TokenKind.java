package com.williamcallahan.titlecase.domain;

/**
 * Which alphabet a token's characters belong to.
 */
public enum TokenKind {
    /** Letters, digits, periods and apostrophes. */
    WORD,
    /** Whitespace, punctuation and symbols. */
    SEPARATOR
}
