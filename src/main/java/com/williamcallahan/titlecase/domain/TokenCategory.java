package com.williamcallahan.titlecase.domain;

/**
 * Outcome of classifying a single token, in rule priority order.
 */
public enum TokenCategory {
    /** Period-delimited acronym such as {@code S.O.S.}; uppercased. */
    ACRONYM,
    /** Digits followed directly by a letter, such as {@code 22nd}; left as is. */
    ORDINAL,
    /** Short article, conjunction or preposition; lowercased. */
    FUNCTION_WORD,
    /** Letters and apostrophes only; capitalized. */
    ORDINARY_WORD,
    /** Anything else, including separators; left as is. */
    PASSTHROUGH
}
