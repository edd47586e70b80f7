package com.williamcallahan.titlecase.domain;

/**
 * A token paired with the category it was assigned and its recased text.
 *
 * @param source token as produced by the tokenizer
 * @param category first classification rule that matched
 * @param text recased text; same length as the source text
 */
public record ClassifiedToken(Token source, TokenCategory category, String text) {}
