package com.williamcallahan.titlecase.service.casing;

/**
 * Signals a function word or phrase entry that cannot be used to build a {@link Lexicon}.
 */
public class LexiconConfigurationException extends IllegalStateException {

    /**
     * Creates a lexicon configuration exception.
     *
     * @param message description of the rejected entry
     */
    public LexiconConfigurationException(String message) {
        super(message);
    }

    /**
     * Creates a lexicon configuration exception with the underlying failure.
     *
     * @param message description of the rejected entry
     * @param cause the underlying failure
     */
    public LexiconConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
