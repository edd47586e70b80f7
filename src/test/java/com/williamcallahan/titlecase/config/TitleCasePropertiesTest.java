package com.williamcallahan.titlecase.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies title casing configuration invariants.
 */
class TitleCasePropertiesTest {

    @Test
    void validateConfigurationAcceptsDefaults() {
        TitleCaseProperties properties = new TitleCaseProperties();

        assertDoesNotThrow(properties::validateConfiguration);
    }

    @Test
    void validateConfigurationRejectsNonPositiveLetterLimit() {
        TitleCaseProperties properties = new TitleCaseProperties();
        properties.setMaxFunctionWordLetters(0);

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }

    @Test
    void validateConfigurationRejectsBlankFunctionWord() {
        TitleCaseProperties properties = new TitleCaseProperties();
        properties.setAdditionalFunctionWords(List.of("per", " "));

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }

    @Test
    void validateConfigurationRejectsNullPhrase() {
        TitleCaseProperties properties = new TitleCaseProperties();
        properties.setAdditionalPhrases(Arrays.asList("apart from", null));

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }
}
