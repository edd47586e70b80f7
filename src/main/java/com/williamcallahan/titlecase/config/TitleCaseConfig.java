package com.williamcallahan.titlecase.config;

import com.williamcallahan.titlecase.service.casing.Lexicon;
import com.williamcallahan.titlecase.service.casing.TitleCaser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the lexicon and title caser once at startup. Invalid word lists fail the context
 * rather than individual conversions.
 */
@Configuration
public class TitleCaseConfig {

    private static final Logger log = LoggerFactory.getLogger(TitleCaseConfig.class);

    @Bean
    public Lexicon lexicon(TitleCaseProperties properties) {
        properties.validateConfiguration();

        Lexicon lexicon = Lexicon.defaultsWith(
                properties.getAdditionalFunctionWords(),
                properties.getAdditionalPhrases(),
                properties.getMaxFunctionWordLetters());
        log.info("Lexicon ready: {} function words, {} phrases, letter limit {}",
                lexicon.functionWords().size(), lexicon.phrases().size(), lexicon.maxFunctionWordLetters());
        return lexicon;
    }

    @Bean
    public TitleCaser titleCaser(Lexicon lexicon) {
        return new TitleCaser(lexicon);
    }
}
