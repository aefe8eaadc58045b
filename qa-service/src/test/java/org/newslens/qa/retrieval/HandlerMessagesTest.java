package org.newslens.qa.retrieval;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.newslens.qa.config.QaProperties;

import static org.assertj.core.api.Assertions.assertThat;

class HandlerMessagesTest {

    private final HandlerMessages messages = new HandlerMessages(new QaProperties());

    @ParameterizedTest
    @EnumSource(MessageKey.class)
    void everyMessageExistsInEverySupportedLanguage(MessageKey key) {
        assertThat(messages.get(key, "az")).isNotBlank();
        assertThat(messages.get(key, "en")).isNotBlank();
        assertThat(messages.get(key, "ru")).isNotBlank();
    }

    @Test
    void languagesAreDistinct() {
        assertThat(messages.get(MessageKey.ATTACKING, "az")).isNotEqualTo(messages.get(MessageKey.ATTACKING, "en"));
        assertThat(messages.get(MessageKey.ATTACKING, "ru")).isNotEqualTo(messages.get(MessageKey.ATTACKING, "en"));
    }

    @Test
    void unsupportedLanguageUsesFallback() {
        assertThat(messages.get(MessageKey.TALK, "tr")).isEqualTo(messages.get(MessageKey.TALK, "en"));
        assertThat(messages.get(MessageKey.TALK, null)).isEqualTo(messages.get(MessageKey.TALK, "en"));
        assertThat(messages.get(MessageKey.TALK, " RU ")).isEqualTo(messages.get(MessageKey.TALK, "ru"));
        assertThat(messages.resolveLanguage("unknown")).isEqualTo("en");
    }

    @Test
    void configuredFallbackLanguageIsHonoured() {
        QaProperties properties = new QaProperties();
        properties.setFallbackLanguage("az");

        HandlerMessages azFirst = new HandlerMessages(properties);

        assertThat(azFirst.get(MessageKey.NO_RESULTS, "de")).isEqualTo(messages.get(MessageKey.NO_RESULTS, "az"));
        assertThat(azFirst.resolveLanguage("de")).isEqualTo("az");
    }
}
