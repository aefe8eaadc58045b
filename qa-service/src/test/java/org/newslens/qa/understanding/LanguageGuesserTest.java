package org.newslens.qa.understanding;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageGuesserTest {

    @Test
    void cyrillicIsRussian() {
        assertThat(LanguageGuesser.guess("Что произошло в Баку?")).isEqualTo("ru");
    }

    @Test
    void azerbaijaniLettersAreAzerbaijani() {
        assertThat(LanguageGuesser.guess("Bakıda nə olub?")).isEqualTo("az");
    }

    @Test
    void plainLatinIsUnknown() {
        assertThat(LanguageGuesser.guess("Salam")).isEqualTo(LanguageGuesser.UNKNOWN);
        assertThat(LanguageGuesser.guess("   ")).isEqualTo(LanguageGuesser.UNKNOWN);
    }
}
