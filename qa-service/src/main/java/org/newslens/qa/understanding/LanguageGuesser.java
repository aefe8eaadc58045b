package org.newslens.qa.understanding;

/**
 * Script-based language guess used when the model gave no language.
 */
public final class LanguageGuesser {

    public static final String UNKNOWN = "unknown";

    private static final String AZERBAIJANI_LETTERS = "əƏğĞıİşŞçÇöÖüÜ";

    private LanguageGuesser() {
    }

    /**
     * Returns {@code ru} for Cyrillic text, {@code az} for text with Azerbaijani
     * Latin letters, otherwise {@link #UNKNOWN}.
     */
    public static String guess(String text) {
        if (text == null || text.isBlank()) {
            return UNKNOWN;
        }
        boolean azerbaijani = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.UnicodeBlock.of(c) == Character.UnicodeBlock.CYRILLIC) {
                return "ru";
            }
            if (AZERBAIJANI_LETTERS.indexOf(c) >= 0) {
                azerbaijani = true;
            }
        }
        return azerbaijani ? "az" : UNKNOWN;
    }
}
