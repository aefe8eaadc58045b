package org.newslens.qa.understanding;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Local normalization applied to questions: lowercase, collapse whitespace, trim.
 * {@code clean(clean(x)).equals(clean(x))} holds for every input.
 */
public final class QueryTextCleaner {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private QueryTextCleaner() {
    }

    public static String clean(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return WHITESPACE.matcher(lower).replaceAll(" ").trim();
    }
}
