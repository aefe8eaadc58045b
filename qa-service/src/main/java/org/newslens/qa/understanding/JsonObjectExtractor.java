package org.newslens.qa.understanding;

import java.util.Optional;

/**
 * Pulls the first balanced {@code {...}} span out of model output that may be
 * wrapped in prose or code fences. Braces inside JSON strings are ignored.
 */
public final class JsonObjectExtractor {

    private JsonObjectExtractor() {
    }

    public static Optional<String> extractFirst(String text) {
        if (text == null) {
            return Optional.empty();
        }
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = findClosingBrace(text, start);
            if (end > 0) {
                return Optional.of(text.substring(start, end + 1));
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    private static int findClosingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;

        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
