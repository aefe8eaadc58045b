package org.newslens.qa.understanding;

import lombok.extern.slf4j.Slf4j;
import org.newslens.qa.config.QaProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Local prompt-injection guard evaluated on the raw question before any routing.
 */
@Slf4j
@Component
public class PromptInjectionDetector {

    private final List<Pattern> patterns;

    public PromptInjectionDetector(QaProperties properties) {
        this.patterns = properties.getSecurity().getInjectionPatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
        log.info("PromptInjectionDetector initialized with {} patterns", patterns.size());
    }

    /**
     * Returns the first matching pattern, if any.
     */
    public Optional<String> detect(String rawQuery) {
        if (rawQuery == null) {
            return Optional.empty();
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(rawQuery).find()) {
                return Optional.of(pattern.pattern());
            }
        }
        return Optional.empty();
    }
}
