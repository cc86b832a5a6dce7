package com.lingxiao.cachify.aop;

import org.springframework.boot.convert.DurationStyle;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Parses annotation durations: {@code PT30S}, {@code 30s}, {@code 500ms}, bare seconds,
 * or a {@code ${property}} placeholder resolving to one of those.
 */
public class DurationParser {

    private final Environment environment;

    public DurationParser(Environment environment) {
        this.environment = environment;
    }

    /**
     * @return null for empty text
     */
    public Duration parse(String text) {
        if (!StringUtils.hasText(text)) {
            return null;
        }
        try {
            String resolved = environment != null
                    ? environment.resolveRequiredPlaceholders(text.trim())
                    : text.trim();
            return DurationStyle.detectAndParse(resolved, ChronoUnit.SECONDS);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid duration '" + text + "'", e);
        }
    }
}
