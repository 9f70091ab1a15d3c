package com.delta.resumeextractor.extraction.llm;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Result items carry a caller-assigned id embedding the record id. Two prefixes have been used
 * over time; anything else falls back to the first run of digits.
 */
public final class ResultItemIds {
    public static final String USER_PREFIX = "user_";
    public static final String UNIFIED_PREFIX = "unified_";

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private ResultItemIds() {
    }

    public static String toCustomId(long recordId) {
        return USER_PREFIX + recordId;
    }

    public static Optional<Long> parse(String customId) {
        if (customId == null || customId.isBlank()) {
            return Optional.empty();
        }
        String trimmed = customId.trim();
        if (trimmed.startsWith(USER_PREFIX)) {
            return toLong(trimmed.substring(USER_PREFIX.length()));
        }
        if (trimmed.startsWith(UNIFIED_PREFIX)) {
            return toLong(trimmed.substring(UNIFIED_PREFIX.length()));
        }
        Matcher matcher = DIGITS.matcher(trimmed);
        return matcher.find() ? toLong(matcher.group()) : Optional.empty();
    }

    private static Optional<Long> toLong(String value) {
        Matcher matcher = DIGITS.matcher(value);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(matcher.group()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
