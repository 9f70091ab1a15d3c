package com.delta.resumeextractor.extraction.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a response into {@code key: value} lines. ALL-CAPS lines ending in a colon are section
 * markers and only tag the entries that follow them.
 */
public class StructuredLineParser {
    private static final Pattern KEY_PREFIX = Pattern.compile("^[-*•>#\\s]*(?:\\d+[.)]\\s*)?");
    private static final Pattern PARENTHETICAL = Pattern.compile("\\([^)]*\\)");

    public record Entry(String section, String key, String value) {
    }

    public List<Entry> parse(String response) {
        List<Entry> entries = new ArrayList<>();
        if (response == null || response.isBlank()) {
            return entries;
        }
        String section = null;
        for (String rawLine : response.split("\\r?\\n")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (isSectionMarker(line)) {
                section = line.substring(0, line.length() - 1).strip();
                continue;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String key = normalizeKey(line.substring(0, colon));
            if (key.isEmpty()) {
                continue;
            }
            String value = FieldExtractor.clean(line.substring(colon + 1));
            entries.add(new Entry(section, key, value));
        }
        return entries;
    }

    static boolean isSectionMarker(String line) {
        if (!line.endsWith(":") || line.length() < 3) {
            return false;
        }
        String body = line.substring(0, line.length() - 1);
        boolean hasLetter = false;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            if (Character.isLetter(c)) {
                hasLetter = true;
            }
        }
        return hasLetter;
    }

    private String normalizeKey(String rawKey) {
        String key = rawKey.replace("**", "");
        key = KEY_PREFIX.matcher(key).replaceFirst("");
        key = PARENTHETICAL.matcher(key).replaceAll("");
        return key.strip();
    }
}
