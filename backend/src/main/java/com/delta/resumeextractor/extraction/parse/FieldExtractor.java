package com.delta.resumeextractor.extraction.parse;

import java.util.Optional;

/**
 * One way of pulling a single field's answer out of a model response.
 */
public interface FieldExtractor {

    Optional<String> extract(String response);

    static String clean(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        value = value.replace("**", "").replace("`", "").trim();
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                value = value.substring(1, value.length() - 1).trim();
            }
        }
        return value;
    }
}
