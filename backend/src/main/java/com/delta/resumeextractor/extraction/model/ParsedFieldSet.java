package com.delta.resumeextractor.extraction.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Field values extracted for one candidate. A field with no entry is unknown; blank values and
 * the literal "NULL" answer are never stored, so a known value cannot be replaced by unknown
 * through {@link #put} or {@link #putIfAbsent}.
 */
public final class ParsedFieldSet {
    private static final String NULL_ANSWER = "NULL";

    private final EnumMap<CandidateField, String> values = new EnumMap<>(CandidateField.class);

    public static boolean isUnknownValue(String value) {
        if (value == null) {
            return true;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() || trimmed.equalsIgnoreCase(NULL_ANSWER);
    }

    public static String normalize(String value) {
        return isUnknownValue(value) ? null : value.trim();
    }

    public boolean put(CandidateField field, String value) {
        String normalized = normalize(value);
        if (field == null || normalized == null) {
            return false;
        }
        values.put(field, normalized);
        return true;
    }

    public boolean putIfAbsent(CandidateField field, String value) {
        if (field == null || values.containsKey(field)) {
            return false;
        }
        return put(field, value);
    }

    /**
     * Explicitly marks a field unknown, used by validation when a value is rejected.
     */
    public void clear(CandidateField field) {
        values.remove(field);
    }

    public Optional<String> get(CandidateField field) {
        return Optional.ofNullable(values.get(field));
    }

    public String getOrNull(CandidateField field) {
        return values.get(field);
    }

    public boolean isKnown(CandidateField field) {
        return values.containsKey(field);
    }

    public int size() {
        return values.size();
    }

    public Map<CandidateField, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public ParsedFieldSet copy() {
        ParsedFieldSet copy = new ParsedFieldSet();
        copy.values.putAll(values);
        return copy;
    }

    @Override
    public String toString() {
        return "ParsedFieldSet" + values;
    }
}
