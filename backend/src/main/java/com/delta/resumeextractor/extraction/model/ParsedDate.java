package com.delta.resumeextractor.extraction.model;

import java.time.LocalDate;

public record ParsedDate(LocalDate date, double confidence, String originalText) {
    public static ParsedDate none(String originalText) {
        return new ParsedDate(null, 0.0, originalText);
    }

    public boolean isPresent() {
        return date != null;
    }
}
