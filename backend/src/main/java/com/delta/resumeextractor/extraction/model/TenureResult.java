package com.delta.resumeextractor.extraction.model;

public record TenureResult(
    double tenureYears,
    double confidence,
    boolean current,
    ParsedDate start,
    ParsedDate end
) {
}
