package com.delta.resumeextractor.extraction.model;

import java.time.LocalDate;

public record JobTenure(
    String company,
    String location,
    double tenureYears,
    double confidence,
    boolean current,
    LocalDate startDate,
    LocalDate endDate
) {
}
