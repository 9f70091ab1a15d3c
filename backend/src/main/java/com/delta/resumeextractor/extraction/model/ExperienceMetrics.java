package com.delta.resumeextractor.extraction.model;

import java.util.List;

public record ExperienceMetrics(
    List<JobTenure> jobs,
    double totalExperience,
    double avgTenure,
    double usExperience,
    double confidence
) {
    public ExperienceMetrics {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    public static ExperienceMetrics empty() {
        return new ExperienceMetrics(List.of(), 0.0, 0.0, 0.0, 0.0);
    }
}
