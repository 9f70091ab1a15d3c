package com.delta.resumeextractor.extraction.model;

import java.util.List;

public record ParseDiagnostics(
    int companiesFound,
    int softwareAppsFound,
    int hardwareFound,
    int skillsFound,
    List<CandidateField> missingCoreFields
) {
    public ParseDiagnostics {
        missingCoreFields = missingCoreFields == null ? List.of() : List.copyOf(missingCoreFields);
    }
}
