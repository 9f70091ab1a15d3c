package com.delta.resumeextractor.extraction.model;

import java.util.List;

public record TaxonomyCategory(String name, List<String> jobTitles, List<String> skillTerms) {
    public TaxonomyCategory {
        jobTitles = jobTitles == null ? List.of() : List.copyOf(jobTitles);
        skillTerms = skillTerms == null ? List.of() : List.copyOf(skillTerms);
    }
}
