package com.delta.resumeextractor.extraction.model;

import java.util.List;

public record TaxonomyMatch(List<String> categories, List<CategoryScore> scores, String context) {
    public TaxonomyMatch {
        categories = categories == null ? List.of() : List.copyOf(categories);
        scores = scores == null ? List.of() : List.copyOf(scores);
        context = context == null ? "" : context;
    }

    public static TaxonomyMatch empty() {
        return new TaxonomyMatch(List.of(), List.of(), "");
    }

    public boolean isEmpty() {
        return categories.isEmpty();
    }
}
