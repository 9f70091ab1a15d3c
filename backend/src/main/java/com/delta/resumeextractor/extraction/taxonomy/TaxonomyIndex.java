package com.delta.resumeextractor.extraction.taxonomy;

import com.delta.resumeextractor.extraction.model.CategoryScore;
import com.delta.resumeextractor.extraction.model.TaxonomyCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable, precompiled view of the taxonomy. Terms match on word boundaries so that short
 * terms such as "Go" or "C++" do not hit inside longer words.
 */
public final class TaxonomyIndex {
    static final double HEADER_TITLE_WEIGHT = 10.0;
    static final double RECENT_JOB_TITLE_WEIGHT = 8.0;
    static final double WORK_HISTORY_TITLE_WEIGHT = 5.0;
    static final double ELSEWHERE_TITLE_WEIGHT = 2.0;
    static final double SKILL_WORD_BONUS = 0.1;
    static final double WORK_HISTORY_SKILL_WEIGHT = 2.0;

    private static final TaxonomyIndex EMPTY = new TaxonomyIndex(List.of());

    private final List<TaxonomyCategory> categories;
    private final List<List<Term>> titleTerms = new ArrayList<>();
    private final List<List<Term>> skillTerms = new ArrayList<>();

    public TaxonomyIndex(List<TaxonomyCategory> categories) {
        this.categories = List.copyOf(categories);
        for (TaxonomyCategory category : this.categories) {
            titleTerms.add(compile(category.jobTitles()));
            skillTerms.add(compile(category.skillTerms()));
        }
    }

    public static TaxonomyIndex empty() {
        return EMPTY;
    }

    public List<TaxonomyCategory> categories() {
        return categories;
    }

    public TaxonomyCategory category(String name) {
        for (TaxonomyCategory category : categories) {
            if (category.name().equals(name)) {
                return category;
            }
        }
        return null;
    }

    public boolean isEmpty() {
        return categories.isEmpty();
    }

    /**
     * Scores every category against the resume regions, in taxonomy order.
     */
    public List<CategoryScore> score(ResumeRegions regions) {
        List<CategoryScore> scores = new ArrayList<>(categories.size());
        for (int i = 0; i < categories.size(); i++) {
            double score = 0.0;
            for (Term title : titleTerms.get(i)) {
                int full = title.count(regions.full());
                if (full == 0) {
                    continue;
                }
                int header = title.count(regions.header());
                int recent = title.count(regions.mostRecentJob());
                int work = title.count(regions.workHistory());
                int elsewhere = Math.max(0, full - header - work);
                score += header * HEADER_TITLE_WEIGHT
                    + recent * RECENT_JOB_TITLE_WEIGHT
                    + work * WORK_HISTORY_TITLE_WEIGHT
                    + elsewhere * ELSEWHERE_TITLE_WEIGHT;
            }
            for (Term skill : skillTerms.get(i)) {
                int full = skill.count(regions.full());
                if (full == 0) {
                    continue;
                }
                int work = skill.count(regions.workHistory());
                score += full * (1.0 + SKILL_WORD_BONUS * skill.wordCount())
                    + work * WORK_HISTORY_SKILL_WEIGHT;
            }
            scores.add(new CategoryScore(categories.get(i).name(), score));
        }
        return scores;
    }

    private static List<Term> compile(List<String> values) {
        List<Term> terms = new ArrayList<>(values.size());
        for (String value : values) {
            if (value == null || value.isBlank()) {
                continue;
            }
            String trimmed = value.trim();
            Pattern pattern = Pattern.compile(
                "(?<![\\p{Alnum}])" + Pattern.quote(trimmed) + "(?![\\p{Alnum}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
            );
            terms.add(new Term(trimmed, pattern, trimmed.split("\\s+").length));
        }
        return terms;
    }

    private record Term(String text, Pattern pattern, int wordCount) {
        int count(String region) {
            if (region == null || region.isEmpty()) {
                return 0;
            }
            Matcher matcher = pattern.matcher(region);
            int count = 0;
            while (matcher.find()) {
                count++;
            }
            return count;
        }
    }
}
