package com.delta.resumeextractor.extraction.taxonomy;

import com.delta.resumeextractor.config.ExtractorProperties;
import com.delta.resumeextractor.extraction.model.CategoryScore;
import com.delta.resumeextractor.extraction.model.TaxonomyCategory;
import com.delta.resumeextractor.extraction.model.TaxonomyMatch;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class TaxonomyMatcher {
    private static final Logger log = LoggerFactory.getLogger(TaxonomyMatcher.class);
    static final double SELECTION_MARGIN = 0.2;

    private final TaxonomyLoader loader;
    private final ExtractorProperties properties;
    private volatile TaxonomyIndex index = TaxonomyIndex.empty();

    public TaxonomyMatcher(TaxonomyLoader loader, ExtractorProperties properties) {
        this.loader = loader;
        this.properties = properties;
    }

    @PostConstruct
    public void loadTaxonomy() {
        String location = properties.getTaxonomy().getLocation();
        try {
            index = new TaxonomyIndex(loader.load(location));
        } catch (IOException e) {
            log.error("Failed to load skills taxonomy from {}; prompts will carry no taxonomy context", location, e);
            index = TaxonomyIndex.empty();
        }
    }

    public TaxonomyIndex index() {
        return index;
    }

    public TaxonomyMatch match(String resumeText) {
        return match(resumeText, properties.getTaxonomy().getMaxCategories());
    }

    public TaxonomyMatch match(String resumeText, int maxCategories) {
        TaxonomyIndex current = index;
        if (current.isEmpty() || resumeText == null || resumeText.isBlank()) {
            return TaxonomyMatch.empty();
        }
        ResumeRegions regions = ResumeRegions.of(resumeText, properties.getTaxonomy().getHeaderLines());
        List<CategoryScore> ranked = new ArrayList<>(current.score(regions));
        ranked.sort(Comparator.comparingDouble(CategoryScore::score).reversed());

        List<CategoryScore> selected = selectCategories(ranked, maxCategories);
        if (selected.isEmpty()) {
            return TaxonomyMatch.empty();
        }
        List<String> names = selected.stream().map(CategoryScore::name).toList();
        log.debug("Taxonomy match {} from top scores {}", names, ranked.subList(0, Math.min(5, ranked.size())));
        return new TaxonomyMatch(names, selected, formatContext(current, names));
    }

    /**
     * Keeps the top category plus any category within the selection margin of it, in score order.
     */
    public static List<CategoryScore> selectCategories(List<CategoryScore> rankedScores, int maxCategories) {
        if (rankedScores == null || rankedScores.isEmpty()) {
            return List.of();
        }
        CategoryScore top = rankedScores.get(0);
        if (top.score() <= 0) {
            return List.of();
        }
        double threshold = top.score() - SELECTION_MARGIN * top.score();
        List<CategoryScore> selected = new ArrayList<>();
        selected.add(top);
        for (int i = 1; i < rankedScores.size() && selected.size() < Math.max(1, maxCategories); i++) {
            CategoryScore candidate = rankedScores.get(i);
            if (candidate.score() >= threshold) {
                selected.add(candidate);
            }
        }
        return selected;
    }

    String formatContext(TaxonomyIndex current, List<String> names) {
        int maxTitles = properties.getTaxonomy().getMaxJobTitles();
        int maxSkills = properties.getTaxonomy().getMaxSkillTerms();
        StringBuilder context = new StringBuilder("SKILLS TAXONOMY REFERENCE:\n\n");
        for (String name : names) {
            TaxonomyCategory category = current.category(name);
            if (category == null) {
                continue;
            }
            context.append("## ").append(name).append('\n');
            if (!category.jobTitles().isEmpty()) {
                context.append("Relevant job titles: ")
                    .append(limited(category.jobTitles(), maxTitles))
                    .append('\n');
            }
            if (!category.skillTerms().isEmpty()) {
                context.append("Skills in this category: ")
                    .append(limited(category.skillTerms(), maxSkills))
                    .append('\n');
            }
            context.append('\n');
        }
        return context.toString();
    }

    private String limited(List<String> values, int max) {
        if (values.size() <= max) {
            return String.join(", ", values);
        }
        return String.join(", ", values.subList(0, max)) + ", and " + (values.size() - max) + " more";
    }
}
