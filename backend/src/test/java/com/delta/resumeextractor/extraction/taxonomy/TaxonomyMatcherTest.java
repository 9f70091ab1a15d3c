package com.delta.resumeextractor.extraction.taxonomy;

import com.delta.resumeextractor.config.ExtractorProperties;
import com.delta.resumeextractor.extraction.model.CategoryScore;
import com.delta.resumeextractor.extraction.model.TaxonomyCategory;
import com.delta.resumeextractor.extraction.model.TaxonomyMatch;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TaxonomyMatcherTest {

    @Test
    void keepsCategoriesWithinTwentyPercentOfTheTop() {
        List<CategoryScore> ranked = List.of(
            new CategoryScore("A", 100),
            new CategoryScore("B", 85),
            new CategoryScore("C", 40)
        );

        List<CategoryScore> selected = TaxonomyMatcher.selectCategories(ranked, 3);

        assertThat(selected).extracting(CategoryScore::name).containsExactly("A", "B");
    }

    @Test
    void selectionRespectsMaximumAndIgnoresZeroTop() {
        List<CategoryScore> ranked = List.of(
            new CategoryScore("A", 50),
            new CategoryScore("B", 49),
            new CategoryScore("C", 48)
        );

        assertThat(TaxonomyMatcher.selectCategories(ranked, 2)).hasSize(2);
        assertThat(TaxonomyMatcher.selectCategories(List.of(new CategoryScore("A", 0)), 3)).isEmpty();
        assertThat(TaxonomyMatcher.selectCategories(List.of(), 3)).isEmpty();
    }

    @Test
    void matchesResumeAgainstLoadedTaxonomy() {
        TaxonomyMatcher matcher = matcher("classpath:taxonomy/test-taxonomy.csv");
        String resume = """
            Jane Doe
            Senior Software Engineer
            jane@example.com

            WORK EXPERIENCE
            Acme Corp - Backend Developer
            Built Java and Spring services on Kubernetes.

            Beta Inc - Software Engineer
            Maintained SQL reporting jobs.

            EDUCATION
            BS Computer Science
            """;

        TaxonomyMatch match = matcher.match(resume);

        assertThat(match.categories()).first().isEqualTo("Software Engineering");
        assertThat(match.context())
            .startsWith("SKILLS TAXONOMY REFERENCE:\n\n## Software Engineering\n")
            .contains("Relevant job titles: Software Engineer, Backend Developer, Full Stack Developer");
    }

    @Test
    void shortTermsDoNotMatchInsideWords() {
        TaxonomyIndex index = new TaxonomyIndex(List.of(
            new TaxonomyCategory("Go", List.of(), List.of("Go"))
        ));

        List<CategoryScore> scores = index.score(ResumeRegions.of("Good governance and ongoing growth", 10));

        assertThat(scores).containsExactly(new CategoryScore("Go", 0.0));
    }

    @Test
    void missingTaxonomyGivesEmptyMatch() {
        TaxonomyMatcher matcher = matcher("classpath:taxonomy/absent.csv");

        assertThat(matcher.match("Software Engineer with Java").isEmpty()).isTrue();
    }

    @Test
    void contextTruncatesLongLists() {
        ExtractorProperties properties = new ExtractorProperties();
        properties.getTaxonomy().setLocation("classpath:taxonomy/test-taxonomy.csv");
        properties.getTaxonomy().setMaxSkillTerms(2);
        TaxonomyMatcher matcher = new TaxonomyMatcher(new TaxonomyLoader(new DefaultResourceLoader()), properties);
        matcher.loadTaxonomy();

        String context = matcher.formatContext(matcher.index(), List.of("Nursing"));

        assertThat(context).contains("Skills in this category: Patient Care, Triage, and 2 more");
    }

    private TaxonomyMatcher matcher(String location) {
        ExtractorProperties properties = new ExtractorProperties();
        properties.getTaxonomy().setLocation(location);
        TaxonomyMatcher matcher = new TaxonomyMatcher(new TaxonomyLoader(new DefaultResourceLoader()), properties);
        matcher.loadTaxonomy();
        return matcher;
    }
}
