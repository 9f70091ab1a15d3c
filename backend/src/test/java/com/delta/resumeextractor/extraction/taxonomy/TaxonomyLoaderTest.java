package com.delta.resumeextractor.extraction.taxonomy;

import com.delta.resumeextractor.extraction.model.TaxonomyCategory;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaxonomyLoaderTest {
    private final TaxonomyLoader loader = new TaxonomyLoader(new DefaultResourceLoader());

    @Test
    void readsCategoryTitleAndSkillRows() throws IOException {
        String csv = """
            ##Alpha
            "Developer,Engineer"
            "Java, SQL"

            ##Beta
            Nurse,Medic
            Triage
            """;

        List<TaxonomyCategory> categories = loader.parse(new StringReader(csv));

        assertThat(categories).containsExactly(
            new TaxonomyCategory("Alpha", List.of("Developer", "Engineer"), List.of("Java", "SQL")),
            new TaxonomyCategory("Beta", List.of("Nurse", "Medic"), List.of("Triage"))
        );
    }

    @Test
    void categoryWithoutSkillRowKeepsTitles() throws IOException {
        List<TaxonomyCategory> categories = loader.parse(new StringReader("##Solo\nLone Title\n"));

        assertThat(categories).containsExactly(new TaxonomyCategory("Solo", List.of("Lone Title"), List.of()));
    }

    @Test
    void loadsClasspathTaxonomy() throws IOException {
        List<TaxonomyCategory> categories = loader.load("classpath:taxonomy/test-taxonomy.csv");

        assertThat(categories).extracting(TaxonomyCategory::name)
            .containsExactly("Software Engineering", "Nursing", "Data Analytics");
    }

    @Test
    void missingTaxonomyIsAnError() {
        assertThatThrownBy(() -> loader.load("classpath:taxonomy/absent.csv"))
            .isInstanceOf(IOException.class);
    }
}
