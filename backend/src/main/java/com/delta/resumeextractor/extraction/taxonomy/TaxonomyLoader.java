package com.delta.resumeextractor.extraction.taxonomy;

import com.delta.resumeextractor.extraction.model.TaxonomyCategory;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the skills taxonomy: a {@code ##Name} row opens a category, the next row lists its job
 * titles and the row after that its skill terms.
 */
@Component
public class TaxonomyLoader {
    private static final Logger log = LoggerFactory.getLogger(TaxonomyLoader.class);
    private static final String CATEGORY_MARKER = "##";

    private final ResourceLoader resourceLoader;

    public TaxonomyLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public List<TaxonomyCategory> load(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IOException("Taxonomy not found at " + location);
        }
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            List<TaxonomyCategory> categories = parse(reader);
            log.info("Loaded {} taxonomy categories from {}", categories.size(), location);
            return categories;
        }
    }

    List<TaxonomyCategory> parse(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();
        List<TaxonomyCategory> categories = new ArrayList<>();
        String currentName = null;
        List<String> titles = null;
        try (CSVParser parser = format.parse(reader)) {
            for (CSVRecord record : parser) {
                List<String> cells = cells(record);
                if (cells.isEmpty()) {
                    continue;
                }
                String first = cells.get(0);
                if (first.startsWith(CATEGORY_MARKER)) {
                    if (currentName != null) {
                        categories.add(new TaxonomyCategory(currentName, titles, List.of()));
                    }
                    currentName = first.substring(CATEGORY_MARKER.length()).trim();
                    titles = null;
                    continue;
                }
                if (currentName == null) {
                    continue;
                }
                if (titles == null) {
                    titles = items(cells);
                } else {
                    categories.add(new TaxonomyCategory(currentName, titles, items(cells)));
                    currentName = null;
                    titles = null;
                }
            }
        }
        if (currentName != null) {
            categories.add(new TaxonomyCategory(currentName, titles, List.of()));
        }
        return categories;
    }

    private List<String> cells(CSVRecord record) {
        List<String> cells = new ArrayList<>();
        for (String value : record) {
            if (value != null && !value.isBlank()) {
                cells.add(value.trim());
            }
        }
        return cells;
    }

    private List<String> items(List<String> cells) {
        List<String> items = new ArrayList<>();
        for (String cell : cells) {
            if (cells.size() == 1 && cell.contains(",")) {
                for (String part : cell.split(",")) {
                    if (!part.isBlank()) {
                        items.add(part.trim());
                    }
                }
            } else {
                items.add(cell);
            }
        }
        return items;
    }
}
