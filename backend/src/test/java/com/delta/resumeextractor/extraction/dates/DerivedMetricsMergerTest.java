package com.delta.resumeextractor.extraction.dates;

import com.delta.resumeextractor.extraction.model.CandidateField;
import com.delta.resumeextractor.extraction.model.ParsedFieldSet;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class DerivedMetricsMergerTest {

    private final DerivedMetricsMerger merger = new DerivedMetricsMerger(new ExperienceCalculator(
        new ResumeDateParser(Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC))
    ));

    @Test
    void fillsUnknownMetricsFromJobHistory() {
        ParsedFieldSet fields = new ParsedFieldSet();
        fields.put(CandidateField.COMPANY_1, "Acme");
        fields.put(CandidateField.START_DATE_1, "2018-01-01");
        fields.put(CandidateField.END_DATE_1, "2022-01-01");
        fields.put(CandidateField.LOCATION_1, "Chicago, IL");

        merger.merge(1L, fields);

        assertThat(fields.getOrNull(CandidateField.YEARS_OF_EXPERIENCE)).isEqualTo("4.0");
        assertThat(fields.getOrNull(CandidateField.AVG_TENURE)).isEqualTo("4.0");
        assertThat(fields.getOrNull(CandidateField.LENGTH_IN_US)).isEqualTo("4.0");
    }

    @Test
    void keepsValuesTheModelSupplied() {
        ParsedFieldSet fields = new ParsedFieldSet();
        fields.put(CandidateField.COMPANY_1, "Acme");
        fields.put(CandidateField.START_DATE_1, "2018-01-01");
        fields.put(CandidateField.END_DATE_1, "2022-01-01");
        fields.put(CandidateField.YEARS_OF_EXPERIENCE, "12");

        merger.merge(2L, fields);

        assertThat(fields.getOrNull(CandidateField.YEARS_OF_EXPERIENCE)).isEqualTo("12");
        assertThat(fields.getOrNull(CandidateField.AVG_TENURE)).isEqualTo("4.0");
        assertThat(fields.isKnown(CandidateField.LENGTH_IN_US)).isFalse();
    }

    @Test
    void undatedJobsFallBackToCountAndDefaultTenure() {
        ParsedFieldSet fields = new ParsedFieldSet();
        fields.put(CandidateField.COMPANY_1, "Acme");
        fields.put(CandidateField.COMPANY_2, "Beta");

        merger.merge(3L, fields);

        assertThat(fields.getOrNull(CandidateField.YEARS_OF_EXPERIENCE)).isEqualTo("2");
        assertThat(fields.getOrNull(CandidateField.AVG_TENURE)).isEqualTo(String.valueOf(DerivedMetricsMerger.DEFAULT_AVG_TENURE));
    }

    @Test
    void noJobsLeavesMetricsUnknown() {
        ParsedFieldSet fields = new ParsedFieldSet();

        merger.merge(4L, fields);

        assertThat(fields.isKnown(CandidateField.YEARS_OF_EXPERIENCE)).isFalse();
        assertThat(fields.isKnown(CandidateField.AVG_TENURE)).isFalse();
        assertThat(fields.isKnown(CandidateField.LENGTH_IN_US)).isFalse();
    }
}
