package com.delta.resumeextractor.extraction.dates;

import com.delta.resumeextractor.extraction.model.CandidateField;
import com.delta.resumeextractor.extraction.model.ExperienceMetrics;
import com.delta.resumeextractor.extraction.model.JobEntry;
import com.delta.resumeextractor.extraction.model.JobTenure;
import com.delta.resumeextractor.extraction.model.ParsedFieldSet;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ExperienceCalculatorTest {
    private static final LocalDate TODAY = LocalDate.of(2024, 6, 15);

    private final ExperienceCalculator calculator = new ExperienceCalculator(new ResumeDateParser(
        Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC)
    ));

    @Test
    void twoUsJobsCountFullyTowardsUsExperience() {
        ExperienceMetrics metrics = calculator.calculate(List.of(
            new JobEntry("Acme", "2020-01-01", "Present", "New York, NY"),
            new JobEntry("Beta", "2015-07-01", "2019-12-31", "San Francisco, CA")
        ));

        double acme = ChronoUnit.DAYS.between(LocalDate.of(2020, 1, 1), TODAY) / 365.25;
        double beta = ChronoUnit.DAYS.between(LocalDate.of(2015, 7, 1), LocalDate.of(2019, 12, 31)) / 365.25;
        assertThat(metrics.jobs()).hasSize(2);
        assertThat(metrics.totalExperience()).isCloseTo(acme + beta, within(0.06));
        assertThat(metrics.avgTenure()).isCloseTo((acme + beta) / 2, within(0.06));
        assertThat(metrics.usExperience()).isEqualTo(metrics.totalExperience());
        assertThat(metrics.confidence()).isCloseTo(0.95, within(1e-9));
    }

    @Test
    void jobsWithoutUsableDatesAreListedButLeftOutOfTotals() {
        ExperienceMetrics metrics = calculator.calculate(List.of(
            new JobEntry("Acme", null, null, "Austin, TX"),
            new JobEntry("Beta", "2018-01-01", "2020-01-01", "London, UK")
        ));

        assertThat(metrics.jobs()).extracting(JobTenure::company).containsExactly("Acme", "Beta");
        assertThat(metrics.jobs().get(0).tenureYears()).isZero();
        assertThat(metrics.totalExperience()).isCloseTo(2.0, within(0.06));
        assertThat(metrics.avgTenure()).isEqualTo(metrics.totalExperience());
        assertThat(metrics.usExperience()).isZero();
    }

    @Test
    void jobsWithNoValidTenureStillAppearWithZeroTotals() {
        ExperienceMetrics metrics = calculator.calculate(List.of(
            new JobEntry("Acme", null, null, null),
            new JobEntry(null, "2018-01-01", "2020-01-01", null)
        ));

        assertThat(metrics.jobs()).extracting(JobTenure::company).containsExactly("Acme");
        assertThat(metrics.totalExperience()).isZero();
        assertThat(metrics.avgTenure()).isZero();
        assertThat(metrics.confidence()).isZero();
    }

    @Test
    void noJobsGivesEmptyMetrics() {
        assertThat(calculator.calculate(List.of())).isEqualTo(ExperienceMetrics.empty());
    }

    @Test
    void recognizesUsLocations() {
        assertThat(ExperienceCalculator.isUsLocation("Austin, TX")).isTrue();
        assertThat(ExperienceCalculator.isUsLocation("Remote, USA")).isTrue();
        assertThat(ExperienceCalculator.isUsLocation("Denver, US")).isTrue();
        assertThat(ExperienceCalculator.isUsLocation("Toronto, Canada")).isFalse();
        assertThat(ExperienceCalculator.isUsLocation("London, UK")).isFalse();
        assertThat(ExperienceCalculator.isUsLocation(null)).isFalse();
    }

    @Test
    void readsRankedJobsFromFields() {
        ParsedFieldSet fields = new ParsedFieldSet();
        fields.put(CandidateField.COMPANY_1, "Acme");
        fields.put(CandidateField.START_DATE_1, "2020-01-01");
        fields.put(CandidateField.COMPANY_3, "Gamma");
        fields.put(CandidateField.LOCATION_3, "Boston, MA");

        List<JobEntry> jobs = calculator.jobsFrom(fields);

        assertThat(jobs).containsExactly(
            new JobEntry("Acme", "2020-01-01", null, null),
            new JobEntry("Gamma", null, null, "Boston, MA")
        );
    }
}
