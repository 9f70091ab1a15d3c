package com.delta.resumeextractor.extraction.dates;

import com.delta.resumeextractor.extraction.model.ParsedDate;
import com.delta.resumeextractor.extraction.model.TenureResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResumeDateParserTest {
    private static final LocalDate TODAY = LocalDate.of(2024, 6, 15);

    private final ResumeDateParser parser = new ResumeDateParser(
        Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC)
    );

    @ParameterizedTest
    @CsvSource({
        "2020-01-15, 2020-01-15, 1.0",
        "3/5/2019, 2019-03-05, 0.9",
        "Jan 2020, 2020-01-01, 0.7",
        "september 2018, 2018-09-01, 0.7",
        "2021-04, 2021-04-01, 0.7",
        "4/2017, 2017-04-01, 0.7",
        "2015, 2015-01-01, 0.5"
    })
    void recognizesSupportedFormats(String text, String expectedDate, double expectedConfidence) {
        ParsedDate parsed = parser.parse(text);

        assertThat(parsed.date()).isEqualTo(LocalDate.parse(expectedDate));
        assertThat(parsed.confidence()).isEqualTo(expectedConfidence);
        assertThat(parsed.originalText()).isEqualTo(text);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Present", "current", "Ongoing", "to date", "NULL", "", "sometime in spring", "13/45/2020"})
    void indicatorsAndGarbageParseToNothing(String text) {
        ParsedDate parsed = parser.parse(text);

        assertThat(parsed.isPresent()).isFalse();
        assertThat(parsed.confidence()).isZero();
    }

    @Test
    void futureDatesRejectedUnlessAllowed() {
        assertThat(parser.parse("2030-01-01").isPresent()).isFalse();
        assertThat(parser.parse("2030-01-01", true).date()).isEqualTo(LocalDate.of(2030, 1, 1));
    }

    @Test
    void currentPositionUsesWholeWords() {
        assertThat(parser.isCurrentPosition("Present")).isTrue();
        assertThat(parser.isCurrentPosition("until now")).isTrue();
        assertThat(parser.isCurrentPosition(null)).isTrue();
        assertThat(parser.isCurrentPosition("2026-01-01")).isTrue();
        assertThat(parser.isCurrentPosition("2019-12-31")).isFalse();
        assertThat(parser.isCurrentPosition("Snowden Corp closure 2019")).isFalse();
    }

    @Test
    void tenureToPresentUsesTodayAndAveragesConfidence() {
        TenureResult tenure = parser.calculateTenure("2020-01-01", "Present");

        double expected = ChronoUnit.DAYS.between(LocalDate.of(2020, 1, 1), TODAY) / 365.25;
        assertThat(tenure.tenureYears()).isCloseTo(expected, within(0.01));
        assertThat(tenure.confidence()).isCloseTo(0.9, within(1e-9));
        assertThat(tenure.current()).isTrue();
    }

    @Test
    void tenureWithEndBeforeStartIsZero() {
        TenureResult tenure = parser.calculateTenure("2020-01-01", "2019-01-01");

        assertThat(tenure.tenureYears()).isZero();
        assertThat(tenure.confidence()).isEqualTo(0.5);
    }
}
