package com.delta.resumeextractor.extraction.validate;

import com.delta.resumeextractor.extraction.dates.ResumeDateParser;
import com.delta.resumeextractor.extraction.model.CandidateField;
import com.delta.resumeextractor.extraction.model.ParsedFieldSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class FieldValidatorTest {

    private final FieldValidator validator = new FieldValidator(
        new ResumeDateParser(Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC))
    );

    @Test
    void duplicatePhoneWithDifferentFormattingIsCleared() {
        ParsedFieldSet fields = new ParsedFieldSet();
        fields.put(CandidateField.PHONE1, "123-456-7890");
        fields.put(CandidateField.PHONE2, "(123) 456-7890");

        validator.validate(1L, fields);

        assertThat(fields.getOrNull(CandidateField.PHONE1)).isEqualTo("123-456-7890");
        assertThat(fields.isKnown(CandidateField.PHONE2)).isFalse();
    }

    @Test
    void phoneDigitsAreComparedWhateverTheirLength() {
        ParsedFieldSet shortDuplicate = new ParsedFieldSet();
        shortDuplicate.put(CandidateField.PHONE1, "ext. 12-34");
        shortDuplicate.put(CandidateField.PHONE2, "1234");
        ParsedFieldSet distinct = new ParsedFieldSet();
        distinct.put(CandidateField.PHONE1, "+44 20 7946 0958 0001");
        distinct.put(CandidateField.PHONE2, "4420794609580002");

        validator.validate(3L, shortDuplicate);
        validator.validate(4L, distinct);

        assertThat(shortDuplicate.isKnown(CandidateField.PHONE2)).isFalse();
        assertThat(distinct.getOrNull(CandidateField.PHONE2)).isEqualTo("4420794609580002");
    }

    @Test
    void secondPhoneKeptWhenFirstIsUnknown() {
        ParsedFieldSet fields = new ParsedFieldSet();
        fields.put(CandidateField.PHONE1, "NULL");
        fields.put(CandidateField.PHONE2, "5551234567");

        validator.validate(2L, fields);

        assertThat(fields.isKnown(CandidateField.PHONE1)).isFalse();
        assertThat(fields.getOrNull(CandidateField.PHONE2)).isEqualTo("5551234567");
    }

    @ParameterizedTest
    @CsvSource({
        "2020-05-17, 2020-05-17",
        "March 2019, 2019-03-01",
        "2018, 2018-01-01",
        "6/2021, 2021-06-01",
        "2017/4/9, 2017-04-09",
        "15-08-2016, 2016-08-15",
        "08-2015, 2015-08-01",
        "since 2012-11, 2012-11-01",
        "around 1999 or so, 1999-01-01"
    })
    void normalizesDates(String input, String expected) {
        assertThat(validator.normalizeDate(input)).isEqualTo(expected);
    }

    @Test
    void unparseableAndCurrentDatesBecomeUnknown() {
        ParsedFieldSet fields = new ParsedFieldSet();
        fields.put(CandidateField.START_DATE_1, "a while ago");
        fields.put(CandidateField.END_DATE_1, "Present");
        fields.put(CandidateField.START_DATE_2, "Jan 2015");

        validator.validate(3L, fields);

        assertThat(fields.isKnown(CandidateField.START_DATE_1)).isFalse();
        assertThat(fields.isKnown(CandidateField.END_DATE_1)).isFalse();
        assertThat(fields.getOrNull(CandidateField.START_DATE_2)).isEqualTo("2015-01-01");
    }

    @Test
    void linkedinProfilesAreCanonicalized() {
        assertThat(validator.normalizeLinkedin("linkedin.com/in/jane-doe-42?trk=x"))
            .isEqualTo("https://www.linkedin.com/in/jane-doe-42");
        assertThat(validator.normalizeLinkedin("https://www.LinkedIn.com/pub/johnsmith/1/2"))
            .isEqualTo("https://www.linkedin.com/pub/johnsmith");
        assertThat(validator.normalizeLinkedin("@janedoe")).isEqualTo("https://www.linkedin.com/in/janedoe");
    }

    @Test
    void genericLinkedinLinksAreRejected() {
        assertThat(validator.normalizeLinkedin("https://www.linkedin.com/in/me")).isNull();
        assertThat(validator.normalizeLinkedin("https://linkedin.com/in/profile")).isNull();
        assertThat(validator.normalizeLinkedin("https://www.linkedin.com/")).isNull();
        assertThat(validator.normalizeLinkedin("see my profile")).isNull();
        assertThat(validator.normalizeLinkedin("NULL")).isNull();
    }

    @Test
    void overlongValuesAreTruncatedToColumnSize() {
        ParsedFieldSet fields = new ParsedFieldSet();
        fields.put(CandidateField.STATE, "x".repeat(80));
        fields.put(CandidateField.CERTIFICATIONS, "y".repeat(5000));

        validator.validate(4L, fields);

        assertThat(fields.getOrNull(CandidateField.STATE)).hasSize(CandidateField.STATE.maxLength());
        assertThat(fields.getOrNull(CandidateField.CERTIFICATIONS)).hasSize(5000);
    }
}
