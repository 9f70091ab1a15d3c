package com.delta.resumeextractor.extraction.validate;

import com.delta.resumeextractor.extraction.dates.ResumeDateParser;
import com.delta.resumeextractor.extraction.model.CandidateField;
import com.delta.resumeextractor.extraction.model.ParsedDate;
import com.delta.resumeextractor.extraction.model.ParsedFieldSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last pass before writeback: canonical dates, usable LinkedIn links, no duplicate phone and
 * column-sized values.
 */
@Component
public class FieldValidator {
    private static final Logger log = LoggerFactory.getLogger(FieldValidator.class);

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern YMD_SLASH = Pattern.compile("^(\\d{4})/(\\d{1,2})/(\\d{1,2})$");
    private static final Pattern DMY_DASH = Pattern.compile("^(\\d{1,2})-(\\d{1,2})-(\\d{4})$");
    private static final Pattern MY_DASH = Pattern.compile("^(\\d{1,2})-(\\d{4})$");
    private static final Pattern EMBEDDED_YMD = Pattern.compile("(\\d{4})[/-](\\d{1,2})[/-](\\d{1,2})");
    private static final Pattern EMBEDDED_YM = Pattern.compile("(\\d{4})[/-](\\d{1,2})");
    private static final Pattern EMBEDDED_YEAR = Pattern.compile("\\b(19\\d{2}|20\\d{2})\\b");

    private static final Pattern LINKEDIN_PATH = Pattern.compile(
        "linkedin\\.com/(in|pub|profile|company)/([^/?#\\s]+)",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern BARE_HANDLE = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{3,99}$");
    private static final Set<String> GENERIC_PROFILE_IDS = Set.of("user", "profile", "linkedin", "my", "page", "me");
    private static final int MIN_PROFILE_ID_LENGTH = 4;

    private final ResumeDateParser dateParser;

    public FieldValidator(ResumeDateParser dateParser) {
        this.dateParser = dateParser;
    }

    public void validate(long recordId, ParsedFieldSet fields) {
        for (CandidateField field : CandidateField.values()) {
            if (field.isDate() && fields.isKnown(field)) {
                String original = fields.getOrNull(field);
                String normalized = normalizeDate(original);
                if (normalized == null) {
                    log.warn("Record {} {}: unparseable date '{}' set to unknown", recordId, field.label(), original);
                    fields.clear(field);
                } else if (!normalized.equals(original)) {
                    fields.put(field, normalized);
                }
            }
        }

        fields.get(CandidateField.LINKEDIN).ifPresent(url -> {
            String normalized = normalizeLinkedin(url);
            if (normalized == null) {
                log.warn("Record {} LinkedIn '{}' is not a specific profile; set to unknown", recordId, url);
                fields.clear(CandidateField.LINKEDIN);
            } else {
                fields.put(CandidateField.LINKEDIN, normalized);
            }
        });

        dedupePhones(recordId, fields);
        enforceLengths(recordId, fields);
    }

    public String normalizeDate(String value) {
        if (ParsedFieldSet.isUnknownValue(value)) {
            return null;
        }
        String trimmed = value.trim();
        if (ISO_DATE.matcher(trimmed).matches() && isValid(trimmed)) {
            return trimmed;
        }
        ParsedDate parsed = dateParser.parse(trimmed, true);
        if (parsed.isPresent()) {
            return parsed.date().toString();
        }
        if (dateParser.isCurrentPosition(trimmed)) {
            return null;
        }
        LocalDate fallback = fallbackDate(trimmed);
        return fallback == null ? null : fallback.toString();
    }

    public String normalizeLinkedin(String value) {
        if (ParsedFieldSet.isUnknownValue(value)) {
            return null;
        }
        String trimmed = value.trim();
        Matcher matcher = LINKEDIN_PATH.matcher(trimmed);
        if (matcher.find()) {
            String kind = matcher.group(1).toLowerCase(Locale.ROOT);
            String id = matcher.group(2);
            if (!isSpecificProfileId(id)) {
                return null;
            }
            return "https://www.linkedin.com/" + kind + "/" + id;
        }
        if (trimmed.toLowerCase(Locale.ROOT).contains("linkedin.com")) {
            return null;
        }
        String handle = trimmed.startsWith("@") ? trimmed.substring(1) : trimmed;
        if (BARE_HANDLE.matcher(handle).matches() && isSpecificProfileId(handle)) {
            return "https://www.linkedin.com/in/" + handle;
        }
        return null;
    }

    void dedupePhones(long recordId, ParsedFieldSet fields) {
        String secondary = fields.getOrNull(CandidateField.PHONE2);
        if (secondary == null) {
            fields.clear(CandidateField.PHONE2);
            return;
        }
        String primary = fields.getOrNull(CandidateField.PHONE1);
        if (primary == null) {
            return;
        }
        String primaryDigits = digits(primary);
        if (!primaryDigits.isEmpty() && primaryDigits.equals(digits(secondary))) {
            log.debug("Record {} Phone2 duplicates Phone1; cleared", recordId);
            fields.clear(CandidateField.PHONE2);
        }
    }

    void enforceLengths(long recordId, ParsedFieldSet fields) {
        for (Map.Entry<CandidateField, String> entry : List.copyOf(fields.asMap().entrySet())) {
            CandidateField field = entry.getKey();
            int max = field.maxLength();
            String value = entry.getValue();
            if (max > 0 && value.length() > max) {
                log.warn("Record {} {} truncated from {} to {} characters", recordId, field.label(), value.length(), max);
                fields.put(field, value.substring(0, max));
            }
        }
    }

    static String digits(String value) {
        return value == null ? "" : value.replaceAll("\\D", "");
    }

    private boolean isSpecificProfileId(String id) {
        if (id == null) {
            return false;
        }
        String cleaned = id.trim();
        return cleaned.length() >= MIN_PROFILE_ID_LENGTH
            && !GENERIC_PROFILE_IDS.contains(cleaned.toLowerCase(Locale.ROOT));
    }

    private LocalDate fallbackDate(String value) {
        Matcher matcher = YMD_SLASH.matcher(value);
        if (matcher.matches()) {
            return date(matcher.group(1), matcher.group(2), matcher.group(3));
        }
        matcher = DMY_DASH.matcher(value);
        if (matcher.matches()) {
            return date(matcher.group(3), matcher.group(2), matcher.group(1));
        }
        matcher = MY_DASH.matcher(value);
        if (matcher.matches()) {
            return date(matcher.group(2), matcher.group(1), "1");
        }
        matcher = EMBEDDED_YMD.matcher(value);
        if (matcher.find()) {
            LocalDate date = date(matcher.group(1), matcher.group(2), matcher.group(3));
            if (date != null) {
                return date;
            }
        }
        matcher = EMBEDDED_YM.matcher(value);
        if (matcher.find()) {
            LocalDate date = date(matcher.group(1), matcher.group(2), "1");
            if (date != null) {
                return date;
            }
        }
        matcher = EMBEDDED_YEAR.matcher(value);
        if (matcher.find()) {
            return date(matcher.group(1), "1", "1");
        }
        return null;
    }

    private LocalDate date(String year, String month, String day) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
        } catch (DateTimeException e) {
            log.debug("Invalid date parts {}-{}-{}", year, month, day);
            return null;
        }
    }

    private boolean isValid(String isoDate) {
        try {
            LocalDate.parse(isoDate);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }
}
