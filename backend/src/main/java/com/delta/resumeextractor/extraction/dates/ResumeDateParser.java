package com.delta.resumeextractor.extraction.dates;

import com.delta.resumeextractor.extraction.model.ParsedDate;
import com.delta.resumeextractor.extraction.model.TenureResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class ResumeDateParser {
    private static final Logger log = LoggerFactory.getLogger(ResumeDateParser.class);

    public static final double FULL_DATE_CONFIDENCE = 1.0;
    public static final double US_DATE_CONFIDENCE = 0.9;
    public static final double MONTH_YEAR_CONFIDENCE = 0.7;
    public static final double YEAR_ONLY_CONFIDENCE = 0.5;
    public static final double CURRENT_END_CONFIDENCE = 0.8;

    static final Set<String> CURRENT_INDICATORS = Set.of(
        "present", "current", "now", "to date", "today", "ongoing", "to present", "currently"
    );

    private static final Pattern CURRENT_INDICATOR_PATTERN = Pattern.compile(
        "\\b(present|currently|current|now|to date|today|ongoing)\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern US_DATE = Pattern.compile("^\\d{1,2}/\\d{1,2}/\\d{4}$");
    private static final Pattern MONTH_NAME_YEAR = Pattern.compile("^[A-Za-z]{3,9}\\s+\\d{4}$");
    private static final Pattern ISO_YEAR_MONTH = Pattern.compile("^\\d{4}-\\d{2}$");
    private static final Pattern SLASH_MONTH_YEAR = Pattern.compile("^\\d{1,2}/\\d{4}$");
    private static final Pattern YEAR_ONLY = Pattern.compile("^\\d{4}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final DateTimeFormatter ISO_DATE_FORMAT = strict("uuuu-MM-dd");
    private static final DateTimeFormatter US_DATE_FORMAT = strict("M/d/uuuu");
    private static final DateTimeFormatter SHORT_MONTH_FORMAT = strict("MMM uuuu");
    private static final DateTimeFormatter FULL_MONTH_FORMAT = strict("MMMM uuuu");
    private static final DateTimeFormatter ISO_YEAR_MONTH_FORMAT = strict("uuuu-MM");
    private static final DateTimeFormatter SLASH_MONTH_YEAR_FORMAT = strict("M/uuuu");

    private final Clock clock;

    public ResumeDateParser(Clock clock) {
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public ParsedDate parse(String text) {
        return parse(text, false);
    }

    public ParsedDate parse(String text, boolean allowFuture) {
        if (text == null || text.isBlank()) {
            return ParsedDate.none(text);
        }
        String trimmed = WHITESPACE.matcher(text.trim()).replaceAll(" ");
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.equals("null") || CURRENT_INDICATORS.contains(lower)) {
            return ParsedDate.none(text);
        }

        ParsedDate parsed = parseKnownFormat(trimmed, text);
        if (!parsed.isPresent()) {
            return parsed;
        }
        if (!allowFuture && parsed.date().isAfter(today())) {
            log.warn("Rejecting future date '{}' parsed as {}", text, parsed.date());
            return ParsedDate.none(text);
        }
        return parsed;
    }

    public boolean isCurrentPosition(String endText) {
        if (endText == null || endText.isBlank() || endText.trim().equalsIgnoreCase("null")) {
            return true;
        }
        if (CURRENT_INDICATOR_PATTERN.matcher(endText).find()) {
            return true;
        }
        ParsedDate parsed = parse(endText, true);
        return parsed.isPresent() && parsed.date().isAfter(today());
    }

    public TenureResult calculateTenure(String startText, String endText) {
        ParsedDate start = parse(startText, false);
        boolean current = isCurrentPosition(endText);
        ParsedDate end = current
            ? new ParsedDate(today(), CURRENT_END_CONFIDENCE, endText)
            : parse(endText, true);

        if (start.isPresent() && end.isPresent() && !end.date().isBefore(start.date())) {
            long days = ChronoUnit.DAYS.between(start.date(), end.date());
            double tenure = round(days / 365.25, 2);
            double confidence = (start.confidence() + end.confidence()) / 2.0;
            return new TenureResult(tenure, confidence, current, start, end);
        }
        return new TenureResult(0.0, start.confidence() * 0.5, current, start, end);
    }

    private ParsedDate parseKnownFormat(String value, String original) {
        try {
            if (ISO_DATE.matcher(value).matches()) {
                return new ParsedDate(LocalDate.parse(value, ISO_DATE_FORMAT), FULL_DATE_CONFIDENCE, original);
            }
            if (US_DATE.matcher(value).matches()) {
                return new ParsedDate(LocalDate.parse(value, US_DATE_FORMAT), US_DATE_CONFIDENCE, original);
            }
            if (MONTH_NAME_YEAR.matcher(value).matches()) {
                YearMonth month = parseMonthName(value);
                return new ParsedDate(month.atDay(1), MONTH_YEAR_CONFIDENCE, original);
            }
            if (ISO_YEAR_MONTH.matcher(value).matches()) {
                YearMonth month = YearMonth.parse(value, ISO_YEAR_MONTH_FORMAT);
                return new ParsedDate(month.atDay(1), MONTH_YEAR_CONFIDENCE, original);
            }
            if (SLASH_MONTH_YEAR.matcher(value).matches()) {
                YearMonth month = YearMonth.parse(value, SLASH_MONTH_YEAR_FORMAT);
                return new ParsedDate(month.atDay(1), MONTH_YEAR_CONFIDENCE, original);
            }
            if (YEAR_ONLY.matcher(value).matches()) {
                int year = Integer.parseInt(value);
                if (year < 1) {
                    return ParsedDate.none(original);
                }
                return new ParsedDate(LocalDate.of(year, 1, 1), YEAR_ONLY_CONFIDENCE, original);
            }
        } catch (DateTimeException e) {
            log.debug("Unparseable date '{}': {}", original, e.getMessage());
        }
        return ParsedDate.none(original);
    }

    private YearMonth parseMonthName(String value) {
        String monthToken = value.substring(0, value.indexOf(' '));
        DateTimeFormatter formatter = monthToken.length() == 3 ? SHORT_MONTH_FORMAT : FULL_MONTH_FORMAT;
        return YearMonth.parse(value, formatter);
    }

    static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    private static DateTimeFormatter strict(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }
}
