package com.delta.resumeextractor.extraction.dates;

import com.delta.resumeextractor.extraction.model.CandidateField;
import com.delta.resumeextractor.extraction.model.ExperienceMetrics;
import com.delta.resumeextractor.extraction.model.JobEntry;
import com.delta.resumeextractor.extraction.model.JobTenure;
import com.delta.resumeextractor.extraction.model.ParsedFieldSet;
import com.delta.resumeextractor.extraction.model.TenureResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class ExperienceCalculator {
    private static final Logger log = LoggerFactory.getLogger(ExperienceCalculator.class);

    private static final List<String> US_STATE_CODES = List.of(
        "AL", "AK", "AZ", "AR", "CA", "CO", "CT", "DE", "FL", "GA",
        "HI", "ID", "IL", "IN", "IA", "KS", "KY", "LA", "ME", "MD",
        "MA", "MI", "MN", "MS", "MO", "MT", "NE", "NV", "NH", "NJ",
        "NM", "NY", "NC", "ND", "OH", "OK", "OR", "PA", "RI", "SC",
        "SD", "TN", "TX", "UT", "VT", "VA", "WA", "WV", "WI", "WY"
    );
    private static final List<String> US_COUNTRY_TOKENS = List.of("UNITED STATES", "USA", "U.S.A");

    private final ResumeDateParser dateParser;

    public ExperienceCalculator(ResumeDateParser dateParser) {
        this.dateParser = dateParser;
    }

    /**
     * Lists every job that names a company. Only jobs with a positive tenure and some date
     * confidence count towards the totals, the average and the US experience.
     */
    public ExperienceMetrics calculate(List<JobEntry> jobs) {
        if (jobs == null || jobs.isEmpty()) {
            return ExperienceMetrics.empty();
        }
        List<JobTenure> listed = new ArrayList<>();
        int validCount = 0;
        double total = 0.0;
        double usTotal = 0.0;
        double confidenceSum = 0.0;
        for (JobEntry job : jobs) {
            if (job == null || !job.hasCompany()) {
                continue;
            }
            TenureResult tenure = dateParser.calculateTenure(job.startDate(), job.endDate());
            listed.add(new JobTenure(
                job.company(),
                job.location(),
                tenure.tenureYears(),
                tenure.confidence(),
                tenure.current(),
                tenure.start().date(),
                tenure.end().date()
            ));
            if (tenure.tenureYears() <= 0 || tenure.confidence() <= 0) {
                log.debug("Job {} has no usable tenure; left out of totals", job.company());
                continue;
            }
            validCount++;
            total += tenure.tenureYears();
            confidenceSum += tenure.confidence();
            if (isUsLocation(job.location())) {
                usTotal += tenure.tenureYears();
            }
        }
        if (validCount == 0) {
            return new ExperienceMetrics(listed, 0.0, 0.0, 0.0, 0.0);
        }
        return new ExperienceMetrics(
            listed,
            ResumeDateParser.round(total, 1),
            ResumeDateParser.round(total / validCount, 1),
            ResumeDateParser.round(usTotal, 1),
            confidenceSum / validCount
        );
    }

    public List<JobEntry> jobsFrom(ParsedFieldSet fields) {
        List<JobEntry> jobs = new ArrayList<>();
        for (int rank = 1; rank <= CandidateField.MAX_JOBS; rank++) {
            String company = fields.getOrNull(CandidateField.company(rank));
            if (company == null) {
                continue;
            }
            jobs.add(new JobEntry(
                company,
                fields.getOrNull(CandidateField.startDate(rank)),
                fields.getOrNull(CandidateField.endDate(rank)),
                fields.getOrNull(CandidateField.location(rank))
            ));
        }
        return jobs;
    }

    public static boolean isUsLocation(String location) {
        if (location == null || location.isBlank()) {
            return false;
        }
        String upper = location.toUpperCase(Locale.ROOT);
        for (String token : US_COUNTRY_TOKENS) {
            if (upper.contains(token)) {
                return true;
            }
        }
        if (upper.contains(", US")) {
            String tail = upper.substring(upper.lastIndexOf(", US") + 4);
            if (tail.isEmpty() || !Character.isLetter(tail.charAt(0))) {
                return true;
            }
        }
        for (String code : US_STATE_CODES) {
            int index = upper.indexOf(", " + code);
            while (index >= 0) {
                int end = index + 2 + code.length();
                if (end == upper.length() || !Character.isLetter(upper.charAt(end))) {
                    return true;
                }
                index = upper.indexOf(", " + code, index + 1);
            }
        }
        return false;
    }
}
