package com.delta.resumeextractor.extraction.dates;

import com.delta.resumeextractor.extraction.model.CandidateField;
import com.delta.resumeextractor.extraction.model.ExperienceMetrics;
import com.delta.resumeextractor.extraction.model.JobEntry;
import com.delta.resumeextractor.extraction.model.ParsedFieldSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fills years of experience, average tenure and US tenure. Values the model supplied are kept;
 * computed aggregates only fill unknown fields.
 */
@Component
public class DerivedMetricsMerger {
    private static final Logger log = LoggerFactory.getLogger(DerivedMetricsMerger.class);
    static final double DEFAULT_AVG_TENURE = 2.0;

    private final ExperienceCalculator calculator;

    public DerivedMetricsMerger(ExperienceCalculator calculator) {
        this.calculator = calculator;
    }

    public ExperienceMetrics merge(long recordId, ParsedFieldSet fields) {
        List<JobEntry> jobs = calculator.jobsFrom(fields);
        ExperienceMetrics metrics = calculator.calculate(jobs);

        if (!fields.isKnown(CandidateField.YEARS_OF_EXPERIENCE)) {
            if (metrics.totalExperience() > 0) {
                fields.put(CandidateField.YEARS_OF_EXPERIENCE, format(metrics.totalExperience()));
            } else if (!jobs.isEmpty()) {
                fields.put(CandidateField.YEARS_OF_EXPERIENCE, String.valueOf(jobs.size()));
            }
        }

        if (!fields.isKnown(CandidateField.AVG_TENURE)) {
            if (metrics.avgTenure() > 0) {
                fields.put(CandidateField.AVG_TENURE, format(metrics.avgTenure()));
            } else if (metrics.totalExperience() > 0 && !jobs.isEmpty()) {
                fields.put(
                    CandidateField.AVG_TENURE,
                    format(ResumeDateParser.round(metrics.totalExperience() / jobs.size(), 1))
                );
            } else if (!jobs.isEmpty()) {
                fields.put(CandidateField.AVG_TENURE, format(DEFAULT_AVG_TENURE));
            }
        }

        if (!fields.isKnown(CandidateField.LENGTH_IN_US)) {
            if (metrics.usExperience() > 0) {
                fields.put(CandidateField.LENGTH_IN_US, format(metrics.usExperience()));
            } else if (metrics.totalExperience() > 0 && anyUsLocation(jobs)) {
                fields.put(CandidateField.LENGTH_IN_US, format(metrics.totalExperience()));
            }
        }

        log.debug(
            "Record {} experience: total={}, avg={}, us={}, confidence={}",
            recordId,
            metrics.totalExperience(),
            metrics.avgTenure(),
            metrics.usExperience(),
            metrics.confidence()
        );
        return metrics;
    }

    private boolean anyUsLocation(List<JobEntry> jobs) {
        for (JobEntry job : jobs) {
            if (ExperienceCalculator.isUsLocation(job.location())) {
                return true;
            }
        }
        return false;
    }

    private String format(double value) {
        return String.valueOf(value);
    }
}
