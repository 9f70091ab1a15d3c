package com.delta.resumeextractor.extraction.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes per-record failures to the dedicated {@code candidate-failures} log.
 */
@Component
public class FailureLog {
    private static final Logger failures = LoggerFactory.getLogger("candidate-failures");

    public void record(String context, long recordId, String reason) {
        failures.warn("context={} record={} reason={}", context, recordId, reason);
    }

    public void summary(String context, int total, int successCount, int failureCount, List<Long> failedIds) {
        if (failureCount == 0) {
            return;
        }
        failures.warn(
            "context={} summary total={} success={} failure={} failedIds={}",
            context,
            total,
            successCount,
            failureCount,
            failedIds
        );
    }
}
