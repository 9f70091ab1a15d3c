package com.delta.resumeextractor.extraction.model;

import java.util.List;

public record BatchOutcome(
    String jobId,
    BatchJobStatus status,
    int total,
    int successCount,
    int failureCount,
    List<Long> failedIds
) {
    public BatchOutcome {
        failedIds = failedIds == null ? List.of() : List.copyOf(failedIds);
    }

    public static BatchOutcome pending(String jobId, BatchJobStatus status, int total) {
        return new BatchOutcome(jobId, status, total, 0, 0, List.of());
    }
}
