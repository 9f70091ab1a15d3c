package com.delta.resumeextractor.extraction.model;

import java.time.Instant;
import java.util.List;

public record BatchJob(
    String externalId,
    BatchJobStatus status,
    List<Long> memberIds,
    Instant submittedAt,
    Instant lastPolledAt,
    String outputFileId,
    String errorFileId,
    Instant resultsProcessedAt,
    int successCount,
    int failureCount
) {
    public BatchJob {
        memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
    }
}
