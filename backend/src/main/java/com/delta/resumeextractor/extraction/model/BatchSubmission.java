package com.delta.resumeextractor.extraction.model;

import java.util.List;

public record BatchSubmission(
    String runId,
    String jobId,
    List<Long> memberIds,
    List<Long> skippedIds,
    List<Long> failedIds
) {
    public BatchSubmission {
        memberIds = memberIds == null ? List.of() : List.copyOf(memberIds);
        skippedIds = skippedIds == null ? List.of() : List.copyOf(skippedIds);
        failedIds = failedIds == null ? List.of() : List.copyOf(failedIds);
    }

    public boolean submitted() {
        return jobId != null;
    }
}
