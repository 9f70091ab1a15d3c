package com.delta.resumeextractor.extraction.model;

public record BatchStatusSnapshot(
    String jobId,
    BatchJobStatus status,
    String outputFileId,
    String errorFileId,
    int totalRequests,
    int completedRequests,
    int failedRequests
) {
}
