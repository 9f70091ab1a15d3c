package com.delta.resumeextractor.extraction.model;

import java.util.List;

public record ExtractionStatusResponse(
    boolean daemonRunning,
    boolean pollerRunning,
    QueueStats queue,
    List<BatchJob> inFlightJobs
) {
}
