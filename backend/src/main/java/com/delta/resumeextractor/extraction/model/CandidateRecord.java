package com.delta.resumeextractor.extraction.model;

import java.time.Instant;

public record CandidateRecord(
    long id,
    String rawText,
    Instant textReadyAt,
    Instant claimedAt,
    String claimOwner,
    Instant processedAt
) {
    public boolean hasText() {
        return rawText != null && !rawText.isBlank();
    }
}
