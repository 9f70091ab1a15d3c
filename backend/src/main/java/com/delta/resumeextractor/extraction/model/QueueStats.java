package com.delta.resumeextractor.extraction.model;

public record QueueStats(long claimable, long claimedUnprocessed, long processed) {
}
