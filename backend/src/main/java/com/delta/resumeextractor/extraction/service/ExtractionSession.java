package com.delta.resumeextractor.extraction.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Bookkeeping for one submission run, passed explicitly to each stage. Safe for use from the
 * claim and prompt worker pools.
 */
public class ExtractionSession {
    private final String runId;
    private final Instant startedAt;
    private final Set<Long> skipped = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Set<Long> claimed = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Map<Long, String> failed = Collections.synchronizedMap(new LinkedHashMap<>());

    public ExtractionSession(String runId, Instant startedAt) {
        this.runId = runId;
        this.startedAt = startedAt;
    }

    public static ExtractionSession start(Instant now) {
        return new ExtractionSession(UUID.randomUUID().toString().substring(0, 8), now);
    }

    public String runId() {
        return runId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public void skip(long recordId) {
        skipped.add(recordId);
    }

    public void claimed(long recordId) {
        claimed.add(recordId);
    }

    public void fail(long recordId, String reason) {
        failed.put(recordId, reason);
    }

    public boolean isSkipped(long recordId) {
        return skipped.contains(recordId);
    }

    public List<Long> skippedIds() {
        synchronized (skipped) {
            return new ArrayList<>(skipped);
        }
    }

    public List<Long> claimedIds() {
        synchronized (claimed) {
            return new ArrayList<>(claimed);
        }
    }

    public List<Long> failedIds() {
        synchronized (failed) {
            return new ArrayList<>(failed.keySet());
        }
    }

    public Map<Long, String> failures() {
        synchronized (failed) {
            return new LinkedHashMap<>(failed);
        }
    }
}
