package com.delta.resumeextractor.extraction.model;

import java.util.Locale;

public enum BatchJobStatus {
    QUEUED,
    VALIDATING,
    IN_PROGRESS,
    FINALIZING,
    CANCELLING,
    COMPLETED,
    FAILED,
    EXPIRED,
    CANCELLED;

    public boolean isInFlight() {
        return this == QUEUED || this == VALIDATING || this == IN_PROGRESS || this == FINALIZING || this == CANCELLING;
    }

    public boolean isTerminal() {
        return !isInFlight();
    }

    public boolean isFailure() {
        return this == FAILED || this == EXPIRED || this == CANCELLED;
    }

    public String apiValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BatchJobStatus fromApiValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing batch status");
        }
        return BatchJobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
