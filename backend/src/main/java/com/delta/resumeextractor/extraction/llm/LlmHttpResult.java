package com.delta.resumeextractor.extraction.llm;

import java.time.Duration;
import java.time.Instant;

public record LlmHttpResult(
    String url,
    int statusCode,
    String body,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String describeFailure() {
        if (errorCode != null) {
            return errorCode + (errorMessage == null ? "" : ": " + errorMessage);
        }
        String snippet = body == null ? "" : body.substring(0, Math.min(200, body.length()));
        return "HTTP " + statusCode + (snippet.isBlank() ? "" : ": " + snippet);
    }
}
