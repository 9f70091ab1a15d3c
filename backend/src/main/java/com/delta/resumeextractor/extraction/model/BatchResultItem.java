package com.delta.resumeextractor.extraction.model;

public record BatchResultItem(String customId, int statusCode, String content, String errorMessage) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorMessage == null;
    }
}
