package com.delta.resumeextractor.extraction.model;

public record WriteResult(boolean success, String message, int attempts) {
    public static WriteResult ok(String message, int attempts) {
        return new WriteResult(true, message, attempts);
    }

    public static WriteResult failed(String message, int attempts) {
        return new WriteResult(false, message, attempts);
    }
}
