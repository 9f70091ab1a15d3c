package com.delta.resumeextractor.extraction.llm;

public class LlmClientException extends RuntimeException {
    private final int statusCode;
    private final String errorCode;

    public LlmClientException(String message, int statusCode, String errorCode) {
        super(message);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public LlmClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.errorCode = "client_error";
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
