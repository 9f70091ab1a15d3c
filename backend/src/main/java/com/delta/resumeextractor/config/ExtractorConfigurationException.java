package com.delta.resumeextractor.config;

/**
 * Configuration that makes extraction impossible, such as a missing API key. Raised before any
 * record is claimed.
 */
public class ExtractorConfigurationException extends RuntimeException {
    public ExtractorConfigurationException(String message) {
        super(message);
    }
}
