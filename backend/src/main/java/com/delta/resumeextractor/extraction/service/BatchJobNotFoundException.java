package com.delta.resumeextractor.extraction.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class BatchJobNotFoundException extends RuntimeException {
    public BatchJobNotFoundException(String message) {
        super(message);
    }
}
