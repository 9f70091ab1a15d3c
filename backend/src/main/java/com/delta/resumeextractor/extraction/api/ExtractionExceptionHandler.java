package com.delta.resumeextractor.extraction.api;

import com.delta.resumeextractor.config.ExtractorConfigurationException;
import com.delta.resumeextractor.extraction.llm.LlmClientException;
import com.delta.resumeextractor.extraction.service.BatchJobNotFoundException;
import com.delta.resumeextractor.extraction.service.CandidateNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ExtractionExceptionHandler {

  @ExceptionHandler(CandidateNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleMissingCandidate(CandidateNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "candidate_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(BatchJobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleMissingBatch(BatchJobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "batch_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(ExtractorConfigurationException.class)
  public ResponseEntity<Map<String, String>> handleConfiguration(ExtractorConfigurationException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "extractor_not_configured", "message", ex.getMessage()));
  }

  @ExceptionHandler(LlmClientException.class)
  public ResponseEntity<Map<String, String>> handleLlmClient(LlmClientException ex) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of(
            "error", ex.getErrorCode() == null ? "llm_error" : ex.getErrorCode(),
            "message", ex.getMessage()));
  }
}
