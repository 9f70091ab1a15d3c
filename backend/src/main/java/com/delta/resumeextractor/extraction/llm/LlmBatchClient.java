package com.delta.resumeextractor.extraction.llm;

import com.delta.resumeextractor.extraction.model.BatchResultItem;
import com.delta.resumeextractor.extraction.model.BatchStatusSnapshot;
import com.delta.resumeextractor.extraction.model.BatchWorkItem;

import java.util.List;

/**
 * Remote batch service. Implementations throw {@link LlmClientException} on transport or API
 * failure after their own retries are exhausted.
 */
public interface LlmBatchClient {

    String submit(List<BatchWorkItem> items);

    BatchStatusSnapshot getStatus(String jobId);

    List<BatchResultItem> fetchOutput(String jobId);
}
