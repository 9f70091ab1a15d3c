package com.delta.resumeextractor.extraction.service;

import com.delta.resumeextractor.extraction.dates.DerivedMetricsMerger;
import com.delta.resumeextractor.extraction.llm.LlmBatchClient;
import com.delta.resumeextractor.extraction.llm.ResultItemIds;
import com.delta.resumeextractor.extraction.model.BatchJob;
import com.delta.resumeextractor.extraction.model.BatchJobStatus;
import com.delta.resumeextractor.extraction.model.BatchOutcome;
import com.delta.resumeextractor.extraction.model.BatchResultItem;
import com.delta.resumeextractor.extraction.model.ParsedFieldSet;
import com.delta.resumeextractor.extraction.model.ParsedResponse;
import com.delta.resumeextractor.extraction.model.WriteResult;
import com.delta.resumeextractor.extraction.parse.ResponseParser;
import com.delta.resumeextractor.extraction.persistence.BatchJobRepository;
import com.delta.resumeextractor.extraction.persistence.CandidateRepository;
import com.delta.resumeextractor.extraction.persistence.DatabaseErrorClassifier;
import com.delta.resumeextractor.extraction.validate.FieldValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns the results of a completed batch into stored fields. Each record is handled on its own:
 * a bad response or a failed write marks that record failed and processing moves on.
 */
@Service
public class BatchResultProcessor {
    private static final Logger log = LoggerFactory.getLogger(BatchResultProcessor.class);

    private final LlmBatchClient llmClient;
    private final ResponseParser responseParser;
    private final DerivedMetricsMerger metricsMerger;
    private final FieldValidator fieldValidator;
    private final CandidateRepository candidateRepository;
    private final BatchJobRepository batchJobRepository;
    private final FailureLog failureLog;
    private final Clock clock;

    public BatchResultProcessor(
        LlmBatchClient llmClient,
        ResponseParser responseParser,
        DerivedMetricsMerger metricsMerger,
        FieldValidator fieldValidator,
        CandidateRepository candidateRepository,
        BatchJobRepository batchJobRepository,
        FailureLog failureLog,
        Clock clock
    ) {
        this.llmClient = llmClient;
        this.responseParser = responseParser;
        this.metricsMerger = metricsMerger;
        this.fieldValidator = fieldValidator;
        this.candidateRepository = candidateRepository;
        this.batchJobRepository = batchJobRepository;
        this.failureLog = failureLog;
        this.clock = clock;
    }

    public BatchOutcome process(BatchJob job) {
        String jobId = job.externalId();
        List<BatchResultItem> results = llmClient.fetchOutput(jobId);
        if (!batchJobRepository.claimResultProcessing(jobId, Instant.now(clock))) {
            log.info("Results of batch {} were already processed", jobId);
            return storedOutcome(jobId, job);
        }

        Set<Long> members = new HashSet<>(job.memberIds());
        Set<Long> seen = new HashSet<>();
        Set<Long> failedIds = new LinkedHashSet<>();
        int successCount = 0;
        int unmatched = 0;

        try {
            for (BatchResultItem item : results) {
                Optional<Long> resolved = ResultItemIds.parse(item.customId());
                if (resolved.isEmpty() || !members.contains(resolved.get())) {
                    log.warn("Batch {} result item '{}' matches no submitted record; skipped", jobId, item.customId());
                    unmatched++;
                    continue;
                }
                long recordId = resolved.get();
                if (!seen.add(recordId)) {
                    log.warn("Batch {} returned more than one result for record {}; extra ignored", jobId, recordId);
                    continue;
                }
                if (processItem(jobId, recordId, item)) {
                    successCount++;
                } else {
                    failedIds.add(recordId);
                }
            }

            for (Long recordId : job.memberIds()) {
                if (!seen.contains(recordId)) {
                    fail(jobId, recordId, "no result returned");
                    failedIds.add(recordId);
                }
            }
        } finally {
            recordCounts(jobId, successCount, failedIds.size());
        }

        int failureCount = failedIds.size();
        List<Long> failed = new ArrayList<>(failedIds);
        log.info(
            "Batch {} processed: total={}, success={}, failure={}, unmatched={}, failedIds={}",
            jobId,
            job.memberIds().size(),
            successCount,
            failureCount,
            unmatched,
            failed
        );
        failureLog.summary(jobId, job.memberIds().size(), successCount, failureCount, failed);
        return new BatchOutcome(
            jobId,
            BatchJobStatus.COMPLETED,
            job.memberIds().size(),
            successCount,
            failureCount,
            failed
        );
    }

    private boolean processItem(String jobId, long recordId, BatchResultItem item) {
        try {
            return handleItem(jobId, recordId, item);
        } catch (RuntimeException e) {
            log.warn("Batch {} record {} failed during processing", jobId, recordId, e);
            fail(jobId, recordId, "processing error: " + e.getMessage());
            return false;
        }
    }

    private boolean handleItem(String jobId, long recordId, BatchResultItem item) {
        if (!item.isSuccessful()) {
            String reason = item.errorMessage() != null
                ? "request failed (" + item.statusCode() + "): " + item.errorMessage()
                : "request failed with status " + item.statusCode();
            fail(jobId, recordId, reason);
            return false;
        }
        if (item.content() == null || item.content().isBlank()) {
            fail(jobId, recordId, "empty response");
            return false;
        }

        ParsedResponse parsed = responseParser.parse(recordId, item.content());
        ParsedFieldSet fields = parsed.fields();
        metricsMerger.merge(recordId, fields);
        fieldValidator.validate(recordId, fields);
        WriteResult write = candidateRepository.upsertFields(recordId, fields.asMap());
        if (!write.success()) {
            fail(jobId, recordId, write.message());
            return false;
        }
        recordOutcome(jobId, recordId, BatchJobRepository.OUTCOME_SUCCEEDED, write.message());
        log.debug("Batch {} record {} stored: {}", jobId, recordId, write.message());
        return true;
    }

    private void fail(String jobId, long recordId, String reason) {
        failureLog.record(jobId, recordId, reason);
        recordOutcome(jobId, recordId, BatchJobRepository.OUTCOME_FAILED, reason);
    }

    /**
     * Member bookkeeping only. A store error here is logged and never stops the remaining records.
     */
    private void recordOutcome(String jobId, long recordId, String outcome, String message) {
        try {
            batchJobRepository.recordMemberOutcome(jobId, recordId, outcome, message);
        } catch (DataAccessException e) {
            log.warn(
                "Batch {} record {} outcome {} not stored ({})",
                jobId,
                recordId,
                outcome,
                DatabaseErrorClassifier.classify(e),
                e
            );
        }
    }

    private void recordCounts(String jobId, int successCount, int failureCount) {
        try {
            batchJobRepository.recordCounts(jobId, successCount, failureCount);
        } catch (DataAccessException e) {
            log.error(
                "Batch {} counts success={} failure={} not stored ({})",
                jobId,
                successCount,
                failureCount,
                DatabaseErrorClassifier.classify(e),
                e
            );
        }
    }

    private BatchOutcome storedOutcome(String jobId, BatchJob fallback) {
        BatchJob stored = batchJobRepository.findById(jobId).orElse(fallback);
        return new BatchOutcome(
            jobId,
            stored.status(),
            stored.memberIds().size(),
            stored.successCount(),
            stored.failureCount(),
            List.of()
        );
    }
}
