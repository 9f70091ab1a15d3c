package com.delta.resumeextractor.extraction.service;

import com.delta.resumeextractor.config.ExtractorConfigurationException;
import com.delta.resumeextractor.config.ExtractorProperties;
import com.delta.resumeextractor.extraction.llm.LlmBatchClient;
import com.delta.resumeextractor.extraction.llm.LlmClientException;
import com.delta.resumeextractor.extraction.llm.PromptBuilder;
import com.delta.resumeextractor.extraction.llm.ResultItemIds;
import com.delta.resumeextractor.extraction.model.BatchSubmission;
import com.delta.resumeextractor.extraction.model.BatchWorkItem;
import com.delta.resumeextractor.extraction.model.CandidateRecord;
import com.delta.resumeextractor.extraction.model.ChatMessage;
import com.delta.resumeextractor.extraction.model.TaxonomyMatch;
import com.delta.resumeextractor.extraction.persistence.BatchJobRepository;
import com.delta.resumeextractor.extraction.persistence.CandidateRepository;
import com.delta.resumeextractor.extraction.persistence.DatabaseErrorClassifier;
import com.delta.resumeextractor.extraction.taxonomy.TaxonomyMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Selects, claims and prepares a batch of records and hands it to the LLM batch API. Returns as
 * soon as the job is accepted; results are collected by {@link BatchPollerService}.
 */
@Service
public class BatchSubmissionService {
    private static final Logger log = LoggerFactory.getLogger(BatchSubmissionService.class);

    private final WorkQueueService workQueueService;
    private final CandidateRepository candidateRepository;
    private final BatchJobRepository batchJobRepository;
    private final TaxonomyMatcher taxonomyMatcher;
    private final PromptBuilder promptBuilder;
    private final LlmBatchClient llmClient;
    private final FailureLog failureLog;
    private final ExtractorProperties properties;
    private final ExecutorService promptExecutor;
    private final Clock clock;

    public BatchSubmissionService(
        WorkQueueService workQueueService,
        CandidateRepository candidateRepository,
        BatchJobRepository batchJobRepository,
        TaxonomyMatcher taxonomyMatcher,
        PromptBuilder promptBuilder,
        LlmBatchClient llmClient,
        FailureLog failureLog,
        ExtractorProperties properties,
        @Qualifier("promptExecutor") ExecutorService promptExecutor,
        Clock clock
    ) {
        this.workQueueService = workQueueService;
        this.candidateRepository = candidateRepository;
        this.batchJobRepository = batchJobRepository;
        this.taxonomyMatcher = taxonomyMatcher;
        this.promptBuilder = promptBuilder;
        this.llmClient = llmClient;
        this.failureLog = failureLog;
        this.properties = properties;
        this.promptExecutor = promptExecutor;
        this.clock = clock;
    }

    public BatchSubmission submitNextBatch() {
        return submitNextBatch(properties.getQueue().getBatchSize());
    }

    public BatchSubmission submitNextBatch(int batchSize) {
        requireApiKey();
        ExtractionSession session = ExtractionSession.start(Instant.now(clock));
        List<CandidateRecord> selected = workQueueService.select(session, batchSize);
        if (selected.isEmpty()) {
            log.info("Run {} found no claimable records", session.runId());
            return new BatchSubmission(session.runId(), null, List.of(), session.skippedIds(), List.of());
        }
        List<CandidateRecord> claimed = workQueueService.claim(selected, session);
        return submitClaimed(claimed, session);
    }

    /**
     * Submits one record by id, claiming it even if it was claimed or processed before.
     */
    public BatchSubmission submitRecord(long recordId) {
        requireApiKey();
        CandidateRecord record = candidateRepository.findById(recordId)
            .orElseThrow(() -> new CandidateNotFoundException("Candidate " + recordId + " does not exist"));
        ExtractionSession session = ExtractionSession.start(Instant.now(clock));
        if (!record.hasText()) {
            session.skip(recordId);
            log.info("Run {} record {} has no text; skipped", session.runId(), recordId);
            return new BatchSubmission(session.runId(), null, List.of(), session.skippedIds(), List.of());
        }
        List<CandidateRecord> claimed = workQueueService.claimSingle(record, session)
            ? List.of(record)
            : List.of();
        return submitClaimed(claimed, session);
    }

    private BatchSubmission submitClaimed(List<CandidateRecord> claimed, ExtractionSession session) {
        if (claimed.isEmpty()) {
            log.info("Run {} claimed no records", session.runId());
            return new BatchSubmission(session.runId(), null, List.of(), session.skippedIds(), session.failedIds());
        }

        List<BatchWorkItem> items = prepare(claimed, session);
        if (items.isEmpty()) {
            return new BatchSubmission(session.runId(), null, List.of(), session.skippedIds(), session.failedIds());
        }
        List<Long> memberIds = items.stream().map(BatchWorkItem::recordId).toList();

        String jobId;
        try {
            jobId = llmClient.submit(items);
        } catch (LlmClientException e) {
            log.error("Run {} batch submission failed: {}", session.runId(), e.getMessage());
            for (Long id : memberIds) {
                session.fail(id, "submission failed: " + e.getMessage());
                failureLog.record(session.runId(), id, "submission failed: " + e.getMessage());
            }
            releaseIfConfigured(memberIds, session);
            return new BatchSubmission(session.runId(), null, List.of(), session.skippedIds(), session.failedIds());
        }

        try {
            batchJobRepository.insertJob(jobId, session.runId(), memberIds, Instant.now(clock));
        } catch (DataAccessException e) {
            String reason = "batch " + jobId + " accepted but not recorded ("
                + DatabaseErrorClassifier.classify(e) + "): " + e.getMessage();
            log.error("Run {} batch {} was accepted but could not be stored; it will not be polled", session.runId(), jobId, e);
            for (Long id : memberIds) {
                session.fail(id, reason);
                failureLog.record(session.runId(), id, reason);
            }
            releaseIfConfigured(memberIds, session);
            return new BatchSubmission(session.runId(), null, List.of(), session.skippedIds(), session.failedIds());
        }
        log.info(
            "Run {} submitted batch {} with {} records ({} skipped, {} failed before submission)",
            session.runId(),
            jobId,
            memberIds.size(),
            session.skippedIds().size(),
            session.failedIds().size()
        );
        return new BatchSubmission(session.runId(), jobId, memberIds, session.skippedIds(), session.failedIds());
    }

    private List<BatchWorkItem> prepare(List<CandidateRecord> records, ExtractionSession session) {
        List<CompletableFuture<BatchWorkItem>> futures = new ArrayList<>(records.size());
        for (CandidateRecord record : records) {
            futures.add(CompletableFuture.supplyAsync(() -> buildItem(record), promptExecutor));
        }
        List<BatchWorkItem> items = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            long id = records.get(i).id();
            try {
                items.add(futures.get(i).join());
            } catch (CompletionException e) {
                String reason = "prompt preparation failed: " + e.getCause().getMessage();
                log.warn("Run {} record {} {}", session.runId(), id, reason, e.getCause());
                session.fail(id, reason);
                failureLog.record(session.runId(), id, reason);
            }
        }
        return items;
    }

    private BatchWorkItem buildItem(CandidateRecord record) {
        TaxonomyMatch match = taxonomyMatcher.match(record.rawText());
        List<ChatMessage> messages = promptBuilder.build(record.rawText(), match);
        return new BatchWorkItem(ResultItemIds.toCustomId(record.id()), record.id(), messages);
    }

    private void releaseIfConfigured(List<Long> ids, ExtractionSession session) {
        if (!properties.getClaims().isReleaseOnJobFailure()) {
            return;
        }
        int released = candidateRepository.releaseClaims(ids);
        log.info("Run {} released {} claims after failed submission", session.runId(), released);
    }

    private void requireApiKey() {
        if (!properties.getLlm().hasApiKey()) {
            throw new ExtractorConfigurationException("extractor.llm.api-key is not set (OPENAI_API_KEY)");
        }
    }
}
