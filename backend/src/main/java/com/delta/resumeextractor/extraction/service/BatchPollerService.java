package com.delta.resumeextractor.extraction.service;

import com.delta.resumeextractor.config.ExtractorProperties;
import com.delta.resumeextractor.extraction.llm.LlmBatchClient;
import com.delta.resumeextractor.extraction.model.BatchJob;
import com.delta.resumeextractor.extraction.model.BatchJobStatus;
import com.delta.resumeextractor.extraction.model.BatchOutcome;
import com.delta.resumeextractor.extraction.model.BatchStatusSnapshot;
import com.delta.resumeextractor.extraction.persistence.BatchJobRepository;
import com.delta.resumeextractor.extraction.persistence.CandidateRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks submitted batches until they reach a terminal state. Runs as a background loop on the
 * poller scheduler; {@link #pollJob(String)} can also be called directly.
 */
@Service
public class BatchPollerService {
    private static final Logger log = LoggerFactory.getLogger(BatchPollerService.class);

    private final BatchJobRepository batchJobRepository;
    private final CandidateRepository candidateRepository;
    private final LlmBatchClient llmClient;
    private final BatchResultProcessor resultProcessor;
    private final FailureLog failureLog;
    private final ExtractorProperties properties;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledFuture<?> pollTask;

    public BatchPollerService(
        BatchJobRepository batchJobRepository,
        CandidateRepository candidateRepository,
        LlmBatchClient llmClient,
        BatchResultProcessor resultProcessor,
        FailureLog failureLog,
        ExtractorProperties properties,
        @Qualifier("pollerScheduler") ScheduledExecutorService scheduler,
        Clock clock
    ) {
        this.batchJobRepository = batchJobRepository;
        this.candidateRepository = candidateRepository;
        this.llmClient = llmClient;
        this.resultProcessor = resultProcessor;
        this.failureLog = failureLog;
        this.properties = properties;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getPoller().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            ExtractorProperties.Poller poller = properties.getPoller();
            pollTask = scheduler.scheduleWithFixedDelay(
                this::pollOnce,
                poller.getInitialDelaySeconds(),
                poller.getIntervalSeconds(),
                TimeUnit.SECONDS
            );
            running.set(true);
            log.info("Batch poller started (interval {}s)", poller.getIntervalSeconds());
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (pollTask != null) {
                pollTask.cancel(false);
                pollTask = null;
            }
            log.info("Batch poller stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * One pass over every job that still needs attention. A failure on one job is logged and does
     * not stop the others.
     */
    public void pollOnce() {
        if (!properties.getLlm().hasApiKey()) {
            log.warn("Batch poll skipped: extractor.llm.api-key is not set");
            return;
        }
        List<BatchJob> jobs;
        try {
            jobs = batchJobRepository.findInFlight();
        } catch (Exception e) {
            log.warn("Failed to load in-flight batches", e);
            return;
        }
        for (BatchJob job : jobs) {
            try {
                pollJob(job);
            } catch (Exception e) {
                log.warn("Polling batch {} failed; will retry next cycle", job.externalId(), e);
            }
        }
    }

    public BatchOutcome pollJob(String jobId) {
        BatchJob job = batchJobRepository.findById(jobId)
            .orElseThrow(() -> new BatchJobNotFoundException("Batch " + jobId + " is not tracked"));
        return pollJob(job);
    }

    BatchOutcome pollJob(BatchJob job) {
        String jobId = job.externalId();
        int total = job.memberIds().size();
        if (job.resultsProcessedAt() != null) {
            return new BatchOutcome(jobId, job.status(), total, job.successCount(), job.failureCount(), List.of());
        }
        if (job.status() == BatchJobStatus.COMPLETED) {
            return resultProcessor.process(job);
        }

        BatchStatusSnapshot snapshot = llmClient.getStatus(jobId);
        batchJobRepository.updateStatus(
            jobId,
            snapshot.status(),
            snapshot.outputFileId(),
            snapshot.errorFileId(),
            Instant.now(clock)
        );
        BatchJobStatus status = snapshot.status();
        if (status.isInFlight()) {
            log.debug(
                "Batch {} is {} ({}/{} completed, {} failed)",
                jobId,
                status.apiValue(),
                snapshot.completedRequests(),
                snapshot.totalRequests(),
                snapshot.failedRequests()
            );
            return BatchOutcome.pending(jobId, status, total);
        }
        if (status == BatchJobStatus.COMPLETED) {
            log.info("Batch {} completed; processing results", jobId);
            return resultProcessor.process(job);
        }
        return handleFailedJob(job, status);
    }

    /**
     * Polls until the job's results are processed or the timeout passes.
     */
    public BatchOutcome awaitTerminal(String jobId, Duration timeout) throws InterruptedException {
        Instant deadline = Instant.now(clock).plus(timeout);
        long intervalMs = TimeUnit.SECONDS.toMillis(properties.getPoller().getIntervalSeconds());
        while (true) {
            BatchOutcome outcome = pollJob(jobId);
            if (outcome.status().isTerminal()) {
                return outcome;
            }
            if (!Instant.now(clock).isBefore(deadline)) {
                log.warn("Batch {} still {} after waiting {}", jobId, outcome.status().apiValue(), timeout);
                return outcome;
            }
            Thread.sleep(intervalMs);
        }
    }

    private BatchOutcome handleFailedJob(BatchJob job, BatchJobStatus status) {
        String jobId = job.externalId();
        if (!batchJobRepository.claimResultProcessing(jobId, Instant.now(clock))) {
            return new BatchOutcome(jobId, status, job.memberIds().size(), 0, job.memberIds().size(), List.of());
        }
        String reason = "batch " + status.apiValue();
        for (Long recordId : job.memberIds()) {
            failureLog.record(jobId, recordId, reason);
            batchJobRepository.recordMemberOutcome(jobId, recordId, BatchJobRepository.OUTCOME_FAILED, reason);
        }
        batchJobRepository.recordCounts(jobId, 0, job.memberIds().size());
        if (properties.getClaims().isReleaseOnJobFailure()) {
            int released = candidateRepository.releaseClaims(job.memberIds());
            log.info("Released {} claims from {} batch {}", released, status.apiValue(), jobId);
        }
        log.error("Batch {} ended {}; {} records failed", jobId, status.apiValue(), job.memberIds().size());
        failureLog.summary(jobId, job.memberIds().size(), 0, job.memberIds().size(), job.memberIds());
        return new BatchOutcome(jobId, status, job.memberIds().size(), 0, job.memberIds().size(), job.memberIds());
    }
}
