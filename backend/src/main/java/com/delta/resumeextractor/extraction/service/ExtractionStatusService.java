package com.delta.resumeextractor.extraction.service;

import com.delta.resumeextractor.extraction.model.BatchJob;
import com.delta.resumeextractor.extraction.model.ExtractionStatusResponse;
import com.delta.resumeextractor.extraction.model.QueueStats;
import com.delta.resumeextractor.extraction.persistence.BatchJobRepository;
import com.delta.resumeextractor.extraction.persistence.CandidateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ExtractionStatusService {
    private static final Logger log = LoggerFactory.getLogger(ExtractionStatusService.class);

    private final CandidateRepository candidateRepository;
    private final BatchJobRepository batchJobRepository;
    private final WorkQueueService workQueueService;
    private final ExtractionDaemonService daemonService;
    private final BatchPollerService pollerService;

    public ExtractionStatusService(
        CandidateRepository candidateRepository,
        BatchJobRepository batchJobRepository,
        WorkQueueService workQueueService,
        ExtractionDaemonService daemonService,
        BatchPollerService pollerService
    ) {
        this.candidateRepository = candidateRepository;
        this.batchJobRepository = batchJobRepository;
        this.workQueueService = workQueueService;
        this.daemonService = daemonService;
        this.pollerService = pollerService;
    }

    public ExtractionStatusResponse status() {
        QueueStats stats;
        try {
            stats = candidateRepository.fetchQueueStats(workQueueService.windowStart());
        } catch (Exception e) {
            log.warn("Failed to load extraction queue stats", e);
            stats = new QueueStats(0, 0, 0);
        }
        List<BatchJob> inFlight;
        try {
            inFlight = batchJobRepository.findInFlight();
        } catch (Exception e) {
            log.warn("Failed to load in-flight batches", e);
            inFlight = List.of();
        }
        return new ExtractionStatusResponse(daemonService.isRunning(), pollerService.isRunning(), stats, inFlight);
    }

    public BatchJob batch(String jobId) {
        return batchJobRepository.findById(jobId)
            .orElseThrow(() -> new BatchJobNotFoundException("Batch " + jobId + " is not tracked"));
    }

    public List<BatchJob> recentBatches(int limit) {
        return batchJobRepository.findRecent(limit);
    }

    public int releaseClaims(List<Long> recordIds) {
        int released = candidateRepository.releaseClaims(recordIds);
        log.info("Released {} of {} requested claims", released, recordIds == null ? 0 : recordIds.size());
        return released;
    }
}
