package com.delta.resumeextractor.extraction.service;

import com.delta.resumeextractor.config.ExtractorProperties;
import com.delta.resumeextractor.extraction.llm.LlmBatchClient;
import com.delta.resumeextractor.extraction.llm.LlmClientException;
import com.delta.resumeextractor.extraction.model.BatchJob;
import com.delta.resumeextractor.extraction.model.BatchJobStatus;
import com.delta.resumeextractor.extraction.model.BatchOutcome;
import com.delta.resumeextractor.extraction.model.BatchStatusSnapshot;
import com.delta.resumeextractor.extraction.persistence.BatchJobRepository;
import com.delta.resumeextractor.extraction.persistence.CandidateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class BatchPollerServiceTest {
    private BatchJobRepository batchJobRepository;
    private CandidateRepository candidateRepository;
    private LlmBatchClient llmClient;
    private BatchResultProcessor resultProcessor;
    private FailureLog failureLog;
    private ExtractorProperties properties;
    private BatchPollerService poller;

    @BeforeEach
    void setUp() {
        batchJobRepository = mock(BatchJobRepository.class);
        candidateRepository = mock(CandidateRepository.class);
        llmClient = mock(LlmBatchClient.class);
        resultProcessor = mock(BatchResultProcessor.class);
        failureLog = mock(FailureLog.class);
        properties = new ExtractorProperties();
        properties.getLlm().setApiKey("sk-test");
        properties.getPoller().setEnabled(false);
        poller = new BatchPollerService(
            batchJobRepository,
            candidateRepository,
            llmClient,
            resultProcessor,
            failureLog,
            properties,
            mock(ScheduledExecutorService.class),
            Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC)
        );
    }

    @Test
    void inFlightJobReturnsPendingAndStoresStatus() {
        BatchJob job = job("batch_1", BatchJobStatus.QUEUED, null);
        when(llmClient.getStatus("batch_1")).thenReturn(snapshot("batch_1", BatchJobStatus.IN_PROGRESS, null));

        BatchOutcome outcome = poller.pollJob(job);

        assertThat(outcome.status()).isEqualTo(BatchJobStatus.IN_PROGRESS);
        assertThat(outcome.total()).isEqualTo(2);
        verify(batchJobRepository).updateStatus(eq("batch_1"), eq(BatchJobStatus.IN_PROGRESS), any(), any(), any());
        verifyNoInteractions(resultProcessor);
    }

    @Test
    void completedJobIsHandedToTheResultProcessor() {
        BatchJob job = job("batch_1", BatchJobStatus.IN_PROGRESS, null);
        BatchOutcome processed = new BatchOutcome("batch_1", BatchJobStatus.COMPLETED, 2, 2, 0, List.of());
        when(llmClient.getStatus("batch_1")).thenReturn(snapshot("batch_1", BatchJobStatus.COMPLETED, "file-out"));
        when(resultProcessor.process(job)).thenReturn(processed);

        BatchOutcome outcome = poller.pollJob(job);

        assertThat(outcome).isEqualTo(processed);
        verify(batchJobRepository).updateStatus(eq("batch_1"), eq(BatchJobStatus.COMPLETED), eq("file-out"), any(), any());
    }

    @Test
    void expiredJobFailsEveryMemberAndKeepsClaimsByDefault() {
        BatchJob job = job("batch_1", BatchJobStatus.IN_PROGRESS, null);
        when(llmClient.getStatus("batch_1")).thenReturn(snapshot("batch_1", BatchJobStatus.EXPIRED, null));
        when(batchJobRepository.claimResultProcessing(eq("batch_1"), any())).thenReturn(true);

        BatchOutcome outcome = poller.pollJob(job);

        assertThat(outcome.status()).isEqualTo(BatchJobStatus.EXPIRED);
        assertThat(outcome.failureCount()).isEqualTo(2);
        assertThat(outcome.failedIds()).containsExactly(11L, 12L);
        verify(batchJobRepository).recordMemberOutcome("batch_1", 11L, BatchJobRepository.OUTCOME_FAILED, "batch expired");
        verify(batchJobRepository).recordMemberOutcome("batch_1", 12L, BatchJobRepository.OUTCOME_FAILED, "batch expired");
        verify(batchJobRepository).recordCounts("batch_1", 0, 2);
        verify(candidateRepository, never()).releaseClaims(anyCollection());
    }

    @Test
    void failedJobReleasesClaimsWhenConfigured() {
        properties.getClaims().setReleaseOnJobFailure(true);
        BatchJob job = job("batch_1", BatchJobStatus.IN_PROGRESS, null);
        when(llmClient.getStatus("batch_1")).thenReturn(snapshot("batch_1", BatchJobStatus.FAILED, null));
        when(batchJobRepository.claimResultProcessing(eq("batch_1"), any())).thenReturn(true);

        poller.pollJob(job);

        verify(candidateRepository).releaseClaims(List.of(11L, 12L));
    }

    @Test
    void processedJobIsNotPolledAgain() {
        BatchJob job = new BatchJob("batch_1", BatchJobStatus.COMPLETED, List.of(11L, 12L), Instant.now(), null,
            "file-out", null, Instant.now(), 2, 0);

        BatchOutcome outcome = poller.pollJob(job);

        assertThat(outcome.successCount()).isEqualTo(2);
        verifyNoInteractions(llmClient, resultProcessor);
    }

    @Test
    void oneFailingJobDoesNotStopThePollCycle() {
        BatchJob first = job("batch_1", BatchJobStatus.IN_PROGRESS, null);
        BatchJob second = job("batch_2", BatchJobStatus.IN_PROGRESS, null);
        when(batchJobRepository.findInFlight()).thenReturn(List.of(first, second));
        when(llmClient.getStatus("batch_1")).thenThrow(new LlmClientException("boom", 503, null));
        when(llmClient.getStatus("batch_2")).thenReturn(snapshot("batch_2", BatchJobStatus.FINALIZING, null));

        poller.pollOnce();

        verify(batchJobRepository).updateStatus(eq("batch_2"), eq(BatchJobStatus.FINALIZING), any(), any(), any());
    }

    @Test
    void pollCycleIsSkippedWithoutApiKey() {
        properties.getLlm().setApiKey("");

        poller.pollOnce();

        verifyNoInteractions(batchJobRepository, llmClient);
    }

    @Test
    void unknownJobIsReportedAsNotFound() {
        when(batchJobRepository.findById(anyString())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> poller.pollJob("batch_missing"))
            .isInstanceOf(BatchJobNotFoundException.class);
    }

    private static BatchJob job(String id, BatchJobStatus status, Instant processedAt) {
        return new BatchJob(id, status, List.of(11L, 12L), Instant.now(), null, null, null, processedAt, 0, 0);
    }

    private static BatchStatusSnapshot snapshot(String id, BatchJobStatus status, String outputFileId) {
        return new BatchStatusSnapshot(id, status, outputFileId, null, 2, 0, 0);
    }
}
