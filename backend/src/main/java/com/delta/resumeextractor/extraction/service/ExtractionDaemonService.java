package com.delta.resumeextractor.extraction.service;

import com.delta.resumeextractor.config.ExtractorConfigurationException;
import com.delta.resumeextractor.config.ExtractorProperties;
import com.delta.resumeextractor.extraction.model.BatchSubmission;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Continuous mode: submits a new batch every interval until stopped.
 */
@Service
public class ExtractionDaemonService {
    private static final Logger log = LoggerFactory.getLogger(ExtractionDaemonService.class);

    private final BatchSubmissionService submissionService;
    private final ExtractorProperties properties;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledFuture<?> submitTask;

    public ExtractionDaemonService(
        BatchSubmissionService submissionService,
        ExtractorProperties properties,
        @Qualifier("submissionScheduler") ScheduledExecutorService scheduler
    ) {
        this.submissionService = submissionService;
        this.properties = properties;
        this.scheduler = scheduler;
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
            if (!properties.getLlm().hasApiKey()) {
                throw new ExtractorConfigurationException("extractor.llm.api-key is not set (OPENAI_API_KEY)");
            }
            int intervalSeconds = properties.getCli().getIntervalSeconds();
            submitTask = scheduler.scheduleWithFixedDelay(this::submitCycle, 0, intervalSeconds, TimeUnit.SECONDS);
            running.set(true);
            log.info("Extraction daemon started (interval {}s)", intervalSeconds);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (submitTask != null) {
                submitTask.cancel(false);
                submitTask = null;
            }
            log.info("Extraction daemon stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    void submitCycle() {
        try {
            BatchSubmission submission = submissionService.submitNextBatch();
            if (submission.submitted()) {
                log.info("Daemon cycle submitted batch {} ({} records)", submission.jobId(), submission.memberIds().size());
            }
        } catch (Exception e) {
            log.warn("Daemon submission cycle failed", e);
        }
    }
}
