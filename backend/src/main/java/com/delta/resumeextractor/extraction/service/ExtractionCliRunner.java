package com.delta.resumeextractor.extraction.service;

import com.delta.resumeextractor.config.ExtractorProperties;
import com.delta.resumeextractor.extraction.model.BatchOutcome;
import com.delta.resumeextractor.extraction.model.BatchSubmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ExtractionCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ExtractionCliRunner.class);

    private final ExtractorProperties properties;
    private final BatchSubmissionService submissionService;
    private final BatchPollerService pollerService;
    private final ExtractionDaemonService daemonService;
    private final ConfigurableApplicationContext applicationContext;

    public ExtractionCliRunner(
        ExtractorProperties properties,
        BatchSubmissionService submissionService,
        BatchPollerService pollerService,
        ExtractionDaemonService daemonService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.submissionService = submissionService;
        this.pollerService = pollerService;
        this.daemonService = daemonService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) throws InterruptedException {
        ExtractorProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        if (cli.isContinuous() && cli.getRecordId() == null) {
            daemonService.start();
            log.info("Continuous extraction running every {}s", cli.getIntervalSeconds());
            return;
        }

        BatchSubmission submission = cli.getRecordId() != null
            ? submissionService.submitRecord(cli.getRecordId())
            : submissionService.submitNextBatch();
        log.info(
            "Run {}: batch={}, submitted={}, skipped={}, failed={}",
            submission.runId(),
            submission.jobId(),
            submission.memberIds().size(),
            submission.skippedIds().size(),
            submission.failedIds()
        );

        if (submission.submitted() && cli.isAwaitCompletion()) {
            BatchOutcome outcome = pollerService.awaitTerminal(
                submission.jobId(),
                Duration.ofMinutes(cli.getAwaitTimeoutMinutes())
            );
            log.info(
                "Batch {} finished {}: total={}, success={}, failure={}, failedIds={}",
                outcome.jobId(),
                outcome.status().apiValue(),
                outcome.total(),
                outcome.successCount(),
                outcome.failureCount(),
                outcome.failedIds()
            );
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
