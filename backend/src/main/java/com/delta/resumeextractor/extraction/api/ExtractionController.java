package com.delta.resumeextractor.extraction.api;

import com.delta.resumeextractor.extraction.model.BatchJob;
import com.delta.resumeextractor.extraction.model.BatchOutcome;
import com.delta.resumeextractor.extraction.model.BatchSubmission;
import com.delta.resumeextractor.extraction.model.ExtractionStatusResponse;
import com.delta.resumeextractor.extraction.model.ReleaseClaimsRequest;
import com.delta.resumeextractor.extraction.service.BatchPollerService;
import com.delta.resumeextractor.extraction.service.BatchSubmissionService;
import com.delta.resumeextractor.extraction.service.ExtractionDaemonService;
import com.delta.resumeextractor.extraction.service.ExtractionStatusService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/extraction")
public class ExtractionController {
    private final ExtractionStatusService statusService;
    private final BatchSubmissionService submissionService;
    private final BatchPollerService pollerService;
    private final ExtractionDaemonService daemonService;

    public ExtractionController(
        ExtractionStatusService statusService,
        BatchSubmissionService submissionService,
        BatchPollerService pollerService,
        ExtractionDaemonService daemonService
    ) {
        this.statusService = statusService;
        this.submissionService = submissionService;
        this.pollerService = pollerService;
        this.daemonService = daemonService;
    }

    @GetMapping("/status")
    public ExtractionStatusResponse status() {
        return statusService.status();
    }

    @PostMapping("/submit")
    public BatchSubmission submit(@RequestParam(name = "batchSize", required = false) Integer batchSize) {
        return batchSize == null
            ? submissionService.submitNextBatch()
            : submissionService.submitNextBatch(Math.max(1, batchSize));
    }

    @PostMapping("/records/{id}")
    public BatchSubmission submitRecord(@PathVariable("id") long id) {
        return submissionService.submitRecord(id);
    }

    @GetMapping("/batches")
    public List<BatchJob> recentBatches(@RequestParam(name = "limit", required = false, defaultValue = "20") int limit) {
        return statusService.recentBatches(limit);
    }

    @GetMapping("/batches/{jobId}")
    public BatchJob batch(@PathVariable("jobId") String jobId) {
        return statusService.batch(jobId);
    }

    @PostMapping("/batches/{jobId}/poll")
    public BatchOutcome poll(@PathVariable("jobId") String jobId) {
        return pollerService.pollJob(jobId);
    }

    @PostMapping("/claims/release")
    public Map<String, Integer> releaseClaims(@RequestBody ReleaseClaimsRequest request) {
        List<Long> ids = request == null || request.recordIds() == null ? List.of() : request.recordIds();
        return Map.of("requested", ids.size(), "released", statusService.releaseClaims(ids));
    }

    @PostMapping("/daemon/start")
    public ExtractionStatusResponse startDaemon() {
        daemonService.start();
        return statusService.status();
    }

    @PostMapping("/daemon/stop")
    public ExtractionStatusResponse stopDaemon() {
        daemonService.stop();
        return statusService.status();
    }
}
