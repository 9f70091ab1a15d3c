package com.delta.resumeextractor.extraction.service;

import com.delta.resumeextractor.config.ExtractorProperties;
import com.delta.resumeextractor.extraction.model.CandidateRecord;
import com.delta.resumeextractor.extraction.persistence.CandidateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

@Service
public class WorkQueueService {
    private static final Logger log = LoggerFactory.getLogger(WorkQueueService.class);

    private final CandidateRepository candidateRepository;
    private final ExtractorProperties properties;
    private final ExecutorService claimExecutor;
    private final Clock clock;

    public WorkQueueService(
        CandidateRepository candidateRepository,
        ExtractorProperties properties,
        @Qualifier("claimExecutor") ExecutorService claimExecutor,
        Clock clock
    ) {
        this.candidateRepository = candidateRepository;
        this.properties = properties;
        this.claimExecutor = claimExecutor;
        this.clock = clock;
    }

    public Instant windowStart() {
        LocalDate firstDay = LocalDate.now(clock).minusDays(properties.getQueue().getRecencyDays());
        return firstDay.atStartOfDay(clock.getZone()).toInstant();
    }

    /**
     * Newest ready records first. Records whose text is only whitespace are noted as skipped.
     */
    public List<CandidateRecord> select(ExtractionSession session, int limit) {
        List<CandidateRecord> rows = candidateRepository.findClaimable(windowStart(), limit);
        List<CandidateRecord> ready = new ArrayList<>(rows.size());
        for (CandidateRecord row : rows) {
            if (!row.hasText()) {
                session.skip(row.id());
                continue;
            }
            ready.add(row);
        }
        log.info(
            "Run {} selected {} claimable records ({} skipped for empty text)",
            session.runId(),
            ready.size(),
            rows.size() - ready.size()
        );
        return ready;
    }

    /**
     * Claims records in parallel. A record that cannot be claimed, because another run took it or
     * the write failed, is dropped from the result without affecting the others.
     */
    public List<CandidateRecord> claim(List<CandidateRecord> records, ExtractionSession session) {
        Instant claimedAt = Instant.now(clock);
        String owner = properties.getQueue().getClaimOwner();
        List<CompletableFuture<Boolean>> futures = new ArrayList<>(records.size());
        for (CandidateRecord record : records) {
            futures.add(CompletableFuture.supplyAsync(
                () -> candidateRepository.markClaimed(record.id(), claimedAt, owner),
                claimExecutor
            ));
        }

        List<CandidateRecord> claimed = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            CandidateRecord record = records.get(i);
            try {
                if (futures.get(i).join()) {
                    claimed.add(record);
                    session.claimed(record.id());
                } else {
                    log.info("Run {} record {} was claimed elsewhere; dropped", session.runId(), record.id());
                }
            } catch (CompletionException e) {
                log.warn("Run {} failed to claim record {}; dropped", session.runId(), record.id(), e.getCause());
            }
        }
        return claimed;
    }

    public boolean claimSingle(CandidateRecord record, ExtractionSession session) {
        boolean claimed = candidateRepository.forceClaim(
            record.id(),
            Instant.now(clock),
            properties.getQueue().getClaimOwner()
        );
        if (claimed) {
            session.claimed(record.id());
        }
        return claimed;
    }
}
