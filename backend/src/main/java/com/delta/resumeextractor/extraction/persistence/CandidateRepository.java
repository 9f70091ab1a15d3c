package com.delta.resumeextractor.extraction.persistence;

import com.delta.resumeextractor.config.ExtractorProperties;
import com.delta.resumeextractor.extraction.model.CandidateField;
import com.delta.resumeextractor.extraction.model.CandidateRecord;
import com.delta.resumeextractor.extraction.model.ParsedFieldSet;
import com.delta.resumeextractor.extraction.model.QueueStats;
import com.delta.resumeextractor.extraction.model.WriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class CandidateRepository {
    private static final Logger log = LoggerFactory.getLogger(CandidateRepository.class);

    private static final RowMapper<CandidateRecord> RECORD_MAPPER = (rs, rowNum) -> new CandidateRecord(
        rs.getLong("id"),
        rs.getString("raw_text"),
        toInstant(rs.getTimestamp("text_ready_at")),
        toInstant(rs.getTimestamp("claimed_at")),
        rs.getString("claim_owner"),
        toInstant(rs.getTimestamp("processed_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;
    private final RetryPolicy writeRetryPolicy;

    public CandidateRepository(NamedParameterJdbcTemplate jdbc, ExtractorProperties properties, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
        ExtractorProperties.Persistence persistence = properties.getPersistence();
        this.writeRetryPolicy = new RetryPolicy(
            persistence.getMaxAttempts(),
            persistence.getBaseDelayMs(),
            persistence.getMaxDelayMs(),
            error -> error instanceof DuplicateKeyException || DatabaseErrorClassifier.isRetryable(error)
        );
    }

    /**
     * Unclaimed, unprocessed records whose text became ready inside the window, newest first.
     * This is a plain read: rows may already be claimed by the time the caller acts on them.
     */
    public List<CandidateRecord> findClaimable(Instant since, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("since", Timestamp.from(since))
            .addValue("limit", Math.max(1, limit));
        try {
            return jdbc.query(
                """
                    SELECT id, raw_text, text_ready_at, claimed_at, claim_owner, processed_at
                    FROM candidates
                    WHERE claimed_at IS NULL
                      AND processed_at IS NULL
                      AND raw_text IS NOT NULL
                      AND LENGTH(raw_text) > 0
                      AND text_ready_at >= :since
                    ORDER BY text_ready_at DESC, id DESC
                    LIMIT :limit
                    """,
                params,
                RECORD_MAPPER
            );
        } catch (DataAccessException e) {
            log.warn("Claimable selection failed ({}); returning no work", DatabaseErrorClassifier.classify(e), e);
            return List.of();
        }
    }

    public Optional<CandidateRecord> findById(long id) {
        List<CandidateRecord> rows = jdbc.query(
            """
                SELECT id, raw_text, text_ready_at, claimed_at, claim_owner, processed_at
                FROM candidates
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", id),
            RECORD_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Claim-only write. Succeeds for exactly one caller per record: the update is conditional on
     * the record still being unclaimed and unprocessed.
     */
    public boolean markClaimed(long id, Instant claimedAt, String owner) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("claimedAt", Timestamp.from(claimedAt))
            .addValue("owner", owner);
        int updated = jdbc.update(
            """
                UPDATE candidates
                SET claimed_at = :claimedAt,
                    claim_owner = :owner
                WHERE id = :id
                  AND claimed_at IS NULL
                  AND processed_at IS NULL
                """,
            params
        );
        return updated == 1;
    }

    /**
     * Claims a record regardless of earlier claims or processing, for explicit single-record runs.
     */
    public boolean forceClaim(long id, Instant claimedAt, String owner) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("claimedAt", Timestamp.from(claimedAt))
            .addValue("owner", owner);
        int updated = jdbc.update(
            """
                UPDATE candidates
                SET claimed_at = :claimedAt,
                    claim_owner = :owner
                WHERE id = :id
                """,
            params
        );
        return updated == 1;
    }

    public int releaseClaims(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        return jdbc.update(
            """
                UPDATE candidates
                SET claimed_at = NULL,
                    claim_owner = NULL
                WHERE id IN (:ids)
                  AND processed_at IS NULL
                """,
            new MapSqlParameterSource().addValue("ids", List.copyOf(ids))
        );
    }

    public QueueStats fetchQueueStats(Instant since) {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("since", Timestamp.from(since));
        Long claimable = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM candidates
                WHERE claimed_at IS NULL
                  AND processed_at IS NULL
                  AND raw_text IS NOT NULL
                  AND LENGTH(raw_text) > 0
                  AND text_ready_at >= :since
                """,
            params,
            Long.class
        );
        Long claimedUnprocessed = jdbc.queryForObject(
            "SELECT COUNT(*) FROM candidates WHERE claimed_at IS NOT NULL AND processed_at IS NULL",
            params,
            Long.class
        );
        Long processed = jdbc.queryForObject(
            "SELECT COUNT(*) FROM candidates WHERE processed_at IS NOT NULL",
            params,
            Long.class
        );
        return new QueueStats(
            claimable == null ? 0 : claimable,
            claimedUnprocessed == null ? 0 : claimedUnprocessed,
            processed == null ? 0 : processed
        );
    }

    /**
     * Writes a record's fields as one statement. Existing rows keep their stored value for every
     * unknown field; new rows get NULL. {@code processed_at} is always set. Deadlocks and timeouts
     * are retried with backoff; nothing is thrown to the caller.
     */
    public WriteResult upsertFields(long id, Map<CandidateField, String> fields) {
        Instant processedAt = Instant.now(clock);
        RetryPolicy.Attempt<String> attempt = writeRetryPolicy.run(
            "upsert candidate " + id,
            () -> writeOnce(id, fields, processedAt)
        );
        if (attempt.succeeded()) {
            return WriteResult.ok(attempt.value(), attempt.attempts());
        }
        RuntimeException error = attempt.error();
        String reason = DatabaseErrorClassifier.classify(error);
        return WriteResult.failed(
            "write failed (" + reason + ") after " + attempt.attempts() + " attempt(s): " + error.getMessage(),
            attempt.attempts()
        );
    }

    private String writeOnce(long id, Map<CandidateField, String> fields, Instant processedAt) {
        Integer existing = jdbc.queryForObject(
            "SELECT COUNT(*) FROM candidates WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            Integer.class
        );
        return existing != null && existing > 0
            ? update(id, fields, processedAt)
            : insert(id, fields, processedAt);
    }

    private String update(long id, Map<CandidateField, String> fields, Instant processedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("processedAt", Timestamp.from(processedAt));
        List<String> assignments = new ArrayList<>();
        for (CandidateField field : CandidateField.persisted()) {
            Object value = columnValue(id, field, fields.get(field));
            if (value == null) {
                continue;
            }
            assignments.add(field.column() + " = :" + field.column());
            params.addValue(field.column(), value);
        }
        assignments.add("processed_at = :processedAt");
        String sql = "UPDATE candidates SET " + String.join(", ", assignments) + " WHERE id = :id";
        jdbc.update(sql, params);
        return "updated " + (assignments.size() - 1) + " field(s)";
    }

    private String insert(long id, Map<CandidateField, String> fields, Instant processedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("processedAt", Timestamp.from(processedAt));
        List<String> columns = new ArrayList<>(List.of("id", "processed_at"));
        List<String> values = new ArrayList<>(List.of(":id", ":processedAt"));
        int written = 0;
        for (CandidateField field : CandidateField.persisted()) {
            Object value = columnValue(id, field, fields.get(field));
            columns.add(field.column());
            values.add(":" + field.column());
            params.addValue(field.column(), value, field.isDate() ? Types.DATE : Types.VARCHAR);
            if (value != null) {
                written++;
            }
        }
        String sql = "INSERT INTO candidates (" + String.join(", ", columns) + ") VALUES ("
            + String.join(", ", values) + ")";
        jdbc.update(sql, params);
        return "inserted " + written + " field(s)";
    }

    private Object columnValue(long id, CandidateField field, String value) {
        String normalized = ParsedFieldSet.normalize(value);
        if (normalized == null) {
            return null;
        }
        if (!field.isDate()) {
            return normalized;
        }
        try {
            return Date.valueOf(LocalDate.parse(normalized));
        } catch (DateTimeParseException e) {
            log.warn("Record {} {}: '{}' is not an ISO date; not written", id, field.label(), normalized);
            return null;
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
