package com.delta.resumeextractor.extraction.persistence;

import com.delta.resumeextractor.extraction.model.BatchJob;
import com.delta.resumeextractor.extraction.model.BatchJobStatus;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class BatchJobRepository {
    public static final String OUTCOME_SUCCEEDED = "SUCCEEDED";
    public static final String OUTCOME_FAILED = "FAILED";

    private static final int MAX_MESSAGE_LENGTH = 500;

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;

    public BatchJobRepository(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Stores the job row and its member rows together; either all are written or none.
     */
    public void insertJob(String externalId, String runId, List<Long> memberIds, Instant submittedAt) {
        transactionTemplate.executeWithoutResult(status -> insertJobRows(externalId, runId, memberIds, submittedAt));
    }

    private void insertJobRows(String externalId, String runId, List<Long> memberIds, Instant submittedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("externalId", externalId)
            .addValue("runId", runId)
            .addValue("status", BatchJobStatus.QUEUED.apiValue())
            .addValue("memberCount", memberIds.size())
            .addValue("submittedAt", Timestamp.from(submittedAt));
        jdbc.update(
            """
                INSERT INTO extraction_batches (
                    external_id, run_id, status, member_count, submitted_at, success_count, failure_count
                )
                VALUES (:externalId, :runId, :status, :memberCount, :submittedAt, 0, 0)
                """,
            params
        );
        SqlParameterSource[] members = memberIds.stream()
            .map(id -> new MapSqlParameterSource()
                .addValue("externalId", externalId)
                .addValue("candidateId", id))
            .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(
            """
                INSERT INTO extraction_batch_members (external_id, candidate_id)
                VALUES (:externalId, :candidateId)
                """,
            members
        );
    }

    public Optional<BatchJob> findById(String externalId) {
        List<BatchJob> jobs = loadJobs(
            """
                SELECT external_id, status, submitted_at, last_polled_at, output_file_id, error_file_id,
                       results_processed_at, success_count, failure_count
                FROM extraction_batches
                WHERE external_id = :externalId
                """,
            new MapSqlParameterSource().addValue("externalId", externalId)
        );
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    /**
     * Jobs whose results have not been processed yet, whatever their last known status.
     */
    public List<BatchJob> findInFlight() {
        return loadJobs(
            """
                SELECT external_id, status, submitted_at, last_polled_at, output_file_id, error_file_id,
                       results_processed_at, success_count, failure_count
                FROM extraction_batches
                WHERE results_processed_at IS NULL
                ORDER BY submitted_at ASC
                """,
            new MapSqlParameterSource()
        );
    }

    public List<BatchJob> findRecent(int limit) {
        return loadJobs(
            """
                SELECT external_id, status, submitted_at, last_polled_at, output_file_id, error_file_id,
                       results_processed_at, success_count, failure_count
                FROM extraction_batches
                ORDER BY submitted_at DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit))
        );
    }

    public void updateStatus(String externalId, BatchJobStatus status, String outputFileId, String errorFileId, Instant polledAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("externalId", externalId)
            .addValue("status", status.apiValue())
            .addValue("outputFileId", outputFileId)
            .addValue("errorFileId", errorFileId)
            .addValue("polledAt", Timestamp.from(polledAt));
        jdbc.update(
            """
                UPDATE extraction_batches
                SET status = :status,
                    output_file_id = COALESCE(:outputFileId, output_file_id),
                    error_file_id = COALESCE(:errorFileId, error_file_id),
                    last_polled_at = :polledAt
                WHERE external_id = :externalId
                """,
            params
        );
    }

    /**
     * Takes the one-time right to process a job's results. Only the first caller sees true.
     */
    public boolean claimResultProcessing(String externalId, Instant now) {
        int updated = jdbc.update(
            """
                UPDATE extraction_batches
                SET results_processed_at = :now
                WHERE external_id = :externalId
                  AND results_processed_at IS NULL
                """,
            new MapSqlParameterSource()
                .addValue("externalId", externalId)
                .addValue("now", Timestamp.from(now))
        );
        return updated == 1;
    }

    public void recordMemberOutcome(String externalId, long candidateId, String outcome, String message) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("externalId", externalId)
            .addValue("candidateId", candidateId)
            .addValue("outcome", outcome)
            .addValue("message", truncate(message));
        jdbc.update(
            """
                UPDATE extraction_batch_members
                SET outcome = :outcome,
                    message = :message
                WHERE external_id = :externalId
                  AND candidate_id = :candidateId
                """,
            params
        );
    }

    public void recordCounts(String externalId, int successCount, int failureCount) {
        jdbc.update(
            """
                UPDATE extraction_batches
                SET success_count = :successCount,
                    failure_count = :failureCount
                WHERE external_id = :externalId
                """,
            new MapSqlParameterSource()
                .addValue("externalId", externalId)
                .addValue("successCount", successCount)
                .addValue("failureCount", failureCount)
        );
    }

    private List<BatchJob> loadJobs(String sql, MapSqlParameterSource params) {
        Map<String, JobRow> rows = new LinkedHashMap<>();
        jdbc.query(sql, params, rs -> {
            JobRow row = mapRow(rs);
            rows.put(row.externalId(), row);
        });
        if (rows.isEmpty()) {
            return List.of();
        }
        Map<String, List<Long>> members = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT external_id, candidate_id
                FROM extraction_batch_members
                WHERE external_id IN (:ids)
                ORDER BY candidate_id
                """,
            new MapSqlParameterSource().addValue("ids", List.copyOf(rows.keySet())),
            rs -> {
                members.computeIfAbsent(rs.getString("external_id"), ignored -> new ArrayList<>())
                    .add(rs.getLong("candidate_id"));
            }
        );
        List<BatchJob> jobs = new ArrayList<>(rows.size());
        for (JobRow row : rows.values()) {
            jobs.add(new BatchJob(
                row.externalId(),
                row.status(),
                members.getOrDefault(row.externalId(), List.of()),
                row.submittedAt(),
                row.lastPolledAt(),
                row.outputFileId(),
                row.errorFileId(),
                row.resultsProcessedAt(),
                row.successCount(),
                row.failureCount()
            ));
        }
        return jobs;
    }

    private JobRow mapRow(ResultSet rs) throws SQLException {
        return new JobRow(
            rs.getString("external_id"),
            BatchJobStatus.fromApiValue(rs.getString("status")),
            toInstant(rs.getTimestamp("submitted_at")),
            toInstant(rs.getTimestamp("last_polled_at")),
            rs.getString("output_file_id"),
            rs.getString("error_file_id"),
            toInstant(rs.getTimestamp("results_processed_at")),
            rs.getInt("success_count"),
            rs.getInt("failure_count")
        );
    }

    private String truncate(String message) {
        if (message == null || message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private record JobRow(
        String externalId,
        BatchJobStatus status,
        Instant submittedAt,
        Instant lastPolledAt,
        String outputFileId,
        String errorFileId,
        Instant resultsProcessedAt,
        int successCount,
        int failureCount
    ) {
    }
}
