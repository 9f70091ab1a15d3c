package com.delta.resumeextractor.extraction.persistence;

import com.delta.resumeextractor.config.ExtractorProperties;
import com.delta.resumeextractor.extraction.model.CandidateField;
import com.delta.resumeextractor.extraction.model.WriteResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DeadlockLoserDataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CandidateRepositoryRetryTest {
    private NamedParameterJdbcTemplate jdbc;
    private CandidateRepository repository;

    @BeforeEach
    void setUp() {
        jdbc = mock(NamedParameterJdbcTemplate.class);
        ExtractorProperties properties = new ExtractorProperties();
        properties.getPersistence().setMaxAttempts(3);
        properties.getPersistence().setBaseDelayMs(0);
        properties.getPersistence().setMaxDelayMs(0);
        Clock clock = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);
        repository = new CandidateRepository(jdbc, properties, clock);
        when(jdbc.queryForObject(anyString(), any(SqlParameterSource.class), eq(Integer.class))).thenReturn(1);
    }

    @Test
    void deadlockIsRetriedAndThenSucceeds() {
        when(jdbc.update(anyString(), any(SqlParameterSource.class)))
            .thenThrow(new DeadlockLoserDataAccessException("deadlock detected", new SQLException("deadlock", "40P01")))
            .thenReturn(1);

        WriteResult result = repository.upsertFields(7L, Map.of(CandidateField.FIRST_NAME, "Jane"));

        assertThat(result.success()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.message()).isEqualTo("updated 1 field(s)");
        verify(jdbc, times(2)).update(anyString(), any(SqlParameterSource.class));
    }

    @Test
    void grammarErrorIsNotRetried() {
        when(jdbc.update(anyString(), any(SqlParameterSource.class)))
            .thenThrow(new BadSqlGrammarException("upsert", "UPDATE candidates", new SQLException("no such column")));

        WriteResult result = repository.upsertFields(7L, Map.of(CandidateField.FIRST_NAME, "Jane"));

        assertThat(result.success()).isFalse();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.message()).startsWith("write failed (fatal) after 1 attempt(s)");
        verify(jdbc, times(1)).update(anyString(), any(SqlParameterSource.class));
    }

    @Test
    void exhaustedRetriesReturnFailureInsteadOfThrowing() {
        when(jdbc.update(anyString(), any(SqlParameterSource.class)))
            .thenThrow(new DeadlockLoserDataAccessException("deadlock detected", new SQLException("deadlock", "40P01")));

        WriteResult result = repository.upsertFields(7L, Map.of(CandidateField.CITY, "Denver"));

        assertThat(result.success()).isFalse();
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.message()).contains("deadlock");
    }
}
