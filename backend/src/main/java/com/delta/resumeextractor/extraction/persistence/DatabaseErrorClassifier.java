package com.delta.resumeextractor.extraction.persistence;

import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.util.Locale;

public final class DatabaseErrorClassifier {
    public static final String DEADLOCK = "deadlock";
    public static final String LOCK_TIMEOUT = "lock_timeout";
    public static final String TIMEOUT = "timeout";
    public static final String TRANSIENT = "transient";
    public static final String FATAL = "fatal";

    private static final String SERIALIZATION_FAILURE = "40001";
    private static final String POSTGRES_DEADLOCK = "40P01";
    private static final String CONNECTION_FAILURE_CLASS = "08";

    private DatabaseErrorClassifier() {
    }

    public static boolean isRetryable(Throwable error) {
        return !FATAL.equals(classify(error));
    }

    public static String classify(Throwable error) {
        if (error == null) {
            return FATAL;
        }
        if (error instanceof PessimisticLockingFailureException) {
            return isDeadlock(error) ? DEADLOCK : LOCK_TIMEOUT;
        }
        if (error instanceof QueryTimeoutException) {
            return TIMEOUT;
        }
        if (error instanceof TransientDataAccessException || error instanceof RecoverableDataAccessException) {
            return TRANSIENT;
        }
        Throwable current = error;
        while (current != null) {
            if (current instanceof SQLException sql) {
                String state = sql.getSQLState();
                if (SERIALIZATION_FAILURE.equals(state) || POSTGRES_DEADLOCK.equals(state)) {
                    return DEADLOCK;
                }
                if (state != null && state.startsWith(CONNECTION_FAILURE_CLASS)) {
                    return TRANSIENT;
                }
                if (current instanceof SQLTransientException) {
                    return TRANSIENT;
                }
            }
            if (current instanceof SocketTimeoutException) {
                return TIMEOUT;
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("deadlock")) {
                    return DEADLOCK;
                }
                if (lower.contains("timeout") || lower.contains("timed out")) {
                    return TIMEOUT;
                }
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return FATAL;
    }

    private static boolean isDeadlock(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SQLException sql
                && (POSTGRES_DEADLOCK.equals(sql.getSQLState()) || SERIALIZATION_FAILURE.equals(sql.getSQLState()))) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("deadlock")) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
