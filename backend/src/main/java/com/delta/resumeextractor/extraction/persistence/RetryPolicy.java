package com.delta.resumeextractor.extraction.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retries an operation on errors the predicate accepts, doubling the delay each attempt up to a
 * cap. Never throws; the caller inspects the returned {@link Attempt}.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    public record Attempt<T>(T value, RuntimeException error, int attempts) {
        public boolean succeeded() {
            return error == null;
        }
    }

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final Predicate<Throwable> retryable;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, Predicate<Throwable> retryable) {
        this(maxAttempts, baseDelayMs, maxDelayMs, retryable, Thread::sleep);
    }

    public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, Predicate<Throwable> retryable, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.retryable = retryable;
        this.sleeper = sleeper;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public long delayForAttempt(int attempt) {
        if (baseDelayMs == 0) {
            return 0;
        }
        int shift = Math.min(30, Math.max(0, attempt - 1));
        long delay = baseDelayMs * (1L << shift);
        return Math.min(delay, maxDelayMs);
    }

    public <T> Attempt<T> run(String operation, Supplier<T> action) {
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return new Attempt<>(action.get(), null, attempt);
            } catch (RuntimeException e) {
                lastError = e;
                if (!retryable.test(e)) {
                    log.warn("{} failed with non-retryable error: {}", operation, e.getMessage());
                    return new Attempt<>(null, e, attempt);
                }
                if (attempt >= maxAttempts) {
                    break;
                }
                long delay = delayForAttempt(attempt);
                log.warn("{} attempt {}/{} failed ({}); retrying in {} ms", operation, attempt, maxAttempts, e.getMessage(), delay);
                if (!pause(delay)) {
                    return new Attempt<>(null, e, attempt);
                }
            }
        }
        log.warn("{} failed after {} attempts: {}", operation, maxAttempts, lastError == null ? null : lastError.getMessage());
        return new Attempt<>(null, lastError, maxAttempts);
    }

    private boolean pause(long delay) {
        if (delay <= 0) {
            return true;
        }
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
