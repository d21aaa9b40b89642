package io.pulse4j.internal;

import io.pulse4j.core.QueueJob;
import io.pulse4j.core.QueueJobUpdate;
import io.pulse4j.exception.QueueJobException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides what happens to a queue job whose execution failed.
 *
 * <ul>
 *   <li>{@code attempts < maxAttempts}: back to pending, error recorded, not claimable before
 *       {@code now + spacing * attempts}</li>
 *   <li>otherwise, or for a non-retryable failure: failed permanently with {@code failedAt}</li>
 * </ul>
 *
 * <p>{@code attempts} already includes the attempt that just failed (the claim increments it).
 */
public class RetryPolicy {

    private final int defaultMaxAttempts;
    private final Duration spacing;

    public RetryPolicy(int defaultMaxAttempts, Duration spacing) {
        if (defaultMaxAttempts <= 0) {
            throw new IllegalArgumentException("defaultMaxAttempts must be a positive number");
        }
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.spacing = Objects.requireNonNull(spacing, "spacing must not be null");
    }

    public QueueJobUpdate onFailure(QueueJob job, Throwable error, Instant now) {
        String message = CallGuard.describe(error);
        if (shouldRetry(job, error)) {
            return QueueJobUpdate.retry(message, now.plus(backoff(job.attempts())));
        }
        return QueueJobUpdate.failed(message, now);
    }

    public boolean shouldRetry(QueueJob job, Throwable error) {
        if (error instanceof QueueJobException qe && !qe.isRetryable()) {
            return false;
        }
        return job.attempts() < maxAttempts(job);
    }

    public int defaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    public int maxAttempts(QueueJob job) {
        return job.maxAttempts() > 0 ? job.maxAttempts() : defaultMaxAttempts;
    }

    /**
     * Minimum spacing before the next claim, linear in the attempts already made.
     */
    public Duration backoff(int attempts) {
        return spacing.multipliedBy(Math.max(1, attempts));
    }
}
