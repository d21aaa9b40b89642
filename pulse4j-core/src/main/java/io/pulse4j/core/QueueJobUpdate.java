package io.pulse4j.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Typed patch applied to a claimed queue job when its execution finishes.
 *
 * <ul>
 *   <li>{@link #completed}: status=completed, completedAt and optional result set</li>
 *   <li>{@link #retry}: status=pending, error recorded, failedAt cleared, next claim not before availableAt</li>
 *   <li>{@link #failed}: status=failed, error and failedAt recorded</li>
 * </ul>
 */
public record QueueJobUpdate(
        QueueJobStatus status,
        String error,
        Map<String, Object> result,
        Instant completedAt,
        Instant failedAt,
        Instant availableAt
) {

    public QueueJobUpdate {
        Objects.requireNonNull(status, "status must not be null");
    }

    public static QueueJobUpdate completed(Instant completedAt, Map<String, Object> result) {
        Objects.requireNonNull(completedAt, "completedAt must not be null");
        return new QueueJobUpdate(QueueJobStatus.COMPLETED, null, result, completedAt, null, null);
    }

    public static QueueJobUpdate retry(String error, Instant availableAt) {
        return new QueueJobUpdate(QueueJobStatus.PENDING, error, null, null, null, availableAt);
    }

    public static QueueJobUpdate failed(String error, Instant failedAt) {
        Objects.requireNonNull(failedAt, "failedAt must not be null");
        return new QueueJobUpdate(QueueJobStatus.FAILED, error, null, null, failedAt, null);
    }
}
