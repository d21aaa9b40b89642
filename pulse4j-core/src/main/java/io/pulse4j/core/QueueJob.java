package io.pulse4j.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A one-shot unit of asynchronous work stored in the queue.
 *
 * <p>{@code type} keeps the raw stored discriminator so that rows written by a newer producer
 * (unknown types) can still be read and failed cleanly; use {@link #knownType()} to dispatch.
 */
public record QueueJob(

        // identity
        String id,
        String type,
        Map<String, Object> data,
        int priority,

        // state
        QueueJobStatus status,
        int attempts,
        int maxAttempts,
        String error,
        Map<String, Object> result,

        // timestamps
        Instant createdAt,
        Instant processedAt,
        Instant completedAt,
        Instant failedAt,
        Instant availableAt
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    public QueueJob {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(status, "status must not be null");
        data = copyOf(data);
        result = (result == null) ? null : copyOf(result);
    }

    public Optional<QueueJobType> knownType() {
        return QueueJobType.fromValue(type);
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return (source == null || source.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        return new Builder(id)
                .type(type)
                .data(data)
                .priority(priority)
                .status(status)
                .attempts(attempts)
                .maxAttempts(maxAttempts)
                .error(error)
                .result(result)
                .createdAt(createdAt)
                .processedAt(processedAt)
                .completedAt(completedAt)
                .failedAt(failedAt)
                .availableAt(availableAt);
    }

    public static final class Builder {
        private final String id;
        private String type;
        private Map<String, Object> data;
        private int priority;
        private QueueJobStatus status = QueueJobStatus.PENDING;
        private int attempts;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private String error;
        private Map<String, Object> result;
        private Instant createdAt;
        private Instant processedAt;
        private Instant completedAt;
        private Instant failedAt;
        private Instant availableAt;

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id must not be null");
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(QueueJobStatus status) {
            this.status = status;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder result(Map<String, Object> result) {
            this.result = result;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder processedAt(Instant processedAt) {
            this.processedAt = processedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder failedAt(Instant failedAt) {
            this.failedAt = failedAt;
            return this;
        }

        public Builder availableAt(Instant availableAt) {
            this.availableAt = availableAt;
            return this;
        }

        public QueueJob build() {
            return new QueueJob(id, type, data, priority, status, attempts, maxAttempts, error, result,
                    createdAt, processedAt, completedAt, failedAt, availableAt);
        }
    }
}
