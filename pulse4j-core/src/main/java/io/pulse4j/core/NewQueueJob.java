package io.pulse4j.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Definition of a queue job to be created. The store assigns id, status and timestamps.
 *
 * <p>{@code maxAttempts == 0} means "not set": the configured {@code pulse.maxAttempts} applies.
 */
public record NewQueueJob(
        QueueJobType type,
        Map<String, Object> data,
        int priority,
        int maxAttempts
) {

    public NewQueueJob {
        Objects.requireNonNull(type, "type must not be null");
        data = (data == null) ? Map.of() : Map.copyOf(data);
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
    }

    public static final int UNSET_MAX_ATTEMPTS = 0;

    public boolean hasMaxAttempts() {
        return maxAttempts != UNSET_MAX_ATTEMPTS;
    }

    public NewQueueJob withMaxAttempts(int maxAttempts) {
        return new NewQueueJob(type, data, priority, maxAttempts);
    }

    public static Builder builder(QueueJobType type) {
        return new Builder(type);
    }

    public static final class Builder {
        private final QueueJobType type;
        private final Map<String, Object> data = new LinkedHashMap<>();
        private int priority = Priority.NORMAL.value();
        private int maxAttempts = UNSET_MAX_ATTEMPTS;

        private Builder(QueueJobType type) {
            this.type = Objects.requireNonNull(type, "type must not be null");
        }

        public Builder data(Map<String, Object> data) {
            this.data.clear();
            if (data != null) {
                this.data.putAll(data);
            }
            return this;
        }

        /**
         * Add a single payload field. Null values are skipped.
         */
        public Builder put(String key, Object value) {
            Objects.requireNonNull(key, "key must not be null");
            if (key.isBlank()) {
                throw new IllegalArgumentException("key must not be blank");
            }
            if (value != null) {
                this.data.put(key, value);
            }
            return this;
        }

        public Builder priority(Priority priority) {
            Objects.requireNonNull(priority, "priority must not be null");
            this.priority = priority.value();
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public NewQueueJob build() {
            return new NewQueueJob(type, data, priority, maxAttempts);
        }
    }
}
