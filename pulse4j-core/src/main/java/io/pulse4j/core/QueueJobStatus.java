package io.pulse4j.core;

/**
 * Queue job state machine: {@code pending -> processing -> {completed | pending | failed}}.
 */
public enum QueueJobStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    QueueJobStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static QueueJobStatus fromValue(String value) {
        for (QueueJobStatus s : values()) {
            if (s.value.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown queue job status: " + value);
    }
}
