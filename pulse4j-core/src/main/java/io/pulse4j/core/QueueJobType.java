package io.pulse4j.core;

import java.util.Optional;

/**
 * Known kinds of queued work. The stored discriminator is {@link #value()}.
 */
public enum QueueJobType {
    EMAIL("email"),
    CAMPAIGN("campaign"),
    CLEANUP("cleanup");

    private final String value;

    QueueJobType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<QueueJobType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (QueueJobType t : values()) {
            if (t.value.equals(value)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
