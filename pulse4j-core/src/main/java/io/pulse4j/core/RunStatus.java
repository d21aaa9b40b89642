package io.pulse4j.core;

/**
 * Outcome of the most recent run of a {@link ScheduledJob}.
 */
public enum RunStatus {
    RUNNING("running"),
    SUCCESS("success"),
    ERROR("error");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RunStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (RunStatus s : values()) {
            if (s.value.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + value);
    }
}
