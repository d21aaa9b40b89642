package io.pulse4j.core;

/**
 * Named priority levels for queue jobs. Higher values are claimed first.
 */
public enum Priority {

    HIGHEST(20),
    HIGH(10),
    NORMAL(0),
    LOW(-10),
    LOWEST(-20);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
