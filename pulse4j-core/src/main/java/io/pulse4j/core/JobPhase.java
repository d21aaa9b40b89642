package io.pulse4j.core;

public enum JobPhase {
    STARTED,
    COMPLETED,
    FAILED
}
