package io.pulse4j.exception;

/**
 * Base type for failures raised by the orchestrator and its collaborators.
 */
public class PulseException extends RuntimeException {

    public PulseException(String message) {
        super(message);
    }

    public PulseException(String message, Throwable cause) {
        super(message, cause);
    }
}
