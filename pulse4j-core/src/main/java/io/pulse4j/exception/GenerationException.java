package io.pulse4j.exception;

/**
 * Content generation failed or timed out. Terminal for the current run only.
 */
public class GenerationException extends PulseException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
