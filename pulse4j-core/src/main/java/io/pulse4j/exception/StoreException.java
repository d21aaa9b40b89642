package io.pulse4j.exception;

/**
 * Transient persistence failure. Callers retry on their next natural cycle.
 */
public class StoreException extends PulseException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
