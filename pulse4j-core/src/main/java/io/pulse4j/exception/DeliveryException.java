package io.pulse4j.exception;

/**
 * Delivery of generated content failed or timed out. Never downgrades a run to error.
 */
public class DeliveryException extends PulseException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
