package io.pulse4j.exception;

/**
 * Malformed cron expression or unresolvable time zone. The job stays unarmed.
 */
public class SchedulingException extends PulseException {

    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
