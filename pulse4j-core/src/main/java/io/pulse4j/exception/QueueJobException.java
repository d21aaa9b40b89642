package io.pulse4j.exception;

/**
 * Failure of a queue job handler.
 *
 * <p>Non-retryable failures (unknown type, unreadable payload) fail the job on the first attempt.
 */
public class QueueJobException extends PulseException {

    private final boolean retryable;

    public QueueJobException(String message) {
        this(message, null, true);
    }

    public QueueJobException(String message, Throwable cause) {
        this(message, cause, true);
    }

    public QueueJobException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static QueueJobException permanent(String message, Throwable cause) {
        return new QueueJobException(message, cause, false);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
