package io.pulse4j.internal;

import io.pulse4j.core.QueueJob;
import io.pulse4j.core.QueueJobStatus;
import io.pulse4j.core.QueueJobUpdate;
import io.pulse4j.exception.QueueJobException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(5));

    @Test
    void failureBelowBoundShouldGoBackToPendingWithBackoff() {
        QueueJobUpdate update = policy.onFailure(claimed(2, 3), new IllegalStateException("smtp down"), NOW);

        assertEquals(QueueJobStatus.PENDING, update.status());
        assertEquals("smtp down", update.error());
        assertEquals(NOW.plusSeconds(10), update.availableAt());
        assertNull(update.failedAt());
    }

    @Test
    void failureAtBoundShouldFailPermanently() {
        QueueJobUpdate update = policy.onFailure(claimed(3, 3), new IllegalStateException("smtp down"), NOW);

        assertEquals(QueueJobStatus.FAILED, update.status());
        assertEquals("smtp down", update.error());
        assertEquals(NOW, update.failedAt());
    }

    @Test
    void nonRetryableFailureShouldFailOnFirstAttempt() {
        QueueJobException permanent = QueueJobException.permanent("Unknown job type: sms", null);

        assertFalse(policy.shouldRetry(claimed(1, 3), permanent));
        assertEquals(QueueJobStatus.FAILED, policy.onFailure(claimed(1, 3), permanent, NOW).status());
    }

    @Test
    void missingMaxAttemptsShouldUseDefault() {
        assertEquals(3, policy.maxAttempts(claimed(1, 0)));
        assertTrue(policy.shouldRetry(claimed(2, 0), new RuntimeException()));
        assertFalse(policy.shouldRetry(claimed(3, 0), new RuntimeException()));
    }

    @Test
    void backoffShouldGrowLinearly() {
        assertEquals(Duration.ofSeconds(5), policy.backoff(0));
        assertEquals(Duration.ofSeconds(5), policy.backoff(1));
        assertEquals(Duration.ofSeconds(15), policy.backoff(3));
    }

    @Test
    void errorWithoutMessageShouldUseExceptionName() {
        QueueJobUpdate update = policy.onFailure(claimed(1, 3), new NullPointerException(), NOW);
        assertEquals("NullPointerException", update.error());
    }

    @Test
    void constructorShouldRejectInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ofSeconds(1)));
        assertThrows(NullPointerException.class, () -> new RetryPolicy(3, null));
    }

    private static QueueJob claimed(int attempts, int maxAttempts) {
        return QueueJob.builder("q-1")
                .type("email")
                .status(QueueJobStatus.PROCESSING)
                .attempts(attempts)
                .maxAttempts(maxAttempts)
                .createdAt(NOW.minusSeconds(60))
                .build();
    }
}
