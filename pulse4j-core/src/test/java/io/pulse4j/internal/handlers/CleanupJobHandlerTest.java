package io.pulse4j.internal.handlers;

import io.pulse4j.core.QueueJob;
import io.pulse4j.core.QueueJobStatus;
import io.pulse4j.internal.handlers.CleanupJobHandler.CleanupPayload;
import io.pulse4j.spi.JobStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class CleanupJobHandlerTest {

    private static final Instant NOW = Instant.parse("2024-06-30T00:00:00Z");

    private final JobStore store = mock(JobStore.class);
    private final CleanupJobHandler handler = new CleanupJobHandler(store, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void shouldDeleteJobsOlderThanRequestedDays() {
        handler.execute(job(), new CleanupPayload(7));
        verify(store).deleteQueueJobsFinishedBefore(Instant.parse("2024-06-23T00:00:00Z"));
    }

    @Test
    void missingOrNegativeRetentionShouldUseDefault() {
        handler.execute(job(), new CleanupPayload(null));
        handler.execute(job(), new CleanupPayload(-1));
        verify(store, times(2)).deleteQueueJobsFinishedBefore(Instant.parse("2024-05-31T00:00:00Z"));
    }

    private static QueueJob job() {
        return QueueJob.builder("q-x").type("cleanup").status(QueueJobStatus.PROCESSING).build();
    }
}
