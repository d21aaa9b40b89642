package io.pulse4j.core;

import io.pulse4j.QueueJobHandler;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueJobHandlerRegistryTest {

    @Test
    void shouldResolveHandlerByType() {
        NoopHandler cleanup = new NoopHandler(QueueJobType.CLEANUP);
        QueueJobHandlerRegistry registry = new QueueJobHandlerRegistry(List.of(cleanup));

        assertSame(cleanup, registry.find(QueueJobType.CLEANUP).orElseThrow());
        assertTrue(registry.supports(QueueJobType.CLEANUP));
        assertFalse(registry.supports(QueueJobType.EMAIL));
        assertTrue(registry.find(QueueJobType.EMAIL).isEmpty());
    }

    @Test
    void duplicateHandlersShouldBeRejected() {
        assertThrows(IllegalStateException.class, () -> new QueueJobHandlerRegistry(List.of(
                new NoopHandler(QueueJobType.EMAIL),
                new NoopHandler(QueueJobType.EMAIL))));
    }

    @Test
    void storedTypeValuesShouldMapBackToEnum() {
        assertSame(QueueJobType.CAMPAIGN, QueueJobType.fromValue("campaign").orElseThrow());
        assertTrue(QueueJobType.fromValue("sms").isEmpty());
        assertTrue(QueueJobType.fromValue(null).isEmpty());
        assertSame(QueueJobStatus.PROCESSING, QueueJobStatus.fromValue("processing"));
        assertSame(RunStatus.ERROR, RunStatus.fromValue("error"));
    }

    private record NoopHandler(QueueJobType type) implements QueueJobHandler<Map<String, Object>> {
        @Override
        @SuppressWarnings("unchecked")
        public Class<Map<String, Object>> payloadClass() {
            return (Class<Map<String, Object>>) (Class<?>) Map.class;
        }

        @Override
        public void execute(QueueJob job, Map<String, Object> payload) {
            // nothing to do
        }
    }
}
