package io.pulse4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * Artifact persisted after a successful generation, before delivery is attempted.
 */
public record GeneratedContent(
        String scheduledJobId,
        String templateRef,
        String userContext,
        String content,
        Map<String, Object> metadata,
        Instant createdAt
) {
}
