package io.pulse4j.core;

import java.util.Map;

/**
 * Output of one content generation call.
 */
public record GenerationResult(String content, Map<String, Object> metadata) {

    public GenerationResult {
        metadata = (metadata == null) ? Map.of() : metadata;
    }
}
