package io.pulse4j.spi;

import io.pulse4j.core.GenerationResult;

import java.util.Map;

public interface ContentGenerator {

    /**
     * @throws io.pulse4j.exception.GenerationException on model/provider failure
     */
    GenerationResult generate(String templateRef, String userContext, Map<String, Object> variables);
}
