package io.pulse4j.core;

import io.pulse4j.QueueJobHandler;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class QueueJobHandlerRegistry {

    private final Map<QueueJobType, QueueJobHandler<?>> handlersByType;

    public QueueJobHandlerRegistry(List<? extends QueueJobHandler<?>> handlers) {
        Map<QueueJobType, QueueJobHandler<?>> map = new EnumMap<>(QueueJobType.class);
        for (QueueJobHandler<?> handler : handlers) {
            QueueJobHandler<?> previous = map.putIfAbsent(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate QueueJobHandler for type: " + handler.type().value());
            }
        }
        this.handlersByType = Collections.unmodifiableMap(map);
    }

    public Optional<QueueJobHandler<?>> find(QueueJobType type) {
        return Optional.ofNullable(handlersByType.get(type));
    }

    public boolean supports(QueueJobType type) {
        return handlersByType.containsKey(type);
    }
}
