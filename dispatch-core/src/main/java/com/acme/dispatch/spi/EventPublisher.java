package com.acme.dispatch.spi;

import java.util.Map;

/**
 * Publishes domain events. Implementations wait for the underlying transport to accept the event
 * but never throw: a failed publish is logged and the caller carries on.
 */
public interface EventPublisher {
    void publish(String eventType, Map<String, Object> data, String correlationId);
}
