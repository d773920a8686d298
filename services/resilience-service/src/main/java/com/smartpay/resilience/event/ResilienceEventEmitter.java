package com.smartpay.resilience.event;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Best-effort event emission. Adds the envelope fields every event carries
 * and logs, then drops, any failure raised by the underlying publisher.
 */
@Slf4j
public class ResilienceEventEmitter {

    private final ResilienceEventPublisher publisher;
    private final Clock clock;
    private final String source;

    public ResilienceEventEmitter(ResilienceEventPublisher publisher, Clock clock, String source) {
        this.publisher = publisher;
        this.clock = clock;
        this.source = source;
    }

    public void emit(String eventType, Map<String, Object> data) {
        if (publisher == null) {
            return;
        }
        Map<String, Object> payload = new HashMap<>(data);
        payload.put("event_id", UUID.randomUUID().toString());
        payload.put("event_type", eventType);
        payload.put("source", source);
        payload.put("timestamp", clock.instant().toString());
        try {
            publisher.publish(eventType, payload);
        } catch (RuntimeException e) {
            log.warn("Failed to publish resilience event: type={}, error={}", eventType, e.getMessage());
        }
    }
}
