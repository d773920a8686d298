package com.smartpay.resilience.event;

import java.util.Map;

/**
 * Outbound event capability. Implementations may throw; callers go through
 * {@link ResilienceEventEmitter}, which never lets a publish failure reach
 * the guarded operation.
 */
public interface ResilienceEventPublisher {

    void publish(String eventType, Map<String, Object> payload);
}
