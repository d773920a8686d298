package com.smartpay.resilience.event;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Publisher used when no message broker is configured.
 */
@Slf4j
public class LoggingResilienceEventPublisher implements ResilienceEventPublisher {

    @Override
    public void publish(String eventType, Map<String, Object> payload) {
        log.info("Resilience event: type={}, payload={}", eventType, payload);
    }
}
