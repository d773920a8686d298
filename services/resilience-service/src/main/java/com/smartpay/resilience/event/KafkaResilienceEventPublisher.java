package com.smartpay.resilience.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Publishes resilience events as JSON to a Kafka topic. The record key is the
 * breaker or operation name so events for one guarded operation stay ordered
 * within a partition.
 *
 * <p>Sends run on {@code sendExecutor}, so a producer waiting for broker
 * metadata never holds up the thread that raised the event. Events the
 * executor cannot accept are dropped with a warning.
 */
@Slf4j
@RequiredArgsConstructor
public class KafkaResilienceEventPublisher implements ResilienceEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;
    private final Executor sendExecutor;

    @Override
    public void publish(String eventType, Map<String, Object> payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize event " + eventType, e);
        }

        String key = resolveKey(payload);
        try {
            sendExecutor.execute(() -> send(eventType, key, json));
        } catch (RejectedExecutionException e) {
            log.warn("Dropping event, send queue is full: topic={}, type={}, key={}", topic, eventType, key);
        }
    }

    private void send(String eventType, String key, String json) {
        try {
            kafkaTemplate.send(topic, key, json)
                .whenComplete((result, failure) -> {
                    if (failure != null) {
                        log.warn("Kafka delivery failed: topic={}, type={}, key={}, error={}",
                            topic, eventType, key, failure.getMessage());
                    } else {
                        log.debug("Published event: topic={}, type={}, key={}", topic, eventType, key);
                    }
                });
        } catch (RuntimeException e) {
            log.warn("Kafka send failed: topic={}, type={}, key={}, error={}", topic, eventType, key, e.getMessage());
        }
    }

    private String resolveKey(Map<String, Object> payload) {
        Object key = payload.get("circuit_breaker");
        if (key == null) {
            key = payload.get("operation");
        }
        return key != null ? key.toString() : null;
    }
}
