package com.smartpay.resilience.circuitbreaker;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Registration settings for a named circuit breaker
 */
@Data
@Builder(toBuilder = true)
public class CircuitBreakerConfig {

    private String name;

    @Builder.Default
    private int failureThreshold = 5;

    @Builder.Default
    private int successThreshold = 3;

    /**
     * Time spent Open before a half-open probe is allowed
     */
    @Builder.Default
    private Duration timeout = Duration.ofMinutes(1);

    /**
     * Concurrent calls admitted while Closed; zero or less means unbounded
     */
    @Builder.Default
    private int maxConcurrentCalls = 100;

    /**
     * Minimum calls since the breaker last closed before the error rate rule applies
     */
    @Builder.Default
    private int volumeThreshold = 0;

    /**
     * Failure percentage that opens the breaker once the volume threshold is reached
     */
    @Builder.Default
    private double errorRateThreshold = 0;

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Circuit breaker name is required");
        }
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be positive: " + successThreshold);
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        if (errorRateThreshold > 100) {
            throw new IllegalArgumentException("errorRateThreshold is a percentage: " + errorRateThreshold);
        }
    }
}
