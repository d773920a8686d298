package com.smartpay.resilience.retry;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Named, immutable retry policy with exponential backoff.
 */
@Value
@Builder(toBuilder = true)
public class RetryStrategy {

    public static final String DEFAULT = "default";
    public static final String AGGRESSIVE = "aggressive";
    public static final String CONSERVATIVE = "conservative";

    String name;

    /**
     * Retries after the first attempt, so an operation runs at most {@code maxRetries + 1} times
     */
    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    Duration initialDelay = Duration.ofSeconds(1);

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(30);

    @Builder.Default
    double backoffFactor = 2.0;

    @Builder.Default
    boolean jitterEnabled = true;

    public static RetryStrategy aggressive() {
        return RetryStrategy.builder()
            .name(AGGRESSIVE)
            .maxRetries(5)
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofSeconds(5))
            .backoffFactor(1.5)
            .jitterEnabled(true)
            .build();
    }

    public static RetryStrategy conservative() {
        return RetryStrategy.builder()
            .name(CONSERVATIVE)
            .maxRetries(2)
            .initialDelay(Duration.ofSeconds(5))
            .maxDelay(Duration.ofSeconds(60))
            .backoffFactor(3.0)
            .jitterEnabled(false)
            .build();
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Retry strategy name is required");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (initialDelay == null || initialDelay.isNegative() || maxDelay == null || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays must not be negative");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be at least 1.0: " + backoffFactor);
        }
    }
}
