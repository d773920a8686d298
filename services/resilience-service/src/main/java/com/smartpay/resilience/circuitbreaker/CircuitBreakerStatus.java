package com.smartpay.resilience.circuitbreaker;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CircuitBreakerStatus {

    String name;
    CircuitBreakerState state;
    int failureCount;
    int successCount;
    int currentCalls;
    double errorRate;
    Instant lastFailureTime;
    Instant nextAttemptTime;
    boolean available;
}
