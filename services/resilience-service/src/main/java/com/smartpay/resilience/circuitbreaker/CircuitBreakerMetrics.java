package com.smartpay.resilience.circuitbreaker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Lifetime call statistics for one breaker. Rates are percentages of admitted calls.
 */
@Value
@Builder
public class CircuitBreakerMetrics {

    String name;
    CircuitBreakerState state;
    long totalCalls;
    long totalFailures;
    long totalSuccesses;
    long totalRejections;
    double errorRate;
    double successRate;
    Duration averageResponseTime;
    List<CallResult> recentCalls;
}
