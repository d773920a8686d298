package com.smartpay.resilience.circuitbreaker;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Partial configuration change. Null fields are left untouched.
 */
@Data
@Builder
public class CircuitBreakerUpdate {

    private Integer failureThreshold;
    private Integer successThreshold;
    private Duration timeout;
    private Integer maxConcurrentCalls;
    private Integer volumeThreshold;
    private Double errorRateThreshold;
}
