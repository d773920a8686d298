package com.smartpay.resilience.circuitbreaker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one guarded call
 */
@Value
@Builder
public class CallResult {

    Instant timestamp;
    boolean success;
    Duration duration;
    String error;
}
