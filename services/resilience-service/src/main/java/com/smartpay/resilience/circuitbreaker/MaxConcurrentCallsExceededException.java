package com.smartpay.resilience.circuitbreaker;

import com.smartpay.resilience.exception.CallNotPermittedException;

/**
 * Thrown when a closed breaker already has its maximum number of calls in flight.
 */
public class MaxConcurrentCallsExceededException extends CallNotPermittedException {

    private final int maxConcurrentCalls;

    public MaxConcurrentCallsExceededException(String breakerName, int maxConcurrentCalls) {
        super(breakerName, "circuit breaker " + breakerName
            + " rejected call: " + maxConcurrentCalls + " concurrent calls already in flight");
        this.maxConcurrentCalls = maxConcurrentCalls;
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }
}
