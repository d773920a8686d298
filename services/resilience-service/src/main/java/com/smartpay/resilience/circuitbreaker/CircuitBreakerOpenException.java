package com.smartpay.resilience.circuitbreaker;

import com.smartpay.resilience.exception.CallNotPermittedException;

/**
 * Thrown when a breaker is open, or half-open with its probe already in flight.
 * The guarded operation was not invoked.
 */
public class CircuitBreakerOpenException extends CallNotPermittedException {

    private final CircuitBreakerState state;

    public CircuitBreakerOpenException(String breakerName, CircuitBreakerState state) {
        super(breakerName, state == CircuitBreakerState.HALF_OPEN
            ? "circuit breaker " + breakerName + " is half-open and a probe call is in flight"
            : "circuit breaker " + breakerName + " is open");
        this.state = state;
    }

    public CircuitBreakerState getState() {
        return state;
    }
}
