package com.smartpay.resilience.circuitbreaker;

import com.smartpay.resilience.exception.ResilienceException;

public class CircuitBreakerNotFoundException extends ResilienceException {

    public CircuitBreakerNotFoundException(String name) {
        super("circuit breaker " + name + " not found");
    }
}
