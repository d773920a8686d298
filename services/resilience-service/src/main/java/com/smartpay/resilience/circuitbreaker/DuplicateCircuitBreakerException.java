package com.smartpay.resilience.circuitbreaker;

import com.smartpay.resilience.exception.ResilienceException;

public class DuplicateCircuitBreakerException extends ResilienceException {

    public DuplicateCircuitBreakerException(String name) {
        super("circuit breaker " + name + " already exists");
    }
}
