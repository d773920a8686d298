package com.smartpay.resilience.circuitbreaker;

import lombok.Value;

@Value
class StateTransition {

    CircuitBreakerState from;
    CircuitBreakerState to;
}
