package com.smartpay.resilience.circuitbreaker;

/**
 * States of a {@link CircuitBreaker}.
 */
public enum CircuitBreakerState {

    CLOSED("closed", 0),
    HALF_OPEN("half_open", 1),
    OPEN("open", 2);

    private final String value;
    private final int gaugeValue;

    CircuitBreakerState(String value, int gaugeValue) {
        this.value = value;
        this.gaugeValue = gaugeValue;
    }

    public String getValue() {
        return value;
    }

    /**
     * Numeric value exported on the state gauge
     */
    public int getGaugeValue() {
        return gaugeValue;
    }
}
