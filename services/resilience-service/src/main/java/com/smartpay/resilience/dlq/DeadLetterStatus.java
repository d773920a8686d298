package com.smartpay.resilience.dlq;

public enum DeadLetterStatus {

    PENDING("pending"),
    RETRYING("retrying"),
    /**
     * Terminal for automatic processing; only an explicit recovery action touches it again
     */
    FAILED("failed"),
    RESOLVED("resolved");

    private final String value;

    DeadLetterStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
