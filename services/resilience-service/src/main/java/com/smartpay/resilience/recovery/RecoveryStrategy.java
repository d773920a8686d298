package com.smartpay.resilience.recovery;

/**
 * Operator-triggered action on a dead letter item.
 */
public enum RecoveryStrategy {
    RETRY("retry"),
    CIRCUIT_BREAK("circuit_break"),
    FALLBACK("fallback"),
    MANUAL_REVIEW("manual_review"),
    IGNORE("ignore");

    private final String value;

    RecoveryStrategy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
