package com.smartpay.resilience.classification;

/**
 * Severity of a classified failure. Always derived from an {@link ErrorCode}.
 */
public enum ErrorSeverity {

    LOW(1, "low"),
    MEDIUM(2, "medium"),
    HIGH(3, "high"),
    CRITICAL(4, "critical");

    private final int level;
    private final String value;

    ErrorSeverity(int level, String value) {
        this.level = level;
        this.value = value;
    }

    /**
     * Get numeric severity level for comparison
     */
    public int getLevel() {
        return level;
    }

    public String getValue() {
        return value;
    }

    /**
     * Check if this severity is higher than another
     */
    public boolean isHigherThan(ErrorSeverity other) {
        return this.level > other.level;
    }
}
