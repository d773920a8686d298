package com.smartpay.resilience.retry;

import com.smartpay.resilience.exception.ResilienceException;

import java.util.UUID;

/**
 * Thrown when every attempt allowed by a retry strategy has failed. The cause
 * is the error of the last attempt; the failure has been handed to the dead
 * letter queue under {@link #getDeadLetterId()}.
 */
public class MaxRetriesExceededException extends ResilienceException {

    private final String operation;
    private final int attempts;
    private final UUID deadLetterId;

    public MaxRetriesExceededException(String operation, int attempts, UUID deadLetterId, Throwable cause) {
        super("Max retries exceeded for " + operation + " after " + attempts + " attempts", cause);
        this.operation = operation;
        this.attempts = attempts;
        this.deadLetterId = deadLetterId;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }

    public UUID getDeadLetterId() {
        return deadLetterId;
    }
}
