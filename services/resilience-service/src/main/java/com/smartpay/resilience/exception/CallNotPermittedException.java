package com.smartpay.resilience.exception;

/**
 * Thrown when a guarded call is refused before the operation is invoked.
 */
public class CallNotPermittedException extends ResilienceException {

    private final String breakerName;

    public CallNotPermittedException(String breakerName, String message) {
        super(message);
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
