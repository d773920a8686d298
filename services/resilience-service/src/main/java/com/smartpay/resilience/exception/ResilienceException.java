package com.smartpay.resilience.exception;

/**
 * Base exception for failures raised by the resilience layer itself,
 * as opposed to failures of the operations it protects.
 */
public class ResilienceException extends RuntimeException {

    public ResilienceException(String message) {
        super(message);
    }

    public ResilienceException(String message, Throwable cause) {
        super(message, cause);
    }
}
