package com.smartpay.resilience.retry;

import com.smartpay.resilience.exception.ResilienceException;

/**
 * Thrown when work is abandoned because its cancellation token fired or the
 * executing thread was interrupted.
 */
public class OperationCancelledException extends ResilienceException {

    public OperationCancelledException(String message) {
        super(message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
