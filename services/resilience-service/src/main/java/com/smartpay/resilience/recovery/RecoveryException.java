package com.smartpay.resilience.recovery;

import com.smartpay.resilience.exception.ResilienceException;

public class RecoveryException extends ResilienceException {

    public RecoveryException(String message) {
        super(message);
    }

    public RecoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
