package com.smartpay.resilience.dlq;

import com.smartpay.resilience.exception.ResilienceException;

import java.util.UUID;

public class DeadLetterItemNotFoundException extends ResilienceException {

    public DeadLetterItemNotFoundException(UUID id) {
        super("operation not found in dead letter queue: " + id);
    }
}
