package com.smartpay.resilience.dlq;

/**
 * Re-executes dead-lettered work for one operation name from its payload.
 * Used when an item carries no replay operation of its own.
 */
@FunctionalInterface
public interface DeadLetterHandler {

    void handle(DeadLetterItem item) throws Exception;
}
