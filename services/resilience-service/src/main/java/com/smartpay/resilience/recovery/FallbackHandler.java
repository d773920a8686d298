package com.smartpay.resilience.recovery;

import com.smartpay.resilience.dlq.DeadLetterItem;

/**
 * Alternative path for an operation whose primary execution keeps failing.
 */
@FunctionalInterface
public interface FallbackHandler {

    void handle(DeadLetterItem item) throws Exception;
}
