package com.smartpay.resilience.dlq;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one reprocessing pass over the dead letter queue
 */
@Value
@Builder
public class DeadLetterReprocessResult {

    int attempted;
    int resolved;
    int requeued;
    int failed;
    int skipped;
    boolean cancelled;
}
