package com.smartpay.resilience.dlq;

import com.smartpay.resilience.history.ErrorContext;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * An operation that failed after exhausting its retries.
 *
 * <p>Instances held by the {@link DeadLetterQueue} are mutated only under the
 * queue lock. Callers outside the queue always receive detached copies.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@Builder(toBuilder = true)
@ToString(exclude = {"payload", "error", "replay"})
public class DeadLetterItem {

    private final UUID id;
    private final String operation;
    private final Object payload;
    private final Throwable error;
    private final String errorMessage;
    private final ErrorContext errorContext;
    private final Instant createdAt;

    @Getter(AccessLevel.PACKAGE)
    private final Callable<?> replay;

    private DeadLetterStatus status;
    private int retryCount;
    private Instant lastRetryAt;
    private Instant nextRetryAt;
    private boolean manualReview;
    private String resolutionNote;
    private Instant resolvedAt;

    public boolean isTerminal() {
        return status == DeadLetterStatus.FAILED || status == DeadLetterStatus.RESOLVED;
    }

    DeadLetterItem copy() {
        return toBuilder().build();
    }
}
