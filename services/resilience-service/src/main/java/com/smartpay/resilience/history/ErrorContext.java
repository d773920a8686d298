package com.smartpay.resilience.history;

import com.smartpay.resilience.classification.ErrorCode;
import com.smartpay.resilience.classification.ErrorSeverity;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Classified record of one handled failure.
 *
 * <p>Everything except the resolution fields is fixed at construction. An
 * error context can be resolved once; later calls to
 * {@link #markResolved(Instant, String)} are ignored.
 */
@Getter
@Builder
@ToString(exclude = "stackTrace")
public class ErrorContext {

    private final UUID id;
    private final String operation;
    private final String serviceName;
    private final String message;
    private final ErrorCode code;
    private final ErrorSeverity severity;
    private final Instant timestamp;

    @Builder.Default
    private final Map<String, Object> metadata = Map.of();

    private final String stackTrace;
    private final UUID userId;
    private final UUID requestId;
    private final int retryCount;

    private volatile boolean resolved;
    private volatile Instant resolvedAt;
    private volatile String resolutionNote;

    /**
     * @return true if this call resolved the context, false if it was already resolved
     */
    public synchronized boolean markResolved(Instant at, String note) {
        if (resolved) {
            return false;
        }
        this.resolvedAt = at;
        this.resolutionNote = note;
        this.resolved = true;
        return true;
    }
}
