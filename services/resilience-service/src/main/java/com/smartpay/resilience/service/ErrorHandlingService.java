package com.smartpay.resilience.service;

import com.smartpay.resilience.circuitbreaker.CircuitBreakerRegistry;
import com.smartpay.resilience.dlq.DeadLetterItem;
import com.smartpay.resilience.dlq.DeadLetterQueue;
import com.smartpay.resilience.dlq.DeadLetterReprocessResult;
import com.smartpay.resilience.dlq.DeadLetterStatus;
import com.smartpay.resilience.history.ErrorContext;
import com.smartpay.resilience.history.ErrorHistory;
import com.smartpay.resilience.history.ErrorMetrics;
import com.smartpay.resilience.history.ErrorRecorder;
import com.smartpay.resilience.history.ErrorTrend;
import com.smartpay.resilience.recovery.RecoveryService;
import com.smartpay.resilience.recovery.RecoveryStrategy;
import com.smartpay.resilience.retry.CancellationToken;
import com.smartpay.resilience.retry.RetryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Entry point for callers that handle, retry and recover failed operations.
 * Guarded calls go straight to the {@link CircuitBreakerRegistry}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ErrorHandlingService {

    private final ErrorRecorder errorRecorder;
    private final ErrorHistory errorHistory;
    private final RetryExecutor retryExecutor;
    private final DeadLetterQueue deadLetterQueue;
    private final RecoveryService recoveryService;
    private final CircuitBreakerRegistry circuitBreakers;
    private final Clock clock;

    /**
     * Classify and record a failure, then count it against the circuit breaker
     * of the operation's service, which is created with default settings on
     * first use.
     */
    public ErrorContext handleError(String operation, Throwable error, Map<String, Object> metadata) {
        ErrorContext context = errorRecorder.record(operation, error, metadata);
        if (error != null) {
            circuitBreakers.recordFailure(context.getServiceName(), error);
        }
        return context;
    }

    public <T> T retryWithStrategy(String strategyName, String operation, Callable<T> callable,
                                   CancellationToken token) {
        return retryExecutor.execute(strategyName, operation, callable, token);
    }

    public <T> T retryWithStrategy(String strategyName, String operation, Object payload,
                                   Callable<T> callable, CancellationToken token) {
        return retryExecutor.execute(strategyName, operation, payload, callable, token);
    }

    /**
     * Retry under the default strategy.
     */
    public <T> T retryOperation(String operation, Callable<T> callable, CancellationToken token) {
        return retryExecutor.execute(null, operation, callable, token);
    }

    public DeadLetterItem enqueueDeadLetter(String operation, Object payload, Throwable error) {
        return deadLetterQueue.enqueue(operation, payload, error);
    }

    public DeadLetterReprocessResult reprocessDeadLetterQueue(CancellationToken token) {
        return deadLetterQueue.reprocess(token != null ? token : CancellationToken.create());
    }

    public List<DeadLetterItem> listDeadLetterItems(int limit) {
        return deadLetterQueue.list(limit);
    }

    public DeadLetterItem getDeadLetterItem(UUID id) {
        return deadLetterQueue.get(id);
    }

    public Map<DeadLetterStatus, Long> countDeadLettersByStatus() {
        return deadLetterQueue.countByStatus();
    }

    public DeadLetterItem executeRecoveryStrategy(RecoveryStrategy strategy, UUID deadLetterItemId) {
        return recoveryService.execute(strategy, deadLetterItemId);
    }

    public ErrorMetrics getErrorMetrics(Duration window) {
        return errorHistory.metrics(window);
    }

    public List<ErrorTrend> getErrorTrends(Instant start, Instant end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Trend range end " + end + " is before start " + start);
        }
        return errorHistory.trends(start, end);
    }

    /**
     * Mark a recorded error resolved.
     *
     * @return false if no such error is retained or it was already resolved
     */
    public boolean resolveError(UUID errorId, String note) {
        boolean resolved = errorHistory.find(errorId)
            .map(context -> context.markResolved(clock.instant(), note))
            .orElse(false);
        if (resolved) {
            log.info("Error resolved: id={}, note={}", errorId, note);
        }
        return resolved;
    }
}
