package com.smartpay.resilience.retry;

import com.smartpay.resilience.classification.ErrorClassifier;
import com.smartpay.resilience.dlq.DeadLetterItem;
import com.smartpay.resilience.dlq.DeadLetterQueue;
import com.smartpay.resilience.history.ErrorContext;
import com.smartpay.resilience.history.ErrorRecorder;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * Runs an operation under a named {@link RetryStrategy}, waiting with
 * exponential backoff between attempts.
 *
 * <p>Waits go through the caller's {@link CancellationToken}, so cancelling
 * aborts the whole operation with {@link OperationCancelledException} instead
 * of a retry-exhaustion error. When every attempt fails, the last error is
 * recorded and handed to the {@link DeadLetterQueue} together with the
 * operation itself, so the sweeper can replay it later.
 */
@Slf4j
public class RetryExecutor {

    private final RetryStrategyRegistry strategies;
    private final DeadLetterQueue deadLetterQueue;
    private final ErrorRecorder errorRecorder;
    private final MeterRegistry meterRegistry;
    private final Random random;

    public RetryExecutor(RetryStrategyRegistry strategies, DeadLetterQueue deadLetterQueue,
                         ErrorRecorder errorRecorder, MeterRegistry meterRegistry) {
        this(strategies, deadLetterQueue, errorRecorder, meterRegistry, new SecureRandom());
    }

    RetryExecutor(RetryStrategyRegistry strategies, DeadLetterQueue deadLetterQueue,
                  ErrorRecorder errorRecorder, MeterRegistry meterRegistry, Random random) {
        this.strategies = strategies;
        this.deadLetterQueue = deadLetterQueue;
        this.errorRecorder = errorRecorder;
        this.meterRegistry = meterRegistry;
        this.random = random;
    }

    public <T> T execute(String strategyName, String operationName, Callable<T> operation,
                         CancellationToken token) {
        return execute(strategyName, operationName, null, operation, token);
    }

    /**
     * @param strategyName retry strategy; null selects the default
     * @param payload data stored with the dead letter item if every attempt fails
     * @throws MaxRetriesExceededException when all {@code maxRetries + 1} attempts failed
     * @throws OperationCancelledException when the token fires or the thread is interrupted
     * @throws IllegalArgumentException for an unknown strategy name
     */
    public <T> T execute(String strategyName, String operationName, Object payload,
                         Callable<T> operation, CancellationToken token) {
        RetryStrategy strategy = strategies.get(strategyName);
        CancellationToken cancellation = token != null ? token : CancellationToken.create();
        Exception lastError = null;

        for (int attempt = 0; attempt <= strategy.getMaxRetries(); attempt++) {
            cancellation.throwIfCancelled();
            if (attempt > 0) {
                Duration delay = delayFor(strategy, attempt - 1, random);
                log.debug("Retrying operation: operation={}, strategy={}, attempt={}, delay={}",
                    operationName, strategy.getName(), attempt + 1, delay);
                cancellation.sleep(delay);
            }

            meterRegistry.counter("resilience.retry.attempts", "strategy", strategy.getName()).increment();
            try {
                T result = operation.call();
                if (attempt > 0) {
                    log.info("Operation succeeded after retry: operation={}, attempts={}", operationName, attempt + 1);
                }
                return result;
            } catch (OperationCancelledException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("Operation " + operationName + " interrupted", e);
            } catch (Exception e) {
                lastError = e;
                log.debug("Attempt failed: operation={}, attempt={}, error={}",
                    operationName, attempt + 1, ErrorClassifier.messageOf(e));
            }
        }

        return exhausted(strategy, operationName, payload, operation, lastError);
    }

    private <T> T exhausted(RetryStrategy strategy, String operationName, Object payload,
                            Callable<T> operation, Exception lastError) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("retry_strategy", strategy.getName());
        metadata.put("attempts", strategy.maxAttempts());
        ErrorContext context = errorRecorder.record(operationName, lastError, metadata, strategy.getMaxRetries());

        DeadLetterItem item = deadLetterQueue.enqueue(operationName, payload, lastError, context, operation);
        meterRegistry.counter("resilience.retry.exhausted", "strategy", strategy.getName()).increment();
        log.warn("Retries exhausted: operation={}, strategy={}, attempts={}, deadLetterId={}",
            operationName, strategy.getName(), strategy.maxAttempts(), item.getId());

        throw new MaxRetriesExceededException(operationName, strategy.maxAttempts(), item.getId(), lastError);
    }

    /**
     * Wait before retry number {@code retry + 1}: {@code initialDelay * backoffFactor^retry}
     * capped at {@code maxDelay}, then scaled into {@code [0.5, 1.0)} of that value when
     * jitter is enabled.
     */
    static Duration delayFor(RetryStrategy strategy, int retry, Random random) {
        double base = strategy.getInitialDelay().toMillis() * Math.pow(strategy.getBackoffFactor(), retry);
        long delay = (long) Math.min(base, strategy.getMaxDelay().toMillis());
        if (strategy.isJitterEnabled()) {
            delay = (long) (delay * (0.5 + random.nextDouble() * 0.5));
        }
        return Duration.ofMillis(delay);
    }
}
