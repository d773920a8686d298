package com.smartpay.resilience.recovery;

import com.smartpay.resilience.circuitbreaker.CircuitBreakerNotFoundException;
import com.smartpay.resilience.circuitbreaker.CircuitBreakerRegistry;
import com.smartpay.resilience.dlq.DeadLetterItem;
import com.smartpay.resilience.dlq.DeadLetterQueue;
import com.smartpay.resilience.history.ErrorRecorder;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Applies an operator-chosen {@link RecoveryStrategy} to a dead letter item.
 */
@Slf4j
public class RecoveryService {

    private final DeadLetterQueue deadLetterQueue;
    private final CircuitBreakerRegistry circuitBreakers;
    private final Map<String, FallbackHandler> fallbacks = new ConcurrentHashMap<>();

    public RecoveryService(DeadLetterQueue deadLetterQueue, CircuitBreakerRegistry circuitBreakers) {
        this.deadLetterQueue = deadLetterQueue;
        this.circuitBreakers = circuitBreakers;
    }

    public void registerFallback(String operation, FallbackHandler handler) {
        fallbacks.put(operation, handler);
        log.info("Registered fallback handler: operation={}", operation);
    }

    /**
     * @return the dead letter item after the strategy was applied
     * @throws com.smartpay.resilience.dlq.DeadLetterItemNotFoundException if no item has that id
     */
    public DeadLetterItem execute(RecoveryStrategy strategy, UUID itemId) {
        log.info("Executing recovery strategy: strategy={}, itemId={}", strategy.getValue(), itemId);
        return switch (strategy) {
            case RETRY -> deadLetterQueue.retryNow(itemId);
            case CIRCUIT_BREAK -> tripBreaker(itemId);
            case FALLBACK -> runFallback(itemId);
            case MANUAL_REVIEW -> deadLetterQueue.markForManualReview(itemId);
            case IGNORE -> deadLetterQueue.markResolved(itemId, "ignored");
        };
    }

    private DeadLetterItem tripBreaker(UUID itemId) {
        DeadLetterItem item = deadLetterQueue.get(itemId);
        String operation = item.getOperation();
        String breaker = operation;
        if (!circuitBreakers.contains(breaker)) {
            breaker = ErrorRecorder.serviceNameOf(operation);
            if (!circuitBreakers.contains(breaker)) {
                throw new CircuitBreakerNotFoundException(operation);
            }
        }
        circuitBreakers.trip(breaker, "Recovery for dead letter item " + itemId + ": " + item.getErrorMessage());
        return item;
    }

    private DeadLetterItem runFallback(UUID itemId) {
        DeadLetterItem item = deadLetterQueue.get(itemId);
        FallbackHandler handler = fallbacks.get(item.getOperation());
        if (handler == null) {
            throw new RecoveryException("No fallback registered for operation " + item.getOperation());
        }
        try {
            handler.handle(item);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecoveryException("Fallback interrupted for dead letter item " + itemId, e);
        } catch (Exception e) {
            throw new RecoveryException("Fallback failed for dead letter item " + itemId, e);
        }
        return deadLetterQueue.markResolved(itemId, "fallback");
    }
}
