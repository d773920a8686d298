package com.smartpay.resilience.dlq;

import com.smartpay.resilience.classification.ErrorClassifier;
import com.smartpay.resilience.event.ResilienceEventEmitter;
import com.smartpay.resilience.event.ResilienceEventTypes;
import com.smartpay.resilience.history.ErrorContext;
import com.smartpay.resilience.retry.CancellationToken;
import com.smartpay.resilience.retry.OperationCancelledException;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, insertion-ordered store of operations that exhausted their retries.
 *
 * <p>When full, admitting a new item evicts the oldest one whatever its status.
 * Losing the oldest failures under sustained overload is accepted in exchange
 * for bounded memory.
 *
 * <p>Reprocessing walks pending items in insertion order. Each item is marked
 * {@link DeadLetterStatus#RETRYING} under the queue lock, re-executed with the
 * lock released, and then resolved, requeued, or marked
 * {@link DeadLetterStatus#FAILED} once its attempts exceed the configured ceiling.
 * An operator decision taken while an attempt is running wins over its outcome.
 */
@Slf4j
public class DeadLetterQueue {

    private final Deque<DeadLetterItem> items = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, DeadLetterHandler> handlers = new ConcurrentHashMap<>();

    private final int maxSize;
    private final int maxReprocessAttempts;
    private final Duration reprocessBackoff;
    private final ResilienceEventEmitter events;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public DeadLetterQueue(int maxSize, int maxReprocessAttempts, Duration reprocessBackoff,
                           ResilienceEventEmitter events, MeterRegistry meterRegistry, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Dead letter queue size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.maxReprocessAttempts = maxReprocessAttempts;
        this.reprocessBackoff = reprocessBackoff;
        this.events = events;
        this.meterRegistry = meterRegistry;
        this.clock = clock;

        Gauge.builder("resilience.dead_letter.size", this, DeadLetterQueue::size)
            .description("Items currently held in the dead letter queue")
            .register(meterRegistry);
    }

    /**
     * Register the handler used to re-execute items of {@code operation}
     * that carry no replay operation of their own.
     */
    public void registerHandler(String operation, DeadLetterHandler handler) {
        handlers.put(operation, handler);
        log.info("Registered dead letter handler: operation={}", operation);
    }

    public DeadLetterItem enqueue(String operation, Object payload, Throwable error) {
        return enqueue(operation, payload, error, null, null);
    }

    public DeadLetterItem enqueue(String operation, Object payload, Throwable error,
                                  ErrorContext errorContext, Callable<?> replay) {
        Instant now = clock.instant();
        DeadLetterItem item = DeadLetterItem.builder()
            .id(UUID.randomUUID())
            .operation(operation)
            .payload(payload)
            .error(error)
            .errorMessage(ErrorClassifier.messageOf(error))
            .errorContext(errorContext)
            .createdAt(now)
            .replay(replay)
            .status(DeadLetterStatus.PENDING)
            .retryCount(0)
            .nextRetryAt(now)
            .build();

        DeadLetterItem evicted = null;
        DeadLetterItem added;
        lock.lock();
        try {
            if (items.size() >= maxSize) {
                evicted = items.pollFirst();
            }
            items.addLast(item);
            added = item.copy();
        } finally {
            lock.unlock();
        }

        if (evicted != null) {
            meterRegistry.counter("resilience.dead_letter.evicted").increment();
            log.warn("Dead letter queue full, evicted oldest item: id={}, operation={}, status={}",
                evicted.getId(), evicted.getOperation(), evicted.getStatus().getValue());
            events.emit(ResilienceEventTypes.DEAD_LETTER_EVICTED, eventData(evicted));
        }

        meterRegistry.counter("resilience.dead_letter.enqueued").increment();
        log.info("Added item to dead letter queue: id={}, operation={}, error={}",
            added.getId(), operation, added.getErrorMessage());
        events.emit(ResilienceEventTypes.DEAD_LETTER_ADDED, eventData(added));
        return added;
    }

    /**
     * Re-execute every pending item that is due.
     */
    public DeadLetterReprocessResult reprocess(CancellationToken token) {
        Instant now = clock.instant();
        List<DeadLetterItem> due = new ArrayList<>();
        int skipped = 0;

        lock.lock();
        try {
            for (DeadLetterItem item : items) {
                if (item.getStatus() != DeadLetterStatus.PENDING) {
                    continue;
                }
                if (item.getNextRetryAt() != null && item.getNextRetryAt().isAfter(now)) {
                    skipped++;
                    continue;
                }
                item.setStatus(DeadLetterStatus.RETRYING);
                due.add(item);
            }
        } finally {
            lock.unlock();
        }

        int resolved = 0;
        int requeued = 0;
        int failed = 0;
        int attempted = 0;
        boolean cancelled = false;

        Iterator<DeadLetterItem> pending = due.iterator();
        while (pending.hasNext()) {
            DeadLetterItem item = pending.next();
            if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
                cancelled = true;
                requeue(item);
                pending.forEachRemaining(this::requeue);
                break;
            }
            attempted++;
            try {
                switch (attempt(item)) {
                    case RESOLVED -> resolved++;
                    case FAILED -> failed++;
                    default -> requeued++;
                }
            } catch (OperationCancelledException e) {
                cancelled = true;
                pending.forEachRemaining(this::requeue);
                break;
            }
        }

        if (attempted > 0 || cancelled) {
            log.info("Processed dead letter queue: attempted={}, resolved={}, requeued={}, failed={}, skipped={}, cancelled={}",
                attempted, resolved, requeued, failed, skipped, cancelled);
        }
        return DeadLetterReprocessResult.builder()
            .attempted(attempted)
            .resolved(resolved)
            .requeued(requeued)
            .failed(failed)
            .skipped(skipped)
            .cancelled(cancelled)
            .build();
    }

    /**
     * Re-execute one item immediately, regardless of its due time. A
     * {@link DeadLetterStatus#FAILED} item gets one more attempt.
     *
     * @return a copy of the item after the attempt
     * @throws IllegalStateException if the item is resolved or already being reprocessed
     */
    public DeadLetterItem retryNow(UUID id) {
        DeadLetterItem item;
        lock.lock();
        try {
            item = find(id);
            if (item.getStatus() == DeadLetterStatus.RESOLVED) {
                throw new IllegalStateException("Dead letter item " + id + " is already resolved");
            }
            if (item.getStatus() == DeadLetterStatus.RETRYING) {
                throw new IllegalStateException("Dead letter item " + id + " is already being reprocessed");
            }
            item.setStatus(DeadLetterStatus.RETRYING);
            item.setManualReview(false);
        } finally {
            lock.unlock();
        }

        attempt(item);
        return snapshot(item);
    }

    public DeadLetterItem markResolved(UUID id, String note) {
        DeadLetterItem copy;
        lock.lock();
        try {
            DeadLetterItem item = find(id);
            resolve(item, note, clock.instant());
            copy = item.copy();
        } finally {
            lock.unlock();
        }
        log.info("Dead letter item resolved: id={}, note={}", id, note);
        events.emit(ResilienceEventTypes.DEAD_LETTER_RESOLVED, eventData(copy));
        return copy;
    }

    /**
     * Take an item out of automatic reprocessing until an operator acts on it.
     */
    public DeadLetterItem markForManualReview(UUID id) {
        DeadLetterItem copy;
        lock.lock();
        try {
            DeadLetterItem item = find(id);
            if (item.getStatus() == DeadLetterStatus.RESOLVED) {
                throw new IllegalStateException("Dead letter item " + id + " is already resolved");
            }
            item.setStatus(DeadLetterStatus.FAILED);
            item.setManualReview(true);
            item.setNextRetryAt(null);
            copy = item.copy();
        } finally {
            lock.unlock();
        }
        log.info("Dead letter item marked for manual review: id={}, operation={}", id, copy.getOperation());
        events.emit(ResilienceEventTypes.DEAD_LETTER_MANUAL_REVIEW, eventData(copy));
        return copy;
    }

    public DeadLetterItem get(UUID id) {
        lock.lock();
        try {
            return find(id).copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * The most recent {@code limit} items, oldest first. A non-positive limit returns everything.
     */
    public List<DeadLetterItem> list(int limit) {
        lock.lock();
        try {
            int size = items.size();
            int count = limit <= 0 || limit > size ? size : limit;
            List<DeadLetterItem> result = new ArrayList<>(count);
            int skip = size - count;
            for (DeadLetterItem item : items) {
                if (skip-- > 0) {
                    continue;
                }
                result.add(item.copy());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public Map<DeadLetterStatus, Long> countByStatus() {
        Map<DeadLetterStatus, Long> counts = new EnumMap<>(DeadLetterStatus.class);
        for (DeadLetterStatus status : DeadLetterStatus.values()) {
            counts.put(status, 0L);
        }
        lock.lock();
        try {
            for (DeadLetterItem item : items) {
                counts.merge(item.getStatus(), 1L, Long::sum);
            }
        } finally {
            lock.unlock();
        }
        return counts;
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return maxSize;
    }

    /**
     * Runs one attempt for an item already marked RETRYING and records the outcome.
     */
    private DeadLetterStatus attempt(DeadLetterItem item) {
        Instant started = clock.instant();
        lock.lock();
        try {
            item.setRetryCount(item.getRetryCount() + 1);
            item.setLastRetryAt(started);
        } finally {
            lock.unlock();
        }
        log.debug("Reprocessing dead letter item: id={}, operation={}, attempt={}",
            item.getId(), item.getOperation(), item.getRetryCount());

        Exception failure = null;
        try {
            execute(item);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requeue(item);
            throw new OperationCancelledException("Dead letter reprocessing interrupted", e);
        } catch (OperationCancelledException e) {
            requeue(item);
            throw e;
        } catch (Exception e) {
            failure = e;
        }

        Instant finished = clock.instant();
        DeadLetterItem copy;
        DeadLetterStatus outcome;
        boolean superseded;
        lock.lock();
        try {
            // An operator may have resolved the item or sent it to manual review mid-attempt
            superseded = item.getStatus() != DeadLetterStatus.RETRYING;
            if (!superseded) {
                if (failure == null) {
                    resolve(item, "reprocessed", finished);
                } else if (item.getRetryCount() > maxReprocessAttempts) {
                    item.setStatus(DeadLetterStatus.FAILED);
                    item.setNextRetryAt(null);
                } else {
                    item.setStatus(DeadLetterStatus.PENDING);
                    item.setNextRetryAt(finished.plus(reprocessBackoff));
                }
            }
            outcome = item.getStatus();
            copy = item.copy();
        } finally {
            lock.unlock();
        }

        if (superseded) {
            log.info("Dead letter item changed during reprocessing, keeping status: id={}, status={}, attemptFailed={}",
                copy.getId(), outcome.getValue(), failure != null);
            return outcome;
        }
        switch (outcome) {
            case RESOLVED -> {
                meterRegistry.counter("resilience.dead_letter.resolved").increment();
                log.info("Dead letter item reprocessed: id={}, operation={}, attempts={}",
                    copy.getId(), copy.getOperation(), copy.getRetryCount());
                events.emit(ResilienceEventTypes.DEAD_LETTER_RESOLVED, eventData(copy));
            }
            case FAILED -> {
                meterRegistry.counter("resilience.dead_letter.failed").increment();
                log.warn("Dead letter item failed permanently: id={}, operation={}, attempts={}, error={}",
                    copy.getId(), copy.getOperation(), copy.getRetryCount(), ErrorClassifier.messageOf(failure));
                events.emit(ResilienceEventTypes.DEAD_LETTER_FAILED, eventData(copy));
            }
            default -> log.info("Failed to reprocess dead letter item: id={}, attempt={}, nextRetryAt={}, error={}",
                copy.getId(), copy.getRetryCount(), copy.getNextRetryAt(), ErrorClassifier.messageOf(failure));
        }
        return outcome;
    }

    private void execute(DeadLetterItem item) throws Exception {
        Callable<?> replay = item.getReplay();
        if (replay != null) {
            replay.call();
            return;
        }
        DeadLetterHandler handler = handlers.get(item.getOperation());
        if (handler == null) {
            throw new IllegalStateException("No replay operation or handler registered for " + item.getOperation());
        }
        handler.handle(snapshot(item));
    }

    private void requeue(DeadLetterItem item) {
        lock.lock();
        try {
            if (item.getStatus() == DeadLetterStatus.RETRYING) {
                item.setStatus(DeadLetterStatus.PENDING);
            }
        } finally {
            lock.unlock();
        }
    }

    // Must hold lock
    private void resolve(DeadLetterItem item, String note, Instant at) {
        item.setStatus(DeadLetterStatus.RESOLVED);
        item.setResolutionNote(note);
        item.setResolvedAt(at);
        item.setNextRetryAt(null);
        item.setManualReview(false);
        if (item.getErrorContext() != null) {
            item.getErrorContext().markResolved(at, note);
        }
    }

    // Must hold lock
    private DeadLetterItem find(UUID id) {
        for (DeadLetterItem item : items) {
            if (item.getId().equals(id)) {
                return item;
            }
        }
        throw new DeadLetterItemNotFoundException(id);
    }

    private DeadLetterItem snapshot(DeadLetterItem item) {
        lock.lock();
        try {
            return item.copy();
        } finally {
            lock.unlock();
        }
    }

    private static Map<String, Object> eventData(DeadLetterItem item) {
        Map<String, Object> data = new HashMap<>();
        data.put("item_id", item.getId().toString());
        data.put("operation", item.getOperation());
        data.put("error", item.getErrorMessage());
        data.put("retry_count", item.getRetryCount());
        data.put("status", item.getStatus().getValue());
        return data;
    }
}
